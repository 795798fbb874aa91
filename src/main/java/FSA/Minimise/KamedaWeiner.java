package FSA.Minimise;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import FSA.BitSetUtils;
import FSA.Equivalence;
import FSA.NFATrim;
import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import FSA.Model.Cancellation;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Kameda–Weiner NFA reduction: prime grids of the state-map matrix, smallest covers by grids,
 * and one synthesized NFA per cover.
 * <p>
 * The search stops at the first cover size admitting any cover, so results are small but not
 * guaranteed minimal. A synthesized automaton is only kept if it is language-equivalent to the
 * input and strictly smaller than the best one so far.
 */
public class KamedaWeiner {
    static final String GRID_PREFIX = "g";
    static final String INITIAL_GRID = "g_init";

    private final MinimisationConfig config;
    private final Cancellation cancellation;

    public KamedaWeiner(MinimisationConfig config, Cancellation cancellation) {
        this.config = config;
        this.cancellation = cancellation;
    }

    public static Automaton minimise(Automaton nfa) {
        return new KamedaWeiner(MinimisationConfig.defaults(), Cancellation.none()).run(nfa);
    }

    /**
     * @param nfa - automaton to reduce; need not be trimmed
     * @return the smallest verified synthesized automaton, or the trimmed input if none is smaller
     */
    public Automaton run(Automaton nfa) {
        Automaton best = NFATrim.trim(nfa);
        if (best.isEmpty() || best.size() == 1) {
            return best;
        }
        final StateMapMatrix matrix = StateMapMatrix.of(best);
        final List<Grid> grids = primeGrids(matrix);
        if (NFAMinimiser.DEBUG) {
            System.out.println("DEBUG: Kameda-Weiner matrix " + matrix.rowCount() + "x" + matrix.columnCount()
                    + ", " + grids.size() + " prime grids");
        }
        for (List<Grid> cover : covers(matrix, grids)) {
            if (cancellation.isCancelled()) {
                break;
            }
            if (cover.size() >= best.size()) {
                continue;
            }
            final Automaton candidate = synthesize(matrix, cover);
            if (candidate.size() < best.size() && Equivalence.areEquivalent(candidate, best)) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Prime grids seeded from every true cell, extended rows-first and columns-first.
     * Duplicates and grids contained in another grid are dropped.
     */
    static List<Grid> primeGrids(StateMapMatrix matrix) {
        final Set<Grid> found = new LinkedHashSet<>();
        for (int cell : matrix.cells()) {
            final int row = matrix.cellRow(cell);
            final int column = matrix.cellColumn(cell);
            // rows-first: every row holding the column, then their shared columns
            found.add(extendColumns(matrix, extendRows(matrix, BitSetUtils.singleton(column)).rows()));
            // columns-first: the whole row, then every row holding all of it
            found.add(extendRows(matrix, matrix.row(row)));
        }
        final List<Grid> primes = new ArrayList<>();
        for (Grid g : found) {
            boolean maximal = true;
            for (Grid other : found) {
                if (other != g && !other.equals(g) && g.isContainedIn(other)) {
                    maximal = false;
                    break;
                }
            }
            if (maximal) {
                primes.add(g);
            }
        }
        return primes;
    }

    // all rows whose column set includes the given columns
    private static Grid extendRows(StateMapMatrix matrix, BitSet columns) {
        final BitSet rows = new BitSet(matrix.rowCount());
        for (int r = 0; r < matrix.rowCount(); r++) {
            if (BitSetUtils.isSubset(columns, matrix.row(r))) {
                rows.set(r);
            }
        }
        return new Grid(rows, (BitSet) columns.clone());
    }

    // all columns shared by the given rows
    private static Grid extendColumns(StateMapMatrix matrix, BitSet rows) {
        final BitSet columns = new BitSet(matrix.columnCount());
        columns.set(0, matrix.columnCount());
        for (int r = rows.nextSetBit(0); r >= 0; r = rows.nextSetBit(r + 1)) {
            columns.and(matrix.row(r));
        }
        return new Grid((BitSet) rows.clone(), columns);
    }

    /**
     * Covers of the smallest size that has any, at most {@code maxCovers} of them.
     * Returns no cover when the search is cancelled, exhausts its budget or exceeds
     * {@code maxCoverSize}.
     */
    List<List<Grid>> covers(StateMapMatrix matrix, List<Grid> grids) {
        final IntList cells = matrix.cells();
        final List<BitSet> covered = new ArrayList<>(grids.size());
        for (Grid g : grids) {
            final BitSet bits = new BitSet(cells.size());
            for (int k = 0; k < cells.size(); k++) {
                if (g.contains(matrix.cellRow(cells.getInt(k)), matrix.cellColumn(cells.getInt(k)))) {
                    bits.set(k);
                }
            }
            covered.add(bits);
        }
        final BitSet all = new BitSet(cells.size());
        all.set(0, cells.size());

        for (int size = 1; size <= config.maxCoverSize(); size++) {
            if (cancellation.isCancelled()) {
                return List.of();
            }
            final CoverSearch search = new CoverSearch(covered, size);
            search.run(all, new IntArrayList());
            if (!search.results.isEmpty()) {
                if (NFAMinimiser.DEBUG) {
                    System.out.println("DEBUG: " + search.results.size() + " covers of size " + size);
                }
                final List<List<Grid>> result = new ArrayList<>();
                for (IntList indices : search.results) {
                    final List<Grid> cover = new ArrayList<>(indices.size());
                    for (int i = 0; i < indices.size(); i++) {
                        cover.add(grids.get(indices.getInt(i)));
                    }
                    result.add(cover);
                }
                return result;
            }
            if (search.exhausted) {
                return List.of();
            }
        }
        return List.of();
    }

    private final class CoverSearch {
        private final List<BitSet> covered;
        private final int size;
        private final List<IntList> results = new ArrayList<>();
        private final Set<BitSet> seen = new HashSet<>();
        private int steps;
        private boolean exhausted;

        CoverSearch(List<BitSet> covered, int size) {
            this.covered = covered;
            this.size = size;
        }

        // each step picks a grid covering the lowest uncovered cell; the same set can be reached
        // in several orders, so finished covers are deduplicated
        void run(BitSet uncovered, IntList selected) {
            if (results.size() >= config.maxCovers() || exhausted) {
                return;
            }
            if (++steps > config.coverSearchBudget()) {
                exhausted = true;
                return;
            }
            final int cell = uncovered.nextSetBit(0);
            if (cell < 0) {
                final BitSet chosen = new BitSet(covered.size());
                for (int i = 0; i < selected.size(); i++) {
                    chosen.set(selected.getInt(i));
                }
                if (seen.add(chosen)) {
                    results.add(new IntArrayList(chosen.stream().toArray()));
                }
                return;
            }
            if (selected.size() == size) {
                return;
            }
            for (int g = 0; g < covered.size(); g++) {
                if (!covered.get(g).get(cell)) {
                    continue;
                }
                selected.add(g);
                run(BitSetUtils.minus(uncovered, covered.get(g)), selected);
                selected.removeInt(selected.size() - 1);
            }
        }
    }

    /**
     * One state per grid ({@code g0}, {@code g1}, ...). A grid is initial iff it contains row 0 and
     * accepting iff it contains column 0. On symbol s a grid moves to the grids that contain the
     * s-successor row of every one of its rows, provided all its rows have that successor. Several
     * initial grids are merged behind a fresh {@code g_init}.
     */
    static Automaton synthesize(StateMapMatrix matrix, List<Grid> cover) {
        final Automaton d = matrix.getDeterminized();
        final AutomatonBuilder builder = Automaton.builder();
        d.getAlphabet().forEach(builder::addSymbol);
        final List<String> initial = new ArrayList<>();
        for (int g = 0; g < cover.size(); g++) {
            final Grid grid = cover.get(g);
            builder.addState(GRID_PREFIX + g, grid.columns().get(0));
            if (grid.rows().get(0)) {
                initial.add(GRID_PREFIX + g);
            }
        }
        if (initial.isEmpty()) {
            return Automaton.empty();
        }

        for (int g = 0; g < cover.size(); g++) {
            final BitSet rows = cover.get(g).rows();
            for (String sym : d.getAlphabet()) {
                final BitSet targets = new BitSet(cover.size());
                targets.set(0, cover.size());
                boolean defined = true;
                for (int r = rows.nextSetBit(0); r >= 0 && defined; r = rows.nextSetBit(r + 1)) {
                    final String succ = d.getSuccessor(matrix.rowName(r), sym);
                    if (succ == null) {
                        defined = false;
                        break;
                    }
                    final int succRow = matrix.rowOf(succ);
                    for (int h = 0; h < cover.size(); h++) {
                        if (!cover.get(h).rows().get(succRow)) {
                            targets.clear(h);
                        }
                    }
                }
                if (!defined) {
                    continue;
                }
                for (int h = targets.nextSetBit(0); h >= 0; h = targets.nextSetBit(h + 1)) {
                    builder.addTransition(GRID_PREFIX + g, sym, GRID_PREFIX + h);
                }
            }
        }

        if (initial.size() == 1) {
            return NFATrim.trim(builder.setStartingState(initial.get(0)).build());
        }
        final Automaton grids = builder.setStartingState(initial.get(0)).build();
        final String start = builder.freshStateName(INITIAL_GRID);
        builder.addState(start);
        for (String init : initial) {
            if (grids.isAccepting(init)) {
                builder.addAcceptingState(start);
            }
            grids.getTransitions(init).forEach((sym, targets) -> targets.forEach(t -> builder.addTransition(start, sym, t)));
        }
        return NFATrim.trim(builder.setStartingState(start).build());
    }
}
