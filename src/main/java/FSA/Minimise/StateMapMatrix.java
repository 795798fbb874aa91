package FSA.Minimise;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import FSA.NFATrim;
import FSA.PowersetDeterminizer;
import FSA.PowersetDeterminizer.Subsets;
import FSA.Model.Automaton;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Kameda–Weiner state-map matrix. Rows are the states of the determinized automaton D, columns the
 * states of the determinized dual; cell (i, j) holds iff the two underlying state sets intersect.
 * Row 0 and column 0 are the respective start states.
 */
public final class StateMapMatrix {
    static final String DUAL_START = "dual_start";

    private final Automaton determinized;
    private final List<String> rowNames;
    private final Object2IntMap<String> rowIndex;
    private final int columns;
    private final BitSet[] rows;
    private final IntList cells;

    private StateMapMatrix(Automaton determinized, List<String> rowNames, int columns, BitSet[] rows) {
        this.determinized = determinized;
        this.rowNames = rowNames;
        this.columns = columns;
        this.rows = rows;
        this.rowIndex = new Object2IntOpenHashMap<>(rowNames.size());
        this.rowIndex.defaultReturnValue(-1);
        for (int i = 0; i < rowNames.size(); i++) {
            rowIndex.put(rowNames.get(i), i);
        }
        this.cells = new IntArrayList();
        for (int i = 0; i < rows.length; i++) {
            for (int j = rows[i].nextSetBit(0); j >= 0; j = rows[i].nextSetBit(j + 1)) {
                cells.add(i * columns + j);
            }
        }
    }

    /**
     * @param nfa - non-empty automaton; epsilon transitions are allowed
     */
    public static StateMapMatrix of(Automaton nfa) {
        final Subsets d = PowersetDeterminizer.determinizeWithSubsets(nfa);
        final Subsets dual = PowersetDeterminizer.determinizeWithSubsets(NFATrim.reverse(nfa, DUAL_START));

        final List<String> rowNames = new ArrayList<>(d.subsets().keySet());
        final List<Set<String>> columnSets = new ArrayList<>(dual.subsets().values());
        final BitSet[] rows = new BitSet[rowNames.size()];
        for (int i = 0; i < rows.length; i++) {
            final Set<String> rowSet = d.subsets().get(rowNames.get(i));
            rows[i] = new BitSet(columnSets.size());
            for (int j = 0; j < columnSets.size(); j++) {
                if (!Collections.disjoint(rowSet, columnSets.get(j))) {
                    rows[i].set(j);
                }
            }
        }
        return new StateMapMatrix(d.dfa(), rowNames, columnSets.size(), rows);
    }

    public Automaton getDeterminized() {
        return determinized;
    }

    public int rowCount() {
        return rows.length;
    }

    public int columnCount() {
        return columns;
    }

    public boolean get(int row, int column) {
        return rows[row].get(column);
    }

    /**
     * Columns set in the given row. The returned set must not be modified.
     */
    BitSet row(int row) {
        return rows[row];
    }

    public String rowName(int row) {
        return rowNames.get(row);
    }

    /**
     * @return row of the given determinized state, or -1
     */
    public int rowOf(String state) {
        return rowIndex.getInt(state);
    }

    /**
     * True cells in row-major order, each encoded as {@code row * columnCount() + column}.
     */
    public IntList cells() {
        return cells;
    }

    public int cellRow(int cell) {
        return cell / columns;
    }

    public int cellColumn(int cell) {
        return cell % columns;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rows.length; i++) {
            for (int j = 0; j < columns; j++) {
                sb.append(rows[i].get(j) ? '1' : '0');
            }
            sb.append(' ').append(rowNames.get(i)).append('\n');
        }
        return sb.toString();
    }
}
