package FSA;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import FSA.Model.Cancellation;
import FSA.Model.FSAProperties;
import FSA.Model.NondeterministicAutomatonException;

/**
 * Subset construction over named automata, plus completion and complementation of DFAs.
 */
public class PowersetDeterminizer {
    public static final String DEAD_STATE = "DEAD";

    static final int MAX_NAMED_MEMBERS = 10;

    private final Cancellation cancellation;

    public PowersetDeterminizer(Cancellation cancellation) {
        this.cancellation = cancellation;
    }

    /**
     * Determinizes with lazy completion: a shared dead state {@code ∅} is added only if some
     * reachable subset lacks a transition.
     */
    public static Automaton determinize(Automaton a) {
        final Automaton dfa = determinizeWithSubsets(a).dfa();
        if (dfa.isEmpty() || FSAProperties.isComplete(dfa)) {
            return dfa;
        }
        return addDeadState(dfa, Automaton.EMPTY_LANGUAGE);
    }

    /**
     * Partial subset construction. Subsets with no members are never created, so the result may
     * lack transitions.
     */
    public static Subsets determinizeWithSubsets(Automaton a) {
        return new PowersetDeterminizer(Cancellation.none()).run(a);
    }

    /**
     * Like {@link #determinizeWithSubsets(Automaton)} but checked against this determinizer's
     * cancellation token after every explored subset.
     *
     * @throws CancellationException when the token is interrupted or the state threshold is crossed
     */
    public Subsets run(Automaton a) {
        if (a.isEmpty()) {
            return new Subsets(a, Map.of());
        }
        final Map<Set<String>, Set<String>> closures = new HashMap<>();
        final Map<Set<String>, String> outStateMap = new HashMap<>();
        final Map<String, Set<String>> subsets = new LinkedHashMap<>();
        final Deque<DeterminizeRecord> queue = new ArrayDeque<>();
        final AutomatonBuilder out = Automaton.builder();
        a.getAlphabet().forEach(out::addSymbol);

        final Set<String> init = closure(a, Set.of(a.getStartingState()), closures);
        final String initOut = addSubsetState(a, init, out, outStateMap, subsets);
        out.setStartingState(initOut);
        queue.add(new DeterminizeRecord(init, initOut));

        while (!queue.isEmpty()) {
            if (cancellation.isInterrupted() || cancellation.isAboveThreshold(subsets.size())) {
                throw new CancellationException(cancellation.cancelLabel());
            }
            final DeterminizeRecord curr = queue.poll();
            for (String sym : a.getAlphabet()) {
                final Set<String> move = new TreeSet<>();
                for (String s : curr.inputState()) {
                    move.addAll(a.getTransitions(s, sym));
                }
                if (move.isEmpty()) {
                    continue;
                }
                final Set<String> succ = closure(a, move, closures);
                String outSucc = outStateMap.get(succ);
                if (outSucc == null) {
                    // add new state to DFA and to queue
                    outSucc = addSubsetState(a, succ, out, outStateMap, subsets);
                    queue.add(new DeterminizeRecord(succ, outSucc));
                }
                out.addTransition(curr.outputState(), sym, outSucc);
            }
        }
        return new Subsets(out.build(), subsets);
    }

    private static Set<String> closure(Automaton a, Set<String> from, Map<Set<String>, Set<String>> memo) {
        return memo.computeIfAbsent(from, k -> new TreeSet<>(NFATrim.epsilonClosure(a, k)));
    }

    private static String addSubsetState(Automaton a,
                                         Set<String> subset,
                                         AutomatonBuilder out,
                                         Map<Set<String>, String> outStateMap,
                                         Map<String, Set<String>> subsets) {
        final String name = out.freshStateName(subsetName(subset));
        out.addState(name, subset.stream().anyMatch(a::isAccepting));
        outStateMap.put(subset, name);
        subsets.put(name, subset);
        return name;
    }

    /**
     * {@code {S0,S1}} from the sorted members; more than {@value #MAX_NAMED_MEMBERS} members are
     * shortened to a prefix, the number of omitted members and a hash of the full list.
     */
    static String subsetName(Collection<String> members) {
        final List<String> sorted = List.copyOf(new TreeSet<>(members));
        if (sorted.size() <= MAX_NAMED_MEMBERS) {
            return "{" + String.join(",", sorted) + "}";
        }
        final String hash = Integer.toHexString(String.join(",", sorted).hashCode());
        return "{" + String.join(",", sorted.subList(0, MAX_NAMED_MEMBERS))
                + ",…+" + (sorted.size() - MAX_NAMED_MEMBERS) + "#" + hash + "}";
    }

    /**
     * Adds a dead state ({@value #DEAD_STATE}, suffixed if taken) absorbing all undefined
     * transitions. Complete DFAs are returned unchanged; the empty automaton becomes a single
     * non-accepting dead start state.
     */
    public static Automaton complete(Automaton dfa) {
        if (!FSAProperties.isDeterministic(dfa)) {
            throw new NondeterministicAutomatonException("Completion");
        }
        if (dfa.isEmpty()) {
            final AutomatonBuilder builder = Automaton.builder().addState(DEAD_STATE).setStartingState(DEAD_STATE);
            for (String sym : dfa.getAlphabet()) {
                builder.addTransition(DEAD_STATE, sym, DEAD_STATE);
            }
            return builder.build();
        }
        if (FSAProperties.isComplete(dfa)) {
            return dfa;
        }
        return addDeadState(dfa, DEAD_STATE);
    }

    private static Automaton addDeadState(Automaton dfa, String preferredName) {
        final AutomatonBuilder builder = dfa.toBuilder();
        final String dead = builder.freshStateName(preferredName);
        builder.addState(dead);
        for (String s : dfa.getStates()) {
            for (String sym : dfa.getAlphabet()) {
                if (dfa.getTransitions(s, sym).isEmpty()) {
                    builder.addTransition(s, sym, dead);
                }
            }
        }
        for (String sym : dfa.getAlphabet()) {
            builder.addTransition(dead, sym, dead);
        }
        return builder.build();
    }

    /**
     * Completes the DFA, then swaps accepting and non-accepting states.
     */
    public static Automaton complement(Automaton dfa) {
        if (!FSAProperties.isDeterministic(dfa)) {
            throw new NondeterministicAutomatonException("Complementation");
        }
        final Automaton complete = complete(dfa);
        final Set<String> accepting = new LinkedHashSet<>(complete.getStates());
        accepting.removeAll(complete.getAcceptingStates());
        return new Automaton(complete.getStates(), complete.getAlphabet(), complete.getTransitions(),
                complete.getStartingState(), accepting);
    }

    /**
     * A subset-construction result: the DFA and, for each of its states, the original states it stands for.
     */
    public record Subsets(Automaton dfa, Map<String, Set<String>> subsets) { }

    private record DeterminizeRecord(Set<String> inputState, String outputState) { }
}
