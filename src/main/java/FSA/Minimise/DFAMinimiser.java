package FSA.Minimise;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import FSA.Model.FSAProperties;
import FSA.Model.NondeterministicAutomatonException;

/**
 * Partition-refinement minimisation of DFAs driven by reverse-transition splitters.
 * <p>
 * Partial DFAs are accepted. A missing transition is kept apart from an explicit transition into a
 * dead state, so for partial input the result is minimal only once dead states are trimmed.
 */
public class DFAMinimiser {

    public static Automaton minimise(Automaton dfa) {
        if (!FSAProperties.isDeterministic(dfa)) {
            throw new NondeterministicAutomatonException("DFA minimisation");
        }
        if (dfa.isEmpty()) {
            return dfa;
        }

        final List<Set<String>> partition = initialPartition(dfa);
        if (!dfa.getAlphabet().isEmpty()) {
            refine(dfa, partition);
        }
        return collapse(dfa, partition);
    }

    private static List<Set<String>> initialPartition(Automaton dfa) {
        final Set<String> accepting = new LinkedHashSet<>();
        final Set<String> rejecting = new LinkedHashSet<>();
        for (String s : dfa.getStates()) {
            (dfa.isAccepting(s) ? accepting : rejecting).add(s);
        }
        final List<Set<String>> partition = new ArrayList<>(2);
        if (!accepting.isEmpty()) {
            partition.add(accepting);
        }
        if (!rejecting.isEmpty()) {
            partition.add(rejecting);
        }
        return partition;
    }

    private static void refine(Automaton dfa, List<Set<String>> partition) {
        // symbol -> target -> sources
        final Map<String, Map<String, Set<String>>> reverse = new HashMap<>();
        for (String s : dfa.getStates()) {
            dfa.getTransitions(s).forEach((sym, targets) -> {
                for (String t : targets) {
                    reverse.computeIfAbsent(sym, k -> new HashMap<>())
                            .computeIfAbsent(t, k -> new LinkedHashSet<>())
                            .add(s);
                }
            });
        }

        // states with no transition on a symbol share an implicit sink, which behaves like a
        // non-accepting block of its own; queueing the whole state set as a splitter separates
        // states that have the transition from states that lack it
        final Deque<Set<String>> worklist = new ArrayDeque<>(partition);
        worklist.add(new LinkedHashSet<>(dfa.getStates()));

        while (!worklist.isEmpty()) {
            final Set<String> splitter = worklist.poll();
            for (String sym : dfa.getAlphabet()) {
                final Map<String, Set<String>> sources = reverse.getOrDefault(sym, Map.of());
                final Set<String> involved = new LinkedHashSet<>();
                for (String t : splitter) {
                    involved.addAll(sources.getOrDefault(t, Set.of()));
                }
                if (involved.isEmpty()) {
                    continue;
                }
                split(partition, worklist, involved);
            }
        }
    }

    private static void split(List<Set<String>> partition, Deque<Set<String>> worklist, Set<String> involved) {
        for (int i = 0; i < partition.size(); i++) {
            final Set<String> block = partition.get(i);
            final Set<String> inside = new LinkedHashSet<>();
            final Set<String> outside = new LinkedHashSet<>();
            for (String s : block) {
                (involved.contains(s) ? inside : outside).add(s);
            }
            if (inside.isEmpty() || outside.isEmpty()) {
                continue;
            }
            partition.set(i, inside);
            partition.add(outside);
            if (removeIdentical(worklist, block)) {
                worklist.add(inside);
                worklist.add(outside);
            } else {
                worklist.add(inside.size() <= outside.size() ? inside : outside);
            }
        }
    }

    private static boolean removeIdentical(Deque<Set<String>> worklist, Set<String> block) {
        return worklist.removeIf(queued -> queued == block);
    }

    private static Automaton collapse(Automaton dfa, List<Set<String>> partition) {
        final Map<String, String> blockOf = new HashMap<>();
        final Set<String> names = new HashSet<>();
        for (Set<String> block : partition) {
            String name = String.join("_", new TreeSet<>(block));
            for (int suffix = 1; !names.add(name); suffix++) {
                name = String.join("_", new TreeSet<>(block)) + "#" + suffix;
            }
            for (String s : block) {
                blockOf.put(s, name);
            }
        }

        // the first member of each block in state order represents it
        final AutomatonBuilder builder = Automaton.builder();
        dfa.getAlphabet().forEach(builder::addSymbol);
        for (String s : dfa.getStates()) {
            final String name = blockOf.get(s);
            if (builder.containsState(name)) {
                continue;
            }
            builder.addState(name, dfa.isAccepting(s));
            for (String sym : dfa.getAlphabet()) {
                final String t = dfa.getSuccessor(s, sym);
                if (t != null) {
                    builder.addTransition(name, sym, blockOf.get(t));
                }
            }
        }
        return builder.setStartingState(blockOf.get(dfa.getStartingState())).build();
    }
}
