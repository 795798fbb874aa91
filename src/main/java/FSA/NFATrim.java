package FSA;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import FSA.Model.FSAProperties;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.fsa.NFAs;
import net.automatalib.util.partitionrefinement.Valmari;
import net.automatalib.util.partitionrefinement.ValmariExtractors;
import net.automatalib.util.partitionrefinement.ValmariInitializers;

/**
 * Language-preserving structural reductions: reachability trimming, reversal, epsilon removal and
 * bisimulation quotients.
 */
public class NFATrim {

    public static Automaton trim(Automaton a) {
        return removeDead(removeUnreachable(a));
    }

    /**
     * Drops states not reachable from the starting state (epsilon transitions count).
     * The alphabet is left as is.
     */
    public static Automaton removeUnreachable(Automaton a) {
        if (a.isEmpty()) {
            return a;
        }
        final Set<String> reachable = FSAProperties.reachableStates(a);
        if (reachable.size() == a.size()) {
            return a;
        }
        return restrict(a, reachable, a.getAlphabet());
    }

    /**
     * Drops states from which no accepting state can be reached, then shrinks the alphabet to the
     * symbols still used. A dead starting state yields the empty automaton.
     */
    public static Automaton removeDead(Automaton a) {
        if (a.isEmpty()) {
            return a;
        }
        final Map<String, Set<String>> predecessors = new HashMap<>();
        a.getTransitions().forEach((s, row) -> row.values().forEach(targets -> {
            for (String t : targets) {
                predecessors.computeIfAbsent(t, k -> new LinkedHashSet<>()).add(s);
            }
        }));

        final Set<String> live = new LinkedHashSet<>(a.getAcceptingStates());
        final Deque<String> queue = new ArrayDeque<>(live);
        while (!queue.isEmpty()) {
            final String s = queue.poll();
            for (String p : predecessors.getOrDefault(s, Set.of())) {
                if (live.add(p)) {
                    queue.add(p);
                }
            }
        }
        if (!live.contains(a.getStartingState())) {
            return Automaton.empty();
        }

        final Set<String> used = new LinkedHashSet<>();
        for (String s : a.getStates()) {
            if (!live.contains(s)) {
                continue;
            }
            a.getTransitions(s).forEach((symbol, targets) -> {
                if (!symbol.equals(Automaton.EPSILON) && targets.stream().anyMatch(live::contains)) {
                    used.add(symbol);
                }
            });
        }
        final Set<String> alphabet = new LinkedHashSet<>(a.getAlphabet());
        alphabet.retainAll(used);
        if (live.size() == a.size() && alphabet.size() == a.getAlphabet().size()) {
            return a;
        }
        return restrict(a, live, alphabet);
    }

    private static Automaton restrict(Automaton a, Set<String> keep, Set<String> alphabet) {
        final AutomatonBuilder builder = Automaton.builder();
        alphabet.forEach(builder::addSymbol);
        for (String s : a.getStates()) {
            if (keep.contains(s)) {
                builder.addState(s, a.isAccepting(s));
            }
        }
        for (String s : a.getStates()) {
            if (!keep.contains(s)) {
                continue;
            }
            a.getTransitions(s).forEach((symbol, targets) -> {
                for (String t : targets) {
                    if (keep.contains(t)) {
                        builder.addTransition(s, symbol, t);
                    }
                }
            });
        }
        return builder.setStartingState(a.getStartingState()).build();
    }

    /**
     * Dual automaton: every edge reversed, a synthetic start state epsilon-linked to each original
     * accepting state, and the original start as the only accepting state.
     *
     * @param freshStart - preferred name of the synthetic start; uniquified if taken
     */
    public static Automaton reverse(Automaton a, String freshStart) {
        if (a.isEmpty()) {
            return a;
        }
        final AutomatonBuilder builder = Automaton.builder();
        a.getAlphabet().forEach(builder::addSymbol);
        a.getStates().forEach(builder::addState);
        final String start = builder.freshStateName(freshStart);
        builder.addState(start);
        a.getTransitions().forEach((s, row) -> row.forEach((symbol, targets) -> {
            for (String t : targets) {
                builder.addTransition(t, symbol, s);
            }
        }));
        for (String f : a.getAcceptingStates()) {
            builder.addEpsilonTransition(start, f);
        }
        return builder.setStartingState(start)
                .addAcceptingState(a.getStartingState())
                .build();
    }

    /**
     * States reachable from {@code from} using only epsilon transitions, {@code from} included.
     */
    public static Set<String> epsilonClosure(Automaton a, Collection<String> from) {
        final Set<String> closure = new LinkedHashSet<>(from);
        final Deque<String> stack = new ArrayDeque<>(from);
        while (!stack.isEmpty()) {
            for (String t : a.getTransitions(stack.pop(), Automaton.EPSILON)) {
                if (closure.add(t)) {
                    stack.push(t);
                }
            }
        }
        return closure;
    }

    /**
     * Replaces epsilon moves by direct symbol transitions: q -a-> r for every p in closure(q) with
     * p -a-> p' and r in closure(p'). A state accepts iff its closure meets the accepting states.
     */
    public static Automaton removeEpsilon(Automaton a) {
        if (!a.hasEpsilonTransitions()) {
            return a;
        }
        final Map<String, Set<String>> closures = new HashMap<>();
        for (String s : a.getStates()) {
            closures.put(s, epsilonClosure(a, Set.of(s)));
        }
        final AutomatonBuilder builder = Automaton.builder();
        a.getAlphabet().forEach(builder::addSymbol);
        for (String q : a.getStates()) {
            final Set<String> closure = closures.get(q);
            builder.addState(q, closure.stream().anyMatch(a::isAccepting));
        }
        for (String q : a.getStates()) {
            for (String symbol : a.getAlphabet()) {
                for (String p : closures.get(q)) {
                    for (String target : a.getTransitions(p, symbol)) {
                        for (String r : closures.get(target)) {
                            builder.addTransition(q, symbol, r);
                        }
                    }
                }
            }
        }
        return builder.setStartingState(a.getStartingState()).build();
    }

    /**
     * Forward then backward bisimulation quotient, computed by AutomataLib's Valmari partition
     * refinement. Returns the input itself when no state is saved.
     *
     * @param reduced - epsilon-free automaton
     */
    public static Automaton bisim(Automaton reduced) {
        if (reduced.size() <= 1) {
            return reduced;
        }
        final Alphabet<String> alphabet = CompactConverter.alphabetOf(reduced);
        CompactNFA<String> result = CompactConverter.toCompactNFA(reduced);
        final int prevReduced = result.size();
        // usually faster to reduce via bisimilarity first, per EBEC paper
        result = bisimReduce(result, alphabet, true);
        if (result.size() > 1) {
            result = bisimReduce(result, alphabet, false);
        }
        if (result.size() >= prevReduced) {
            return reduced;
        }
        return trim(CompactConverter.fromNFA(result, alphabet, "b"));
    }

    private static CompactNFA<String> bisimReduce(CompactNFA<String> reduced, Alphabet<String> alphabet, boolean forward) {
        CompactNFA<String> cnfa = forward ? reduced : reverse(reduced, alphabet);
        final Valmari prb = ValmariInitializers.initializeNFA(cnfa, alphabet);
        prb.computeCoarsestStablePartition();
        cnfa = ValmariExtractors.toNFA(prb, cnfa, alphabet, false, new CompactNFA.Creator<>());
        if (cnfa.size() < reduced.size()) {
            // There's an actual reduction
            return forward ? cnfa : reverse(cnfa, alphabet);
        }
        return reduced;
    }

    private static CompactNFA<String> reverse(CompactNFA<String> nfa, Alphabet<String> alphabet) {
        final CompactNFA<String> out = new CompactNFA<>(alphabet, nfa.size());
        NFAs.reverse(nfa, alphabet, out);
        return out;
    }
}
