package FSA;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import FSA.Minimise.DFAMinimiser;
import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import FSA.Model.FSAProperties;
import FSA.Regex.ThompsonConstruction;

/**
 * Language equivalence by canonical form: both automata are trimmed, turned into complete minimal
 * DFAs over the union of their alphabets, and compared for isomorphism.
 */
public class Equivalence {

    public static boolean areEquivalent(Automaton a, Automaton b) {
        return check(a, b).equivalent();
    }

    public static EquivalenceResult check(Automaton a, Automaton b) {
        final Automaton t1 = NFATrim.trim(a);
        final Automaton t2 = NFATrim.trim(b);
        if (t1.isEmpty() || t2.isEmpty()) {
            if (t1.isEmpty() && t2.isEmpty()) {
                return new EquivalenceResult(true, "Both automata accept the empty language", 0, 0, Map.of());
            }
            return new EquivalenceResult(false, "Exactly one automaton accepts the empty language",
                    t1.size(), t2.size(), Map.of());
        }

        final Set<String> alphabet = new LinkedHashSet<>(t1.getAlphabet());
        alphabet.addAll(t2.getAlphabet());
        final Automaton d1;
        final Automaton d2;
        try {
            d1 = canonical(t1, alphabet);
            d2 = canonical(t2, alphabet);
        } catch (IllegalArgumentException e) {
            return new EquivalenceResult(false, "Normalisation failed: " + e.getMessage(), 0, 0, Map.of());
        }
        if (d1.size() != d2.size()) {
            return new EquivalenceResult(false, "Minimal DFAs differ in size: " + d1.size() + " vs " + d2.size(),
                    d1.size(), d2.size(), Map.of());
        }
        return isomorphism(d1, d2);
    }

    public static boolean regexEquivalent(String regex1, String regex2) {
        return areEquivalent(ThompsonConstruction.toEpsilonNFA(regex1), ThompsonConstruction.toEpsilonNFA(regex2));
    }

    public static boolean automatonRegexEquivalent(Automaton a, String regex) {
        return areEquivalent(a, ThompsonConstruction.toEpsilonNFA(regex));
    }

    /**
     * Complete minimal DFA of a trimmed automaton, over the given (wider) alphabet.
     */
    static Automaton canonical(Automaton trimmed, Set<String> alphabet) {
        final Automaton dfa = FSAProperties.isDeterministic(trimmed)
                ? trimmed
                : PowersetDeterminizer.determinizeWithSubsets(trimmed).dfa();
        final Automaton minimal = DFAMinimiser.minimise(dfa);
        final AutomatonBuilder widened = minimal.toBuilder();
        alphabet.forEach(widened::addSymbol);
        return PowersetDeterminizer.complete(widened.build());
    }

    private static EquivalenceResult isomorphism(Automaton d1, Automaton d2) {
        final Map<String, String> forward = new LinkedHashMap<>();
        final Map<String, String> backward = new HashMap<>();
        final Deque<String> queue = new ArrayDeque<>();
        forward.put(d1.getStartingState(), d2.getStartingState());
        backward.put(d2.getStartingState(), d1.getStartingState());
        queue.add(d1.getStartingState());

        while (!queue.isEmpty()) {
            final String p = queue.poll();
            final String q = forward.get(p);
            if (d1.isAccepting(p) != d2.isAccepting(q)) {
                return mismatch(d1, d2, "Acceptance differs at (" + p + ", " + q + ")");
            }
            for (String sym : d1.getAlphabet()) {
                final Set<String> ts1 = d1.getTransitions(p, sym);
                final Set<String> ts2 = d2.getTransitions(q, sym);
                if (ts1.size() != ts2.size()) {
                    return mismatch(d1, d2, "Transition arity differs on '" + sym + "' at (" + p + ", " + q + ")");
                }
                if (ts1.isEmpty()) {
                    continue;
                }
                final String t1 = ts1.iterator().next();
                final String t2 = ts2.iterator().next();
                final String mapped = forward.get(t1);
                final String mappedBack = backward.get(t2);
                if (mapped == null && mappedBack == null) {
                    forward.put(t1, t2);
                    backward.put(t2, t1);
                    queue.add(t1);
                } else if (!t2.equals(mapped) || !t1.equals(mappedBack)) {
                    return mismatch(d1, d2, "Inconsistent state mapping for (" + t1 + ", " + t2 + ")");
                }
            }
        }
        if (forward.size() != d1.size() || backward.size() != d2.size()) {
            return mismatch(d1, d2, "State mapping does not cover every state");
        }
        return new EquivalenceResult(true, "Minimal DFAs are isomorphic", d1.size(), d2.size(),
                Collections.unmodifiableMap(forward));
    }

    private static EquivalenceResult mismatch(Automaton d1, Automaton d2, String reason) {
        return new EquivalenceResult(false, reason, d1.size(), d2.size(), Map.of());
    }

    /**
     * @param states1 - states of the first complete minimal DFA
     * @param stateMapping - first-to-second state bijection, only when equivalent
     */
    public record EquivalenceResult(boolean equivalent,
                                    String reason,
                                    int states1,
                                    int states2,
                                    Map<String, String> stateMapping) { }
}
