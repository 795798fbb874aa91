package FSA.Model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Structural predicates over automata. Determinism is always derived, never stored.
 */
public final class FSAProperties {

    private FSAProperties() {}

    /**
     * Deterministic iff there are no epsilon transitions and at most one target per state and symbol.
     * An epsilon transition makes an automaton non-deterministic even over an empty alphabet.
     */
    public static boolean isDeterministic(Automaton a) {
        for (Map<String, Set<String>> row : a.getTransitions().values()) {
            for (Map.Entry<String, Set<String>> e : row.entrySet()) {
                if (Automaton.EPSILON.equals(e.getKey()) || e.getValue().size() > 1) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Non-deterministic iff some epsilon transition exists or some state/symbol pair has several targets.
     */
    public static boolean isNondeterministic(Automaton a) {
        for (Map<String, Set<String>> row : a.getTransitions().values()) {
            for (Map.Entry<String, Set<String>> e : row.entrySet()) {
                if (Automaton.EPSILON.equals(e.getKey()) || e.getValue().size() > 1) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Complete iff every state has at least one target for every alphabet symbol.
     * Epsilon transitions are ignored.
     */
    public static boolean isComplete(Automaton a) {
        if (a.isEmpty() || a.getAlphabet().isEmpty()) {
            return true;
        }
        for (String s : a.getStates()) {
            for (String symbol : a.getAlphabet()) {
                if (a.getTransitions(s, symbol).isEmpty()) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Connected iff every state is reachable from the starting state (epsilon transitions included).
     */
    public static boolean isConnected(Automaton a) {
        if (a.size() <= 1) {
            return true;
        }
        return reachableStates(a).size() == a.size();
    }

    /**
     * @return whether some cycle consists solely of epsilon transitions
     */
    public static boolean hasEpsilonLoops(Automaton a) {
        // colours: absent = unvisited, 1 = on stack, 2 = done
        final Map<String, Integer> colour = new HashMap<>();
        for (String root : a.getStates()) {
            if (colour.containsKey(root)) {
                continue;
            }
            final Deque<String> stack = new ArrayDeque<>();
            final Deque<Iterator<String>> iters = new ArrayDeque<>();
            stack.push(root);
            iters.push(a.getTransitions(root, Automaton.EPSILON).iterator());
            colour.put(root, 1);
            while (!stack.isEmpty()) {
                final Iterator<String> it = iters.peek();
                if (it.hasNext()) {
                    final String next = it.next();
                    final Integer c = colour.get(next);
                    if (c == null) {
                        colour.put(next, 1);
                        stack.push(next);
                        iters.push(a.getTransitions(next, Automaton.EPSILON).iterator());
                    } else if (c == 1) {
                        return true;
                    }
                } else {
                    colour.put(stack.pop(), 2);
                    iters.pop();
                }
            }
        }
        return false;
    }

    /**
     * States reachable from the starting state over all transitions, epsilon included.
     */
    public static Set<String> reachableStates(Automaton a) {
        final Set<String> reachable = new HashSet<>();
        final String start = a.getStartingState();
        if (start == null) {
            return reachable;
        }
        final Deque<String> queue = new ArrayDeque<>();
        reachable.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            final String current = queue.poll();
            for (Set<String> targets : a.getTransitions(current).values()) {
                for (String t : targets) {
                    if (reachable.add(t)) {
                        queue.add(t);
                    }
                }
            }
        }
        return reachable;
    }

    public static PropertyReport checkAll(Automaton a) {
        return new PropertyReport(isDeterministic(a), isComplete(a), isConnected(a));
    }

    public record PropertyReport(boolean deterministic, boolean complete, boolean connected) { }
}
