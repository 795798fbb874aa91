package FSA.Regex;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSA.Model.Automaton;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Generalized automaton for state elimination: at most one edge per ordered state pair, labelled
 * with a {@link RegexLabel}. The synthetic start and accept states are never eliminated.
 */
public final class RegexAutomaton {
    static final String START = "gnfa_start";
    static final String ACCEPT = "gnfa_accept";

    private final Set<String> states = new LinkedHashSet<>();
    private final Map<String, Map<String, RegexLabel>> edges = new LinkedHashMap<>();
    private final String start;
    private final String accept;

    private RegexAutomaton(String start, String accept) {
        this.start = start;
        this.accept = accept;
        states.add(start);
        states.add(accept);
    }

    /**
     * Wraps an automaton: epsilon edges from the synthetic start to its starting state and from its
     * accepting states to the synthetic accept; parallel symbols merge into unions.
     */
    public static RegexAutomaton of(Automaton a) {
        final RegexAutomaton gnfa = new RegexAutomaton(unique(START, a), unique(ACCEPT, a));
        gnfa.states.addAll(a.getStates());
        if (a.getStartingState() != null) {
            gnfa.addEdge(gnfa.start, a.getStartingState(), RegexLabel.EPSILON);
        }
        for (String f : a.getAcceptingStates()) {
            gnfa.addEdge(f, gnfa.accept, RegexLabel.EPSILON);
        }
        a.getTransitions().forEach((from, row) -> row.forEach((symbol, targets) -> {
            for (String to : targets) {
                gnfa.addEdge(from, to, RegexLabel.symbol(symbol));
            }
        }));
        return gnfa;
    }

    private static String unique(String name, Automaton a) {
        String candidate = name;
        for (int suffix = 1; a.getStates().contains(candidate); suffix++) {
            candidate = name + "_" + suffix;
        }
        return candidate;
    }

    public void addEdge(String from, String to, RegexLabel label) {
        edges.computeIfAbsent(from, k -> new LinkedHashMap<>())
                .merge(to, label, RegexLabel::union);
    }

    public @Nullable RegexLabel getEdge(String from, String to) {
        return edges.getOrDefault(from, Map.of()).get(to);
    }

    public Set<String> getStates() {
        return states;
    }

    /**
     * Incoming plus outgoing edges, a self-loop counting twice.
     */
    int degree(String state) {
        int degree = edges.getOrDefault(state, Map.of()).size();
        for (String from : states) {
            if (getEdge(from, state) != null) {
                degree++;
            }
        }
        return degree;
    }

    /**
     * Removes a state, routing every incoming/outgoing pair around it.
     */
    public void eliminate(String state) {
        if (state.equals(start) || state.equals(accept)) {
            throw new IllegalArgumentException("Cannot eliminate the synthetic state " + state);
        }
        final RegexLabel loop = getEdge(state, state);
        final List<String> incoming = new ArrayList<>();
        for (String from : states) {
            if (!from.equals(state) && getEdge(from, state) != null) {
                incoming.add(from);
            }
        }
        final Map<String, RegexLabel> outgoing = new LinkedHashMap<>(edges.getOrDefault(state, Map.of()));
        outgoing.remove(state);

        for (String from : incoming) {
            final RegexLabel in = getEdge(from, state);
            outgoing.forEach((to, out) -> addEdge(from, to, RegexLabel.eliminate(in, loop, out)));
        }

        states.remove(state);
        edges.remove(state);
        for (Map<String, RegexLabel> row : edges.values()) {
            row.remove(state);
        }
    }

    /**
     * Eliminates every original state, lowest degree first (earliest state on ties).
     *
     * @return the remaining start-to-accept label, or {@code ∅} if there is none
     */
    public String eliminateAll() {
        while (states.size() > 2) {
            String best = null;
            int bestDegree = Integer.MAX_VALUE;
            for (String s : states) {
                if (s.equals(start) || s.equals(accept)) {
                    continue;
                }
                final int d = degree(s);
                if (d < bestDegree) {
                    bestDegree = d;
                    best = s;
                }
            }
            eliminate(best);
        }
        final RegexLabel result = getEdge(start, accept);
        return result == null ? String.valueOf(RegexNode.EMPTY_SET) : result.text();
    }
}
