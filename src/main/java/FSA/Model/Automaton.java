package FSA.Model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Immutable finite-state acceptor over named states and string symbols.
 * <p>
 * Transitions are an adjacency structure state -> symbol -> ordered target set. The empty string
 * ({@link #EPSILON}) labels epsilon transitions and is never part of the alphabet.
 * An automaton without states has no starting state and accepts the empty language.
 */
public final class Automaton {
    public static final String EPSILON = "";
    public static final String EPSILON_LABEL = "ε";
    public static final String EMPTY_LANGUAGE = "∅";

    private static final Automaton EMPTY = new Automaton(Set.of(), Set.of(), Map.of(), null, Set.of());

    private final Set<String> states;
    private final Set<String> alphabet;
    private final Map<String, Map<String, Set<String>>> transitions;
    private final @Nullable String startingState;
    private final Set<String> acceptingStates;

    public Automaton(Set<String> states,
                     Set<String> alphabet,
                     Map<String, ? extends Map<String, ? extends Set<String>>> transitions,
                     @Nullable String startingState,
                     Set<String> acceptingStates) {
        AutomatonValidator.validate(states, alphabet, transitions, startingState, acceptingStates);
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
        this.alphabet = Collections.unmodifiableSet(new LinkedHashSet<>(alphabet));
        this.startingState = startingState;
        this.acceptingStates = Collections.unmodifiableSet(new LinkedHashSet<>(acceptingStates));

        // copy in state order, dropping empty target sets
        final Map<String, Map<String, Set<String>>> copy = new LinkedHashMap<>();
        for (String s : this.states) {
            final Map<String, ? extends Set<String>> row = transitions.get(s);
            if (row == null) {
                continue;
            }
            final Map<String, Set<String>> rowCopy = new LinkedHashMap<>();
            for (Map.Entry<String, ? extends Set<String>> e : row.entrySet()) {
                if (!e.getValue().isEmpty()) {
                    rowCopy.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
                }
            }
            if (!rowCopy.isEmpty()) {
                copy.put(s, Collections.unmodifiableMap(rowCopy));
            }
        }
        this.transitions = Collections.unmodifiableMap(copy);
    }

    public static Automaton empty() {
        return EMPTY;
    }

    public static AutomatonBuilder builder() {
        return new AutomatonBuilder();
    }

    public Set<String> getStates() {
        return states;
    }

    public Set<String> getAlphabet() {
        return alphabet;
    }

    public Map<String, Map<String, Set<String>>> getTransitions() {
        return transitions;
    }

    public @Nullable String getStartingState() {
        return startingState;
    }

    public Set<String> getAcceptingStates() {
        return acceptingStates;
    }

    public int size() {
        return states.size();
    }

    public boolean isEmpty() {
        return states.isEmpty();
    }

    public boolean isAccepting(String state) {
        return acceptingStates.contains(state);
    }

    /**
     * Outgoing transitions of a state, keyed by symbol (epsilon included).
     */
    public Map<String, Set<String>> getTransitions(String state) {
        return transitions.getOrDefault(state, Map.of());
    }

    public Set<String> getTransitions(String state, String symbol) {
        return getTransitions(state).getOrDefault(symbol, Set.of());
    }

    /**
     * @return the single target on {@code symbol}, or {@code null} if there is none.
     *         For non-deterministic transitions the first target is returned.
     */
    public @Nullable String getSuccessor(String state, String symbol) {
        final Set<String> targets = getTransitions(state, symbol);
        return targets.isEmpty() ? null : targets.iterator().next();
    }

    public boolean hasEpsilonTransitions() {
        for (Map<String, Set<String>> row : transitions.values()) {
            if (row.containsKey(EPSILON)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Number of (source, label, target) triples, epsilon transitions included.
     */
    public int transitionCount() {
        int count = 0;
        for (Map<String, Set<String>> row : transitions.values()) {
            for (Set<String> targets : row.values()) {
                count += targets.size();
            }
        }
        return count;
    }

    /**
     * Complexity score used to gate exponential algorithms: states plus transitions.
     */
    public int complexity() {
        return size() + transitionCount();
    }

    /**
     * A builder pre-filled with this automaton's structure.
     */
    public AutomatonBuilder toBuilder() {
        final AutomatonBuilder builder = new AutomatonBuilder();
        states.forEach(builder::addState);
        alphabet.forEach(builder::addSymbol);
        transitions.forEach((s, row) -> row.forEach((a, targets) -> targets.forEach(t -> builder.addTransition(s, a, t))));
        if (startingState != null) {
            builder.setStartingState(startingState);
        }
        acceptingStates.forEach(builder::addAcceptingState);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Automaton)) {
            return false;
        }
        Automaton that = (Automaton) o;
        return states.equals(that.states) && alphabet.equals(that.alphabet)
                && transitions.equals(that.transitions)
                && Objects.equals(startingState, that.startingState)
                && acceptingStates.equals(that.acceptingStates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, transitions, startingState, acceptingStates);
    }

    @Override
    public String toString() {
        return "Automaton{states=" + states + ", alphabet=" + alphabet + ", transitions=" + transitions
                + ", startingState=" + startingState + ", acceptingStates=" + acceptingStates + '}';
    }
}
