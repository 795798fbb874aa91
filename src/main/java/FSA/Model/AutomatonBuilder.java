package FSA.Model;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Mutable staging area for an {@link Automaton}. Non-epsilon transition symbols are added to the
 * alphabet automatically; states are not, so dangling targets are still reported by
 * {@link #build()}.
 */
public final class AutomatonBuilder {
    private final Set<String> states = new LinkedHashSet<>();
    private final Set<String> alphabet = new LinkedHashSet<>();
    private final Map<String, Map<String, Set<String>>> transitions = new LinkedHashMap<>();
    private final Set<String> acceptingStates = new LinkedHashSet<>();
    private @Nullable String startingState;

    AutomatonBuilder() {}

    public AutomatonBuilder addState(String state) {
        states.add(state);
        return this;
    }

    public AutomatonBuilder addState(String state, boolean accepting) {
        states.add(state);
        if (accepting) {
            acceptingStates.add(state);
        }
        return this;
    }

    public AutomatonBuilder addStates(String... names) {
        for (String s : names) {
            states.add(s);
        }
        return this;
    }

    public AutomatonBuilder addSymbol(String symbol) {
        alphabet.add(symbol);
        return this;
    }

    public AutomatonBuilder addSymbols(String... symbols) {
        for (String a : symbols) {
            alphabet.add(a);
        }
        return this;
    }

    public AutomatonBuilder addTransition(String from, String symbol, String to) {
        if (!Automaton.EPSILON.equals(symbol)) {
            alphabet.add(symbol);
        }
        transitions.computeIfAbsent(from, k -> new LinkedHashMap<>())
                .computeIfAbsent(symbol, k -> new LinkedHashSet<>())
                .add(to);
        return this;
    }

    public AutomatonBuilder addEpsilonTransition(String from, String to) {
        return addTransition(from, Automaton.EPSILON, to);
    }

    public AutomatonBuilder setStartingState(String state) {
        this.startingState = state;
        return this;
    }

    public AutomatonBuilder addAcceptingState(String state) {
        acceptingStates.add(state);
        return this;
    }

    public AutomatonBuilder addAcceptingStates(String... names) {
        for (String s : names) {
            acceptingStates.add(s);
        }
        return this;
    }

    public boolean containsState(String state) {
        return states.contains(state);
    }

    /**
     * @return {@code base}, or {@code base_1}, {@code base_2}, ... whichever is not yet a state.
     */
    public String freshStateName(String base) {
        String name = base;
        int suffix = 1;
        while (states.contains(name)) {
            name = base + "_" + suffix++;
        }
        return name;
    }

    public Automaton build() {
        return new Automaton(states, alphabet, transitions, startingState, acceptingStates);
    }
}
