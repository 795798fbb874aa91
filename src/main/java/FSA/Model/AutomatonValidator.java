package FSA.Model;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Structural checks run before any algorithm sees an automaton.
 */
public final class AutomatonValidator {

    private AutomatonValidator() {}

    public static void validate(@Nullable Set<String> states,
                                @Nullable Set<String> alphabet,
                                @Nullable Map<String, ? extends Map<String, ? extends Set<String>>> transitions,
                                @Nullable String startingState,
                                @Nullable Set<String> acceptingStates) {
        requirePresent("states", states);
        requirePresent("alphabet", alphabet);
        requirePresent("transitions", transitions);
        requirePresent("acceptingStates", acceptingStates);

        if (alphabet.contains(Automaton.EPSILON)) {
            throw new InvalidAutomatonException("alphabet must not contain the epsilon symbol");
        }

        if (states.isEmpty()) {
            if (startingState != null && !startingState.isEmpty()) {
                throw new InvalidAutomatonException("empty states list but non-empty starting state");
            }
        } else {
            if (startingState == null) {
                throw new InvalidAutomatonException("missing required key 'startingState'");
            }
            if (!states.contains(startingState)) {
                throw new InvalidAutomatonException("starting state '" + startingState + "' not in states list");
            }
        }

        for (String s : acceptingStates) {
            if (!states.contains(s)) {
                throw new InvalidAutomatonException("accepting state '" + s + "' not in states list");
            }
        }

        for (Map.Entry<String, ? extends Map<String, ? extends Set<String>>> row : transitions.entrySet()) {
            final String source = row.getKey();
            if (!states.contains(source)) {
                throw new InvalidAutomatonException("transition source state '" + source + "' not in states list");
            }
            for (Map.Entry<String, ? extends Set<String>> e : row.getValue().entrySet()) {
                final String symbol = e.getKey();
                if (!Automaton.EPSILON.equals(symbol) && !alphabet.contains(symbol)) {
                    throw new InvalidAutomatonException(
                            "transition symbol '" + symbol + "' of state '" + source + "' not in alphabet");
                }
                for (String target : e.getValue()) {
                    if (!states.contains(target)) {
                        throw new InvalidAutomatonException(
                                "transition target state '" + target + "' not in states list");
                    }
                }
            }
        }
    }

    /**
     * Rejects duplicate entries in list-shaped input, e.g. a deserialized payload.
     */
    public static void requireDistinct(String field, Collection<String> values) {
        if (new HashSet<>(values).size() != values.size()) {
            throw new InvalidAutomatonException("duplicate entries in " + field);
        }
    }

    private static void requirePresent(String field, @Nullable Object value) {
        if (value == null) {
            throw new InvalidAutomatonException("missing required key '" + field + "'");
        }
    }
}
