package FSA;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSA.Model.Automaton;
import FSA.Model.AutomatonValidator;
import FSA.Model.InvalidAutomatonException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Reads and writes automata in the JSON shape
 * <pre>
 * {"states": [...], "alphabet": [...], "transitions": {state: {symbol: [targets]}},
 *  "startingState": ..., "acceptingStates": [...]}
 * </pre>
 * The empty symbol {@code ""} marks epsilon transitions.
 */
public class FSAJson {
    private static final List<String> REQUIRED_KEYS =
            List.of("states", "alphabet", "transitions", "startingState", "acceptingStates");

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private FSAJson() {}

    public static class AutomatonJson {
        @JsonProperty("states")
        private List<String> states;

        @JsonProperty("alphabet")
        private List<String> alphabet;

        @JsonProperty("transitions")
        private Map<String, Map<String, List<String>>> transitions;

        @JsonProperty("startingState")
        @JsonInclude(JsonInclude.Include.ALWAYS)
        private String startingState;

        @JsonProperty("acceptingStates")
        private List<String> acceptingStates;

        public AutomatonJson() {}

        public AutomatonJson(List<String> states, List<String> alphabet,
                             Map<String, Map<String, List<String>>> transitions,
                             String startingState, List<String> acceptingStates) {
            this.states = states;
            this.alphabet = alphabet;
            this.transitions = transitions;
            this.startingState = startingState;
            this.acceptingStates = acceptingStates;
        }

        public List<String> getStates() { return states; }
        public void setStates(List<String> states) { this.states = states; }

        public List<String> getAlphabet() { return alphabet; }
        public void setAlphabet(List<String> alphabet) { this.alphabet = alphabet; }

        public Map<String, Map<String, List<String>>> getTransitions() { return transitions; }
        public void setTransitions(Map<String, Map<String, List<String>>> transitions) { this.transitions = transitions; }

        public String getStartingState() { return startingState; }
        public void setStartingState(String startingState) { this.startingState = startingState; }

        public List<String> getAcceptingStates() { return acceptingStates; }
        public void setAcceptingStates(List<String> acceptingStates) { this.acceptingStates = acceptingStates; }
    }

    /**
     * @throws InvalidAutomatonException if the text is not JSON, a required key is missing, or the
     *         automaton it describes is malformed
     */
    public static Automaton read(String json) {
        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidAutomatonException("malformed JSON: " + e.getOriginalMessage());
        }
        return fromTree(root);
    }

    /**
     * @throws InvalidAutomatonException if the file is not JSON or does not describe a valid automaton
     * @throws IOException if the file cannot be read
     */
    public static Automaton read(File file) throws IOException {
        final JsonNode root;
        try {
            root = MAPPER.readTree(file);
        } catch (JsonProcessingException e) {
            throw new InvalidAutomatonException("malformed JSON in " + file.getName() + ": " + e.getOriginalMessage());
        }
        return fromTree(root);
    }

    private static Automaton fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidAutomatonException("automaton must be a JSON object");
        }
        for (String key : REQUIRED_KEYS) {
            if (!root.has(key)) {
                throw new InvalidAutomatonException("missing required key '" + key + "'");
            }
        }
        final AutomatonJson dto;
        try {
            dto = MAPPER.treeToValue(root, AutomatonJson.class);
        } catch (JsonProcessingException e) {
            throw new InvalidAutomatonException("wrongly typed automaton field: " + e.getOriginalMessage());
        }
        return toAutomaton(dto);
    }

    static Automaton toAutomaton(AutomatonJson dto) {
        AutomatonValidator.validate(
                dto.getStates() == null ? null : new LinkedHashSet<>(dto.getStates()),
                dto.getAlphabet() == null ? null : new LinkedHashSet<>(dto.getAlphabet()),
                dto.getTransitions() == null ? null : Map.of(),
                dto.getStartingState(),
                dto.getAcceptingStates() == null ? null : new LinkedHashSet<>(dto.getAcceptingStates()));
        AutomatonValidator.requireDistinct("states", dto.getStates());
        AutomatonValidator.requireDistinct("alphabet", dto.getAlphabet());

        final Map<String, Map<String, Set<String>>> transitions = new LinkedHashMap<>();
        dto.getTransitions().forEach((from, row) -> {
            if (row == null) {
                throw new InvalidAutomatonException("transitions of state '" + from + "' must be an object");
            }
            final Map<String, Set<String>> converted = new LinkedHashMap<>();
            row.forEach((symbol, targets) -> {
                if (targets == null) {
                    throw new InvalidAutomatonException(
                            "targets of state '" + from + "' on '" + symbol + "' must be a list");
                }
                converted.put(symbol, new LinkedHashSet<>(targets));
            });
            transitions.put(from, converted);
        });
        final String start = dto.getStates().isEmpty() ? null : dto.getStartingState();
        return new Automaton(new LinkedHashSet<>(dto.getStates()), new LinkedHashSet<>(dto.getAlphabet()),
                transitions, start, new LinkedHashSet<>(dto.getAcceptingStates()));
    }

    public static String write(Automaton a) {
        try {
            return MAPPER.writeValueAsString(toJson(a));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void write(Automaton a, File file) throws IOException {
        MAPPER.writeValue(file, toJson(a));
    }

    static AutomatonJson toJson(Automaton a) {
        final Map<String, Map<String, List<String>>> transitions = new LinkedHashMap<>();
        a.getTransitions().forEach((from, row) -> {
            final Map<String, List<String>> converted = new LinkedHashMap<>();
            row.forEach((symbol, targets) -> converted.put(symbol, new ArrayList<>(targets)));
            transitions.put(from, converted);
        });
        return new AutomatonJson(new ArrayList<>(a.getStates()), new ArrayList<>(a.getAlphabet()), transitions,
                a.getStartingState() == null ? "" : a.getStartingState(), new ArrayList<>(a.getAcceptingStates()));
    }
}
