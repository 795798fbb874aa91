package FSA.Model;

/**
 * Thrown when an automaton is structurally invalid: a required field is missing, or a starting,
 * accepting or transition state is not among the automaton's states.
 */
public class InvalidAutomatonException extends IllegalArgumentException {

    public InvalidAutomatonException(String message) {
        super("Invalid FSA structure: " + message);
    }
}
