package FSA.Model;

/**
 * Thrown when an operation that is only defined for deterministic automata (DFA minimisation,
 * completion, complementation, deterministic simulation) receives an automaton with epsilon
 * transitions or several targets for some state and symbol.
 */
public class NondeterministicAutomatonException extends IllegalArgumentException {
    private final String operation;

    public NondeterministicAutomatonException(String operation) {
        super(operation + " requires a deterministic FSA.");
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
