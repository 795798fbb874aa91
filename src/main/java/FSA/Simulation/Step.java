package FSA.Simulation;

/**
 * One move of a run. Epsilon moves carry the symbol {@code ε}.
 */
public record Step(String from, String symbol, String to) {

    @Override
    public String toString() {
        return from + " -" + symbol + "-> " + to;
    }
}
