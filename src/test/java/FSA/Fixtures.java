package FSA;

import FSA.Model.Automaton;

/**
 * Small automata shared by the tests.
 */
public final class Fixtures {

    private Fixtures() {}

    /**
     * Minimal complete DFA over {a,b} accepting words ending in a.
     */
    public static Automaton endsWithA() {
        return Automaton.builder()
                .addStates("S0", "S1")
                .addTransition("S0", "a", "S1")
                .addTransition("S0", "b", "S0")
                .addTransition("S1", "a", "S1")
                .addTransition("S1", "b", "S0")
                .setStartingState("S0")
                .addAcceptingState("S1")
                .build();
    }

    /**
     * NFA over {a,b} accepting words ending in ab.
     */
    public static Automaton endsWithAb() {
        return Automaton.builder()
                .addStates("S0", "S1", "S2")
                .addSymbols("a", "b")
                .addTransition("S0", "a", "S0")
                .addTransition("S0", "a", "S1")
                .addTransition("S0", "b", "S0")
                .addTransition("S1", "b", "S2")
                .setStartingState("S0")
                .addAcceptingState("S2")
                .build();
    }

    /**
     * Complete DFA with three equivalent non-accepting states S0, S1, S2 and an accepting sink S3.
     */
    public static Automaton threeEquivalentStates() {
        return Automaton.builder()
                .addStates("S0", "S1", "S2", "S3")
                .addTransition("S0", "a", "S1")
                .addTransition("S0", "b", "S3")
                .addTransition("S1", "a", "S2")
                .addTransition("S1", "b", "S3")
                .addTransition("S2", "a", "S0")
                .addTransition("S2", "b", "S3")
                .addTransition("S3", "a", "S3")
                .addTransition("S3", "b", "S3")
                .setStartingState("S0")
                .addAcceptingState("S3")
                .build();
    }

    /**
     * NFA over {a,b} accepting words whose third symbol from the end is a. The minimal DFA has 8 states.
     */
    public static Automaton thirdFromEndIsA() {
        return Automaton.builder()
                .addStates("q0", "q1", "q2", "q3")
                .addTransition("q0", "a", "q0")
                .addTransition("q0", "b", "q0")
                .addTransition("q0", "a", "q1")
                .addTransition("q1", "a", "q2")
                .addTransition("q1", "b", "q2")
                .addTransition("q2", "a", "q3")
                .addTransition("q2", "b", "q3")
                .setStartingState("q0")
                .addAcceptingState("q3")
                .build();
    }

    /**
     * Single state, start and accepting, with a self-loop on a.
     */
    public static Automaton aStar() {
        return Automaton.builder()
                .addState("S0", true)
                .addTransition("S0", "a", "S0")
                .setStartingState("S0")
                .build();
    }
}
