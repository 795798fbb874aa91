package FSA.Model;

import java.util.function.Predicate;

/**
 * Thresholds decide whether an exponential stage (Kameda–Weiner grid and cover search) may run on
 * a given automaton.
 */
public interface Threshold extends Predicate<Automaton> {
    int DEFAULT_THRESHOLD_SIZE = 150;

    String getName();

    String getParam();

    /**
     * @return how many automata were rejected by this threshold so far
     */
    int getCrossings();

    /**
     * maxComplexity(limit): admits automata whose states plus transitions are at most limit.
     * @param limit - largest admitted complexity score
     */
    static Threshold maxComplexity(int limit) {
        return new Threshold() {
            int crossings = 0;

            @Override
            public boolean test(Automaton automaton) {
                if (automaton.complexity() > limit) {
                    crossings++;
                    return false;
                }
                return true;
            }

            @Override
            public String getName() {
                return "complexity";
            }

            @Override
            public String getParam() {
                return String.valueOf(limit);
            }

            @Override
            public int getCrossings() {
                return crossings;
            }
        };
    }
}
