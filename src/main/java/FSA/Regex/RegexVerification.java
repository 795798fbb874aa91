package FSA.Regex;

/**
 * How a regex produced from an automaton was confirmed. Only {@link BothFailed} carries a regex
 * whose language could not be shown equal to the automaton's.
 */
public sealed interface RegexVerification permits RegexVerification.Verified, RegexVerification.Fallback,
        RegexVerification.BothFailed {

    String regex();

    String strategy();

    default boolean isEquivalent() {
        return !(this instanceof BothFailed);
    }

    /**
     * The simplified regex verified.
     */
    record Verified(String regex) implements RegexVerification {
        @Override
        public String strategy() {
            return "simplified_passed";
        }
    }

    /**
     * The simplified regex did not verify, the unsimplified one did.
     */
    record Fallback(String regex, String reason) implements RegexVerification {
        @Override
        public String strategy() {
            return "fallback_to_original";
        }
    }

    /**
     * Neither regex verified; {@code regex} is the unsimplified one.
     *
     * @param conversionFailed - whether the unsimplified regex could not even be converted back
     */
    record BothFailed(String regex, String reason, boolean conversionFailed) implements RegexVerification {
        @Override
        public String strategy() {
            return conversionFailed ? "both_failed_conversion" : "both_failed_equivalence";
        }
    }
}
