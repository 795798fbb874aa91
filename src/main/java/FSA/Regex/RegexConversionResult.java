package FSA.Regex;

/**
 * @param minimisedStates - states of the automaton the regex was read off
 * @param simplificationSkipped - whether the automaton was too large for simplification
 */
public record RegexConversionResult(String regex,
                                    int originalStates,
                                    int minimisedStates,
                                    RegexVerification verification,
                                    boolean simplificationSkipped) { }
