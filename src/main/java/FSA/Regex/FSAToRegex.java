package FSA.Regex;

import java.util.ArrayList;
import java.util.List;

import FSA.Equivalence;
import FSA.Equivalence.EquivalenceResult;
import FSA.NFATrim;
import FSA.Minimise.NFAMinimiser;
import FSA.Model.Automaton;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Automaton to regex by state elimination, with verified simplification.
 * <p>
 * Regex text has no escapes, so every symbol the automaton uses must be a single character other
 * than the operators {@code ( ) | * + ?} and the reserved {@code ε} and {@code ∅}.
 */
public class FSAToRegex {
    public static final int DEFAULT_SKIP_SIMPLIFICATION_THRESHOLD = 2500;

    private static final String RESERVED = "()|*+?" + RegexNode.EPSILON + RegexNode.EMPTY_SET;

    private final int skipSimplificationThreshold;
    private final RegexSimplifier simplifier;

    public FSAToRegex(int skipSimplificationThreshold, RegexSimplifier simplifier) {
        this.skipSimplificationThreshold = skipSimplificationThreshold;
        this.simplifier = simplifier;
    }

    public static RegexConversionResult convert(Automaton a) {
        return new FSAToRegex(DEFAULT_SKIP_SIMPLIFICATION_THRESHOLD,
                new RegexSimplifier(RegexSimplifier.DEFAULT_MAX_ITERATIONS, RegexSimplifier.DEFAULT_MAX_COMPLEXITY))
                .run(a);
    }

    /**
     * @throws IllegalArgumentException if a used symbol cannot be written as a regex character
     */
    public RegexConversionResult run(Automaton a) {
        final Automaton trimmed = NFATrim.trim(a);
        requireRegexSymbols(trimmed);
        if (trimmed.isEmpty()) {
            return emptyLanguage(a);
        }
        final Automaton minimised = NFAMinimiser.minimise(trimmed).nfa();
        if (minimised.isEmpty()) {
            return emptyLanguage(a);
        }

        if (minimised.size() == 1) {
            final String original = singleState(minimised);
            final RegexVerification verification = verify(trimmed, original, simplifier.run(original));
            return new RegexConversionResult(verification.regex(), a.size(), 1, verification, false);
        }

        final long estimate = (long) minimised.size() * minimised.getAlphabet().size() * minimised.transitionCount();
        final boolean skip = estimate > skipSimplificationThreshold;
        final String original = RegexAutomaton.of(minimised).eliminateAll();
        final String simplified = skip ? original : simplifier.run(original);
        final RegexVerification verification = verify(trimmed, original, simplified);
        return new RegexConversionResult(verification.regex(), a.size(), minimised.size(), verification, skip);
    }

    static void requireRegexSymbols(Automaton a) {
        for (String symbol : a.getAlphabet()) {
            if (symbol.length() != 1 || RESERVED.indexOf(symbol.charAt(0)) >= 0) {
                throw new IllegalArgumentException("Symbol '" + symbol
                        + "' cannot be written in a regex: symbols must be single non-operator characters");
            }
        }
    }

    private static RegexConversionResult emptyLanguage(Automaton a) {
        final String empty = String.valueOf(RegexNode.EMPTY_SET);
        return new RegexConversionResult(empty, a.size(), 0, new RegexVerification.Verified(empty), false);
    }

    // self-loop union starred, ε, or ∅
    private static String singleState(Automaton a) {
        final String state = a.getStartingState();
        if (!a.isAccepting(state)) {
            return String.valueOf(RegexNode.EMPTY_SET);
        }
        final List<String> loops = new ArrayList<>();
        a.getTransitions(state).forEach((symbol, targets) -> {
            if (targets.contains(state)) {
                loops.add(symbol.isEmpty() ? String.valueOf(RegexNode.EPSILON) : symbol);
            }
        });
        if (loops.isEmpty()) {
            return String.valueOf(RegexNode.EPSILON);
        }
        return "(" + String.join("|", loops) + ")*";
    }

    /**
     * Accepts the simplified regex if its Thompson automaton is equivalent to {@code source},
     * otherwise the unsimplified one if that is; never throws.
     */
    public static RegexVerification verify(Automaton source, String original, String simplified) {
        final String simplifiedProblem = problem(source, simplified);
        if (simplifiedProblem == null) {
            return new RegexVerification.Verified(simplified);
        }
        final Automaton originalNfa;
        try {
            originalNfa = NFATrim.trim(ThompsonConstruction.toEpsilonNFA(original));
        } catch (RegexSyntaxException e) {
            return new RegexVerification.BothFailed(original, "Unsimplified regex does not parse: " + e.getMessage(), true);
        }
        final EquivalenceResult check = Equivalence.check(source, originalNfa);
        if (check.equivalent()) {
            return new RegexVerification.Fallback(original, simplifiedProblem);
        }
        return new RegexVerification.BothFailed(original, "Unsimplified regex not equivalent: " + check.reason(), false);
    }

    // why the regex does not describe the source language, or null if it does
    private static @Nullable String problem(Automaton source, String regex) {
        final Automaton nfa;
        try {
            nfa = NFATrim.trim(ThompsonConstruction.toEpsilonNFA(regex));
        } catch (RegexSyntaxException e) {
            return "Simplified regex does not parse: " + e.getMessage();
        }
        final EquivalenceResult check = Equivalence.check(source, nfa);
        return check.equivalent() ? null : "Simplified regex not equivalent: " + check.reason();
    }
}
