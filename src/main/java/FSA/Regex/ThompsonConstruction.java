package FSA.Regex;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thompson construction: every syntax node becomes an epsilon-NFA fragment with one entry and one
 * exit state, joined by epsilon transitions. States are numbered {@code q0, q1, ...} in creation
 * order; the exit of the outermost fragment is the only accepting state.
 */
public class ThompsonConstruction {
    static final String STATE_PREFIX = "q";

    private final AutomatonBuilder builder = Automaton.builder();
    private int counter;

    private ThompsonConstruction() {}

    /**
     * @throws RegexSyntaxException if the regex is malformed; no automaton is produced then
     */
    public static Automaton toEpsilonNFA(String regex) {
        final RegexNode ast = RegexASTParser.parse(regex);
        final ThompsonConstruction construction = new ThompsonConstruction();
        final Fragment f = construction.build(ast);
        return construction.builder.setStartingState(f.start()).addAcceptingState(f.accept()).build();
    }

    public static RegexValidation validate(String regex) {
        try {
            RegexASTParser.parse(regex);
            return new RegexValidation(true, null);
        } catch (RegexSyntaxException e) {
            return new RegexValidation(false, "Invalid regex '" + regex + "': " + e.getMessage());
        }
    }

    private String newState() {
        final String s = STATE_PREFIX + counter++;
        builder.addState(s);
        return s;
    }

    private Fragment build(RegexNode node) {
        if (node instanceof RegexNode.Symbol) {
            final Fragment f = new Fragment(newState(), newState());
            builder.addTransition(f.start(), String.valueOf(((RegexNode.Symbol) node).symbol()), f.accept());
            return f;
        } else if (node instanceof RegexNode.Epsilon || node instanceof RegexNode.EmptyGroup) {
            final Fragment f = new Fragment(newState(), newState());
            builder.addEpsilonTransition(f.start(), f.accept());
            return f;
        } else if (node instanceof RegexNode.EmptySet) {
            // no path from entry to exit
            return new Fragment(newState(), newState());
        } else if (node instanceof RegexNode.Union) {
            final RegexNode.Union union = (RegexNode.Union) node;
            final Fragment left = build(union.left());
            final Fragment right = build(union.right());
            final Fragment f = new Fragment(newState(), newState());
            builder.addEpsilonTransition(f.start(), left.start())
                    .addEpsilonTransition(f.start(), right.start())
                    .addEpsilonTransition(left.accept(), f.accept())
                    .addEpsilonTransition(right.accept(), f.accept());
            return f;
        } else if (node instanceof RegexNode.Concat) {
            final RegexNode.Concat concat = (RegexNode.Concat) node;
            final Fragment first = build(concat.left());
            final Fragment second = build(concat.right());
            builder.addEpsilonTransition(first.accept(), second.start());
            return new Fragment(first.start(), second.accept());
        } else if (node instanceof RegexNode.Star) {
            return applyPostfix(build(((RegexNode.Star) node).inner()), '*');
        } else if (node instanceof RegexNode.Plus) {
            return applyPostfix(build(((RegexNode.Plus) node).inner()), '+');
        } else if (node instanceof RegexNode.Optional) {
            return applyPostfix(build(((RegexNode.Optional) node).inner()), '?');
        } else {
            final RegexNode.MultiOperator multi = (RegexNode.MultiOperator) node;
            Fragment f = build(multi.inner());
            for (char operator : multi.operators()) {
                f = applyPostfix(f, operator);
            }
            return f;
        }
    }

    private Fragment applyPostfix(Fragment inner, char operator) {
        final Fragment f = new Fragment(newState(), newState());
        // enter and exit
        builder.addEpsilonTransition(f.start(), inner.start())
                .addEpsilonTransition(inner.accept(), f.accept());
        if (operator != '+') {
            // bypass
            builder.addEpsilonTransition(f.start(), f.accept());
        }
        if (operator != '?') {
            // loop back
            builder.addEpsilonTransition(inner.accept(), inner.start());
        }
        return f;
    }

    private record Fragment(String start, String accept) { }

    /**
     * @param error - description of the syntax error, null when valid
     */
    public record RegexValidation(boolean valid, @Nullable String error) { }
}
