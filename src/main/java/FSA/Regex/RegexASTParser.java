package FSA.Regex;

import java.util.ArrayList;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Recursive-descent parser for the flat regex syntax:
 * <pre>
 *   Union   → Concat ('|' Union)?
 *   Concat  → Postfix Concat?
 *   Postfix → Atom ('*' | '+' | '?')*
 *   Atom    → Char | 'ε' | '∅' | '(' Union? ')'
 * </pre>
 * An empty alternative, such as the right side of {@code a|}, denotes the empty word.
 */
public final class RegexASTParser {
    private final String regex;
    private int pos;

    private RegexASTParser(String regex) {
        this.regex = regex;
    }

    /**
     * @throws RegexSyntaxException on a postfix operator without operand, a postfix operator right
     *         after '|', a missing ')' or unconsumed trailing input
     */
    public static RegexNode parse(String regex) {
        return new RegexASTParser(regex).parse();
    }

    private RegexNode parse() {
        if (regex.isEmpty()) {
            return new RegexNode.Epsilon();
        }
        if (isPostfix(regex.charAt(0))) {
            throw new RegexSyntaxException("Regex cannot start with '" + regex.charAt(0)
                    + "' - postfix operators require a preceding element", regex.charAt(0), 0);
        }
        final RegexNode result = parseUnion();
        if (pos < regex.length()) {
            throw new RegexSyntaxException("Unexpected character '" + regex.charAt(pos) + "' at position " + pos,
                    regex.charAt(pos), pos);
        }
        return result;
    }

    private @Nullable Character peek() {
        return pos < regex.length() ? regex.charAt(pos) : null;
    }

    private static boolean isPostfix(@Nullable Character c) {
        return c != null && (c == '*' || c == '+' || c == '?');
    }

    private RegexNode parseUnion() {
        final RegexNode left = parseConcat();
        if (peek() != null && peek() == '|') {
            pos++;
            if (isPostfix(peek())) {
                throw new RegexSyntaxException("Unexpected '" + peek() + "' after '|' at position " + pos, peek(), pos);
            }
            return new RegexNode.Union(left, parseUnion());
        }
        return left;
    }

    private RegexNode parseConcat() {
        final RegexNode left = parsePostfix();
        final Character next = peek();
        if (next != null && next != '|' && next != ')') {
            return new RegexNode.Concat(left, parseConcat());
        }
        return left;
    }

    private RegexNode parsePostfix() {
        final RegexNode inner = parseAtom();
        final List<Character> operators = new ArrayList<>();
        while (isPostfix(peek())) {
            operators.add(regex.charAt(pos++));
        }
        if (operators.isEmpty()) {
            return inner;
        }
        if (operators.size() > 1) {
            return new RegexNode.MultiOperator(inner, operators);
        }
        switch (operators.get(0)) {
            case '*':
                return new RegexNode.Star(inner);
            case '+':
                return new RegexNode.Plus(inner);
            default:
                return new RegexNode.Optional(inner);
        }
    }

    private RegexNode parseAtom() {
        final Character c = peek();
        if (c == null || c == '|' || c == ')') {
            return new RegexNode.Epsilon();
        }
        if (isPostfix(c)) {
            throw new RegexSyntaxException("Unexpected '" + c + "' at position " + pos
                    + " - postfix operators require a preceding element", c, pos);
        }
        pos++;
        switch (c) {
            case '(':
                if (peek() != null && peek() == ')') {
                    pos++;
                    return new RegexNode.EmptyGroup();
                }
                final RegexNode inner = parseUnion();
                if (peek() == null || peek() != ')') {
                    throw new RegexSyntaxException("Expected ')' at position " + pos, peek(), pos);
                }
                pos++;
                return inner;
            case RegexNode.EPSILON:
                return new RegexNode.Epsilon();
            case RegexNode.EMPTY_SET:
                return new RegexNode.EmptySet();
            default:
                return new RegexNode.Symbol(c);
        }
    }
}
