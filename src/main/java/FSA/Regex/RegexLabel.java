package FSA.Regex;

import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Edge label of a {@link RegexAutomaton}: regex text synthesized during state elimination.
 * Labels are only combined, never parsed.
 */
public final class RegexLabel {
    public static final RegexLabel EPSILON = new RegexLabel(String.valueOf(RegexNode.EPSILON));

    private final String text;

    private RegexLabel(String text) {
        this.text = text;
    }

    public static RegexLabel symbol(String symbol) {
        return symbol.isEmpty() ? EPSILON : new RegexLabel(symbol);
    }

    public boolean isEpsilon() {
        return this.equals(EPSILON);
    }

    /**
     * {@code (this|other)}; the parentheses keep the union intact under later concatenation.
     */
    public RegexLabel union(RegexLabel other) {
        return new RegexLabel("(" + text + "|" + other.text + ")");
    }

    /**
     * {@code in·(loop)*·out}, leaving out epsilon factors. The loop is parenthesized unless it is a
     * single symbol; a missing or epsilon loop contributes nothing.
     */
    public static RegexLabel eliminate(RegexLabel in, @Nullable RegexLabel loop, RegexLabel out) {
        final StringBuilder sb = new StringBuilder();
        if (!in.isEpsilon()) {
            sb.append(in.text);
        }
        if (loop != null && !loop.isEpsilon()) {
            if (loop.text.contains("|") || loop.text.length() > 1) {
                sb.append('(').append(loop.text).append(")*");
            } else {
                sb.append(loop.text).append('*');
            }
        }
        if (!out.isEpsilon()) {
            sb.append(out.text);
        }
        return sb.length() == 0 ? EPSILON : new RegexLabel(sb.toString());
    }

    public String text() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RegexLabel)) {
            return false;
        }
        return text.equals(((RegexLabel) o).text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
