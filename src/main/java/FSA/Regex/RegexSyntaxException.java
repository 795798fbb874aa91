package FSA.Regex;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Malformed regular expression. Carries the offending character, or null at end of input, and
 * its index in the regex.
 */
public class RegexSyntaxException extends IllegalArgumentException {
    private final @Nullable Character offending;
    private final int position;

    public RegexSyntaxException(String message, @Nullable Character offending, int position) {
        super(message);
        this.offending = offending;
        this.position = position;
    }

    public @Nullable Character getOffending() {
        return offending;
    }

    public int getPosition() {
        return position;
    }
}
