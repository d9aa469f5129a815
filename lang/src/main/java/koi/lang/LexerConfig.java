package koi.lang;

import lombok.Builder;
import lombok.Value;

/**
 * The marker characters the pipeline recognizes.
 */
@Value
public class LexerConfig {

    public static final LexerConfig DEFAULT = LexerConfig.builder().build();

    char quote;
    char escape;
    char comment;

    @Builder
    private LexerConfig(char quote, char escape, char comment) {
        if (quote == escape || quote == comment || escape == comment) {
            throw new IllegalArgumentException("quote, escape and comment markers must differ");
        }
        if (Character.isWhitespace(quote) || Character.isWhitespace(escape) || Character.isWhitespace(comment)) {
            throw new IllegalArgumentException("markers must not be whitespace");
        }
        this.quote = quote;
        this.escape = escape;
        this.comment = comment;
    }

    public static class LexerConfigBuilder {
        private char quote = '"';
        private char escape = '\\';
        private char comment = ';';
    }

    /**
     * Whether {@code text.charAt(index)} is preceded by the escape marker.
     */
    boolean isEscaped(CharSequence text, int index) {
        return index > 0 && text.charAt(index - 1) == escape;
    }

    /**
     * Index of the first {@code marker} at or after {@code from} that is not
     * escaped, or -1.
     */
    int indexOfUnescaped(CharSequence text, char marker, int from) {
        for (int i = from; i < text.length(); i++) {
            if (text.charAt(i) == marker && !isEscaped(text, i)) {
                return i;
            }
        }
        return -1;
    }
}
