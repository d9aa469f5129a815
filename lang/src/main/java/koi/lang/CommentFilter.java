package koi.lang;

import static koi.lang.Token.Kind.EOF;
import static koi.lang.Token.Kind.LINE;
import static koi.lang.Token.Kind.STRING;

import java.util.Iterator;

import lombok.NonNull;
import lombok.extern.flogger.Flogger;

/**
 * Third stage: truncates {@code LINE} tokens at the comment marker, trims
 * trailing whitespace and drops whatever is left blank.
 */
@Flogger
final class CommentFilter extends Pass {

    private final LexerConfig config;

    // row whose remainder is commented out, or -1
    private int commentRow = -1;

    // blank start of a row, kept only if a string follows on that row
    private Token held = null;

    CommentFilter(Iterator<Token> upstream, @NonNull LexerConfig config) {
        super(upstream);
        this.config = config;
    }

    @Override
    protected void process(Token token) {
        if (held != null) {
            if (token.is(STRING) && token.row() == held.row()) {
                emit(held);
            }
            held = null;
        }

        if (token.row() == commentRow && !token.is(EOF)) {
            log.atFinest().log("dropping commented %s", token);
            return;
        }
        if (!token.is(LINE)) {
            emit(token);
            return;
        }

        var text = token.text();
        var cut = config.indexOfUnescaped(text, config.getComment(), 0);
        if (cut >= 0) {
            commentRow = token.row();
            text = text.substring(0, cut);
        }

        var stripped = text.stripTrailing();
        if (!stripped.isEmpty()) {
            emit(token.withValue(stripped));
        } else if (cut < 0 && token.column() == 0 && !endsWithTerminator(text)) {
            held = token;
        }
    }

    private static boolean endsWithTerminator(String text) {
        return text.endsWith("\n") || text.endsWith("\r");
    }
}
