package koi.lang;

import static koi.lang.Token.Kind.EOF;
import static koi.lang.Token.Kind.LINE;
import static koi.lang.Token.Kind.STRING;

import java.util.Iterator;

import lombok.NonNull;
import lombok.extern.flogger.Flogger;

/**
 * Second stage: cuts quoted text out of {@code LINE} tokens. A literal may
 * run over several lines; its {@code STRING} token sits at the first
 * character after the opening quote and holds the raw text up to the closing
 * one, line terminators included and escapes left in place.
 */
@Flogger
final class StringExtractor extends Pass {

    private final LexerConfig config;

    // the literal being read, or null outside of one
    private StringBuilder literal = null;
    private Position literalStart = null;

    StringExtractor(Iterator<Token> upstream, @NonNull LexerConfig config) {
        super(upstream);
        this.config = config;
    }

    @Override
    protected void process(Token token) {
        if (token.is(EOF) && literal != null) {
            log.atFine().log("string opened at %s is never closed", literalStart);
            throw new LexException(token.position());
        }
        if (!token.is(LINE)) {
            emit(token);
            return;
        }

        var text = token.text();
        var position = token.position();
        var index = 0;
        while (index < text.length() || literal == null && index == 0) {
            if (literal != null) {
                var close = config.indexOfUnescaped(text, config.getQuote(), index);
                if (close < 0) {
                    literal.append(text, index, text.length());
                    return;
                }
                literal.append(text, index, close);
                closeLiteral();
                index = close + 1;
            } else {
                var open = config.indexOfUnescaped(text, config.getQuote(), index);
                if (open < 0) {
                    emitFragment(text, index, text.length(), position);
                    return;
                }
                emitFragment(text, index, open, position);
                literal = new StringBuilder();
                literalStart = position.shift(open + 1);
                index = open + 1;
            }
        }
    }

    private void closeLiteral() {
        var value = literal.toString();
        log.atFinest().log("string at %s closed after %d chars", literalStart, value.length());
        emit(new Token(STRING, literalStart, value));
        literal = null;
        literalStart = null;
    }

    /**
     * Emits {@code text[start, end)} as a {@code LINE}. Empty fragments are
     * skipped, except at the start of a row, which always begins with a line.
     */
    private void emitFragment(String text, int start, int end, Position position) {
        var rowStart = start == 0 && position.column() == 0;
        if (end > start || rowStart) {
            emit(Token.line(text.substring(start, end), position.shift(start)));
        }
    }
}
