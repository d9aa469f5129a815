package koi.lang;

import static koi.lang.Token.Kind.CLOSE_LEVEL;
import static koi.lang.Token.Kind.EOF;
import static koi.lang.Token.Kind.LINE;
import static koi.lang.Token.Kind.OPEN_LEVEL;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

import lombok.extern.flogger.Flogger;

/**
 * Fourth stage: turns the leading whitespace of every row into
 * {@code OPEN_LEVEL} and {@code CLOSE_LEVEL} tokens.
 *
 * <p>The stack of open widths is strictly increasing from a bottom of 0, and
 * each non-zero entry matches one {@code OPEN_LEVEL} not yet closed. Only
 * lines starting a row (column 0) are measured; the text following a string
 * literal on the same row passes through untouched, as do the strings.
 */
@Flogger
final class IndentationTracker extends Pass {

    private final Deque<Integer> levels = new ArrayDeque<>();
    private boolean first = true;

    IndentationTracker(Iterator<Token> upstream) {
        super(upstream);
        levels.push(0);
    }

    @Override
    protected void process(Token token) {
        if (token.is(EOF)) {
            closeAll(token.position());
            emit(token);
            finish();
            return;
        }
        if (!token.is(LINE) || token.column() != 0) {
            emit(token);
            return;
        }

        var text = token.text();
        var width = leadingWhitespace(text);
        var position = token.position().shift(width);

        if (first && width != 0) {
            log.atFine().log("source starts indented by %d", width);
            throw new LexException(position);
        }
        first = false;

        int top = levels.peek();
        if (width > top) {
            levels.push(width);
            log.atFinest().log("opened level %d at %s", width, position);
            emit(Token.of(OPEN_LEVEL, position));
        } else if (width < top) {
            if (!levels.contains(width)) {
                log.atFine().log("dedent to %d matches no open level %s", width, levels);
                throw new LexException(position);
            }
            while (levels.peek() != width) {
                levels.pop();
                emit(Token.of(CLOSE_LEVEL, position));
            }
            log.atFinest().log("closed down to level %d at %s", width, position);
        }
        emit(Token.line(text.substring(width), position));
    }

    private void closeAll(Position position) {
        while (levels.peek() != 0) {
            levels.pop();
            emit(Token.of(CLOSE_LEVEL, position));
        }
    }

    private static int leadingWhitespace(String text) {
        var width = 0;
        while (width < text.length() && Character.isWhitespace(text.charAt(width))) {
            width++;
        }
        return width;
    }
}
