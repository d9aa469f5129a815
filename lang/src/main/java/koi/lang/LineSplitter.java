package koi.lang;

import static koi.lang.Token.Kind.EOF;

import com.google.common.collect.AbstractIterator;

import lombok.NonNull;

/**
 * First stage: one {@code LINE} token per physical line, terminator
 * included, followed by a single {@code EOF}.
 */
final class LineSplitter extends AbstractIterator<Token> {

    private final String source;

    private int current = 0;
    private int row = 0;
    private boolean done = false;

    LineSplitter(@NonNull String source) {
        this.source = source;
    }

    @Override
    protected Token computeNext() {
        if (done) {
            return endOfData();
        }
        if (current >= source.length()) {
            done = true;
            return Token.of(EOF, eofPosition());
        }

        var start = current;
        current = endOfLine(start);
        return Token.line(source.substring(start, current), new Position(row++, 0));
    }

    /** Index just past the terminator of the line starting at {@code start}. */
    private int endOfLine(int start) {
        for (int i = start; i < source.length(); i++) {
            var c = source.charAt(i);
            if (c == '\n') {
                return i + 1;
            }
            if (c == '\r') {
                var crlf = i + 1 < source.length() && source.charAt(i + 1) == '\n';
                return crlf ? i + 2 : i + 1;
            }
        }
        return source.length();
    }

    private Position eofPosition() {
        if (source.isEmpty()) {
            return Position.START;
        }
        var last = source.charAt(source.length() - 1);
        if (last == '\n' || last == '\r') {
            return new Position(row, 0);
        }
        // the last line has no terminator, so it is row - 1
        var lineStart = Math.max(source.lastIndexOf('\n'), source.lastIndexOf('\r')) + 1;
        return new Position(row - 1, source.length() - lineStart);
    }
}
