package koi.lang;

import static koi.lang.Token.Kind.EOF;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class LineSplitterTest {

    private static List<Token> split(String source) {
        return ImmutableList.copyOf(new LineSplitter(source));
    }

    private static Token line(String text, int row) {
        return Token.line(text, new Position(row, 0));
    }

    private static Token eof(int row, int column) {
        return Token.of(EOF, new Position(row, column));
    }

    @Test
    void keepsLineTerminators() {
        assertEquals(
            List.of(line("hello\n", 0), line("cowsay", 1), eof(1, 6)),
            split("hello\ncowsay"));
    }

    @Test
    void eofAfterTrailingLineBreak() {
        assertEquals(
            List.of(line("hello\n", 0), line("cowsay\n", 1), eof(2, 0)),
            split("hello\ncowsay\n"));
    }

    @Test
    void emptyLinesAreStillLines() {
        assertEquals(
            List.of(line("hello\n", 0), line("\n", 1), line("cowsay", 2), eof(2, 6)),
            split("hello\n\ncowsay"));
    }

    @Test
    void emptySource() {
        assertEquals(List.of(eof(0, 0)), split(""));
    }

    @Test
    void carriageReturns() {
        assertEquals(
            List.of(line("a\r\n", 0), line("b\r", 1), line("c", 2), eof(2, 1)),
            split("a\r\nb\rc"));
        assertEquals(
            List.of(line("a\r\n", 0), eof(1, 0)),
            split("a\r\n"));
    }

    @Test
    void singleEof() {
        var lines = new LineSplitter("x");
        lines.next();
        assertEquals(eof(0, 1), lines.next());
        assertFalse(lines.hasNext());
    }
}
