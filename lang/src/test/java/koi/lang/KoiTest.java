package koi.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class KoiTest {

    ByteArrayOutputStream out;
    ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) throws IOException {
        return runWithInput("", args);
    }

    private int runWithInput(String input, String... args) throws IOException {
        return Koi.run(args,
            new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static String lines(String... lines) {
        return String.join(System.lineSeparator(), lines) + System.lineSeparator();
    }

    @Test
    void printsTokens(@TempDir Path dir) throws IOException {
        var script = dir.resolve("hello.koi");
        Files.writeString(script, "say \"hi\"\n  x = 0x1F\n");

        assertEquals(0, run(script.toString()));
        assertEquals(
            lines(
                "(Token NAME \"say\" 0:0)",
                "(Token STRING \"hi\" 0:5)",
                "(Token OPEN_LEVEL 1:2)",
                "(Token NAME \"x\" 1:2)",
                "(Token ASSIGN 1:4)",
                "(Token INT 31 1:6)",
                "(Token CLOSE_LEVEL 2:0)",
                "(Token EOF 2:0)"),
            out.toString(StandardCharsets.UTF_8));
        assertEquals("", err.toString(StandardCharsets.UTF_8));
    }

    @Test
    void reportsLexicalError(@TempDir Path dir) throws IOException {
        var script = dir.resolve("bad.koi");
        Files.writeString(script, "x = 1\ny = $\n");

        assertEquals(Koi.EX_DATAERR, run(script.toString()));
        assertEquals(lines("(Token NAME \"x\" 0:0)", "(Token ASSIGN 0:2)", "(Token INT 1 0:4)"),
            out.toString(StandardCharsets.UTF_8));
        assertEquals(lines("lexer: lexical error at row 2, column 5"), err.toString(StandardCharsets.UTF_8));
    }

    @Test
    void readsStandardInput() throws IOException {
        assertEquals(0, runWithInput("if x\n  \"é\"\n", "-"));
        assertEquals(
            lines(
                "(Token IF 0:0)",
                "(Token NAME \"x\" 0:3)",
                "(Token OPEN_LEVEL 1:2)",
                "(Token STRING \"é\" 1:3)",
                "(Token CLOSE_LEVEL 2:0)",
                "(Token EOF 2:0)"),
            out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void usage() throws IOException {
        assertEquals(Koi.EX_USAGE, run());
        assertEquals(Koi.EX_USAGE, run("a.koi", "b.koi"));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Usage: koi"));
    }
}
