package koi.lang;

import static lombok.AccessLevel.PRIVATE;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import lombok.RequiredArgsConstructor;
import lombok.extern.flogger.Flogger;

/**
 * Prints the tokens of a Koi source file, one per line.
 */
@Flogger
@RequiredArgsConstructor(access = PRIVATE)
public class Koi {

    static final int EX_USAGE = 64;
    static final int EX_DATAERR = 65;

    public static void main(String[] args) throws IOException {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) throws IOException {
        if (args.length != 1) {
            err.println("Usage: koi <script>");
            return EX_USAGE;
        }

        var path = args[0];
        byte[] bytes;
        if ("-".equals(path)) {
            bytes = in.readAllBytes();
        } else {
            bytes = Files.readAllBytes(Paths.get(path));
        }
        return print(new String(bytes, StandardCharsets.UTF_8), out, err);
    }

    static int print(String source, PrintStream out, PrintStream err) {
        var tokens = new Lexer().tokenize(source);
        try {
            tokens.forEachRemaining(out::println);
        } catch (LexException ex) {
            log.atWarning().log("tokenizing stopped at %s", ex.getPosition());
            err.println("lexer: " + ex.getMessage());
            return EX_DATAERR;
        }
        return 0;
    }
}
