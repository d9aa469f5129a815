package koi.lang;

import static koi.lang.Token.Kind.EOF;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Lookahead cursor over a token stream. Tokens are pulled from upstream only
 * as far as a caller looks ahead, and dropped once stepped over.
 */
@RequiredArgsConstructor
public final class TokenStream {

    private final @NonNull Iterator<Token> tokens;

    private final Deque<Token> buffer = new ArrayDeque<>();
    private Token last = null;

    public Token peek() {
        return lookahead(0);
    }

    /**
     * The token {@code distance} places ahead, not consumed.
     *
     * @throws IllegalStateException when looking past {@code EOF}
     */
    public Token lookahead(int distance) {
        if (distance < 0) {
            throw new IllegalArgumentException("negative lookahead: " + distance);
        }
        while (buffer.size() <= distance) {
            if (last != null && last.is(EOF)) {
                throw new IllegalStateException("lookahead past " + last);
            }
            last = tokens.next();
            buffer.add(last);
        }
        if (distance == 0) {
            return buffer.peekFirst();
        }
        var it = buffer.iterator();
        for (int i = 0; i < distance; i++) {
            it.next();
        }
        return it.next();
    }

    public boolean isAtEnd() {
        return peek().is(EOF);
    }

    public Token forward() {
        peek();
        return buffer.poll();
    }

    /**
     * Steps over the next token, which must be of the {@code expected} kind.
     *
     * @throws ParseException carrying the next token when it is not
     */
    public Token forward(@NonNull Token.Kind expected) {
        var token = peek();
        if (!token.is(expected)) {
            throw new ParseException(token);
        }
        return buffer.poll();
    }
}
