package koi.lang;

import lombok.Getter;
import lombok.NonNull;

/**
 * Raised by a pipeline stage that cannot make sense of its input. The stage
 * that threw is finished; it produces no further tokens.
 */
public class LexException extends RuntimeException {
    @Getter
    private final Position position;

    LexException(@NonNull Position position) {
        super("lexical error at row " + (position.row() + 1) + ", column " + (position.column() + 1));
        this.position = position;
    }
}
