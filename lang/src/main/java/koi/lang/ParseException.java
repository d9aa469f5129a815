package koi.lang;

import lombok.Getter;
import lombok.NonNull;

public class ParseException extends RuntimeException {
    @Getter
    private final Token token;

    ParseException(@NonNull Token token) {
        super("unexpected " + token);
        this.token = token;
    }
}
