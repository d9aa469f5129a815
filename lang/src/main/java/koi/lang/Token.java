package koi.lang;

import lombok.NonNull;
import lombok.With;

/**
 * An immutable lexical unit. {@code value} holds the raw text of a
 * {@link Kind#LINE}, the contents of a {@link Kind#STRING}, the text of a
 * {@link Kind#NAME} or the {@link java.math.BigInteger} of an {@link Kind#INT};
 * it is {@code null} for every other kind.
 */
@With
public record Token(
    @NonNull Kind kind,
    @NonNull Position position,
    Object value) {

    public static Token of(Kind kind, Position position) {
        return new Token(kind, position, null);
    }

    public static Token line(String text, Position position) {
        return new Token(Kind.LINE, position, text);
    }

    public boolean is(Kind kind) {
        return this.kind == kind;
    }

    public String text() {
        return (String) value;
    }

    public int row() {
        return position.row();
    }

    public int column() {
        return position.column();
    }

    @Override
    public String toString() {
        var valueTag = value == null ? ""
            : value instanceof String ? " \"" + value + "\"" : " " + value;
        return "(Token " + kind + valueTag + " " + position + ")";
    }

    public enum Kind {
        // produced by the pipeline stages
        LINE,
        EOF,
        STRING,
        OPEN_LEVEL,
        CLOSE_LEVEL,

        // literals
        NAME,
        INT,

        // keywords
        IF,
        ELSE,
        WHILE,
        RETURN,

        // operators
        ARROW,
        EQUAL,
        NOT_EQUAL,
        LESS_EQUAL,
        GREATER_EQUAL,
        ASSIGN,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        LESS,
        GREATER,
        COMMA,
        COLON,
        PAREN_LEFT,
        PAREN_RIGHT;
    }
}
