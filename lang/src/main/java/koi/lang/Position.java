package koi.lang;

/**
 * Zero-based location of a character in the original source text.
 */
public record Position(int row, int column) {

    public static final Position START = new Position(0, 0);

    public Position shift(int columns) {
        return new Position(row, column + columns);
    }

    @Override
    public String toString() {
        return row + ":" + column;
    }
}
