package io.txxt.structure.token;

/**
 * Zero-indexed location in a source document. The column is a UTF-8 byte offset within the row.
 */
public record Position(int row, int column) implements Comparable<Position> {

    public static final Position ORIGIN = new Position(0, 0);

    public Position {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("Position must not be negative: " + row + ":" + column);
        }
    }

    @Override
    public int compareTo(Position other) {
        int byRow = Integer.compare(row, other.row);
        return byRow != 0 ? byRow : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return row + ":" + column;
    }
}
