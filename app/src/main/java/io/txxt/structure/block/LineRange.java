package io.txxt.structure.block;

/**
 * Inclusive range of zero-indexed source rows.
 */
public record LineRange(int first, int last) {

    public LineRange {
        if (first < 0 || last < first) {
            throw new IllegalArgumentException("Invalid line range " + first + ".." + last);
        }
    }

    public LineRange span(LineRange other) {
        return new LineRange(Math.min(first, other.first), Math.max(last, other.last));
    }

    @Override
    public String toString() {
        return first + ".." + last;
    }
}
