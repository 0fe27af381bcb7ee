package io.txxt.structure.token;

import java.util.Objects;

/**
 * Half-open range of source positions, start inclusive and end exclusive.
 */
public record SourceSpan(Position start, Position end) {

    public SourceSpan {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.compareTo(start) < 0) {
            throw new IllegalArgumentException("Span end " + end + " precedes start " + start);
        }
    }

    public static SourceSpan empty(Position at) {
        return new SourceSpan(at, at);
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
