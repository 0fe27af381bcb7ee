package io.txxt.structure.token;

import java.util.Objects;

/**
 * List item marker keeping both the authored text and its parsed value.
 *
 * @param style numbering style
 * @param value parsed ordinal; zero for plain markers
 * @param text marker exactly as written, for example {@code "-"}, {@code "3."} or {@code "iv)"}
 */
public record SequenceMarker(MarkerStyle style, int value, String text) {

    public SequenceMarker {
        Objects.requireNonNull(style, "style");
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
        if (value < 0) {
            throw new IllegalArgumentException("value must not be negative");
        }
    }

    public boolean isOrdered() {
        return style != MarkerStyle.PLAIN;
    }
}
