package io.txxt.structure.token;

import java.util.Objects;

/**
 * Immutable lexical token. Only the fields matching the kind's payload are populated.
 *
 * @param kind token kind
 * @param span source range covered by the token
 * @param text literal or semantic text; the canonical spelling for fixed kinds, empty for structural kinds,
 *             the key for parameters and the marker text for sequence markers
 * @param sequenceMarker parsed marker, present only for {@link TokenKind#SEQUENCE_MARKER}
 * @param value parameter value, {@code null} for boolean shorthand and for every other kind
 */
public record Token(TokenKind kind, SourceSpan span, String text, SequenceMarker sequenceMarker, String value) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(text, "text");
        switch (kind.payload()) {
            case MARKER -> {
                Objects.requireNonNull(sequenceMarker, "sequenceMarker");
                if (!text.equals(sequenceMarker.text())) {
                    throw new IllegalArgumentException("marker token text must equal the marker text");
                }
            }
            case PARAMETER -> {
                if (text.isBlank()) {
                    throw new IllegalArgumentException("parameter key must not be blank");
                }
            }
            case TEXT -> {
                if (sequenceMarker != null || value != null) {
                    throw new IllegalArgumentException(kind + " carries text only");
                }
            }
            case NONE -> {
                String expected = kind.literal() == null ? "" : kind.literal();
                if (!text.equals(expected) || sequenceMarker != null || value != null) {
                    throw new IllegalArgumentException(kind + " carries no payload");
                }
            }
        }
    }

    public static Token of(TokenKind kind, SourceSpan span) {
        return new Token(kind, span, kind.literal() == null ? "" : kind.literal(), null, null);
    }

    public static Token ofText(TokenKind kind, SourceSpan span, String text) {
        if (!kind.carriesText()) {
            throw new IllegalArgumentException(kind + " does not carry text");
        }
        return new Token(kind, span, text, null, null);
    }

    public static Token marker(SourceSpan span, SequenceMarker marker) {
        return new Token(TokenKind.SEQUENCE_MARKER, span, marker.text(), marker, null);
    }

    public static Token parameter(SourceSpan span, String key, String value) {
        return new Token(TokenKind.PARAMETER, span, key, null, value);
    }

    public boolean is(TokenKind candidate) {
        return kind == candidate;
    }

    /**
     * Compares kind and payload, ignoring the span.
     */
    public boolean contentEquals(Token other) {
        return other != null
                && kind == other.kind
                && text.equals(other.text)
                && Objects.equals(sequenceMarker, other.sequenceMarker)
                && Objects.equals(value, other.value);
    }
}
