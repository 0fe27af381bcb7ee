package io.txxt.structure.token;

/**
 * Closed set of token kinds produced by the lexer.
 */
public enum TokenKind {
    TEXT(Payload.TEXT, null),
    WHITESPACE(Payload.TEXT, null),
    NEWLINE(Payload.NONE, null),
    BLANK_LINE(Payload.NONE, null),
    INDENT(Payload.NONE, null),
    DEDENT(Payload.NONE, null),
    /** Leading whitespace of a logical line (the wall). */
    INDENTATION(Payload.NONE, null),
    SEQUENCE_MARKER(Payload.MARKER, null),
    TXXT_MARKER(Payload.NONE, "::"),
    IDENTIFIER(Payload.TEXT, null),
    COLON(Payload.NONE, ":"),
    COMMA(Payload.NONE, ","),
    PARAMETER(Payload.PARAMETER, null),
    LEFT_BRACKET(Payload.NONE, "["),
    RIGHT_BRACKET(Payload.NONE, "]"),
    LEFT_PAREN(Payload.NONE, "("),
    RIGHT_PAREN(Payload.NONE, ")"),
    BOLD_DELIMITER(Payload.NONE, "*"),
    ITALIC_DELIMITER(Payload.NONE, "_"),
    CODE_DELIMITER(Payload.NONE, "`"),
    MATH_DELIMITER(Payload.NONE, "#"),
    VERBATIM_TITLE(Payload.TEXT, null),
    /** Indentation stripped from a verbatim content line. */
    VERBATIM_WALL(Payload.NONE, null),
    VERBATIM_CONTENT(Payload.TEXT, null),
    VERBATIM_LABEL(Payload.TEXT, null),
    EOF(Payload.NONE, null);

    enum Payload {
        NONE,
        TEXT,
        MARKER,
        PARAMETER
    }

    private final Payload payload;
    private final String literal;

    TokenKind(Payload payload, String literal) {
        this.payload = payload;
        this.literal = literal;
    }

    Payload payload() {
        return payload;
    }

    /**
     * Canonical source text of fixed-spelling kinds, or {@code null} when the kind has no fixed spelling.
     */
    public String literal() {
        return literal;
    }

    public boolean carriesText() {
        return payload == Payload.TEXT;
    }

    public boolean isStructural() {
        return payload == Payload.NONE && literal == null;
    }

    public static TokenKind forDelimiter(char ch) {
        return switch (ch) {
            case '[' -> LEFT_BRACKET;
            case ']' -> RIGHT_BRACKET;
            case '(' -> LEFT_PAREN;
            case ')' -> RIGHT_PAREN;
            case '*' -> BOLD_DELIMITER;
            case '_' -> ITALIC_DELIMITER;
            case '`' -> CODE_DELIMITER;
            case '#' -> MATH_DELIMITER;
            case ':' -> COLON;
            case ',' -> COMMA;
            default -> null;
        };
    }
}
