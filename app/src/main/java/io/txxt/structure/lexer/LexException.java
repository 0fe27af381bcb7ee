package io.txxt.structure.lexer;

import io.txxt.structure.TxxtException;
import io.txxt.structure.token.Position;
import java.util.Objects;

/**
 * Fatal lexing failure: an unterminated verbatim block, an invalid escape or an invalid encoding boundary.
 */
public class LexException extends TxxtException {

    private final Position position;

    public LexException(String message, Position position) {
        super(message + " at " + describe(position));
        this.position = Objects.requireNonNull(position, "position");
    }

    public LexException(String message, Position position, Throwable cause) {
        super(message + " at " + describe(position), cause);
        this.position = Objects.requireNonNull(position, "position");
    }

    public Position position() {
        return position;
    }

    private static String describe(Position position) {
        return "line " + (position.row() + 1) + ", byte " + position.column();
    }
}
