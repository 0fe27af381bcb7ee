package io.txxt.structure.tree;

import io.txxt.structure.TxxtException;
import io.txxt.structure.token.Position;
import java.util.Objects;

/**
 * Fatal indentation failure: a dedent to an unknown width, an unmatched dedent or a level left open at end of input.
 */
public class StructuralException extends TxxtException {

    private final Position position;

    public StructuralException(String message, Position position) {
        super(message + " at line " + (position.row() + 1));
        this.position = Objects.requireNonNull(position, "position");
    }

    public Position position() {
        return position;
    }
}
