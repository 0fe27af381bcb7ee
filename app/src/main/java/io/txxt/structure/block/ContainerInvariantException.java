package io.txxt.structure.block;

import io.txxt.structure.TxxtException;

/**
 * Raised when a session block is inserted into a content container.
 */
public class ContainerInvariantException extends TxxtException {

    private final Block rejected;

    public ContainerInvariantException(Block rejected) {
        super("A " + rejected.kind().displayName() + " block (lines " + (rejected.lines().first() + 1) + "-"
                + (rejected.lines().last() + 1) + ") cannot be nested inside a content container");
        this.rejected = rejected;
    }

    public Block rejected() {
        return rejected;
    }
}
