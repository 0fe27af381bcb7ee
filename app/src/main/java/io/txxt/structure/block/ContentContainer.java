package io.txxt.structure.block;

/**
 * Children of a non-session block. Sessions are rejected.
 */
public class ContentContainer extends Container {

    @Override
    public ContainerKind kind() {
        return ContainerKind.CONTENT;
    }

    @Override
    protected boolean accepts(Block child) {
        return child.kind() != BlockKind.SESSION;
    }
}
