package io.txxt.structure.block;

/**
 * Children of the root or of a session. Accepts every block kind, nested sessions included.
 */
public class SessionContainer extends Container {

    @Override
    public ContainerKind kind() {
        return ContainerKind.SESSION;
    }

    @Override
    protected boolean accepts(Block child) {
        return true;
    }
}
