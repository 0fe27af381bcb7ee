package io.txxt.structure.block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered children of a block. Subclasses decide which blocks they accept.
 */
public abstract class Container {

    private final List<Block> children = new ArrayList<>();

    public abstract ContainerKind kind();

    /**
     * Appends a child.
     *
     * @throws ContainerInvariantException when this container does not accept the child's kind
     */
    public void addChild(Block child) {
        Objects.requireNonNull(child, "child");
        if (!accepts(child)) {
            throw new ContainerInvariantException(child);
        }
        children.add(child);
    }

    public List<Block> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    protected abstract boolean accepts(Block child);
}
