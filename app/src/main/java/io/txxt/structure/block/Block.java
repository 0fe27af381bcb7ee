package io.txxt.structure.block;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A classified block: its type, the container of its indented children when it has any, and its source rows.
 */
public record Block(BlockType type, Optional<Container> container, LineRange lines, int indentLevel) {

    public Block {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(lines, "lines");
        if (indentLevel < 0) {
            throw new IllegalArgumentException("indentLevel must not be negative");
        }
    }

    public BlockKind kind() {
        return type.kind();
    }

    public List<Block> children() {
        return container.map(Container::children).orElse(List.of());
    }

    public <T extends BlockType> T typeAs(Class<T> expected) {
        if (!expected.isInstance(type)) {
            throw new IllegalStateException("Expected " + expected.getSimpleName() + " but block is " + kind());
        }
        return expected.cast(type);
    }
}
