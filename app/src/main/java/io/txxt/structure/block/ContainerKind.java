package io.txxt.structure.block;

/**
 * The two child-holding container kinds.
 */
public enum ContainerKind {
    CONTENT,
    SESSION
}
