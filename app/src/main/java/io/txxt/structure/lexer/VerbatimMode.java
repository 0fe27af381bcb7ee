package io.txxt.structure.lexer;

/**
 * Placement of verbatim content relative to its title.
 */
public enum VerbatimMode {
    /** Content indented deeper than the title. */
    IN_FLOW,
    /** Content at column 0 under an indented title. */
    STRETCHED,
    /** Closing label directly under the title, no content. */
    EMPTY
}
