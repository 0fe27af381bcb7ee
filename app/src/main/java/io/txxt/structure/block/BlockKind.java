package io.txxt.structure.block;

/**
 * Kinds of structural blocks.
 */
public enum BlockKind {
    ROOT,
    BLANK_LINE,
    ANNOTATION,
    DEFINITION,
    VERBATIM,
    LIST_ITEM,
    LIST,
    SESSION,
    PARAGRAPH;

    public String displayName() {
        StringBuilder builder = new StringBuilder();
        for (String part : name().split("_")) {
            builder.append(part.charAt(0)).append(part.substring(1).toLowerCase());
        }
        return builder.toString();
    }
}
