package io.txxt.structure.config;

/**
 * What the command line prints for each structured document.
 */
public enum OutputMode {
    /** Indented block tree. */
    TREE,
    /** One line per token. */
    TOKENS,
    /** Source text rebuilt from the block tree. */
    DETOKENIZE,
    /** Round-trip check result. */
    VERIFY;

    public static OutputMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TREE;
        }
        for (OutputMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported output mode: " + raw);
    }
}
