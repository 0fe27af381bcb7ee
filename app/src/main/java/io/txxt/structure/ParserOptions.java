package io.txxt.structure;

/**
 * Width settings shared by the lexer and the detokenizer.
 *
 * @param tabWidth columns a tab contributes to a line's indentation width
 * @param indentWidth spaces the detokenizer emits per nesting level
 */
public record ParserOptions(int tabWidth, int indentWidth) {

    public static final int DEFAULT_TAB_WIDTH = 4;
    public static final int DEFAULT_INDENT_WIDTH = 4;

    public ParserOptions {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tabWidth must be positive");
        }
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be positive");
        }
    }

    public static ParserOptions defaults() {
        return new ParserOptions(DEFAULT_TAB_WIDTH, DEFAULT_INDENT_WIDTH);
    }

    /**
     * Computes the indentation width of the first {@code length} characters of {@code text}.
     */
    public int widthOf(CharSequence text, int length) {
        int width = 0;
        for (int i = 0; i < length; i++) {
            width += text.charAt(i) == '\t' ? tabWidth : 1;
        }
        return width;
    }
}
