package io.txxt.structure.token;

import java.util.List;
import java.util.OptionalInt;

/**
 * Helpers over token sequences.
 */
public final class Tokens {

    private Tokens() {
    }

    public static boolean contentEquals(List<Token> left, List<Token> right) {
        return firstDifference(left, right).isEmpty();
    }

    /**
     * Index of the first position where the sequences differ in content, including a length mismatch.
     */
    public static OptionalInt firstDifference(List<Token> left, List<Token> right) {
        int shared = Math.min(left.size(), right.size());
        for (int i = 0; i < shared; i++) {
            if (!left.get(i).contentEquals(right.get(i))) {
                return OptionalInt.of(i);
            }
        }
        return left.size() == right.size() ? OptionalInt.empty() : OptionalInt.of(shared);
    }

    /**
     * Readable text of a token run: indentation and structure are dropped, newlines are kept,
     * and the result is trimmed.
     */
    public static String text(List<Token> tokens) {
        StringBuilder builder = new StringBuilder();
        for (Token token : tokens) {
            switch (token.kind()) {
                case NEWLINE -> builder.append('\n');
                case PARAMETER -> {
                    builder.append(token.text());
                    if (token.value() != null) {
                        builder.append('=').append(token.value());
                    }
                }
                case INDENT, DEDENT, INDENTATION, VERBATIM_WALL, BLANK_LINE, EOF -> {
                }
                default -> builder.append(token.text());
            }
        }
        return builder.toString().strip();
    }

    /**
     * Index of the first token that is not line indentation, or -1 when there is none.
     */
    public static int firstContentIndex(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            TokenKind kind = tokens.get(i).kind();
            if (kind != TokenKind.INDENTATION && kind != TokenKind.VERBATIM_WALL) {
                return i;
            }
        }
        return -1;
    }
}
