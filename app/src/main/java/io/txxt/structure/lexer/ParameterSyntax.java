package io.txxt.structure.lexer;

/**
 * Key grammar and canonical serialization shared by the parameter scanner and the detokenizer.
 */
public final class ParameterSyntax {

    private ParameterSyntax() {
    }

    /**
     * End index of the key starting at {@code from}, or {@code from} when no key starts there.
     * Keys start with a letter or underscore, continue with letters, digits, {@code _ - .} and never end with a period.
     */
    static int keyEnd(String text, int from) {
        if (from >= text.length()) {
            return from;
        }
        char first = text.charAt(from);
        if (!Character.isLetter(first) && first != '_') {
            return from;
        }
        int end = from + 1;
        while (end < text.length() && isKeyPart(text.charAt(end))) {
            end++;
        }
        while (end > from + 1 && text.charAt(end - 1) == '.') {
            end--;
        }
        return end;
    }

    public static String format(String key, String value) {
        if (value == null) {
            return key;
        }
        return key + '=' + (needsQuoting(value) ? quote(value) : value);
    }

    static boolean needsQuoting(String value) {
        if (value.isEmpty()) {
            return true;
        }
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (Character.isWhitespace(ch) || ch < 0x20 || ",=:\"\\".indexOf(ch) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static String quote(String value) {
        StringBuilder quoted = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '"' -> quoted.append("\\\"");
                case '\\' -> quoted.append("\\\\");
                case '\n' -> quoted.append("\\n");
                case '\t' -> quoted.append("\\t");
                case '\r' -> quoted.append("\\r");
                default -> quoted.append(ch);
            }
        }
        return quoted.append('"').toString();
    }

    private static boolean isKeyPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '-' || ch == '.';
    }
}
