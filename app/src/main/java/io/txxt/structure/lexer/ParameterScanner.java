package io.txxt.structure.lexer;

import io.txxt.structure.token.Position;
import io.txxt.structure.token.SourceSpan;
import io.txxt.structure.token.Token;
import io.txxt.structure.token.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scans a {@code key=value,key2="quoted, value",flag} parameter list into Parameter, Comma and Whitespace tokens.
 * Returns empty when the text is not a well-formed parameter list.
 */
public class ParameterScanner {

    /**
     * @param raw parameter text without leading or trailing context
     * @param start position of the first character of {@code raw}, on a single row
     */
    public Optional<List<Token>> scan(String raw, Position start) {
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        Cursor cursor = new Cursor(raw, start);
        List<Token> tokens = new ArrayList<>();
        while (true) {
            if (!cursor.readParameter(tokens)) {
                return Optional.empty();
            }
            cursor.readWhitespace(tokens);
            if (cursor.atEnd()) {
                return Optional.of(List.copyOf(tokens));
            }
            if (cursor.peek() != ',') {
                return Optional.empty();
            }
            tokens.add(Token.of(TokenKind.COMMA, cursor.span(cursor.index, cursor.index + 1)));
            cursor.index++;
            cursor.readWhitespace(tokens);
        }
    }

    private static final class Cursor {

        private final String raw;
        private final Position start;
        private final int[] columns;
        private int index;

        private Cursor(String raw, Position start) {
            this.raw = raw;
            this.start = start;
            this.columns = new int[raw.length() + 1];
            int bytes = 0;
            for (int i = 0; i < raw.length(); i++) {
                columns[i] = bytes;
                char ch = raw.charAt(i);
                if (Character.isHighSurrogate(ch) || Character.isLowSurrogate(ch)) {
                    bytes += 2;
                } else {
                    bytes += ch < 0x80 ? 1 : ch < 0x800 ? 2 : 3;
                }
            }
            columns[raw.length()] = bytes;
        }

        boolean atEnd() {
            return index >= raw.length();
        }

        char peek() {
            return raw.charAt(index);
        }

        SourceSpan span(int from, int to) {
            return new SourceSpan(
                    new Position(start.row(), start.column() + columns[from]),
                    new Position(start.row(), start.column() + columns[to]));
        }

        void readWhitespace(List<Token> tokens) {
            int from = index;
            while (!atEnd() && SourceLine.isInlineWhitespace(peek())) {
                index++;
            }
            if (index > from) {
                tokens.add(Token.ofText(TokenKind.WHITESPACE, span(from, index), raw.substring(from, index)));
            }
        }

        boolean readParameter(List<Token> tokens) {
            int from = index;
            int keyEnd = ParameterSyntax.keyEnd(raw, index);
            if (keyEnd == index) {
                return false;
            }
            String key = raw.substring(index, keyEnd);
            index = keyEnd;
            if (atEnd() || peek() != '=') {
                tokens.add(Token.parameter(span(from, index), key, null));
                return true;
            }
            index++;
            String value = !atEnd() && peek() == '"' ? readQuoted() : readUnquoted();
            if (value == null) {
                return false;
            }
            tokens.add(Token.parameter(span(from, index), key, value));
            return true;
        }

        private String readQuoted() {
            StringBuilder value = new StringBuilder();
            int cursor = index + 1;
            while (cursor < raw.length()) {
                char ch = raw.charAt(cursor);
                if (ch == '"') {
                    index = cursor + 1;
                    return value.toString();
                }
                if (ch == '\\' && cursor + 1 < raw.length()) {
                    char escaped = raw.charAt(cursor + 1);
                    switch (escaped) {
                        case 'n' -> value.append('\n');
                        case 't' -> value.append('\t');
                        case 'r' -> value.append('\r');
                        default -> value.append(escaped);
                    }
                    cursor += 2;
                    continue;
                }
                value.append(ch);
                cursor++;
            }
            return null;
        }

        private String readUnquoted() {
            int end = index;
            while (end < raw.length() && raw.charAt(end) != ',' && raw.charAt(end) != '"') {
                end++;
            }
            while (end > index && SourceLine.isInlineWhitespace(raw.charAt(end - 1))) {
                end--;
            }
            String value = raw.substring(index, end);
            index = end;
            return value;
        }
    }
}
