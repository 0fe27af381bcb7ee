package io.txxt.structure.lexer;

import io.txxt.structure.token.Position;
import java.util.ArrayList;
import java.util.List;

/**
 * One physical line of input with its terminator and UTF-8 byte columns for every character index.
 */
final class SourceLine {

    private final int row;
    private final String content;
    private final String terminator;
    private final int[] columns;

    private SourceLine(int row, String content, String terminator) {
        this.row = row;
        this.content = content;
        this.terminator = terminator;
        this.columns = byteColumns(row, content);
    }

    static List<SourceLine> split(String source) {
        List<SourceLine> lines = new ArrayList<>();
        int start = 0;
        int row = 0;
        while (start < source.length()) {
            int newline = source.indexOf('\n', start);
            if (newline < 0) {
                lines.add(new SourceLine(row, source.substring(start), ""));
                break;
            }
            int contentEnd = newline > start && source.charAt(newline - 1) == '\r' ? newline - 1 : newline;
            lines.add(new SourceLine(row, source.substring(start, contentEnd), source.substring(contentEnd, newline + 1)));
            start = newline + 1;
            row++;
        }
        return lines;
    }

    int row() {
        return row;
    }

    String content() {
        return content;
    }

    int length() {
        return content.length();
    }

    char charAt(int index) {
        return content.charAt(index);
    }

    boolean hasTerminator() {
        return !terminator.isEmpty();
    }

    boolean isBlank() {
        return leadingWhitespace() == content.length();
    }

    int leadingWhitespace() {
        int index = 0;
        while (index < content.length() && isInlineWhitespace(content.charAt(index))) {
            index++;
        }
        return index;
    }

    /**
     * Length of the content once trailing spaces and tabs are removed.
     */
    int trimmedLength() {
        int end = content.length();
        while (end > 0 && isInlineWhitespace(content.charAt(end - 1))) {
            end--;
        }
        return end;
    }

    Position position(int charIndex) {
        return new Position(row, columns[charIndex]);
    }

    Position endOfContent() {
        return position(content.length());
    }

    /**
     * Position right after the terminator, which is the start of the next row when one exists.
     */
    Position endOfLine() {
        return hasTerminator() ? new Position(row + 1, 0) : endOfContent();
    }

    static boolean isInlineWhitespace(char ch) {
        return ch == ' ' || ch == '\t';
    }

    private static int[] byteColumns(int row, String content) {
        int[] columns = new int[content.length() + 1];
        int bytes = 0;
        int index = 0;
        while (index < content.length()) {
            char ch = content.charAt(index);
            columns[index] = bytes;
            if (Character.isHighSurrogate(ch) && index + 1 < content.length()
                    && Character.isLowSurrogate(content.charAt(index + 1))) {
                columns[index + 1] = bytes + 2;
                bytes += 4;
                index += 2;
                continue;
            }
            if (Character.isSurrogate(ch)) {
                throw new LexException("Invalid encoding boundary: unpaired surrogate", new Position(row, bytes));
            }
            bytes += ch < 0x80 ? 1 : ch < 0x800 ? 2 : 3;
            index++;
        }
        columns[content.length()] = bytes;
        return columns;
    }
}
