package io.txxt.structure.lexer;

import io.txxt.structure.token.MarkerStyle;
import io.txxt.structure.token.SequenceMarker;
import java.util.Optional;

/**
 * Recognizes list markers at the start of a line: {@code -}, {@code 1.}, {@code 2)}, {@code iv.}, {@code b)}.
 * A marker only counts when a space or tab follows it.
 */
public class SequenceMarkerReader {

    private static final int MAX_NUMBER_DIGITS = 9;
    private static final int MAX_ROMAN_VALUE = 39;

    public Optional<SequenceMarker> read(CharSequence text, int from) {
        if (from >= text.length()) {
            return Optional.empty();
        }
        char first = text.charAt(from);
        if (first == '-') {
            return followedBySpace(text, from + 1)
                    ? Optional.of(new SequenceMarker(MarkerStyle.PLAIN, 0, "-"))
                    : Optional.empty();
        }
        int end = from;
        if (isDigit(first)) {
            while (end < text.length() && isDigit(text.charAt(end))) {
                end++;
            }
            if (end - from > MAX_NUMBER_DIGITS) {
                return Optional.empty();
            }
            int value = Integer.parseInt(text.subSequence(from, end).toString());
            return ordered(text, from, end, MarkerStyle.NUMERICAL, value);
        }
        if (isRomanLetter(first)) {
            boolean lower = Character.isLowerCase(first);
            while (end < text.length() && isRomanLetter(text.charAt(end))
                    && Character.isLowerCase(text.charAt(end)) == lower) {
                end++;
            }
            int value = romanValue(text.subSequence(from, end).toString());
            if (value > 0) {
                Optional<SequenceMarker> roman = ordered(text, from, end, MarkerStyle.ROMAN, value);
                if (roman.isPresent()) {
                    return roman;
                }
            }
        }
        if (isAsciiLetter(first)) {
            int index = Character.toLowerCase(first) - 'a' + 1;
            return ordered(text, from, from + 1, MarkerStyle.ALPHABETICAL, index);
        }
        return Optional.empty();
    }

    private Optional<SequenceMarker> ordered(CharSequence text, int from, int end, MarkerStyle style, int value) {
        if (end >= text.length()) {
            return Optional.empty();
        }
        char separator = text.charAt(end);
        if ((separator != '.' && separator != ')') || !followedBySpace(text, end + 1)) {
            return Optional.empty();
        }
        return Optional.of(new SequenceMarker(style, value, text.subSequence(from, end + 1).toString()));
    }

    /**
     * Value of a canonical Roman numeral written with {@code i}, {@code v} and {@code x}, or 0 when invalid.
     */
    static int romanValue(String numeral) {
        String lower = numeral.toLowerCase();
        int total = 0;
        for (int i = 0; i < lower.length(); i++) {
            int current = digitValue(lower.charAt(i));
            int next = i + 1 < lower.length() ? digitValue(lower.charAt(i + 1)) : 0;
            if (current == 0) {
                return 0;
            }
            total += current < next ? -current : current;
        }
        if (total < 1 || total > MAX_ROMAN_VALUE || !toRoman(total).equals(lower)) {
            return 0;
        }
        return total;
    }

    private static String toRoman(int value) {
        StringBuilder builder = new StringBuilder();
        int remaining = value;
        while (remaining >= 10) {
            builder.append('x');
            remaining -= 10;
        }
        String[] units = {"", "i", "ii", "iii", "iv", "v", "vi", "vii", "viii", "ix"};
        return builder.append(units[remaining]).toString();
    }

    private static int digitValue(char ch) {
        return switch (ch) {
            case 'i' -> 1;
            case 'v' -> 5;
            case 'x' -> 10;
            default -> 0;
        };
    }

    private static boolean followedBySpace(CharSequence text, int index) {
        return index < text.length() && SourceLine.isInlineWhitespace(text.charAt(index));
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isAsciiLetter(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    private static boolean isRomanLetter(char ch) {
        return "ivxIVX".indexOf(ch) >= 0;
    }
}
