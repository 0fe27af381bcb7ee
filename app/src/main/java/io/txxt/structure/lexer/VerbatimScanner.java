package io.txxt.structure.lexer;

import io.txxt.structure.ParserOptions;
import io.txxt.structure.token.Position;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects verbatim block boundaries: the {@code Title:} opening line and the {@code :: label} closing line.
 */
final class VerbatimScanner {

    static final String LABEL = "[A-Za-z][A-Za-z0-9_-]*(?:\\.[A-Za-z][A-Za-z0-9_-]*)*";

    private static final Pattern CLOSING_LINE = Pattern.compile("::[ \\t]+(" + LABEL + ")(?::(.*))?");

    private final ParserOptions options;
    private final ParameterScanner parameterScanner;

    VerbatimScanner(ParserOptions options, ParameterScanner parameterScanner) {
        this.options = options;
        this.parameterScanner = parameterScanner;
    }

    /**
     * Closing label found on a line, with character offsets into the line content.
     */
    record ClosingLabel(int markerStart, String label, int labelEnd, int parametersStart, int contentEnd) {

        boolean hasParameters() {
            return parametersStart >= 0;
        }
    }

    /**
     * Returns the frame of a verbatim block whose title is {@code lines[index]}, or empty when the line does not open one.
     * The line's indentation has already been reconciled and {@code titleWidth} is the current level's width.
     */
    Optional<VerbatimFrame> open(List<SourceLine> lines, int index, int titleWidth) {
        SourceLine title = lines.get(index);
        if (!isTitleShape(title)) {
            return Optional.empty();
        }
        int next = nextNonBlank(lines, index + 1);
        if (next < 0) {
            return Optional.empty();
        }
        int nextWidth = width(lines.get(next));
        Position titlePosition = title.position(title.leadingWhitespace());
        if (nextWidth == titleWidth && closingLabel(lines.get(next)).isPresent()) {
            return Optional.of(new VerbatimFrame(VerbatimMode.EMPTY, titleWidth, 0, titlePosition));
        }
        if (nextWidth > titleWidth) {
            return Optional.of(new VerbatimFrame(VerbatimMode.IN_FLOW, titleWidth,
                    inFlowWall(lines, next, titleWidth), titlePosition));
        }
        if (nextWidth == 0 && titleWidth > 0 && stretchedBlockCloses(lines, next, titleWidth)) {
            return Optional.of(new VerbatimFrame(VerbatimMode.STRETCHED, titleWidth, 0, titlePosition));
        }
        return Optional.empty();
    }

    Optional<ClosingLabel> closingLabel(SourceLine line) {
        int start = line.leadingWhitespace();
        int end = line.trimmedLength();
        if (end <= start) {
            return Optional.empty();
        }
        Matcher matcher = CLOSING_LINE.matcher(line.content()).region(start, end);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int parametersStart = matcher.start(2);
        if (parametersStart >= 0) {
            String raw = line.content().substring(parametersStart, end);
            if (parameterScanner.scan(raw, Position.ORIGIN).isEmpty()) {
                return Optional.empty();
            }
        }
        return Optional.of(new ClosingLabel(start, matcher.group(1), matcher.end(1), parametersStart, end));
    }

    int width(SourceLine line) {
        return options.widthOf(line.content(), line.leadingWhitespace());
    }

    /**
     * Number of leading characters to strip so that at most {@code wall} columns of indentation are removed.
     */
    int wallLength(SourceLine line, int wall) {
        int width = 0;
        int index = 0;
        while (index < line.length() && width < wall && SourceLine.isInlineWhitespace(line.charAt(index))) {
            width += line.charAt(index) == '\t' ? options.tabWidth() : 1;
            index++;
        }
        return index;
    }

    private boolean isTitleShape(SourceLine line) {
        int start = line.leadingWhitespace();
        int end = line.trimmedLength();
        if (end <= start || line.charAt(end - 1) != ':') {
            return false;
        }
        if (end - start >= 2 && (line.charAt(end - 2) == ':' || line.charAt(end - 2) == '\\')) {
            return false;
        }
        return !line.content().startsWith("::", start);
    }

    private int inFlowWall(List<SourceLine> lines, int first, int titleWidth) {
        int wall = Integer.MAX_VALUE;
        for (int index = first; index < lines.size(); index++) {
            SourceLine line = lines.get(index);
            if (line.isBlank()) {
                continue;
            }
            int lineWidth = width(line);
            if (lineWidth <= titleWidth) {
                break;
            }
            wall = Math.min(wall, lineWidth);
        }
        return wall;
    }

    private boolean stretchedBlockCloses(List<SourceLine> lines, int first, int titleWidth) {
        for (int index = first; index < lines.size(); index++) {
            SourceLine line = lines.get(index);
            if (line.isBlank()) {
                continue;
            }
            int lineWidth = width(line);
            if (lineWidth == titleWidth && closingLabel(line).isPresent()) {
                return true;
            }
            if (lineWidth != 0) {
                return false;
            }
        }
        return false;
    }

    private static int nextNonBlank(List<SourceLine> lines, int from) {
        for (int index = from; index < lines.size(); index++) {
            if (!lines.get(index).isBlank()) {
                return index;
            }
        }
        return -1;
    }
}
