package io.txxt.structure.lexer;

import io.txxt.structure.ParserOptions;
import io.txxt.structure.token.Position;
import io.txxt.structure.token.SequenceMarker;
import io.txxt.structure.token.SourceSpan;
import io.txxt.structure.token.Token;
import io.txxt.structure.token.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns txxt source text into a flat, lossless token sequence terminated by {@link TokenKind#EOF}.
 * Each call to {@link #tokenize(String)} owns its own indentation stack and verbatim state.
 */
public class Lexer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Lexer.class);

    private static final Pattern ANNOTATION_LABEL = Pattern.compile(VerbatimScanner.LABEL);
    private static final String ESCAPABLE = "\\*_`#-[]:()=,.";
    private static final String DELIMITERS = "[]()*`#:";

    private final ParserOptions options;
    private final SequenceMarkerReader markerReader;
    private final ParameterScanner parameterScanner;
    private final VerbatimScanner verbatimScanner;

    public Lexer() {
        this(ParserOptions.defaults());
    }

    public Lexer(ParserOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.markerReader = new SequenceMarkerReader();
        this.parameterScanner = new ParameterScanner();
        this.verbatimScanner = new VerbatimScanner(options, parameterScanner);
    }

    public List<Token> tokenize(String source) {
        Objects.requireNonNull(source, "source");
        List<Token> tokens = new Run(SourceLine.split(source)).execute();
        LOGGER.debug("Lexed {} characters into {} tokens", source.length(), tokens.size());
        return tokens;
    }

    private final class Run {

        private final List<SourceLine> lines;
        private final List<Token> tokens = new ArrayList<>();
        private final IndentationStack indentation = new IndentationStack();
        private final List<SourceLine> pendingBlankLines = new ArrayList<>();
        private LexerState state = LexerState.NORMAL;
        private VerbatimFrame frame;

        private Run(List<SourceLine> lines) {
            this.lines = lines;
        }

        List<Token> execute() {
            int index = 0;
            while (index < lines.size()) {
                index = switch (state) {
                    case NORMAL -> lexNormal(index);
                    case IN_VERBATIM -> lexVerbatim(index);
                };
            }
            if (state == LexerState.IN_VERBATIM) {
                throw new LexException("Unterminated verbatim block", frame.title());
            }
            Position end = lines.isEmpty() ? Position.ORIGIN : lines.get(lines.size() - 1).endOfLine();
            tokens.addAll(indentation.closeAll(end));
            tokens.add(Token.of(TokenKind.EOF, SourceSpan.empty(end)));
            return List.copyOf(tokens);
        }

        private int lexNormal(int index) {
            SourceLine line = lines.get(index);
            if (line.isBlank()) {
                emitBlankLine(line);
                return index + 1;
            }
            int wallLength = line.leadingWhitespace();
            int width = options.widthOf(line.content(), wallLength);
            tokens.addAll(indentation.reconcile(width, line.position(0)));
            emitWall(line, wallLength, TokenKind.INDENTATION);

            Optional<VerbatimFrame> opened = verbatimScanner.open(lines, index, width);
            if (opened.isPresent()) {
                frame = opened.get();
                state = LexerState.IN_VERBATIM;
                emitTitle(line, wallLength);
                return index + 1;
            }
            new LineLexer(line, index == lines.size() - 1).lex(wallLength);
            emitNewline(line);
            return index + 1;
        }

        private int lexVerbatim(int index) {
            SourceLine line = lines.get(index);
            if (line.isBlank()) {
                pendingBlankLines.add(line);
                return index + 1;
            }
            int width = verbatimScanner.width(line);
            if (width == frame.titleWidth()) {
                Optional<VerbatimScanner.ClosingLabel> closing = verbatimScanner.closingLabel(line);
                if (closing.isPresent()) {
                    flushPendingBlankLines(true);
                    emitClosingLabel(line, closing.get());
                    leaveVerbatim();
                    return index + 1;
                }
            }
            if (frame.mode() == VerbatimMode.IN_FLOW && width <= frame.titleWidth()) {
                // dedent back to the title closes the block; this line is lexed again as normal text
                flushPendingBlankLines(false);
                leaveVerbatim();
                return index;
            }
            flushPendingBlankLines(true);
            emitVerbatimContent(line);
            return index + 1;
        }

        private void leaveVerbatim() {
            state = LexerState.NORMAL;
            frame = null;
        }

        private void flushPendingBlankLines(boolean asContent) {
            for (SourceLine blank : pendingBlankLines) {
                if (asContent) {
                    emitVerbatimContent(blank);
                } else {
                    emitBlankLine(blank);
                }
            }
            pendingBlankLines.clear();
        }

        private void emitTitle(SourceLine line, int wallLength) {
            int colon = line.trimmedLength() - 1;
            tokens.add(Token.ofText(TokenKind.VERBATIM_TITLE,
                    new SourceSpan(line.position(wallLength), line.endOfContent()),
                    line.content().substring(wallLength, colon)));
            emitNewline(line);
        }

        private void emitVerbatimContent(SourceLine line) {
            int stripped = verbatimScanner.wallLength(line, frame.wall());
            emitWall(line, stripped, TokenKind.VERBATIM_WALL);
            tokens.add(Token.ofText(TokenKind.VERBATIM_CONTENT,
                    new SourceSpan(line.position(stripped), line.endOfContent()),
                    line.content().substring(stripped)));
            emitNewline(line);
        }

        private void emitClosingLabel(SourceLine line, VerbatimScanner.ClosingLabel closing) {
            emitWall(line, closing.markerStart(), TokenKind.INDENTATION);
            tokens.add(Token.ofText(TokenKind.VERBATIM_LABEL,
                    span(line, closing.markerStart(), closing.labelEnd()), closing.label()));
            if (closing.hasParameters()) {
                tokens.add(Token.of(TokenKind.COLON, span(line, closing.labelEnd(), closing.parametersStart())));
                String raw = line.content().substring(closing.parametersStart(), closing.contentEnd());
                tokens.addAll(parameterScanner.scan(raw, line.position(closing.parametersStart()))
                        .orElseThrow(() -> new IllegalStateException("closing label parameters were validated")));
            }
            emitWhitespace(line, closing.contentEnd(), line.length());
            emitNewline(line);
        }

        private void emitBlankLine(SourceLine line) {
            tokens.add(Token.of(TokenKind.BLANK_LINE, new SourceSpan(line.position(0), line.endOfLine())));
        }

        private void emitWall(SourceLine line, int length, TokenKind kind) {
            if (length > 0) {
                tokens.add(Token.of(kind, span(line, 0, length)));
            }
        }

        private void emitWhitespace(SourceLine line, int from, int to) {
            if (to > from) {
                tokens.add(Token.ofText(TokenKind.WHITESPACE, span(line, from, to), line.content().substring(from, to)));
            }
        }

        private void emitNewline(SourceLine line) {
            if (line.hasTerminator()) {
                tokens.add(Token.of(TokenKind.NEWLINE, new SourceSpan(line.endOfContent(), line.endOfLine())));
            }
        }

        private SourceSpan span(SourceLine line, int from, int to) {
            return new SourceSpan(line.position(from), line.position(to));
        }

        /**
         * Lexes the content of one normal-state line after its wall.
         */
        private final class LineLexer {

            private final SourceLine line;
            private final String content;
            private final boolean lastLine;
            private List<Token> definitionParameters = List.of();
            private int definitionParametersEnd;

            private LineLexer(SourceLine line, boolean lastLine) {
                this.line = line;
                this.content = line.content();
                this.lastLine = lastLine;
            }

            void lex(int start) {
                if (lexAnnotation(start)) {
                    return;
                }
                int position = start;
                Optional<SequenceMarker> marker = markerReader.read(content, position);
                if (marker.isPresent()) {
                    int end = position + marker.get().text().length();
                    tokens.add(Token.marker(span(line, position, end), marker.get()));
                    position = end;
                }
                int colon = definitionParameterColon(position);
                if (colon < 0) {
                    lexInline(position, content.length());
                    return;
                }
                lexInline(position, colon);
                tokens.add(Token.of(TokenKind.COLON, span(line, colon, colon + 1)));
                tokens.addAll(definitionParameters);
                lexInline(definitionParametersEnd, content.length());
            }

            private boolean lexAnnotation(int start) {
                if (!content.startsWith("::", start)) {
                    return false;
                }
                int afterMarker = start + 2;
                int labelStart = afterMarker;
                while (labelStart < content.length() && SourceLine.isInlineWhitespace(content.charAt(labelStart))) {
                    labelStart++;
                }
                if (labelStart == afterMarker) {
                    return false;
                }
                Matcher matcher = ANNOTATION_LABEL.matcher(content).region(labelStart, content.length());
                if (!matcher.lookingAt()) {
                    return false;
                }
                int labelEnd = matcher.end();
                int parametersStart = -1;
                if (labelEnd < content.length() && content.charAt(labelEnd) == ':'
                        && (labelEnd + 1 >= content.length() || content.charAt(labelEnd + 1) != ':')) {
                    parametersStart = labelEnd + 1;
                }
                int closing = closingMarker(parametersStart >= 0 ? parametersStart : labelEnd);
                if (closing < 0) {
                    return false;
                }
                List<Token> parameters = List.of();
                int parametersEnd = labelEnd;
                if (parametersStart >= 0) {
                    parametersEnd = closing;
                    while (parametersEnd > parametersStart
                            && SourceLine.isInlineWhitespace(content.charAt(parametersEnd - 1))) {
                        parametersEnd--;
                    }
                    Optional<List<Token>> scanned = parameterScanner.scan(
                            content.substring(parametersStart, parametersEnd), line.position(parametersStart));
                    if (scanned.isEmpty()) {
                        return false;
                    }
                    parameters = scanned.get();
                } else if (!content.substring(labelEnd, closing).isBlank()) {
                    return false;
                }

                tokens.add(Token.of(TokenKind.TXXT_MARKER, span(line, start, afterMarker)));
                emitWhitespace(line, afterMarker, labelStart);
                tokens.add(Token.ofText(TokenKind.IDENTIFIER, span(line, labelStart, labelEnd),
                        content.substring(labelStart, labelEnd)));
                if (parametersStart >= 0) {
                    tokens.add(Token.of(TokenKind.COLON, span(line, labelEnd, parametersStart)));
                    tokens.addAll(parameters);
                }
                emitWhitespace(line, parametersEnd, closing);
                tokens.add(Token.of(TokenKind.TXXT_MARKER, span(line, closing, closing + 2)));
                lexInline(closing + 2, content.length());
                return true;
            }

            /**
             * First {@code ::} at or after {@code from} that is not inside a quoted parameter value.
             */
            private int closingMarker(int from) {
                boolean quoted = false;
                for (int index = from; index + 1 < content.length(); index++) {
                    char ch = content.charAt(index);
                    if (quoted) {
                        if (ch == '\\') {
                            index++;
                        } else if (ch == '"') {
                            quoted = false;
                        }
                        continue;
                    }
                    if (ch == '"') {
                        quoted = true;
                    } else if (ch == ':' && content.charAt(index + 1) == ':') {
                        return index;
                    }
                }
                return -1;
            }

            /**
             * For a definition line {@code Term:key=value ::}, returns the index of the colon that opens the
             * parameter list, or -1 when the line carries no definition parameters.
             */
            private int definitionParameterColon(int from) {
                int end = line.trimmedLength();
                if (end - from < 3 || !content.startsWith("::", end - 2) || content.startsWith("::", from)) {
                    return -1;
                }
                int marker = end - 2;
                if (content.charAt(marker - 1) == ':') {
                    return -1;
                }
                for (int colon = from + 1; colon < marker; colon++) {
                    if (content.charAt(colon) != ':' || content.charAt(colon - 1) == ':'
                            || content.charAt(colon - 1) == '\\' || content.charAt(colon + 1) == ':') {
                        continue;
                    }
                    if (content.substring(from, colon).isBlank()) {
                        continue;
                    }
                    int parametersEnd = marker;
                    while (parametersEnd > colon + 1
                            && SourceLine.isInlineWhitespace(content.charAt(parametersEnd - 1))) {
                        parametersEnd--;
                    }
                    Optional<List<Token>> scanned = parameterScanner.scan(
                            content.substring(colon + 1, parametersEnd), line.position(colon + 1));
                    if (scanned.isPresent()) {
                        definitionParameters = scanned.get();
                        definitionParametersEnd = parametersEnd;
                        return colon;
                    }
                }
                return -1;
            }

            private void lexInline(int from, int to) {
                int index = from;
                while (index < to) {
                    char ch = content.charAt(index);
                    if (SourceLine.isInlineWhitespace(ch)) {
                        int end = index;
                        while (end < to && SourceLine.isInlineWhitespace(content.charAt(end))) {
                            end++;
                        }
                        emitWhitespace(line, index, end);
                        index = end;
                    } else if (ch == '\\') {
                        index = lexBackslash(index, to);
                    } else if (ch == ':' && index + 1 < to && content.charAt(index + 1) == ':') {
                        tokens.add(Token.of(TokenKind.TXXT_MARKER, span(line, index, index + 2)));
                        index += 2;
                    } else if (isDelimiter(index, to)) {
                        tokens.add(Token.of(TokenKind.forDelimiter(ch), span(line, index, index + 1)));
                        index++;
                    } else {
                        int end = textRunEnd(index, to);
                        tokens.add(Token.ofText(TokenKind.TEXT, span(line, index, end), content.substring(index, end)));
                        index = end;
                    }
                }
            }

            private int lexBackslash(int index, int to) {
                if (index + 1 < to && ESCAPABLE.indexOf(content.charAt(index + 1)) >= 0) {
                    tokens.add(Token.ofText(TokenKind.TEXT, span(line, index, index + 2), content.substring(index, index + 2)));
                    return index + 2;
                }
                if (lastLine && !line.hasTerminator() && index + 1 == content.length()) {
                    throw new LexException("Invalid escape boundary: backslash at end of input", line.position(index));
                }
                tokens.add(Token.ofText(TokenKind.TEXT, span(line, index, index + 1), "\\"));
                return index + 1;
            }

            private boolean isDelimiter(int index, int to) {
                char ch = content.charAt(index);
                if (ch == '_') {
                    return !isWordInternalUnderscore(index, to);
                }
                return DELIMITERS.indexOf(ch) >= 0;
            }

            private int textRunEnd(int from, int to) {
                int end = from;
                while (end < to) {
                    char ch = content.charAt(end);
                    if (SourceLine.isInlineWhitespace(ch) || ch == '\\' || DELIMITERS.indexOf(ch) >= 0) {
                        break;
                    }
                    if (ch == '_' && !isWordInternalUnderscore(end, to)) {
                        break;
                    }
                    end += Character.isHighSurrogate(ch) && end + 1 < to ? 2 : 1;
                }
                return end;
            }

            private boolean isWordInternalUnderscore(int index, int to) {
                return index > 0 && index + 1 < to
                        && Character.isLetterOrDigit(content.charAt(index - 1))
                        && Character.isLetterOrDigit(content.charAt(index + 1));
            }
        }
    }
}
