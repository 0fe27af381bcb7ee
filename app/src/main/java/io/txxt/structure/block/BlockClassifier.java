package io.txxt.structure.block;

import io.txxt.structure.token.Token;
import io.txxt.structure.token.TokenKind;
import io.txxt.structure.token.Tokens;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Assigns a block type to one token group from its own tokens and whether it has children.
 * Tests run in a fixed priority order and look at nothing outside the group.
 */
public class BlockClassifier {

    private static final Set<TokenKind> LAYOUT = EnumSet.of(TokenKind.INDENTATION, TokenKind.VERBATIM_WALL,
            TokenKind.WHITESPACE, TokenKind.NEWLINE, TokenKind.BLANK_LINE);
    private static final Set<TokenKind> PARAMETER_LIST = EnumSet.of(TokenKind.PARAMETER, TokenKind.COMMA,
            TokenKind.WHITESPACE);

    public BlockType classify(List<Token> tokens, boolean hasChildren) {
        if (tokens.isEmpty()) {
            return new BlockType.Root();
        }
        if (tokens.size() == 1 && tokens.get(0).is(TokenKind.BLANK_LINE)) {
            return new BlockType.BlankLine(tokens);
        }
        int first = firstContent(tokens, 0);
        if (first >= 0 && tokens.get(first).is(TokenKind.TXXT_MARKER)) {
            return annotation(tokens, first);
        }
        int lineEnd = firstLineEnd(tokens);
        int definitionMarker = lastContent(tokens, lineEnd);
        if (definitionMarker >= 0 && definitionMarker != first && tokens.get(definitionMarker).is(TokenKind.TXXT_MARKER)) {
            return definition(tokens, first, definitionMarker);
        }
        if (tokens.stream().anyMatch(token -> token.is(TokenKind.VERBATIM_TITLE))) {
            return verbatim(tokens);
        }
        if (first >= 0 && tokens.get(first).is(TokenKind.SEQUENCE_MARKER)) {
            return new BlockType.ListItem(tokens, tokens.get(first).sequenceMarker(),
                    tokens.subList(first + 1, tokens.size()));
        }
        if (hasChildren && tokens.get(tokens.size() - 1).is(TokenKind.BLANK_LINE)) {
            int titleEnd = tokens.size();
            while (titleEnd > 0 && tokens.get(titleEnd - 1).is(TokenKind.BLANK_LINE)) {
                titleEnd--;
            }
            List<Token> title = tokens.subList(0, titleEnd);
            if (isSingleLine(title)) {
                return new BlockType.Session(tokens, title);
            }
        }
        return new BlockType.Paragraph(tokens);
    }

    private BlockType.Annotation annotation(List<Token> tokens, int opening) {
        int lineEnd = firstLineEnd(tokens);
        int closing = -1;
        for (int i = opening + 1; i < lineEnd; i++) {
            if (tokens.get(i).is(TokenKind.TXXT_MARKER)) {
                closing = i;
                break;
            }
        }
        int labelIndex = firstContent(tokens, opening + 1);
        String label;
        List<Token> parameters = List.of();
        if (labelIndex >= 0 && tokens.get(labelIndex).is(TokenKind.IDENTIFIER)) {
            label = tokens.get(labelIndex).text();
            int colon = labelIndex + 1;
            if (colon < tokens.size() && tokens.get(colon).is(TokenKind.COLON)) {
                int end = colon + 1;
                while (end < tokens.size() && PARAMETER_LIST.contains(tokens.get(end).kind())) {
                    end++;
                }
                parameters = tokens.subList(colon + 1, end);
            }
        } else {
            // "::" that did not lex as a well-formed annotation: use the raw text between the markers
            int labelEnd = closing < 0 ? lineEnd : closing;
            label = Tokens.text(tokens.subList(opening + 1, labelEnd));
        }
        List<Token> content = closing < 0 ? List.of() : tokens.subList(closing + 1, tokens.size());
        return new BlockType.Annotation(tokens, label, parameters, content);
    }

    private BlockType.Definition definition(List<Token> tokens, int first, int marker) {
        int termEnd = marker;
        List<Token> parameters = List.of();
        for (int colon = first; colon < marker; colon++) {
            if (tokens.get(colon).is(TokenKind.COLON) && isParameterList(tokens.subList(colon + 1, marker))) {
                termEnd = colon;
                parameters = tokens.subList(colon + 1, marker);
                break;
            }
        }
        return new BlockType.Definition(tokens, tokens.subList(first, termEnd), parameters, tokens.get(marker));
    }

    private BlockType.Verbatim verbatim(List<Token> tokens) {
        String title = "";
        List<String> lines = new ArrayList<>();
        String label = null;
        List<Token> parameters = new ArrayList<>();
        boolean inLabel = false;
        for (Token token : tokens) {
            switch (token.kind()) {
                case VERBATIM_TITLE -> title = token.text().strip();
                case VERBATIM_CONTENT -> lines.add(token.text());
                case VERBATIM_LABEL -> {
                    label = token.text();
                    inLabel = true;
                }
                case PARAMETER, COMMA -> {
                    if (inLabel) {
                        parameters.add(token);
                    }
                }
                case NEWLINE -> inLabel = false;
                default -> {
                }
            }
        }
        return new BlockType.Verbatim(tokens, title, lines, Optional.ofNullable(label), parameters);
    }

    /**
     * True when no line break occurs before the final token, so the tokens form one logical line.
     */
    private static boolean isSingleLine(List<Token> tokens) {
        for (int i = 0; i < tokens.size() - 1; i++) {
            if (tokens.get(i).is(TokenKind.NEWLINE) || tokens.get(i).is(TokenKind.BLANK_LINE)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isParameterList(List<Token> tokens) {
        boolean sawParameter = false;
        for (Token token : tokens) {
            if (!PARAMETER_LIST.contains(token.kind())) {
                return false;
            }
            sawParameter |= token.is(TokenKind.PARAMETER);
        }
        return sawParameter;
    }

    private static int firstContent(List<Token> tokens, int from) {
        for (int i = from; i < tokens.size(); i++) {
            if (!LAYOUT.contains(tokens.get(i).kind())) {
                return i;
            }
        }
        return -1;
    }

    private static int lastContent(List<Token> tokens, int end) {
        for (int i = end - 1; i >= 0; i--) {
            if (!LAYOUT.contains(tokens.get(i).kind())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index just past the first line's content, that is of its first NEWLINE or BLANK_LINE token.
     */
    private static int firstLineEnd(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).is(TokenKind.NEWLINE) || tokens.get(i).is(TokenKind.BLANK_LINE)) {
                return i;
            }
        }
        return tokens.size();
    }
}
