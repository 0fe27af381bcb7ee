package io.txxt.structure.tree;

import io.txxt.structure.token.Position;
import io.txxt.structure.token.Token;
import io.txxt.structure.token.TokenKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the token block tree in two passes: nesting from Indent/Dedent pairs, then splitting every level into
 * sibling groups at blank lines and block boundaries.
 */
public class TokenTreeBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenTreeBuilder.class);

    private static final Set<TokenKind> BLOCK_OPENERS =
            EnumSet.of(TokenKind.SEQUENCE_MARKER, TokenKind.TXXT_MARKER, TokenKind.VERBATIM_TITLE);

    public TokenBlock build(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        TokenBlock root = nest(tokens);
        segment(root);
        LOGGER.debug("Built token tree with {} top-level groups", root.children().size());
        return root;
    }

    /**
     * Stage A: one block per Indent/Dedent pair. Tokens land in the innermost open block.
     */
    TokenBlock nest(List<Token> tokens) {
        TokenBlock root = new TokenBlock(0);
        Deque<TokenBlock> open = new ArrayDeque<>();
        open.push(root);
        Position last = Position.ORIGIN;
        for (Token token : tokens) {
            last = token.span().end();
            switch (token.kind()) {
                case INDENT -> {
                    TokenBlock child = new TokenBlock(open.peek().indentLevel() + 1);
                    open.peek().addChild(child);
                    open.push(child);
                }
                case DEDENT -> {
                    if (open.size() == 1) {
                        throw new StructuralException("Unmatched dedent", token.span().start());
                    }
                    open.pop();
                }
                case EOF -> {
                    // terminator only
                }
                default -> open.peek().addToken(token);
            }
        }
        if (open.size() > 1) {
            throw new StructuralException("Indentation level " + (open.size() - 1) + " left open at end of input", last);
        }
        return root;
    }

    /**
     * Stage B: deepest blocks first, turn every block into a list of sibling groups and move each nested block
     * under the group it follows.
     */
    void segment(TokenBlock root) {
        List<TokenBlock> preorder = new ArrayList<>();
        Deque<TokenBlock> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            TokenBlock block = pending.pop();
            preorder.add(block);
            List<TokenBlock> children = block.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        for (int i = preorder.size() - 1; i >= 0; i--) {
            segmentBlock(preorder.get(i));
        }
    }

    private void segmentBlock(TokenBlock block) {
        List<TokenBlock> nested = List.copyOf(block.children());
        int[] childStarts = nested.stream().mapToInt(TokenBlock::startLine).toArray();

        List<TokenBlock> segments = new ArrayList<>();
        TokenBlock current = null;
        LineShape previous = null;
        for (List<Token> line : splitLines(block.tokens())) {
            LineShape shape = LineShape.of(line);
            if (current == null || startsSegment(previous, shape, childStarts)) {
                current = new TokenBlock(block.indentLevel());
                segments.add(current);
            }
            current.addTokens(line);
            previous = shape;
        }

        List<TokenBlock> siblings = new ArrayList<>(segments);
        for (TokenBlock child : nested) {
            rehome(child, segments, siblings);
        }
        block.replaceContent(siblings);
    }

    /**
     * Attaches an already segmented nested block to the last non-blank sibling that starts before it, absorbing the
     * blank lines in between. Without such a sibling its groups are spliced into the sibling list in line order.
     */
    private void rehome(TokenBlock child, List<TokenBlock> segments, List<TokenBlock> siblings) {
        int start = child.startLine();
        TokenBlock target = null;
        int targetIndex = -1;
        for (int i = 0; i < segments.size() && segments.get(i).startLine() < start; i++) {
            if (!segments.get(i).isBlankLine()) {
                target = segments.get(i);
                targetIndex = i;
            }
        }
        if (target == null) {
            int insertAt = 0;
            while (insertAt < siblings.size() && siblings.get(insertAt).startLine() <= start) {
                insertAt++;
            }
            siblings.addAll(insertAt, child.children());
            return;
        }
        for (int i = targetIndex + 1; i < segments.size() && segments.get(i).startLine() < start; i++) {
            TokenBlock blank = segments.get(i);
            if (siblings.remove(blank)) {
                target.addTokens(blank.tokens());
            }
        }
        target.addChildren(child.children());
    }

    private static boolean startsSegment(LineShape previous, LineShape shape, int[] childStarts) {
        if (shape.blank() || previous.blank()) {
            return true;
        }
        if (shape.opensBlock() || previous.closesBlock()) {
            return true;
        }
        if (previous.isVerbatim() && !shape.continuesVerbatim()) {
            return true;
        }
        for (int childStart : childStarts) {
            if (childStart > previous.row() && childStart <= shape.row()) {
                return true;
            }
        }
        return false;
    }

    private static List<List<Token>> splitLines(List<Token> tokens) {
        List<List<Token>> lines = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        for (Token token : tokens) {
            if (token.is(TokenKind.BLANK_LINE)) {
                if (!current.isEmpty()) {
                    lines.add(current);
                    current = new ArrayList<>();
                }
                lines.add(List.of(token));
                continue;
            }
            current.add(token);
            if (token.is(TokenKind.NEWLINE)) {
                lines.add(current);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            lines.add(current);
        }
        return lines;
    }

    /**
     * What a single line looks like to the segmenter: its row, whether it is blank, its first content token kind and
     * its last non-whitespace token kind.
     */
    private record LineShape(int row, boolean blank, TokenKind first, TokenKind last) {

        static LineShape of(List<Token> line) {
            int row = line.get(0).span().start().row();
            if (line.size() == 1 && line.get(0).is(TokenKind.BLANK_LINE)) {
                return new LineShape(row, true, TokenKind.BLANK_LINE, TokenKind.BLANK_LINE);
            }
            TokenKind first = null;
            TokenKind last = null;
            for (Token token : line) {
                TokenKind kind = token.kind();
                if (kind == TokenKind.INDENTATION || kind == TokenKind.VERBATIM_WALL
                        || kind == TokenKind.NEWLINE || kind == TokenKind.WHITESPACE) {
                    continue;
                }
                if (first == null) {
                    first = kind;
                }
                last = kind;
            }
            return new LineShape(row, false, first, last);
        }

        boolean opensBlock() {
            return BLOCK_OPENERS.contains(first) || isDefinition();
        }

        boolean closesBlock() {
            return isDefinition() || first == TokenKind.TXXT_MARKER || first == TokenKind.VERBATIM_LABEL;
        }

        boolean isDefinition() {
            return first != TokenKind.TXXT_MARKER && last == TokenKind.TXXT_MARKER;
        }

        boolean isVerbatim() {
            return first == TokenKind.VERBATIM_TITLE || first == TokenKind.VERBATIM_CONTENT;
        }

        boolean continuesVerbatim() {
            return first == TokenKind.VERBATIM_CONTENT || first == TokenKind.VERBATIM_LABEL;
        }
    }
}
