package io.txxt.structure.lexer;

import io.txxt.structure.token.Position;
import io.txxt.structure.token.SourceSpan;
import io.txxt.structure.token.Token;
import io.txxt.structure.token.TokenKind;
import io.txxt.structure.tree.StructuralException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Stack of open indentation widths owned by a single lexer run.
 */
final class IndentationStack {

    private final Deque<Integer> widths = new ArrayDeque<>();

    IndentationStack() {
        widths.push(0);
    }

    /**
     * Emits the Indent or Dedent tokens that move the stack to {@code width}.
     */
    List<Token> reconcile(int width, Position at) {
        int top = widths.peek();
        if (width == top) {
            return List.of();
        }
        SourceSpan span = SourceSpan.empty(at);
        if (width > top) {
            widths.push(width);
            return List.of(Token.of(TokenKind.INDENT, span));
        }
        List<Token> dedents = new ArrayList<>();
        while (widths.peek() > width) {
            widths.pop();
            dedents.add(Token.of(TokenKind.DEDENT, span));
        }
        if (widths.peek() != width) {
            throw new StructuralException("Indentation width " + width + " matches no open level " + widths, at);
        }
        return dedents;
    }

    List<Token> closeAll(Position at) {
        List<Token> dedents = new ArrayList<>();
        while (widths.size() > 1) {
            widths.pop();
            dedents.add(Token.of(TokenKind.DEDENT, SourceSpan.empty(at)));
        }
        return dedents;
    }
}
