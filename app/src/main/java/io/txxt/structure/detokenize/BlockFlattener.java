package io.txxt.structure.detokenize;

import io.txxt.structure.block.Block;
import io.txxt.structure.block.BlockKind;
import io.txxt.structure.token.Position;
import io.txxt.structure.token.SourceSpan;
import io.txxt.structure.token.Token;
import io.txxt.structure.token.TokenKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Walks a block tree in document order and reproduces the lexer's token stream, Indent and Dedent included.
 */
public class BlockFlattener {

    public List<Token> flatten(Block root) {
        Objects.requireNonNull(root, "root");
        List<Token> tokens = new ArrayList<>();
        Deque<Block> pending = new ArrayDeque<>();
        pending.push(root);
        int depth = 0;
        Position last = Position.ORIGIN;
        while (!pending.isEmpty()) {
            Block block = pending.pop();
            List<Token> own = block.type().tokens();
            if (own.isEmpty() && block.kind() != BlockKind.ROOT && block.kind() != BlockKind.LIST) {
                throw new DetokenizeException(block.kind().displayName() + " block at lines " + block.lines()
                        + " has no tokens");
            }
            if (!own.isEmpty()) {
                Position at = own.get(0).span().start();
                if (block.kind() != BlockKind.BLANK_LINE) {
                    depth = moveTo(tokens, depth, block.indentLevel(), at);
                }
                tokens.addAll(own);
                last = own.get(own.size() - 1).span().end();
            }
            List<Block> children = block.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        moveTo(tokens, depth, 0, last);
        tokens.add(Token.of(TokenKind.EOF, SourceSpan.empty(last)));
        return tokens;
    }

    private static int moveTo(List<Token> tokens, int depth, int target, Position at) {
        SourceSpan span = SourceSpan.empty(at);
        for (; depth < target; depth++) {
            tokens.add(Token.of(TokenKind.INDENT, span));
        }
        for (; depth > target; depth--) {
            tokens.add(Token.of(TokenKind.DEDENT, span));
        }
        return depth;
    }
}
