package io.txxt.structure.tree;

import io.txxt.structure.token.Token;
import io.txxt.structure.token.TokenKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Intermediate group of tokens at one nesting level, with the groups nested beneath it.
 * Lives only while the block tree is being built.
 */
public final class TokenBlock {

    private final int indentLevel;
    private final List<Token> tokens = new ArrayList<>();
    private final List<TokenBlock> children = new ArrayList<>();

    public TokenBlock(int indentLevel) {
        if (indentLevel < 0) {
            throw new IllegalArgumentException("indentLevel must not be negative");
        }
        this.indentLevel = indentLevel;
    }

    public int indentLevel() {
        return indentLevel;
    }

    public List<Token> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    public List<TokenBlock> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean isBlankLine() {
        return tokens.size() == 1 && tokens.get(0).is(TokenKind.BLANK_LINE);
    }

    /**
     * First source row of this block's own tokens, falling back to its first child; -1 when empty.
     */
    public int startLine() {
        if (!tokens.isEmpty()) {
            return tokens.get(0).span().start().row();
        }
        return children.isEmpty() ? -1 : children.get(0).startLine();
    }

    /**
     * Last source row of this block's own tokens, falling back to its last child; -1 when empty.
     */
    public int endLine() {
        if (!tokens.isEmpty()) {
            return tokens.get(tokens.size() - 1).span().start().row();
        }
        return children.isEmpty() ? -1 : children.get(children.size() - 1).lastLine();
    }

    /**
     * Last source row covered by this block or any of its descendants.
     */
    public int lastLine() {
        int last = tokens.isEmpty() ? -1 : tokens.get(tokens.size() - 1).span().start().row();
        for (TokenBlock child : children) {
            last = Math.max(last, child.lastLine());
        }
        return last;
    }

    void addToken(Token token) {
        tokens.add(token);
    }

    void addTokens(List<Token> additional) {
        tokens.addAll(additional);
    }

    void addChild(TokenBlock child) {
        children.add(child);
    }

    void addChildren(List<TokenBlock> additional) {
        children.addAll(additional);
    }

    void replaceContent(List<TokenBlock> siblings) {
        tokens.clear();
        children.clear();
        children.addAll(siblings);
    }

    @Override
    public String toString() {
        return "TokenBlock[level=" + indentLevel + ", lines=" + startLine() + ".." + endLine()
                + ", tokens=" + tokens.size() + ", children=" + children.size() + "]";
    }
}
