package io.txxt.structure.pipeline;

import io.txxt.structure.block.Block;
import io.txxt.structure.token.Token;
import java.util.List;
import java.util.Objects;

/**
 * Result of structuring one document: the lexer's tokens and the root block built from them.
 *
 * @param sourceName logical source identifier, used for diagnostics only
 * @param tokens full token sequence, Eof included
 * @param root root block
 */
public record ParsedDocument(String sourceName, List<Token> tokens, Block root) {

    public ParsedDocument {
        Objects.requireNonNull(sourceName, "sourceName");
        tokens = List.copyOf(tokens);
        Objects.requireNonNull(root, "root");
    }
}
