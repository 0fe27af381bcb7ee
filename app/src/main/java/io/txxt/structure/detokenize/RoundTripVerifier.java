package io.txxt.structure.detokenize;

import io.txxt.structure.block.Block;
import io.txxt.structure.lexer.Lexer;
import io.txxt.structure.token.Token;
import java.util.List;
import java.util.Objects;

/**
 * Correctness oracle: lexes the detokenized text again and compares it with the original tokens, ignoring spans.
 */
public class RoundTripVerifier {

    private final Lexer lexer;
    private final Detokenizer detokenizer;

    public RoundTripVerifier(Lexer lexer, Detokenizer detokenizer) {
        this.lexer = Objects.requireNonNull(lexer, "lexer");
        this.detokenizer = Objects.requireNonNull(detokenizer, "detokenizer");
    }

    public RoundTripReport verify(List<Token> tokens) {
        String text = detokenizer.detokenize(tokens);
        return new RoundTripReport(text, tokens, lexer.tokenize(text));
    }

    /**
     * Checks that the block tree still holds every token of the document it was built from.
     */
    public RoundTripReport verify(List<Token> tokens, Block root) {
        String text = detokenizer.detokenize(root);
        return new RoundTripReport(text, tokens, lexer.tokenize(text));
    }
}
