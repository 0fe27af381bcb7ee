package io.txxt.structure.detokenize;

import io.txxt.structure.ParserOptions;
import io.txxt.structure.block.Block;
import io.txxt.structure.lexer.ParameterSyntax;
import io.txxt.structure.token.Token;
import java.util.List;
import java.util.Objects;

/**
 * Rebuilds source text from tokens. Lexing the result yields tokens content-equal to the input; indentation is
 * normalized to {@link ParserOptions#indentWidth()} spaces per level.
 */
public class Detokenizer {

    private final ParserOptions options;
    private final BlockFlattener flattener;

    public Detokenizer() {
        this(ParserOptions.defaults());
    }

    public Detokenizer(ParserOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.flattener = new BlockFlattener();
    }

    /**
     * @throws DetokenizeException on a dedent below level zero
     */
    public String detokenize(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        StringBuilder out = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            switch (token.kind()) {
                case INDENT -> depth++;
                case DEDENT -> {
                    if (depth == 0) {
                        throw new DetokenizeException("Unmatched dedent at token " + i);
                    }
                    depth--;
                }
                case INDENTATION -> indent(out, depth);
                case VERBATIM_WALL -> indent(out, depth + 1);
                case NEWLINE, BLANK_LINE -> out.append('\n');
                case PARAMETER -> out.append(ParameterSyntax.format(token.text(), token.value()));
                case VERBATIM_TITLE -> out.append(token.text()).append(':');
                case VERBATIM_LABEL -> out.append(":: ").append(token.text());
                case EOF -> {
                }
                default -> out.append(token.text());
            }
        }
        return out.toString();
    }

    /**
     * Flattens the tree back to tokens, re-deriving indentation from block levels, and detokenizes them.
     */
    public String detokenize(Block root) {
        return detokenize(flattener.flatten(root));
    }

    private void indent(StringBuilder out, int depth) {
        out.append(" ".repeat(depth * options.indentWidth()));
    }
}
