package io.txxt.structure.pipeline;

import io.txxt.structure.ParserOptions;
import io.txxt.structure.block.Block;
import io.txxt.structure.block.BlockAssembler;
import io.txxt.structure.lexer.LexException;
import io.txxt.structure.lexer.Lexer;
import io.txxt.structure.token.Position;
import io.txxt.structure.token.Token;
import io.txxt.structure.tree.TokenBlock;
import io.txxt.structure.tree.TokenTreeBuilder;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs lexer, tree builder and assembler over one document. Instances hold no per-document state and may be shared.
 */
public class StructureParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(StructureParser.class);
    static final String MDC_SOURCE = "source";

    private final Lexer lexer;
    private final TokenTreeBuilder treeBuilder;
    private final BlockAssembler assembler;

    public StructureParser() {
        this(ParserOptions.defaults());
    }

    public StructureParser(ParserOptions options) {
        this(new Lexer(options), new TokenTreeBuilder(), new BlockAssembler());
    }

    StructureParser(Lexer lexer, TokenTreeBuilder treeBuilder, BlockAssembler assembler) {
        this.lexer = Objects.requireNonNull(lexer, "lexer");
        this.treeBuilder = Objects.requireNonNull(treeBuilder, "treeBuilder");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
    }

    /**
     * @throws io.txxt.structure.TxxtException when the document cannot be lexed or structured; no partial tree
     *         is produced
     */
    public ParsedDocument parse(String sourceName, String source) {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(source, "source");
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SOURCE, sourceName)) {
            List<Token> tokens = lexer.tokenize(source);
            TokenBlock tree = treeBuilder.build(tokens);
            Block root = assembler.assemble(tree);
            LOGGER.debug("Structured {}: {} tokens, {} top-level blocks", sourceName, tokens.size(),
                    root.children().size());
            return new ParsedDocument(sourceName, tokens, root);
        }
    }

    /**
     * Decodes strict UTF-8 and parses the result.
     */
    public ParsedDocument parse(String sourceName, byte[] source) {
        Objects.requireNonNull(source, "source");
        return parse(sourceName, decode(source));
    }

    static String decode(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(bytes);
        CharBuffer out = CharBuffer.allocate(bytes.length);
        CoderResult result = decoder.decode(in, out, true);
        if (!result.isError()) {
            result = decoder.flush(out);
        }
        if (result.isError()) {
            throw new LexException("Invalid encoding boundary: malformed UTF-8", positionOf(bytes, in.position()));
        }
        return out.flip().toString();
    }

    private static Position positionOf(byte[] bytes, int offset) {
        int row = 0;
        int lineStart = 0;
        for (int i = 0; i < offset; i++) {
            if (bytes[i] == '\n') {
                row++;
                lineStart = i + 1;
            }
        }
        return new Position(row, offset - lineStart);
    }
}
