package io.txxt.structure.detokenize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.txxt.structure.ParserOptions;
import io.txxt.structure.block.Block;
import io.txxt.structure.block.BlockAssembler;
import io.txxt.structure.block.BlockType;
import io.txxt.structure.block.LineRange;
import io.txxt.structure.lexer.Lexer;
import io.txxt.structure.token.Position;
import io.txxt.structure.token.SourceSpan;
import io.txxt.structure.token.Token;
import io.txxt.structure.token.TokenKind;
import io.txxt.structure.tree.TokenTreeBuilder;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DetokenizerTest {

    private final Lexer lexer = new Lexer();
    private final Detokenizer detokenizer = new Detokenizer();

    @Test
    void reproducesCanonicalSourceExactly() {
        String source = "Title\n\n    - one\n    2. two\n\n    :: note:lang=en :: Remember *this*\n";

        assertThat(detokenizer.detokenize(lexer.tokenize(source))).isEqualTo(source);
    }

    @Test
    void normalizesIndentationToTheConfiguredWidth() {
        String source = "a\n  b\n\tc\n";
        List<Token> tokens = new Lexer(new ParserOptions(2, 4)).tokenize(source);

        assertThat(detokenizer.detokenize(tokens)).isEqualTo("a\n    b\n    c\n");
        assertThat(new Detokenizer(new ParserOptions(4, 2)).detokenize(tokens)).isEqualTo("a\n  b\n  c\n");
    }

    @Test
    void quotesParameterValuesThatNeedIt() {
        String source = ":: ref:title=\"a, b\",draft ::\n";

        assertThat(detokenizer.detokenize(lexer.tokenize(source))).isEqualTo(source);
    }

    @Test
    void rebuildsVerbatimWallsAndLabels() {
        String source = "Intro\n    Code:\n        x = 1\n    :: python\n";

        assertThat(detokenizer.detokenize(lexer.tokenize(source))).isEqualTo(source);
    }

    @Test
    void rejectsDedentBelowLevelZero() {
        Throwable thrown = catchThrowable(() -> detokenizer.detokenize(
                List.of(Token.of(TokenKind.DEDENT, SourceSpan.empty(Position.ORIGIN)))));

        assertThat(thrown).isInstanceOf(DetokenizeException.class).hasMessageContaining("Unmatched dedent");
    }

    @Test
    void detokenizesBlockTrees() {
        String source = "Title\n\n    Body\n\nNext\n";
        Block root = new BlockAssembler().assemble(new TokenTreeBuilder().build(lexer.tokenize(source)));

        assertThat(detokenizer.detokenize(root)).isEqualTo(source);
    }

    @Test
    void flattensBlockTreeBackToTheLexerTokens() {
        String source = "- a\n    nested\n- b\n\n:: end ::\n";
        List<Token> tokens = lexer.tokenize(source);
        Block root = new BlockAssembler().assemble(new TokenTreeBuilder().build(tokens));

        List<Token> flattened = new BlockFlattener().flatten(root);

        assertThat(flattened).extracting(Token::kind).containsExactlyElementsOf(
                tokens.stream().map(Token::kind).toList());
    }

    @Test
    void rejectsBlocksWithoutTokens() {
        Block empty = new Block(new BlockType.Paragraph(List.of()), Optional.empty(), new LineRange(0, 0), 0);

        Throwable thrown = catchThrowable(() -> new BlockFlattener().flatten(empty));

        assertThat(thrown).isInstanceOf(DetokenizeException.class).hasMessageContaining("Paragraph block");
    }
}
