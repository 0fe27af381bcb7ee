package io.txxt.structure.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;

import io.txxt.structure.lexer.Lexer;
import io.txxt.structure.token.Position;
import io.txxt.structure.token.SourceSpan;
import io.txxt.structure.token.Token;
import io.txxt.structure.token.TokenKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class TokenTreeBuilderTest {

    private static final SourceSpan AT_ORIGIN = SourceSpan.empty(Position.ORIGIN);

    private final Lexer lexer = new Lexer();
    private final TokenTreeBuilder builder = new TokenTreeBuilder();

    @Test
    void nestsTokensByIndentAndDedent() {
        TokenBlock root = builder.nest(lexer.tokenize("a\n    b\n        c\nd\n"));

        assertThat(root.tokens()).extracting(Token::text).containsExactly("a", "", "d", "");
        assertThat(root.children()).singleElement().satisfies(level1 -> {
            assertThat(level1.indentLevel()).isEqualTo(1);
            assertThat(level1.children()).singleElement()
                    .extracting(TokenBlock::indentLevel).isEqualTo(2);
        });
    }

    @Test
    void splitsParagraphsAtBlankLines() {
        TokenBlock root = builder.build(lexer.tokenize("one\ntwo\n\nthree\n"));

        assertThat(root.tokens()).isEmpty();
        assertThat(root.children())
                .extracting(TokenBlock::isBlankLine, TokenBlock::startLine, TokenBlock::endLine)
                .containsExactly(
                        tuple(false, 0, 1),
                        tuple(true, 2, 2),
                        tuple(false, 3, 3));
    }

    @Test
    void attachesIndentedBlockToTheGroupBeforeItAbsorbingBlankLines() {
        TokenBlock root = builder.build(lexer.tokenize("Title\n\n    Body\n"));

        assertThat(root.children()).singleElement().satisfies(title -> {
            assertThat(title.tokens()).extracting(Token::kind)
                    .containsExactly(TokenKind.TEXT, TokenKind.NEWLINE, TokenKind.BLANK_LINE);
            assertThat(title.children()).singleElement().satisfies(body -> {
                assertThat(body.indentLevel()).isEqualTo(1);
                assertThat(body.startLine()).isEqualTo(2);
            });
        });
    }

    @Test
    void startsNewGroupAtEveryListItem() {
        TokenBlock root = builder.build(lexer.tokenize("- a\n- b\n"));

        assertThat(root.children()).extracting(TokenBlock::startLine).containsExactly(0, 1);
    }

    @Test
    void separatesDefinitionAndAnnotationLinesFromFollowingText() {
        TokenBlock root = builder.build(lexer.tokenize("Term ::\nplain text\n:: note ::\nmore text\n"));

        assertThat(root.children()).extracting(TokenBlock::startLine).containsExactly(0, 1, 2, 3);
    }

    @Test
    void keepsVerbatimLinesTogether() {
        TokenBlock root = builder.build(lexer.tokenize("Intro\nCode:\n    x\n\n    y\n:: end\nafter\n"));

        assertThat(root.children())
                .extracting(TokenBlock::startLine, TokenBlock::endLine)
                .containsExactly(tuple(0, 0), tuple(1, 5), tuple(6, 6));
    }

    @Test
    void resumesParentTextAfterAChildAsANewGroup() {
        TokenBlock root = builder.build(lexer.tokenize("first\n    nested\nsecond\n"));

        assertThat(root.children()).hasSize(2);
        assertThat(root.children().get(0).children()).hasSize(1);
        assertThat(root.children().get(1).startLine()).isEqualTo(2);
    }

    @Test
    void hoistsIndentedGroupsWithoutAPrecedingSibling() {
        TokenBlock root = builder.build(lexer.tokenize("    indented\n"));

        assertThat(root.children()).singleElement()
                .extracting(TokenBlock::indentLevel, TokenBlock::startLine)
                .containsExactly(1, 0);
    }

    @Test
    void rejectsUnmatchedDedent() {
        Throwable thrown = catchThrowable(() -> builder.build(List.of(
                Token.of(TokenKind.DEDENT, AT_ORIGIN), Token.of(TokenKind.EOF, AT_ORIGIN))));

        assertThat(thrown).isInstanceOf(StructuralException.class).hasMessageContaining("Unmatched dedent");
    }

    @Test
    void rejectsIndentLeftOpenAtEndOfInput() {
        Throwable thrown = catchThrowable(() -> builder.build(List.of(
                Token.of(TokenKind.INDENT, AT_ORIGIN),
                Token.ofText(TokenKind.TEXT, AT_ORIGIN, "x"),
                Token.of(TokenKind.EOF, AT_ORIGIN))));

        assertThat(thrown).isInstanceOf(StructuralException.class).hasMessageContaining("left open");
    }
}
