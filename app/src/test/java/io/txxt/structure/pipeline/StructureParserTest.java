package io.txxt.structure.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.txxt.structure.block.Block;
import io.txxt.structure.block.BlockKind;
import io.txxt.structure.block.BlockType;
import io.txxt.structure.block.Container;
import io.txxt.structure.block.ContainerKind;
import io.txxt.structure.lexer.LexException;
import io.txxt.structure.token.Position;
import io.txxt.structure.tree.StructuralException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class StructureParserTest {

    private final StructureParser parser = new StructureParser();

    @Test
    void plainLineIsParagraphWithoutContainer() {
        Block block = single(parser.parse("doc", "Hello world"));

        assertThat(block.typeAs(BlockType.Paragraph.class).text()).isEqualTo("Hello world");
        assertThat(block.container()).isEmpty();
    }

    @Test
    void annotationExposesItsLabel() {
        Block block = single(parser.parse("doc", ":: title :: My Document"));

        assertThat(block.typeAs(BlockType.Annotation.class).label()).isEqualTo("title");
        assertThat(block.typeAs(BlockType.Annotation.class).text()).isEqualTo("My Document");
    }

    @Test
    void definitionExposesItsTerm() {
        Block block = single(parser.parse("doc", "Parser ::\n"));

        assertThat(block.typeAs(BlockType.Definition.class).term()).isEqualTo("Parser");
    }

    @Test
    void consecutiveItemsBecomeOneList() {
        Block block = single(parser.parse("doc", "- a\n- b\n"));

        assertThat(block.kind()).isEqualTo(BlockKind.LIST);
        assertThat(block.children())
                .extracting(item -> item.typeAs(BlockType.ListItem.class).marker().text())
                .containsExactly("-", "-");
    }

    @Test
    void titleBlankLineAndIndentedContentMakeASession() {
        Block block = single(parser.parse("doc", "Title\n\n    Body\n"));

        assertThat(block.typeAs(BlockType.Session.class).title()).isEqualTo("Title");
        assertThat(block.container()).map(Container::kind).contains(ContainerKind.SESSION);
        assertThat(block.children()).singleElement()
                .satisfies(body -> assertThat(body.typeAs(BlockType.Paragraph.class).text()).isEqualTo("Body"));
    }

    @Test
    void titleWithoutBlankLineIsNotASession() {
        Block block = single(parser.parse("doc", "Title\n    Body\n"));

        assertThat(block.kind()).isEqualTo(BlockKind.PARAGRAPH);
        assertThat(block.container()).map(Container::kind).contains(ContainerKind.CONTENT);
        assertThat(block.children()).extracting(Block::kind).containsExactly(BlockKind.PARAGRAPH);
    }

    @Test
    void sessionTitleIsASingleLine() {
        Block block = single(parser.parse("doc", "Intro line\nTitle\n\n    Body\n"));

        assertThat(block.kind()).isEqualTo(BlockKind.PARAGRAPH);
        assertThat(block.container()).map(Container::kind).contains(ContainerKind.CONTENT);
        assertThat(block.children()).extracting(Block::kind).containsExactly(BlockKind.PARAGRAPH);
    }

    @Test
    void colonEndedLineWithDeeperLinesOpensVerbatimBeforeListDetection() {
        ParsedDocument document = parser.parse("doc", "- Items:\n    - nested\n- next\n");

        assertThat(document.root().children()).extracting(Block::kind)
                .containsExactly(BlockKind.VERBATIM, BlockKind.LIST);
        BlockType.Verbatim verbatim = document.root().children().get(0).typeAs(BlockType.Verbatim.class);
        assertThat(verbatim.title()).isEqualTo("- Items");
        assertThat(verbatim.lines()).containsExactly("- nested");
    }

    @Test
    void keepsTokensAndSourceNameInTheResult() {
        ParsedDocument document = parser.parse("notes.txxt", "a\n");

        assertThat(document.sourceName()).isEqualTo("notes.txxt");
        assertThat(document.tokens()).hasSize(3);
        assertThat(document.root().kind()).isEqualTo(BlockKind.ROOT);
    }

    @Test
    void decodesUtf8Bytes() {
        Block block = single(parser.parse("doc", "Grüße\n".getBytes(StandardCharsets.UTF_8)));

        assertThat(block.typeAs(BlockType.Paragraph.class).text()).isEqualTo("Grüße");
    }

    @Test
    void rejectsMalformedUtf8WithItsPosition() {
        byte[] bytes = {'o', 'k', '\n', 'a', (byte) 0xC3, '(', '\n'};

        Throwable thrown = catchThrowable(() -> parser.parse("doc", bytes));

        assertThat(thrown).isInstanceOf(LexException.class).hasMessageContaining("Invalid encoding boundary");
        assertThat(((LexException) thrown).position()).isEqualTo(new Position(1, 1));
    }

    @Test
    void propagatesStructuralFailuresWithoutPartialTree() {
        Throwable thrown = catchThrowable(() -> parser.parse("doc", "a\n        b\n    c\n"));

        assertThat(thrown).isInstanceOf(StructuralException.class);
    }

    @Test
    void clearsSourceFromMdcAfterParsing() {
        parser.parse("doc", "text\n");

        assertThat(MDC.get(StructureParser.MDC_SOURCE)).isNull();
    }

    private static Block single(ParsedDocument document) {
        assertThat(document.root().children()).hasSize(1);
        return document.root().children().get(0);
    }
}
