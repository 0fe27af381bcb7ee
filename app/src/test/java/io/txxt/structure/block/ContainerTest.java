package io.txxt.structure.block;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ContainerTest {

    private static final Block SESSION = block(new BlockType.Session(List.of(), List.of()), 2);
    private static final Block PARAGRAPH = block(new BlockType.Paragraph(List.of()), 4);

    @Test
    void contentContainerRejectsSessions() {
        ContentContainer container = new ContentContainer();

        Throwable thrown = catchThrowable(() -> container.addChild(SESSION));

        assertThat(thrown).isInstanceOf(ContainerInvariantException.class)
                .hasMessageContaining("Session block (lines 3-3)");
        assertThat(((ContainerInvariantException) thrown).rejected()).isSameAs(SESSION);
        assertThat(container.isEmpty()).isTrue();
    }

    @Test
    void contentContainerAcceptsOtherBlocks() {
        ContentContainer container = new ContentContainer();

        container.addChild(PARAGRAPH);

        assertThat(container.children()).containsExactly(PARAGRAPH);
        assertThat(container.kind()).isEqualTo(ContainerKind.CONTENT);
    }

    @Test
    void sessionContainerAcceptsSessions() {
        SessionContainer container = new SessionContainer();

        container.addChild(SESSION);
        container.addChild(PARAGRAPH);

        assertThat(container.children()).containsExactly(SESSION, PARAGRAPH);
        assertThat(container.kind()).isEqualTo(ContainerKind.SESSION);
    }

    private static Block block(BlockType type, int row) {
        return new Block(type, Optional.empty(), new LineRange(row, row), 0);
    }
}
