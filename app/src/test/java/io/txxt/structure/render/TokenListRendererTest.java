package io.txxt.structure.render;

import static org.assertj.core.api.Assertions.assertThat;

import io.txxt.structure.lexer.Lexer;
import org.junit.jupiter.api.Test;

class TokenListRendererTest {

    private final Lexer lexer = new Lexer();
    private final TokenListRenderer renderer = new TokenListRenderer();

    @Test
    void rendersKindSpanAndPayload() {
        assertThat(renderer.render(lexer.tokenize("- a"))).isEqualTo("""
                SEQUENCE_MARKER 0:0-0:1 "-" PLAIN
                WHITESPACE 0:1-0:2 " "
                TEXT 0:2-0:3 "a"
                EOF 0:3-0:3
                """);
    }

    @Test
    void showsOrderedMarkerValues() {
        assertThat(renderer.render(lexer.tokenize("2. b")).lines().findFirst())
                .contains("SEQUENCE_MARKER 0:0-0:2 \"2.\" NUMERICAL 2");
    }

    @Test
    void showsParameterValuesQuoted() {
        assertThat(renderer.render(lexer.tokenize(":: ref:title=\"a b\",draft ::")).lines())
                .contains("PARAMETER 0:7-0:18 title=\"a b\"", "PARAMETER 0:19-0:24 draft");
    }
}
