package io.txxt.structure.lexer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.txxt.structure.token.Position;
import io.txxt.structure.token.Token;
import io.txxt.structure.token.TokenKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class ParameterScannerTest {

    private final ParameterScanner scanner = new ParameterScanner();

    @Test
    void scansUnquotedQuotedAndShorthandParameters() {
        List<Token> tokens = scanner.scan("a=1,b=\"x, y\", flag", Position.ORIGIN).orElseThrow();

        assertThat(tokens)
                .extracting(Token::kind, Token::text, Token::value)
                .containsExactly(
                        tuple(TokenKind.PARAMETER, "a", "1"),
                        tuple(TokenKind.COMMA, ",", null),
                        tuple(TokenKind.PARAMETER, "b", "x, y"),
                        tuple(TokenKind.COMMA, ",", null),
                        tuple(TokenKind.WHITESPACE, " ", null),
                        tuple(TokenKind.PARAMETER, "flag", null));
    }

    @Test
    void decodesEscapesInQuotedValues() {
        List<Token> tokens = scanner.scan("msg=\"say \\\"hi\\\"\\n\"", Position.ORIGIN).orElseThrow();

        assertThat(tokens).singleElement().extracting(Token::value).isEqualTo("say \"hi\"\n");
    }

    @Test
    void offsetsSpansFromTheStartPosition() {
        List<Token> tokens = scanner.scan("k=v", new Position(3, 10)).orElseThrow();

        assertThat(tokens.get(0).span().start()).isEqualTo(new Position(3, 10));
        assertThat(tokens.get(0).span().end()).isEqualTo(new Position(3, 13));
    }

    @Test
    void rejectsTextThatIsNotAParameterList() {
        assertThat(scanner.scan("", Position.ORIGIN)).isEmpty();
        assertThat(scanner.scan("9lives=1", Position.ORIGIN)).isEmpty();
        assertThat(scanner.scan("key=\"unterminated", Position.ORIGIN)).isEmpty();
        assertThat(scanner.scan(" explained", Position.ORIGIN)).isEmpty();
    }

    @Test
    void formatsValuesSoTheScannerReadsThemBack() {
        assertThat(ParameterSyntax.format("draft", null)).isEqualTo("draft");
        assertThat(ParameterSyntax.format("lang", "en")).isEqualTo("lang=en");
        assertThat(ParameterSyntax.format("title", "a, b")).isEqualTo("title=\"a, b\"");
        assertThat(ParameterSyntax.format("path", "C:\\dir")).isEqualTo("path=\"C:\\\\dir\"");
        assertThat(ParameterSyntax.format("empty", "")).isEqualTo("empty=\"\"");

        String formatted = ParameterSyntax.format("note", "line\tone \"quoted\"");
        List<Token> scanned = scanner.scan(formatted, Position.ORIGIN).orElseThrow();
        assertThat(scanned).singleElement().extracting(Token::value).isEqualTo("line\tone \"quoted\"");
    }
}
