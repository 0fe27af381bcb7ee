package io.txxt.structure.render;

import io.txxt.structure.token.Token;
import java.util.List;

/**
 * Renders tokens one per line as {@code KIND start-end payload}.
 */
public class TokenListRenderer {

    public String render(List<Token> tokens) {
        StringBuilder out = new StringBuilder();
        for (Token token : tokens) {
            out.append(token.kind()).append(' ').append(token.span().start()).append('-').append(token.span().end());
            String payload = payload(token);
            if (!payload.isEmpty()) {
                out.append(' ').append(payload);
            }
            out.append('\n');
        }
        return out.toString();
    }

    private static String payload(Token token) {
        return switch (token.kind()) {
            case PARAMETER -> token.value() == null ? token.text() : token.text() + "=" + quote(token.value());
            case SEQUENCE_MARKER -> quote(token.text()) + " " + token.sequenceMarker().style()
                    + (token.sequenceMarker().isOrdered() ? " " + token.sequenceMarker().value() : "");
            default -> token.kind().carriesText() ? quote(token.text()) : "";
        };
    }

    private static String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\t", "\\t") + '"';
    }
}
