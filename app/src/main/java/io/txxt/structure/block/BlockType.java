package io.txxt.structure.block;

import io.txxt.structure.token.SequenceMarker;
import io.txxt.structure.token.Token;
import io.txxt.structure.token.TokenKind;
import io.txxt.structure.token.Tokens;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Closed set of block types. Each type keeps the tokens it was classified from, so its source text can be rebuilt.
 */
public sealed interface BlockType permits BlockType.Root, BlockType.BlankLine, BlockType.Annotation,
        BlockType.Definition, BlockType.Verbatim, BlockType.ListItem, BlockType.ItemList, BlockType.Session,
        BlockType.Paragraph {

    BlockKind kind();

    List<Token> tokens();

    /**
     * Short human readable description used by renderers.
     */
    String summary();

    /** Synthetic document wrapper. */
    record Root() implements BlockType {

        @Override
        public BlockKind kind() {
            return BlockKind.ROOT;
        }

        @Override
        public List<Token> tokens() {
            return List.of();
        }

        @Override
        public String summary() {
            return "";
        }
    }

    record BlankLine(List<Token> tokens) implements BlockType {

        public BlankLine {
            tokens = List.copyOf(tokens);
        }

        @Override
        public BlockKind kind() {
            return BlockKind.BLANK_LINE;
        }

        @Override
        public String summary() {
            return "";
        }
    }

    /**
     * {@code :: label :: content}, with optional parameters after the label.
     *
     * @param tokens every token of the block
     * @param label dotted label between the markers
     * @param parameters parameter, comma and whitespace tokens of the label's parameter list
     * @param content tokens following the closing marker
     */
    record Annotation(List<Token> tokens, String label, List<Token> parameters, List<Token> content)
            implements BlockType {

        public Annotation {
            tokens = List.copyOf(tokens);
            Objects.requireNonNull(label, "label");
            parameters = List.copyOf(parameters);
            content = List.copyOf(content);
        }

        @Override
        public BlockKind kind() {
            return BlockKind.ANNOTATION;
        }

        public String text() {
            return Tokens.text(content);
        }

        public Map<String, String> metadata() {
            return BlockType.metadata(parameters);
        }

        @Override
        public String summary() {
            String text = text();
            return text.isEmpty() ? label : label + ": " + text;
        }
    }

    /**
     * {@code Term ::} with optional {@code :key=value} parameters on the term.
     *
     * @param tokens every token of the block
     * @param termTokens tokens preceding the parameters or the marker
     * @param parameters parameter tokens following the term
     * @param marker the closing definition marker
     */
    record Definition(List<Token> tokens, List<Token> termTokens, List<Token> parameters, Token marker)
            implements BlockType {

        public Definition {
            tokens = List.copyOf(tokens);
            termTokens = List.copyOf(termTokens);
            parameters = List.copyOf(parameters);
            Objects.requireNonNull(marker, "marker");
        }

        @Override
        public BlockKind kind() {
            return BlockKind.DEFINITION;
        }

        public String term() {
            return Tokens.text(termTokens);
        }

        public Map<String, String> metadata() {
            return BlockType.metadata(parameters);
        }

        @Override
        public String summary() {
            return term();
        }
    }

    /**
     * Verbatim block: title, literal content lines and, unless it was closed by a dedent, a closing label.
     */
    record Verbatim(List<Token> tokens, String title, List<String> lines, Optional<String> label,
                    List<Token> parameters) implements BlockType {

        public Verbatim {
            tokens = List.copyOf(tokens);
            Objects.requireNonNull(title, "title");
            lines = List.copyOf(lines);
            Objects.requireNonNull(label, "label");
            parameters = List.copyOf(parameters);
        }

        @Override
        public BlockKind kind() {
            return BlockKind.VERBATIM;
        }

        public String content() {
            return String.join("\n", lines);
        }

        public Map<String, String> metadata() {
            return BlockType.metadata(parameters);
        }

        @Override
        public String summary() {
            return label.map(value -> title + " (" + value + ")").orElse(title);
        }
    }

    /**
     * A line opened by a sequence marker. The marker is kept exactly as authored.
     */
    record ListItem(List<Token> tokens, SequenceMarker marker, List<Token> content) implements BlockType {

        public ListItem {
            tokens = List.copyOf(tokens);
            Objects.requireNonNull(marker, "marker");
            content = List.copyOf(content);
        }

        @Override
        public BlockKind kind() {
            return BlockKind.LIST_ITEM;
        }

        public String text() {
            return Tokens.text(content);
        }

        @Override
        public String summary() {
            return marker.text() + " " + text();
        }
    }

    /**
     * Run of consecutive list items at one level. The items themselves are the children of the list block.
     *
     * @param markers authored marker text of every item, in order
     */
    record ItemList(List<String> markers) implements BlockType {

        public ItemList {
            markers = List.copyOf(markers);
        }

        @Override
        public BlockKind kind() {
            return BlockKind.LIST;
        }

        @Override
        public List<Token> tokens() {
            return List.of();
        }

        public int size() {
            return markers.size();
        }

        @Override
        public String summary() {
            return markers.size() + (markers.size() == 1 ? " item" : " items");
        }
    }

    /**
     * Titled section. Its content is the session container of the owning block.
     *
     * @param tokens title tokens followed by the blank lines separating the title from the content
     * @param titleTokens title tokens only
     */
    record Session(List<Token> tokens, List<Token> titleTokens) implements BlockType {

        public Session {
            tokens = List.copyOf(tokens);
            titleTokens = List.copyOf(titleTokens);
        }

        @Override
        public BlockKind kind() {
            return BlockKind.SESSION;
        }

        public String title() {
            return Tokens.text(titleTokens);
        }

        @Override
        public String summary() {
            return title();
        }
    }

    record Paragraph(List<Token> tokens) implements BlockType {

        public Paragraph {
            tokens = List.copyOf(tokens);
        }

        @Override
        public BlockKind kind() {
            return BlockKind.PARAGRAPH;
        }

        public String text() {
            return Tokens.text(tokens);
        }

        @Override
        public String summary() {
            return text();
        }
    }

    /**
     * Parameter tokens as an insertion-ordered map. Boolean shorthand keys map to {@code "true"}.
     */
    private static Map<String, String> metadata(List<Token> parameters) {
        Map<String, String> values = new LinkedHashMap<>();
        for (Token token : parameters) {
            if (token.is(TokenKind.PARAMETER)) {
                values.put(token.text(), token.value() == null ? "true" : token.value());
            }
        }
        return Collections.unmodifiableMap(values);
    }
}
