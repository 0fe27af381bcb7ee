package io.txxt.structure.lexer;

import static org.assertj.core.api.Assertions.assertThat;

import io.txxt.structure.token.MarkerStyle;
import io.txxt.structure.token.SequenceMarker;
import org.junit.jupiter.api.Test;

class SequenceMarkerReaderTest {

    private final SequenceMarkerReader reader = new SequenceMarkerReader();

    @Test
    void readsEveryMarkerStyle() {
        assertThat(reader.read("- item", 0)).contains(new SequenceMarker(MarkerStyle.PLAIN, 0, "-"));
        assertThat(reader.read("12. item", 0)).contains(new SequenceMarker(MarkerStyle.NUMERICAL, 12, "12."));
        assertThat(reader.read("b) item", 0)).contains(new SequenceMarker(MarkerStyle.ALPHABETICAL, 2, "b)"));
        assertThat(reader.read("XIV. item", 0)).contains(new SequenceMarker(MarkerStyle.ROMAN, 14, "XIV."));
    }

    @Test
    void prefersRomanOverAlphabeticalForSingleLetters() {
        assertThat(reader.read("i. first", 0)).contains(new SequenceMarker(MarkerStyle.ROMAN, 1, "i."));
        assertThat(reader.read("x) tenth", 0)).contains(new SequenceMarker(MarkerStyle.ROMAN, 10, "x)"));
    }

    @Test
    void fallsBackToAlphabeticalForNonCanonicalNumerals() {
        assertThat(reader.read("iiii. item", 0)).isEmpty();
        assertThat(reader.read("A. item", 0)).contains(new SequenceMarker(MarkerStyle.ALPHABETICAL, 1, "A."));
    }

    @Test
    void requiresWhitespaceAfterTheMarker() {
        assertThat(reader.read("-item", 0)).isEmpty();
        assertThat(reader.read("1.5 percent", 0)).isEmpty();
        assertThat(reader.read("3.", 0)).isEmpty();
        assertThat(reader.read("Hello world", 0)).isEmpty();
    }

    @Test
    void readsFromTheGivenOffset() {
        assertThat(reader.read("    2) nested", 4)).contains(new SequenceMarker(MarkerStyle.NUMERICAL, 2, "2)"));
    }

    @Test
    void computesCanonicalRomanValues() {
        assertThat(SequenceMarkerReader.romanValue("xxxix")).isEqualTo(39);
        assertThat(SequenceMarkerReader.romanValue("ix")).isEqualTo(9);
        assertThat(SequenceMarkerReader.romanValue("iix")).isZero();
        assertThat(SequenceMarkerReader.romanValue("xl")).isZero();
    }
}
