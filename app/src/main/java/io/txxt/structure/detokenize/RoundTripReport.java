package io.txxt.structure.detokenize;

import io.txxt.structure.token.Token;
import io.txxt.structure.token.Tokens;
import java.util.List;
import java.util.OptionalInt;

/**
 * Outcome of one round trip: the reconstructed text and the token sequences compared.
 *
 * @param reconstructed text produced by the detokenizer
 * @param expected tokens of the original source
 * @param actual tokens of the reconstructed text
 */
public record RoundTripReport(String reconstructed, List<Token> expected, List<Token> actual) {

    public RoundTripReport {
        expected = List.copyOf(expected);
        actual = List.copyOf(actual);
    }

    public boolean matches() {
        return Tokens.contentEquals(expected, actual);
    }

    public OptionalInt firstMismatchIndex() {
        return Tokens.firstDifference(expected, actual);
    }
}
