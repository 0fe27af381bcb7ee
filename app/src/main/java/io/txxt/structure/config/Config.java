package io.txxt.structure.config;

import io.txxt.structure.ParserOptions;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Resolved command-line configuration.
 *
 * @param inputs documents to structure, in command-line order
 * @param outputMode what to print per document
 * @param logFormat log line encoding
 * @param parserOptions widths used by the lexer and the detokenizer
 */
public record Config(List<Path> inputs, OutputMode outputMode, LogFormat logFormat, ParserOptions parserOptions) {

    public Config {
        inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("At least one input file must be provided");
        }
        Objects.requireNonNull(outputMode, "outputMode");
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(parserOptions, "parserOptions");
    }
}
