package io.txxt.structure.cli;

import io.txxt.structure.config.LogFormat;
import io.txxt.structure.config.OutputMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "txxt-structure", mixinStandardHelpOptions = true,
        description = "Lexes txxt documents and prints their block structure")
public class CliArguments {

    @CommandLine.Parameters(arity = "1..*", paramLabel = "FILE", description = "txxt documents to structure")
    private List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = "--output", converter = OutputModeConverter.class,
            description = "Output: tree, tokens, detokenize or verify")
    private OutputMode outputMode;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--tab-width", description = "Columns a tab adds to indentation width", paramLabel = "COLUMNS")
    private Integer tabWidth;

    @CommandLine.Option(names = "--indent-width", description = "Spaces per level in detokenized output", paramLabel = "SPACES")
    private Integer indentWidth;

    public List<Path> inputs() {
        return inputs;
    }

    public OutputMode outputMode() {
        return outputMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public Integer tabWidth() {
        return tabWidth;
    }

    public Integer indentWidth() {
        return indentWidth;
    }
}
