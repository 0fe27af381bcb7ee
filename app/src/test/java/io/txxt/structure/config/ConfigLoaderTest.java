package io.txxt.structure.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.txxt.structure.ParserOptions;
import io.txxt.structure.cli.CliArguments;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--output", "verify",
                "--log-format", "json",
                "--tab-width", "8",
                "--indent-width", "2",
                "a.txxt", "b.txxt");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.inputs()).containsExactly(Path.of("a.txxt"), Path.of("b.txxt"));
        assertThat(config.outputMode()).isEqualTo(OutputMode.VERIFY);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.parserOptions()).isEqualTo(new ParserOptions(8, 2));
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_OUTPUT, "tokens");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "JSON");
        envValues.put(ConfigLoader.ENV_TAB_WIDTH, " 2 ");
        envValues.put(ConfigLoader.ENV_INDENT_WIDTH, "3");

        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "doc.txxt");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.outputMode()).isEqualTo(OutputMode.TOKENS);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.parserOptions()).isEqualTo(new ParserOptions(2, 3));
        assertThat(environmentReader.requestedKeys()).contains(ConfigLoader.ENV_OUTPUT, ConfigLoader.ENV_TAB_WIDTH);
    }

    @Test
    void cliValuesWinOverEnvironment() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--output", "tree", "doc.txxt");

        Config config = new ConfigLoader(key -> key.equals(ConfigLoader.ENV_OUTPUT)
                ? Optional.of("detokenize") : Optional.empty()).load(cliArguments);

        assertThat(config.outputMode()).isEqualTo(OutputMode.TREE);
    }

    @Test
    void usesDefaultsWhenNothingIsConfigured() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "doc.txxt");

        Config config = new ConfigLoader(key -> Optional.of("  ")).load(cliArguments);

        assertThat(config.outputMode()).isEqualTo(OutputMode.TREE);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.parserOptions()).isEqualTo(ParserOptions.defaults());
    }

    @Test
    void rejectsNonNumericWidthFromEnvironment() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "doc.txxt");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> key.equals(ConfigLoader.ENV_TAB_WIDTH)
                ? Optional.of("wide") : Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class)
                .hasMessage("TXXT_TAB_WIDTH must be an integer");
    }

    @Test
    void rejectsNonPositiveWidthFromCli() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--indent-width", "0", "doc.txxt");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class)
                .hasMessage("--indent-width must be a positive integer");
    }

    @Test
    void rejectsUnknownOutputModeFromEnvironment() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "doc.txxt");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> key.equals(ConfigLoader.ENV_OUTPUT)
                ? Optional.of("html") : Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported output mode: html");
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {
        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
