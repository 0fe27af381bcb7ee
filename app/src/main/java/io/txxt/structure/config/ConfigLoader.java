package io.txxt.structure.config;

import io.txxt.structure.ParserOptions;
import io.txxt.structure.cli.CliArguments;
import java.util.Objects;

/**
 * Builds a {@link Config} from CLI arguments, then environment variables, then defaults.
 */
public class ConfigLoader {

    static final String ENV_OUTPUT = "TXXT_OUTPUT";
    static final String ENV_LOG_FORMAT = "TXXT_LOG_FORMAT";
    static final String ENV_TAB_WIDTH = "TXXT_TAB_WIDTH";
    static final String ENV_INDENT_WIDTH = "TXXT_INDENT_WIDTH";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        OutputMode outputMode = resolveOutputMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        int tabWidth = resolveWidth(arguments.tabWidth(), "--tab-width", ENV_TAB_WIDTH, ParserOptions.DEFAULT_TAB_WIDTH);
        int indentWidth = resolveWidth(arguments.indentWidth(), "--indent-width", ENV_INDENT_WIDTH,
                ParserOptions.DEFAULT_INDENT_WIDTH);
        return new Config(arguments.inputs(), outputMode, logFormat, new ParserOptions(tabWidth, indentWidth));
    }

    private OutputMode resolveOutputMode(CliArguments arguments) {
        if (arguments.outputMode() != null) {
            return arguments.outputMode();
        }
        return environmentReader.get(ENV_OUTPUT)
                .filter(ConfigLoader::isNotBlank)
                .map(OutputMode::from)
                .orElse(OutputMode.TREE);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        if (arguments.logFormat() != null) {
            return arguments.logFormat();
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolveWidth(Integer cliValue, String optionName, String envKey, int defaultValue) {
        if (cliValue != null) {
            if (cliValue < 1) {
                throw new IllegalArgumentException(optionName + " must be a positive integer");
            }
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parsePositiveInteger(raw, envKey))
                .orElse(defaultValue);
    }

    private static int parsePositiveInteger(String raw, String key) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(key + " must be a positive integer");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
