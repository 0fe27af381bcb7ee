package io.txxt.structure.cli;

import io.txxt.structure.config.LogFormat;
import picocli.CommandLine;

/**
 * Parses the {@code --log-format} option.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
    @Override
    public LogFormat convert(String value) {
        return LogFormat.from(value);
    }
}
