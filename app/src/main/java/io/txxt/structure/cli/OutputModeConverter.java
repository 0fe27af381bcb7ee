package io.txxt.structure.cli;

import io.txxt.structure.config.OutputMode;
import picocli.CommandLine;

public class OutputModeConverter implements CommandLine.ITypeConverter<OutputMode> {

    @Override
    public OutputMode convert(String value) {
        return OutputMode.from(value);
    }
}
