package io.txxt.structure.cli;

import io.txxt.structure.TxxtException;
import io.txxt.structure.config.Config;
import io.txxt.structure.config.ConfigLoader;
import io.txxt.structure.config.SystemEnvironmentReader;
import io.txxt.structure.detokenize.Detokenizer;
import io.txxt.structure.detokenize.RoundTripReport;
import io.txxt.structure.detokenize.RoundTripVerifier;
import io.txxt.structure.lexer.Lexer;
import io.txxt.structure.logging.LoggingConfigurator;
import io.txxt.structure.pipeline.ParsedDocument;
import io.txxt.structure.pipeline.StructureParser;
import io.txxt.structure.render.BlockTreeRenderer;
import io.txxt.structure.render.TokenListRenderer;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, the configuration loader and the structuring pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.debug("Structuring {} document(s) with output {} and {}", config.inputs().size(),
                config.outputMode(), config.parserOptions());

        StructureParser parser = new StructureParser(config.parserOptions());
        Detokenizer detokenizer = new Detokenizer(config.parserOptions());
        RoundTripVerifier verifier = new RoundTripVerifier(new Lexer(config.parserOptions()), detokenizer);
        int failures = 0;
        for (Path input : config.inputs()) {
            String sourceName = input.toString();
            try {
                ParsedDocument document = parser.parse(sourceName, Files.readAllBytes(input));
                if (config.inputs().size() > 1) {
                    out.println("== " + sourceName + " ==");
                }
                if (!print(config, document, detokenizer, verifier)) {
                    failures++;
                }
            } catch (IOException ex) {
                failures++;
                LOGGER.warn("Failed to read {}", sourceName, ex);
                err.println(sourceName + ": cannot read file: " + ex.getMessage());
            } catch (TxxtException ex) {
                failures++;
                LOGGER.warn("Failed to structure {}: {}", sourceName, ex.getMessage());
                err.println(sourceName + ": " + ex.getMessage());
            }
        }
        out.flush();
        err.flush();
        return failures == 0 ? 0 : 1;
    }

    /**
     * Prints one document in the configured output mode. Returns false when a round-trip check failed.
     */
    private boolean print(Config config, ParsedDocument document, Detokenizer detokenizer, RoundTripVerifier verifier) {
        switch (config.outputMode()) {
            case TREE -> out.print(new BlockTreeRenderer().render(document.root()));
            case TOKENS -> out.print(new TokenListRenderer().render(document.tokens()));
            case DETOKENIZE -> out.print(detokenizer.detokenize(document.root()));
            case VERIFY -> {
                RoundTripReport report = verifier.verify(document.tokens(), document.root());
                if (report.matches()) {
                    out.println(document.sourceName() + ": ok");
                    return true;
                }
                out.println(document.sourceName() + ": round trip differs at token "
                        + report.firstMismatchIndex().orElse(-1));
                return false;
            }
        }
        return true;
    }
}
