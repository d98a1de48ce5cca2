package ai.docsite.omml.cli;

import ai.docsite.omml.config.Config;
import ai.docsite.omml.config.ConfigLoader;
import ai.docsite.omml.config.SystemEnvironmentReader;
import ai.docsite.omml.convert.ConversionResult;
import ai.docsite.omml.convert.LatexMathConverter;
import ai.docsite.omml.diagnostics.ConversionIssue;
import ai.docsite.omml.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and converter.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final LatexMathConverter converter;
    private final InputStream stdin;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new LatexMathConverter(), System.in,
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, LatexMathConverter converter, InputStream stdin,
                   PrintWriter out, PrintWriter err) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.converter = Objects.requireNonNull(converter, "converter");
        this.stdin = Objects.requireNonNull(stdin, "stdin");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
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
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.debug("Converting in {} mode (strict={}, maxInputLength={})",
                config.mode(), config.strict(), config.maxInputLength());

        try {
            return convertAll(config);
        } catch (UncheckedIOException ex) {
            LOGGER.error("I/O failure: {}", ex.getMessage(), ex);
            commandLine.getErr().println(ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int convertAll(Config config) {
        List<String> expressions = readExpressions(config);
        for (int i = 0; i < expressions.size(); i++) {
            int length = expressions.get(i).length();
            if (length > config.maxInputLength()) {
                err.printf("Expression %d is %d characters long; the limit is %d%n",
                        i + 1, length, config.maxInputLength());
                return EXIT_FAILURE;
            }
        }

        List<String> fragments = new ArrayList<>(expressions.size());
        int issueCount = 0;
        for (int i = 0; i < expressions.size(); i++) {
            ConversionResult result = converter.convert(expressions.get(i), config.mode());
            fragments.add(result.xml());
            for (ConversionIssue issue : result.issues()) {
                issueCount++;
                if (config.strict()) {
                    err.printf("Expression %d: %s%n", i + 1, issue);
                } else {
                    LOGGER.debug("Expression {}: {}", i + 1, issue);
                }
            }
        }
        writeFragments(config, fragments);
        LOGGER.info("Converted {} expression(s) in {} mode with {} issue(s)",
                fragments.size(), config.mode(), issueCount);
        return config.strict() && issueCount > 0 ? EXIT_FAILURE : EXIT_OK;
    }

    private List<String> readExpressions(Config config) {
        if (!config.expressions().isEmpty()) {
            return config.expressions();
        }
        if (config.inputFile().isPresent()) {
            Path input = config.inputFile().get();
            try {
                return Files.readAllLines(input, StandardCharsets.UTF_8).stream()
                        .map(String::strip)
                        .filter(line -> !line.isEmpty())
                        .collect(Collectors.toList());
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to read " + input, ex);
            }
        }
        try {
            String all = new String(stdin.readAllBytes(), StandardCharsets.UTF_8).strip();
            if (all.isEmpty()) {
                LOGGER.warn("No expression given on the command line or stdin");
                return List.of();
            }
            return List.of(all);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read stdin", ex);
        }
    }

    private void writeFragments(Config config, List<String> fragments) {
        if (config.outputFile().isPresent()) {
            Path output = config.outputFile().get();
            try {
                Files.write(output, fragments, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to write " + output, ex);
            }
            return;
        }
        fragments.forEach(out::println);
        out.flush();
    }
}
