package ai.docsite.omml.config;

import ai.docsite.omml.cli.CliArguments;
import ai.docsite.omml.convert.MathMode;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 * A value given on the command line wins over the environment, which wins over the default.
 */
public class ConfigLoader {

    static final String ENV_MODE = "OMML_MODE";
    static final String ENV_STRICT = "OMML_STRICT";
    static final String ENV_MAX_INPUT_LENGTH = "OMML_MAX_INPUT_LENGTH";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_VERBOSE = "OMML_VERBOSE";

    static final int DEFAULT_MAX_INPUT_LENGTH = 10_000;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        MathMode mode = resolveMode(arguments);
        boolean strict = arguments.strict() || resolveFlag(ENV_STRICT);
        boolean verbose = arguments.verbose() || resolveFlag(ENV_VERBOSE);
        LogFormat logFormat = resolveLogFormat(arguments);
        int maxInputLength = environmentReader.nonBlank(ENV_MAX_INPUT_LENGTH)
                .map(ConfigLoader::parseMaxInputLength)
                .orElse(DEFAULT_MAX_INPUT_LENGTH);

        return new Config(mode, strict, maxInputLength, logFormat, verbose,
                Optional.ofNullable(arguments.inputFile()),
                Optional.ofNullable(arguments.outputFile()),
                arguments.expressions());
    }

    private MathMode resolveMode(CliArguments arguments) {
        MathMode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.nonBlank(ENV_MODE)
                .map(MathMode::from)
                .orElse(MathMode.INLINE);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.nonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveFlag(String key) {
        return environmentReader.nonBlank(key)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private static int parseMaxInputLength(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_MAX_INPUT_LENGTH + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_MAX_INPUT_LENGTH + " must be an integer", ex);
        }
    }
}
