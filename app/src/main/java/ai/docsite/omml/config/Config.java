package ai.docsite.omml.config;

import ai.docsite.omml.convert.MathMode;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration of the command-line converter, assembled from CLI arguments and
 * environment values.
 */
public record Config(
        MathMode mode,
        boolean strict,
        int maxInputLength,
        LogFormat logFormat,
        boolean verbose,
        Optional<Path> inputFile,
        Optional<Path> outputFile,
        List<String> expressions
) {

    public Config {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(logFormat, "logFormat");
        if (maxInputLength < 1) {
            throw new IllegalArgumentException("maxInputLength must be at least 1");
        }
        inputFile = inputFile == null ? Optional.empty() : inputFile;
        outputFile = outputFile == null ? Optional.empty() : outputFile;
        expressions = expressions == null ? List.of() : List.copyOf(expressions);
        if (!expressions.isEmpty() && inputFile.isPresent()) {
            throw new IllegalArgumentException("Expressions and --input cannot be combined");
        }
    }
}
