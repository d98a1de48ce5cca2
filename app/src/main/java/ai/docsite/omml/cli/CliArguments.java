package ai.docsite.omml.cli;

import ai.docsite.omml.config.LogFormat;
import ai.docsite.omml.convert.MathMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "latex2omml", mixinStandardHelpOptions = true, version = "latex2omml 0.1.0",
        description = "Converts LaTeX math expressions into Office Math Markup (OMML)")
public class CliArguments {

    @CommandLine.Option(names = "--mode", converter = MathModeConverter.class, description = "Output wrapping: inline, display or fragment", paramLabel = "MODE")
    private MathMode mode;

    @CommandLine.Option(names = "--input", description = "Read one expression per non-blank line from FILE", paramLabel = "FILE")
    private Path inputFile;

    @CommandLine.Option(names = "--output", description = "Write the fragments to FILE instead of stdout", paramLabel = "FILE")
    private Path outputFile;

    @CommandLine.Option(names = "--strict", description = "Exit with status 1 when an expression had to be repaired")
    private boolean strict;

    @CommandLine.Option(names = "--verbose", description = "Log at debug level")
    private boolean verbose;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Parameters(paramLabel = "EXPR", arity = "0..*", description = "Expressions to convert; stdin is read when none are given")
    private List<String> expressions = new ArrayList<>();

    public MathMode mode() {
        return mode;
    }

    public Path inputFile() {
        return inputFile;
    }

    public Path outputFile() {
        return outputFile;
    }

    public boolean strict() {
        return strict;
    }

    public boolean verbose() {
        return verbose;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public List<String> expressions() {
        return expressions == null ? List.of() : List.copyOf(expressions);
    }
}
