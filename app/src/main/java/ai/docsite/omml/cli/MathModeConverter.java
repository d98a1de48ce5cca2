package ai.docsite.omml.cli;

import ai.docsite.omml.convert.MathMode;
import picocli.CommandLine;

/**
 * Parses the {@code --mode} option.
 */
public class MathModeConverter implements CommandLine.ITypeConverter<MathMode> {
    @Override
    public MathMode convert(String value) {
        if (value == null || value.isBlank()) {
            throw new CommandLine.TypeConversionException("Mode must not be blank");
        }
        try {
            return MathMode.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
