package ai.docsite.omml.diagnostics;

import java.util.Objects;

/**
 * A single recovery performed while compiling an expression.
 */
public record ConversionIssue(IssueType type, String detail) {

    public ConversionIssue {
        Objects.requireNonNull(type, "type");
        detail = detail == null ? "" : detail;
    }

    @Override
    public String toString() {
        return detail.isEmpty() ? type.name() : type.name() + ": " + detail;
    }
}
