package ai.docsite.omml.convert;

import ai.docsite.omml.diagnostics.ConversionIssue;
import java.util.List;
import java.util.Objects;

/**
 * OMML produced for one expression together with the issues recovered from while producing it.
 */
public record ConversionResult(String xml, List<ConversionIssue> issues) {

    public ConversionResult {
        Objects.requireNonNull(xml, "xml");
        issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
