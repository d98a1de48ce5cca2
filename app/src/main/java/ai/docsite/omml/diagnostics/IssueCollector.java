package ai.docsite.omml.diagnostics;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates the issues of one compile call. Not thread safe; create one per call.
 */
public class IssueCollector {

    private static final Logger LOGGER = LoggerFactory.getLogger(IssueCollector.class);

    private final List<ConversionIssue> issues = new ArrayList<>();

    public void report(IssueType type, String detail) {
        ConversionIssue issue = new ConversionIssue(type, detail);
        LOGGER.debug("Recovered from malformed math input: {}", issue);
        issues.add(issue);
    }

    public List<ConversionIssue> issues() {
        return List.copyOf(issues);
    }
}
