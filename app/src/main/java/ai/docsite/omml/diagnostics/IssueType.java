package ai.docsite.omml.diagnostics;

/**
 * Kinds of malformed or unsupported input the compiler recovered from.
 */
public enum IssueType {
    UNKNOWN_COMMAND,
    UNKNOWN_ENVIRONMENT,
    UNCLOSED_GROUP,
    UNMATCHED_CLOSE_BRACE,
    UNCLOSED_ENVIRONMENT,
    UNCLOSED_DELIMITER,
    UNCLOSED_OPTIONAL_ARGUMENT,
    MISSING_ARGUMENT,
    MISSING_BASE,
    STRAY_TOKEN,
    NESTING_TOO_DEEP
}
