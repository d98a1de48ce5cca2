package ai.docsite.omml.lexer;

/**
 * Classification of tokens produced by {@link LatexTokenizer}.
 */
public enum TokenType {
    TEXT,
    COMMAND,
    GROUP,
    SUPERSCRIPT,
    SUBSCRIPT,
    AMPERSAND,
    NEWLINE,
    OPEN_BRACKET,
    CLOSE_BRACKET;

    public boolean isScript() {
        return this == SUPERSCRIPT || this == SUBSCRIPT;
    }
}
