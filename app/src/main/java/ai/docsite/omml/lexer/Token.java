package ai.docsite.omml.lexer;

import java.util.List;
import java.util.Objects;

/**
 * A lexical unit of a LaTeX math expression.
 *
 * <p>{@code text} holds the characters of a {@link TokenType#TEXT} token or the name of a
 * {@link TokenType#COMMAND} (without the backslash); {@code children} holds the content of a
 * {@link TokenType#GROUP}. Both are empty for structural tokens.
 */
public record Token(TokenType type, String text, List<Token> children) {

    private static final Token SUPERSCRIPT = new Token(TokenType.SUPERSCRIPT, "", List.of());
    private static final Token SUBSCRIPT = new Token(TokenType.SUBSCRIPT, "", List.of());
    private static final Token AMPERSAND = new Token(TokenType.AMPERSAND, "", List.of());
    private static final Token NEWLINE = new Token(TokenType.NEWLINE, "", List.of());
    private static final Token OPEN_BRACKET = new Token(TokenType.OPEN_BRACKET, "", List.of());
    private static final Token CLOSE_BRACKET = new Token(TokenType.CLOSE_BRACKET, "", List.of());

    public Token {
        Objects.requireNonNull(type, "type");
        text = text == null ? "" : text;
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Token text(String text) {
        return new Token(TokenType.TEXT, text, List.of());
    }

    public static Token command(String name) {
        return new Token(TokenType.COMMAND, name, List.of());
    }

    public static Token group(List<Token> children) {
        return new Token(TokenType.GROUP, "", children);
    }

    public static Token superscript() {
        return SUPERSCRIPT;
    }

    public static Token subscript() {
        return SUBSCRIPT;
    }

    public static Token ampersand() {
        return AMPERSAND;
    }

    public static Token newline() {
        return NEWLINE;
    }

    public static Token openBracket() {
        return OPEN_BRACKET;
    }

    public static Token closeBracket() {
        return CLOSE_BRACKET;
    }

    public boolean is(TokenType candidate) {
        return type == candidate;
    }

    public boolean isCommand(String name) {
        return type == TokenType.COMMAND && text.equals(name);
    }

    @Override
    public String toString() {
        return switch (type) {
            case TEXT -> "Text(" + text + ")";
            case COMMAND -> "Command(" + text + ")";
            case GROUP -> "Group" + children;
            default -> type.name();
        };
    }
}
