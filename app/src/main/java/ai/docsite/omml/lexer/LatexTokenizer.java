package ai.docsite.omml.lexer;

import ai.docsite.omml.diagnostics.IssueCollector;
import ai.docsite.omml.diagnostics.IssueType;
import ai.docsite.omml.symbols.SymbolTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scans a LaTeX math string into tokens, with {@code {...}} groups nested as {@link TokenType#GROUP} tokens.
 *
 * <p>The scan never fails. Consecutive ordinary characters are collected into one {@link TokenType#TEXT}
 * token and source whitespace is dropped, since math-mode spacing is expressed through commands. The
 * group following a text-mode command such as {@code \text} is scanned as prose instead: whitespace
 * runs collapse to a single space and {@code ^ _ & [ ]} are kept as ordinary characters. Groups nested
 * deeper than {@link #MAX_GROUP_DEPTH} are kept as literal text.
 */
public class LatexTokenizer {

    static final int MAX_GROUP_DEPTH = 64;

    private static final String ESCAPED_CHARACTERS = "{}|&%#_";
    private static final String SPACING_TRIGGERS = " ,;!";

    public List<Token> tokenize(String input) {
        return tokenize(input, new IssueCollector());
    }

    public List<Token> tokenize(String input, IssueCollector issues) {
        Objects.requireNonNull(issues, "issues");
        if (input == null || input.isEmpty()) {
            return List.of();
        }
        return scan(input, 0, 0, false, issues).tokens();
    }

    private ScanResult scan(String input, int start, int depth, boolean textMode, IssueCollector issues) {
        boolean nested = depth > 0;
        List<Token> tokens = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int position = start;

        while (position < input.length()) {
            char ch = input.charAt(position);
            switch (ch) {
                case '\\' -> {
                    flush(text, tokens);
                    position = scanBackslash(input, position + 1, tokens);
                }
                case '{' -> {
                    if (depth >= MAX_GROUP_DEPTH) {
                        position = literalGroup(input, position, text, issues);
                    } else {
                        flush(text, tokens);
                        boolean prose = textMode || followsTextCommand(tokens);
                        ScanResult group = scan(input, position + 1, depth + 1, prose, issues);
                        tokens.add(Token.group(group.tokens()));
                        position = group.position();
                    }
                }
                case '}' -> {
                    if (nested) {
                        flush(text, tokens);
                        return new ScanResult(tokens, position + 1);
                    }
                    issues.report(IssueType.UNMATCHED_CLOSE_BRACE, "at offset " + position);
                    text.append(ch);
                    position++;
                }
                case '^', '_', '&', '[', ']' -> {
                    if (textMode) {
                        text.append(ch);
                        position++;
                    } else {
                        position = structural(structuralToken(ch), text, tokens, position);
                    }
                }
                case ' ', '\t', '\n', '\r' -> {
                    if (textMode && (text.length() == 0 || text.charAt(text.length() - 1) != ' ')) {
                        text.append(' ');
                    }
                    position++;
                }
                default -> {
                    text.append(ch);
                    position++;
                }
            }
        }

        flush(text, tokens);
        if (nested) {
            issues.report(IssueType.UNCLOSED_GROUP, "missing '}' before end of input");
        }
        return new ScanResult(tokens, position);
    }

    /**
     * Handles the characters after a backslash and returns the position following the escape.
     */
    private int scanBackslash(String input, int position, List<Token> tokens) {
        if (position >= input.length()) {
            return position;
        }
        char next = input.charAt(position);
        if (next == '\\') {
            tokens.add(Token.newline());
            return position + 1;
        }
        if (ESCAPED_CHARACTERS.indexOf(next) >= 0) {
            tokens.add(Token.text(String.valueOf(next)));
            return position + 1;
        }
        if (SPACING_TRIGGERS.indexOf(next) >= 0) {
            SymbolTable.symbol(String.valueOf(next)).ifPresent(space -> tokens.add(Token.text(space)));
            return position + 1;
        }
        if (Character.isLetter(next)) {
            int end = position;
            while (end < input.length() && Character.isLetter(input.charAt(end))) {
                end++;
            }
            tokens.add(Token.command(input.substring(position, end)));
            return end;
        }
        int codePoint = input.codePointAt(position);
        tokens.add(Token.text(new String(Character.toChars(codePoint))));
        return position + Character.charCount(codePoint);
    }

    /**
     * Appends the brace-balanced span starting at {@code position} to the current text run verbatim and
     * returns the position after it. An unbalanced span runs to the end of input.
     */
    private int literalGroup(String input, int position, StringBuilder text, IssueCollector issues) {
        issues.report(IssueType.NESTING_TOO_DEEP,
                "group at offset " + position + " is nested more than " + MAX_GROUP_DEPTH + " levels");
        int open = 0;
        int end = position;
        while (end < input.length()) {
            char ch = input.charAt(end++);
            if (ch == '\\') {
                end = Math.min(end + 1, input.length());
            } else if (ch == '{') {
                open++;
            } else if (ch == '}' && --open == 0) {
                break;
            }
        }
        text.append(input, position, end);
        return end;
    }

    private static boolean followsTextCommand(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return false;
        }
        Token last = tokens.get(tokens.size() - 1);
        return last.is(TokenType.COMMAND) && SymbolTable.isTextCommand(last.text());
    }

    private static Token structuralToken(char ch) {
        return switch (ch) {
            case '^' -> Token.superscript();
            case '_' -> Token.subscript();
            case '&' -> Token.ampersand();
            case '[' -> Token.openBracket();
            default -> Token.closeBracket();
        };
    }

    private int structural(Token token, StringBuilder text, List<Token> tokens, int position) {
        flush(text, tokens);
        tokens.add(token);
        return position + 1;
    }

    private void flush(StringBuilder text, List<Token> tokens) {
        if (text.length() > 0) {
            tokens.add(Token.text(text.toString()));
            text.setLength(0);
        }
    }

    private record ScanResult(List<Token> tokens, int position) {
    }
}
