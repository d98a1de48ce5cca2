package ai.docsite.omml.render;

import ai.docsite.omml.lexer.Token;
import ai.docsite.omml.lexer.TokenType;
import ai.docsite.omml.symbols.SymbolTable;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a {@code \left ... \right} construct whose {@code \left} has already been consumed.
 */
final class DelimiterParser {

    private static final String INVISIBLE = ".";

    private DelimiterParser() {
    }

    static Delimited read(TokenReader reader) {
        String open = readDelimiter(reader);
        List<Token> body = new ArrayList<>();
        int depth = 1;
        while (reader.hasNext()) {
            Token token = reader.next();
            if (token.isCommand("left")) {
                depth++;
            } else if (token.isCommand("right")) {
                depth--;
                if (depth == 0) {
                    String close = readDelimiter(reader);
                    return new Delimited(open, body, close, true);
                }
            }
            body.add(token);
        }
        return new Delimited(open, body, "", false);
    }

    /**
     * Resolves the delimiter operand following {@code \left} or {@code \right}. Of a text run only the
     * first character is the delimiter; the rest is returned to the stream.
     */
    static String readDelimiter(TokenReader reader) {
        if (!reader.hasNext()) {
            return "";
        }
        Token token = reader.next();
        String glyph;
        switch (token.type()) {
            case TEXT -> {
                String text = token.text();
                if (text.isEmpty()) {
                    return "";
                }
                int split = text.offsetByCodePoints(0, 1);
                if (split < text.length()) {
                    reader.pushBack(Token.text(text.substring(split)));
                }
                glyph = text.substring(0, split);
            }
            case COMMAND -> glyph = SymbolTable.delimiter(token.text())
                    .or(() -> SymbolTable.symbol(token.text()))
                    .orElse("\\" + token.text());
            case OPEN_BRACKET -> glyph = "[";
            case CLOSE_BRACKET -> glyph = "]";
            case GROUP -> glyph = TokenText.flatten(token);
            default -> {
                reader.pushBack(token);
                return "";
            }
        }
        return INVISIBLE.equals(glyph) ? "" : glyph;
    }

    record Delimited(String open, List<Token> body, String close, boolean closed) {

        Delimited {
            body = List.copyOf(body);
        }
    }
}
