package ai.docsite.omml.render;

import ai.docsite.omml.lexer.Token;
import ai.docsite.omml.symbols.SymbolTable;
import java.util.List;

/**
 * Flattens tokens back into plain text, for environment names and text-mode arguments.
 */
final class TokenText {

    private TokenText() {
    }

    static String flatten(Token token) {
        return switch (token.type()) {
            case TEXT -> token.text();
            case GROUP -> flatten(token.children());
            case COMMAND -> SymbolTable.symbol(token.text()).orElse("\\" + token.text());
            case OPEN_BRACKET -> "[";
            case CLOSE_BRACKET -> "]";
            default -> "";
        };
    }

    static String flatten(List<Token> tokens) {
        StringBuilder text = new StringBuilder();
        for (Token token : tokens) {
            text.append(flatten(token));
        }
        return text.toString();
    }
}
