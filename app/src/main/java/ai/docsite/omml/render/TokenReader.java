package ai.docsite.omml.render;

import ai.docsite.omml.lexer.Token;
import ai.docsite.omml.lexer.TokenType;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Forward cursor over a token list. Tokens pushed back are returned before the remaining list.
 */
final class TokenReader {

    private final List<Token> tokens;
    private final Deque<Token> pushedBack = new ArrayDeque<>();
    private int position;

    TokenReader(List<Token> tokens) {
        this.tokens = tokens == null ? List.of() : tokens;
    }

    boolean hasNext() {
        return !pushedBack.isEmpty() || position < tokens.size();
    }

    Token peek() {
        if (!pushedBack.isEmpty()) {
            return pushedBack.peek();
        }
        return position < tokens.size() ? tokens.get(position) : null;
    }

    Token next() {
        if (!pushedBack.isEmpty()) {
            return pushedBack.pop();
        }
        if (position >= tokens.size()) {
            throw new NoSuchElementException("No tokens left");
        }
        return tokens.get(position++);
    }

    void pushBack(Token token) {
        pushedBack.push(token);
    }

    boolean nextIs(TokenType type) {
        Token next = peek();
        return next != null && next.is(type);
    }

    boolean nextIsScript() {
        Token next = peek();
        return next != null && next.type().isScript();
    }

    /**
     * Whether the next token can serve as a command argument.
     */
    boolean nextIsArgument() {
        Token next = peek();
        return next != null
                && (next.is(TokenType.TEXT) || next.is(TokenType.GROUP) || next.is(TokenType.COMMAND));
    }

    /**
     * Reads one argument token. A text run is taken whole, as the tokenizer collected it.
     */
    Token nextArgument() {
        return next();
    }
}
