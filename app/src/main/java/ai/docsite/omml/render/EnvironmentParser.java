package ai.docsite.omml.render;

import ai.docsite.omml.lexer.Token;
import ai.docsite.omml.lexer.TokenType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Locates the body of a {@code \begin{name} ... \end{name}} block and splits it into rows and cells.
 */
final class EnvironmentParser {

    private EnvironmentParser() {
    }

    /**
     * Reads tokens up to the {@code \end} matching an already consumed {@code \begin{name}}. Nested
     * environments of the same name are counted so only the balancing {@code \end} closes the block.
     */
    static EnvironmentBody readBody(TokenReader reader, String name) {
        List<Token> body = new ArrayList<>();
        int depth = 1;
        while (reader.hasNext()) {
            Token token = reader.next();
            boolean marker = token.isCommand("begin") || token.isCommand("end");
            if (marker && reader.nextIs(TokenType.GROUP)) {
                Token nameGroup = reader.next();
                if (TokenText.flatten(nameGroup).equals(name)) {
                    depth += token.isCommand("begin") ? 1 : -1;
                    if (depth == 0) {
                        return new EnvironmentBody(body, true);
                    }
                }
                body.add(token);
                body.add(nameGroup);
                continue;
            }
            body.add(token);
        }
        return new EnvironmentBody(body, false);
    }

    /**
     * Splits a body on {@code \\} into rows and on {@code &} into cells. A trailing row separator does
     * not open an empty row.
     */
    static List<List<List<Token>>> partition(List<Token> body) {
        List<List<List<Token>>> rows = new ArrayList<>();
        List<List<Token>> row = new ArrayList<>();
        List<Token> cell = new ArrayList<>();
        for (Token token : body) {
            if (token.is(TokenType.NEWLINE)) {
                row.add(cell);
                rows.add(row);
                row = new ArrayList<>();
                cell = new ArrayList<>();
            } else if (token.is(TokenType.AMPERSAND)) {
                row.add(cell);
                cell = new ArrayList<>();
            } else {
                cell.add(token);
            }
        }
        if (!cell.isEmpty() || !row.isEmpty()) {
            row.add(cell);
            rows.add(row);
        }
        return rows;
    }

    static int columnCount(List<List<List<Token>>> rows) {
        int columns = 0;
        for (List<List<Token>> row : rows) {
            columns = Math.max(columns, row.size());
        }
        return columns;
    }

    /**
     * Returns a copy of {@code rows} in which every row has {@code columnCount(rows)} cells.
     */
    static List<List<List<Token>>> pad(List<List<List<Token>>> rows) {
        int columns = columnCount(rows);
        List<List<List<Token>>> padded = new ArrayList<>(rows.size());
        for (List<List<Token>> row : rows) {
            List<List<Token>> copy = new ArrayList<>(row);
            copy.addAll(Collections.nCopies(columns - row.size(), List.of()));
            padded.add(copy);
        }
        return padded;
    }

    record EnvironmentBody(List<Token> tokens, boolean closed) {

        EnvironmentBody {
            tokens = List.copyOf(tokens);
        }
    }
}
