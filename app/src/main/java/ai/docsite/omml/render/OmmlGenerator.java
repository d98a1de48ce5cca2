package ai.docsite.omml.render;

import ai.docsite.omml.diagnostics.IssueCollector;
import ai.docsite.omml.diagnostics.IssueType;
import ai.docsite.omml.lexer.Token;
import ai.docsite.omml.lexer.TokenType;
import ai.docsite.omml.render.DelimiterParser.Delimited;
import ai.docsite.omml.render.EnvironmentParser.EnvironmentBody;
import ai.docsite.omml.symbols.SymbolTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a token list into OMML content, without the {@code m:oMath} wrapper.
 *
 * <p>Generation is a single recursive-descent pass over a {@link TokenReader}. Malformed input never
 * aborts the pass: the affected construct is emitted with empty parts and an issue is reported to the
 * collector given at construction. Content nested deeper than {@link #MAX_NESTING_DEPTH} levels is kept as
 * literal text. One instance serves one conversion.
 */
public class OmmlGenerator {

    static final int MAX_NESTING_DEPTH = 128;

    private static final String OVER_BRACE = "⏞";
    private static final String UNDER_BRACE = "⏟";
    private static final String DOUBLE_BAR = "‖";

    private final IssueCollector issues;
    private int depth;

    public OmmlGenerator(IssueCollector issues) {
        this.issues = Objects.requireNonNull(issues, "issues");
    }

    public String generate(List<Token> tokens) {
        return render(new TokenReader(tokens));
    }

    private String render(TokenReader reader) {
        OmmlWriter out = new OmmlWriter();
        while (reader.hasNext()) {
            renderNext(reader, out);
        }
        return out.toXml();
    }

    private String renderTokens(List<Token> tokens) {
        if (depth >= MAX_NESTING_DEPTH) {
            reportTooDeep("content");
            return new OmmlWriter().run(TokenText.flatten(tokens), RunStyle.ITALIC).toXml();
        }
        depth++;
        try {
            return render(new TokenReader(tokens));
        } finally {
            depth--;
        }
    }

    private void renderNext(TokenReader reader, OmmlWriter out) {
        Token token = reader.next();
        switch (token.type()) {
            case TEXT -> attachScripts(new OmmlWriter().run(token.text(), RunStyle.ITALIC).toXml(), reader, out);
            case GROUP -> attachScripts(renderTokens(token.children()), reader, out);
            case COMMAND -> {
                Optional<String> nary = SymbolTable.naryOperator(token.text());
                if (nary.isPresent()) {
                    out.raw(renderNary(nary.get(), reader));
                } else {
                    attachScripts(renderCommand(token.text(), reader), reader, out);
                }
            }
            case SUPERSCRIPT, SUBSCRIPT -> {
                issues.report(IssueType.MISSING_BASE, "script without a base");
                reader.pushBack(token);
                attachScripts("", reader, out);
            }
            default -> issues.report(IssueType.STRAY_TOKEN, describe(token));
        }
    }

    private void attachScripts(String base, TokenReader reader, OmmlWriter out) {
        Scripts scripts = readScripts(reader);
        if (scripts.sub() != null && scripts.sup() != null) {
            out.open("sSubSup").open("sSubSupPr").empty("ctrlPr").close("sSubSupPr")
                    .element("e", base)
                    .element("sub", scripts.sub())
                    .element("sup", scripts.sup())
                    .close("sSubSup");
        } else if (scripts.sub() != null) {
            out.open("sSub").open("sSubPr").empty("ctrlPr").close("sSubPr")
                    .element("e", base)
                    .element("sub", scripts.sub())
                    .close("sSub");
        } else if (scripts.sup() != null) {
            out.open("sSup").open("sSupPr").empty("ctrlPr").close("sSupPr")
                    .element("e", base)
                    .element("sup", scripts.sup())
                    .close("sSup");
        } else {
            out.raw(base);
        }
    }

    /**
     * Reads at most one subscript and one superscript, in either order. A repeated script is left in the
     * stream.
     */
    private Scripts readScripts(TokenReader reader) {
        String sub = null;
        String sup = null;
        while (reader.nextIsScript()) {
            boolean subscript = reader.peek().is(TokenType.SUBSCRIPT);
            if (subscript ? sub != null : sup != null) {
                break;
            }
            reader.next();
            String argument = renderArgument(subscript ? "_" : "^", reader);
            if (subscript) {
                sub = argument;
            } else {
                sup = argument;
            }
        }
        return new Scripts(sub, sup);
    }

    private String renderArgument(String owner, TokenReader reader) {
        if (!reader.nextIsArgument()) {
            issues.report(IssueType.MISSING_ARGUMENT, owner);
            return "";
        }
        return renderArgumentToken(reader.nextArgument(), reader);
    }

    private String renderArgumentToken(Token argument, TokenReader reader) {
        return switch (argument.type()) {
            case TEXT -> new OmmlWriter().run(argument.text(), RunStyle.ITALIC).toXml();
            case GROUP -> renderTokens(argument.children());
            case COMMAND -> renderCommandArgument(argument.text(), reader);
            default -> "";
        };
    }

    private String renderCommandArgument(String name, TokenReader reader) {
        if (depth >= MAX_NESTING_DEPTH) {
            reportTooDeep("\\" + name);
            return literal(name);
        }
        depth++;
        try {
            Optional<String> nary = SymbolTable.naryOperator(name);
            return nary.isPresent() ? renderNary(nary.get(), reader) : renderCommand(name, reader);
        } finally {
            depth--;
        }
    }

    private void reportTooDeep(String what) {
        issues.report(IssueType.NESTING_TOO_DEEP, what + " nested more than " + MAX_NESTING_DEPTH + " levels");
    }

    private String renderNary(String glyph, TokenReader reader) {
        Scripts limits = readScripts(reader);
        String body = "";
        if (reader.nextIsArgument()) {
            OmmlWriter operand = new OmmlWriter();
            attachScripts(renderArgumentToken(reader.nextArgument(), reader), reader, operand);
            body = operand.toXml();
        }

        OmmlWriter out = new OmmlWriter().open("nary").open("naryPr").property("chr", glyph);
        if (limits.sub() == null && limits.sup() == null) {
            out.property("limLoc", "undOvr").property("subHide", "1").property("supHide", "1");
        } else {
            out.property("limLoc", "subSup");
            if (limits.sub() == null) {
                out.property("subHide", "1");
            }
            if (limits.sup() == null) {
                out.property("supHide", "1");
            }
        }
        return out.empty("ctrlPr").close("naryPr")
                .element("sub", limits.sub())
                .element("sup", limits.sup())
                .element("e", body)
                .close("nary")
                .toXml();
    }

    private String renderCommand(String name, TokenReader reader) {
        switch (name) {
            case "frac", "dfrac", "tfrac" -> {
                return renderFraction("\\" + name, reader, false);
            }
            case "binom", "dbinom", "tbinom" -> {
                return renderDelimited("(", renderFraction("\\" + name, reader, true), ")");
            }
            case "sqrt" -> {
                return renderRoot(reader);
            }
            case "overbrace" -> {
                return renderBrace(name, reader, OVER_BRACE, TokenType.SUPERSCRIPT);
            }
            case "underbrace" -> {
                return renderBrace(name, reader, UNDER_BRACE, TokenType.SUBSCRIPT);
            }
            case "underline" -> {
                String body = renderArgument("\\underline", reader);
                return new OmmlWriter().open("bar").open("barPr").property("pos", "bot").empty("ctrlPr")
                        .close("barPr").element("e", body).close("bar").toXml();
            }
            case "begin" -> {
                return renderEnvironment(reader);
            }
            case "left" -> {
                Delimited delimited = DelimiterParser.read(reader);
                if (!delimited.closed()) {
                    issues.report(IssueType.UNCLOSED_DELIMITER, "\\left" + delimited.open() + " without \\right");
                }
                return renderDelimited(delimited.open(), renderTokens(delimited.body()), delimited.close());
            }
            case "right", "end" -> {
                issues.report(IssueType.STRAY_TOKEN, "\\" + name);
                return literal(name);
            }
            default -> {
                return renderSimpleCommand(name, reader);
            }
        }
    }

    private String renderSimpleCommand(String name, TokenReader reader) {
        Optional<String> accent = SymbolTable.accent(name);
        if (accent.isPresent() && reader.nextIsArgument()) {
            String body = renderArgumentToken(reader.nextArgument(), reader);
            return new OmmlWriter().open("acc").open("accPr").property("chr", accent.get()).empty("ctrlPr")
                    .close("accPr").element("e", body).close("acc").toXml();
        }
        if (SymbolTable.isTextCommand(name)) {
            return renderTextCommand(name, reader);
        }
        Optional<String> symbol = SymbolTable.symbol(name);
        if (symbol.isPresent()) {
            RunStyle style = SymbolTable.isFunction(name) ? RunStyle.UPRIGHT : RunStyle.ITALIC;
            return new OmmlWriter().run(symbol.get(), style).toXml();
        }
        issues.report(IssueType.UNKNOWN_COMMAND, "\\" + name);
        return literal(name);
    }

    private String renderFraction(String owner, TokenReader reader, boolean noBar) {
        String numerator = renderArgument(owner, reader);
        String denominator = renderArgument(owner, reader);
        OmmlWriter out = new OmmlWriter().open("f").open("fPr");
        if (noBar) {
            out.property("type", "noBar");
        }
        return out.empty("ctrlPr").close("fPr")
                .element("num", numerator)
                .element("den", denominator)
                .close("f")
                .toXml();
    }

    private String renderRoot(TokenReader reader) {
        String degree = "";
        if (reader.nextIs(TokenType.OPEN_BRACKET)) {
            reader.next();
            degree = renderTokens(readOptionalArgument(reader));
        }
        String radicand = renderArgument("\\sqrt", reader);
        OmmlWriter out = new OmmlWriter().open("rad").open("radPr");
        if (degree.isEmpty()) {
            out.property("degHide", "1");
        }
        return out.empty("ctrlPr").close("radPr")
                .element("deg", degree)
                .element("e", radicand)
                .close("rad")
                .toXml();
    }

    /**
     * Collects the tokens of a {@code [...]} argument whose opening bracket was consumed.
     */
    private List<Token> readOptionalArgument(TokenReader reader) {
        List<Token> content = new ArrayList<>();
        int depth = 1;
        while (reader.hasNext()) {
            Token token = reader.next();
            if (token.is(TokenType.OPEN_BRACKET)) {
                depth++;
            } else if (token.is(TokenType.CLOSE_BRACKET) && --depth == 0) {
                return content;
            }
            content.add(token);
        }
        issues.report(IssueType.UNCLOSED_OPTIONAL_ARGUMENT, "missing ']' after \\sqrt[");
        return content;
    }

    private String renderBrace(String name, TokenReader reader, String glyph, TokenType labelScript) {
        boolean over = labelScript == TokenType.SUPERSCRIPT;
        String body = renderArgument("\\" + name, reader);
        String brace = new OmmlWriter().open("groupChr").open("groupChrPr")
                .property("chr", glyph)
                .property("pos", over ? "top" : "bot")
                .property("vertJc", over ? "bot" : "top")
                .empty("ctrlPr").close("groupChrPr")
                .element("e", body)
                .close("groupChr")
                .toXml();
        if (!reader.nextIs(labelScript)) {
            return brace;
        }
        reader.next();
        String label = renderArgument(over ? "^" : "_", reader);
        String limit = over ? "limUpp" : "limLow";
        return new OmmlWriter().open(limit).open(limit + "Pr").empty("ctrlPr").close(limit + "Pr")
                .element("e", brace)
                .element("lim", label)
                .close(limit)
                .toXml();
    }

    private String renderTextCommand(String name, TokenReader reader) {
        if (!reader.nextIsArgument()) {
            issues.report(IssueType.MISSING_ARGUMENT, "\\" + name);
            return "";
        }
        String text = TokenText.flatten(reader.nextArgument());
        RunStyle style = switch (name) {
            case "text", "textrm", "mathrm", "operatorname" -> RunStyle.UPRIGHT;
            case "mathbb" -> RunStyle.DOUBLE_STRUCK;
            case "mathcal" -> RunStyle.SCRIPT;
            case "mathsf" -> RunStyle.SANS_SERIF;
            default -> RunStyle.ITALIC;
        };
        return new OmmlWriter().run(text, style).toXml();
    }

    private String renderEnvironment(TokenReader reader) {
        if (!reader.nextIs(TokenType.GROUP)) {
            issues.report(IssueType.MISSING_ARGUMENT, "\\begin without an environment name");
            return literal("begin");
        }
        String name = TokenText.flatten(reader.next());
        EnvironmentBody body = EnvironmentParser.readBody(reader, name);
        if (!body.closed()) {
            issues.report(IssueType.UNCLOSED_ENVIRONMENT, "\\begin{" + name + "} without \\end{" + name + "}");
        }
        List<Token> tokens = body.tokens();
        return switch (name) {
            case "matrix", "smallmatrix" -> renderMatrix(tokens, "", "", "center");
            case "pmatrix" -> renderMatrix(tokens, "(", ")", "center");
            case "bmatrix" -> renderMatrix(tokens, "[", "]", "center");
            case "Bmatrix" -> renderMatrix(tokens, "{", "}", "center");
            case "vmatrix" -> renderMatrix(tokens, "|", "|", "center");
            case "Vmatrix" -> renderMatrix(tokens, DOUBLE_BAR, DOUBLE_BAR, "center");
            case "cases" -> renderMatrix(tokens, "{", "", "left");
            case "array" -> renderMatrix(withoutColumnSpec(tokens), "", "", "center");
            case "aligned", "align", "align*", "split" -> renderEquationArray(tokens, true);
            case "gather", "gather*", "gathered" -> renderEquationArray(tokens, false);
            case "equation", "equation*" -> renderTokens(tokens);
            default -> {
                issues.report(IssueType.UNKNOWN_ENVIRONMENT, name);
                yield renderTokens(tokens);
            }
        };
    }

    private static List<Token> withoutColumnSpec(List<Token> tokens) {
        if (!tokens.isEmpty() && tokens.get(0).is(TokenType.GROUP)) {
            return tokens.subList(1, tokens.size());
        }
        return tokens;
    }

    private String renderMatrix(List<Token> body, String open, String close, String justification) {
        List<List<List<Token>>> rows = rowsOf(body);
        int columns = EnvironmentParser.columnCount(rows);
        OmmlWriter out = new OmmlWriter().open("m").open("mPr")
                .open("mcs").open("mc").open("mcPr")
                .property("count", String.valueOf(columns))
                .property("mcJc", justification)
                .close("mcPr").close("mc").close("mcs")
                .empty("ctrlPr").close("mPr");
        for (List<List<Token>> row : EnvironmentParser.pad(rows)) {
            out.open("mr");
            for (List<Token> cell : row) {
                out.element("e", renderTokens(cell));
            }
            out.close("mr");
        }
        String matrix = out.close("m").toXml();
        if (open.isEmpty() && close.isEmpty()) {
            return matrix;
        }
        return renderDelimited(open, matrix, close);
    }

    private String renderEquationArray(List<Token> body, boolean aligned) {
        OmmlWriter out = new OmmlWriter().open("eqArr").open("eqArrPr").empty("ctrlPr").close("eqArrPr");
        for (List<List<Token>> row : rowsOf(body)) {
            OmmlWriter line = new OmmlWriter();
            for (int column = 0; column < row.size(); column++) {
                List<Token> cell = row.get(column);
                if (aligned && column > 0) {
                    cell = writeAlignment(cell, line);
                }
                line.raw(renderTokens(cell));
            }
            out.element("e", line.toXml());
        }
        return out.close("eqArr").toXml();
    }

    /**
     * Writes the alignment point that precedes a cell and returns the cell tokens still to render. A
     * leading {@code =} becomes the text of the alignment run; another leading relation keeps the marker
     * empty.
     */
    private static List<Token> writeAlignment(List<Token> cell, OmmlWriter line) {
        Token first = cell.isEmpty() ? null : cell.get(0);
        if (first != null && first.is(TokenType.TEXT) && first.text().startsWith("=")) {
            line.alignmentRun("=");
            List<Token> rest = new ArrayList<>(cell.subList(1, cell.size()));
            if (first.text().length() > 1) {
                rest.add(0, Token.text(first.text().substring(1)));
            }
            return rest;
        }
        boolean relation = first != null
                && (first.is(TokenType.TEXT) && (first.text().startsWith("<") || first.text().startsWith(">"))
                        || first.is(TokenType.COMMAND) && SymbolTable.isRelation(first.text()));
        line.alignmentRun(relation ? "" : "=");
        return cell;
    }

    /**
     * Partitions an environment body, giving an empty body one empty cell.
     */
    private static List<List<List<Token>>> rowsOf(List<Token> body) {
        List<List<List<Token>>> rows = EnvironmentParser.partition(body);
        return rows.isEmpty() ? List.of(List.of(List.of())) : rows;
    }

    private static String renderDelimited(String open, String content, String close) {
        return new OmmlWriter().open("d").open("dPr")
                .property("begChr", open)
                .property("endChr", close)
                .empty("ctrlPr").close("dPr")
                .element("e", content)
                .close("d")
                .toXml();
    }

    private static String literal(String name) {
        return new OmmlWriter().run("\\" + name, RunStyle.ITALIC).toXml();
    }

    private static String describe(Token token) {
        return switch (token.type()) {
            case AMPERSAND -> "'&' outside an environment";
            case NEWLINE -> "'\\\\' outside an environment";
            case OPEN_BRACKET -> "'['";
            case CLOSE_BRACKET -> "']'";
            default -> token.toString();
        };
    }

    private record Scripts(String sub, String sup) {
    }
}
