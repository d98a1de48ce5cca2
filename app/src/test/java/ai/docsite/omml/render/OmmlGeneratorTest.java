package ai.docsite.omml.render;

import static ai.docsite.omml.testing.OmmlXml.all;
import static ai.docsite.omml.testing.OmmlXml.child;
import static ai.docsite.omml.testing.OmmlXml.childNames;
import static ai.docsite.omml.testing.OmmlXml.children;
import static ai.docsite.omml.testing.OmmlXml.first;
import static ai.docsite.omml.testing.OmmlXml.parse;
import static ai.docsite.omml.testing.OmmlXml.property;
import static ai.docsite.omml.testing.OmmlXml.text;
import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.omml.diagnostics.ConversionIssue;
import ai.docsite.omml.diagnostics.IssueCollector;
import ai.docsite.omml.diagnostics.IssueType;
import ai.docsite.omml.lexer.LatexTokenizer;
import ai.docsite.omml.symbols.SymbolTable;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

class OmmlGeneratorTest {

    private final IssueCollector issues = new IssueCollector();

    @Test
    void fractionHasOneNumeratorAndOneDenominator() {
        Element root = render("\\frac{a}{b}");

        assertThat(all(root, "f")).hasSize(1);
        assertThat(all(root, "num")).hasSize(1);
        assertThat(all(root, "den")).hasSize(1);
        assertThat(text(first(root, "num"))).isEqualTo("a");
        assertThat(text(first(root, "den"))).isEqualTo("b");
        assertThat(issueTypes()).isEmpty();
    }

    @Test
    void textRunIsOneWholeArgument() {
        Element root = render("\\frac12");

        assertThat(text(first(root, "num"))).isEqualTo("12");
        assertThat(children(first(root, "den"))).isEmpty();
        assertThat(issueTypes()).containsExactly(IssueType.MISSING_ARGUMENT);
    }

    @Test
    void fractionWithMissingDenominatorKeepsEmptyDenominator() {
        Element root = render("\\frac{a}");

        assertThat(all(root, "f")).hasSize(1);
        assertThat(children(first(root, "den"))).isEmpty();
        assertThat(issueTypes()).containsExactly(IssueType.MISSING_ARGUMENT);
    }

    @Test
    void binomialIsBarlessFractionInParentheses() {
        Element root = render("\\binom{n}{k}");

        Element delimiter = first(root, "d");
        assertThat(property(delimiter, "begChr")).isEqualTo("(");
        assertThat(property(delimiter, "endChr")).isEqualTo(")");
        assertThat(property(first(delimiter, "f"), "type")).isEqualTo("noBar");
        assertThat(text(first(root, "num"))).isEqualTo("n");
        assertThat(text(first(root, "den"))).isEqualTo("k");
    }

    @Test
    void superscriptAndSubscriptProduceScriptNodes() {
        Element sup = render("x^{2}");
        assertThat(all(sup, "sSup")).hasSize(1);
        assertThat(text(child(first(sup, "sSup"), "e"))).isEqualTo("x");
        assertThat(text(child(first(sup, "sSup"), "sup"))).isEqualTo("2");

        Element sub = render("x_{i}");
        assertThat(all(sub, "sSub")).hasSize(1);
        assertThat(text(child(first(sub, "sSub"), "sub"))).isEqualTo("i");
    }

    @Test
    void bothScriptsCombineIntoOneNodeInEitherOrder() {
        for (String latex : List.of("x_{i}^{2}", "x^{2}_{i}")) {
            Element root = render(latex);

            assertThat(all(root, "sSubSup")).as(latex).hasSize(1);
            assertThat(all(root, "sSub")).as(latex).isEmpty();
            assertThat(all(root, "sSup")).as(latex).isEmpty();
            Element node = first(root, "sSubSup");
            assertThat(childNames(node)).containsExactly("sSubSupPr", "e", "sub", "sup");
            assertThat(text(child(node, "sub"))).isEqualTo("i");
            assertThat(text(child(node, "sup"))).isEqualTo("2");
        }
    }

    @Test
    void wholeTextRunIsTheScriptBase() {
        Element root = render("mc^2");

        assertThat(childNames(root)).containsExactly("sSup");
        assertThat(text(child(first(root, "sSup"), "e"))).isEqualTo("mc");
        assertThat(text(child(first(root, "sSup"), "sup"))).isEqualTo("2");
    }

    @Test
    void scriptArgumentTakesTheWholeTextRun() {
        Element root = render("x^2y");

        assertThat(childNames(root)).containsExactly("sSup");
        assertThat(text(child(first(root, "sSup"), "sup"))).isEqualTo("2y");
    }

    @Test
    void repeatedScriptGetsAnEmptyBase() {
        Element root = render("x^2^3");

        assertThat(all(root, "sSup")).hasSize(2);
        assertThat(issueTypes()).containsExactly(IssueType.MISSING_BASE);
    }

    @Test
    void bareScriptAttachesToEmptyBase() {
        Element root = render("^2");

        Element sup = first(root, "sSup");
        assertThat(children(child(sup, "e"))).isEmpty();
        assertThat(text(child(sup, "sup"))).isEqualTo("2");
        assertThat(issueTypes()).containsExactly(IssueType.MISSING_BASE);
    }

    @Test
    void groupIsBaseForScripts() {
        Element root = render("{a+b}^2");

        assertThat(text(child(first(root, "sSup"), "e"))).isEqualTo("a+b");
    }

    @Test
    void squareRootHidesAbsentDegree() {
        Element root = render("\\sqrt{x}");

        Element rad = first(root, "rad");
        assertThat(property(rad, "degHide")).isEqualTo("1");
        assertThat(children(child(rad, "deg"))).isEmpty();
        assertThat(text(child(rad, "e"))).isEqualTo("x");
    }

    @Test
    void rootWithDegreeShowsIt() {
        Element root = render("\\sqrt[3]{x}");

        Element rad = first(root, "rad");
        assertThat(property(rad, "degHide")).isNull();
        assertThat(text(child(rad, "deg"))).isEqualTo("3");
        assertThat(text(child(rad, "e"))).isEqualTo("x");
    }

    @Test
    void rootDegreeMatchesNestedBrackets() {
        Element root = render("\\sqrt[[n]]{x}");

        assertThat(text(child(first(root, "rad"), "e"))).isEqualTo("x");
        assertThat(issueTypes()).containsExactly(IssueType.STRAY_TOKEN, IssueType.STRAY_TOKEN);
    }

    @Test
    void unclosedRootDegreeIsReported() {
        render("\\sqrt[3 x");

        assertThat(issueTypes()).contains(IssueType.UNCLOSED_OPTIONAL_ARGUMENT);
    }

    @Test
    void sumWithLimitsShowsThemStacked() {
        Element root = render("\\sum_{i=1}^{n}");

        Element nary = first(root, "nary");
        assertThat(property(nary, "chr")).isEqualTo("∑");
        assertThat(property(nary, "limLoc")).isEqualTo("subSup");
        assertThat(property(nary, "subHide")).isNull();
        assertThat(property(nary, "supHide")).isNull();
        assertThat(text(child(nary, "sub"))).isEqualTo("i=1");
        assertThat(text(child(nary, "sup"))).isEqualTo("n");
    }

    @Test
    void sumWithoutLimitsHidesBoth() {
        Element root = render("\\sum");

        Element nary = first(root, "nary");
        assertThat(property(nary, "subHide")).isEqualTo("1");
        assertThat(property(nary, "supHide")).isEqualTo("1");
        assertThat(children(child(nary, "e"))).isEmpty();
        assertThat(issueTypes()).isEmpty();
    }

    @Test
    void missingLimitIsHidden() {
        Element root = render("\\int_{0} f");

        Element nary = first(root, "nary");
        assertThat(property(nary, "chr")).isEqualTo("∫");
        assertThat(property(nary, "limLoc")).isEqualTo("subSup");
        assertThat(property(nary, "subHide")).isNull();
        assertThat(property(nary, "supHide")).isEqualTo("1");
        assertThat(text(child(nary, "e"))).isEqualTo("f");
    }

    @Test
    void naryBodyKeepsItsOwnScripts() {
        Element root = render("\\sum_{i} x_{i} + 1");

        Element body = child(first(root, "nary"), "e");
        assertThat(all(body, "sSub")).hasSize(1);
        assertThat(childNames(root)).containsExactly("nary", "r");
        assertThat(text(children(root).get(1))).isEqualTo("+1");
    }

    @Test
    void naryOperatorIsNotAScriptBase() {
        Element root = render("\\prod_{k}");

        assertThat(all(root, "sSub")).isEmpty();
        assertThat(property(first(root, "nary"), "supHide")).isEqualTo("1");
    }

    @Test
    void matrixRowsArePaddedToWidestRow() {
        Element root = render("\\begin{pmatrix} a & b \\\\ c \\end{pmatrix}");

        Element delimiter = first(root, "d");
        assertThat(property(delimiter, "begChr")).isEqualTo("(");
        assertThat(property(delimiter, "endChr")).isEqualTo(")");
        Element matrix = first(root, "m");
        assertThat(property(matrix, "count")).isEqualTo("2");
        List<Element> rows = children(matrix, "mr");
        assertThat(rows).hasSize(2);
        assertThat(children(rows.get(0), "e")).hasSize(2);
        assertThat(children(rows.get(1), "e")).hasSize(2);
        assertThat(children(children(rows.get(1), "e").get(1))).isEmpty();
    }

    @Test
    void matrixFencesFollowEnvironmentName() {
        assertFences("bmatrix", "[", "]");
        assertFences("Bmatrix", "{", "}");
        assertFences("vmatrix", "|", "|");
        assertFences("Vmatrix", "‖", "‖");
    }

    @Test
    void plainMatrixHasNoFence() {
        Element root = render("\\begin{matrix} 1 & 0 \\\\ 0 & 1 \\end{matrix}");

        assertThat(childNames(root)).containsExactly("m");
    }

    @Test
    void casesOpenWithBraceOnlyAndAlignLeft() {
        Element root = render("\\begin{cases} 1 & x > 0 \\\\ 0 & x \\le 0 \\end{cases}");

        Element delimiter = first(root, "d");
        assertThat(property(delimiter, "begChr")).isEqualTo("{");
        assertThat(property(delimiter, "endChr")).isEmpty();
        assertThat(property(first(root, "m"), "mcJc")).isEqualTo("left");
        assertThat(all(root, "mr")).hasSize(2);
    }

    @Test
    void arraySkipsColumnSpecification() {
        Element root = render("\\begin{array}{cc} 1 & 2 \\end{array}");

        assertThat(childNames(root)).containsExactly("m");
        assertThat(property(first(root, "m"), "count")).isEqualTo("2");
        assertThat(text(root)).isEqualTo("12");
    }

    @Test
    void emptyMatrixHasOneEmptyCell() {
        Element root = render("\\begin{matrix}\\end{matrix}");

        assertThat(all(root, "mr")).hasSize(1);
        assertThat(property(first(root, "m"), "count")).isEqualTo("1");
    }

    @Test
    void nestedSameNameEnvironmentsAreDepthMatched() {
        Element root = render("\\begin{matrix} \\begin{matrix} a \\end{matrix} & b \\end{matrix}");

        List<Element> matrices = all(root, "m");
        assertThat(matrices).hasSize(2);
        assertThat(property(matrices.get(0), "count")).isEqualTo("2");
        assertThat(issueTypes()).isEmpty();
    }

    @Test
    void alignedEquationsShowOneEqualsSignPerRow() {
        Element root = render("\\begin{aligned} a &= b \\\\ c &= d \\end{aligned}");

        Element array = first(root, "eqArr");
        List<Element> rows = children(array, "e");
        assertThat(rows).hasSize(2);
        assertThat(text(rows.get(0))).isEqualTo("a=b");
        assertThat(text(rows.get(1))).isEqualTo("c=d");
        assertThat(all(array, "aln")).hasSize(2);
    }

    @Test
    void alignmentBeforeOtherRelationIsEmpty() {
        Element root = render("\\begin{align*} x & \\le y \\end{align*}");

        assertThat(text(first(root, "eqArr"))).isEqualTo("x≤y");
        assertThat(all(root, "aln")).hasSize(1);
    }

    @Test
    void alignmentBeforePlainCellInsertsEqualsSign() {
        Element root = render("\\begin{align} x & y \\end{align}");

        assertThat(text(first(root, "eqArr"))).isEqualTo("x=y");
    }

    @Test
    void gatheredRowsHaveNoAlignment() {
        Element root = render("\\begin{gather} a \\\\ b \\end{gather}");

        assertThat(children(first(root, "eqArr"), "e")).hasSize(2);
        assertThat(all(root, "aln")).isEmpty();
    }

    @Test
    void equationEnvironmentRendersInline() {
        Element root = render("\\begin{equation} x \\end{equation}");

        assertThat(childNames(root)).containsExactly("r");
        assertThat(issueTypes()).isEmpty();
    }

    @Test
    void unknownEnvironmentRendersBody() {
        Element root = render("\\begin{foo} x \\end{foo}");

        assertThat(text(root)).isEqualTo("x");
        assertThat(issueTypes()).containsExactly(IssueType.UNKNOWN_ENVIRONMENT);
    }

    @Test
    void unclosedEnvironmentRunsToEndOfInput() {
        Element root = render("\\begin{pmatrix} a");

        assertThat(text(first(root, "m"))).isEqualTo("a");
        assertThat(issueTypes()).containsExactly(IssueType.UNCLOSED_ENVIRONMENT);
    }

    @Test
    void beginWithoutNameIsLiteral() {
        Element root = render("\\begin x");

        assertThat(text(root)).isEqualTo("\\beginx");
        assertThat(issueTypes()).containsExactly(IssueType.MISSING_ARGUMENT);
    }

    @Test
    void leftRightProducesDelimiter() {
        Element root = render("\\left( x \\right)");

        Element delimiter = first(root, "d");
        assertThat(property(delimiter, "begChr")).isEqualTo("(");
        assertThat(property(delimiter, "endChr")).isEqualTo(")");
        assertThat(text(child(delimiter, "e"))).isEqualTo("x");
    }

    @Test
    void invisibleDelimiterIsEmpty() {
        Element root = render("\\left. x \\right)");

        assertThat(property(first(root, "d"), "begChr")).isEmpty();
        assertThat(property(first(root, "d"), "endChr")).isEqualTo(")");
    }

    @Test
    void namedDelimitersResolveToGlyphs() {
        Element root = render("\\left\\langle v \\right\\rangle");

        assertThat(property(first(root, "d"), "begChr")).isEqualTo("⟨");
        assertThat(property(first(root, "d"), "endChr")).isEqualTo("⟩");
    }

    @Test
    void nestedDelimitersAreDepthMatched() {
        Element root = render("\\left( \\left[ x \\right] + 1 \\right)");

        List<Element> delimiters = all(root, "d");
        assertThat(delimiters).hasSize(2);
        assertThat(property(delimiters.get(0), "begChr")).isEqualTo("(");
        assertThat(property(delimiters.get(0), "endChr")).isEqualTo(")");
        assertThat(property(delimiters.get(1), "begChr")).isEqualTo("[");
        assertThat(property(delimiters.get(1), "endChr")).isEqualTo("]");
        assertThat(text(child(delimiters.get(0), "e"))).isEqualTo("x+1");
    }

    @Test
    void unclosedDelimiterHasEmptyClose() {
        Element root = render("\\left( x");

        assertThat(property(first(root, "d"), "endChr")).isEmpty();
        assertThat(issueTypes()).containsExactly(IssueType.UNCLOSED_DELIMITER);
    }

    @Test
    void accentDecoratesItsArgument() {
        Element root = render("\\hat{x} + \\vec v");

        List<Element> accents = all(root, "acc");
        assertThat(accents).hasSize(2);
        assertThat(property(accents.get(0), "chr")).isEqualTo("\u0302");
        assertThat(text(child(accents.get(0), "e"))).isEqualTo("x");
        assertThat(property(accents.get(1), "chr")).isEqualTo("\u20D7");
        assertThat(text(child(accents.get(1), "e"))).isEqualTo("v");
    }

    @Test
    void overbraceWithLabelIsUpperLimit() {
        Element root = render("\\overbrace{a+b}^{n}");

        Element limit = first(root, "limUpp");
        Element brace = first(limit, "groupChr");
        assertThat(property(brace, "chr")).isEqualTo("⏞");
        assertThat(property(brace, "pos")).isEqualTo("top");
        assertThat(text(child(limit, "lim"))).isEqualTo("n");
        assertThat(all(root, "sSup")).isEmpty();
    }

    @Test
    void underbraceWithoutLabelIsGroupCharacter() {
        Element root = render("\\underbrace{a+b}");

        assertThat(childNames(root)).containsExactly("groupChr");
        assertThat(property(first(root, "groupChr"), "pos")).isEqualTo("bot");
    }

    @Test
    void underlineIsBottomBar() {
        Element root = render("\\underline{x}");

        assertThat(property(first(root, "bar"), "pos")).isEqualTo("bot");
        assertThat(text(root)).isEqualTo("x");
    }

    @Test
    void romanTextKeepsSpacesAndIsUpright() {
        Element root = render("\\text{if } x");

        Element run = children(root).get(0);
        assertThat(property(run, "sty")).isEqualTo("p");
        assertThat(text(run)).isEqualTo("if ");
        assertThat(first(run, "t").getAttribute("xml:space")).isEqualTo("preserve");
        assertThat(text(children(root).get(1))).isEqualTo("x");
    }

    @Test
    void fontCommandsSelectScript() {
        assertThat(property(render("\\mathbb{R}"), "scr")).isEqualTo("double-struck");
        assertThat(property(render("\\mathcal{L}"), "scr")).isEqualTo("script");
        assertThat(property(render("\\mathsf{A}"), "scr")).isEqualTo("sans-serif");
        assertThat(property(render("\\mathbf{v}"), "rPr")).isNull();
        assertThat(property(render("\\operatorname{rank}"), "sty")).isEqualTo("p");
    }

    @Test
    void functionNameIsUprightAndTakesScripts() {
        Element root = render("\\lim_{x \\to 0} \\sin x");

        Element base = child(first(root, "sSub"), "e");
        assertThat(text(base)).isEqualTo("lim");
        assertThat(property(base, "sty")).isEqualTo("p");
        assertThat(text(child(first(root, "sSub"), "sub"))).isEqualTo("x→0");
        Element sine = children(root).get(1);
        assertThat(text(sine)).isEqualTo("sin");
        assertThat(property(sine, "sty")).isEqualTo("p");
    }

    @Test
    void everySymbolCompilesToRunWithMappedText() {
        for (String name : SymbolTable.symbolNames()) {
            Element root = render("\\" + name);

            assertThat(childNames(root)).as(name).containsExactly("r");
            assertThat(text(root)).as(name).isEqualTo(SymbolTable.symbol(name).orElseThrow());
        }
        assertThat(issueTypes()).isEmpty();
    }

    @Test
    void everyNaryOperatorCompilesToNaryWithItsGlyph() {
        for (String name : SymbolTable.naryOperatorNames()) {
            Element root = render("\\" + name);

            assertThat(property(first(root, "nary"), "chr")).as(name)
                    .isEqualTo(SymbolTable.naryOperator(name).orElseThrow());
        }
    }

    @Test
    void unknownCommandIsLiteral() {
        Element root = render("\\nonexistentcmd");

        assertThat(text(root)).isEqualTo("\\nonexistentcmd");
        assertThat(issues.issues()).containsExactly(
                new ConversionIssue(IssueType.UNKNOWN_COMMAND, "\\nonexistentcmd"));
    }

    @Test
    void strayRightIsLiteral() {
        Element root = render("x \\right)");

        assertThat(text(root)).isEqualTo("x\\right)");
        assertThat(issueTypes()).containsExactly(IssueType.STRAY_TOKEN);
    }

    @Test
    void strayStructuralTokensAreSkipped() {
        Element root = render("a & b \\\\ c");

        assertThat(text(root)).isEqualTo("abc");
        assertThat(issueTypes()).containsExactly(IssueType.STRAY_TOKEN, IssueType.STRAY_TOKEN);
    }

    @Test
    void constructsAppearInSourceOrder() {
        Element root = render("\\frac{a}{b} + \\sqrt{c}");

        assertThat(childNames(root)).containsExactly("f", "r", "rad");
        assertThat(text(children(root).get(1))).isEqualTo("+");
    }

    @Test
    void commandArgumentChainBeyondMaximumDepthIsLiteral() {
        Element root = render("\\hat".repeat(OmmlGenerator.MAX_NESTING_DEPTH + 10) + "x");

        assertThat(text(root)).contains("\\hat").endsWith("x");
        assertThat(issueTypes()).containsExactly(IssueType.NESTING_TOO_DEEP);
    }

    @Test
    void delimitersBeyondMaximumDepthAreLiteral() {
        int depth = OmmlGenerator.MAX_NESTING_DEPTH + 10;
        Element root = render("\\left(".repeat(depth) + "x" + "\\right)".repeat(depth));

        assertThat(all(root, "d")).hasSize(OmmlGenerator.MAX_NESTING_DEPTH + 1);
        assertThat(text(root)).contains("\\left(");
        assertThat(issueTypes()).containsExactly(IssueType.NESTING_TOO_DEEP);
    }

    @Test
    void specialCharactersAreEscaped() {
        String xml = generate("a < b \\& c > \"d\"");

        assertThat(xml).contains("&lt;").contains("&amp;").contains("&gt;").contains("&quot;");
        assertThat(text(parse(xml))).isEqualTo("a<b&c>\"d\"");
    }

    private void assertFences(String environment, String open, String close) {
        Element root = render("\\begin{" + environment + "} a \\end{" + environment + "}");

        assertThat(property(first(root, "d"), "begChr")).as(environment).isEqualTo(open);
        assertThat(property(first(root, "d"), "endChr")).as(environment).isEqualTo(close);
    }

    private String generate(String latex) {
        return new OmmlGenerator(issues).generate(new LatexTokenizer().tokenize(latex, issues));
    }

    private Element render(String latex) {
        return parse(generate(latex));
    }

    private List<IssueType> issueTypes() {
        return issues.issues().stream().map(ConversionIssue::type).toList();
    }
}
