package ai.docsite.omml.convert;

import ai.docsite.omml.diagnostics.IssueCollector;
import ai.docsite.omml.lexer.LatexTokenizer;
import ai.docsite.omml.lexer.Token;
import ai.docsite.omml.render.OmmlGenerator;
import java.util.List;
import java.util.Objects;

/**
 * Converts LaTeX math into OMML.
 *
 * <p>Instances hold no state between calls and may be shared across threads. Conversion never fails:
 * input the compiler cannot make sense of is rendered as literal text or empty structure, and the
 * issues collected along the way are available through {@link #convert(String, MathMode)}. A
 * {@code null} expression is treated as empty.
 */
public class LatexMathConverter {

    private static final String INLINE_OPEN = "<m:oMath>";
    private static final String INLINE_CLOSE = "</m:oMath>";
    private static final String DISPLAY_OPEN =
            "<m:oMathPara><m:oMathParaPr><m:jc m:val=\"center\"/></m:oMathParaPr>" + INLINE_OPEN;
    private static final String DISPLAY_CLOSE = INLINE_CLOSE + "</m:oMathPara>";

    private final LatexTokenizer tokenizer;

    public LatexMathConverter() {
        this(new LatexTokenizer());
    }

    public LatexMathConverter(LatexTokenizer tokenizer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
    }

    /**
     * Returns an {@code m:oMath} element for math set within a line of text.
     */
    public String toInline(String latex) {
        return convert(latex, MathMode.INLINE).xml();
    }

    /**
     * Returns a centered {@code m:oMathPara} block.
     */
    public String toDisplay(String latex) {
        return convert(latex, MathMode.DISPLAY).xml();
    }

    /**
     * Returns the bare math content, for callers that supply their own parent element.
     */
    public String toFragment(String latex) {
        return convert(latex, MathMode.FRAGMENT).xml();
    }

    public ConversionResult convert(String latex, MathMode mode) {
        Objects.requireNonNull(mode, "mode");
        IssueCollector issues = new IssueCollector();
        List<Token> tokens = tokenizer.tokenize(latex == null ? "" : latex, issues);
        String content = new OmmlGenerator(issues).generate(tokens);
        String xml = switch (mode) {
            case INLINE -> INLINE_OPEN + content + INLINE_CLOSE;
            case DISPLAY -> DISPLAY_OPEN + content + DISPLAY_CLOSE;
            case FRAGMENT -> content;
        };
        return new ConversionResult(xml, issues.issues());
    }
}
