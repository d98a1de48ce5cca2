package ai.docsite.omml.render;

/**
 * Builds OMML markup with the {@code m:} prefix. Element content passed as strings must already be
 * OMML; text and attribute values are escaped here.
 */
public final class OmmlWriter {

    public static final String MATH_NAMESPACE = "http://schemas.openxmlformats.org/officeDocument/2006/math";

    private final StringBuilder buffer = new StringBuilder(128);

    public OmmlWriter open(String element) {
        buffer.append("<m:").append(element).append('>');
        return this;
    }

    public OmmlWriter close(String element) {
        buffer.append("</m:").append(element).append('>');
        return this;
    }

    public OmmlWriter empty(String element) {
        buffer.append("<m:").append(element).append("/>");
        return this;
    }

    /**
     * Writes a property element of the form {@code <m:name m:val="value"/>}.
     */
    public OmmlWriter property(String element, String value) {
        buffer.append("<m:").append(element).append(" m:val=\"").append(escape(value)).append("\"/>");
        return this;
    }

    /**
     * Writes {@code content} wrapped in {@code element}, collapsing to an empty element when there is no content.
     */
    public OmmlWriter element(String element, String content) {
        if (content == null || content.isEmpty()) {
            return empty(element);
        }
        return open(element).raw(content).close(element);
    }

    public OmmlWriter run(String text, RunStyle style) {
        buffer.append("<m:r>");
        if (style.hasProperties()) {
            buffer.append("<m:rPr>");
            if (style.script() != null) {
                property("scr", style.script());
            }
            if (style.style() != null) {
                property("sty", style.style());
            }
            buffer.append("</m:rPr>");
        }
        return text(text).close("r");
    }

    /**
     * Writes a run that marks an alignment point inside an equation array.
     */
    public OmmlWriter alignmentRun(String text) {
        buffer.append("<m:r><m:rPr><m:aln/></m:rPr>");
        return text(text).close("r");
    }

    public OmmlWriter raw(String xml) {
        buffer.append(xml);
        return this;
    }

    public String toXml() {
        return buffer.toString();
    }

    private OmmlWriter text(String text) {
        String value = text == null ? "" : text;
        buffer.append("<m:t");
        if (!value.isEmpty() && (Character.isWhitespace(value.charAt(0))
                || Character.isWhitespace(value.charAt(value.length() - 1)))) {
            buffer.append(" xml:space=\"preserve\"");
        }
        buffer.append('>').append(escape(value)).append("</m:t>");
        return this;
    }

    /**
     * Escapes the characters that may not appear literally in OMML text or attribute values.
     */
    public static String escape(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(value.length() + 16);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                default -> {
                    // control characters other than tab and line breaks are not legal XML 1.0
                    if (ch >= 0x20 || ch == '\t' || ch == '\n' || ch == '\r') {
                        escaped.append(ch);
                    }
                }
            }
        }
        return escaped.toString();
    }
}
