package ai.docsite.omml.render;

/**
 * Character formatting applied to an OMML run through its {@code m:rPr} element.
 */
public enum RunStyle {
    /** Default math italic; no run properties are written. */
    ITALIC(null, null),
    UPRIGHT(null, "p"),
    DOUBLE_STRUCK("double-struck", null),
    SCRIPT("script", null),
    SANS_SERIF("sans-serif", null);

    private final String script;
    private final String style;

    RunStyle(String script, String style) {
        this.script = script;
        this.style = style;
    }

    String script() {
        return script;
    }

    String style() {
        return style;
    }

    boolean hasProperties() {
        return script != null || style != null;
    }
}
