package ai.docsite.omml.convert;

/**
 * How a converted expression is wrapped for its parent element.
 */
public enum MathMode {
    INLINE,
    DISPLAY,
    FRAGMENT;

    public static MathMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return INLINE;
        }
        for (MathMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported math mode: " + raw);
    }

    /**
     * Maps a markdown math delimiter: {@code $} marks inline math, {@code $$} a display block.
     */
    public static MathMode forDelimiter(String delimiter) {
        if ("$".equals(delimiter)) {
            return INLINE;
        }
        if ("$$".equals(delimiter)) {
            return DISPLAY;
        }
        throw new IllegalArgumentException("Unsupported math delimiter: " + delimiter);
    }
}
