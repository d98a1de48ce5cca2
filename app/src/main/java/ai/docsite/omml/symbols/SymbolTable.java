package ai.docsite.omml.symbols;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only lookups from LaTeX command names to the Unicode text or glyphs used in OMML output.
 *
 * <p>All tables are immutable constants, so lookups are safe from any thread. Lookups are exact and
 * case-sensitive ({@code Delta} and {@code delta} are different entries) and return an empty result
 * for anything outside the tables.
 */
public final class SymbolTable {

    private static final Map<String, String> FUNCTIONS = Map.ofEntries(
            Map.entry("sin", "sin"),
            Map.entry("cos", "cos"),
            Map.entry("tan", "tan"),
            Map.entry("cot", "cot"),
            Map.entry("sec", "sec"),
            Map.entry("csc", "csc"),
            Map.entry("arcsin", "arcsin"),
            Map.entry("arccos", "arccos"),
            Map.entry("arctan", "arctan"),
            Map.entry("sinh", "sinh"),
            Map.entry("cosh", "cosh"),
            Map.entry("tanh", "tanh"),
            Map.entry("log", "log"),
            Map.entry("ln", "ln"),
            Map.entry("exp", "exp"),
            Map.entry("lim", "lim"),
            Map.entry("limsup", "lim sup"),
            Map.entry("liminf", "lim inf"),
            Map.entry("sup", "sup"),
            Map.entry("inf", "inf"),
            Map.entry("min", "min"),
            Map.entry("max", "max"),
            Map.entry("det", "det"),
            Map.entry("dim", "dim"),
            Map.entry("ker", "ker"),
            Map.entry("hom", "hom"),
            Map.entry("deg", "deg"),
            Map.entry("gcd", "gcd"),
            Map.entry("arg", "arg"),
            Map.entry("mod", "mod"),
            Map.entry("Pr", "Pr"));

    private static final Map<String, String> GLYPHS = Map.ofEntries(
            // Greek lowercase
            Map.entry("alpha", "α"),
            Map.entry("beta", "β"),
            Map.entry("gamma", "γ"),
            Map.entry("delta", "δ"),
            Map.entry("epsilon", "ε"),
            Map.entry("varepsilon", "ε"),
            Map.entry("zeta", "ζ"),
            Map.entry("eta", "η"),
            Map.entry("theta", "θ"),
            Map.entry("vartheta", "ϑ"),
            Map.entry("iota", "ι"),
            Map.entry("kappa", "κ"),
            Map.entry("lambda", "λ"),
            Map.entry("mu", "μ"),
            Map.entry("nu", "ν"),
            Map.entry("xi", "ξ"),
            Map.entry("pi", "π"),
            Map.entry("varpi", "ϖ"),
            Map.entry("rho", "ρ"),
            Map.entry("varrho", "ϱ"),
            Map.entry("sigma", "σ"),
            Map.entry("varsigma", "ς"),
            Map.entry("tau", "τ"),
            Map.entry("upsilon", "υ"),
            Map.entry("phi", "φ"),
            Map.entry("varphi", "ϕ"),
            Map.entry("chi", "χ"),
            Map.entry("psi", "ψ"),
            Map.entry("omega", "ω"),
            // Greek uppercase
            Map.entry("Gamma", "Γ"),
            Map.entry("Delta", "Δ"),
            Map.entry("Theta", "Θ"),
            Map.entry("Lambda", "Λ"),
            Map.entry("Xi", "Ξ"),
            Map.entry("Pi", "Π"),
            Map.entry("Sigma", "Σ"),
            Map.entry("Upsilon", "Υ"),
            Map.entry("Phi", "Φ"),
            Map.entry("Psi", "Ψ"),
            Map.entry("Omega", "Ω"),
            // Operators and relations
            Map.entry("times", "×"),
            Map.entry("div", "÷"),
            Map.entry("cdot", "⋅"),
            Map.entry("pm", "±"),
            Map.entry("mp", "∓"),
            Map.entry("ast", "∗"),
            Map.entry("leq", "≤"),
            Map.entry("le", "≤"),
            Map.entry("geq", "≥"),
            Map.entry("ge", "≥"),
            Map.entry("neq", "≠"),
            Map.entry("ne", "≠"),
            Map.entry("ll", "≪"),
            Map.entry("gg", "≫"),
            Map.entry("approx", "≈"),
            Map.entry("equiv", "≡"),
            Map.entry("sim", "∼"),
            Map.entry("simeq", "≃"),
            Map.entry("cong", "≅"),
            Map.entry("propto", "∝"),
            Map.entry("infty", "∞"),
            Map.entry("partial", "∂"),
            Map.entry("nabla", "∇"),
            Map.entry("prime", "′"),
            Map.entry("dagger", "†"),
            // Sets and logic
            Map.entry("forall", "∀"),
            Map.entry("exists", "∃"),
            Map.entry("in", "∈"),
            Map.entry("notin", "∉"),
            Map.entry("ni", "∋"),
            Map.entry("subset", "⊂"),
            Map.entry("supset", "⊃"),
            Map.entry("subseteq", "⊆"),
            Map.entry("supseteq", "⊇"),
            Map.entry("cup", "∪"),
            Map.entry("cap", "∩"),
            Map.entry("setminus", "∖"),
            Map.entry("emptyset", "∅"),
            Map.entry("varnothing", "∅"),
            Map.entry("neg", "¬"),
            Map.entry("lnot", "¬"),
            Map.entry("land", "∧"),
            Map.entry("lor", "∨"),
            Map.entry("wedge", "∧"),
            Map.entry("vee", "∨"),
            Map.entry("oplus", "⊕"),
            Map.entry("otimes", "⊗"),
            // Arrows
            Map.entry("rightarrow", "→"),
            Map.entry("to", "→"),
            Map.entry("leftarrow", "←"),
            Map.entry("leftrightarrow", "↔"),
            Map.entry("longrightarrow", "⟶"),
            Map.entry("uparrow", "↑"),
            Map.entry("downarrow", "↓"),
            Map.entry("mapsto", "↦"),
            Map.entry("Rightarrow", "⇒"),
            Map.entry("Leftarrow", "⇐"),
            Map.entry("Leftrightarrow", "⇔"),
            Map.entry("Longrightarrow", "⟹"),
            Map.entry("implies", "⇒"),
            Map.entry("iff", "⇔"),
            // Dots and miscellaneous
            Map.entry("ldots", "…"),
            Map.entry("dots", "…"),
            Map.entry("cdots", "⋯"),
            Map.entry("vdots", "⋮"),
            Map.entry("ddots", "⋱"),
            Map.entry("therefore", "∴"),
            Map.entry("because", "∵"),
            Map.entry("angle", "∠"),
            Map.entry("perp", "⊥"),
            Map.entry("parallel", "∥"),
            Map.entry("star", "⋆"),
            Map.entry("circ", "∘"),
            Map.entry("bullet", "•"),
            Map.entry("ell", "ℓ"),
            Map.entry("hbar", "ℏ"),
            Map.entry("aleph", "ℵ"),
            // Delimiters written outside \left ... \right
            Map.entry("langle", "⟨"),
            Map.entry("rangle", "⟩"),
            Map.entry("lfloor", "⌊"),
            Map.entry("rfloor", "⌋"),
            Map.entry("lceil", "⌈"),
            Map.entry("rceil", "⌉"),
            Map.entry("lbrace", "{"),
            Map.entry("rbrace", "}"),
            Map.entry("vert", "|"),
            Map.entry("Vert", "‖"),
            Map.entry("mid", "∣"),
            // Spacing; "!" is a negative kern and has no visible width
            Map.entry("quad", "\u2003"),
            Map.entry("qquad", "\u2003\u2003"),
            Map.entry(",", "\u2009"),
            Map.entry(";", "\u2005"),
            Map.entry("!", ""),
            Map.entry(" ", " "),
            // Accent placeholders, used when the accent has nothing to decorate
            Map.entry("hat", "\u0302"),
            Map.entry("bar", "\u0304"),
            Map.entry("dot", "\u0307"),
            Map.entry("ddot", "\u0308"),
            Map.entry("tilde", "\u0303"),
            Map.entry("vec", "\u20D7"));

    private static final Map<String, String> NARY_OPERATORS = Map.ofEntries(
            Map.entry("sum", "∑"),
            Map.entry("prod", "∏"),
            Map.entry("coprod", "∐"),
            Map.entry("int", "∫"),
            Map.entry("iint", "∬"),
            Map.entry("iiint", "∭"),
            Map.entry("oint", "∮"),
            Map.entry("bigcup", "⋃"),
            Map.entry("bigcap", "⋂"),
            Map.entry("bigoplus", "⨁"),
            Map.entry("bigotimes", "⨂"));

    private static final Map<String, String> ACCENTS = Map.ofEntries(
            Map.entry("overline", "\u0305"),
            Map.entry("bar", "\u0305"),
            Map.entry("hat", "\u0302"),
            Map.entry("widehat", "\u0302"),
            Map.entry("tilde", "\u0303"),
            Map.entry("widetilde", "\u0303"),
            Map.entry("vec", "\u20D7"),
            Map.entry("dot", "\u0307"),
            Map.entry("ddot", "\u0308"));

    private static final Map<String, String> DELIMITERS = Map.ofEntries(
            Map.entry("langle", "⟨"),
            Map.entry("rangle", "⟩"),
            Map.entry("lfloor", "⌊"),
            Map.entry("rfloor", "⌋"),
            Map.entry("lceil", "⌈"),
            Map.entry("rceil", "⌉"),
            Map.entry("lbrace", "{"),
            Map.entry("rbrace", "}"),
            Map.entry("vert", "|"),
            Map.entry("lvert", "|"),
            Map.entry("rvert", "|"),
            Map.entry("Vert", "‖"),
            Map.entry("lVert", "‖"),
            Map.entry("rVert", "‖"));

    private static final Set<String> TEXT_COMMANDS = Set.of(
            "text", "textrm", "textbf", "textit", "mathrm", "mathbf", "mathit", "mathbb", "mathcal", "mathsf",
            "operatorname");

    private static final Set<String> RELATIONS = Set.of(
            "leq", "le", "geq", "ge", "neq", "ne", "ll", "gg", "approx", "equiv", "sim", "simeq", "cong",
            "propto", "in", "notin", "ni", "subset", "supset", "subseteq", "supseteq", "mid", "parallel",
            "perp", "to", "rightarrow", "leftarrow", "leftrightarrow", "longrightarrow", "mapsto",
            "Rightarrow", "Leftarrow", "Leftrightarrow", "Longrightarrow", "implies", "iff");

    private SymbolTable() {
    }

    /**
     * Returns the text for a plain symbol or an upright function name.
     */
    public static Optional<String> symbol(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String glyph = GLYPHS.get(name);
        if (glyph != null) {
            return Optional.of(glyph);
        }
        return Optional.ofNullable(FUNCTIONS.get(name));
    }

    public static boolean isFunction(String name) {
        return name != null && FUNCTIONS.containsKey(name);
    }

    public static Optional<String> naryOperator(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(NARY_OPERATORS.get(name));
    }

    /**
     * Commands whose argument is set as text rather than math.
     */
    public static boolean isTextCommand(String name) {
        return name != null && TEXT_COMMANDS.contains(name);
    }

    public static boolean isRelation(String name) {
        return name != null && RELATIONS.contains(name);
    }

    public static Optional<String> accent(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(ACCENTS.get(name));
    }

    public static Optional<String> delimiter(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(DELIMITERS.get(name));
    }

    /**
     * Every name {@link #symbol(String)} resolves, functions included.
     */
    public static Set<String> symbolNames() {
        Set<String> names = new TreeSet<>(GLYPHS.keySet());
        names.addAll(FUNCTIONS.keySet());
        return Collections.unmodifiableSet(names);
    }

    public static Set<String> naryOperatorNames() {
        return NARY_OPERATORS.keySet();
    }
}
