package domlocator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named locator strategies, in the order they appear in a {@link LocatorSet}.
 * CSS strategies come first, then XPath.
 */
public enum LocatorStrategy {

    CSS_ID("css-id", Syntax.CSS),
    CSS_ATTR("css-attr", Syntax.CSS),
    CSS_CLASS("css-class", Syntax.CSS),
    CSS_HIERARCHICAL("css-hierarchical", Syntax.CSS),
    /** Uses the jsoup/jQuery {@code :contains()} pseudo-class; browsers do not support it. */
    CSS_TEXT("css-text", Syntax.CSS),
    CSS_POSITION("css-position", Syntax.CSS),
    CSS_FALLBACK("css-fallback", Syntax.CSS),

    XPATH_ID("xpath-id", Syntax.XPATH),
    XPATH_ATTR("xpath-attr", Syntax.XPATH),
    XPATH_TEXT("xpath-text", Syntax.XPATH),
    XPATH_HIERARCHICAL("xpath-hierarchical", Syntax.XPATH),
    XPATH_POSITION("xpath-position", Syntax.XPATH),
    XPATH_FALLBACK("xpath-fallback", Syntax.XPATH);

    public enum Syntax { CSS, XPATH }

    private final String key;
    private final Syntax syntax;

    LocatorStrategy(String key, Syntax syntax) {
        this.key = key;
        this.syntax = syntax;
    }

    /** Stable external name, e.g. {@code "css-id"}. */
    @JsonValue
    public String key() { return key; }

    public Syntax syntax() { return syntax; }

    public boolean isCss() { return syntax == Syntax.CSS; }

    public boolean isXpath() { return syntax == Syntax.XPATH; }

    /** True if a standard browser selector engine can evaluate the expression. */
    public boolean isBrowserEvaluable() {
        return this != CSS_TEXT;
    }
}
