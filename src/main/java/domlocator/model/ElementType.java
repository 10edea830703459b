package domlocator.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Coarse classification of an HTML element, derived from its tag name
 * (and, for {@code <input>}, its {@code type} attribute).
 */
public enum ElementType {

    // Interactive
    BUTTON, LINK, INPUT, TEXTAREA, SELECT, CHECKBOX, RADIO, FILE_INPUT, SUBMIT, FORM,

    // Content
    TEXT, IMAGE, VIDEO, AUDIO, TABLE, LIST, HEADING, PARAGRAPH,

    // Structural
    NAVIGATION, HEADER, FOOTER, MAIN, ASIDE, SECTION, ARTICLE, DIV, SPAN,

    UNKNOWN;

    private static final Set<ElementType> INTERACTIVE = Collections.unmodifiableSet(EnumSet.of(
            BUTTON, LINK, INPUT, TEXTAREA, SELECT, CHECKBOX, RADIO, FILE_INPUT, SUBMIT, FORM));

    private static final Map<String, ElementType> BY_TAG = Map.ofEntries(
            entry("button", BUTTON),
            entry("a", LINK),
            entry("input", INPUT),
            entry("textarea", TEXTAREA),
            entry("select", SELECT),
            entry("form", FORM),
            entry("img", IMAGE),
            entry("video", VIDEO),
            entry("audio", AUDIO),
            entry("table", TABLE),
            entry("ul", LIST),
            entry("ol", LIST),
            entry("li", LIST),
            entry("h1", HEADING),
            entry("h2", HEADING),
            entry("h3", HEADING),
            entry("h4", HEADING),
            entry("h5", HEADING),
            entry("h6", HEADING),
            entry("p", PARAGRAPH),
            entry("nav", NAVIGATION),
            entry("header", HEADER),
            entry("footer", FOOTER),
            entry("main", MAIN),
            entry("aside", ASIDE),
            entry("section", SECTION),
            entry("article", ARTICLE),
            entry("div", DIV),
            entry("span", SPAN));

    /** True for the types an automation agent can act on without further signals. */
    public boolean isInteractive() {
        return INTERACTIVE.contains(this);
    }

    /** The default-interactive types, unmodifiable. */
    public static Set<ElementType> interactiveTypes() {
        return INTERACTIVE;
    }

    /**
     * Looks up the type for a bare tag name. The {@code input} type override
     * is applied by the classifier, not here.
     *
     * @return the mapped type, or {@link #UNKNOWN}
     */
    public static ElementType forTag(String tagName) {
        if (tagName == null) return UNKNOWN;
        return BY_TAG.getOrDefault(tagName.toLowerCase(Locale.ROOT), UNKNOWN);
    }
}
