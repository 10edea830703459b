package domlocator.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** WAI-ARIA roles recognised on the {@code role} attribute. */
public enum AccessibilityRole {

    // Landmarks
    BANNER, COMPLEMENTARY, CONTENTINFO, MAIN, NAVIGATION, REGION, SEARCH,

    // Document structure
    APPLICATION, ARTICLE, DOCUMENT,

    // Widgets
    BUTTON, CHECKBOX, DIALOG, GRIDCELL, LINK, LOG, MARQUEE, MENUITEM, MENUITEMCHECKBOX,
    MENUITEMRADIO, OPTION, PROGRESSBAR, RADIO, SCROLLBAR, SLIDER, SPINBUTTON, STATUS, TAB,
    TABPANEL, TEXTBOX, TIMER, TOOLTIP, TREEITEM,

    // Composite
    COMBOBOX, GRID, LISTBOX, MENU, MENUBAR, RADIOGROUP, TABLIST, TREE, TREEGRID,

    // Live regions
    ALERT, ALERTDIALOG,

    PRESENTATION, NONE;

    private static final Set<AccessibilityRole> INTERACTIVE = Collections.unmodifiableSet(EnumSet.of(
            BUTTON, LINK, MENUITEM, TAB, OPTION, CHECKBOX, RADIO));

    /** Roles that by themselves mark an element as something to act on. */
    public boolean isInteractive() {
        return INTERACTIVE.contains(this);
    }

    /** The attribute value of this role, e.g. {@code "menuitem"}. */
    public String attributeValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a {@code role} attribute. Only the first token of a space-separated
     * fallback list is considered.
     */
    public static Optional<AccessibilityRole> fromAttribute(String role) {
        if (role == null || role.isBlank()) return Optional.empty();
        String first = role.trim().split("\\s+")[0].toUpperCase(Locale.ROOT);
        try {
            return Optional.of(valueOf(first));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
