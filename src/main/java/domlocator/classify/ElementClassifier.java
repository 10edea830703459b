package domlocator.classify;

import domlocator.model.AccessibilityRole;
import domlocator.model.ElementType;
import domlocator.model.FormFieldType;
import domlocator.model.InteractionType;
import domlocator.model.SemanticType;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether an element belongs in the catalogue and derives its type,
 * interactions, form-field type, semantic type and confidence.
 *
 * <p>All decisions are table lookups on the element's own tag, attributes and
 * text; no ancestor or sibling is consulted. Instances are immutable and may be
 * shared between threads.
 */
public class ElementClassifier {

    private static final Logger log = LoggerFactory.getLogger(ElementClassifier.class);

    static final List<String> INCLUSION_ATTRIBUTES = List.of(
            "onclick", "onmousedown", "onmouseup", "onkeypress", "onkeydown",
            "href", "data-toggle", "data-target", "data-dismiss", "role");

    static final List<String> INTERACTIVE_CLASS_FRAGMENTS =
            List.of("btn", "button", "link", "click", "toggle", "submit");

    private static final Set<String> NON_TYPING_INPUTS = Set.of("submit", "button", "checkbox", "radio", "file");
    private static final Set<String> DATE_INPUTS       = Set.of("date", "datetime-local", "time");
    private static final Set<String> FOCUSABLE_TAGS    = Set.of("input", "textarea", "select", "button");
    private static final Set<String> SELF_CLOSING_TAGS = Set.of("img", "input", "br", "hr", "meta", "link");

    private final SemanticRules rules;
    private final int minTextLength;
    private final boolean includeHidden;

    public ElementClassifier(SemanticRules rules, int minTextLength, boolean includeHidden) {
        this.rules         = Objects.requireNonNull(rules, "rules");
        this.minTextLength = minTextLength;
        this.includeHidden = includeHidden;
    }

    /** Default keyword tables, minimum text length 3, hidden elements skipped. */
    public ElementClassifier() {
        this(SemanticRules.defaults(), 3, false);
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Classifies {@code el}.
     *
     * @return empty when the element is neither default-interactive nor carries an
     *         inclusion signal, or when it is hidden and hidden elements are skipped
     */
    public Optional<Classification> classify(Element el) {
        ElementType type = elementType(el);
        if (!type.isInteractive() && !hasInclusionSignal(el)) return Optional.empty();

        boolean hidden = isHidden(el);
        if (hidden && !includeHidden) {
            log.debug("Skipping hidden <{}>", el.normalName());
            return Optional.empty();
        }

        String text = el.text();
        Set<InteractionType> interactions = interactions(el, type);
        SemanticType semantic = semanticType(el, text);

        return Optional.of(new Classification(
                type,
                interactions,
                formFieldType(el).orElse(null),
                semantic,
                confidence(el, type, semantic, text),
                text,
                interactionHints(el, interactions),
                properties(el),
                !hidden,
                !isDisabled(el),
                AccessibilityRole.fromAttribute(el.attr("role")).orElse(null)));
    }

    // ── Type and inclusion ────────────────────────────────────────────────

    /** Tag-table type, with {@code <input type>} overriding for checkbox, radio, file and submit. */
    public ElementType elementType(Element el) {
        if (!"input".equals(el.normalName())) return ElementType.forTag(el.normalName());
        switch (inputType(el)) {
            case "checkbox": return ElementType.CHECKBOX;
            case "radio":    return ElementType.RADIO;
            case "file":     return ElementType.FILE_INPUT;
            case "submit":
            case "button":   return ElementType.SUBMIT;
            default:         return ElementType.INPUT;
        }
    }

    /**
     * True if the element carries an event handler, {@code href}, toggle attribute
     * or {@code role}, an interactive ARIA role, or a class name hinting at a control.
     */
    public boolean hasInclusionSignal(Element el) {
        for (String attr : INCLUSION_ATTRIBUTES) {
            if (el.hasAttr(attr)) return true;
        }
        if (AccessibilityRole.fromAttribute(el.attr("role")).map(AccessibilityRole::isInteractive).orElse(false)) {
            return true;
        }
        for (String c : el.classNames()) {
            String lower = c.toLowerCase(Locale.ROOT);
            for (String fragment : INTERACTIVE_CLASS_FRAGMENTS) {
                if (lower.contains(fragment)) return true;
            }
        }
        return false;
    }

    public boolean isHidden(Element el) {
        if (el.hasAttr("hidden")) return true;
        if ("true".equalsIgnoreCase(el.attr("aria-hidden"))) return true;
        String style = el.attr("style").toLowerCase(Locale.ROOT).replace(" ", "");
        if (style.contains("display:none") || style.contains("visibility:hidden")) return true;
        return "input".equals(el.normalName()) && "hidden".equals(inputType(el));
    }

    private static boolean isDisabled(Element el) {
        return el.hasAttr("disabled") || "true".equalsIgnoreCase(el.attr("aria-disabled"));
    }

    // ── Interactions ──────────────────────────────────────────────────────

    public Set<InteractionType> interactions(Element el, ElementType type) {
        Set<InteractionType> out = EnumSet.noneOf(InteractionType.class);
        String tag = el.normalName();
        String inputType = "input".equals(tag) ? inputType(el) : el.attr("type").toLowerCase(Locale.ROOT);

        if (type == ElementType.BUTTON || type == ElementType.LINK || type == ElementType.SUBMIT
                || el.hasAttr("onclick") || "button".equalsIgnoreCase(el.attr("role"))) {
            out.add(InteractionType.CLICK);
        }
        if ((type == ElementType.INPUT || type == ElementType.TEXTAREA) && !NON_TYPING_INPUTS.contains(inputType)) {
            out.add(InteractionType.TYPE);
        }
        if (type == ElementType.SELECT || type == ElementType.CHECKBOX || type == ElementType.RADIO) {
            out.add(InteractionType.SELECT);
        }
        if (type == ElementType.SELECT && el.hasAttr("multiple")) out.add(InteractionType.MULTI_SELECT);

        if ("file".equals(inputType))              out.add(InteractionType.UPLOAD);
        else if ("range".equals(inputType))        out.add(InteractionType.RANGE_SELECT);
        else if ("color".equals(inputType))        out.add(InteractionType.COLOR_PICK);
        else if (DATE_INPUTS.contains(inputType))  out.add(InteractionType.DATE_PICK);

        if (el.hasAttr("title") || "abbr".equals(tag) || "acronym".equals(tag)) out.add(InteractionType.HOVER);

        if (FOCUSABLE_TAGS.contains(tag)) {
            out.add(InteractionType.FOCUS);
            out.add(InteractionType.BLUR);
        }
        if ("form".equals(tag) || ("input".equals(tag) && "submit".equals(inputType))) {
            out.add(InteractionType.SUBMIT);
        }
        if ("a".equals(tag) && !el.attr("href").isEmpty()) out.add(InteractionType.NAVIGATE);
        return out;
    }

    List<String> interactionHints(Element el, Set<InteractionType> interactions) {
        List<String> hints = new ArrayList<>();
        String tag = el.normalName();
        String type = el.attr("type").toLowerCase(Locale.ROOT);

        if (interactions.contains(InteractionType.CLICK)) {
            if ("button".equals(tag)) {
                hints.add("Click to activate button");
            } else if ("a".equals(tag)) {
                String href = el.attr("href");
                if (href.startsWith("#"))            hints.add("Click to navigate to page section");
                else if (href.startsWith("mailto:")) hints.add("Click to send email");
                else if (href.startsWith("tel:"))    hints.add("Click to make phone call");
                else                                 hints.add("Click to navigate to URL");
            } else {
                hints.add("Element is clickable");
            }
        }

        if (interactions.contains(InteractionType.TYPE)) {
            String placeholder = el.attr("placeholder");
            switch (type.isEmpty() ? "text" : type) {
                case "email":    hints.add("Enter email address"); break;
                case "password": hints.add("Enter password"); break;
                case "search":   hints.add("Enter search query"); break;
                case "number":   hints.add("Enter numeric value"); break;
                default:         hints.add(placeholder.isEmpty() ? "Enter text" : "Enter " + placeholder);
            }
        }

        if (interactions.contains(InteractionType.SELECT)) {
            if ("select".equals(tag)) {
                hints.add(el.hasAttr("multiple") ? "Select one or more options" : "Select an option");
            } else if ("checkbox".equals(type)) {
                hints.add("Check or uncheck");
            } else if ("radio".equals(type)) {
                hints.add("Select radio option");
            }
        }

        if (interactions.contains(InteractionType.UPLOAD)) {
            String accept = el.attr("accept");
            if (accept.contains("image"))  hints.add("Upload image file");
            else if (!accept.isEmpty())    hints.add("Upload file (" + accept + ")");
            else                           hints.add("Upload file");
        }
        return hints;
    }

    // ── Form field and semantics ──────────────────────────────────────────

    public Optional<FormFieldType> formFieldType(Element el) {
        switch (el.normalName()) {
            case "input":    return FormFieldType.forInputType(inputType(el));
            case "textarea": return Optional.of(FormFieldType.TEXTAREA);
            case "select":   return Optional.of(el.hasAttr("multiple") ? FormFieldType.MULTISELECT : FormFieldType.SELECT);
            case "button":   return Optional.of(FormFieldType.BUTTON);
            default:         return Optional.empty();
        }
    }

    /**
     * Resolves the semantic type by rule precedence: search, login, navigation,
     * then the generic table. The navigation rule looks at the tag, id and
     * classes only; every other rule also looks at {@code text}.
     */
    public SemanticType semanticType(Element el, String text) {
        String id = el.id().toLowerCase(Locale.ROOT);
        String classes = String.join(" ", el.classNames()).toLowerCase(Locale.ROOT);
        String lowerText = text == null ? "" : text.toLowerCase(Locale.ROOT);

        if (matchesAny(rules.searchKeywords(), id, classes, lowerText)) return SemanticType.SEARCH_FORM;
        if (matchesAny(rules.loginKeywords(), id, classes, lowerText))  return SemanticType.LOGIN_FORM;
        if ("nav".equals(el.normalName()) || matchesAny(rules.navigationKeywords(), id, classes)) {
            return SemanticType.PRIMARY_NAV;
        }
        for (Map.Entry<SemanticType, List<String>> e : rules.genericKeywords().entrySet()) {
            if (matchesAny(e.getValue(), id, classes, lowerText)) return e.getKey();
        }
        return SemanticType.UNKNOWN;
    }

    private static boolean matchesAny(List<String> keywords, String... haystacks) {
        for (String keyword : keywords) {
            for (String h : haystacks) {
                if (h.contains(keyword)) return true;
            }
        }
        return false;
    }

    // ── Confidence ────────────────────────────────────────────────────────

    /**
     * Base 0.5; +0.3 default-interactive type; +0.2 resolved semantic type;
     * +0.1 id or name; +0.1 text longer than the configured minimum; -0.2 for a
     * {@code div} or {@code span} without an inclusion signal. Clamped to [0, 1]
     * and rounded to two decimals.
     */
    public double confidence(Element el, ElementType type, SemanticType semantic, String text) {
        double score = 0.5;
        if (type.isInteractive()) score += 0.3;
        if (semantic != null && semantic.isResolved()) score += 0.2;
        if (!el.id().isEmpty() || !el.attr("name").isEmpty()) score += 0.1;
        if (text != null && text.trim().length() > minTextLength) score += 0.1;

        String tag = el.normalName();
        if (("div".equals(tag) || "span".equals(tag)) && !hasInclusionSignal(el)) score -= 0.2;

        score = Math.min(Math.max(score, 0.0), 1.0);
        return Math.round(score * 100) / 100.0;
    }

    // ── Properties ────────────────────────────────────────────────────────

    Map<String, Object> properties(Element el) {
        Map<String, Object> props = new LinkedHashMap<>();
        String tag = el.normalName();
        props.put("tag_name", tag);
        props.put("has_children", el.childNodeSize() > 0);
        props.put("is_self_closing", SELF_CLOSING_TAGS.contains(tag));
        props.put("attribute_count", el.attributesSize());

        if ("input".equals(tag)) {
            props.put("input_type", inputType(el));
            props.put("required", el.hasAttr("required"));
            props.put("readonly", el.hasAttr("readonly"));
            props.put("multiple", el.hasAttr("multiple"));
        }
        if ("a".equals(tag)) {
            String href = el.attr("href");
            props.put("is_external_link", href.startsWith("http"));
            props.put("is_anchor_link", href.startsWith("#"));
            props.put("is_mailto", href.startsWith("mailto:"));
            props.put("is_tel", href.startsWith("tel:"));
        }
        if (!el.attr("form").isEmpty()) props.put("associated_form", el.attr("form"));
        return props;
    }

    private static String inputType(Element el) {
        String type = el.attr("type").trim().toLowerCase(Locale.ROOT);
        return type.isEmpty() ? "text" : type;
    }
}
