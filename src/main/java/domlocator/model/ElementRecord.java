package domlocator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The packaged classification result for one element of an analysed page.
 *
 * <p>Everything except {@link #getHierarchy() hierarchy} is fixed at
 * construction. The hierarchy is attached once by the relationship phase of
 * the same pass.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"elementId", "elementType", "tagName", "locators", "nonUniqueLocators",
        "interactionTypes", "semanticType", "formFieldType", "accessibilityRole", "confidence",
        "text", "placeholder", "value", "visible", "enabled", "attributes", "properties",
        "interactionHints", "hierarchy"})
public final class ElementRecord {

    @JsonProperty("elementId")
    private final String elementId;

    @JsonProperty("elementType")
    private final ElementType elementType;

    @JsonProperty("tagName")
    private final String tagName;

    @JsonProperty("locators")
    private final LocatorSet locators;

    @JsonProperty("interactionTypes")
    private final Set<InteractionType> interactionTypes;

    @JsonProperty("semanticType")
    private final SemanticType semanticType;

    /** Null when the element is not a form control. */
    @JsonProperty("formFieldType")
    private final FormFieldType formFieldType;

    /** Null when the element has no recognised {@code role}. */
    @JsonProperty("accessibilityRole")
    private final AccessibilityRole accessibilityRole;

    @JsonProperty("confidence")
    private final double confidence;

    @JsonProperty("attributes")
    private final Map<String, String> attributes;

    @JsonProperty("text")
    private final String text;

    @JsonProperty("placeholder")
    private final String placeholder;

    @JsonProperty("value")
    private final String value;

    @JsonProperty("visible")
    private final boolean visible;

    @JsonProperty("enabled")
    private final boolean enabled;

    @JsonProperty("properties")
    private final Map<String, Object> properties;

    @JsonProperty("interactionHints")
    private final List<String> interactionHints;

    @JsonProperty("hierarchy")
    private volatile ElementHierarchy hierarchy = ElementHierarchy.none();

    private ElementRecord(Builder b) {
        this.elementId         = Objects.requireNonNull(b.elementId, "elementId");
        this.elementType       = Objects.requireNonNull(b.elementType, "elementType");
        this.tagName           = Objects.requireNonNull(b.tagName, "tagName");
        this.locators          = b.locators != null ? b.locators : LocatorSet.empty();
        this.interactionTypes  = b.interactionTypes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(b.interactionTypes));
        this.semanticType      = b.semanticType != null ? b.semanticType : SemanticType.UNKNOWN;
        this.formFieldType     = b.formFieldType;
        this.accessibilityRole = b.accessibilityRole;
        this.confidence        = b.confidence;
        this.attributes        = Collections.unmodifiableMap(new LinkedHashMap<>(b.attributes));
        this.text              = b.text != null ? b.text : "";
        this.placeholder       = b.placeholder;
        this.value             = b.value;
        this.visible           = b.visible;
        this.enabled           = b.enabled;
        this.properties        = Collections.unmodifiableMap(new LinkedHashMap<>(b.properties));
        this.interactionHints  = List.copyOf(b.interactionHints);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String                 getElementId()         { return elementId; }
    public ElementType            getElementType()       { return elementType; }
    public String                 getTagName()           { return tagName; }
    public LocatorSet             getLocators()          { return locators; }
    public Set<InteractionType>   getInteractionTypes()  { return interactionTypes; }
    public SemanticType           getSemanticType()      { return semanticType; }
    public FormFieldType          getFormFieldType()     { return formFieldType; }
    public AccessibilityRole      getAccessibilityRole() { return accessibilityRole; }
    public double                 getConfidence()        { return confidence; }
    public Map<String, String>    getAttributes()        { return attributes; }
    public String                 getText()              { return text; }
    public String                 getPlaceholder()       { return placeholder; }
    public String                 getValue()             { return value; }
    public boolean                isVisible()            { return visible; }
    public boolean                isEnabled()            { return enabled; }
    public Map<String, Object>    getProperties()        { return properties; }
    public List<String>           getInteractionHints()  { return interactionHints; }
    public ElementHierarchy       getHierarchy()         { return hierarchy; }

    /** Strategy keys of locators that could not be verified unique. */
    @JsonProperty("nonUniqueLocators")
    public List<String> getNonUniqueLocators() {
        return locators.all().stream()
                .filter(l -> !l.isUnique())
                .map(l -> l.getStrategy().key())
                .toList();
    }

    @JsonIgnore
    public String getAttribute(String name) {
        return attributes.get(name);
    }

    public boolean supports(InteractionType interaction) {
        return interactionTypes.contains(interaction);
    }

    /**
     * Sets the relationship data computed by the hierarchy phase.
     *
     * @throws IllegalStateException if a hierarchy was already attached
     */
    public synchronized void attachHierarchy(ElementHierarchy hierarchy) {
        if (this.hierarchy != ElementHierarchy.none()) {
            throw new IllegalStateException("Hierarchy already attached to " + elementId);
        }
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
    }

    @Override
    public String toString() {
        return String.format("ElementRecord{id='%s', type=%s, tag=%s, semantic=%s, confidence=%.2f, locators=%d}",
                elementId, elementType, tagName, semanticType, confidence, locators.size());
    }

    public static final class Builder {

        private String elementId;
        private ElementType elementType;
        private String tagName;
        private LocatorSet locators;
        private Set<InteractionType> interactionTypes = EnumSet.noneOf(InteractionType.class);
        private SemanticType semanticType;
        private FormFieldType formFieldType;
        private AccessibilityRole accessibilityRole;
        private double confidence;
        private Map<String, String> attributes = Map.of();
        private String text;
        private String placeholder;
        private String value;
        private boolean visible = true;
        private boolean enabled = true;
        private Map<String, Object> properties = Map.of();
        private List<String> interactionHints = List.of();

        private Builder() {}

        public Builder elementId(String elementId)                 { this.elementId = elementId; return this; }
        public Builder elementType(ElementType elementType)        { this.elementType = elementType; return this; }
        public Builder tagName(String tagName)                     { this.tagName = tagName; return this; }
        public Builder locators(LocatorSet locators)               { this.locators = locators; return this; }
        public Builder semanticType(SemanticType semanticType)     { this.semanticType = semanticType; return this; }
        public Builder formFieldType(FormFieldType formFieldType)  { this.formFieldType = formFieldType; return this; }
        public Builder accessibilityRole(AccessibilityRole role)   { this.accessibilityRole = role; return this; }
        public Builder confidence(double confidence)               { this.confidence = confidence; return this; }
        public Builder text(String text)                           { this.text = text; return this; }
        public Builder placeholder(String placeholder)             { this.placeholder = placeholder; return this; }
        public Builder value(String value)                         { this.value = value; return this; }
        public Builder visible(boolean visible)                    { this.visible = visible; return this; }
        public Builder enabled(boolean enabled)                    { this.enabled = enabled; return this; }

        public Builder interactionTypes(Set<InteractionType> types) {
            this.interactionTypes = types != null ? types : EnumSet.noneOf(InteractionType.class);
            return this;
        }

        public Builder attributes(Map<String, String> attributes) {
            this.attributes = attributes != null ? attributes : Map.of();
            return this;
        }

        public Builder properties(Map<String, Object> properties) {
            this.properties = properties != null ? properties : Map.of();
            return this;
        }

        public Builder interactionHints(List<String> hints) {
            this.interactionHints = hints != null ? hints : List.of();
            return this;
        }

        public ElementRecord build() {
            return new ElementRecord(this);
        }
    }
}
