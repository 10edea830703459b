package domlocator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One control inside a form: an {@code input}, {@code textarea}, {@code select}
 * or {@code button}. {@code fieldId} is positional ({@code field_<form>_<field>});
 * {@code elementId} links to the matching {@link ElementRecord} when the control
 * was catalogued, and is {@code null} otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FormField {

    @JsonProperty("fieldId")
    private final String fieldId;

    @JsonProperty("elementId")
    private final String elementId;

    @JsonProperty("tagName")
    private final String tagName;

    @JsonProperty("elementType")
    private final ElementType elementType;

    @JsonProperty("formFieldType")
    private final FormFieldType formFieldType;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("required")
    private final boolean required;

    public FormField(String fieldId, String elementId, String tagName, ElementType elementType,
                     FormFieldType formFieldType, String name, boolean required) {
        this.fieldId       = Objects.requireNonNull(fieldId, "fieldId");
        this.elementId     = elementId;
        this.tagName       = tagName;
        this.elementType   = elementType != null ? elementType : ElementType.UNKNOWN;
        this.formFieldType = formFieldType;
        this.name          = name;
        this.required      = required;
    }

    public String        getFieldId()       { return fieldId; }
    public String        getElementId()     { return elementId; }
    public String        getTagName()       { return tagName; }
    public ElementType   getElementType()   { return elementType; }
    public FormFieldType getFormFieldType() { return formFieldType; }
    public String        getName()          { return name; }
    public boolean       isRequired()       { return required; }

    @Override
    public String toString() {
        return String.format("FormField{%s, <%s>, %s}", fieldId, tagName, formFieldType);
    }
}
