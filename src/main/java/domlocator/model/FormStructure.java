package domlocator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Summary of one {@code <form>}: where and how it submits, its controls in
 * document order, which of them submit or are required, and what kind of
 * form it looks like.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"formId", "elementId", "formType", "action", "method", "encType",
        "fields", "submitButtons", "requiredFields"})
public final class FormStructure {

    @JsonProperty("formId")
    private final String formId;

    @JsonProperty("elementId")
    private final String elementId;

    @JsonProperty("action")
    private final String action;

    @JsonProperty("method")
    private final String method;

    @JsonProperty("encType")
    private final String encType;

    @JsonProperty("fields")
    private final List<FormField> fields;

    @JsonProperty("submitButtons")
    private final List<String> submitButtons;

    @JsonProperty("requiredFields")
    private final List<String> requiredFields;

    @JsonProperty("formType")
    private final SemanticType formType;

    public FormStructure(String formId, String elementId, String action, String method, String encType,
                         List<FormField> fields, List<String> submitButtons, List<String> requiredFields,
                         SemanticType formType) {
        this.formId         = Objects.requireNonNull(formId, "formId");
        this.elementId      = elementId;
        this.action         = action;
        this.method         = method;
        this.encType        = encType;
        this.fields         = fields != null ? List.copyOf(fields) : List.of();
        this.submitButtons  = submitButtons != null ? List.copyOf(submitButtons) : List.of();
        this.requiredFields = requiredFields != null ? List.copyOf(requiredFields) : List.of();
        this.formType       = formType != null ? formType : SemanticType.UNKNOWN;
    }

    public String          getFormId()         { return formId; }
    /** Id of the form's own record, or {@code null} if the form was not catalogued. */
    public String          getElementId()      { return elementId; }
    public String          getAction()         { return action; }
    public String          getMethod()         { return method; }
    public String          getEncType()        { return encType; }
    public List<FormField> getFields()         { return fields; }
    public List<String>    getSubmitButtons()  { return submitButtons; }
    public List<String>    getRequiredFields() { return requiredFields; }
    public SemanticType    getFormType()       { return formType; }

    public Optional<FormField> field(String fieldId) {
        return fields.stream().filter(f -> f.getFieldId().equals(fieldId)).findFirst();
    }

    @Override
    public String toString() {
        return String.format("FormStructure{%s, %s %s, %s, %d field(s)}",
                formId, method, action, formType, fields.size());
    }
}
