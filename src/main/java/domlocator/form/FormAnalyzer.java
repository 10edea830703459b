package domlocator.form;

import domlocator.classify.ElementClassifier;
import domlocator.model.FormField;
import domlocator.model.FormFieldType;
import domlocator.model.FormStructure;
import domlocator.model.SemanticType;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Describes every {@code <form>} of a document: its submission attributes, its
 * controls and the kind of form it appears to be.
 *
 * <p>Forms are numbered in document order ({@code form_0}, {@code form_1}, ...)
 * and their controls per form ({@code field_0_0}, {@code field_0_1}, ...).
 * Controls are matched to element records through the id map passed in, so
 * a form or field that was not catalogued simply has no element id.
 */
public class FormAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(FormAnalyzer.class);

    static final String DEFAULT_METHOD   = "GET";
    static final String DEFAULT_ENC_TYPE = "application/x-www-form-urlencoded";

    private static final String CONTROLS = "input, textarea, select, button";

    // Checked in this order against the form's class and id
    private static final Map<SemanticType, List<String>> NAME_KEYWORDS = new LinkedHashMap<>();
    static {
        NAME_KEYWORDS.put(SemanticType.LOGIN_FORM,        List.of("login", "signin", "auth"));
        NAME_KEYWORDS.put(SemanticType.SEARCH_FORM,       List.of("search", "query"));
        NAME_KEYWORDS.put(SemanticType.REGISTRATION_FORM, List.of("register", "signup", "create"));
        NAME_KEYWORDS.put(SemanticType.CONTACT_FORM,      List.of("contact", "message", "feedback"));
    }

    private final ElementClassifier classifier;

    public FormAnalyzer(ElementClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public FormAnalyzer() {
        this(new ElementClassifier());
    }

    /**
     * @param document  parsed page
     * @param recordIds element record id per catalogued node; looked up by identity
     * @return one structure per form, in document order
     */
    public List<FormStructure> analyze(Document document, Map<Element, String> recordIds) {
        Elements forms = document.select("form");
        List<FormStructure> out = new ArrayList<>(forms.size());
        for (int i = 0; i < forms.size(); i++) {
            out.add(analyzeForm(forms.get(i), i, recordIds));
        }
        log.debug("Analyzed {} form(s)", out.size());
        return out;
    }

    FormStructure analyzeForm(Element form, int formIndex, Map<Element, String> recordIds) {
        List<FormField> fields = new ArrayList<>();
        List<String> submitButtons = new ArrayList<>();
        List<String> requiredFields = new ArrayList<>();

        Elements controls = form.select(CONTROLS);
        for (int j = 0; j < controls.size(); j++) {
            Element control = controls.get(j);
            String fieldId = "field_" + formIndex + "_" + j;
            boolean required = control.hasAttr("required");

            fields.add(new FormField(fieldId, recordIds.get(control), control.normalName(),
                    classifier.elementType(control), fieldType(control),
                    control.hasAttr("name") ? control.attr("name") : null, required));

            if (isSubmit(control)) submitButtons.add(fieldId);
            if (required) requiredFields.add(fieldId);
        }

        String method = form.attr("method").trim();
        String encType = form.attr("enctype").trim();
        return new FormStructure(
                "form_" + formIndex,
                recordIds.get(form),
                form.attr("action"),
                method.isEmpty() ? DEFAULT_METHOD : method.toUpperCase(Locale.ROOT),
                encType.isEmpty() ? DEFAULT_ENC_TYPE : encType,
                fields, submitButtons, requiredFields,
                formType(form, fields));
    }

    /**
     * Form kind from its class or id keywords, else from its field types: a
     * password with an email or text field is a login form; a search field, or
     * a lone text field, is a search form.
     */
    SemanticType formType(Element form, List<FormField> fields) {
        String classes = form.className().toLowerCase(Locale.ROOT);
        String id = form.id().toLowerCase(Locale.ROOT);
        for (Map.Entry<SemanticType, List<String>> e : NAME_KEYWORDS.entrySet()) {
            for (String keyword : e.getValue()) {
                if (classes.contains(keyword) || id.contains(keyword)) return e.getKey();
            }
        }

        List<FormFieldType> types = fields.stream()
                .map(FormField::getFormFieldType)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        Set<FormFieldType> present = Set.copyOf(types);

        if ((present.contains(FormFieldType.EMAIL) || present.contains(FormFieldType.TEXT))
                && present.contains(FormFieldType.PASSWORD)) {
            return SemanticType.LOGIN_FORM;
        }
        if (present.contains(FormFieldType.SEARCH)
                || (types.size() == 1 && types.get(0) == FormFieldType.TEXT)) {
            return SemanticType.SEARCH_FORM;
        }
        return SemanticType.UNKNOWN;
    }

    private FormFieldType fieldType(Element control) {
        FormFieldType type = classifier.formFieldType(control).orElse(null);
        if (type == null && "input".equals(control.normalName())) return FormFieldType.TEXT;
        return type;
    }

    private static boolean isSubmit(Element control) {
        if ("button".equals(control.normalName())) return true;
        if (!"input".equals(control.normalName())) return false;
        String type = control.attr("type").trim().toLowerCase(Locale.ROOT);
        return type.equals("submit") || type.equals("button");
    }
}
