package domlocator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Size indicators for an analysed page, with suggestions for pages that are
 * expensive to automate.
 */
public final class PerformanceHints {

    public enum Complexity { LOW, MEDIUM, HIGH }

    static final int MEDIUM_ABOVE        = 500;
    static final int HIGH_ABOVE          = 1000;
    static final int MANY_INTERACTIVE    = 100;
    static final String PAGINATION_HINT  = "Consider pagination or lazy loading for better performance";

    @JsonProperty("totalElements")
    private final int totalElements;

    @JsonProperty("interactiveElements")
    private final int interactiveElements;

    @JsonProperty("forms")
    private final int forms;

    @JsonProperty("complexity")
    private final Complexity complexity;

    @JsonProperty("suggestions")
    private final List<String> suggestions;

    public PerformanceHints(int totalElements, int interactiveElements, int forms,
                            Complexity complexity, List<String> suggestions) {
        this.totalElements       = totalElements;
        this.interactiveElements = interactiveElements;
        this.forms               = forms;
        this.complexity          = complexity;
        this.suggestions         = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    /**
     * Derives hints from the page's element count and the records of one pass.
     *
     * @param totalElements every element in the document, excluding the document node
     * @param records       catalogued elements
     */
    public static PerformanceHints of(int totalElements, List<ElementRecord> records) {
        int interactive = records.size();
        int forms = (int) records.stream().filter(r -> r.getElementType() == ElementType.FORM).count();

        Complexity complexity = Complexity.LOW;
        if (totalElements > HIGH_ABOVE) complexity = Complexity.HIGH;
        else if (totalElements > MEDIUM_ABOVE) complexity = Complexity.MEDIUM;

        List<String> suggestions = new ArrayList<>();
        if (interactive > MANY_INTERACTIVE) suggestions.add(PAGINATION_HINT);
        return new PerformanceHints(totalElements, interactive, forms, complexity, suggestions);
    }

    public int          getTotalElements()       { return totalElements; }
    public int          getInteractiveElements() { return interactiveElements; }
    public int          getForms()               { return forms; }
    public Complexity   getComplexity()          { return complexity; }
    public List<String> getSuggestions()         { return suggestions; }

    @Override
    public String toString() {
        return String.format("PerformanceHints{total=%d, interactive=%d, forms=%d, %s}",
                totalElements, interactiveElements, forms, complexity);
    }
}
