package domlocator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Result of one analysis pass over a page: the ordered element records plus
 * an id-keyed index and relationship map, the page's forms and size hints.
 *
 * <p>A failed pass is represented by an instance with no records and at least
 * one entry in {@link #getErrors()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"sourceUrl", "title", "analyzedAt", "processingTimeMs", "elementCount",
        "errors", "performanceHints", "elements", "relationships", "forms"})
public final class ElementAnalysis {

    /** Default cut-off for {@link #findSimilar(String)}. */
    public static final double SIMILARITY_THRESHOLD = 0.7;

    @JsonProperty("sourceUrl")
    private final String sourceUrl;

    @JsonProperty("title")
    private final String title;

    @JsonProperty("analyzedAt")
    private final Instant analyzedAt;

    @JsonProperty("processingTimeMs")
    private final long processingTimeMs;

    @JsonProperty("elements")
    private final List<ElementRecord> elements;

    @JsonProperty("relationships")
    private final Map<String, ElementHierarchy> relationships;

    @JsonProperty("errors")
    private final List<String> errors;

    @JsonProperty("forms")
    private final List<FormStructure> forms;

    @JsonProperty("performanceHints")
    private final PerformanceHints performanceHints;

    @JsonIgnore
    private final Map<String, ElementRecord> index;

    public ElementAnalysis(String sourceUrl,
                           String title,
                           Instant analyzedAt,
                           long processingTimeMs,
                           List<ElementRecord> elements,
                           Map<String, ElementHierarchy> relationships,
                           List<String> errors) {
        this(sourceUrl, title, analyzedAt, processingTimeMs, elements, relationships, errors, List.of(), null);
    }

    public ElementAnalysis(String sourceUrl,
                           String title,
                           Instant analyzedAt,
                           long processingTimeMs,
                           List<ElementRecord> elements,
                           Map<String, ElementHierarchy> relationships,
                           List<String> errors,
                           List<FormStructure> forms,
                           PerformanceHints performanceHints) {
        this.sourceUrl        = sourceUrl;
        this.title            = title;
        this.analyzedAt       = analyzedAt;
        this.processingTimeMs = processingTimeMs;
        this.elements         = elements != null ? List.copyOf(elements) : List.of();
        this.relationships    = relationships != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(relationships))
                : Map.of();
        this.errors           = errors != null ? List.copyOf(errors) : List.of();
        this.forms            = forms != null ? List.copyOf(forms) : List.of();
        this.performanceHints = performanceHints;

        Map<String, ElementRecord> idx = new LinkedHashMap<>();
        for (ElementRecord r : this.elements) idx.put(r.getElementId(), r);
        this.index = Collections.unmodifiableMap(idx);
    }

    /** An empty result for a pass that could not run. */
    public static ElementAnalysis failed(String sourceUrl, long processingTimeMs, String error) {
        return new ElementAnalysis(sourceUrl, null, Instant.now(), processingTimeMs,
                List.of(), Map.of(), List.of(error));
    }

    public String                        getSourceUrl()        { return sourceUrl; }
    public String                        getTitle()            { return title; }
    public Instant                       getAnalyzedAt()       { return analyzedAt; }
    public long                          getProcessingTimeMs() { return processingTimeMs; }
    public List<ElementRecord>           getElements()         { return elements; }
    public Map<String, ElementHierarchy> getRelationships()    { return relationships; }
    public List<String>                  getErrors()           { return errors; }
    public List<FormStructure>           getForms()            { return forms; }
    /** Page size indicators, or {@code null} for a failed pass. */
    public PerformanceHints              getPerformanceHints() { return performanceHints; }

    @JsonProperty("elementCount")
    public int getElementCount() {
        return elements.size();
    }

    public Optional<ElementRecord> find(String elementId) {
        return Optional.ofNullable(index.get(elementId));
    }

    @JsonIgnore
    public Set<String> getElementIds() {
        return index.keySet();
    }

    @JsonIgnore
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** Records of the given type, in document order. */
    public List<ElementRecord> ofType(ElementType type) {
        return elements.stream().filter(r -> r.getElementType() == type).toList();
    }

    // ── Similarity ────────────────────────────────────────────────────────

    /** Records similar to {@code elementId} above {@link #SIMILARITY_THRESHOLD}. */
    public List<ElementRecord> findSimilar(String elementId) {
        return findSimilar(elementId, SIMILARITY_THRESHOLD);
    }

    /**
     * Records whose {@link #similarity} to {@code elementId} is strictly above
     * {@code threshold}, most similar first; ties keep document order. The target
     * itself is never included, and an unknown id gives an empty list.
     */
    public List<ElementRecord> findSimilar(String elementId, double threshold) {
        ElementRecord target = index.get(elementId);
        if (target == null) return List.of();

        List<Scored> scored = new ArrayList<>();
        for (ElementRecord r : elements) {
            if (r == target) continue;
            double score = similarity(target, r);
            if (score > threshold) scored.add(new Scored(r, score));
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());
        return scored.stream().map(Scored::element).toList();
    }

    /**
     * Score in [0, 1]: 0.3 for the same element type, 0.2 for the same semantic
     * type, up to 0.2 for shared words of text and up to 0.3 for shared attribute names.
     */
    public static double similarity(ElementRecord a, ElementRecord b) {
        double score = 0.0;
        if (a.getElementType() == b.getElementType()) score += 0.3;
        if (a.getSemanticType() == b.getSemanticType()) score += 0.2;

        String[] wordsA = words(a.getText());
        String[] wordsB = words(b.getText());
        if (wordsA.length > 0 && wordsB.length > 0) {
            Set<String> common = lowerCased(wordsA);
            common.retainAll(lowerCased(wordsB));
            score += 0.2 * common.size() / Math.max(wordsA.length, wordsB.length);
        }

        Map<String, String> attrsA = a.getAttributes();
        Map<String, String> attrsB = b.getAttributes();
        long shared = attrsA.keySet().stream().filter(attrsB::containsKey).count();
        if (shared > 0) {
            score += 0.3 * shared / Math.max(attrsA.size(), attrsB.size());
        }
        return Math.min(score, 1.0);
    }

    private static String[] words(String text) {
        if (text == null || text.isBlank()) return new String[0];
        return text.trim().split("\\s+");
    }

    private static Set<String> lowerCased(String[] words) {
        Set<String> out = new HashSet<>();
        for (String w : words) out.add(w.toLowerCase(Locale.ROOT));
        return out;
    }

    private record Scored(ElementRecord element, double score) {}

    @Override
    public String toString() {
        return String.format("ElementAnalysis{url='%s', elements=%d, errors=%d, %dms}",
                sourceUrl, elements.size(), errors.size(), processingTimeMs);
    }
}
