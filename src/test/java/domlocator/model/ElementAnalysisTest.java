package domlocator.model;

import org.testng.annotations.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/** Tests for the query helpers of {@link ElementAnalysis} and for {@link PerformanceHints}. */
public class ElementAnalysisTest {

    private static ElementRecord record(String id, ElementType type, SemanticType semantic,
                                        String text, Map<String, String> attributes) {
        return ElementRecord.builder()
                .elementId(id)
                .elementType(type)
                .tagName(type == ElementType.LINK ? "a" : "button")
                .semanticType(semantic)
                .text(text)
                .attributes(attributes)
                .build();
    }

    private static final ElementRecord TARGET = record("add_1", ElementType.BUTTON, SemanticType.CART,
            "Add to cart", Map.of("class", "add", "data-id", "1"));
    private static final ElementRecord TWIN = record("add_2", ElementType.BUTTON, SemanticType.CART,
            "Add to cart", Map.of("class", "add", "data-id", "2"));
    private static final ElementRecord WISHLIST = record("wish", ElementType.BUTTON, SemanticType.UNKNOWN,
            "Add to wishlist", Map.of("class", "wish"));
    private static final ElementRecord ITEM = record("item", ElementType.BUTTON, SemanticType.CART,
            "Add item", Map.of("class", "add", "data-id", "3"));
    private static final ElementRecord LINK = record("cart_link", ElementType.LINK, SemanticType.CART,
            "Add to cart", Map.of("href", "/cart"));
    private static final ElementRecord TWIN_LATER = record("add_3", ElementType.BUTTON, SemanticType.CART,
            "add TO cart", Map.of("class", "add", "data-id", "4"));

    private static ElementAnalysis analysisOf(ElementRecord... records) {
        return new ElementAnalysis("https://example.test/", "Shop", Instant.EPOCH, 1,
                List.of(records), Map.of(), List.of());
    }

    // ── Similarity ────────────────────────────────────────────────────────

    @Test(description = "Similarity adds type, semantic, word and attribute-name overlap, capped at 1")
    public void testSimilarityScore() {
        assertThat(ElementAnalysis.similarity(TARGET, TWIN)).isCloseTo(1.0, within(1e-9));
        assertThat(ElementAnalysis.similarity(TARGET, ITEM)).isCloseTo(0.3 + 0.2 + 0.2 / 3 + 0.3, within(1e-9));
        assertThat(ElementAnalysis.similarity(TARGET, WISHLIST)).isCloseTo(0.3 + 0.2 * 2 / 3 + 0.15, within(1e-9));
        assertThat(ElementAnalysis.similarity(TARGET, LINK)).isCloseTo(0.4, within(1e-9));
    }

    @Test(description = "Blank text and disjoint attributes contribute nothing")
    public void testSimilarityWithoutTextOrAttributes() {
        ElementRecord bare = record("bare", ElementType.BUTTON, SemanticType.UNKNOWN, "  ", Map.of());

        assertThat(ElementAnalysis.similarity(TARGET, bare)).isCloseTo(0.3, within(1e-9));
    }

    @Test(description = "Similar records are above the threshold, most similar first, ties in document order")
    public void testFindSimilar() {
        ElementAnalysis analysis = analysisOf(TARGET, TWIN, WISHLIST, ITEM, LINK, TWIN_LATER);

        assertThat(analysis.findSimilar("add_1")).extracting(ElementRecord::getElementId)
                .containsExactly("add_2", "add_3", "item");
    }

    @Test(description = "A lower threshold admits weaker matches")
    public void testFindSimilarThreshold() {
        ElementAnalysis analysis = analysisOf(TARGET, TWIN, WISHLIST, ITEM, LINK);

        assertThat(analysis.findSimilar("add_1", 0.5)).extracting(ElementRecord::getElementId)
                .containsExactly("add_2", "item", "wish");
    }

    @Test(description = "An unknown id finds nothing and the target never matches itself")
    public void testFindSimilarEdges() {
        ElementAnalysis analysis = analysisOf(TARGET);

        assertThat(analysis.findSimilar("missing")).isEmpty();
        assertThat(analysis.findSimilar("add_1", 0.0)).isEmpty();
    }

    // ── Performance hints ─────────────────────────────────────────────────

    @Test(description = "Complexity rises above 500 and 1000 elements")
    public void testComplexity() {
        assertThat(PerformanceHints.of(500, List.of()).getComplexity()).isEqualTo(PerformanceHints.Complexity.LOW);
        assertThat(PerformanceHints.of(501, List.of()).getComplexity()).isEqualTo(PerformanceHints.Complexity.MEDIUM);
        assertThat(PerformanceHints.of(1000, List.of()).getComplexity()).isEqualTo(PerformanceHints.Complexity.MEDIUM);
        assertThat(PerformanceHints.of(1001, List.of()).getComplexity()).isEqualTo(PerformanceHints.Complexity.HIGH);
    }

    @Test(description = "Forms are counted and many interactive elements earn a suggestion")
    public void testCountsAndSuggestions() {
        List<ElementRecord> records = new ArrayList<>();
        records.add(ElementRecord.builder().elementId("f").elementType(ElementType.FORM).tagName("form").build());
        for (int i = 0; i < 100; i++) {
            records.add(record("b" + i, ElementType.BUTTON, SemanticType.UNKNOWN, "", Map.of()));
        }

        PerformanceHints many = PerformanceHints.of(300, records);
        assertThat(many.getInteractiveElements()).isEqualTo(101);
        assertThat(many.getForms()).isEqualTo(1);
        assertThat(many.getTotalElements()).isEqualTo(300);
        assertThat(many.getSuggestions()).containsExactly(PerformanceHints.PAGINATION_HINT);

        assertThat(PerformanceHints.of(300, records.subList(0, 100)).getSuggestions()).isEmpty();
    }

    @Test(description = "A failed pass has no forms and no hints")
    public void testFailedAnalysis() {
        ElementAnalysis failed = ElementAnalysis.failed(null, 0, "Document is null");

        assertThat(failed.getForms()).isEmpty();
        assertThat(failed.getPerformanceHints()).isNull();
    }
}
