package domlocator.model;

import com.fasterxml.jackson.databind.JsonNode;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * JSON export tests for AnalysisIO.
 */
public class AnalysisIOTest {

    private static ElementRecord button() {
        ElementRecord r = ElementRecord.builder()
                .elementId("id_go")
                .elementType(ElementType.BUTTON)
                .tagName("button")
                .locators(LocatorSet.builder()
                        .add(ElementLocator.unique(LocatorStrategy.CSS_ID, "#go"))
                        .add(ElementLocator.bestEffort(LocatorStrategy.XPATH_FALLBACK, "//button"))
                        .build())
                .interactionTypes(EnumSet.of(InteractionType.CLICK, InteractionType.FOCUS))
                .formFieldType(FormFieldType.BUTTON)
                .confidence(0.9)
                .attributes(Map.of("id", "go"))
                .text("Go")
                .properties(Map.of("tag_name", "button"))
                .interactionHints(List.of("Click to activate button"))
                .build();
        r.attachHierarchy(new ElementHierarchy(null, List.of(), List.of(), 3));
        return r;
    }

    private static ElementAnalysis analysis() {
        ElementRecord r = button();
        return new ElementAnalysis("https://example.test/", "Example", Instant.parse("2024-05-01T10:15:30Z"), 12,
                List.of(r), Map.of(r.getElementId(), r.getHierarchy()), List.of());
    }

    // ── Record JSON ───────────────────────────────────────────────────────

    @Test
    public void recordJson_locatorsAsStrategyMap() throws IOException {
        JsonNode node = AnalysisIO.getMapper().readTree(AnalysisIO.toJson(button()));

        assertThat(node.get("elementId").asText()).isEqualTo("id_go");
        assertThat(node.get("elementType").asText()).isEqualTo("BUTTON");
        assertThat(node.get("locators").get("css-id").asText()).isEqualTo("#go");
        assertThat(node.get("locators").get("xpath-fallback").asText()).isEqualTo("//button");
        assertThat(node.get("nonUniqueLocators").get(0).asText()).isEqualTo("xpath-fallback");
        assertThat(node.get("interactionTypes")).extracting(JsonNode::asText).containsExactly("CLICK", "FOCUS");
        assertThat(node.get("confidence").asDouble()).isEqualTo(0.9);
        assertThat(node.get("hierarchy").get("depth").asInt()).isEqualTo(3);
    }

    @Test
    public void recordJson_omitsNullFields() throws IOException {
        JsonNode node = AnalysisIO.getMapper().readTree(AnalysisIO.toJson(button()));

        assertThat(node.has("placeholder")).isFalse();
        assertThat(node.has("accessibilityRole")).isFalse();
        assertThat(node.get("hierarchy").has("parent")).isFalse();
        assertThat(node.get("hierarchy").has("root")).isFalse();
    }

    // ── Analysis JSON ─────────────────────────────────────────────────────

    @Test
    public void analysisJson_metadata() throws IOException {
        JsonNode node = AnalysisIO.getMapper().readTree(AnalysisIO.toJson(analysis()));

        assertThat(node.get("sourceUrl").asText()).isEqualTo("https://example.test/");
        assertThat(node.get("analyzedAt").asText()).isEqualTo("2024-05-01T10:15:30Z");
        assertThat(node.get("elementCount").asInt()).isEqualTo(1);
        assertThat(node.get("elements")).hasSize(1);
        assertThat(node.get("relationships").has("id_go")).isTrue();
        assertThat(node.get("errors")).isEmpty();
    }

    @Test
    public void analysisJson_formsAndHints() throws IOException {
        ElementRecord r = button();
        FormStructure form = new FormStructure("form_0", null, "/go", "POST", "application/x-www-form-urlencoded",
                List.of(new FormField("field_0_0", "id_go", "button", ElementType.BUTTON, FormFieldType.BUTTON, null, false)),
                List.of("field_0_0"), List.of(), SemanticType.UNKNOWN);
        ElementAnalysis analysis = new ElementAnalysis("https://example.test/", "Example", Instant.EPOCH, 1,
                List.of(r), Map.of(), List.of(), List.of(form), PerformanceHints.of(4, List.of(r)));

        JsonNode node = AnalysisIO.getMapper().readTree(AnalysisIO.toJson(analysis));

        JsonNode f = node.get("forms").get(0);
        assertThat(f.get("formId").asText()).isEqualTo("form_0");
        assertThat(f.has("elementId")).isFalse();
        assertThat(f.get("formType").asText()).isEqualTo("UNKNOWN");
        assertThat(f.get("fields").get(0).get("elementId").asText()).isEqualTo("id_go");
        assertThat(f.get("fields").get(0).has("name")).isFalse();
        assertThat(f.get("submitButtons").get(0).asText()).isEqualTo("field_0_0");
        assertThat(node.get("performanceHints").get("complexity").asText()).isEqualTo("LOW");
        assertThat(node.get("performanceHints").get("interactiveElements").asInt()).isEqualTo(1);
    }

    @Test
    public void analysisJson_omitsMissingHints() throws IOException {
        JsonNode node = AnalysisIO.getMapper().readTree(AnalysisIO.toJson(analysis()));

        assertThat(node.has("performanceHints")).isFalse();
        assertThat(node.get("forms")).isEmpty();
    }

    @Test
    public void write_createsParentDirectories() throws IOException {
        Path dir = Files.createTempDirectory("dom-locator-test-");
        Path out = dir.resolve("nested/analysis.json");
        try {
            AnalysisIO.write(analysis(), out);

            assertThat(out).exists();
            JsonNode node = AnalysisIO.getMapper().readTree(out.toFile());
            assertThat(node.get("title").asText()).isEqualTo("Example");
        } finally {
            Files.deleteIfExists(out);
            Files.deleteIfExists(out.getParent());
            Files.deleteIfExists(dir);
        }
    }
}
