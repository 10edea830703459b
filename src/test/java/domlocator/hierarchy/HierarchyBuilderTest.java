package domlocator.hierarchy;

import domlocator.model.ElementHierarchy;
import domlocator.model.ElementLocator;
import domlocator.model.ElementRecord;
import domlocator.model.ElementType;
import domlocator.model.LocatorSet;
import domlocator.model.LocatorStrategy;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Unit tests for {@link HierarchyBuilder}. */
public class HierarchyBuilderTest {

    private static final String PAGE =
            "<html><body>"
            + "<form id=\"login\">"
            + "<div class=\"row\"><input name=\"user\"><input name=\"pass\"></div>"
            + "<button id=\"go\">Go</button>"
            + "</form>"
            + "<a href=\"/help\">Help</a>"
            + "</body></html>";

    private Document doc;
    private HierarchyBuilder builder;

    @BeforeMethod
    public void setUp() {
        doc = Jsoup.parse(PAGE);
        builder = new HierarchyBuilder();
    }

    private static ElementRecord record(String id, Element el) {
        ElementRecord.Builder b = ElementRecord.builder()
                .elementId(id)
                .elementType(ElementType.forTag(el.normalName()))
                .tagName(el.normalName())
                .attributes(Map.of());
        if (!el.id().isEmpty()) b.attributes(Map.of("id", el.id()));
        else if (el.hasAttr("name")) b.attributes(Map.of("name", el.attr("name")));
        return b.build();
    }

    private Map<String, ElementHierarchy> buildFromPage() {
        List<Element> elements = List.of(
                doc.getElementById("login"),
                doc.selectFirst("[name=user]"),
                doc.selectFirst("[name=pass]"),
                doc.getElementById("go"),
                doc.selectFirst("a"));
        List<ElementRecord> records = List.of(
                record("form", elements.get(0)),
                record("user", elements.get(1)),
                record("pass", elements.get(2)),
                record("go", elements.get(3)),
                record("help", elements.get(4)));
        return builder.build(elements, records);
    }

    // ── Element overload ──────────────────────────────────────────────────

    @Test(description = "Unclassified containers are skipped when linking parents")
    public void testParentSkipsUnclassifiedNodes() {
        Map<String, ElementHierarchy> h = buildFromPage();

        assertThat(h.get("user").getParent()).isEqualTo("form");
        assertThat(h.get("go").getParent()).isEqualTo("form");
        assertThat(h.get("form").getChildren()).containsExactly("user", "pass", "go");
        assertThat(h.get("user").getChildren()).isEmpty();
    }

    @Test(description = "Siblings share a logical parent; top-level elements are siblings of each other")
    public void testSiblings() {
        Map<String, ElementHierarchy> h = buildFromPage();

        assertThat(h.get("user").getSiblings()).containsExactly("pass", "go");
        assertThat(h.get("go").getSiblings()).containsExactly("user", "pass");
        assertThat(h.get("form").isRoot()).isTrue();
        assertThat(h.get("form").getSiblings()).containsExactly("help");
        assertThat(h.get("help").getSiblings()).containsExactly("form");
    }

    @Test(description = "Depth counts DOM ancestors, not logical ones")
    public void testDepth() {
        Map<String, ElementHierarchy> h = buildFromPage();

        assertThat(h.get("form").getDepth()).isEqualTo(3);
        assertThat(h.get("user").getDepth()).isEqualTo(5);
        assertThat(h.get("go").getDepth()).isEqualTo(4);
        assertThat(h.get("help").getDepth()).isEqualTo(3);
    }

    @Test(description = "Result keeps document order")
    public void testOrder() {
        assertThat(buildFromPage().keySet()).containsExactly("form", "user", "pass", "go", "help");
    }

    @Test(description = "Mismatched input lists are rejected")
    public void testSizeMismatch() {
        Element form = doc.getElementById("login");
        assertThatThrownBy(() -> builder.build(List.of(form), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ── Document overload ─────────────────────────────────────────────────

    @Test(description = "Detached records are relocated by id, name and primary CSS")
    public void testRelocateRecords() {
        ElementRecord byCss = ElementRecord.builder()
                .elementId("help")
                .elementType(ElementType.LINK)
                .tagName("a")
                .locators(LocatorSet.builder().add(ElementLocator.unique(LocatorStrategy.CSS_ATTR, "a[href=\"/help\"]")).build())
                .build();

        Map<String, ElementHierarchy> h = builder.build(doc, List.of(
                record("form", doc.getElementById("login")),
                record("user", doc.selectFirst("[name=user]")),
                byCss));

        assertThat(h.keySet()).containsExactly("form", "user", "help");
        assertThat(h.get("user").getParent()).isEqualTo("form");
        assertThat(h.get("help").getSiblings()).containsExactly("form");
    }

    @Test(description = "Records with no node, or a node already claimed, are left out")
    public void testUnmatchedRecordsOmitted() {
        ElementRecord missing = ElementRecord.builder()
                .elementId("ghost").elementType(ElementType.BUTTON).tagName("button")
                .attributes(Map.of("id", "nope"))
                .build();
        ElementRecord duplicate = ElementRecord.builder()
                .elementId("go-again").elementType(ElementType.BUTTON).tagName("button")
                .attributes(Map.of("id", "go"))
                .build();

        Map<String, ElementHierarchy> h = builder.build(doc, List.of(
                record("go", doc.getElementById("go")), missing, duplicate));

        assertThat(h).containsOnlyKeys("go");
        assertThat(h.get("go").isRoot()).isTrue();
    }

    @Test(description = "Thousands of top-level elements each see every other one as a sibling")
    public void testLargeTopLevelGroup() {
        int count = 5000;
        StringBuilder html = new StringBuilder("<body>");
        for (int i = 0; i < count; i++) html.append("<a href=\"/p").append(i).append("\">p</a>");
        Document big = Jsoup.parse(html.append("</body>").toString());

        List<Element> elements = big.select("a");
        List<ElementRecord> records = new ArrayList<>();
        for (int i = 0; i < count; i++) records.add(record("link_" + i, elements.get(i)));

        Map<String, ElementHierarchy> h = builder.build(elements, records);

        List<String> first = h.get("link_0").getSiblings();
        assertThat(first).hasSize(count - 1);
        assertThat(first.get(0)).isEqualTo("link_1");
        assertThat(first.get(count - 2)).isEqualTo("link_" + (count - 1));

        List<String> middle = h.get("link_2500").getSiblings();
        assertThat(middle).hasSize(count - 1).doesNotContain("link_2500");
        assertThat(middle.get(2499)).isEqualTo("link_2499");
        assertThat(middle.get(2500)).isEqualTo("link_2501");
        assertThat(h.get("link_4999").getSiblings()).endsWith("link_4998");

        assertThatThrownBy(() -> middle.add("x")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> middle.get(count - 1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test(description = "A sibling view equals the plain list it stands for")
    public void testSiblingViewEquality() {
        ElementHierarchy shared = ElementHierarchy.inGroup("form", List.of(), List.of("a", "b", "c"), 1, 2);

        assertThat(shared).isEqualTo(new ElementHierarchy("form", List.of(), List.of("a", "c"), 2));
        assertThat(shared.hashCode()).isEqualTo(new ElementHierarchy("form", List.of(), List.of("a", "c"), 2).hashCode());
    }
}
