package domlocator.engine;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Unit tests for {@link ElementIdGenerator}. */
public class ElementIdGeneratorTest {

    private static Element first(String html) {
        return Jsoup.parse(html).body().child(0);
    }

    @Test(description = "id attribute wins, then name")
    public void testIdAndName() {
        ElementIdGenerator ids = new ElementIdGenerator(100);

        assertThat(ids.nextId(first("<input id=\"email\" name=\"mail\">"))).isEqualTo("id_email");
        assertThat(ids.nextId(first("<input name=\"q\">"))).isEqualTo("name_q");
    }

    @Test(description = "Composed ids use tag, index, first class, type and the first two words")
    public void testComposedId() {
        Document doc = Jsoup.parse(
                "<button type=\"submit\">Go</button>"
                + "<div class=\"card big\" onclick=\"x()\">Buy now please</div>"
                + "<div onclick=\"y()\">Second</div>"
                + "<a href=\"#\">Hello, World!</a>");
        ElementIdGenerator ids = new ElementIdGenerator(100);

        assertThat(ids.nextId(doc.selectFirst("button"))).as("short text is dropped").isEqualTo("button_0_submit");
        assertThat(ids.nextId(doc.select("div").get(0))).isEqualTo("div_0_card_buy_now");
        assertThat(ids.nextId(doc.select("div").get(1))).isEqualTo("div_1_second");
        assertThat(ids.nextId(doc.selectFirst("a"))).as("punctuation stripped").isEqualTo("a_0_hello_world");
    }

    @Test(description = "Repeated base ids get numeric suffixes")
    public void testDeduplication() {
        Document doc = Jsoup.parse("<input id=\"x\"><input id=\"x\"><input id=\"x\">");
        ElementIdGenerator ids = new ElementIdGenerator(100);

        assertThat(ids.nextId(doc.select("input").get(0))).isEqualTo("id_x");
        assertThat(ids.nextId(doc.select("input").get(1))).isEqualTo("id_x_2");
        assertThat(ids.nextId(doc.select("input").get(2))).isEqualTo("id_x_3");
    }

    @Test(description = "Ids are truncated, and suffixes stay within the cap")
    public void testTruncation() {
        Document doc = Jsoup.parse("<input id=\"abcdefghijkl\"><input id=\"abcdefghijkl\">");
        ElementIdGenerator ids = new ElementIdGenerator(10);

        assertThat(ids.nextId(doc.select("input").get(0))).isEqualTo("id_abcdefg");
        assertThat(ids.nextId(doc.select("input").get(1))).isEqualTo("id_abcde_2");
    }

    @Test(description = "Separate generators do not share issued ids")
    public void testGeneratorsIndependent() {
        Element el = first("<input id=\"x\">");

        assertThat(new ElementIdGenerator(100).nextId(el)).isEqualTo("id_x");
        assertThat(new ElementIdGenerator(100).nextId(el)).isEqualTo("id_x");
    }

    @Test(description = "A cap too small for a suffix is rejected")
    public void testMinimumLength() {
        assertThatThrownBy(() -> new ElementIdGenerator(7)).isInstanceOf(IllegalArgumentException.class);
    }
}
