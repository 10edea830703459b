package domlocator.locator;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

/** Unit tests for {@link XPathLiterals}. */
public class XPathLiteralsTest {

    @Test(description = "Values without apostrophes use single quotes, otherwise double quotes")
    public void testSimpleLiterals() {
        assertThat(XPathLiterals.literal("Send")).isEqualTo("'Send'");
        assertThat(XPathLiterals.literal("O'Brien")).isEqualTo("\"O'Brien\"");
        assertThat(XPathLiterals.literal("say \"hi\"")).isEqualTo("'say \"hi\"'");
        assertThat(XPathLiterals.literal("")).isEqualTo("''");
    }

    @Test(description = "Values with both quote kinds are rebuilt with concat()")
    public void testConcatLiteral() {
        assertThat(XPathLiterals.literal("O'Brien \"Team\""))
                .isEqualTo("concat('O', \"'\", 'Brien \"Team\"')");
        assertThat(XPathLiterals.literal("'\"'"))
                .as("apostrophes at both ends")
                .isEqualTo("concat(\"'\", '\"', \"'\")");
    }

    @Test(description = "concat() literal selects the element carrying the value")
    public void testConcatLiteralResolves() {
        Document doc = Jsoup.parse("<input title=\"O'Brien &quot;Team&quot;\"><input title=\"Other\">");
        Element target = doc.selectFirst("input");
        JsoupOracle oracle = new JsoupOracle(doc);

        String xpath = "//input[@title=" + XPathLiterals.literal("O'Brien \"Team\"") + "]";

        assertThat(oracle.xpathSelectsOnly(xpath, target)).isTrue();
    }

    @Test(description = "Deny-list covers //*, //div and //span only")
    public void testTooGeneric() {
        assertThat(XPathLiterals.isTooGeneric("//*")).isTrue();
        assertThat(XPathLiterals.isTooGeneric("//div")).isTrue();
        assertThat(XPathLiterals.isTooGeneric("//span")).isTrue();
        assertThat(XPathLiterals.isTooGeneric("//button")).isFalse();
        assertThat(XPathLiterals.isTooGeneric("//div[1]")).isFalse();
    }
}
