package domlocator.locator;

import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

/** Unit tests for {@link CssEscaper}. */
public class CssEscaperTest {

    @Test(description = "Only letter-led word/hyphen ids are simple identifiers")
    public void testSimpleIdentifier() {
        assertThat(CssEscaper.isSimpleIdentifier("submit-btn")).isTrue();
        assertThat(CssEscaper.isSimpleIdentifier("field_2")).isTrue();
        assertThat(CssEscaper.isSimpleIdentifier("1st")).as("leading digit").isFalse();
        assertThat(CssEscaper.isSimpleIdentifier("a b")).as("space").isFalse();
        assertThat(CssEscaper.isSimpleIdentifier("user:name")).as("colon").isFalse();
        assertThat(CssEscaper.isSimpleIdentifier("")).isFalse();
        assertThat(CssEscaper.isSimpleIdentifier(null)).isFalse();
    }

    @Test(description = "Identifiers are escaped like CSS.escape()")
    public void testIdentifierEscaping() {
        assertThat(CssEscaper.identifier("card")).isEqualTo("card");
        assertThat(CssEscaper.identifier("1col")).as("leading digit hex-escaped").isEqualTo("\\31 col");
        assertThat(CssEscaper.identifier("-2x")).as("digit after leading hyphen").isEqualTo("-\\32 x");
        assertThat(CssEscaper.identifier("-")).isEqualTo("\\-");
        assertThat(CssEscaper.identifier("sm:hidden")).isEqualTo("sm\\:hidden");
        assertThat(CssEscaper.identifier("w-1/2")).isEqualTo("w-1\\/2");
    }

    @Test(description = "Quoted values pick the delimiter that is absent from the value")
    public void testQuotedPicksDelimiter() {
        assertThat(CssEscaper.quoted("plain")).isEqualTo("\"plain\"");
        assertThat(CssEscaper.quoted("O'Brien")).isEqualTo("\"O'Brien\"");
        assertThat(CssEscaper.quoted("say \"hi\"")).isEqualTo("'say \"hi\"'");
    }

    @Test(description = "A value with both quote kinds is double-quoted with escapes")
    public void testQuotedBothQuotes() {
        assertThat(CssEscaper.quoted("O'Brien \"Team\""))
                .isEqualTo("\"O'Brien \\\"Team\\\"\"");
        assertThat(CssEscaper.quoted("a\\b")).isEqualTo("\"a\\\\b\"");
        assertThat(CssEscaper.quoted("line\nbreak")).isEqualTo("\"line\\a break\"");
    }

    @Test(description = ":contains() arguments escape parentheses, quotes and backslashes")
    public void testContainsArgument() {
        assertThat(CssEscaper.containsArgument("Save (draft)")).isEqualTo("Save \\(draft\\)");
        assertThat(CssEscaper.containsArgument("Don't")).isEqualTo("Don\\'t");
        assertThat(CssEscaper.containsArgument("Sign in")).isEqualTo("Sign in");
    }
}
