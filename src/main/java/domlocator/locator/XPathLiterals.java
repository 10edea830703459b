package domlocator.locator;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * String literals and generic-expression checks for XPath 1.0.
 */
public final class XPathLiterals {

    /** Expressions too broad to be offered as a locator. */
    private static final List<Pattern> TOO_GENERIC = List.of(
            Pattern.compile("^//\\*$"),
            Pattern.compile("^//div$"),
            Pattern.compile("^//span$"));

    private XPathLiterals() {}

    /**
     * Renders {@code value} as an XPath 1.0 string expression.
     *
     * <p>XPath 1.0 has no escape sequences, so a value containing both quote
     * characters is split on the apostrophe and rebuilt with
     * {@code concat()}, e.g. {@code O'Brien "Team"} becomes
     * {@code concat('O', "'", 'Brien "Team"')}.
     */
    public static String literal(String value) {
        if (value.indexOf('\'') < 0) return "'" + value + "'";
        if (value.indexOf('"') < 0) return "\"" + value + "\"";

        List<String> args = new ArrayList<>();
        String[] parts = value.split("'", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) args.add("\"'\"");
            if (!parts[i].isEmpty()) args.add("'" + parts[i] + "'");
        }
        return "concat(" + String.join(", ", args) + ")";
    }

    /** True for {@code //*}, {@code //div} and {@code //span}. */
    public static boolean isTooGeneric(String xpath) {
        for (Pattern p : TOO_GENERIC) {
            if (p.matcher(xpath).matches()) return true;
        }
        return false;
    }
}
