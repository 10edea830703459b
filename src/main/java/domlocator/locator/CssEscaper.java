package domlocator.locator;

import java.util.regex.Pattern;

/**
 * Escaping of untrusted strings for CSS selector syntax.
 */
public final class CssEscaper {

    private static final Pattern SIMPLE_ID = Pattern.compile("^[A-Za-z][\\w-]*$");

    private CssEscaper() {}

    /**
     * True if {@code id} can appear after {@code #} without any escaping.
     * Ids outside this shape are not used for id-based locators at all.
     */
    public static boolean isSimpleIdentifier(String id) {
        return id != null && SIMPLE_ID.matcher(id).matches();
    }

    /**
     * Escapes an identifier (class name, id) following the CSSOM
     * {@code CSS.escape()} algorithm.
     */
    public static String identifier(String ident) {
        StringBuilder out = new StringBuilder(ident.length() + 8);
        int len = ident.length();
        for (int i = 0; i < len; i++) {
            char c = ident.charAt(i);
            if (c == 0) {
                out.append('\uFFFD');
            } else if ((c >= 0x1 && c <= 0x1F) || c == 0x7F
                    || (i == 0 && isDigit(c))
                    || (i == 1 && isDigit(c) && ident.charAt(0) == '-')) {
                hex(out, c);
            } else if (i == 0 && len == 1 && c == '-') {
                out.append('\\').append(c);
            } else if (c >= 0x80 || c == '-' || c == '_' || isDigit(c)
                    || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')) {
                out.append(c);
            } else {
                out.append('\\').append(c);
            }
        }
        return out.toString();
    }

    /** True when {@code value} contains both {@code '} and {@code "}. */
    public static boolean hasBothQuotes(String value) {
        return value.indexOf('"') >= 0 && value.indexOf('\'') >= 0;
    }

    /**
     * Renders {@code value} as a quoted CSS string. The delimiter is the quote
     * character absent from the value; when both occur, double quotes are used
     * and embedded ones are backslash-escaped.
     */
    public static String quoted(String value) {
        char quote = value.indexOf('"') < 0 || value.indexOf('\'') >= 0 ? '"' : '\'';
        StringBuilder out = new StringBuilder(value.length() + 2).append(quote);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == quote || c == '\\') {
                out.append('\\').append(c);
            } else if (c == '\n' || c == '\r' || c == '\f') {
                hex(out, c);
            } else {
                out.append(c);
            }
        }
        return out.append(quote).toString();
    }

    /**
     * Escapes the argument of a {@code :contains()} pseudo-class: parentheses,
     * quotes and backslashes are backslash-escaped so the argument needs no
     * surrounding quotes.
     */
    public static String containsArgument(String text) {
        StringBuilder out = new StringBuilder(text.length() + 4);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == ')' || c == '\'' || c == '"' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static void hex(StringBuilder out, char c) {
        out.append('\\').append(Integer.toHexString(c)).append(' ');
    }
}
