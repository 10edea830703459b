package domlocator.locator;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides which class names are stable enough to build locators from.
 *
 * <p>A class is <em>meaningful</em> unless it is:
 * <ul>
 *   <li>shorter than two characters,</li>
 *   <li>hash-like (8+ lowercase hex digits, typical of CSS-in-JS output),</li>
 *   <li>a visibility/display utility ({@code hidden, visible, flex, block, inline}),</li>
 *   <li>a spacing utility ({@code m-2, mt4, pb-10, ...}),</li>
 *   <li>a sizing utility ({@code w-50, h4}),</li>
 *   <li>an alignment or colour utility ({@code text-center, text-muted, bg-light}).</li>
 * </ul>
 */
public final class ClassNameFilter {

    private static final Pattern HASH_LIKE = Pattern.compile("^[a-f0-9]{8,}$");

    private static final List<Pattern> UTILITY = List.of(
            Pattern.compile("^(hidden|visible|flex|block|inline)$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(mt?|mb?|ml?|mr?|pt?|pb?|pl?|pr?)-?\\d+$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(w|h)-?\\d+$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^text-(left|right|center)$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^bg-\\w+$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^text-\\w+$", Pattern.CASE_INSENSITIVE));

    private ClassNameFilter() {}

    public static boolean isMeaningful(String className) {
        if (className == null || className.length() < 2) return false;
        if (HASH_LIKE.matcher(className.toLowerCase(Locale.ROOT)).matches()) return false;
        for (Pattern p : UTILITY) {
            if (p.matcher(className).matches()) return false;
        }
        return true;
    }

    /** Meaningful classes of {@code el}, in attribute order, without duplicates. */
    public static List<String> meaningfulClasses(Element el) {
        List<String> out = new ArrayList<>();
        for (String c : el.classNames()) {
            if (isMeaningful(c) && !out.contains(c)) out.add(c);
        }
        return out;
    }
}
