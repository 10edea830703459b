package domlocator.engine;

import domlocator.locator.DomPaths;
import org.jsoup.nodes.Element;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives readable element ids that are unique within one analysis pass.
 *
 * <p>Ids come from the {@code id} attribute ({@code id_<id>}), else the
 * {@code name} attribute ({@code name_<name>}), else are composed as
 * {@code <tag>_<index>[_<firstClass>][_<type>][_<first two words>]} where
 * {@code index} is the 0-based position among same-tag siblings. Ids are
 * capped at the configured length; a clash gets {@code _2}, {@code _3}, ...
 *
 * <p>Holds the ids issued so far, so use one instance per pass.
 */
public class ElementIdGenerator {

    private static final Pattern NON_WORD = Pattern.compile("[^a-zA-Z0-9_]");

    /** Smallest cap that still leaves room for a clash suffix. */
    static final int MIN_MAX_LENGTH = 8;

    private final int maxLength;
    private final Set<String> issued = new HashSet<>();

    public ElementIdGenerator(int maxLength) {
        if (maxLength < MIN_MAX_LENGTH) throw new IllegalArgumentException("maxLength too small: " + maxLength);
        this.maxLength = maxLength;
    }

    public String nextId(Element el) {
        String base = truncate(baseId(el));
        String id = base;
        int n = 2;
        while (!issued.add(id)) {
            String suffix = "_" + n++;
            id = truncate(base, maxLength - suffix.length()) + suffix;
        }
        return id;
    }

    String baseId(Element el) {
        if (!el.id().isEmpty()) return "id_" + el.id();
        String name = el.attr("name");
        if (!name.isEmpty()) return "name_" + name;

        StringBuilder id = new StringBuilder(el.normalName()).append('_').append(DomPaths.sameTagIndex(el) - 1);
        if (!el.classNames().isEmpty()) id.append('_').append(el.classNames().iterator().next());
        if (!el.attr("type").isEmpty()) id.append('_').append(el.attr("type"));

        String text = el.text();
        if (text.length() > 3) {
            String[] words = text.split("\\s+");
            String joined = words.length > 1 ? words[0] + "_" + words[1] : words[0];
            String cleaned = NON_WORD.matcher(joined.toLowerCase(Locale.ROOT)).replaceAll("");
            if (!cleaned.isEmpty()) id.append('_').append(cleaned);
        }
        return id.toString();
    }

    private String truncate(String id) {
        return truncate(id, maxLength);
    }

    private static String truncate(String id, int length) {
        return id.length() <= length ? id : id.substring(0, length);
    }
}
