package domlocator.locator;

import domlocator.model.ElementLocator;
import domlocator.model.LocatorStrategy;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Generates CSS selectors for an element, verifying each candidate against a
 * {@link UniquenessOracle}.
 *
 * <p>Strategies, in priority order:
 * <ol>
 *   <li>{@code #id}, only for ids that need no escaping</li>
 *   <li>{@code [attr="value"]} for {@code name} and test-hook attributes, then other {@code data-*}</li>
 *   <li>single meaningful classes, then class combinations of increasing size</li>
 *   <li>child-combinator ancestor chain, bounded by {@code maxDepth}</li>
 *   <li>{@code tag:contains(text)} for links, buttons and headings</li>
 *   <li>{@code :nth-of-type()} chain, bounded by {@code maxDepth}</li>
 * </ol>
 *
 * <p>A candidate is accepted only if the oracle returns exactly the origin
 * element. When nothing verifies, the longest ancestor chain and the bare
 * tag name are returned as non-unique fallbacks.
 *
 * <p>One instance serves one document snapshot: it caches match counts.
 */
public class CssSelectorGenerator {

    private static final Logger log = LoggerFactory.getLogger(CssSelectorGenerator.class);

    static final List<String> PRIORITY_ATTRIBUTES =
            List.of("name", "data-testid", "data-cy", "data-test", "data-automation");

    private static final Set<String> TEXT_TAGS =
            Set.of("a", "button", "h1", "h2", "h3", "h4", "h5", "h6");

    private final UniquenessOracle oracle;
    private final LocatorSettings settings;
    private final Map<String, Integer> matchCounts = new HashMap<>();

    public CssSelectorGenerator(UniquenessOracle oracle, LocatorSettings settings) {
        this.oracle   = Objects.requireNonNull(oracle, "oracle");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Returns the first verified selector in strategy order, or the best
     * non-unique fallback. Never returns {@code null}.
     */
    public ElementLocator generate(Element el) {
        return run(el, true).get(0);
    }

    /**
     * Returns the first verified selector of every strategy, in strategy
     * order. When no strategy verifies, returns the non-unique fallbacks
     * instead. Never empty.
     */
    public List<ElementLocator> generateAll(Element el) {
        return run(el, false);
    }

    // ── Strategy driver ───────────────────────────────────────────────────

    private List<ElementLocator> run(Element el, boolean stopAtFirst) {
        List<ElementLocator> found = new ArrayList<>();

        if (addIfPresent(found, byId(el)) && stopAtFirst) return found;
        if (addIfPresent(found, byAttribute(el)) && stopAtFirst) return found;
        if (addIfPresent(found, byClass(el)) && stopAtFirst) return found;

        Chain chain = hierarchicalChain(el);
        if (chain != null && chain.unique()) {
            found.add(ElementLocator.unique(LocatorStrategy.CSS_HIERARCHICAL, chain.expression()));
            if (stopAtFirst) return found;
        }

        if (addIfPresent(found, byText(el)) && stopAtFirst) return found;
        if (addIfPresent(found, byPosition(el)) && stopAtFirst) return found;

        if (found.isEmpty()) {
            log.debug("No unique CSS selector for <{}>; using fallbacks", el.normalName());
            if (chain != null && !chain.expression().equals(el.normalName())) {
                found.add(ElementLocator.bestEffort(LocatorStrategy.CSS_HIERARCHICAL, chain.expression()));
            }
            found.add(ElementLocator.bestEffort(LocatorStrategy.CSS_FALLBACK, el.normalName()));
        }
        return found;
    }

    private static boolean addIfPresent(List<ElementLocator> found, Optional<ElementLocator> candidate) {
        candidate.ifPresent(found::add);
        return candidate.isPresent();
    }

    /** jsoup cannot match a quoted value holding both quote characters, so those are not tried. */
    private static boolean quotable(String name, String value) {
        if (CssEscaper.hasBothQuotes(value)) {
            log.debug("Skipping [{}]: value holds both quote characters", name);
            return false;
        }
        return true;
    }

    // ── Strategies ────────────────────────────────────────────────────────

    Optional<ElementLocator> byId(Element el) {
        String id = el.id();
        if (!CssEscaper.isSimpleIdentifier(id)) return Optional.empty();
        return verified(LocatorStrategy.CSS_ID, "#" + id, el);
    }

    Optional<ElementLocator> byAttribute(Element el) {
        for (String name : PRIORITY_ATTRIBUTES) {
            String value = el.attr(name);
            if (value.isEmpty() || !quotable(name, value)) continue;
            Optional<ElementLocator> hit = verified(LocatorStrategy.CSS_ATTR, attributeSelector(name, value), el);
            if (hit.isPresent()) return hit;
        }
        for (Attribute attr : el.attributes()) {
            String name = attr.getKey();
            if (!name.startsWith("data-") || PRIORITY_ATTRIBUTES.contains(name) || attr.getValue().isEmpty()) {
                continue;
            }
            if (!quotable(name, attr.getValue())) continue;
            Optional<ElementLocator> hit = verified(LocatorStrategy.CSS_ATTR, attributeSelector(name, attr.getValue()), el);
            if (hit.isPresent()) return hit;
        }
        return Optional.empty();
    }

    Optional<ElementLocator> byClass(Element el) {
        List<String> classes = ClassNameFilter.meaningfulClasses(el);
        for (String c : classes) {
            Optional<ElementLocator> hit = verified(LocatorStrategy.CSS_CLASS, "." + CssEscaper.identifier(c), el);
            if (hit.isPresent()) return hit;
        }

        List<String> pool = classes.subList(0, Math.min(classes.size(), settings.classMaxCount()));
        int maxSize = Math.min(pool.size(), settings.classCombinationMaxSize());
        for (int size = 2; size <= maxSize; size++) {
            for (List<String> combo : combinations(pool, size)) {
                StringBuilder sel = new StringBuilder();
                for (String c : combo) sel.append('.').append(CssEscaper.identifier(c));
                Optional<ElementLocator> hit = verified(LocatorStrategy.CSS_CLASS, sel.toString(), el);
                if (hit.isPresent()) return hit;
            }
        }
        return Optional.empty();
    }

    /**
     * Builds a {@code a > b > c} chain bottom-up, re-testing after each
     * prepended level. Returns the first unique chain, or the longest chain
     * built within {@code maxDepth} marked non-unique.
     */
    Chain hierarchicalChain(Element el) {
        List<String> parts = new ArrayList<>();
        Element current = el;
        String chain = null;
        int depth = 0;
        while (DomPaths.isElementLevel(current) && depth < settings.maxDepth()) {
            parts.add(0, levelPart(current));
            chain = String.join(" > ", parts);
            if (isUnique(chain, el)) return new Chain(chain, true);
            current = current.parent();
            depth++;
        }
        return chain == null ? null : new Chain(chain, false);
    }

    Optional<ElementLocator> byText(Element el) {
        String tag = el.normalName();
        if (!TEXT_TAGS.contains(tag)) return Optional.empty();
        String text = el.text();
        if (text.isEmpty() || text.length() > settings.textSelectorMaxLength()) return Optional.empty();
        return verified(LocatorStrategy.CSS_TEXT, tag + ":contains(" + CssEscaper.containsArgument(text) + ")", el);
    }

    Optional<ElementLocator> byPosition(Element el) {
        List<String> parts = new ArrayList<>();
        Element current = el;
        int depth = 0;
        while (DomPaths.isElementLevel(current) && depth < settings.maxDepth()) {
            String part = levelPart(current);
            if (current == el || (current.id().isEmpty() && DomPaths.sameTagCount(current) > 1)) {
                part += ":nth-of-type(" + DomPaths.sameTagIndex(current) + ")";
            }
            parts.add(0, part);
            String chain = String.join(" > ", parts);
            if (isUnique(chain, el)) return Optional.of(ElementLocator.unique(LocatorStrategy.CSS_POSITION, chain));
            current = current.parent();
            depth++;
        }
        return Optional.empty();
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /**
     * One level of an ancestor chain: {@code tag#id} for a simple id, else
     * {@code tag.class} when the first meaningful class narrows the tag,
     * else the bare tag.
     */
    private String levelPart(Element el) {
        String tag = el.normalName();
        if (CssEscaper.isSimpleIdentifier(el.id())) return tag + "#" + el.id();

        List<String> classes = ClassNameFilter.meaningfulClasses(el);
        if (!classes.isEmpty()) {
            String withClass = tag + "." + CssEscaper.identifier(classes.get(0));
            if (matchCount(withClass) < matchCount(tag)) return withClass;
        }
        return tag;
    }

    private static String attributeSelector(String name, String value) {
        return "[" + name + "=" + CssEscaper.quoted(value) + "]";
    }

    private Optional<ElementLocator> verified(LocatorStrategy strategy, String css, Element el) {
        return isUnique(css, el) ? Optional.of(ElementLocator.unique(strategy, css)) : Optional.empty();
    }

    private boolean isUnique(String css, Element el) {
        try {
            boolean unique = oracle.selectsOnly(css, el);
            log.debug("[{}] unique={}", css, unique);
            return unique;
        } catch (OracleQueryException e) {
            log.debug("Skipping CSS candidate: {}", e.getMessage());
            return false;
        }
    }

    private int matchCount(String css) {
        return matchCounts.computeIfAbsent(css, q -> {
            try {
                return oracle.select(q).size();
            } catch (OracleQueryException e) {
                log.debug("Cannot count matches: {}", e.getMessage());
                return Integer.MAX_VALUE;
            }
        });
    }

    /** All {@code size}-element combinations of {@code items}, preserving their order. */
    static List<List<String>> combinations(List<String> items, int size) {
        List<List<String>> out = new ArrayList<>();
        collect(items, size, 0, new ArrayList<>(), out);
        return out;
    }

    private static void collect(List<String> items, int size, int start, List<String> current, List<List<String>> out) {
        if (current.size() == size) {
            out.add(List.copyOf(current));
            return;
        }
        for (int i = start; i <= items.size() - (size - current.size()); i++) {
            current.add(items.get(i));
            collect(items, size, i + 1, current, out);
            current.remove(current.size() - 1);
        }
    }

    /** An ancestor chain and whether the oracle confirmed it. */
    record Chain(String expression, boolean unique) {}
}
