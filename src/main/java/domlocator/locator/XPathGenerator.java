package domlocator.locator;

import domlocator.model.ElementLocator;
import domlocator.model.LocatorStrategy;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Generates XPath 1.0 expressions for an element.
 *
 * <p>Strategies, in priority order: id, attribute (meaningful class tokens
 * last), text, ancestor path and position. Each strategy yields an ordered list of candidates; the first
 * one the oracle resolves to exactly the origin element wins. Expressions
 * matching the deny-list ({@code //*}, {@code //div}, {@code //span}) are
 * never queried.
 *
 * <p>With {@link LocatorSettings#verifyXpath()} off no queries are made: the
 * first candidate of each strategy is taken as is and flagged non-unique.
 */
public class XPathGenerator {

    private static final Logger log = LoggerFactory.getLogger(XPathGenerator.class);

    private static final Set<String> SKIPPED_ATTRIBUTES = Set.of("class", "style", "id");
    private static final Pattern ATTRIBUTE_NAME = Pattern.compile("^[A-Za-z_][\\w.-]*$");
    private static final int SHORT_ATTRIBUTE_VALUE = 30;

    private final UniquenessOracle oracle;
    private final LocatorSettings settings;

    public XPathGenerator(UniquenessOracle oracle, LocatorSettings settings) {
        this.oracle   = Objects.requireNonNull(oracle, "oracle");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    // ── Public API ────────────────────────────────────────────────────────

    /** Primary expression: the first verified one in strategy order, else the best fallback. */
    public ElementLocator generate(Element el) {
        return run(el, true).get(0);
    }

    /** One locator per strategy that produced a verified candidate, or the fallbacks. Never empty. */
    public List<ElementLocator> generateAll(Element el) {
        return run(el, false);
    }

    // ── Strategy driver ───────────────────────────────────────────────────

    private List<ElementLocator> run(Element el, boolean stopAtFirst) {
        List<ElementLocator> found = new ArrayList<>();

        List<Candidates> strategies = List.of(
                new Candidates(LocatorStrategy.XPATH_ID, idCandidates(el)),
                new Candidates(LocatorStrategy.XPATH_ATTR, attributeCandidates(el)),
                new Candidates(LocatorStrategy.XPATH_TEXT, textCandidates(el)));

        for (Candidates c : strategies) {
            Optional<ElementLocator> hit = firstAccepted(c, el);
            hit.ifPresent(found::add);
            if (hit.isPresent() && stopAtFirst) return found;
        }

        HierarchicalResult chain = hierarchical(el);
        if (chain.accepted() != null) {
            found.add(chain.accepted());
            if (stopAtFirst) return found;
        }

        List<String> positions = positionCandidates(el);
        Optional<ElementLocator> position = firstAccepted(new Candidates(LocatorStrategy.XPATH_POSITION, positions), el);
        position.ifPresent(found::add);
        if (position.isPresent() && stopAtFirst) return found;

        if (found.isEmpty()) {
            log.debug("No unique XPath for <{}>; using fallbacks", el.normalName());
            if (chain.longest() != null) {
                found.add(ElementLocator.bestEffort(LocatorStrategy.XPATH_HIERARCHICAL, chain.longest()));
            }
            String bare = "//" + el.normalName();
            if (!XPathLiterals.isTooGeneric(bare)) {
                found.add(ElementLocator.bestEffort(LocatorStrategy.XPATH_FALLBACK, bare));
            } else if (!positions.isEmpty()) {
                found.add(ElementLocator.bestEffort(LocatorStrategy.XPATH_FALLBACK, positions.get(0)));
            } else if (found.isEmpty()) {
                found.add(ElementLocator.bestEffort(LocatorStrategy.XPATH_FALLBACK, bare));
            }
        }
        return found;
    }

    private Optional<ElementLocator> firstAccepted(Candidates candidates, Element el) {
        for (String xpath : candidates.expressions()) {
            if (XPathLiterals.isTooGeneric(xpath)) continue;
            if (!settings.verifyXpath()) {
                return Optional.of(ElementLocator.bestEffort(candidates.strategy(), xpath));
            }
            if (isUnique(xpath, el)) {
                return Optional.of(ElementLocator.unique(candidates.strategy(), xpath));
            }
        }
        return Optional.empty();
    }

    // ── Candidate lists ───────────────────────────────────────────────────

    List<String> idCandidates(Element el) {
        String id = el.id();
        if (id.isEmpty()) return List.of();
        return List.of("//*[@id=" + XPathLiterals.literal(id) + "]");
    }

    List<String> attributeCandidates(Element el) {
        List<String> out = new ArrayList<>();
        for (String name : CssSelectorGenerator.PRIORITY_ATTRIBUTES) {
            String value = el.attr(name);
            if (!value.isEmpty()) out.add(attributePredicate("*", name, value));
        }
        for (Attribute attr : el.attributes()) {
            String name = attr.getKey();
            if (SKIPPED_ATTRIBUTES.contains(name) || CssSelectorGenerator.PRIORITY_ATTRIBUTES.contains(name)) continue;
            if (!ATTRIBUTE_NAME.matcher(name).matches() || attr.getValue().isEmpty()) continue;
            out.add(attributePredicate("*", name, attr.getValue()));
        }
        for (String c : ClassNameFilter.meaningfulClasses(el)) {
            out.add("//" + classPredicate("*", c));
        }
        return out;
    }

    List<String> textCandidates(Element el) {
        String text = el.text();
        if (text.isEmpty() || text.length() > settings.xpathTextMaxLength()) return List.of();

        String tag = el.normalName();
        String literal = XPathLiterals.literal(text);
        List<String> out = new ArrayList<>(List.of(
                "//" + tag + "[text()=" + literal + "]",
                "//" + tag + "[normalize-space(text())=" + literal + "]",
                "//*[text()=" + literal + "]",
                "//*[normalize-space()=" + literal + "]"));

        String[] words = text.split("\\s+");
        if (text.length() > 10 && words.length > 1) {
            String prefix = XPathLiterals.literal(String.join(" ", List.of(words).subList(0, Math.min(3, words.length))));
            out.add("//" + tag + "[contains(text(), " + prefix + ")]");
            out.add("//*[contains(text(), " + prefix + ")]");
        }
        return out;
    }

    /**
     * Builds {@code //a/b/c} bottom-up from at least two levels, testing
     * after each prepended level, up to {@code maxDepth} levels.
     */
    HierarchicalResult hierarchical(Element el) {
        List<String> parts = new ArrayList<>();
        parts.add(levelPart(el));
        Element current = el.parent();
        String longest = null;
        while (DomPaths.isElementLevel(current) && parts.size() < settings.maxDepth()) {
            parts.add(0, levelPart(current));
            String xpath = "//" + String.join("/", parts);
            longest = xpath;
            if (!settings.verifyXpath()) {
                return new HierarchicalResult(ElementLocator.bestEffort(LocatorStrategy.XPATH_HIERARCHICAL, xpath), xpath);
            }
            if (isUnique(xpath, el)) {
                return new HierarchicalResult(ElementLocator.unique(LocatorStrategy.XPATH_HIERARCHICAL, xpath), xpath);
            }
            current = current.parent();
        }
        return new HierarchicalResult(null, longest);
    }

    /**
     * {@code tag[n]} under a parent path of at most {@code positionParentDepth}
     * levels. The path stops early at an ancestor with an id; a path that
     * reaches {@code <html>} is anchored at the root.
     */
    List<String> positionCandidates(Element el) {
        String own = el.normalName() + "[" + DomPaths.sameTagIndex(el) + "]";
        List<String> parts = new ArrayList<>();
        parts.add(own);

        String prefix = "//";
        Element current = el.parent();
        int levels = 0;
        while (DomPaths.isElementLevel(current) && levels < settings.positionParentDepth()) {
            if (!current.id().isEmpty()) {
                parts.add(0, attributePredicate(current.normalName(), "id", current.id()).substring(2));
                break;
            }
            parts.add(0, current.normalName() + "[" + DomPaths.sameTagIndex(current) + "]");
            if (!DomPaths.isElementLevel(current.parent())) {
                prefix = "/";
                break;
            }
            current = current.parent();
            levels++;
        }

        List<String> out = new ArrayList<>();
        if (parts.size() > 1) out.add(prefix + String.join("/", parts));
        out.add("//" + own);
        return out;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /**
     * One level of an ancestor path: {@code tag[@id=L]}, else the first
     * short attribute, else a class-token test on the first meaningful
     * class, else {@code tag[n]} when the tag repeats among siblings.
     */
    private String levelPart(Element el) {
        String tag = el.normalName();
        if (!el.id().isEmpty()) return tag + "[@id=" + XPathLiterals.literal(el.id()) + "]";

        for (Attribute attr : el.attributes()) {
            String name = attr.getKey();
            String value = attr.getValue();
            if (SKIPPED_ATTRIBUTES.contains(name) || !ATTRIBUTE_NAME.matcher(name).matches()) continue;
            if (value.isEmpty() || value.length() > SHORT_ATTRIBUTE_VALUE) continue;
            return tag + "[@" + name + "=" + XPathLiterals.literal(value) + "]";
        }

        List<String> classes = ClassNameFilter.meaningfulClasses(el);
        if (!classes.isEmpty()) return classPredicate(tag, classes.get(0));

        return DomPaths.sameTagCount(el) > 1 ? tag + "[" + DomPaths.sameTagIndex(el) + "]" : tag;
    }

    /** Whole-token class test, so {@code btn} does not match {@code btn-primary}. */
    private static String classPredicate(String tag, String className) {
        return tag + "[contains(concat(' ', normalize-space(@class), ' '), "
                + XPathLiterals.literal(" " + className + " ") + ")]";
    }

    private static String attributePredicate(String tag, String name, String value) {
        return "//" + tag + "[@" + name + "=" + XPathLiterals.literal(value) + "]";
    }

    private boolean isUnique(String xpath, Element el) {
        try {
            boolean unique = oracle.xpathSelectsOnly(xpath, el);
            log.debug("[{}] unique={}", xpath, unique);
            return unique;
        } catch (OracleQueryException e) {
            log.debug("Skipping XPath candidate: {}", e.getMessage());
            return false;
        }
    }

    private record Candidates(LocatorStrategy strategy, List<String> expressions) {}

    /** Outcome of the ancestor-path strategy: the accepted locator, if any, and the longest path tried. */
    record HierarchicalResult(ElementLocator accepted, String longest) {}
}
