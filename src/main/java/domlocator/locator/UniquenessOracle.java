package domlocator.locator;

import org.jsoup.nodes.Element;

import java.util.List;

/**
 * Tree-query capability used to test candidate locators.
 *
 * <p>Implementations evaluate against one immutable document snapshot.
 * Both query methods throw {@link OracleQueryException} for malformed
 * expressions or backend faults; callers treat that as "candidate rejected".
 */
public interface UniquenessOracle {

    /** Elements matching a CSS selector, in document order. */
    List<Element> select(String css);

    /** Elements matching an XPath expression, in document order. */
    List<Element> selectXpath(String xpath);

    /** True if {@code css} selects exactly {@code target} and nothing else. */
    default boolean selectsOnly(String css, Element target) {
        List<Element> hits = select(css);
        return hits.size() == 1 && hits.get(0) == target;
    }

    /** True if {@code xpath} selects exactly {@code target} and nothing else. */
    default boolean xpathSelectsOnly(String xpath, Element target) {
        List<Element> hits = selectXpath(xpath);
        return hits.size() == 1 && hits.get(0) == target;
    }
}
