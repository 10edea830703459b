package domlocator.locator;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Positional helpers over a jsoup tree.
 */
public final class DomPaths {

    private DomPaths() {}

    /** 1-based index of {@code el} among its parent's children with the same tag. */
    public static int sameTagIndex(Element el) {
        Element parent = el.parent();
        if (parent == null) return 1;
        int index = 0;
        for (Element sibling : parent.children()) {
            if (sibling.normalName().equals(el.normalName())) index++;
            if (sibling == el) return index;
        }
        return 1;
    }

    /** Number of children of {@code el}'s parent sharing its tag, itself included. */
    public static int sameTagCount(Element el) {
        Element parent = el.parent();
        if (parent == null) return 1;
        int count = 0;
        for (Element sibling : parent.children()) {
            if (sibling.normalName().equals(el.normalName())) count++;
        }
        return count;
    }

    /**
     * Number of ancestors of {@code el} up to and including the document node.
     * The {@code <html>} element of a parsed document has depth 1.
     */
    public static int depth(Element el) {
        int depth = 0;
        Element current = el.parent();
        while (current != null) {
            depth++;
            current = current.parent();
        }
        return depth;
    }

    /** True while walking upward has not yet reached the document node. */
    static boolean isElementLevel(Element el) {
        return el != null && !(el instanceof Document);
    }
}
