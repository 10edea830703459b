package domlocator.hierarchy;

import domlocator.locator.DomPaths;
import domlocator.model.ElementHierarchy;
import domlocator.model.ElementLocator;
import domlocator.model.ElementRecord;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Links classified elements into a logical tree that skips unclassified nodes.
 *
 * <p>An element's parent is its nearest classified ancestor. Its children are
 * the classified elements whose nearest classified ancestor it is. Siblings
 * share a logical parent; elements with no classified ancestor are siblings
 * of one another. Depth counts every DOM ancestor up to the document node.
 */
public class HierarchyBuilder {

    private static final Logger log = LoggerFactory.getLogger(HierarchyBuilder.class);

    /**
     * Builds the relationship map for elements paired with their records.
     *
     * @param elements classified elements, in document order
     * @param records  the record of each element, same order and size
     * @return element id to hierarchy, in document order
     */
    public Map<String, ElementHierarchy> build(List<Element> elements, List<ElementRecord> records) {
        if (elements.size() != records.size()) {
            throw new IllegalArgumentException("elements and records differ in size: "
                    + elements.size() + " vs " + records.size());
        }

        Map<Element, ElementRecord> arena = new IdentityHashMap<>();
        for (int i = 0; i < elements.size(); i++) {
            arena.put(elements.get(i), records.get(i));
        }

        Map<String, String> parentOf = new LinkedHashMap<>();
        Map<String, List<String>> childrenOf = new LinkedHashMap<>();
        Map<String, Integer> indexInGroup = new HashMap<>();
        List<String> roots = new ArrayList<>();

        for (int i = 0; i < elements.size(); i++) {
            String id = records.get(i).getElementId();
            childrenOf.putIfAbsent(id, new ArrayList<>());
            ElementRecord parent = nearestClassifiedAncestor(elements.get(i), arena);
            List<String> group;
            if (parent == null) {
                group = roots;
            } else {
                parentOf.put(id, parent.getElementId());
                group = childrenOf.computeIfAbsent(parent.getElementId(), k -> new ArrayList<>());
            }
            indexInGroup.put(id, group.size());
            group.add(id);
        }

        // Each group is frozen once and shared by all of its members.
        List<String> frozenRoots = List.copyOf(roots);
        Map<String, List<String>> frozenChildren = new HashMap<>();
        childrenOf.forEach((id, kids) -> frozenChildren.put(id, List.copyOf(kids)));

        Map<String, ElementHierarchy> out = new LinkedHashMap<>();
        for (int i = 0; i < elements.size(); i++) {
            String id = records.get(i).getElementId();
            String parent = parentOf.get(id);
            List<String> group = parent == null ? frozenRoots : frozenChildren.get(parent);
            out.put(id, ElementHierarchy.inGroup(parent, frozenChildren.get(id), group,
                    indexInGroup.get(id), DomPaths.depth(elements.get(i))));
        }
        log.debug("Built relationships for {} element(s), {} top-level", out.size(), roots.size());
        return out;
    }

    /**
     * Re-associates records that were detached from their nodes with {@code document}
     * and builds their relationships. Each record is looked up by id attribute, then
     * name attribute, then primary CSS locator; records that cannot be found, or that
     * resolve to a node already claimed by an earlier record, are left out.
     */
    public Map<String, ElementHierarchy> build(Document document, List<ElementRecord> records) {
        List<Element> elements = new ArrayList<>();
        List<ElementRecord> matched = new ArrayList<>();
        Map<Element, Boolean> claimed = new IdentityHashMap<>();

        for (ElementRecord record : records) {
            Optional<Element> node = locate(document, record);
            if (node.isEmpty() || claimed.containsKey(node.get())) {
                log.debug("No node for {}; omitted from relationships", record.getElementId());
                continue;
            }
            claimed.put(node.get(), Boolean.TRUE);
            elements.add(node.get());
            matched.add(record);
        }
        return build(elements, matched);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static ElementRecord nearestClassifiedAncestor(Element el, Map<Element, ElementRecord> arena) {
        Element current = el.parent();
        while (current != null) {
            ElementRecord r = arena.get(current);
            if (r != null) return r;
            current = current.parent();
        }
        return null;
    }

    private static Optional<Element> locate(Document document, ElementRecord record) {
        String id = record.getAttribute("id");
        if (id != null && !id.isEmpty()) {
            Element byId = document.getElementById(id);
            if (byId != null) return Optional.of(byId);
        }

        String name = record.getAttribute("name");
        if (name != null && !name.isEmpty()) {
            Element byName = document.getElementsByAttributeValue("name", name).first();
            if (byName != null) return Optional.of(byName);
        }

        Optional<ElementLocator> css = record.getLocators().primaryCss();
        if (css.isPresent()) {
            try {
                Elements hits = document.select(css.get().getValue());
                if (!hits.isEmpty()) return Optional.of(hits.first());
            } catch (RuntimeException e) {
                log.debug("Cannot evaluate {} for {}: {}", css.get().getValue(), record.getElementId(), e.getMessage());
            }
        }
        return Optional.empty();
    }
}
