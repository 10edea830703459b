package domlocator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.AbstractList;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * Position of a classified element in the logical (classified-only) tree.
 * {@code depth} counts every ancestor up to the document root, classified or not.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ElementHierarchy {

    private static final ElementHierarchy NONE = new ElementHierarchy(null, List.of(), List.of(), 0);

    @JsonProperty("parent")
    private final String parent;

    @JsonProperty("children")
    private final List<String> children;

    @JsonProperty("siblings")
    private final List<String> siblings;

    @JsonProperty("depth")
    private final int depth;

    public ElementHierarchy(String parent, List<String> children, List<String> siblings, int depth) {
        this.parent   = parent;
        this.children = children != null ? List.copyOf(children) : List.of();
        this.siblings = siblings != null ? List.copyOf(siblings) : List.of();
        this.depth    = depth;
    }

    private ElementHierarchy(String parent, List<String> children, GroupView siblings, int depth) {
        this.parent   = parent;
        this.children = children != null ? List.copyOf(children) : List.of();
        this.siblings = siblings;
        this.depth    = depth;
    }

    /**
     * Hierarchy whose siblings are {@code group} minus the entry at
     * {@code indexInGroup}. The group is shared, not copied, so it must be
     * immutable; every member of a large group can then point at one list.
     */
    public static ElementHierarchy inGroup(String parent, List<String> children,
                                           List<String> group, int indexInGroup, int depth) {
        Objects.checkIndex(indexInGroup, group.size());
        return new ElementHierarchy(parent, children, new GroupView(group, indexInGroup), depth);
    }

    /** Placeholder used before the relationship phase has run. */
    public static ElementHierarchy none() {
        return NONE;
    }

    /** Id of the nearest classified ancestor, or {@code null}. */
    public String       getParent()   { return parent; }
    public List<String> getChildren() { return children; }
    public List<String> getSiblings() { return siblings; }
    public int          getDepth()    { return depth; }

    @JsonIgnore
    public boolean isRoot() {
        return parent == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementHierarchy)) return false;
        ElementHierarchy that = (ElementHierarchy) o;
        return depth == that.depth
                && Objects.equals(parent, that.parent)
                && children.equals(that.children)
                && siblings.equals(that.siblings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parent, children, siblings, depth);
    }

    @Override
    public String toString() {
        return String.format("ElementHierarchy{parent=%s, children=%s, siblings=%s, depth=%d}",
                parent, children, siblings, depth);
    }

    // ── Sibling view ──────────────────────────────────────────────────────

    /** Read-only view of a group with one index skipped. */
    private static final class GroupView extends AbstractList<String> implements RandomAccess {

        private final List<String> group;
        private final int skipped;

        GroupView(List<String> group, int skipped) {
            this.group   = group;
            this.skipped = skipped;
        }

        @Override
        public String get(int index) {
            Objects.checkIndex(index, size());
            return group.get(index < skipped ? index : index + 1);
        }

        @Override
        public int size() {
            return group.size() - 1;
        }
    }
}
