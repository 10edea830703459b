package domlocator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered collection of locators for one element, at most one per
 * {@link LocatorStrategy}. Iteration follows strategy declaration order, so
 * the first CSS entry is the preferred selector and the first XPath entry the
 * preferred path.
 *
 * <p>Instances are immutable; use {@link #builder()}.
 */
public final class LocatorSet {

    private static final LocatorSet EMPTY = new LocatorSet(new EnumMap<>(LocatorStrategy.class));

    private final EnumMap<LocatorStrategy, ElementLocator> locators;

    private LocatorSet(EnumMap<LocatorStrategy, ElementLocator> locators) {
        this.locators = locators;
    }

    public static LocatorSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ElementLocator> get(LocatorStrategy strategy) {
        return Optional.ofNullable(locators.get(strategy));
    }

    /** Expression for the strategy, or {@code null}. */
    public String expression(LocatorStrategy strategy) {
        ElementLocator l = locators.get(strategy);
        return l == null ? null : l.getValue();
    }

    public boolean contains(LocatorStrategy strategy) {
        return locators.containsKey(strategy);
    }

    /** All locators in strategy order. */
    public Collection<ElementLocator> all() {
        return Collections.unmodifiableCollection(locators.values());
    }

    /** Locators whose uniqueness was confirmed at generation time, in strategy order. */
    public List<ElementLocator> uniqueLocators() {
        List<ElementLocator> out = new ArrayList<>();
        for (ElementLocator l : locators.values()) {
            if (l.isUnique()) out.add(l);
        }
        return out;
    }

    /** The preferred CSS locator: first CSS entry in strategy order. */
    @JsonIgnore
    public Optional<ElementLocator> primaryCss() {
        return first(LocatorStrategy.Syntax.CSS);
    }

    /** The preferred XPath locator: first XPath entry in strategy order. */
    @JsonIgnore
    public Optional<ElementLocator> primaryXpath() {
        return first(LocatorStrategy.Syntax.XPATH);
    }

    /** True if at least one entry was verified unique. */
    @JsonIgnore
    public boolean hasUniqueLocator() {
        return locators.values().stream().anyMatch(ElementLocator::isUnique);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return locators.isEmpty();
    }

    public int size() {
        return locators.size();
    }

    /** Strategy key → expression, in strategy order. */
    @JsonValue
    public Map<String, String> asMap() {
        Map<String, String> out = new LinkedHashMap<>();
        locators.forEach((k, v) -> out.put(k.key(), v.getValue()));
        return Collections.unmodifiableMap(out);
    }

    private Optional<ElementLocator> first(LocatorStrategy.Syntax syntax) {
        for (ElementLocator l : locators.values()) {
            if (l.getStrategy().syntax() == syntax) return Optional.of(l);
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LocatorSet)) return false;
        return locators.equals(((LocatorSet) o).locators);
    }

    @Override
    public int hashCode() {
        return Objects.hash(locators);
    }

    @Override
    public String toString() {
        return "LocatorSet" + locators.values();
    }

    public static final class Builder {

        private final EnumMap<LocatorStrategy, ElementLocator> locators = new EnumMap<>(LocatorStrategy.class);

        private Builder() {}

        /** Adds or replaces the entry for the locator's strategy. */
        public Builder add(ElementLocator locator) {
            locators.put(locator.getStrategy(), locator);
            return this;
        }

        public Builder addAll(Collection<ElementLocator> more) {
            more.forEach(this::add);
            return this;
        }

        public LocatorSet build() {
            return locators.isEmpty() ? EMPTY : new LocatorSet(new EnumMap<>(locators));
        }
    }
}
