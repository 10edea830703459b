package domlocator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single generated locator with its strategy and expression.
 *
 * <p>{@code unique} records the time-of-check result: the uniqueness oracle
 * confirmed that the expression selected exactly the origin element when it
 * was generated. Best-effort fallbacks carry {@code unique=false}.
 */
public final class ElementLocator {

    @JsonProperty("strategy")
    private final LocatorStrategy strategy;

    @JsonProperty("value")
    private final String value;

    @JsonProperty("unique")
    private final boolean unique;

    public ElementLocator(LocatorStrategy strategy, String value, boolean unique) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.value    = Objects.requireNonNull(value, "value");
        this.unique   = unique;
    }

    public static ElementLocator unique(LocatorStrategy strategy, String value) {
        return new ElementLocator(strategy, value, true);
    }

    public static ElementLocator bestEffort(LocatorStrategy strategy, String value) {
        return new ElementLocator(strategy, value, false);
    }

    public LocatorStrategy getStrategy() { return strategy; }
    public String          getValue()    { return value; }
    public boolean         isUnique()    { return unique; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementLocator)) return false;
        ElementLocator that = (ElementLocator) o;
        return unique == that.unique && strategy == that.strategy && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategy, value, unique);
    }

    @Override
    public String toString() {
        return String.format("ElementLocator{%s='%s'%s}", strategy.key(), value, unique ? "" : " [NON-UNIQUE]");
    }
}
