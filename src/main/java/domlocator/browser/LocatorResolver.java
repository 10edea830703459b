package domlocator.browser;

import domlocator.engine.DomAnalysisException;
import domlocator.model.ElementLocator;
import domlocator.model.ElementRecord;
import org.openqa.selenium.By;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Finds the live {@link WebElement} for an analysed {@link ElementRecord} by
 * trying its verified locators in strategy order.
 *
 * <p>Only locators flagged unique at analysis time are tried, and
 * {@code css-text} is skipped because browsers do not support
 * {@code :contains()}. At most {@code maxAttempts} locators are tried before a
 * {@link DomAnalysisException} is thrown.
 */
public class LocatorResolver {

    private static final Logger log = LoggerFactory.getLogger(LocatorResolver.class);

    private final WebDriver driver;
    private final int maxAttempts;

    /**
     * @param driver      active WebDriver session showing the analysed page
     * @param maxAttempts maximum number of locators to try per lookup
     */
    public LocatorResolver(WebDriver driver, int maxAttempts) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        this.driver = Objects.requireNonNull(driver, "driver");
        this.maxAttempts = maxAttempts;
    }

    /** Pair of the winning locator and the element it found, from one DOM call. */
    private record LocateMatch(ElementLocator locator, WebElement element) {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Returns the first locator that finds an element in the current page.
     *
     * @throws DomAnalysisException if every candidate fails
     */
    public ElementLocator resolve(ElementRecord record) {
        return locateFirst(record).locator();
    }

    /**
     * Returns the live element for {@code record}, with a single DOM query per
     * candidate tried.
     *
     * @throws DomAnalysisException if every candidate fails
     */
    public WebElement findElement(ElementRecord record) {
        LocateMatch m = locateFirst(record);
        log.debug("Located {} with {}: {}", record.getElementId(), m.locator().getStrategy().key(), m.locator().getValue());
        return m.element();
    }

    /** Candidates tried for {@code record}, in order, before the attempt limit. */
    public List<ElementLocator> candidates(ElementRecord record) {
        return record.getLocators().uniqueLocators().stream()
                .filter(l -> l.getStrategy().isBrowserEvaluable())
                .limit(maxAttempts)
                .collect(Collectors.toList());
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private LocateMatch locateFirst(ElementRecord record) {
        List<ElementLocator> candidates = candidates(record);
        for (ElementLocator locator : candidates) {
            log.debug("Trying [{}]: {}", locator.getStrategy().key(), locator.getValue());
            LocateMatch m = tryLocator(locator);
            if (m != null) return m;
        }
        throw new DomAnalysisException(String.format(
                "All locator strategies failed for element %s (tried %d of %d: %s)",
                record.getElementId(), candidates.size(), record.getLocators().size(), candidates));
    }

    private LocateMatch tryLocator(ElementLocator locator) {
        By by = locator.getStrategy().isXpath()
                ? By.xpath(locator.getValue())
                : By.cssSelector(locator.getValue());
        try {
            return new LocateMatch(locator, driver.findElement(by));
        } catch (NoSuchElementException e) {
            log.debug("[{}] not found: {}", locator.getStrategy().key(), by);
            return null;
        } catch (InvalidSelectorException e) {
            log.debug("[{}] rejected by browser: {}", locator.getStrategy().key(), by);
            return null;
        }
    }
}
