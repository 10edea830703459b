package domlocator.browser;

import domlocator.engine.DomAnalysisException;
import domlocator.engine.ElementAnalyzer;
import domlocator.model.ElementAnalysis;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * A jsoup copy of the page a {@link WebDriver} is showing.
 *
 * <p>Analysis runs against the copy, so later changes in the browser do not
 * affect an in-progress pass. Locators generated from the copy are only
 * guaranteed to resolve while the live page still matches it.
 */
public final class PageSnapshot {

    private static final Logger log = LoggerFactory.getLogger(PageSnapshot.class);

    private final Document document;
    private final String url;
    private final Instant capturedAt;

    private PageSnapshot(Document document, String url, Instant capturedAt) {
        this.document   = document;
        this.url        = url;
        this.capturedAt = capturedAt;
    }

    /**
     * Reads the current page source and URL from {@code driver}.
     *
     * @throws DomAnalysisException if the driver cannot supply the page source
     */
    public static PageSnapshot capture(WebDriver driver) {
        Objects.requireNonNull(driver, "driver");
        String source;
        String url;
        try {
            source = driver.getPageSource();
            url = driver.getCurrentUrl();
        } catch (WebDriverException e) {
            throw new DomAnalysisException("Cannot read page from browser", e);
        }
        if (source == null) {
            throw new DomAnalysisException("Browser returned no page source for " + url);
        }
        Document document = Jsoup.parse(source, url == null ? "" : url);
        log.debug("Captured snapshot of {} ({} chars)", url, source.length());
        return new PageSnapshot(document, url, Instant.now());
    }

    public ElementAnalysis analyze(ElementAnalyzer analyzer) {
        return analyzer.analyze(document);
    }

    public Document getDocument()   { return document; }
    public String   getUrl()        { return url; }
    public Instant  getCapturedAt() { return capturedAt; }
}
