package domlocator.browser;

import domlocator.engine.DomAnalysisException;
import domlocator.model.ElementLocator;
import domlocator.model.ElementRecord;
import domlocator.model.ElementType;
import domlocator.model.LocatorSet;
import domlocator.model.LocatorStrategy;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.By;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LocatorResolver}.
 *
 * <p>Verifies that verified locators are tried in strategy order, that
 * {@code css-text} and non-unique locators are skipped, and that a
 * {@link DomAnalysisException} is raised when every candidate fails.
 */
public class LocatorResolverTest {

    @Mock
    private WebDriver driver;

    @Mock
    private WebElement mockElement;

    private AutoCloseable mocks;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    // ── Helper builders ───────────────────────────────────────────────────

    private static ElementRecord record(ElementLocator... locators) {
        LocatorSet.Builder set = LocatorSet.builder();
        for (ElementLocator l : locators) set.add(l);
        return ElementRecord.builder()
                .elementId("id_go")
                .elementType(ElementType.BUTTON)
                .tagName("button")
                .locators(set.build())
                .build();
    }

    private static ElementRecord typicalRecord() {
        return record(
                ElementLocator.unique(LocatorStrategy.CSS_ID, "#go"),
                ElementLocator.unique(LocatorStrategy.CSS_TEXT, "button:contains(Go)"),
                ElementLocator.bestEffort(LocatorStrategy.CSS_FALLBACK, "button"),
                ElementLocator.unique(LocatorStrategy.XPATH_ID, "//*[@id='go']"));
    }

    // ── Candidate selection ───────────────────────────────────────────────

    @Test(description = "Candidates are unique, browser-evaluable locators in strategy order")
    public void testCandidates() {
        LocatorResolver r = new LocatorResolver(driver, 5);

        assertThat(r.candidates(typicalRecord()))
                .extracting(ElementLocator::getValue)
                .containsExactly("#go", "//*[@id='go']");
    }

    @Test(description = "maxAttempts caps the number of candidates")
    public void testMaxAttempts() {
        when(driver.findElement(any(By.class))).thenThrow(new NoSuchElementException("none"));
        LocatorResolver r = new LocatorResolver(driver, 1);

        assertThatThrownBy(() -> r.findElement(typicalRecord()))
                .isInstanceOf(DomAnalysisException.class)
                .hasMessageContaining("tried 1 of 4");
        verify(driver, times(1)).findElement(any(By.class));
    }

    @Test(description = "maxAttempts below 1 is rejected")
    public void testInvalidMaxAttempts() {
        assertThatThrownBy(() -> new LocatorResolver(driver, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    // ── Resolution ────────────────────────────────────────────────────────

    @Test(description = "The first locator that finds an element wins")
    public void testFirstCandidateWins() {
        when(driver.findElement(By.cssSelector("#go"))).thenReturn(mockElement);
        LocatorResolver r = new LocatorResolver(driver, 5);

        assertThat(r.findElement(typicalRecord())).isSameAs(mockElement);
        assertThat(r.resolve(typicalRecord()).getStrategy()).isEqualTo(LocatorStrategy.CSS_ID);
        verify(driver, never()).findElement(By.xpath("//*[@id='go']"));
    }

    @Test(description = "A missing element falls through to the next strategy")
    public void testFallsThroughOnNoSuchElement() {
        when(driver.findElement(By.cssSelector("#go"))).thenThrow(new NoSuchElementException("gone"));
        when(driver.findElement(By.xpath("//*[@id='go']"))).thenReturn(mockElement);
        LocatorResolver r = new LocatorResolver(driver, 5);

        assertThat(r.resolve(typicalRecord()).getStrategy()).isEqualTo(LocatorStrategy.XPATH_ID);
    }

    @Test(description = "A selector the browser rejects falls through to the next strategy")
    public void testFallsThroughOnInvalidSelector() {
        when(driver.findElement(By.cssSelector("#go"))).thenThrow(new InvalidSelectorException("bad"));
        when(driver.findElement(By.xpath("//*[@id='go']"))).thenReturn(mockElement);
        LocatorResolver r = new LocatorResolver(driver, 5);

        assertThat(r.findElement(typicalRecord())).isSameAs(mockElement);
    }

    @Test(description = "DomAnalysisException when every candidate fails")
    public void testAllFail() {
        when(driver.findElement(any(By.class))).thenThrow(new NoSuchElementException("none"));
        LocatorResolver r = new LocatorResolver(driver, 5);

        assertThatThrownBy(() -> r.resolve(typicalRecord()))
                .isInstanceOf(DomAnalysisException.class)
                .hasMessageContaining("id_go");
    }

    @Test(description = "A record with only non-unique locators has nothing to try")
    public void testNoVerifiedLocators() {
        LocatorResolver r = new LocatorResolver(driver, 5);
        ElementRecord fallbackOnly = record(ElementLocator.bestEffort(LocatorStrategy.CSS_FALLBACK, "button"));

        assertThatThrownBy(() -> r.resolve(fallbackOnly)).isInstanceOf(DomAnalysisException.class);
        verifyNoInteractions(driver);
    }
}
