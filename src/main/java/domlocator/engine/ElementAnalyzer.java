package domlocator.engine;

import domlocator.classify.Classification;
import domlocator.classify.ElementClassifier;
import domlocator.form.FormAnalyzer;
import domlocator.hierarchy.HierarchyBuilder;
import domlocator.locator.CssSelectorGenerator;
import domlocator.locator.JsoupOracle;
import domlocator.locator.LocatorSettings;
import domlocator.locator.XPathGenerator;
import domlocator.model.ElementAnalysis;
import domlocator.model.ElementHierarchy;
import domlocator.model.ElementRecord;
import domlocator.model.FormStructure;
import domlocator.model.LocatorSet;
import domlocator.model.PerformanceHints;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one analysis pass over a document snapshot: classification, locator
 * generation, relationship building, then form and page summaries.
 *
 * <p>Each call to {@link #analyze(Document)} owns its oracle and id generator,
 * so an analyzer may be shared between threads as long as each thread passes
 * its own document. The thread's interrupt flag is checked between phases.
 */
public class ElementAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ElementAnalyzer.class);

    private final ElementClassifier classifier;
    private final HierarchyBuilder hierarchyBuilder;
    private final FormAnalyzer formAnalyzer;
    private final LocatorSettings locatorSettings;
    private final int elementIdMaxLength;

    public ElementAnalyzer(AnalyzerConfig config) {
        Objects.requireNonNull(config, "config");
        this.classifier         = new ElementClassifier(config.semanticRules(), config.getTextMinLength(), config.isIncludeHidden());
        this.hierarchyBuilder   = new HierarchyBuilder();
        this.formAnalyzer       = new FormAnalyzer(classifier);
        this.locatorSettings    = config.toLocatorSettings();
        this.elementIdMaxLength = config.getElementIdMaxLength();
    }

    /** Analyzer configured from {@code config.properties} on the classpath. */
    public ElementAnalyzer() {
        this(new AnalyzerConfig());
    }

    ElementAnalyzer(ElementClassifier classifier, LocatorSettings locatorSettings, int elementIdMaxLength) {
        this.classifier         = Objects.requireNonNull(classifier, "classifier");
        this.hierarchyBuilder   = new HierarchyBuilder();
        this.formAnalyzer       = new FormAnalyzer(classifier);
        this.locatorSettings    = Objects.requireNonNull(locatorSettings, "locatorSettings");
        this.elementIdMaxLength = elementIdMaxLength;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Parses {@code html} with jsoup and analyzes the result.
     *
     * @param html    page source
     * @param baseUrl page URL, recorded as the analysis source; may be {@code null}
     */
    public ElementAnalysis analyze(String html, String baseUrl) {
        Objects.requireNonNull(html, "html");
        return analyze(Jsoup.parse(html, baseUrl == null ? "" : baseUrl));
    }

    /**
     * Analyzes {@code document}. A document without a root element yields an empty
     * analysis carrying the reason in {@link ElementAnalysis#getErrors()}.
     *
     * @throws AnalysisCancelledException if the thread is interrupted during the pass
     */
    public ElementAnalysis analyze(Document document) {
        long start = System.nanoTime();
        String url = document == null ? null : document.location();
        try {
            requireRoot(document);
        } catch (MalformedDocumentException e) {
            log.warn("Cannot analyze {}: {}", url, e.getMessage());
            return ElementAnalysis.failed(url, elapsedMs(start), e.getMessage());
        }

        log.info("Analyzing {} ({} nodes)", url == null || url.isEmpty() ? "<inline document>" : url,
                document.getAllElements().size());
        List<String> errors = new ArrayList<>();

        // Phase 1: classification
        List<Element> elements = new ArrayList<>();
        List<Classification> classifications = new ArrayList<>();
        for (Element el : document.getAllElements()) {
            if (el == document) continue;
            try {
                classifier.classify(el).ifPresent(c -> {
                    elements.add(el);
                    classifications.add(c);
                });
            } catch (RuntimeException e) {
                skip(el, e, errors);
            }
        }
        checkCancelled("classification");

        // Phase 2: locators and records
        JsoupOracle oracle = new JsoupOracle(document);
        CssSelectorGenerator css = new CssSelectorGenerator(oracle, locatorSettings);
        XPathGenerator xpath = new XPathGenerator(oracle, locatorSettings);
        ElementIdGenerator ids = new ElementIdGenerator(elementIdMaxLength);

        List<Element> recorded = new ArrayList<>();
        List<ElementRecord> records = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            Element el = elements.get(i);
            try {
                records.add(toRecord(el, classifications.get(i), ids.nextId(el),
                        LocatorSet.builder().addAll(css.generateAll(el)).addAll(xpath.generateAll(el)).build()));
                recorded.add(el);
            } catch (RuntimeException e) {
                skip(el, e, errors);
            }
        }
        checkCancelled("locator generation");

        // Phase 3: relationships
        Map<String, ElementHierarchy> relationships = hierarchyBuilder.build(recorded, records);
        for (ElementRecord r : records) {
            r.attachHierarchy(relationships.get(r.getElementId()));
        }
        checkCancelled("relationship building");

        // Phase 4: forms and page hints
        Map<Element, String> recordIds = new IdentityHashMap<>();
        for (int i = 0; i < recorded.size(); i++) {
            recordIds.put(recorded.get(i), records.get(i).getElementId());
        }
        List<FormStructure> forms;
        try {
            forms = formAnalyzer.analyze(document, recordIds);
        } catch (RuntimeException e) {
            log.warn("Form analysis failed: {}", e.getMessage(), e);
            errors.add("forms: " + e.getMessage());
            forms = List.of();
        }
        PerformanceHints hints = PerformanceHints.of(document.getAllElements().size() - 1, records);

        long ms = elapsedMs(start);
        log.info("Analysis complete: {} element(s), {} form(s), {} error(s), {} oracle queries, {} ms",
                records.size(), forms.size(), errors.size(), oracle.queryCount(), ms);
        return new ElementAnalysis(url, document.title(), Instant.now(), ms, records, relationships, errors,
                forms, hints);
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private static void requireRoot(Document document) {
        if (document == null) {
            throw new MalformedDocumentException("Document is null");
        }
        if (document.children().isEmpty()) {
            throw new MalformedDocumentException("Document has no root element");
        }
    }

    private static ElementRecord toRecord(Element el, Classification c, String id, LocatorSet locators) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (Attribute a : el.attributes()) attributes.put(a.getKey(), a.getValue());

        return ElementRecord.builder()
                .elementId(id)
                .elementType(c.elementType())
                .tagName(el.normalName())
                .locators(locators)
                .interactionTypes(c.interactions())
                .semanticType(c.semanticType())
                .formFieldType(c.formFieldType())
                .accessibilityRole(c.role())
                .confidence(c.confidence())
                .attributes(attributes)
                .text(c.text())
                .placeholder(el.hasAttr("placeholder") ? el.attr("placeholder") : null)
                .value(el.hasAttr("value") ? el.attr("value") : null)
                .visible(c.visible())
                .enabled(c.enabled())
                .properties(c.properties())
                .interactionHints(c.interactionHints())
                .build();
    }

    private static void skip(Element el, RuntimeException e, List<String> errors) {
        log.warn("Skipping <{}>: {}", el.normalName(), e.getMessage(), e);
        errors.add("<" + el.normalName() + ">: " + e.getMessage());
    }

    private static void checkCancelled(String phase) {
        if (Thread.currentThread().isInterrupted()) {
            throw new AnalysisCancelledException("Analysis interrupted after " + phase);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
