package domlocator.engine;

import domlocator.classify.SemanticRules;
import domlocator.locator.LocatorSettings;
import domlocator.model.SemanticType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Reads analyzer settings from {@code config.properties} (classpath) and
 * exposes typed accessor methods with sensible defaults.
 *
 * <p>An optional {@code config.local.properties} file on the classpath
 * overrides any value from the base file.
 *
 * <h3>Supported keys and defaults</h3>
 * <table>
 *   <tr><th>Key</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>analyzer.max.depth</td><td>10</td><td>Levels in a CSS or XPath ancestor chain</td></tr>
 *   <tr><td>analyzer.text.min.length</td><td>3</td><td>Text longer than this earns the text confidence bonus</td></tr>
 *   <tr><td>analyzer.text.selector.max.length</td><td>50</td><td>Longest text used in a {@code :contains()} selector</td></tr>
 *   <tr><td>analyzer.xpath.text.max.length</td><td>100</td><td>Longest text used in an XPath text predicate</td></tr>
 *   <tr><td>analyzer.class.max.count</td><td>6</td><td>Meaningful classes considered for combinations</td></tr>
 *   <tr><td>analyzer.class.combination.max.size</td><td>3</td><td>Largest class combination tried</td></tr>
 *   <tr><td>analyzer.position.parent.depth</td><td>3</td><td>Parent levels in an XPath position locator</td></tr>
 *   <tr><td>analyzer.include.hidden</td><td>false</td><td>Catalogue hidden elements too</td></tr>
 *   <tr><td>analyzer.xpath.verify</td><td>true</td><td>Verify XPath candidates against the document</td></tr>
 *   <tr><td>analyzer.element.id.max.length</td><td>100</td><td>Longest generated element id</td></tr>
 *   <tr><td>analyzer.semantic.&lt;type&gt;.keywords</td><td>built in</td><td>Comma-separated keyword override, e.g. {@code analyzer.semantic.cart.keywords}</td></tr>
 * </table>
 */
public class AnalyzerConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    private static final String KEY_MAX_DEPTH             = "analyzer.max.depth";
    private static final String KEY_TEXT_MIN_LENGTH       = "analyzer.text.min.length";
    private static final String KEY_TEXT_SELECTOR_MAX     = "analyzer.text.selector.max.length";
    private static final String KEY_XPATH_TEXT_MAX        = "analyzer.xpath.text.max.length";
    private static final String KEY_CLASS_MAX_COUNT       = "analyzer.class.max.count";
    private static final String KEY_CLASS_COMBINATION_MAX = "analyzer.class.combination.max.size";
    private static final String KEY_POSITION_PARENT_DEPTH = "analyzer.position.parent.depth";
    private static final String KEY_INCLUDE_HIDDEN        = "analyzer.include.hidden";
    private static final String KEY_XPATH_VERIFY          = "analyzer.xpath.verify";
    private static final String KEY_ELEMENT_ID_MAX        = "analyzer.element.id.max.length";
    private static final String SEMANTIC_PREFIX           = "analyzer.semantic.";
    private static final String SEMANTIC_SUFFIX           = ".keywords";

    // Defaults
    private static final int     DEFAULT_MAX_DEPTH             = 10;
    private static final int     DEFAULT_TEXT_MIN_LENGTH       = 3;
    private static final int     DEFAULT_TEXT_SELECTOR_MAX     = 50;
    private static final int     DEFAULT_XPATH_TEXT_MAX        = 100;
    private static final int     DEFAULT_CLASS_MAX_COUNT       = 6;
    private static final int     DEFAULT_CLASS_COMBINATION_MAX = 3;
    private static final int     DEFAULT_POSITION_PARENT_DEPTH = 3;
    private static final boolean DEFAULT_INCLUDE_HIDDEN        = false;
    private static final boolean DEFAULT_XPATH_VERIFY          = true;
    private static final int     DEFAULT_ELEMENT_ID_MAX        = 100;

    private final Properties props;

    // ── Construction ──────────────────────────────────────────────────────

    /**
     * Loads configuration from the classpath. A missing {@code config.properties}
     * is tolerated and leaves every setting at its default.
     *
     * @throws DomAnalysisException if the base file exists but cannot be read
     */
    public AnalyzerConfig() {
        props = new Properties();
        loadBase();
        loadLocalOverrides();
    }

    /** Package-private constructor for tests; bypasses classpath I/O. */
    AnalyzerConfig(Properties props) {
        this.props = props;
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public int getMaxDepth() {
        return getPositiveInt(KEY_MAX_DEPTH, DEFAULT_MAX_DEPTH);
    }

    public int getTextMinLength() {
        return getIntAtLeast(KEY_TEXT_MIN_LENGTH, 0, DEFAULT_TEXT_MIN_LENGTH);
    }

    public int getTextSelectorMaxLength() {
        return getIntAtLeast(KEY_TEXT_SELECTOR_MAX, 0, DEFAULT_TEXT_SELECTOR_MAX);
    }

    public int getXpathTextMaxLength() {
        return getIntAtLeast(KEY_XPATH_TEXT_MAX, 0, DEFAULT_XPATH_TEXT_MAX);
    }

    public int getClassMaxCount() {
        return getIntAtLeast(KEY_CLASS_MAX_COUNT, 0, DEFAULT_CLASS_MAX_COUNT);
    }

    public int getClassCombinationMaxSize() {
        return getPositiveInt(KEY_CLASS_COMBINATION_MAX, DEFAULT_CLASS_COMBINATION_MAX);
    }

    public int getPositionParentDepth() {
        return getIntAtLeast(KEY_POSITION_PARENT_DEPTH, 0, DEFAULT_POSITION_PARENT_DEPTH);
    }

    /** Whether hidden elements are catalogued. Default: {@code false}. */
    public boolean isIncludeHidden() {
        return getBoolean(KEY_INCLUDE_HIDDEN, DEFAULT_INCLUDE_HIDDEN);
    }

    /** Whether XPath candidates are verified. Default: {@code true}. */
    public boolean isXpathVerify() {
        return getBoolean(KEY_XPATH_VERIFY, DEFAULT_XPATH_VERIFY);
    }

    public int getElementIdMaxLength() {
        return getIntAtLeast(KEY_ELEMENT_ID_MAX, ElementIdGenerator.MIN_MAX_LENGTH, DEFAULT_ELEMENT_ID_MAX);
    }

    /** Overrides a single key at runtime; takes precedence over the config files. */
    public void set(String key, String value) {
        props.setProperty(key, value);
    }

    public LocatorSettings toLocatorSettings() {
        return new LocatorSettings(
                getMaxDepth(),
                getTextSelectorMaxLength(),
                getXpathTextMaxLength(),
                getClassMaxCount(),
                getClassCombinationMaxSize(),
                getPositionParentDepth(),
                isXpathVerify());
    }

    /**
     * Default keyword tables with any {@code analyzer.semantic.<type>.keywords}
     * overrides applied. {@code <type>} is the lower-case {@link SemanticType}
     * name; unknown types are logged and ignored.
     */
    public SemanticRules semanticRules() {
        SemanticRules rules = SemanticRules.defaults();
        for (String key : props.stringPropertyNames().stream().sorted().collect(Collectors.toList())) {
            if (!key.startsWith(SEMANTIC_PREFIX) || !key.endsWith(SEMANTIC_SUFFIX)) continue;
            String name = key.substring(SEMANTIC_PREFIX.length(), key.length() - SEMANTIC_SUFFIX.length());
            SemanticType type;
            try {
                type = SemanticType.valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                log.warn("Unknown semantic type in key '{}' - ignored", key);
                continue;
            }
            if (type == SemanticType.UNKNOWN) {
                log.warn("Keywords cannot be set for UNKNOWN - ignoring '{}'", key);
                continue;
            }
            List<String> words = splitToList(props.getProperty(key));
            if (words.isEmpty()) {
                log.warn("Empty keyword list for '{}' - keeping defaults", key);
                continue;
            }
            rules = rules.withKeywords(type, words);
        }
        return rules;
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private void loadBase() {
        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                log.warn("Classpath resource not found: {} - all analyzer settings use defaults", CONFIG_FILE);
                return;
            }
            props.load(base);
            log.debug("Loaded analyzer base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new DomAnalysisException("Cannot load " + CONFIG_FILE, e);
        }
    }

    private void loadLocalOverrides() {
        try (InputStream local = getClass().getClassLoader().getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {} - using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}' - using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private int getPositiveInt(String key, int defaultValue) {
        return getIntAtLeast(key, 1, defaultValue);
    }

    private int getIntAtLeast(String key, int min, int defaultValue) {
        int value = getInt(key, defaultValue);
        if (value < min) {
            log.warn("Value for key '{}' must be >= {}, got {} - using default {}", key, min, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (v.equals("true"))  return true;
        if (v.equals("false")) return false;
        log.warn("Invalid boolean for key '{}': '{}' - using default {}", key, raw, defaultValue);
        return defaultValue;
    }

    private static List<String> splitToList(String csv) {
        if (csv == null || csv.isBlank()) return List.of();
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
