package domlocator.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes {@link ElementAnalysis} results as pretty-printed JSON.
 *
 * <p>Locator sets serialise as {@code strategy-key -> expression} maps;
 * timestamps as ISO-8601 strings.
 */
public class AnalysisIO {

    private static final Logger log = LoggerFactory.getLogger(AnalysisIO.class);

    /** Singleton ObjectMapper, thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private AnalysisIO() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Writes {@code analysis} to {@code path}, creating parent directories.
     *
     * @throws IOException if the file cannot be written
     */
    public static void write(ElementAnalysis analysis, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        MAPPER.writeValue(path.toFile(), analysis);
        log.info("Wrote analysis of {} ({} elements) to {}", analysis.getSourceUrl(),
                analysis.getElementCount(), path);
    }

    public static String toJson(ElementAnalysis analysis) throws IOException {
        return MAPPER.writeValueAsString(analysis);
    }

    public static String toJson(ElementRecord record) throws IOException {
        return MAPPER.writeValueAsString(record);
    }

    /** Returns the shared ObjectMapper (for use in tests and other modules). */
    public static ObjectMapper getMapper() { return MAPPER; }
}
