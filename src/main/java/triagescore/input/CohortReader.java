package triagescore.input;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads a cohort: a JSON array of {@link CohortEntry} objects.
 * Unknown properties are ignored and null numbers read as missing.
 */
public class CohortReader {
    private static final Logger logger = LoggerFactory.getLogger(CohortReader.class);

    /** Classpath name of the cohort shipped with the application. */
    public static final String SAMPLE_COHORT = "sample-cohort.json";

    private static final TypeReference<List<CohortEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public CohortReader() {
        this.objectMapper = new ObjectMapper();
        // Be lenient with fields we do not score on
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, false);
    }

    /**
     * Parse raw JSON bytes.
     *
     * @param data UTF-8 encoded JSON array
     * @return the entries, in file order
     * @throws IllegalArgumentException if parsing fails
     */
    public List<CohortEntry> read(byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        try {
            List<CohortEntry> entries = objectMapper.readValue(data, ENTRY_LIST);
            return checked(entries);
        } catch (IOException e) {
            logger.error("Failed to parse cohort", e);
            throw new IllegalArgumentException("Cohort parsing failed: " + e.getMessage(), e);
        }
    }

    /**
     * Parse from a stream. The stream is not closed.
     *
     * @throws IllegalArgumentException if parsing fails
     */
    public List<CohortEntry> read(InputStream in) {
        Objects.requireNonNull(in, "in cannot be null");
        try {
            return read(in.readAllBytes());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read cohort stream", e);
        }
    }

    /**
     * Parse a cohort file.
     *
     * @throws UncheckedIOException if the file cannot be read
     * @throws IllegalArgumentException if parsing fails
     */
    public List<CohortEntry> read(Path file) {
        Objects.requireNonNull(file, "file cannot be null");
        try {
            List<CohortEntry> entries = read(Files.readAllBytes(file));
            logger.info("Loaded {} cohort entries from {}", entries.size(), file);
            return entries;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read cohort file " + file, e);
        }
    }

    /**
     * Parse a cohort from the classpath.
     *
     * @throws IllegalArgumentException if the resource does not exist or cannot be parsed
     */
    public List<CohortEntry> readResource(String name) {
        try (InputStream in = CohortReader.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalArgumentException("Cohort resource not found: " + name);
            }
            List<CohortEntry> entries = read(in);
            logger.debug("Loaded {} cohort entries from classpath:{}", entries.size(), name);
            return entries;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close cohort resource " + name, e);
        }
    }

    public List<CohortEntry> readSample() {
        return readResource(SAMPLE_COHORT);
    }

    private static List<CohortEntry> checked(List<CohortEntry> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("Cohort parsing failed: document is null");
        }
        int nullIndex = entries.indexOf(null);
        if (nullIndex >= 0) {
            throw new IllegalArgumentException("Cohort parsing failed: null entry at index " + nullIndex);
        }
        return List.copyOf(entries);
    }
}
