package triagescore.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagescore.domain.TriageLevel;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON and CSV serialization of triage results.
 * Timestamps are written as ISO-8601 strings; absent optional fields are omitted
 * from JSON and left empty in CSV.
 */
public final class ResultExporter {
    private static final Logger logger = LoggerFactory.getLogger(ResultExporter.class);

    // Shared mappers, configured for Java Time as ISO-8601
    private static final ObjectMapper JSON = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final CsvMapper CSV = (CsvMapper) new CsvMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private ResultExporter() {
    }

    public static String toJson(TriageResult result) {
        return write(result);
    }

    public static String toJson(List<TriageResult> results) {
        return write(results);
    }

    public static String toJson(ResultBatch batch) {
        return write(batch);
    }

    public static String toJson(ExportSummary summary) {
        return write(summary);
    }

    /**
     * Parse a single result.
     *
     * @throws IllegalArgumentException if the text is not a valid result
     */
    public static TriageResult fromJson(String json) {
        try {
            return JSON.readValue(json, TriageResult.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Result parsing failed: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse a batch written by {@link #toJson(ResultBatch)}.
     *
     * @throws IllegalArgumentException if the text is not a valid batch
     */
    public static ResultBatch readBatch(String json) {
        try {
            return JSON.readValue(json, ResultBatch.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Batch parsing failed: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * The CSV header line, without line terminator.
     */
    public static String csvHeader() {
        return String.join(",", resultSchema().getColumnNames());
    }

    /**
     * Write results as CSV with a header row. The writer is flushed but not closed.
     */
    public static void writeCsv(Writer out, List<TriageResult> results) {
        writeRows(out, results, TriageResult.class);
        logger.debug("Wrote {} result rows as CSV", results.size());
    }

    public static String toCsv(List<TriageResult> results) {
        StringWriter out = new StringWriter();
        writeCsv(out, results);
        return out.toString();
    }

    /**
     * One row per level 1..5, in level order, including levels with no results.
     * Percentages are of all results; acuity columns are 0 for empty levels.
     */
    public static List<LevelReportRow> levelReport(List<TriageResult> results) {
        List<LevelReportRow> rows = new ArrayList<>(TriageLevel.values().length);
        int total = results.size();
        for (TriageLevel level : TriageLevel.values()) {
            int count = 0;
            double sum = 0.0;
            double min = Double.MAX_VALUE;
            double max = -Double.MAX_VALUE;
            for (TriageResult r : results) {
                if (r.level() == level.number()) {
                    count++;
                    sum += r.acuity();
                    min = Math.min(min, r.acuity());
                    max = Math.max(max, r.acuity());
                }
            }
            if (count == 0) {
                rows.add(new LevelReportRow(level.number(), level.label(), 0, 0.0, 0.0, 0.0, 0.0));
            } else {
                double pct = 100.0 * count / total;
                rows.add(new LevelReportRow(level.number(), level.label(), count, pct, sum / count, min, max));
            }
        }
        return rows;
    }

    public static void writeLevelReportCsv(Writer out, List<LevelReportRow> rows) {
        writeRows(out, rows, LevelReportRow.class);
    }

    public static ExportSummary computeSummary(List<TriageResult> results) {
        return ExportSummary.of(results);
    }

    private static CsvSchema resultSchema() {
        return CSV.schemaFor(TriageResult.class).withHeader();
    }

    private static <T> void writeRows(Writer out, List<T> rows, Class<T> type) {
        ObjectWriter writer = CSV.writer(CSV.schemaFor(type).withHeader())
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        try (SequenceWriter sequence = writer.writeValues(out)) {
            sequence.writeAll(rows);
        } catch (IOException e) {
            logger.error("Failed to write CSV", e);
            throw new UncheckedIOException("CSV export failed", e);
        }
    }

    private static String write(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("JSON serialization error", e);
        }
    }
}
