package triagescore.export;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A set of results exported together.
 *
 * @param results   the evaluations
 * @param generated when the batch was produced
 * @param source    optional origin, e.g. a cohort file name
 */
public record ResultBatch(
        @JsonProperty("results") List<TriageResult> results,
        @JsonProperty("generated") Instant generated,
        @JsonProperty("source") String source
) {
    public ResultBatch {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static ResultBatch create(List<TriageResult> results, String source) {
        return new ResultBatch(results, Instant.now(), source);
    }
}
