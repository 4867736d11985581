package triagescore.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Per-level summary row: count, share of all results in percent, and acuity range.
 */
@JsonPropertyOrder({"level", "level_label", "count", "pct", "mean_acuity", "min_acuity", "max_acuity"})
public record LevelReportRow(
        @JsonProperty("level") int level,
        @JsonProperty("level_label") String levelLabel,
        @JsonProperty("count") int count,
        @JsonProperty("pct") double pct,
        @JsonProperty("mean_acuity") double meanAcuity,
        @JsonProperty("min_acuity") double minAcuity,
        @JsonProperty("max_acuity") double maxAcuity
) {
}
