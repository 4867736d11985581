package triagescore.export;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import triagescore.domain.Evaluation;
import triagescore.domain.TriageLevel;
import triagescore.domain.Vitals;

import java.time.Instant;
import java.util.Optional;

/**
 * Flat record of one evaluation for JSON or CSV export.
 * Property order is the CSV column order.
 */
@JsonPropertyOrder({"hr", "rr", "sbp", "dbp", "temp", "spo2", "gcs",
        "resource_count", "acuity", "level", "level_label", "timestamp", "id"})
public record TriageResult(
        @JsonProperty("hr") int hr,
        @JsonProperty("rr") int rr,
        @JsonProperty("sbp") int sbp,
        @JsonProperty("dbp") int dbp,
        @JsonProperty("temp") double temp,
        @JsonProperty("spo2") int spo2,
        @JsonProperty("gcs") int gcs,
        @JsonProperty("resource_count") int resourceCount,
        @JsonProperty("acuity") double acuity,
        @JsonProperty("level") int level,
        @JsonProperty("level_label") String levelLabel,
        @JsonProperty("timestamp") Instant timestamp,  // optional
        @JsonProperty("id") String id                  // optional, e.g. encounter id
) {

    /**
     * Build from the scored observation, without timestamp or id.
     */
    public static TriageResult of(Vitals vitals, int resourceCount, Evaluation evaluation) {
        return new TriageResult(
                vitals.heartRate(),
                vitals.respiratoryRate(),
                vitals.systolic(),
                vitals.diastolic(),
                vitals.temperature(),
                vitals.spo2(),
                vitals.gcs(),
                resourceCount,
                evaluation.score(),
                evaluation.level().number(),
                evaluation.level().label(),
                null,
                null
        );
    }

    public TriageResult withTimestamp(Instant timestamp) {
        return new TriageResult(hr, rr, sbp, dbp, temp, spo2, gcs, resourceCount,
                acuity, level, levelLabel, timestamp, id);
    }

    public TriageResult withId(String id) {
        return new TriageResult(hr, rr, sbp, dbp, temp, spo2, gcs, resourceCount,
                acuity, level, levelLabel, timestamp, id);
    }

    /**
     * The observation, for re-scoring or validation.
     */
    public Vitals toVitals() {
        return new Vitals(hr, rr, sbp, dbp, temp, spo2, gcs);
    }

    @JsonIgnore
    public Optional<TriageLevel> triageLevel() {
        return TriageLevel.fromNumber(level);
    }

    /**
     * Convert this record to its JSON representation.
     */
    public String toJSON() {
        return ResultExporter.toJson(this);
    }
}
