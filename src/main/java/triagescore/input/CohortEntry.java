package triagescore.input;

import com.fasterxml.jackson.annotation.JsonProperty;
import triagescore.domain.Vitals;

/**
 * One patient observation in a cohort file. Absent fields read as 0 (missing).
 */
public record CohortEntry(
        @JsonProperty("id") String id,
        @JsonProperty("hr") int hr,
        @JsonProperty("rr") int rr,
        @JsonProperty("sbp") int sbp,
        @JsonProperty("dbp") int dbp,
        @JsonProperty("temp") double temp,
        @JsonProperty("spo2") int spo2,
        @JsonProperty("gcs") int gcs,
        @JsonProperty("resource_count") int resourceCount
) {

    public static CohortEntry of(String id, Vitals vitals, int resourceCount) {
        return new CohortEntry(id, vitals.heartRate(), vitals.respiratoryRate(), vitals.systolic(),
                vitals.diastolic(), vitals.temperature(), vitals.spo2(), vitals.gcs(), resourceCount);
    }

    public Vitals toVitals() {
        return new Vitals(hr, rr, sbp, dbp, temp, spo2, gcs);
    }
}
