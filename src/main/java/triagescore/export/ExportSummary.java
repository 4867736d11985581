package triagescore.export;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Aggregate view of exported results.
 *
 * @param n                 number of results
 * @param meanAcuity        mean score
 * @param minAcuity         lowest score
 * @param maxAcuity         highest score
 * @param levelDistribution counts indexed by level number, index 0 unused
 */
public record ExportSummary(
        @JsonProperty("n") int n,
        @JsonProperty("mean_acuity") double meanAcuity,
        @JsonProperty("min_acuity") double minAcuity,
        @JsonProperty("max_acuity") double maxAcuity,
        @JsonProperty("level_dist") int[] levelDistribution
) {
    public ExportSummary {
        levelDistribution = levelDistribution.clone();
    }

    public static ExportSummary of(List<TriageResult> results) {
        int[] distribution = new int[6];
        if (results.isEmpty()) {
            return new ExportSummary(0, 0.0, 0.0, 0.0, distribution);
        }
        double sum = 0.0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (TriageResult r : results) {
            sum += r.acuity();
            min = Math.min(min, r.acuity());
            max = Math.max(max, r.acuity());
            if (r.level() >= 1 && r.level() <= 5) {
                distribution[r.level()]++;
            }
        }
        return new ExportSummary(results.size(), sum / results.size(), min, max, distribution);
    }

    @Override
    public int[] levelDistribution() {
        return levelDistribution.clone();
    }
}
