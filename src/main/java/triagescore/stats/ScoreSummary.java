package triagescore.stats;

/**
 * Summary statistics of a set of acuity scores.
 */
public record ScoreSummary(
        int n,
        double mean,
        double stdDev,
        double standardError,
        double ci95Low,
        double ci95High,
        double min,
        double max,
        double p25,
        double p50,
        double p75
) {
    private static final ScoreSummary EMPTY = new ScoreSummary(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    public static ScoreSummary of(double[] scores) {
        if (scores.length == 0) {
            return EMPTY;
        }
        double[] ci = Descriptive.ci95(scores);
        return new ScoreSummary(
                scores.length,
                Descriptive.mean(scores),
                Descriptive.stdDev(scores),
                Descriptive.standardError(scores),
                ci[0],
                ci[1],
                Descriptive.min(scores),
                Descriptive.max(scores),
                Descriptive.percentile(scores, 25),
                Descriptive.percentile(scores, 50),
                Descriptive.percentile(scores, 75)
        );
    }
}
