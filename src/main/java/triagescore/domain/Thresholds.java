package triagescore.domain;

/**
 * The four score cut points separating the five triage levels.
 * A usable set satisfies {@code 1 >= t1 > t2 > t3 > t4 > 0}; construction does not enforce it.
 *
 * @param t1 lower bound of level 1
 * @param t2 lower bound of level 2
 * @param t3 lower bound of level 3
 * @param t4 lower bound of level 4
 */
public record Thresholds(double t1, double t2, double t3, double t4) {

    /**
     * Whether the cut points are strictly decreasing, positive and at most 1.
     */
    public boolean isOrdered() {
        return t1 > t2 && t2 > t3 && t3 > t4 && t4 > 0 && t1 <= 1;
    }

    /**
     * True if every cut point is lower than the other's, so more scores land in urgent levels.
     */
    public boolean isStricterThan(Thresholds other) {
        return t1 < other.t1 && t2 < other.t2 && t3 < other.t3 && t4 < other.t4;
    }

    public double[] toArray() {
        return new double[]{t1, t2, t3, t4};
    }

    /**
     * Build from an array of exactly four values.
     *
     * @throws IllegalArgumentException if the array does not have four elements
     */
    public static Thresholds of(double[] values) {
        if (values == null || values.length != 4) {
            throw new IllegalArgumentException("Exactly four thresholds are required");
        }
        return new Thresholds(values[0], values[1], values[2], values[3]);
    }

    /**
     * Score interval {@code [lower, upper)} of a level; level 1 is closed at 1.0.
     */
    public double[] band(TriageLevel level) {
        return switch (level) {
            case RESUSCITATION -> new double[]{t1, 1.0};
            case EMERGENT -> new double[]{t2, t1};
            case URGENT -> new double[]{t3, t2};
            case LESS_URGENT -> new double[]{t4, t3};
            case NON_URGENT -> new double[]{0.0, t4};
        };
    }

    /**
     * Continuous level in [1, 5] by linear interpolation inside each band.
     * For display or smoothing only; use {@link TriageLevel#fromScore} for the discrete level.
     */
    public double continuousLevel(double score) {
        if (score >= t1) {
            return t1 >= 1.0 ? 1.0 : 1.0 + (1.0 - score) / (1.0 - t1) * 0.5;
        }
        if (score >= t2) {
            return 1.5 + (t1 - score) / (t1 - t2) * 0.5;
        }
        if (score >= t3) {
            return 2.0 + (t2 - score) / (t2 - t3) * 0.5;
        }
        if (score >= t4) {
            return 2.5 + (t3 - score) / (t3 - t4) * 0.5;
        }
        return 3.0 + (t4 - score) / t4 * 2.0;
    }
}
