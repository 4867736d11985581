package triagescore.metrics;

/**
 * 5x5 confusion matrix of predicted against reference triage levels.
 * Rows are the reference level, columns the predicted level; levels 1..5 map to
 * indices 0..4. Pairs with a level outside 1..5 are skipped.
 *
 * <pre>
 * | Metric      | Formula                 |
 * |-------------|-------------------------|
 * | Sensitivity | TP / (TP + FN)          |
 * | Specificity | TN / (TN + FP)          |
 * | PPV         | TP / (TP + FP)          |
 * | NPV         | TN / (TN + FN)          |
 * | F1          | 2*PPV*Sens / (PPV+Sens) |
 * | Kappa       | (p_o - p_e) / (1 - p_e) |
 * </pre>
 * Ratios with a zero denominator are reported as 0.
 */
public final class ConfusionMatrix {

    private static final int LEVELS = 5;

    private final int[][] counts = new int[LEVELS][LEVELS];
    private int total;

    private ConfusionMatrix() {
    }

    /**
     * Build from paired level numbers.
     *
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public static ConfusionMatrix of(int[] predicted, int[] reference) {
        Agreement.checkSameLength(predicted.length, reference.length);
        ConfusionMatrix cm = new ConfusionMatrix();
        for (int k = 0; k < predicted.length; k++) {
            int p = predicted[k];
            int r = reference[k];
            if (!isLevel(p) || !isLevel(r)) {
                continue;
            }
            cm.counts[r - 1][p - 1]++;
            cm.total++;
        }
        return cm;
    }

    /**
     * Count where the reference was {@code referenceLevel} and the prediction {@code predictedLevel}.
     */
    public int count(int referenceLevel, int predictedLevel) {
        if (!isLevel(referenceLevel) || !isLevel(predictedLevel)) {
            return 0;
        }
        return counts[referenceLevel - 1][predictedLevel - 1];
    }

    public int total() {
        return total;
    }

    public int truePositives(int level) {
        if (!isLevel(level)) {
            return 0;
        }
        return counts[level - 1][level - 1];
    }

    /**
     * Predicted as {@code level} while the reference was another level.
     */
    public int falsePositives(int level) {
        if (!isLevel(level)) {
            return 0;
        }
        int i = level - 1;
        int fp = 0;
        for (int r = 0; r < LEVELS; r++) {
            if (r != i) {
                fp += counts[r][i];
            }
        }
        return fp;
    }

    /**
     * Reference was {@code level} while the prediction was another level.
     */
    public int falseNegatives(int level) {
        if (!isLevel(level)) {
            return 0;
        }
        int i = level - 1;
        int fn = 0;
        for (int c = 0; c < LEVELS; c++) {
            if (c != i) {
                fn += counts[i][c];
            }
        }
        return fn;
    }

    public int trueNegatives(int level) {
        if (!isLevel(level)) {
            return 0;
        }
        int i = level - 1;
        int tn = 0;
        for (int r = 0; r < LEVELS; r++) {
            for (int c = 0; c < LEVELS; c++) {
                if (r != i && c != i) {
                    tn += counts[r][c];
                }
            }
        }
        return tn;
    }

    public double sensitivity(int level) {
        return ratio(truePositives(level), truePositives(level) + falseNegatives(level));
    }

    public double specificity(int level) {
        return ratio(trueNegatives(level), trueNegatives(level) + falsePositives(level));
    }

    public double ppv(int level) {
        return ratio(truePositives(level), truePositives(level) + falsePositives(level));
    }

    public double npv(int level) {
        return ratio(trueNegatives(level), trueNegatives(level) + falseNegatives(level));
    }

    public double f1(int level) {
        double ppv = ppv(level);
        double sens = sensitivity(level);
        if (ppv + sens == 0) {
            return 0.0;
        }
        return 2 * ppv * sens / (ppv + sens);
    }

    /**
     * One-vs-rest accuracy for {@code level}: (TP + TN) / total.
     */
    public double accuracy(int level) {
        return ratio(truePositives(level) + trueNegatives(level), total);
    }

    public double macroSensitivity() {
        double sum = 0.0;
        for (int level = 1; level <= LEVELS; level++) {
            sum += sensitivity(level);
        }
        return sum / LEVELS;
    }

    public double macroSpecificity() {
        double sum = 0.0;
        for (int level = 1; level <= LEVELS; level++) {
            sum += specificity(level);
        }
        return sum / LEVELS;
    }

    /**
     * Fraction of pairs on the diagonal.
     */
    public double overallAccuracy() {
        int diagonal = 0;
        for (int i = 0; i < LEVELS; i++) {
            diagonal += counts[i][i];
        }
        return ratio(diagonal, total);
    }

    /**
     * Cohen's kappa; 0 for an empty matrix or when expected agreement is 1.
     */
    public double cohenKappa() {
        if (total == 0) {
            return 0.0;
        }
        double observed = overallAccuracy();
        double[] predictedTotals = new double[LEVELS];
        double[] referenceTotals = new double[LEVELS];
        for (int r = 0; r < LEVELS; r++) {
            for (int c = 0; c < LEVELS; c++) {
                predictedTotals[c] += counts[r][c];
                referenceTotals[r] += counts[r][c];
            }
        }
        double t = total;
        double expected = 0.0;
        for (int i = 0; i < LEVELS; i++) {
            expected += predictedTotals[i] * referenceTotals[i] / (t * t);
        }
        if (expected >= 1) {
            return 0.0;
        }
        return (observed - expected) / (1 - expected);
    }

    private static boolean isLevel(int level) {
        return level >= 1 && level <= LEVELS;
    }

    private static double ratio(int numerator, int denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
