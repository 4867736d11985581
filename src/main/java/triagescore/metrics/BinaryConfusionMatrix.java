package triagescore.metrics;

import java.util.Set;

/**
 * 2x2 confusion matrix for a binary split of the levels, e.g. high acuity (1-2) against the rest.
 */
public record BinaryConfusionMatrix(int truePositives, int falsePositives, int falseNegatives, int trueNegatives) {

    /**
     * Levels 1 and 2.
     */
    public static final Set<Integer> HIGH_ACUITY = Set.of(1, 2);

    /**
     * Build by treating the levels in {@code positive} as the positive class.
     * Pairs with a level outside 1..5 are skipped.
     *
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public static BinaryConfusionMatrix of(int[] predicted, int[] reference, Set<Integer> positive) {
        Agreement.checkSameLength(predicted.length, reference.length);
        int tp = 0;
        int fp = 0;
        int fn = 0;
        int tn = 0;
        for (int k = 0; k < predicted.length; k++) {
            int p = predicted[k];
            int r = reference[k];
            if (p < 1 || p > 5 || r < 1 || r > 5) {
                continue;
            }
            boolean predictedPositive = positive.contains(p);
            boolean referencePositive = positive.contains(r);
            if (referencePositive && predictedPositive) {
                tp++;
            } else if (predictedPositive) {
                fp++;
            } else if (referencePositive) {
                fn++;
            } else {
                tn++;
            }
        }
        return new BinaryConfusionMatrix(tp, fp, fn, tn);
    }

    public int total() {
        return truePositives + falsePositives + falseNegatives + trueNegatives;
    }

    public double sensitivity() {
        return ratio(truePositives, truePositives + falseNegatives);
    }

    public double specificity() {
        return ratio(trueNegatives, trueNegatives + falsePositives);
    }

    public double ppv() {
        return ratio(truePositives, truePositives + falsePositives);
    }

    public double npv() {
        return ratio(trueNegatives, trueNegatives + falseNegatives);
    }

    public double f1() {
        double s = sensitivity();
        double p = ppv();
        return s + p == 0 ? 0.0 : 2 * s * p / (s + p);
    }

    public double accuracy() {
        return ratio(truePositives + trueNegatives, total());
    }

    private static double ratio(int numerator, int denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
