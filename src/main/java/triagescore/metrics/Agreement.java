package triagescore.metrics;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Agreement and discrimination measures over paired outputs.
 * Each method takes equal-length arrays and rejects mismatched ones.
 */
public final class Agreement {

    private Agreement() {
    }

    /**
     * Linearly weighted kappa with {@code weight(p, r) = max(0, 1 - |p - r| / 4)}.
     * Levels outside 1..5 count as 3 in the observed term and are left out of the
     * marginals. Returns 0 for empty input or when expected agreement is 1.
     *
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public static double weightedKappa(int[] predicted, int[] reference) {
        checkSameLength(predicted.length, reference.length);
        if (predicted.length == 0) {
            return 0.0;
        }
        double n = predicted.length;
        double observed = 0.0;
        double[] predictedCounts = new double[6];
        double[] referenceCounts = new double[6];
        for (int i = 0; i < predicted.length; i++) {
            observed += kappaWeight(orMiddle(predicted[i]), orMiddle(reference[i]));
            if (isLevel(predicted[i])) {
                predictedCounts[predicted[i]]++;
            }
            if (isLevel(reference[i])) {
                referenceCounts[reference[i]]++;
            }
        }
        observed /= n;

        double expected = 0.0;
        for (int p = 1; p <= 5; p++) {
            for (int r = 1; r <= 5; r++) {
                expected += (predictedCounts[p] / n) * (referenceCounts[r] / n) * kappaWeight(p, r);
            }
        }
        if (expected >= 1) {
            return 0.0;
        }
        return (observed - expected) / (1 - expected);
    }

    /**
     * Area under the ROC curve by rank statistics; tied scores share their average rank.
     * Outcomes are 1 (positive) or anything else (negative). Returns 0.5 when either
     * class is empty.
     *
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public static double auc(double[] scores, int[] outcomes) {
        checkSameLength(scores.length, outcomes.length);
        int n = scores.length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> scores[i]));

        int positives = 0;
        double positiveRankSum = 0.0;
        int i = 0;
        while (i < n) {
            int j = i;
            while (j + 1 < n && scores[order[j + 1]] == scores[order[i]]) {
                j++;
            }
            double averageRank = (i + j) / 2.0 + 1.0;
            for (int k = i; k <= j; k++) {
                if (outcomes[order[k]] == 1) {
                    positives++;
                    positiveRankSum += averageRank;
                }
            }
            i = j + 1;
        }
        int negatives = n - positives;
        if (positives == 0 || negatives == 0) {
            return 0.5;
        }
        double u = positiveRankSum - positives * (positives + 1) / 2.0;
        return u / ((double) positives * negatives);
    }

    /**
     * Mean absolute difference between score (clamped to [0, 1]) and binary outcome.
     * Returns 0 for empty input.
     *
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public static double calibrationError(double[] scores, int[] outcomes) {
        checkSameLength(scores.length, outcomes.length);
        if (scores.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = 0; i < scores.length; i++) {
            double outcome = outcomes[i] == 1 ? 1.0 : 0.0;
            double s = Math.max(0.0, Math.min(1.0, scores[i]));
            sum += Math.abs(s - outcome);
        }
        return sum / scores.length;
    }

    static void checkSameLength(int predictedLength, int referenceLength) {
        if (predictedLength != referenceLength) {
            throw new IllegalArgumentException(String.format(
                    "Paired inputs must have the same length (%d != %d)", predictedLength, referenceLength));
        }
    }

    private static double kappaWeight(int p, int r) {
        return Math.max(0.0, 1.0 - Math.abs(p - r) / 4.0);
    }

    private static int orMiddle(int level) {
        return isLevel(level) ? level : 3;
    }

    private static boolean isLevel(int level) {
        return level >= 1 && level <= 5;
    }
}
