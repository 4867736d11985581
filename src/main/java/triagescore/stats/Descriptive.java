package triagescore.stats;

import java.util.Arrays;
import java.util.function.DoublePredicate;

/**
 * Descriptive statistics over score arrays. Inputs are never modified.
 *
 * <pre>
 * Mean:     (1/n) * sum(x)
 * Variance: (1/(n-1)) * sum((x - mean)^2)   sample variance
 * SE:       stdDev / sqrt(n)
 * 95% CI:   mean +/- 1.96 * SE               normal approximation
 * </pre>
 * Empty input yields 0 rather than NaN throughout.
 */
public final class Descriptive {

    private static final double Z_95 = 1.96;

    private Descriptive() {
    }

    public static double mean(double[] x) {
        if (x.length == 0) {
            return 0.0;
        }
        return sum(x) / x.length;
    }

    /**
     * Sample variance; 0 for fewer than two values.
     */
    public static double variance(double[] x) {
        if (x.length < 2) {
            return 0.0;
        }
        double mu = mean(x);
        double sum = 0.0;
        for (double v : x) {
            double d = v - mu;
            sum += d * d;
        }
        return sum / (x.length - 1);
    }

    public static double stdDev(double[] x) {
        return Math.sqrt(variance(x));
    }

    /**
     * Standard error of the mean; 0 for fewer than two values.
     */
    public static double standardError(double[] x) {
        if (x.length < 2) {
            return 0.0;
        }
        return stdDev(x) / Math.sqrt(x.length);
    }

    /**
     * Approximate 95% confidence interval for the mean as {@code [low, high]};
     * {@code [0, 0]} for fewer than two values.
     */
    public static double[] ci95(double[] x) {
        if (x.length < 2) {
            return new double[]{0.0, 0.0};
        }
        double mu = mean(x);
        double se = standardError(x);
        return new double[]{mu - Z_95 * se, mu + Z_95 * se};
    }

    public static double median(double[] x) {
        if (x.length == 0) {
            return 0.0;
        }
        double[] sorted = sorted(x);
        int n = sorted.length;
        if (n % 2 == 1) {
            return sorted[n / 2];
        }
        return (sorted[n / 2 - 1] + sorted[n / 2]) / 2;
    }

    /**
     * The p-th percentile (0..100) by linear interpolation between order statistics.
     * Returns 0 for empty input or p outside [0, 100].
     */
    public static double percentile(double[] x, double p) {
        if (x.length == 0 || p < 0 || p > 100) {
            return 0.0;
        }
        double[] sorted = sorted(x);
        double idx = p / 100 * (sorted.length - 1);
        int i = (int) idx;
        if (i >= sorted.length - 1) {
            return sorted[sorted.length - 1];
        }
        double w = idx - i;
        return sorted[i] * (1 - w) + sorted[i + 1] * w;
    }

    public static double min(double[] x) {
        return Arrays.stream(x).min().orElse(0.0);
    }

    public static double max(double[] x) {
        return Arrays.stream(x).max().orElse(0.0);
    }

    public static double sum(double[] x) {
        double s = 0.0;
        for (double v : x) {
            s += v;
        }
        return s;
    }

    public static long count(double[] x, DoublePredicate predicate) {
        return Arrays.stream(x).filter(predicate).count();
    }

    /**
     * Pearson correlation; 0 when lengths differ, n &lt; 2, or either side is constant.
     */
    public static double pearson(double[] x, double[] y) {
        if (x.length != y.length || x.length < 2) {
            return 0.0;
        }
        double mx = mean(x);
        double my = mean(y);
        double sumXY = 0.0;
        double sumX2 = 0.0;
        double sumY2 = 0.0;
        for (int i = 0; i < x.length; i++) {
            double dx = x[i] - mx;
            double dy = y[i] - my;
            sumXY += dx * dy;
            sumX2 += dx * dx;
            sumY2 += dy * dy;
        }
        if (sumX2 == 0 || sumY2 == 0) {
            return 0.0;
        }
        return sumXY / (Math.sqrt(sumX2) * Math.sqrt(sumY2));
    }

    public static double rmse(double[] predicted, double[] reference) {
        if (predicted.length != reference.length || predicted.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = 0; i < predicted.length; i++) {
            double d = predicted[i] - reference[i];
            sum += d * d;
        }
        return Math.sqrt(sum / predicted.length);
    }

    public static double mae(double[] predicted, double[] reference) {
        if (predicted.length != reference.length || predicted.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = 0; i < predicted.length; i++) {
            sum += Math.abs(predicted[i] - reference[i]);
        }
        return sum / predicted.length;
    }

    /**
     * Proportion of pairs with {@code |predicted - reference| <= tolerance}.
     */
    public static double withinTolerance(double[] predicted, double[] reference, double tolerance) {
        if (predicted.length != reference.length || predicted.length == 0) {
            return 0.0;
        }
        int c = 0;
        for (int i = 0; i < predicted.length; i++) {
            if (Math.abs(predicted[i] - reference[i]) <= tolerance) {
                c++;
            }
        }
        return (double) c / predicted.length;
    }

    /**
     * Proportion of identical level pairs.
     */
    public static double exactAgreement(int[] predicted, int[] reference) {
        return levelAgreement(predicted, reference, 0);
    }

    /**
     * Proportion of level pairs at most one level apart.
     */
    public static double withinOneLevel(int[] predicted, int[] reference) {
        return levelAgreement(predicted, reference, 1);
    }

    private static double levelAgreement(int[] predicted, int[] reference, int maxDistance) {
        if (predicted.length != reference.length || predicted.length == 0) {
            return 0.0;
        }
        int c = 0;
        for (int i = 0; i < predicted.length; i++) {
            if (Math.abs(predicted[i] - reference[i]) <= maxDistance) {
                c++;
            }
        }
        return (double) c / predicted.length;
    }

    private static double[] sorted(double[] x) {
        double[] copy = x.clone();
        Arrays.sort(copy);
        return copy;
    }
}
