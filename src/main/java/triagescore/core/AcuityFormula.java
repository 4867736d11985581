package triagescore.core;

import triagescore.domain.ReferenceRange;
import triagescore.domain.ReferenceRanges;
import triagescore.domain.Vital;
import triagescore.domain.Vitals;

/**
 * The parametric acuity formula.
 *
 * <p>The vital component V is the weighted mean deviation over the vitals that
 * are present and have an enabled range, normalized by the weights of those
 * vitals only. The resource component R saturates at the resource weight. The
 * final score divides {@code V + R} by the weight sum of all seven vitals plus
 * the resource weight, so sparse observations cannot reach extreme scores on
 * their own.
 *
 * <p>All methods are pure and total: any finite input yields a finite result.
 */
public final class AcuityFormula {

    private AcuityFormula() {
    }

    /**
     * Weighted mean deviation over present vitals with enabled ranges, in [0, 1].
     * Returns 0 if the weight of the contributing vitals is not positive.
     */
    public static double vitalComponent(Vitals vitals, TriageParams params, ReferenceRanges ranges) {
        double sum = 0.0;
        double weightSum = 0.0;
        for (Vital vital : Vital.values()) {
            ReferenceRange range = ranges.of(vital);
            if (!vitals.isPresent(vital) || !range.isEnabled()) {
                continue;
            }
            double w = params.weight(vital);
            sum += w * range.deviation(vitals.value(vital));
            weightSum += w;
        }
        if (weightSum <= 0) {
            return 0.0;
        }
        double v = sum / weightSum;
        // overflowing weights give NaN
        if (!(v >= 0.0)) {
            return 0.0;
        }
        return v > 1.0 ? 1.0 : v;
    }

    /**
     * {@code resourceWeight * min(1, resourceCount / maxResources)}; 0 when any of
     * the three inputs is not positive.
     */
    public static double resourceComponent(int resourceCount, int maxResources, double resourceWeight) {
        if (maxResources <= 0 || resourceWeight <= 0 || resourceCount <= 0) {
            return 0.0;
        }
        double r = (double) resourceCount / maxResources;
        return resourceWeight * (r > 1.0 ? 1.0 : r);
    }

    /**
     * Map a raw score to [0, 1] by the divisor; 0 if the divisor is not positive
     * or the quotient is NaN.
     */
    public static double normalize(double raw, double divisor) {
        if (!(divisor > 0)) {
            return 0.0;
        }
        double s = raw / divisor;
        if (!(s >= 0.0)) {
            return 0.0;
        }
        return s > 1.0 ? 1.0 : s;
    }

    /**
     * Normalized acuity score in [0, 1].
     */
    public static double acuity(Vitals vitals, int resourceCount, TriageParams params, ReferenceRanges ranges) {
        double v = vitalComponent(vitals, params, ranges);
        double r = resourceComponent(resourceCount, params.maxResources(), params.resourceWeight());
        return normalize(v + r, params.divisor());
    }
}
