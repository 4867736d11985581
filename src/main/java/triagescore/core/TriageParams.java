package triagescore.core;

import triagescore.domain.Thresholds;
import triagescore.domain.TriageLevel;
import triagescore.domain.Vital;
import triagescore.validate.ParamsDescriptor;
import triagescore.validate.ParamsValidator;

import java.util.Arrays;
import java.util.Objects;

/**
 * Tunable parameters for acuity scoring and level assignment.
 *
 * <p>Instances are immutable. Construction does not validate: build through
 * {@link #builder()} or {@link #toBuilder()}, then call {@link #validate()} before
 * handing the parameters to a {@link ScoringEngine}. Invalid sets still score
 * without failing, but the results are meaningless.
 *
 * <pre>
 * | Field           | Valid range                                   |
 * |-----------------|-----------------------------------------------|
 * | vital weights   | each in [0, 1]; order HR, RR, SBP, DBP, Temp, SpO2, GCS |
 * | maxResources    | &gt;= 0                                       |
 * | resourceWeight  | &gt;= 0                                       |
 * | T1..T4          | 1 &gt;= T1 &gt; T2 &gt; T3 &gt; T4 &gt; 0     |
 * </pre>
 */
public final class TriageParams {

    private static final double[] DEFAULT_WEIGHTS = {0.18, 0.22, 0.16, 0.10, 0.08, 0.16, 0.10};
    private static final int DEFAULT_MAX_RESOURCES = 6;
    private static final double DEFAULT_RESOURCE_WEIGHT = 0.25;

    private static final TriageParams DEFAULT = builder()
            .thresholds(0.85, 0.60, 0.35, 0.15)
            .build();
    private static final TriageParams STRICT = DEFAULT.toBuilder()
            .thresholds(0.80, 0.55, 0.30, 0.12)
            .build();
    private static final TriageParams LENIENT = DEFAULT.toBuilder()
            .thresholds(0.90, 0.68, 0.42, 0.18)
            .build();
    private static final TriageParams RESEARCH = DEFAULT.toBuilder()
            .thresholds(0.80, 0.60, 0.40, 0.20)
            .build();

    private final double[] vitalWeights;
    private final int maxResources;
    private final double resourceWeight;
    private final Thresholds thresholds;

    private TriageParams(double[] vitalWeights, int maxResources, double resourceWeight, Thresholds thresholds) {
        this.vitalWeights = vitalWeights.clone();
        this.maxResources = maxResources;
        this.resourceWeight = resourceWeight;
        this.thresholds = thresholds;
    }

    /**
     * Parameters for a typical five-level emergency department triage.
     */
    public static TriageParams defaults() {
        return DEFAULT;
    }

    /**
     * Lower thresholds than default: more patients classified as high acuity.
     * Use when under-triage must be minimised.
     */
    public static TriageParams strict() {
        return STRICT;
    }

    /**
     * Higher thresholds than default: fewer patients classified as high acuity.
     * Use when over-triage is a concern.
     */
    public static TriageParams lenient() {
        return LENIENT;
    }

    /**
     * Equal level widths of 0.2 for balanced research cohorts.
     */
    public static TriageParams research() {
        return RESEARCH;
    }

    /**
     * Builder preloaded with the default weights and resource settings.
     */
    public static Builder builder() {
        return new Builder(DEFAULT_WEIGHTS, DEFAULT_MAX_RESOURCES, DEFAULT_RESOURCE_WEIGHT,
                new Thresholds(0.85, 0.60, 0.35, 0.15));
    }

    public Builder toBuilder() {
        return new Builder(vitalWeights, maxResources, resourceWeight, thresholds);
    }

    /**
     * True if every field is within its admissible range.
     */
    public boolean validate() {
        if (maxResources < 0 || resourceWeight < 0) {
            return false;
        }
        for (double w : vitalWeights) {
            if (w < 0 || w > 1) {
                return false;
            }
        }
        return thresholds.isOrdered();
    }

    /**
     * Run the standalone {@link ParamsValidator} on these parameters.
     * Stricter than {@link #validate()} in that non-finite weights also fail.
     */
    public boolean validateExternally() {
        return ParamsValidator.isValid(toDescriptor());
    }

    public ParamsDescriptor toDescriptor() {
        return new ParamsDescriptor(vitalWeights, maxResources, resourceWeight,
                thresholds.t1(), thresholds.t2(), thresholds.t3(), thresholds.t4());
    }

    public double weight(Vital vital) {
        return vitalWeights[vital.index()];
    }

    /**
     * Copy of the weight vector in index order.
     */
    public double[] vitalWeights() {
        return vitalWeights.clone();
    }

    public int maxResources() {
        return maxResources;
    }

    public double resourceWeight() {
        return resourceWeight;
    }

    public Thresholds thresholds() {
        return thresholds;
    }

    /**
     * Sum of the seven vital weights.
     */
    public double weightSum() {
        double sum = 0.0;
        for (double w : vitalWeights) {
            sum += w;
        }
        return sum;
    }

    /**
     * Normalization denominator shared by every score: {@code weightSum() + resourceWeight}.
     */
    public double divisor() {
        return weightSum() + resourceWeight;
    }

    public TriageLevel classify(double score) {
        return TriageLevel.fromScore(score, thresholds);
    }

    /**
     * Score interval {lower, upper} that maps to {@code level}.
     */
    public double[] bandFor(TriageLevel level) {
        return thresholds.band(level);
    }

    /**
     * Piecewise-linear 1..5 display value; 1 at the top of the scale.
     */
    public double continuousLevel(double score) {
        return thresholds.continuousLevel(score);
    }

    public boolean isStricterThan(TriageParams other) {
        return thresholds.isStricterThan(other.thresholds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TriageParams other)) return false;
        return maxResources == other.maxResources
                && Double.compare(resourceWeight, other.resourceWeight) == 0
                && Arrays.equals(vitalWeights, other.vitalWeights)
                && thresholds.equals(other.thresholds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(vitalWeights), maxResources, resourceWeight, thresholds);
    }

    @Override
    public String toString() {
        return String.format("TriageParams{weights=%s, maxResources=%d, resourceWeight=%.3f, thresholds=%s}",
                Arrays.toString(vitalWeights), maxResources, resourceWeight, thresholds);
    }

    /**
     * Unchecked builder. Any state is accepted, so tuning code can pass through
     * invalid configurations; validate the built instance before use.
     */
    public static final class Builder {
        private final double[] vitalWeights;
        private int maxResources;
        private double resourceWeight;
        private Thresholds thresholds;

        private Builder(double[] vitalWeights, int maxResources, double resourceWeight, Thresholds thresholds) {
            this.vitalWeights = vitalWeights.clone();
            this.maxResources = maxResources;
            this.resourceWeight = resourceWeight;
            this.thresholds = thresholds;
        }

        public Builder weight(Vital vital, double weight) {
            vitalWeights[vital.index()] = weight;
            return this;
        }

        /**
         * Replace all seven weights.
         *
         * @throws IllegalArgumentException if the array does not have seven elements
         */
        public Builder weights(double... weights) {
            if (weights == null || weights.length != Vital.COUNT) {
                throw new IllegalArgumentException("Exactly " + Vital.COUNT + " vital weights are required");
            }
            System.arraycopy(weights, 0, vitalWeights, 0, Vital.COUNT);
            return this;
        }

        public Builder maxResources(int maxResources) {
            this.maxResources = maxResources;
            return this;
        }

        public Builder resourceWeight(double resourceWeight) {
            this.resourceWeight = resourceWeight;
            return this;
        }

        public Builder thresholds(double t1, double t2, double t3, double t4) {
            this.thresholds = new Thresholds(t1, t2, t3, t4);
            return this;
        }

        public Builder thresholds(Thresholds thresholds) {
            this.thresholds = Objects.requireNonNull(thresholds, "thresholds cannot be null");
            return this;
        }

        /**
         * Multiply all weights by {@code factor}, then rescale so the largest is 1.0.
         * No-op if {@code factor <= 0}.
         */
        public Builder scaleWeights(double factor) {
            if (factor <= 0) {
                return this;
            }
            double max = 0.0;
            for (int i = 0; i < vitalWeights.length; i++) {
                vitalWeights[i] *= factor;
                max = Math.max(max, vitalWeights[i]);
            }
            if (max > 0) {
                for (int i = 0; i < vitalWeights.length; i++) {
                    vitalWeights[i] /= max;
                }
            }
            return this;
        }

        /**
         * Rescale weights to sum to 1.0. No-op if the sum is not positive.
         */
        public Builder normalizeWeights() {
            double sum = 0.0;
            for (double w : vitalWeights) {
                sum += w;
            }
            if (sum <= 0) {
                return this;
            }
            for (int i = 0; i < vitalWeights.length; i++) {
                vitalWeights[i] /= sum;
            }
            return this;
        }

        /**
         * Set every weight to 1/7, a neutral baseline.
         */
        public Builder uniformWeights() {
            Arrays.fill(vitalWeights, 1.0 / Vital.COUNT);
            return this;
        }

        /**
         * Space T4..T1 evenly in log-space between {@code min} and {@code max}.
         * No-op unless {@code 0 < min < max <= 1}.
         */
        public Builder geometricThresholds(double min, double max) {
            if (min <= 0 || max <= min || max > 1) {
                return this;
            }
            double logMin = Math.log(min);
            double step = (Math.log(max) - logMin) / 5;
            double t4 = Math.exp(logMin + step);
            double t3 = Math.exp(logMin + 2 * step);
            double t2 = Math.exp(logMin + 3 * step);
            double t1 = Math.min(1.0, Math.exp(logMin + 4 * step));
            this.thresholds = new Thresholds(t1, t2, t3, t4);
            return this;
        }

        public TriageParams build() {
            return new TriageParams(vitalWeights, maxResources, resourceWeight, thresholds);
        }
    }
}
