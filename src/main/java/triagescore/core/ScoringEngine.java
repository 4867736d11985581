package triagescore.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagescore.domain.Evaluation;
import triagescore.domain.ReferenceRanges;
import triagescore.domain.TriageLevel;
import triagescore.domain.Vitals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Evaluates acuity score and triage level from vitals and an expected resource count.
 * Holds one immutable parameter set and one set of reference ranges, so a single
 * engine can be shared by any number of threads.
 *
 * <pre>
 * | Method                    | Returns                 |
 * |---------------------------|-------------------------|
 * | acuity                    | score in [0, 1]         |
 * | level                     | triage level 1..5       |
 * | evaluate                  | score and level         |
 * | batchEvaluate             | index-aligned results   |
 * | parallelBatchEvaluate     | same, computed in parallel |
 * </pre>
 */
public class ScoringEngine {
    private static final Logger logger = LoggerFactory.getLogger(ScoringEngine.class);

    private final TriageParams params;
    private final ReferenceRanges ranges;

    /**
     * Create an engine using adult reference ranges.
     *
     * @param params the scoring parameters; validate them first
     */
    public ScoringEngine(TriageParams params) {
        this(params, ReferenceRanges.adult());
    }

    /**
     * Create an engine with its own default reference ranges.
     *
     * @param params the scoring parameters; validate them first
     * @param ranges reference ranges used when a call does not supply its own
     */
    public ScoringEngine(TriageParams params, ReferenceRanges ranges) {
        this.params = Objects.requireNonNull(params, "params cannot be null");
        this.ranges = Objects.requireNonNull(ranges, "ranges cannot be null");

        if (!params.validate()) {
            logger.warn("Scoring engine created with parameters that fail validation: {}", params);
        }
    }

    public static ScoringEngine defaultEngine() {
        return new ScoringEngine(TriageParams.defaults());
    }

    public static ScoringEngine forPreset(Preset preset) {
        return new ScoringEngine(preset.params());
    }

    /**
     * Normalized acuity score in [0, 1] using the engine's ranges.
     * Negative or excessive resource counts never fail; they are absorbed by the formula.
     */
    public double acuity(Vitals vitals, int resourceCount) {
        return AcuityFormula.acuity(vitals, resourceCount, params, ranges);
    }

    /**
     * Normalized acuity score using caller-supplied reference ranges instead of the engine's own.
     * Intended for calibration experiments.
     */
    public double acuity(Vitals vitals, int resourceCount, ReferenceRanges customRanges) {
        Objects.requireNonNull(customRanges, "customRanges cannot be null");
        return AcuityFormula.acuity(vitals, resourceCount, params, customRanges);
    }

    public TriageLevel level(Vitals vitals, int resourceCount) {
        return params.classify(acuity(vitals, resourceCount));
    }

    public Evaluation evaluate(Vitals vitals, int resourceCount) {
        double score = acuity(vitals, resourceCount);
        return new Evaluation(score, params.classify(score));
    }

    public Evaluation evaluate(Vitals vitals, int resourceCount, ReferenceRanges customRanges) {
        double score = acuity(vitals, resourceCount, customRanges);
        return new Evaluation(score, params.classify(score));
    }

    /**
     * Evaluate after clamping the resource count to [0, maxResources].
     */
    public Evaluation evaluateWithResourceClamp(Vitals vitals, int resourceCount) {
        int clamped = Math.max(0, Math.min(resourceCount, params.maxResources()));
        return evaluate(vitals, clamped);
    }

    /**
     * Evaluate each (vitals, resourceCount) pair, one result per index.
     *
     * @throws IllegalArgumentException if the two lists differ in length
     */
    public List<Evaluation> batchEvaluate(List<Vitals> vitals, List<Integer> resourceCounts) {
        checkSameLength(vitals, resourceCounts);
        List<Evaluation> results = new ArrayList<>(vitals.size());
        for (int i = 0; i < vitals.size(); i++) {
            results.add(evaluate(vitals.get(i), resourceCounts.get(i)));
        }
        logger.debug("Batch evaluated {} observation(s)", results.size());
        return Collections.unmodifiableList(results);
    }

    /**
     * Like {@link #batchEvaluate} but spread across the common fork-join pool.
     * Output order matches input order.
     *
     * @throws IllegalArgumentException if the two lists differ in length
     */
    public List<Evaluation> parallelBatchEvaluate(List<Vitals> vitals, List<Integer> resourceCounts) {
        checkSameLength(vitals, resourceCounts);
        Evaluation[] results = new Evaluation[vitals.size()];
        IntStream.range(0, results.length)
                .parallel()
                .forEach(i -> results[i] = evaluate(vitals.get(i), resourceCounts.get(i)));
        logger.debug("Parallel batch evaluated {} observation(s)", results.length);
        return List.of(results);
    }

    /**
     * @throws IllegalArgumentException if the two lists differ in length
     */
    public double[] batchAcuity(List<Vitals> vitals, List<Integer> resourceCounts) {
        checkSameLength(vitals, resourceCounts);
        double[] scores = new double[vitals.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = acuity(vitals.get(i), resourceCounts.get(i));
        }
        return scores;
    }

    /**
     * @throws IllegalArgumentException if the two lists differ in length
     */
    public List<TriageLevel> batchLevel(List<Vitals> vitals, List<Integer> resourceCounts) {
        return batchEvaluate(vitals, resourceCounts).stream()
                .map(Evaluation::level)
                .toList();
    }

    /**
     * The engine's parameters. The returned instance is immutable and safe to share.
     */
    public TriageParams params() {
        return params;
    }

    public ReferenceRanges ranges() {
        return ranges;
    }

    /**
     * New engine with other parameters and the same ranges; this engine is unchanged.
     */
    public ScoringEngine withParams(TriageParams newParams) {
        return new ScoringEngine(newParams, ranges);
    }

    public ScoringEngine withRanges(ReferenceRanges newRanges) {
        return new ScoringEngine(params, newRanges);
    }

    private static void checkSameLength(List<Vitals> vitals, List<Integer> resourceCounts) {
        Objects.requireNonNull(vitals, "vitals cannot be null");
        Objects.requireNonNull(resourceCounts, "resourceCounts cannot be null");
        if (vitals.size() != resourceCounts.size()) {
            throw new IllegalArgumentException(String.format(
                    "vitals and resourceCounts must have the same length (%d != %d)",
                    vitals.size(), resourceCounts.size()));
        }
    }

    // Aggregation helpers over evaluation results

    public static long countByLevel(List<Evaluation> results, TriageLevel level) {
        return results.stream().filter(r -> r.level() == level).count();
    }

    /**
     * Mean score, 0 for an empty list.
     */
    public static double meanAcuity(List<Evaluation> results) {
        return results.stream().mapToDouble(Evaluation::score).average().orElse(0.0);
    }

    public static double minAcuity(List<Evaluation> results) {
        return results.stream().mapToDouble(Evaluation::score).min().orElse(0.0);
    }

    public static double maxAcuity(List<Evaluation> results) {
        return results.stream().mapToDouble(Evaluation::score).max().orElse(0.0);
    }

    public static List<Evaluation> filterByLevel(List<Evaluation> results, TriageLevel level) {
        return results.stream().filter(r -> r.level() == level).toList();
    }

    public static List<Evaluation> filterHighAcuity(List<Evaluation> results) {
        return results.stream().filter(r -> r.level().isHighAcuity()).toList();
    }

    public static List<Evaluation> filterLowAcuity(List<Evaluation> results) {
        return results.stream().filter(r -> r.level().isLowAcuity()).toList();
    }

    @Override
    public String toString() {
        return "ScoringEngine{params=" + params + ", ranges=" + ranges + ", thresholds="
                + Arrays.toString(params.thresholds().toArray()) + "}";
    }
}
