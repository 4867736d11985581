package triagescore.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import triagescore.domain.Evaluation;
import triagescore.domain.ReferenceRanges;
import triagescore.domain.TriageLevel;
import triagescore.domain.Vital;
import triagescore.domain.Vitals;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class ScoringEngineTest {

    private static final Vitals SHOCKED = Vitals.builder()
            .heartRate(120).respiratoryRate(24).systolic(90).spo2(92).build();

    private ScoringEngine engine;

    @BeforeEach
    void setUp() {
        engine = ScoringEngine.defaultEngine();
    }

    @Test
    @DisplayName("Tachycardic hypotensive patient with three resources should be Emergent")
    void testEmergentScenario() {
        Evaluation result = engine.evaluate(SHOCKED, 3);

        assertThat(result.score()).isGreaterThan(0.60).isLessThan(0.85);
        assertThat(result.score()).isCloseTo(0.7622, within(1e-4));
        assertThat(result.level()).isEqualTo(TriageLevel.EMERGENT);
        assertThat(result.level().label()).isEqualTo("Emergent");
    }

    @Test
    @DisplayName("Score 0.72 should map to level 2 with default parameters")
    void testLevelForScore() {
        assertThat(TriageLevel.fromScore(0.72, TriageParams.defaults().thresholds()))
                .isEqualTo(TriageLevel.EMERGENT);
    }

    @Test
    @DisplayName("Empty vitals with no resources should score zero and be Non-urgent")
    void testEmptyVitals() {
        Evaluation result = engine.evaluate(Vitals.empty(), 0);

        assertThat(result.score()).isZero();
        assertThat(result.level()).isEqualTo(TriageLevel.NON_URGENT);
    }

    @Test
    @DisplayName("Resource contribution should stop growing at max resources")
    void testResourceSaturation() {
        double atMax = engine.acuity(Vitals.empty(), 6);
        double far = engine.acuity(Vitals.empty(), 100);

        assertThat(far).isEqualTo(atMax);
        assertThat(far).isCloseTo(0.25 / 1.25, within(1e-12));
        assertThat(engine.acuity(Vitals.empty(), 3)).isLessThan(atMax);
    }

    @Test
    @DisplayName("Negative resource counts should be absorbed without failing")
    void testNegativeResourceCount() {
        assertThat(engine.acuity(SHOCKED, -5)).isEqualTo(engine.acuity(SHOCKED, 0));
    }

    @Test
    @DisplayName("Scoring should be deterministic")
    void testDeterministic() {
        double first = engine.acuity(SHOCKED, 3);
        double second = engine.acuity(SHOCKED, 3);
        assertThat(Double.doubleToLongBits(first)).isEqualTo(Double.doubleToLongBits(second));
    }

    @Test
    @DisplayName("Score should stay in [0, 1] for arbitrary finite inputs")
    void testScoreBounds() {
        Random random = new Random(42);
        List<TriageParams> paramSets = List.of(
                TriageParams.defaults(),
                TriageParams.builder().weights(0, 0, 0, 0, 0, 0, 0).build(),
                TriageParams.builder().maxResources(0).build(),
                TriageParams.builder().resourceWeight(0).weights(1, 1, 1, 1, 1, 1, 1).build());

        for (TriageParams params : paramSets) {
            ScoringEngine e = new ScoringEngine(params);
            for (int i = 0; i < 500; i++) {
                Vitals vitals = new Vitals(
                        random.nextInt(600) - 100, random.nextInt(200) - 50,
                        random.nextInt(600) - 100, random.nextInt(400) - 100,
                        random.nextDouble() * 100 - 20, random.nextInt(300) - 100,
                        random.nextInt(40) - 10);
                double score = e.acuity(vitals, random.nextInt(40) - 20);
                assertThat(score).isBetween(0.0, 1.0);
            }
        }
    }

    @Test
    @DisplayName("Custom ranges should be used only for that call")
    void testCustomRanges() {
        double adult = engine.acuity(SHOCKED, 3);
        double pediatric = engine.acuity(SHOCKED, 3, ReferenceRanges.pediatric());

        assertThat(pediatric).isCloseTo(0.3133, within(1e-4));
        assertThat(pediatric).isLessThan(adult);
        assertThat(engine.acuity(SHOCKED, 3)).isEqualTo(adult);
        assertThat(engine.evaluate(SHOCKED, 3, ReferenceRanges.pediatric()).level())
                .isEqualTo(TriageLevel.LESS_URGENT);
    }

    @Test
    @DisplayName("Engine built with pediatric ranges should match per-call pediatric scoring")
    void testEngineWithRanges() {
        ScoringEngine pediatric = engine.withRanges(ReferenceRanges.pediatric());

        assertThat(pediatric.acuity(SHOCKED, 3))
                .isEqualTo(engine.acuity(SHOCKED, 3, ReferenceRanges.pediatric()));
        assertThat(engine.ranges()).isEqualTo(ReferenceRanges.adult());
    }

    @Test
    @DisplayName("Stricter presets should never assign a less urgent level")
    void testPresetOrdering() {
        ScoringEngine strict = ScoringEngine.forPreset(Preset.STRICT);
        ScoringEngine lenient = ScoringEngine.forPreset(Preset.LENIENT);
        for (int hr = 40; hr <= 200; hr += 10) {
            Vitals vitals = SHOCKED.toBuilder().heartRate(hr).build();
            int def = engine.level(vitals, 2).number();
            assertThat(strict.level(vitals, 2).number()).isLessThanOrEqualTo(def);
            assertThat(lenient.level(vitals, 2).number()).isGreaterThanOrEqualTo(def);
        }
    }

    @Test
    @DisplayName("Invalid parameters should still score without failing")
    void testInvalidParamsStillScore() {
        TriageParams invalid = TriageParams.builder().thresholds(0.5, 0.6, 0.35, 0.15).build();
        ScoringEngine e = new ScoringEngine(invalid);

        assertThat(invalid.validate()).isFalse();
        assertThat(e.acuity(SHOCKED, 3)).isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("Should reject null parameters or ranges")
    void testNullArguments() {
        assertThatThrownBy(() -> new ScoringEngine(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("params cannot be null");
        assertThatThrownBy(() -> new ScoringEngine(TriageParams.defaults(), null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("ranges cannot be null");
    }

    @Test
    @DisplayName("Resource clamp variant should match scoring with the clamped count")
    void testEvaluateWithResourceClamp() {
        assertThat(engine.evaluateWithResourceClamp(SHOCKED, 40)).isEqualTo(engine.evaluate(SHOCKED, 6));
        assertThat(engine.evaluateWithResourceClamp(SHOCKED, -4)).isEqualTo(engine.evaluate(SHOCKED, 0));
    }

    @Test
    @DisplayName("withParams should return a new engine and keep this one unchanged")
    void testWithParams() {
        ScoringEngine strict = engine.withParams(TriageParams.strict());

        assertThat(strict).isNotSameAs(engine);
        assertThat(strict.params()).isEqualTo(TriageParams.strict());
        assertThat(engine.params()).isEqualTo(TriageParams.defaults());
    }

    @Test
    @DisplayName("Batch evaluation should match individual evaluation index for index")
    void testBatchEvaluate() {
        List<Vitals> vitals = List.of(SHOCKED, Vitals.empty(),
                new Vitals(80, 16, 120, 80, 37.0, 98, 15),
                Vitals.builder().heartRate(150).gcs(8).build());
        List<Integer> counts = List.of(3, 0, 1, 6);

        List<Evaluation> results = engine.batchEvaluate(vitals, counts);

        assertThat(results).hasSize(4);
        for (int i = 0; i < vitals.size(); i++) {
            assertThat(results.get(i)).isEqualTo(engine.evaluate(vitals.get(i), counts.get(i)));
        }
        assertThat(engine.batchAcuity(vitals, counts))
                .containsExactly(results.stream().mapToDouble(Evaluation::score).toArray());
        assertThat(engine.batchLevel(vitals, counts))
                .containsExactlyElementsOf(results.stream().map(Evaluation::level).toList());
    }

    @Test
    @DisplayName("Batch operations should reject lists of different length")
    void testBatchLengthMismatch() {
        List<Vitals> vitals = List.of(SHOCKED, Vitals.empty());
        List<Integer> counts = List.of(3);

        assertThatThrownBy(() -> engine.batchEvaluate(vitals, counts))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2 != 1");
        assertThatThrownBy(() -> engine.parallelBatchEvaluate(vitals, counts))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.batchAcuity(vitals, counts))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.batchLevel(vitals, counts))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Empty batches should give empty results")
    void testEmptyBatch() {
        assertThat(engine.batchEvaluate(List.of(), List.of())).isEmpty();
        assertThat(engine.parallelBatchEvaluate(List.of(), List.of())).isEmpty();
    }

    @Test
    @DisplayName("Parallel batch should equal sequential batch in order")
    void testParallelBatch() {
        Random random = new Random(7);
        List<Vitals> vitals = new ArrayList<>();
        List<Integer> counts = new ArrayList<>();
        for (int i = 0; i < 2000; i++) {
            vitals.add(new Vitals(40 + random.nextInt(140), 8 + random.nextInt(30),
                    70 + random.nextInt(120), 40 + random.nextInt(70), 35.0 + random.nextInt(60) / 10.0,
                    80 + random.nextInt(21), 3 + random.nextInt(13)));
            counts.add(random.nextInt(8));
        }

        assertThat(engine.parallelBatchEvaluate(vitals, counts))
                .containsExactlyElementsOf(engine.batchEvaluate(vitals, counts));
    }

    @Test
    @DisplayName("Aggregation helpers should summarise results")
    void testAggregation() {
        List<Evaluation> results = List.of(
                new Evaluation(0.9, TriageLevel.RESUSCITATION),
                new Evaluation(0.7, TriageLevel.EMERGENT),
                new Evaluation(0.4, TriageLevel.URGENT),
                new Evaluation(0.1, TriageLevel.NON_URGENT));

        assertThat(ScoringEngine.countByLevel(results, TriageLevel.EMERGENT)).isEqualTo(1);
        assertThat(ScoringEngine.meanAcuity(results)).isCloseTo(0.525, within(1e-12));
        assertThat(ScoringEngine.minAcuity(results)).isEqualTo(0.1);
        assertThat(ScoringEngine.maxAcuity(results)).isEqualTo(0.9);
        assertThat(ScoringEngine.filterHighAcuity(results)).hasSize(2);
        assertThat(ScoringEngine.filterLowAcuity(results)).containsExactly(results.get(3));
        assertThat(ScoringEngine.filterByLevel(results, TriageLevel.URGENT)).containsExactly(results.get(2));
        assertThat(ScoringEngine.meanAcuity(List.of())).isZero();
    }

    @Test
    @DisplayName("Only present vitals with enabled ranges should contribute")
    void testMissingVitalsDoNotPullTowardNormal() {
        Vitals sparse = Vitals.builder().heartRate(140).build();
        Vitals withNormal = sparse.toBuilder().spo2(98).build();

        assertThat(engine.acuity(sparse, 0)).isGreaterThan(engine.acuity(withNormal, 0));
        assertThat(engine.acuity(sparse, 0, ReferenceRanges.adult().scaleHalfWidths(2)))
                .isLessThan(engine.acuity(sparse, 0));
        assertThat(engine.params().weight(Vital.HEART_RATE)).isEqualTo(0.18);
    }
}
