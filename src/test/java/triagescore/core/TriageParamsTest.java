package triagescore.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import triagescore.domain.Thresholds;
import triagescore.domain.TriageLevel;
import triagescore.domain.Vital;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class TriageParamsTest {

    @Test
    @DisplayName("Defaults should carry the documented weights and settings")
    void testDefaults() {
        TriageParams params = TriageParams.defaults();

        assertThat(params.vitalWeights()).containsExactly(0.18, 0.22, 0.16, 0.10, 0.08, 0.16, 0.10);
        assertThat(params.maxResources()).isEqualTo(6);
        assertThat(params.resourceWeight()).isEqualTo(0.25);
        assertThat(params.thresholds()).isEqualTo(new Thresholds(0.85, 0.60, 0.35, 0.15));
        assertThat(params.weightSum()).isCloseTo(1.0, within(1e-12));
        assertThat(params.divisor()).isCloseTo(1.25, within(1e-12));
        assertThat(params.validate()).isTrue();
    }

    @Test
    @DisplayName("Every preset should validate")
    void testPresetsValid() {
        assertThat(TriageParams.strict().validate()).isTrue();
        assertThat(TriageParams.lenient().validate()).isTrue();
        assertThat(TriageParams.research().validate()).isTrue();
        assertThat(TriageParams.research().thresholds()).isEqualTo(new Thresholds(0.80, 0.60, 0.40, 0.20));
    }

    @Test
    @DisplayName("Strict should be stricter than default, lenient should not")
    void testStrictness() {
        assertThat(TriageParams.strict().isStricterThan(TriageParams.defaults())).isTrue();
        assertThat(TriageParams.lenient().isStricterThan(TriageParams.defaults())).isFalse();
        assertThat(TriageParams.defaults().isStricterThan(TriageParams.lenient())).isTrue();
    }

    @Test
    @DisplayName("Non-increasing thresholds should fail validation")
    void testInvalidThresholds() {
        TriageParams params = TriageParams.builder()
                .thresholds(0.5, 0.6, 0.35, 0.15)
                .build();

        assertThat(params.validate()).isFalse();
        assertThat(params.validateExternally()).isFalse();
    }

    @Test
    @DisplayName("Out of range weights and negative settings should fail validation")
    void testInvalidFields() {
        assertThat(TriageParams.builder().weight(Vital.GCS, 1.5).build().validate()).isFalse();
        assertThat(TriageParams.builder().weight(Vital.GCS, -0.1).build().validate()).isFalse();
        assertThat(TriageParams.builder().maxResources(-1).build().validate()).isFalse();
        assertThat(TriageParams.builder().resourceWeight(-0.25).build().validate()).isFalse();
        assertThat(TriageParams.builder().thresholds(1.1, 0.6, 0.35, 0.15).build().validate()).isFalse();
    }

    @Test
    @DisplayName("Zero max resources and zero resource weight are still valid")
    void testZeroResourcesValid() {
        TriageParams params = TriageParams.builder().maxResources(0).resourceWeight(0).build();
        assertThat(params.validate()).isTrue();
    }

    @Test
    @DisplayName("External validation should also reject non-finite weights")
    void testNonFiniteWeights() {
        TriageParams params = TriageParams.builder().weight(Vital.HEART_RATE, Double.NaN).build();

        assertThat(params.validate()).isTrue();
        assertThat(params.validateExternally()).isFalse();
    }

    @Test
    @DisplayName("Descriptor should mirror the parameters")
    void testToDescriptor() {
        var descriptor = TriageParams.defaults().toDescriptor();

        assertThat(descriptor.vitalWeights()).containsExactly(TriageParams.defaults().vitalWeights());
        assertThat(descriptor.maxResources()).isEqualTo(6);
        assertThat(descriptor.t1()).isEqualTo(0.85);
        assertThat(descriptor.t4()).isEqualTo(0.15);
    }

    @Test
    @DisplayName("Builder should not affect previously built instances")
    void testImmutability() {
        TriageParams.Builder builder = TriageParams.builder();
        TriageParams first = builder.build();
        builder.weight(Vital.HEART_RATE, 0.9);
        TriageParams second = builder.build();

        assertThat(first.weight(Vital.HEART_RATE)).isEqualTo(0.18);
        assertThat(second.weight(Vital.HEART_RATE)).isEqualTo(0.9);

        double[] weights = first.vitalWeights();
        weights[0] = 0.0;
        assertThat(first.weight(Vital.HEART_RATE)).isEqualTo(0.18);
    }

    @Test
    @DisplayName("toBuilder should round-trip to an equal instance")
    void testToBuilderEquality() {
        TriageParams copy = TriageParams.strict().toBuilder().build();

        assertThat(copy).isEqualTo(TriageParams.strict());
        assertThat(copy.hashCode()).isEqualTo(TriageParams.strict().hashCode());
        assertThat(copy).isNotEqualTo(TriageParams.defaults());
    }

    @Test
    @DisplayName("weights should require exactly seven values")
    void testWeightsLength() {
        assertThatThrownBy(() -> TriageParams.builder().weights(0.1, 0.2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("normalizeWeights should make weights sum to one")
    void testNormalizeWeights() {
        TriageParams params = TriageParams.builder()
                .weights(1, 1, 1, 1, 0, 0, 0)
                .normalizeWeights()
                .build();

        assertThat(params.weightSum()).isCloseTo(1.0, within(1e-12));
        assertThat(params.weight(Vital.HEART_RATE)).isCloseTo(0.25, within(1e-12));
        assertThat(params.weight(Vital.GCS)).isZero();
    }

    @Test
    @DisplayName("normalizeWeights should do nothing when all weights are zero")
    void testNormalizeWeightsZero() {
        TriageParams params = TriageParams.builder()
                .weights(0, 0, 0, 0, 0, 0, 0)
                .normalizeWeights()
                .build();
        assertThat(params.vitalWeights()).containsOnly(0.0);
    }

    @Test
    @DisplayName("scaleWeights should rescale so the largest weight is one")
    void testScaleWeights() {
        TriageParams params = TriageParams.builder().scaleWeights(2.0).build();

        assertThat(Arrays.stream(params.vitalWeights()).max().orElseThrow()).isCloseTo(1.0, within(1e-12));
        assertThat(params.weight(Vital.HEART_RATE)).isCloseTo(0.18 / 0.22, within(1e-12));
        assertThat(TriageParams.builder().scaleWeights(0).build()).isEqualTo(TriageParams.defaults());
    }

    @Test
    @DisplayName("uniformWeights should give every vital 1/7")
    void testUniformWeights() {
        TriageParams params = TriageParams.builder().uniformWeights().build();
        for (Vital vital : Vital.values()) {
            assertThat(params.weight(vital)).isCloseTo(1.0 / 7, within(1e-12));
        }
    }

    @Test
    @DisplayName("geometricThresholds should produce ordered thresholds inside the bounds")
    void testGeometricThresholds() {
        TriageParams params = TriageParams.builder().geometricThresholds(0.05, 1.0).build();
        Thresholds t = params.thresholds();

        assertThat(t.isOrdered()).isTrue();
        assertThat(t.t4()).isGreaterThan(0.05);
        assertThat(t.t1()).isLessThan(1.0);
        assertThat(t.t2() / t.t3()).isCloseTo(t.t3() / t.t4(), within(1e-9));
    }

    @Test
    @DisplayName("geometricThresholds should ignore invalid bounds")
    void testGeometricThresholdsInvalid() {
        Thresholds before = TriageParams.defaults().thresholds();

        assertThat(TriageParams.builder().geometricThresholds(0, 1).build().thresholds()).isEqualTo(before);
        assertThat(TriageParams.builder().geometricThresholds(0.5, 0.4).build().thresholds()).isEqualTo(before);
        assertThat(TriageParams.builder().geometricThresholds(0.1, 1.5).build().thresholds()).isEqualTo(before);
    }

    @Test
    @DisplayName("Should expose bands and classification through the parameters")
    void testClassifyAndBands() {
        TriageParams params = TriageParams.defaults();

        assertThat(params.classify(0.72)).isEqualTo(TriageLevel.EMERGENT);
        assertThat(params.bandFor(TriageLevel.URGENT)).containsExactly(0.35, 0.60);
        assertThat(params.continuousLevel(0.60)).isCloseTo(2.0, within(1e-12));
    }
}
