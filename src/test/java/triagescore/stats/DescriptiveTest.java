package triagescore.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DescriptiveTest {

    private static final double[] VALUES = {2, 4, 4, 4, 5, 5, 7, 9};

    @Test
    @DisplayName("Should compute mean and sample variance")
    void testMeanAndVariance() {
        assertThat(Descriptive.mean(VALUES)).isEqualTo(5.0);
        assertThat(Descriptive.variance(VALUES)).isCloseTo(32.0 / 7, within(1e-12));
        assertThat(Descriptive.stdDev(VALUES)).isCloseTo(Math.sqrt(32.0 / 7), within(1e-12));
        assertThat(Descriptive.standardError(VALUES)).isCloseTo(Math.sqrt(32.0 / 7) / Math.sqrt(8), within(1e-12));
    }

    @Test
    @DisplayName("95% interval should be centred on the mean")
    void testCi95() {
        double[] ci = Descriptive.ci95(VALUES);
        double half = 1.96 * Descriptive.standardError(VALUES);

        assertThat(ci[0]).isCloseTo(5.0 - half, within(1e-12));
        assertThat(ci[1]).isCloseTo(5.0 + half, within(1e-12));
        assertThat(Descriptive.ci95(new double[]{3})).containsExactly(0.0, 0.0);
    }

    @Test
    @DisplayName("Should compute median and interpolated percentiles")
    void testMedianAndPercentile() {
        assertThat(Descriptive.median(VALUES)).isEqualTo(4.5);
        assertThat(Descriptive.median(new double[]{3, 1, 2})).isEqualTo(2.0);
        assertThat(Descriptive.percentile(new double[]{1, 2, 3, 4, 5}, 25)).isEqualTo(2.0);
        assertThat(Descriptive.percentile(new double[]{1, 2, 3, 4}, 50)).isCloseTo(2.5, within(1e-12));
        assertThat(Descriptive.percentile(VALUES, 100)).isEqualTo(9.0);
        assertThat(Descriptive.percentile(VALUES, 0)).isEqualTo(2.0);
        assertThat(Descriptive.percentile(VALUES, 101)).isZero();
    }

    @Test
    @DisplayName("Empty input should give zero rather than NaN")
    void testEmpty() {
        double[] empty = new double[0];

        assertThat(Descriptive.mean(empty)).isZero();
        assertThat(Descriptive.variance(empty)).isZero();
        assertThat(Descriptive.median(empty)).isZero();
        assertThat(Descriptive.min(empty)).isZero();
        assertThat(Descriptive.max(empty)).isZero();
        assertThat(Descriptive.percentile(empty, 50)).isZero();
    }

    @Test
    @DisplayName("Should not modify the input array")
    void testInputUntouched() {
        double[] values = {3, 1, 2};
        Descriptive.median(values);
        Descriptive.percentile(values, 75);

        assertThat(values).containsExactly(3, 1, 2);
    }

    @Test
    @DisplayName("Should compute Pearson correlation")
    void testPearson() {
        double[] x = {1, 2, 3, 4};

        assertThat(Descriptive.pearson(x, new double[]{2, 4, 6, 8})).isCloseTo(1.0, within(1e-12));
        assertThat(Descriptive.pearson(x, new double[]{8, 6, 4, 2})).isCloseTo(-1.0, within(1e-12));
        assertThat(Descriptive.pearson(x, new double[]{5, 5, 5, 5})).isZero();
        assertThat(Descriptive.pearson(x, new double[]{1, 2})).isZero();
    }

    @Test
    @DisplayName("Should compute error and tolerance measures")
    void testErrors() {
        double[] predicted = {0.5, 0.7, 0.2};
        double[] reference = {0.4, 0.7, 0.5};

        assertThat(Descriptive.mae(predicted, reference)).isCloseTo(0.4 / 3, within(1e-12));
        assertThat(Descriptive.rmse(predicted, reference)).isCloseTo(Math.sqrt(0.1 / 3), within(1e-12));
        assertThat(Descriptive.withinTolerance(predicted, reference, 0.15)).isCloseTo(2.0 / 3, within(1e-12));
        assertThat(Descriptive.count(predicted, v -> v > 0.4)).isEqualTo(2);
        assertThat(Descriptive.sum(predicted)).isCloseTo(1.4, within(1e-12));
    }

    @Test
    @DisplayName("Should compute exact and within-one-level agreement")
    void testLevelAgreement() {
        int[] predicted = {1, 2, 3, 5};
        int[] reference = {1, 3, 5, 5};

        assertThat(Descriptive.exactAgreement(predicted, reference)).isEqualTo(0.5);
        assertThat(Descriptive.withinOneLevel(predicted, reference)).isEqualTo(0.75);
        assertThat(Descriptive.exactAgreement(new int[]{1}, new int[0])).isZero();
    }
}
