package triagescore.validate;

import java.util.Objects;

/**
 * Validates parameter descriptions: weights in [0, 1], {@code 1 >= T1 > T2 > T3 > T4 > 0},
 * non-negative max resources and resource weight. Non-finite values fail.
 */
public final class ParamsValidator {

    private static final int VITAL_COUNT = 7;

    private ParamsValidator() {
    }

    /**
     * Check every rule and report which ones hold.
     */
    public static ParamsReport validate(ParamsDescriptor params) {
        Objects.requireNonNull(params, "params cannot be null");

        double[] weights = params.vitalWeights();
        boolean weightsOk = weights.length == VITAL_COUNT;
        for (double w : weights) {
            if (w < 0 || w > 1 || !Double.isFinite(w)) {
                weightsOk = false;
                break;
            }
        }

        boolean maxResourcesOk = params.maxResources() >= 0;
        boolean resourceWeightOk = params.resourceWeight() >= 0 && Double.isFinite(params.resourceWeight());
        boolean thresholdsOk = params.t1() > params.t2()
                && params.t2() > params.t3()
                && params.t3() > params.t4()
                && params.t4() > 0
                && params.t1() <= 1;

        return new ParamsReport(weightsOk, thresholdsOk, maxResourcesOk, resourceWeightOk);
    }

    public static boolean isValid(ParamsDescriptor params) {
        return validate(params).valid();
    }
}
