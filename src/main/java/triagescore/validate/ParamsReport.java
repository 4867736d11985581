package triagescore.validate;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-rule result of parameter validation.
 */
public record ParamsReport(
        boolean weightsOk,
        boolean thresholdsOk,
        boolean maxResourcesOk,
        boolean resourceWeightOk
) {
    public boolean valid() {
        return weightsOk && thresholdsOk && maxResourcesOk && resourceWeightOk;
    }

    /**
     * Human-readable description of each failed rule; empty when valid.
     */
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (!weightsOk) {
            problems.add("vital weights must be seven finite values in [0, 1]");
        }
        if (!thresholdsOk) {
            problems.add("thresholds must satisfy 1 >= T1 > T2 > T3 > T4 > 0");
        }
        if (!maxResourcesOk) {
            problems.add("max resources must be >= 0");
        }
        if (!resourceWeightOk) {
            problems.add("resource weight must be finite and >= 0");
        }
        return problems;
    }
}
