package triagescore.validate;

import triagescore.domain.Vital;
import triagescore.domain.Vitals;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Validation result for one observation.
 *
 * @param valid    true if no field is {@link FieldStatus#INVALID}
 * @param statuses status per vital
 * @param clamped  the observation with out-of-range present values forced into bounds
 */
public record VitalsReport(boolean valid, Map<Vital, FieldStatus> statuses, Vitals clamped) {

    public VitalsReport {
        statuses = Collections.unmodifiableMap(new EnumMap<>(statuses));
    }

    public FieldStatus status(Vital vital) {
        return statuses.get(vital);
    }

    /**
     * Whether any field was changed by clamping.
     */
    public boolean wasClamped() {
        return statuses.containsValue(FieldStatus.CLAMPED);
    }
}
