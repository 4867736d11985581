package triagescore.validate;

import triagescore.domain.Vital;
import triagescore.domain.Vitals;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bounds checking and clamping of raw vitals before scoring.
 * The scoring engine never calls this itself; integrators wanting strict input
 * hygiene run it upstream.
 *
 * <pre>
 * | Vital | Min | Max |
 * |-------|-----|-----|
 * | HR    | 20  | 300 |
 * | RR    | 0   | 60  |
 * | SBP   | 40  | 300 |
 * | DBP   | 20  | 200 |
 * | Temp  | 30  | 45  |
 * | SpO2  | 0   | 100 |
 * | GCS   | 3   | 15  |
 * </pre>
 * A value of exactly zero is "missing" and always allowed.
 */
public final class VitalsValidator {

    private static final Map<Vital, double[]> BOUNDS = new EnumMap<>(Map.of(
            Vital.HEART_RATE, new double[]{20, 300},
            Vital.RESPIRATORY_RATE, new double[]{0, 60},
            Vital.SYSTOLIC_BP, new double[]{40, 300},
            Vital.DIASTOLIC_BP, new double[]{20, 200},
            Vital.TEMPERATURE, new double[]{30, 45},
            Vital.SPO2, new double[]{0, 100},
            Vital.GCS, new double[]{3, 15}
    ));

    private VitalsValidator() {
    }

    public static double lowerBound(Vital vital) {
        return BOUNDS.get(vital)[0];
    }

    public static double upperBound(Vital vital) {
        return BOUNDS.get(vital)[1];
    }

    public static boolean isWithinBounds(Vital vital, double value) {
        return value >= lowerBound(vital) && value <= upperBound(vital);
    }

    /**
     * Classify each field as OK, INVALID or MISSING. Does not change the input;
     * the report carries a clamped copy.
     */
    public static VitalsReport validate(Vitals vitals) {
        Objects.requireNonNull(vitals, "vitals cannot be null");
        Map<Vital, FieldStatus> statuses = new EnumMap<>(Vital.class);
        boolean valid = true;
        for (Vital vital : Vital.values()) {
            double value = vitals.value(vital);
            if (value == 0) {
                statuses.put(vital, FieldStatus.MISSING);
            } else if (isWithinBounds(vital, value)) {
                statuses.put(vital, FieldStatus.OK);
            } else {
                statuses.put(vital, FieldStatus.INVALID);
                valid = false;
            }
        }
        return new VitalsReport(valid, statuses, clamp(vitals));
    }

    public static boolean isValid(Vitals vitals) {
        return validate(vitals).valid();
    }

    /**
     * Copy with every present out-of-range value forced into bounds.
     * Missing values stay zero.
     */
    public static Vitals clamp(Vitals vitals) {
        return new Vitals(
                clampInt(vitals.heartRate(), Vital.HEART_RATE),
                clampInt(vitals.respiratoryRate(), Vital.RESPIRATORY_RATE),
                clampInt(vitals.systolic(), Vital.SYSTOLIC_BP),
                clampInt(vitals.diastolic(), Vital.DIASTOLIC_BP),
                clampDouble(vitals.temperature(), Vital.TEMPERATURE),
                clampInt(vitals.spo2(), Vital.SPO2),
                clampInt(vitals.gcs(), Vital.GCS)
        );
    }

    /**
     * Validate and clamp in one step. Fields that were out of range are reported as
     * {@link FieldStatus#CLAMPED}, and the report is valid since the clamped copy is in bounds.
     */
    public static VitalsReport sanitize(Vitals vitals) {
        VitalsReport report = validate(vitals);
        if (report.valid()) {
            return report;
        }
        Map<Vital, FieldStatus> statuses = new EnumMap<>(report.statuses());
        statuses.replaceAll((vital, status) -> status == FieldStatus.INVALID ? FieldStatus.CLAMPED : status);
        return new VitalsReport(true, statuses, report.clamped());
    }

    /**
     * Whether at least one vital is present (non-zero).
     */
    public static boolean hasAnyVital(Vitals vitals) {
        for (Vital vital : Vital.values()) {
            if (vitals.value(vital) != 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Clamp a resource count to [0, maxResources]; 0 if {@code maxResources <= 0}.
     */
    public static int clampResourceCount(int count, int maxResources) {
        if (maxResources <= 0 || count < 0) {
            return 0;
        }
        return Math.min(count, maxResources);
    }

    /**
     * Vitals valid and resource count in [0, maxResources]; with no resource capacity only 0 is accepted.
     */
    public static boolean isValidWithResources(Vitals vitals, int resourceCount, int maxResources) {
        if (!isValid(vitals)) {
            return false;
        }
        if (maxResources <= 0) {
            return resourceCount == 0;
        }
        return resourceCount >= 0 && resourceCount <= maxResources;
    }

    private static int clampInt(int value, Vital vital) {
        if (value == 0) {
            return 0;
        }
        return (int) Math.max(lowerBound(vital), Math.min(upperBound(vital), value));
    }

    private static double clampDouble(double value, Vital vital) {
        if (value == 0) {
            return 0;
        }
        return Math.max(lowerBound(vital), Math.min(upperBound(vital), value));
    }
}
