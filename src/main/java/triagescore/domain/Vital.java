package triagescore.domain;

/**
 * The seven vital signs used for acuity scoring, in their fixed order.
 * The ordinal order matches the index order of weight vectors and reference ranges.
 */
public enum Vital {
    HEART_RATE("hr", "bpm"),
    RESPIRATORY_RATE("rr", "/min"),
    SYSTOLIC_BP("sbp", "mmHg"),
    DIASTOLIC_BP("dbp", "mmHg"),
    TEMPERATURE("temp", "°C"),
    SPO2("spo2", "%"),
    GCS("gcs", "3-15");

    /**
     * Number of vitals; length of every per-vital vector.
     */
    public static final int COUNT = 7;

    private final String code;
    private final String unit;

    Vital(String code, String unit) {
        this.code = code;
        this.unit = unit;
    }

    /**
     * Position of this vital in weight vectors and reference ranges (0..6).
     */
    public int index() {
        return ordinal();
    }

    /**
     * Short lowercase code, also used as JSON and CSV field name.
     */
    public String code() {
        return code;
    }

    public String unit() {
        return unit;
    }

    /**
     * Get the vital at the given index.
     *
     * @param index position 0..6
     * @return the vital
     * @throws IllegalArgumentException if index is out of range
     */
    public static Vital fromIndex(int index) {
        if (index < 0 || index >= COUNT) {
            throw new IllegalArgumentException("Vital index out of range: " + index);
        }
        return values()[index];
    }
}
