package triagescore.domain;

/**
 * One observation of the seven vital signs.
 * A value of zero means "not measured" and is excluded from scoring.
 *
 * @param heartRate       heart rate, beats per minute
 * @param respiratoryRate respiratory rate, per minute
 * @param systolic        systolic blood pressure, mmHg
 * @param diastolic       diastolic blood pressure, mmHg
 * @param temperature     core temperature, Celsius
 * @param spo2            oxygen saturation, percent
 * @param gcs             Glasgow Coma Scale, 3-15
 */
public record Vitals(
        int heartRate,
        int respiratoryRate,
        int systolic,
        int diastolic,
        double temperature,
        int spo2,
        int gcs
) {
    private static final Vitals EMPTY = new Vitals(0, 0, 0, 0, 0.0, 0, 0);

    /**
     * Vitals with every measurement missing.
     */
    public static Vitals empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Raw value of the given vital as a double.
     */
    public double value(Vital vital) {
        return switch (vital) {
            case HEART_RATE -> heartRate;
            case RESPIRATORY_RATE -> respiratoryRate;
            case SYSTOLIC_BP -> systolic;
            case DIASTOLIC_BP -> diastolic;
            case TEMPERATURE -> temperature;
            case SPO2 -> spo2;
            case GCS -> gcs;
        };
    }

    /**
     * Whether the vital was measured.
     * Temperature is present when it is not exactly 0.0; integer vitals must be
     * strictly positive, so a negative temperature counts as present while a
     * negative heart rate does not.
     */
    public boolean isPresent(Vital vital) {
        if (vital == Vital.TEMPERATURE) {
            return temperature != 0.0;
        }
        return value(vital) > 0;
    }

    /**
     * Number of vitals that are present.
     */
    public int presentCount() {
        int count = 0;
        for (Vital vital : Vital.values()) {
            if (isPresent(vital)) {
                count++;
            }
        }
        return count;
    }

    public boolean hasAnyPresent() {
        return presentCount() > 0;
    }

    /**
     * Raw values in index order, for callers working with fixed-size vectors.
     */
    public double[] toArray() {
        double[] values = new double[Vital.COUNT];
        for (Vital vital : Vital.values()) {
            values[vital.index()] = value(vital);
        }
        return values;
    }

    public Builder toBuilder() {
        return new Builder()
                .heartRate(heartRate)
                .respiratoryRate(respiratoryRate)
                .systolic(systolic)
                .diastolic(diastolic)
                .temperature(temperature)
                .spo2(spo2)
                .gcs(gcs);
    }

    /**
     * Builder for sparse observations; unset vitals stay missing.
     */
    public static final class Builder {
        private int heartRate;
        private int respiratoryRate;
        private int systolic;
        private int diastolic;
        private double temperature;
        private int spo2;
        private int gcs;

        private Builder() {
        }

        public Builder heartRate(int heartRate) {
            this.heartRate = heartRate;
            return this;
        }

        public Builder respiratoryRate(int respiratoryRate) {
            this.respiratoryRate = respiratoryRate;
            return this;
        }

        public Builder systolic(int systolic) {
            this.systolic = systolic;
            return this;
        }

        public Builder diastolic(int diastolic) {
            this.diastolic = diastolic;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder spo2(int spo2) {
            this.spo2 = spo2;
            return this;
        }

        public Builder gcs(int gcs) {
            this.gcs = gcs;
            return this;
        }

        public Vitals build() {
            return new Vitals(heartRate, respiratoryRate, systolic, diastolic, temperature, spo2, gcs);
        }
    }
}
