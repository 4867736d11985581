package triagescore.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of the seven reference ranges, one per {@link Vital}.
 * Derivation methods return new instances; an instance is never mutated.
 */
public final class ReferenceRanges {

    private static final ReferenceRanges ADULT = builder()
            .range(Vital.HEART_RATE, 80, 40)
            .range(Vital.RESPIRATORY_RATE, 16, 10)
            .range(Vital.SYSTOLIC_BP, 120, 40)
            .range(Vital.DIASTOLIC_BP, 80, 30)
            .range(Vital.TEMPERATURE, 37.0, 2.0)
            .range(Vital.SPO2, 98, 8)
            .range(Vital.GCS, 15, 6)
            .build();

    // Illustrative paediatric values; calibrate per protocol.
    private static final ReferenceRanges PEDIATRIC = builder()
            .range(Vital.HEART_RATE, 100, 50)
            .range(Vital.RESPIRATORY_RATE, 24, 14)
            .range(Vital.SYSTOLIC_BP, 90, 30)
            .range(Vital.DIASTOLIC_BP, 60, 25)
            .range(Vital.TEMPERATURE, 37.0, 2.0)
            .range(Vital.SPO2, 98, 8)
            .range(Vital.GCS, 15, 6)
            .build();

    private final Map<Vital, ReferenceRange> ranges;

    private ReferenceRanges(Map<Vital, ReferenceRange> ranges) {
        EnumMap<Vital, ReferenceRange> copy = new EnumMap<>(Vital.class);
        for (Vital vital : Vital.values()) {
            copy.put(vital, ranges.getOrDefault(vital, ReferenceRange.DISABLED));
        }
        this.ranges = Collections.unmodifiableMap(copy);
    }

    /**
     * Standard adult emergency department ranges.
     */
    public static ReferenceRanges adult() {
        return ADULT;
    }

    public static ReferenceRanges pediatric() {
        return PEDIATRIC;
    }

    /**
     * Look up a population by name ("adult" or "pediatric", case-insensitive).
     *
     * @throws IllegalArgumentException for an unknown population
     */
    public static ReferenceRanges forPopulation(String population) {
        Objects.requireNonNull(population, "population cannot be null");
        return switch (population.trim().toLowerCase(Locale.ROOT)) {
            case "adult" -> ADULT;
            case "pediatric", "paediatric" -> PEDIATRIC;
            default -> throw new IllegalArgumentException("Unknown population: " + population);
        };
    }

    /**
     * Builder starting with every vital disabled.
     */
    public static Builder builder() {
        return new Builder(Map.of());
    }

    public Builder toBuilder() {
        return new Builder(ranges);
    }

    public ReferenceRange of(Vital vital) {
        return ranges.get(vital);
    }

    public Map<Vital, ReferenceRange> asMap() {
        return ranges;
    }

    /**
     * Copy with one range replaced.
     */
    public ReferenceRanges with(Vital vital, ReferenceRange range) {
        return toBuilder().range(vital, range).build();
    }

    /**
     * Copy where every range of {@code overrides} with a positive half-width replaces ours.
     */
    public ReferenceRanges mergeWith(ReferenceRanges overrides) {
        Builder builder = toBuilder();
        for (Vital vital : Vital.values()) {
            ReferenceRange override = overrides.of(vital);
            if (override.isEnabled()) {
                builder.range(vital, override);
            }
        }
        return builder.build();
    }

    /**
     * Copy with all half-widths multiplied by {@code factor}; midpoints unchanged.
     * Returns this instance if {@code factor <= 0}.
     */
    public ReferenceRanges scaleHalfWidths(double factor) {
        if (factor <= 0) {
            return this;
        }
        Builder builder = toBuilder();
        for (Vital vital : Vital.values()) {
            ReferenceRange r = of(vital);
            builder.range(vital, r.mid(), r.halfWidth() * factor);
        }
        return builder.build();
    }

    /**
     * True if every half-width is non-negative and all values are finite.
     */
    public boolean isValid() {
        for (ReferenceRange r : ranges.values()) {
            if (r.halfWidth() < 0 || !Double.isFinite(r.mid()) || !Double.isFinite(r.halfWidth())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReferenceRanges other)) return false;
        return ranges.equals(other.ranges);
    }

    @Override
    public int hashCode() {
        return ranges.hashCode();
    }

    @Override
    public String toString() {
        return "ReferenceRanges" + ranges;
    }

    public static final class Builder {
        private final EnumMap<Vital, ReferenceRange> ranges = new EnumMap<>(Vital.class);

        private Builder(Map<Vital, ReferenceRange> initial) {
            ranges.putAll(initial);
        }

        public Builder range(Vital vital, double mid, double halfWidth) {
            return range(vital, new ReferenceRange(mid, halfWidth));
        }

        public Builder range(Vital vital, ReferenceRange range) {
            ranges.put(Objects.requireNonNull(vital, "vital cannot be null"),
                    Objects.requireNonNull(range, "range cannot be null"));
            return this;
        }

        public ReferenceRanges build() {
            return new ReferenceRanges(ranges);
        }
    }
}
