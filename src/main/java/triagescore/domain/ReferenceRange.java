package triagescore.domain;

/**
 * Normal range of one vital, given as midpoint and half-width.
 * A half-width of zero or less disables the vital for scoring.
 */
public record ReferenceRange(double mid, double halfWidth) {

    /**
     * Range that disables its vital.
     */
    public static final ReferenceRange DISABLED = new ReferenceRange(0.0, 0.0);

    /**
     * Normalized deviation of a value from this range, {@code min(1, |value - mid| / halfWidth)}.
     * Returns 0 when the range is disabled. Missing-value sentinels are not special here.
     */
    public double deviation(double value) {
        return deviation(value, mid, halfWidth);
    }

    public boolean isEnabled() {
        return halfWidth > 0;
    }

    public double lowerBound() {
        return mid - halfWidth;
    }

    public double upperBound() {
        return mid + halfWidth;
    }

    /**
     * The deviation primitive shared by every vital.
     *
     * @param value     observed value
     * @param mid       reference midpoint
     * @param halfWidth reference half-width
     * @return deviation in [0, 1]; 0 if {@code halfWidth <= 0}
     */
    public static double deviation(double value, double mid, double halfWidth) {
        if (halfWidth <= 0) {
            return 0.0;
        }
        double d = Math.abs(value - mid) / halfWidth;
        return d > 1.0 ? 1.0 : d;
    }

    /**
     * Map {@code x} from [low, high] to [0, 1], clamping outside values.
     * Returns 0 if {@code low >= high}.
     */
    public static double normalizeLinear(double x, double low, double high) {
        if (low >= high || x <= low) {
            return 0.0;
        }
        if (x >= high) {
            return 1.0;
        }
        return (x - low) / (high - low);
    }

    /**
     * Clamp {@code x} to [low, high]. Returns low if the interval is inverted.
     */
    public static double clampToRange(double x, double low, double high) {
        if (low > high) {
            return low;
        }
        return Math.max(low, Math.min(high, x));
    }

    /**
     * Whether {@code low <= x <= high}; always false for an inverted interval.
     */
    public static boolean inRange(double x, double low, double high) {
        return low <= high && x >= low && x <= high;
    }
}
