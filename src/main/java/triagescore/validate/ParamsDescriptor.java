package triagescore.validate;

import java.util.Arrays;
import java.util.Objects;

/**
 * Plain description of a parameter set, structurally equal to the scoring
 * parameters, so validation does not depend on the engine's own types.
 *
 * @param vitalWeights   seven weights in vital index order
 * @param maxResources   resource saturation point
 * @param resourceWeight weight of the resource component
 * @param t1             level 1 threshold
 * @param t2             level 2 threshold
 * @param t3             level 3 threshold
 * @param t4             level 4 threshold
 */
public record ParamsDescriptor(
        double[] vitalWeights,
        int maxResources,
        double resourceWeight,
        double t1,
        double t2,
        double t3,
        double t4
) {
    public ParamsDescriptor {
        vitalWeights = vitalWeights == null ? new double[0] : vitalWeights.clone();
    }

    @Override
    public double[] vitalWeights() {
        return vitalWeights.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParamsDescriptor other)) return false;
        return maxResources == other.maxResources
                && Double.compare(resourceWeight, other.resourceWeight) == 0
                && Double.compare(t1, other.t1) == 0
                && Double.compare(t2, other.t2) == 0
                && Double.compare(t3, other.t3) == 0
                && Double.compare(t4, other.t4) == 0
                && Arrays.equals(vitalWeights, other.vitalWeights);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(vitalWeights), maxResources, resourceWeight, t1, t2, t3, t4);
    }

    @Override
    public String toString() {
        return String.format("ParamsDescriptor{weights=%s, maxResources=%d, resourceWeight=%s, "
                        + "thresholds=[%s, %s, %s, %s]}",
                Arrays.toString(vitalWeights), maxResources, resourceWeight, t1, t2, t3, t4);
    }
}
