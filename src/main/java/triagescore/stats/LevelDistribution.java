package triagescore.stats;

/**
 * Counts and proportions of levels 1..5; arrays are indexed by level number, index 0 unused.
 * Values outside 1..5 are ignored.
 */
public record LevelDistribution(int[] counts, double[] proportions, int total) {

    public LevelDistribution {
        counts = counts.clone();
        proportions = proportions.clone();
    }

    public static LevelDistribution of(int[] levels) {
        int[] counts = new int[6];
        int total = 0;
        for (int level : levels) {
            if (level >= 1 && level <= 5) {
                counts[level]++;
                total++;
            }
        }
        double[] proportions = new double[6];
        if (total > 0) {
            for (int i = 1; i <= 5; i++) {
                proportions[i] = (double) counts[i] / total;
            }
        }
        return new LevelDistribution(counts, proportions, total);
    }

    public int count(int level) {
        return level >= 1 && level <= 5 ? counts[level] : 0;
    }

    public double proportion(int level) {
        return level >= 1 && level <= 5 ? proportions[level] : 0.0;
    }

    @Override
    public int[] counts() {
        return counts.clone();
    }

    @Override
    public double[] proportions() {
        return proportions.clone();
    }
}
