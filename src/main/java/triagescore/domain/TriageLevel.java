package triagescore.domain;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Discrete five-level triage classification, 1 (most urgent) to 5 (least urgent).
 *
 * <p>Assignment thresholds a normalized acuity score {@code s}:
 * <ul>
 *     <li>Level 1: {@code s >= T1}</li>
 *     <li>Level 2: {@code T2 <= s < T1}</li>
 *     <li>Level 3: {@code T3 <= s < T2}</li>
 *     <li>Level 4: {@code T4 <= s < T3}</li>
 *     <li>Level 5: {@code s < T4}</li>
 * </ul>
 * Wait times and actions are guidance only; institutional protocols override.
 */
public enum TriageLevel {
    RESUSCITATION(1, "Resuscitation", "R", 0,
            "Requires immediate life-saving intervention; do not delay.",
            List.of("Immediate assessment", "Life-saving interventions as indicated", "Continuous monitoring")),
    EMERGENT(2, "Emergent", "E", 15,
            "High risk; should be seen within 15 minutes.",
            List.of("Rapid assessment", "Stabilisation", "Re-evaluate within 15 min")),
    URGENT(3, "Urgent", "U", 60,
            "Urgent but stable; target within 60 minutes.",
            List.of("Assessment within 60 min", "Routine monitoring", "Re-evaluate as needed")),
    LESS_URGENT(4, "Less urgent", "L", 120,
            "Less urgent; target within 120 minutes.",
            List.of("Assessment within 120 min", "Routine care", "Re-evaluate if condition changes")),
    NON_URGENT(5, "Non-urgent", "N", 240,
            "Non-urgent; target within 240 minutes.",
            List.of("Assessment within 240 min", "Routine care", "May use fast-track if available"));

    private final int number;
    private final String label;
    private final String shortCode;
    private final int waitTimeMinutes;
    private final String description;
    private final List<String> recommendedActions;

    TriageLevel(int number, String label, String shortCode, int waitTimeMinutes,
                String description, List<String> recommendedActions) {
        this.number = number;
        this.label = label;
        this.shortCode = shortCode;
        this.waitTimeMinutes = waitTimeMinutes;
        this.description = description;
        this.recommendedActions = recommendedActions;
    }

    /**
     * Classify a score against the thresholds, most urgent band first.
     * A score equal to a threshold falls on the more urgent side.
     */
    public static TriageLevel fromScore(double score, Thresholds thresholds) {
        if (score >= thresholds.t1()) {
            return RESUSCITATION;
        }
        if (score >= thresholds.t2()) {
            return EMERGENT;
        }
        if (score >= thresholds.t3()) {
            return URGENT;
        }
        if (score >= thresholds.t4()) {
            return LESS_URGENT;
        }
        return NON_URGENT;
    }

    /**
     * Level for a number 1..5.
     */
    public static Optional<TriageLevel> fromNumber(int number) {
        if (number < 1 || number > 5) {
            return Optional.empty();
        }
        return Optional.of(values()[number - 1]);
    }

    /**
     * Parse a level number, label or short code, case-insensitive.
     */
    public static Optional<TriageLevel> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String key = text.trim().toLowerCase(Locale.ROOT);
        for (TriageLevel level : values()) {
            if (key.equals(String.valueOf(level.number))
                    || key.equals(level.label.toLowerCase(Locale.ROOT))
                    || key.equals(level.shortCode.toLowerCase(Locale.ROOT))) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    public int number() {
        return number;
    }

    public String label() {
        return label;
    }

    public String shortCode() {
        return shortCode;
    }

    public int waitTimeMinutes() {
        return waitTimeMinutes;
    }

    public String description() {
        return description;
    }

    public List<String> recommendedActions() {
        return recommendedActions;
    }

    /**
     * Levels 1 and 2.
     */
    public boolean isHighAcuity() {
        return this == RESUSCITATION || this == EMERGENT;
    }

    /**
     * Levels 4 and 5.
     */
    public boolean isLowAcuity() {
        return this == LESS_URGENT || this == NON_URGENT;
    }

    public boolean isMoreAcuteThan(TriageLevel other) {
        return number < other.number;
    }

    public boolean isLessAcuteThan(TriageLevel other) {
        return number > other.number;
    }

    public int distance(TriageLevel other) {
        return Math.abs(number - other.number);
    }

    /**
     * Counts per level, indexed by level number (index 0 unused).
     */
    public static int[] counts(Collection<TriageLevel> levels) {
        int[] counts = new int[6];
        for (TriageLevel level : levels) {
            counts[Objects.requireNonNull(level, "level cannot be null").number]++;
        }
        return counts;
    }

    /**
     * Proportions per level in [0, 1], indexed by level number (index 0 unused).
     */
    public static double[] proportions(Collection<TriageLevel> levels) {
        int[] counts = counts(levels);
        double[] proportions = new double[6];
        if (levels.isEmpty()) {
            return proportions;
        }
        for (int i = 1; i <= 5; i++) {
            proportions[i] = (double) counts[i] / levels.size();
        }
        return proportions;
    }

    @Override
    public String toString() {
        return label;
    }
}
