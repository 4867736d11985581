package triagescore.domain;

/**
 * Outcome of scoring one observation.
 *
 * @param score normalized acuity score in [0, 1]
 * @param level triage level derived from the score
 */
public record Evaluation(double score, TriageLevel level) {
}
