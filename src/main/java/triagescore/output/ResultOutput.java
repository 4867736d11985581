package triagescore.output;

import triagescore.export.TriageResult;

/**
 * Destination for triage results.
 */
public interface ResultOutput {
    /**
     * Deliver one result.
     *
     * @param result the scored observation
     * @throws RuntimeException if delivery fails
     */
    void send(TriageResult result);

    /**
     * Called once before the first result.
     */
    default void initialize() {
        // no-op
    }

    /**
     * Release resources. Must be idempotent.
     */
    void close();
}
