package triagescore.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagescore.domain.Evaluation;
import triagescore.domain.TriageLevel;
import triagescore.domain.Vitals;
import triagescore.export.TriageResult;
import triagescore.input.CohortEntry;
import triagescore.output.ResultOutput;
import triagescore.validate.VitalsReport;
import triagescore.validate.VitalsValidator;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs cohorts through the scoring engine and hands every result to the outputs.
 * Inputs are sanitized first: out-of-range vitals are clamped and resource counts
 * are limited to {@code [0, maxResources]}.
 */
public class TriageProcessor {
    private static final Logger logger = LoggerFactory.getLogger(TriageProcessor.class);

    private final ScoringEngine engine;
    private final List<ResultOutput> outputs;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<TriageResult> lastResult = new AtomicReference<>();
    private final ProcessorStatistics statistics = new ProcessorStatistics();

    public TriageProcessor(ScoringEngine engine, ResultOutput output) {
        this(engine, List.of(output));
    }

    public TriageProcessor(ScoringEngine engine, ResultOutput output, Clock clock) {
        this(engine, List.of(output), clock);
    }

    public TriageProcessor(ScoringEngine engine, List<ResultOutput> outputs) {
        this(engine, outputs, Clock.systemUTC());
    }

    /**
     * @param engine  scores every entry
     * @param outputs result destinations, at least one
     * @param clock   source of result timestamps
     */
    public TriageProcessor(ScoringEngine engine, List<ResultOutput> outputs, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.outputs = new CopyOnWriteArrayList<>(
                Objects.requireNonNull(outputs, "outputs cannot be null"));
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");

        if (outputs.isEmpty()) {
            throw new IllegalArgumentException("At least one output is required");
        }
    }

    /**
     * Initialize the outputs. Calling it on a running processor does nothing.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            try {
                initializeOutputs();
                statistics.recordStart();
                logger.info("TriageProcessor started with {} output(s), {}", outputs.size(), engine);
            } catch (Exception e) {
                running.set(false);
                closeResources();
                throw new RuntimeException("Failed to start TriageProcessor", e);
            }
        }
    }

    /**
     * Close the outputs.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            closeResources();
            statistics.recordStop();
            logger.info("TriageProcessor stopped. Statistics: {}", statistics);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Score a cohort and send each result to every output, in input order.
     * A stopped processor ignores the call and returns an empty list.
     *
     * @param entries observations to score
     * @return the results, index-aligned with {@code entries}
     */
    public List<TriageResult> process(List<CohortEntry> entries) {
        Objects.requireNonNull(entries, "entries cannot be null");
        if (!running.get()) {
            logger.debug("Ignoring {} entries, processor not running", entries.size());
            return List.of();
        }

        int maxResources = engine.params().maxResources();
        List<Vitals> vitals = new ArrayList<>(entries.size());
        List<Integer> counts = new ArrayList<>(entries.size());
        for (CohortEntry entry : entries) {
            VitalsReport report = VitalsValidator.sanitize(entry.toVitals());
            if (report.wasClamped()) {
                statistics.recordClamped();
                logger.debug("Clamped out-of-range vitals for entry {}", entry.id());
            }
            if (!report.clamped().hasAnyPresent()) {
                statistics.recordNoVitals();
            }
            vitals.add(report.clamped());
            counts.add(VitalsValidator.clampResourceCount(entry.resourceCount(), maxResources));
        }

        List<Evaluation> evaluations = engine.batchEvaluate(vitals, counts);
        Instant now = clock.instant();
        List<TriageResult> results = new ArrayList<>(entries.size());
        for (int i = 0; i < evaluations.size(); i++) {
            TriageResult result = TriageResult.of(vitals.get(i), counts.get(i), evaluations.get(i))
                    .withTimestamp(now)
                    .withId(entries.get(i).id());
            results.add(result);
            lastResult.set(result);
            statistics.recordResult(evaluations.get(i).level());
            distributeToOutputs(result);
        }
        statistics.recordBatch();
        return List.copyOf(results);
    }

    /**
     * Score and distribute a single observation.
     */
    public TriageResult process(CohortEntry entry) {
        List<TriageResult> results = process(List.of(entry));
        return results.isEmpty() ? null : results.get(0);
    }

    /**
     * @return the most recent result, or null if nothing has been processed
     */
    public TriageResult getLastResult() {
        return lastResult.get();
    }

    public ProcessorStatistics getStatistics() {
        return statistics;
    }

    public ScoringEngine getEngine() {
        return engine;
    }

    public void addOutput(ResultOutput output) {
        Objects.requireNonNull(output, "output cannot be null");
        if (running.get()) {
            output.initialize();
        }
        outputs.add(output);
        logger.info("Added new output: {}", output.getClass().getSimpleName());
    }

    /**
     * @return true if the output was registered and has been closed
     */
    public boolean removeOutput(ResultOutput output) {
        boolean removed = outputs.remove(output);
        if (removed) {
            try {
                output.close();
            } catch (Exception e) {
                logger.warn("Error closing removed output", e);
            }
            logger.info("Removed output: {}", output.getClass().getSimpleName());
        }
        return removed;
    }

    private void distributeToOutputs(TriageResult result) {
        for (ResultOutput output : outputs) {
            try {
                output.send(result);
            } catch (Exception e) {
                statistics.recordOutputError();
                logger.error("Error sending to output: {}",
                        output.getClass().getSimpleName(), e);
            }
        }
    }

    private void initializeOutputs() {
        for (ResultOutput output : outputs) {
            try {
                output.initialize();
                logger.debug("Initialized output: {}", output.getClass().getSimpleName());
            } catch (Exception e) {
                logger.error("Failed to initialize output: {}",
                        output.getClass().getSimpleName(), e);
                throw new RuntimeException("Failed to initialize output", e);
            }
        }
    }

    private void closeResources() {
        for (ResultOutput output : outputs) {
            try {
                output.close();
            } catch (Exception e) {
                logger.warn("Error closing output: {}",
                        output.getClass().getSimpleName(), e);
            }
        }
    }

    /**
     * Counters for one processor lifetime.
     */
    public static class ProcessorStatistics {
        private volatile long startTime;
        private volatile long stopTime;
        private volatile long startNano;
        private final AtomicLong totalEvaluated = new AtomicLong();
        private final AtomicLong totalBatches = new AtomicLong();
        private final AtomicLong totalClamped = new AtomicLong();
        private final AtomicLong totalWithoutVitals = new AtomicLong();
        private final AtomicLong outputErrors = new AtomicLong();
        private final AtomicLongArray levelCounts = new AtomicLongArray(6);

        void recordStart() {
            startTime = System.currentTimeMillis();
            startNano = System.nanoTime();
            stopTime = 0;
        }

        void recordStop() {
            stopTime = System.currentTimeMillis();
        }

        void recordResult(TriageLevel level) {
            totalEvaluated.incrementAndGet();
            levelCounts.incrementAndGet(level.number());
        }

        void recordBatch() {
            totalBatches.incrementAndGet();
        }

        void recordClamped() {
            totalClamped.incrementAndGet();
        }

        void recordNoVitals() {
            totalWithoutVitals.incrementAndGet();
        }

        void recordOutputError() {
            outputErrors.incrementAndGet();
        }

        public long getUptime() {
            if (startTime == 0) return 0;
            if (stopTime > 0) {
                return stopTime - startTime;
            }
            long elapsedMs = (System.nanoTime() - startNano) / 1_000_000L;
            return elapsedMs > 0 ? elapsedMs : 1L;
        }

        public long getTotalEvaluated() {
            return totalEvaluated.get();
        }

        public long getTotalBatches() {
            return totalBatches.get();
        }

        public long getTotalClamped() {
            return totalClamped.get();
        }

        public long getTotalWithoutVitals() {
            return totalWithoutVitals.get();
        }

        public long getOutputErrors() {
            return outputErrors.get();
        }

        public long getLevelCount(TriageLevel level) {
            return levelCounts.get(level.number());
        }

        @Override
        public String toString() {
            return String.format("ProcessorStatistics{uptime=%dms, evaluated=%d, batches=%d, " +
                            "clamped=%d, levels=[%d,%d,%d,%d,%d], outputErrors=%d}",
                    getUptime(), totalEvaluated.get(), totalBatches.get(), totalClamped.get(),
                    levelCounts.get(1), levelCounts.get(2), levelCounts.get(3),
                    levelCounts.get(4), levelCounts.get(5), outputErrors.get());
        }
    }
}
