package triagescore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagescore.core.Preset;
import triagescore.core.ScoringEngine;
import triagescore.core.TriageProcessor;
import triagescore.domain.ReferenceRanges;
import triagescore.domain.TriageLevel;
import triagescore.export.ResultExporter;
import triagescore.export.TriageResult;
import triagescore.input.CohortEntry;
import triagescore.input.CohortReader;
import triagescore.output.ConsoleResultOutput;
import triagescore.stats.ScoreSummary;

import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point: scores a cohort file (or the bundled sample cohort),
 * prints every result and finishes with a per-level report.
 */
public class TriageApplication {
    private static final Logger logger = LoggerFactory.getLogger(TriageApplication.class);

    private final Options options;
    private final CohortReader reader;
    private final ConsoleResultOutput console;
    private final TriageProcessor processor;

    /**
     * Parsed command-line configuration.
     *
     * @param cohortFile cohort path, or null for the bundled sample
     */
    public record Options(String cohortFile, Preset preset, String population,
                          boolean verbose, boolean colorized) {

        /**
         * Positional arguments: {@code [cohortFile|-] [preset] [population] [verbose] [colorized]}.
         *
         * @throws IllegalArgumentException on an unknown preset or population
         */
        public static Options parse(String[] args) {
            String cohortFile = args.length > 0 && !"-".equals(args[0]) ? args[0] : null;
            Preset preset = args.length > 1 ? Preset.fromName(args[1]) : Preset.DEFAULT;
            String population = args.length > 2 ? args[2] : "adult";
            // fail early on a bad population name
            ReferenceRanges.forPopulation(population);
            boolean verbose = args.length > 3 && Boolean.parseBoolean(args[3]);
            boolean colorized = args.length <= 4 || Boolean.parseBoolean(args[4]);
            return new Options(cohortFile, preset, population, verbose, colorized);
        }
    }

    public TriageApplication(Options options) {
        this.options = options;
        this.reader = new CohortReader();
        this.console = new ConsoleResultOutput(options.verbose(), options.colorized());
        ScoringEngine engine = new ScoringEngine(options.preset().params(),
                ReferenceRanges.forPopulation(options.population()));
        this.processor = new TriageProcessor(engine, console);
    }

    /**
     * Load, score and report. Returns the results in cohort order.
     */
    public List<TriageResult> run() {
        logger.info("════════════════════════════════════════════════════════");
        logger.info("Triage acuity scoring - preset {}, {} ranges", options.preset(), options.population());
        logger.info("════════════════════════════════════════════════════════");

        List<CohortEntry> entries = loadCohort();
        processor.start();
        List<TriageResult> results;
        try {
            results = processor.process(entries);
        } finally {
            processor.stop();
        }

        console.printLevelReport(ResultExporter.levelReport(results));
        logSummary(results);
        return results;
    }

    public TriageProcessor getProcessor() {
        return processor;
    }

    private List<CohortEntry> loadCohort() {
        if (options.cohortFile() == null) {
            logger.info("No cohort file given, using bundled {}", CohortReader.SAMPLE_COHORT);
            return reader.readSample();
        }
        return reader.read(Path.of(options.cohortFile()));
    }

    private void logSummary(List<TriageResult> results) {
        double[] scores = results.stream().mapToDouble(TriageResult::acuity).toArray();
        ScoreSummary summary = ScoreSummary.of(scores);
        TriageProcessor.ProcessorStatistics stats = processor.getStatistics();

        logger.info("Final Statistics:");
        logger.info("   • Evaluated: {}", stats.getTotalEvaluated());
        logger.info("   • Clamped inputs: {}", stats.getTotalClamped());
        logger.info("   • High acuity (levels 1-2): {}",
                stats.getLevelCount(TriageLevel.RESUSCITATION) + stats.getLevelCount(TriageLevel.EMERGENT));
        logger.info("   • Mean acuity: {} (95% CI {} - {})",
                String.format("%.4f", summary.mean()),
                String.format("%.4f", summary.ci95Low()),
                String.format("%.4f", summary.ci95High()));
        logger.info("   • Output errors: {}", stats.getOutputErrors());
    }

    /**
     * Run with the given arguments and return the process exit status.
     */
    static int execute(String[] args) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid arguments: {}", e.getMessage());
            logger.error("Usage: TriageApplication [cohortFile|-] [default|strict|lenient|research] "
                    + "[adult|pediatric] [verbose] [colorized]");
            return 2;
        }

        logger.info("Configuration:");
        logger.info("  • Cohort: {}", options.cohortFile() != null ? options.cohortFile() : CohortReader.SAMPLE_COHORT);
        logger.info("  • Preset: {}", options.preset());
        logger.info("  • Population: {}", options.population());
        logger.info("  • Verbose: {}", options.verbose());
        logger.info("  • Colorized: {}", options.colorized());

        try {
            new TriageApplication(options).run();
            return 0;
        } catch (Exception e) {
            logger.error("Triage run failed", e);
            return 1;
        }
    }

    /**
     * Main entry point.
     *
     * @param args command line arguments:
     *             [0] - cohort JSON file, or "-" for the bundled sample (default: sample)
     *             [1] - parameter preset (default: default)
     *             [2] - reference population (default: adult)
     *             [3] - verbose (default: false)
     *             [4] - colorized (default: true)
     */
    public static void main(String[] args) {
        int status = execute(args);
        if (status != 0) {
            System.exit(status);
        }
    }
}
