package triagescore.output;

import triagescore.domain.TriageLevel;
import triagescore.export.LevelReportRow;
import triagescore.export.TriageResult;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Prints results to standard output, one line each or as a detailed block,
 * with the level optionally coloured.
 */
public class ConsoleResultOutput implements ResultOutput {

    private final boolean verbose;
    private final boolean colorized;
    private final DateTimeFormatter timeFormatter;

    // ANSI color codes
    private static final class Colors {
        static final String RESET = "\u001B[0m";
        static final String BRIGHT = "\u001B[1m";
        static final String DIM = "\u001B[2m";
        static final String RED = "\u001B[31m";
        static final String GREEN = "\u001B[32m";
        static final String YELLOW = "\u001B[33m";
        static final String BLUE = "\u001B[34m";
        static final String MAGENTA = "\u001B[35m";
        static final String CYAN = "\u001B[36m";
    }

    /**
     * @param verbose   detailed block per result instead of one line
     * @param colorized use ANSI colours
     */
    public ConsoleResultOutput(boolean verbose, boolean colorized) {
        this.verbose = verbose;
        this.colorized = colorized;
        this.timeFormatter = DateTimeFormatter.ISO_LOCAL_DATE_TIME
                .withZone(ZoneId.systemDefault());
    }

    /**
     * Compact and colorized.
     */
    public ConsoleResultOutput() {
        this(false, true);
    }

    @Override
    public void send(TriageResult result) {
        try {
            if (verbose) {
                printVerbose(result);
            } else {
                printCompact(result);
            }
        } catch (Exception e) {
            System.err.println("Console output error: " + e.getMessage());
            return;
        }
        // PrintStream swallows IOExceptions and reports them through checkError()
        if (System.out.checkError()) {
            System.err.println("Console output error: write failure");
        }
    }

    @Override
    public void close() {
        // nothing to release
    }

    /**
     * Print the per-level table.
     */
    public void printLevelReport(List<LevelReportRow> rows) {
        String bright = color(Colors.BRIGHT);
        String cyan = color(Colors.CYAN);
        String reset = color(Colors.RESET);

        System.out.println(cyan + "━".repeat(60) + reset);
        System.out.println(bright + "LEVEL REPORT" + reset);
        System.out.println(cyan + "━".repeat(60) + reset);
        for (LevelReportRow row : rows) {
            String levelColor = color(levelColor(row.level()));
            System.out.println(String.format(Locale.ROOT, "%s%d %-14s%s %4d  %5.1f%%  mean %.3f  [%.3f, %.3f]",
                    levelColor, row.level(), row.levelLabel(), reset,
                    row.count(), row.pct(), row.meanAcuity(), row.minAcuity(), row.maxAcuity()));
        }
    }

    private void printVerbose(TriageResult result) {
        String cyan = color(Colors.CYAN);
        String bright = color(Colors.BRIGHT);
        String yellow = color(Colors.YELLOW);
        String dim = color(Colors.DIM);
        String reset = color(Colors.RESET);
        String levelColor = color(levelColor(result.level()));

        System.out.println(cyan + "━".repeat(60) + reset);
        System.out.println(bright + "TRIAGE RESULT" + reset);
        System.out.println(cyan + "━".repeat(60) + reset);

        if (result.id() != null) {
            System.out.println(yellow + "Patient:" + reset + " " + result.id());
        }
        if (result.timestamp() != null) {
            System.out.println(yellow + "Timestamp:" + reset + " " + timeFormatter.format(result.timestamp()));
        }
        System.out.println(yellow + "Acuity:" + reset + " " + formatScore(result.acuity()));
        System.out.println(yellow + "Level:" + reset + " " + levelColor + result.level() + " "
                + result.levelLabel() + reset);
        System.out.println(yellow + "Resources:" + reset + " " + result.resourceCount());
        System.out.println(dim + "─".repeat(50) + reset);
        printVital("Heart rate", result.hr(), "bpm");
        printVital("Respiratory rate", result.rr(), "/min");
        printVital("Systolic BP", result.sbp(), "mmHg");
        printVital("Diastolic BP", result.dbp(), "mmHg");
        printVital("Temperature", result.temp(), "°C");
        printVital("SpO2", result.spo2(), "%");
        printVital("GCS", result.gcs(), "");

        result.triageLevel().ifPresent(level -> {
            System.out.println(dim + level.description() + reset);
            for (String action : level.recommendedActions()) {
                System.out.println("  - " + action);
            }
        });
        System.out.println();
    }

    private void printCompact(TriageResult result) {
        String bright = color(Colors.BRIGHT);
        String dim = color(Colors.DIM);
        String reset = color(Colors.RESET);
        String levelColor = color(levelColor(result.level()));

        String who = result.id() != null ? result.id() : "-";
        System.out.println(bright + "[" + who + "]" + reset + " "
                + levelColor + "L" + result.level() + " " + result.levelLabel() + reset
                + " acuity=" + formatScore(result.acuity())
                + " " + dim + "(" + vitalsSummary(result) + ")" + reset);
    }

    private void printVital(String name, double value, String unit) {
        String green = color(Colors.GREEN);
        String blue = color(Colors.BLUE);
        String dim = color(Colors.DIM);
        String reset = color(Colors.RESET);
        if (value == 0) {
            System.out.println("  " + green + name + reset + " " + dim + "missing" + reset);
        } else {
            String shown = value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
            System.out.println("  " + green + name + reset + " " + shown + " " + blue + unit + reset);
        }
    }

    private static String vitalsSummary(TriageResult r) {
        return "HR " + r.hr() + ", RR " + r.rr() + ", BP " + r.sbp() + "/" + r.dbp()
                + ", T " + r.temp() + ", SpO2 " + r.spo2() + ", GCS " + r.gcs()
                + ", res " + r.resourceCount();
    }

    private static String formatScore(double score) {
        return String.format(Locale.ROOT, "%.3f", score);
    }

    private static String levelColor(int level) {
        return TriageLevel.fromNumber(level).map(l -> switch (l) {
            case RESUSCITATION -> Colors.RED;
            case EMERGENT -> Colors.MAGENTA;
            case URGENT -> Colors.YELLOW;
            case LESS_URGENT -> Colors.GREEN;
            case NON_URGENT -> Colors.BLUE;
        }).orElse(Colors.DIM);
    }

    private String color(String colorCode) {
        return colorized ? colorCode : "";
    }
}
