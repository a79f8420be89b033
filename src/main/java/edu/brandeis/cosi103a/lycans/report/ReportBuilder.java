package edu.brandeis.cosi103a.lycans.report;

import edu.brandeis.cosi103a.lycans.model.GameLog;
import edu.brandeis.cosi103a.lycans.model.GameRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI that reads a game log and writes every report to a single JSON file.
 *
 * <p>Invocation:
 * <pre>
 * java -cp lycans-stats.jar edu.brandeis.cosi103a.lycans.report.ReportBuilder \
 *   --input ./data/season-3/gamelog.json \
 *   --output ./data/season-3/reports.json \
 *   --mod-only --map Village
 * </pre>
 */
public final class ReportBuilder {

    static final String DEFAULT_OUTPUT_NAME = "reports.json";

    private ReportBuilder() {}

    public static void main(String[] args) {
        if (args.length == 0) {
            printUsage();
            System.exit(1);
        }
        try {
            ReportOptions options = parseArgs(args);
            StatsReport report = buildReport(options);
            System.out.printf("%d games analyzed, %d players, reports written to %s%n",
                report.gamesAnalyzed(), report.players().players().size(), options.output());
            if (!report.unmappedRoles().isEmpty()) {
                System.out.println("Roles counted as Villageois: " + String.join(", ", report.unmappedRoles()));
            }
        } catch (IllegalArgumentException | UncheckedIOException e) {
            System.err.println("Report failed: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Reads the input log, filters it and writes the report file.
     *
     * @throws IllegalArgumentException if the input file does not exist
     * @throws UncheckedIOException     if the log cannot be read or the report cannot be written
     */
    static StatsReport buildReport(ReportOptions options) {
        try {
            GameLog log = new GameLogReader().read(options.input());
            List<GameRecord> games = options.filter().apply(log.gameStats());
            StatsReport report = StatsReport.build(log.modVersion(), games);
            new ReportFileWriter().write(options.output(), report);
            return report;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to build reports for " + options.input(), e);
        }
    }

    /**
     * Parses CLI arguments into report options.
     *
     * @throws IllegalArgumentException if required arguments are missing
     */
    static ReportOptions parseArgs(String[] args) {
        Path input = null;
        Path output = null;
        boolean modOnly = false;
        String map = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--input" -> input = Path.of(valueOf(args, ++i, "--input"));
                case "--output" -> output = Path.of(valueOf(args, ++i, "--output"));
                case "--mod-only" -> modOnly = true;
                case "--map" -> map = valueOf(args, ++i, "--map");
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        if (input == null) {
            throw new IllegalArgumentException("Missing required argument: --input");
        }
        if (output == null) {
            output = input.resolveSibling(DEFAULT_OUTPUT_NAME);
        }
        return new ReportOptions(input, output, new GameFilter(modOnly, map));
    }

    private static String valueOf(String[] args, int i, String flag) {
        if (i >= args.length) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[i];
    }

    private static void printUsage() {
        System.err.println("Usage: java -cp lycans-stats.jar edu.brandeis.cosi103a.lycans.report.ReportBuilder [options]");
        System.err.println();
        System.err.println("Options:");
        System.err.println("  --input <gamelog.json>     Game log export to analyze (required)");
        System.err.println("  --output <reports.json>    Report file (default: reports.json next to the input)");
        System.err.println("  --mod-only                 Only count games played with the mod");
        System.err.println("  --map <name>               Only count games played on this map");
    }
}
