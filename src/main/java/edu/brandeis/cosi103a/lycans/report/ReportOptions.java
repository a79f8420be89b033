package edu.brandeis.cosi103a.lycans.report;

import java.nio.file.Path;

/**
 * Parsed command line of {@link ReportBuilder}.
 */
public record ReportOptions(Path input, Path output, GameFilter filter) {}
