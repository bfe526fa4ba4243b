package io.perfdash.core.report;

import io.perfdash.api.report.ReportGenerator;

import java.util.Locale;

/**
 * Lookup of the built-in report generators by format name.
 */
public final class ReportGenerators {

    private ReportGenerators() {}

    /**
     * @param format {@code html}, {@code csv} or {@code json}, case-insensitive; null means html
     * @throws IllegalArgumentException for any other format
     */
    public static ReportGenerator forFormat(String format) {
        String name = format == null || format.isBlank() ? "html" : format.trim().toLowerCase(Locale.ROOT);
        return switch (name) {
            case "html" -> new HtmlReportGenerator();
            case "csv" -> new CsvReportGenerator();
            case "json" -> new JsonReportGenerator();
            default -> throw new IllegalArgumentException("Unsupported report format: " + format);
        };
    }
}
