package io.perfdash.api.report;

import java.nio.file.Path;

/**
 * Generates a report from a device's performance data.
 * Implementations can produce HTML, CSV, JSON, or any other format.
 */
public interface ReportGenerator {

    /**
     * Generate a report file.
     *
     * @param report     the assembled report
     * @param outputPath path where the report file should be written
     * @return the path to the generated report
     */
    Path generate(PerformanceReport report, Path outputPath);

    /**
     * Render the report without touching the filesystem.
     */
    String render(PerformanceReport report);

    /**
     * @return the format name (e.g., "HTML", "CSV", "JSON")
     */
    String format();
}
