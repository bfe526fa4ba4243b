package io.perfdash.core.report;

import io.perfdash.api.report.PerformanceReport;
import io.perfdash.api.report.ReportGenerator;
import io.perfdash.api.sample.Sample;
import io.perfdash.core.support.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Generates CSV reports from a device run.
 * <p>
 * Produces two files:
 * <ul>
 *   <li>{name}-summary.csv: per-metric summary statistics</li>
 *   <li>{name}-timeseries.csv: every analysed sample, one column per summarized metric</li>
 * </ul>
 * {@link #render(PerformanceReport)} returns the summary table only.
 */
public class CsvReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(CsvReportGenerator.class);

    @Override
    public Path generate(PerformanceReport report, Path outputPath) {
        try {
            Path dir = outputPath.toAbsolutePath().getParent();
            Files.createDirectories(dir);

            String baseName = outputPath.getFileName().toString().replaceFirst("\\.[^.]+$", "");
            Path summaryPath = dir.resolve(baseName + "-summary.csv");
            Path timeseriesPath = dir.resolve(baseName + "-timeseries.csv");

            Files.write(summaryPath, summaryLines(report));
            Files.write(timeseriesPath, timeSeriesLines(report));

            log.info("CSV reports generated: {} and {}", summaryPath, timeseriesPath);
            return summaryPath;

        } catch (IOException e) {
            throw new RuntimeException("Failed to write CSV report", e);
        }
    }

    @Override
    public String render(PerformanceReport report) {
        return String.join("\n", summaryLines(report)) + "\n";
    }

    @Override
    public String format() {
        return "CSV";
    }

    private List<String> summaryLines(PerformanceReport report) {
        List<String> lines = new ArrayList<>();
        lines.add("metric_id,name,category,unit,count,mean,max,min");

        for (var s : report.summaries()) {
            lines.add(String.format(Locale.ROOT, "%s,%s,%s,%s,%d,%.2f,%.2f,%.2f",
                    escapeCsv(s.metric().id()),
                    escapeCsv(s.metric().name()),
                    escapeCsv(s.metric().category()),
                    escapeCsv(s.metric().unit()),
                    s.statistics().count(),
                    s.statistics().mean(),
                    s.statistics().max(),
                    s.statistics().min()
            ));
        }
        return lines;
    }

    private List<String> timeSeriesLines(PerformanceReport report) {
        List<String> metricIds = report.summaries().stream().map(s -> s.metric().id()).toList();

        List<String> lines = new ArrayList<>();
        lines.add("timestamp," + String.join(",", metricIds));

        for (Sample sample : report.samples()) {
            StringBuilder line = new StringBuilder(Timestamps.format(sample.timestamp()));
            for (String metricId : metricIds) {
                line.append(',');
                sample.value(metricId).ifPresent(v -> line.append(formatValue(v)));
            }
            lines.add(line.toString());
        }
        return lines;
    }

    private static String formatValue(double value) {
        return value == Math.rint(value) && Math.abs(value) < 1e15
                ? String.valueOf((long) value)
                : String.valueOf(value);
    }

    private static String escapeCsv(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
