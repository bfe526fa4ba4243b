package io.perfdash.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.perfdash.api.report.Assessment;
import io.perfdash.api.report.AssessmentLevel;
import io.perfdash.api.report.PerformanceReport;
import io.perfdash.api.report.ReportGenerator;
import io.perfdash.api.sample.Sample;
import io.perfdash.core.align.SeriesPalette;
import io.perfdash.core.support.JsonSupport;
import io.perfdash.core.support.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Generates a standalone HTML report of one device run.
 * <p>
 * The report includes:
 * <ul>
 *   <li>Run header (device, Android version, analysed window)</li>
 *   <li>Summary cards (samples, dropped rows, headline means)</li>
 *   <li>Assessment list with a badge per area</li>
 *   <li>Per-metric table with mean, max and min</li>
 *   <li>One time-series chart per metric category</li>
 * </ul>
 * <p>
 * The output is a single self-contained HTML file with Chart.js loaded from CDN.
 */
public class HtmlReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(HtmlReportGenerator.class);

    private final ObjectMapper objectMapper = JsonSupport.newMapper();

    @Override
    public Path generate(PerformanceReport report, Path outputPath) {
        String html = render(report);
        try {
            Files.createDirectories(outputPath.toAbsolutePath().getParent());
            Files.writeString(outputPath, html);
            log.info("Report generated: {}", outputPath.toAbsolutePath());
            return outputPath;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write report to " + outputPath, e);
        }
    }

    @Override
    public String render(PerformanceReport report) {
        // Group summarized metrics by category, catalog order
        Map<String, List<PerformanceReport.MetricSummary>> byCategory = new LinkedHashMap<>();
        for (var summary : report.summaries()) {
            byCategory.computeIfAbsent(summary.metric().category(), k -> new ArrayList<>()).add(summary);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(htmlHead(report.deviceName()));
        sb.append("<body><div class=\"wrap\">\n");

        sb.append(sectionHeader(report));
        sb.append(summaryCards(report));
        sb.append(assessmentList(report.assessments()));
        sb.append(metricTable(report.summaries()));

        List<String> chartIds = new ArrayList<>();
        for (String category : byCategory.keySet()) {
            String id = "chart" + chartIds.size();
            chartIds.add(id);
            sb.append(chartSection(id, category));
        }
        if (report.samples().isEmpty()) {
            sb.append("<div class=\"section empty\">No samples in the analysed window.</div>\n");
        }

        sb.append("<footer>Generated by PerfDash</footer>\n");
        sb.append("</div></body>\n");
        sb.append(chartScript(report.samples(), byCategory, chartIds));
        sb.append("</html>");
        return sb.toString();
    }

    @Override
    public String format() {
        return "HTML";
    }

    // ─── HTML sections ───

    private String htmlHead(String deviceName) {
        return """
                <!DOCTYPE html>
                <html lang="en">
                <head>
                <meta charset="UTF-8">
                <meta name="viewport" content="width=device-width, initial-scale=1.0">
                <title>%s - Performance Report</title>
                <style>
                :root {
                    --bg: #0f1117; --surface: #161b22; --border: #2a3343;
                    --text: #e1e4e8; --muted: #7a8ba5; --dim: #4a5b73;
                    --blue: #3b8bff; --green: #34d399; --red: #ef4444; --amber: #f59e0b;
                }
                * { margin: 0; padding: 0; box-sizing: border-box; }
                body { font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif; background: var(--bg); color: var(--text); }
                .wrap { max-width: 1200px; margin: 0 auto; padding: 40px 24px; }
                .header { margin-bottom: 40px; }
                .header h1 { font-size: 28px; font-weight: 800; margin-bottom: 8px; }
                .header h1 span { color: var(--blue); }
                .header .meta { font-size: 13px; color: var(--muted); display: flex; gap: 24px; flex-wrap: wrap; }
                .cards { display: grid; grid-template-columns: repeat(auto-fit, minmax(160px, 1fr)); gap: 12px; margin-bottom: 40px; }
                .card { background: var(--surface); border: 1px solid var(--border); border-radius: 10px; padding: 20px; }
                .card-label { font-size: 11px; color: var(--dim); text-transform: uppercase; letter-spacing: 1px; margin-bottom: 6px; }
                .card-val { font-size: 26px; font-weight: 800; font-variant-numeric: tabular-nums; }
                .section { margin-bottom: 40px; }
                .section h2 { font-size: 18px; font-weight: 700; margin-bottom: 16px; color: var(--muted); }
                .empty { color: var(--muted); }
                table { width: 100%%; border-collapse: collapse; background: var(--surface); border: 1px solid var(--border); }
                th { text-align: left; padding: 12px 16px; font-size: 11px; text-transform: uppercase; color: var(--dim); border-bottom: 1px solid var(--border); }
                td { padding: 12px 16px; font-size: 14px; border-bottom: 1px solid rgba(42,51,67,0.5); font-variant-numeric: tabular-nums; }
                .metric-name { font-weight: 600; color: var(--blue); }
                .assessments li { list-style: none; margin-bottom: 8px; }
                .badge { display: inline-block; padding: 2px 8px; border-radius: 4px; font-size: 11px; font-weight: 700; margin-right: 8px; }
                .badge-good { background: rgba(52,211,153,0.15); color: var(--green); }
                .badge-normal { background: rgba(245,158,11,0.15); color: var(--amber); }
                .badge-high { background: rgba(239,68,68,0.15); color: var(--red); }
                .chart-box { background: var(--surface); border: 1px solid var(--border); border-radius: 10px; padding: 20px; margin-bottom: 24px; }
                .chart-box h3 { font-size: 14px; color: var(--muted); margin-bottom: 12px; }
                canvas { width: 100%% !important; height: 280px !important; }
                footer { text-align: center; padding: 40px 0 20px; color: var(--dim); font-size: 13px; }
                </style>
                </head>
                """.formatted(escapeHtml(deviceName));
    }

    private String sectionHeader(PerformanceReport report) {
        String window = report.firstSample() == null
                ? "no samples"
                : Timestamps.format(report.firstSample()) + " to " + Timestamps.format(report.lastSample());
        return """
                <div class="header">
                    <h1><span>%s</span> Performance Report</h1>
                    <div class="meta">
                        <span>Folder: %s</span>
                        <span>Android: %s</span>
                        <span>Window: %s</span>
                    </div>
                </div>
                """.formatted(
                escapeHtml(report.deviceName()),
                escapeHtml(report.folderName()),
                report.androidVersion().isEmpty() ? "unknown" : escapeHtml(report.androidVersion()),
                window);
    }

    private String summaryCards(PerformanceReport report) {
        StringBuilder sb = new StringBuilder("<div class=\"cards\">\n");
        sb.append(card("Samples", String.valueOf(report.sampleCount())));
        sb.append(card("Dropped Rows", String.valueOf(report.malformedRows())));
        for (Assessment a : report.assessments()) {
            sb.append(card("Avg " + a.area(), String.format(Locale.ROOT, "%.2f %s", a.value(), a.unit())));
        }
        sb.append("</div>\n");
        return sb.toString();
    }

    private String card(String label, String value) {
        return """
                    <div class="card"><div class="card-label">%s</div><div class="card-val">%s</div></div>
                """.formatted(escapeHtml(label), escapeHtml(value));
    }

    private String assessmentList(List<Assessment> assessments) {
        if (assessments.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("""
                <div class="section">
                <h2>Assessment</h2>
                <ul class="assessments">
                """);
        for (Assessment a : assessments) {
            sb.append("<li><span class=\"badge %s\">%s</span>%s</li>\n".formatted(
                    badgeClass(a.level()), a.level(), escapeHtml(a.message())));
        }
        sb.append("</ul></div>\n");
        return sb.toString();
    }

    private String metricTable(List<PerformanceReport.MetricSummary> summaries) {
        StringBuilder sb = new StringBuilder();
        sb.append("""
                <div class="section">
                <h2>Metrics</h2>
                <table>
                <thead><tr>
                    <th>Metric</th><th>Category</th><th>Samples</th><th>Mean</th><th>Max</th><th>Min</th>
                </tr></thead>
                <tbody>
                """);

        for (var s : summaries) {
            sb.append(String.format(Locale.ROOT, """
                    <tr>
                        <td class="metric-name">%s</td>
                        <td>%s</td>
                        <td>%d</td>
                        <td>%.2f</td>
                        <td>%.2f</td>
                        <td>%.2f</td>
                    </tr>
                    """,
                    escapeHtml(s.metric().name()),
                    escapeHtml(s.metric().category()),
                    s.statistics().count(),
                    s.statistics().mean(),
                    s.statistics().max(),
                    s.statistics().min()));
        }

        sb.append("</tbody></table></div>\n");
        return sb.toString();
    }

    private String chartSection(String id, String title) {
        return """
                <div class="chart-box"><h3>%s</h3><canvas id="%s"></canvas></div>
                """.formatted(escapeHtml(title), id);
    }

    // ─── Chart data & script ───

    private String chartScript(List<Sample> samples,
                               Map<String, List<PerformanceReport.MetricSummary>> byCategory,
                               List<String> chartIds) {
        List<String> labels = samples.stream().map(s -> Timestamps.format(s.timestamp())).toList();

        StringBuilder charts = new StringBuilder();
        int index = 0;
        for (var entry : byCategory.entrySet()) {
            List<Map<String, Object>> datasets = new ArrayList<>();
            int position = 0;
            for (var summary : entry.getValue()) {
                String metricId = summary.metric().id();
                List<Double> data = new ArrayList<>(samples.size());
                for (Sample sample : samples) {
                    data.add(sample.value(metricId).orElse(null));
                }
                String color = SeriesPalette.colorFor(metricId, position++);

                Map<String, Object> dataset = new LinkedHashMap<>();
                dataset.put("label", summary.metric().name());
                dataset.put("data", data);
                dataset.put("borderColor", color);
                dataset.put("backgroundColor", SeriesPalette.fillFor(color));
                dataset.put("tension", 0.1);
                dataset.put("pointRadius", 0);
                dataset.put("borderWidth", 2);
                dataset.put("spanGaps", true);
                datasets.add(dataset);
            }
            charts.append("""
                    new Chart(document.getElementById('%s'), {
                        type: 'line', data: { labels, datasets: %s }, options: { ...chartOpts }
                    });
                    """.formatted(chartIds.get(index++), toJson(datasets)));
        }

        return """
                <script src="https://cdn.jsdelivr.net/npm/chart.js@4.4.1/dist/chart.umd.min.js"></script>
                <script>
                const labels = %s;
                const chartOpts = {
                    responsive: true,
                    animation: false,
                    interaction: { mode: 'index', intersect: false },
                    scales: {
                        x: { ticks: { color: '#7a8ba5', maxTicksLimit: 15, maxRotation: 45, minRotation: 45 }, grid: { color: '#1c2333' } },
                        y: { beginAtZero: true, ticks: { color: '#7a8ba5' }, grid: { color: '#1c2333' } }
                    },
                    plugins: { legend: { labels: { color: '#e1e4e8', usePointStyle: true, pointStyle: 'circle' } } }
                };
                %s</script>
                """.formatted(toJson(labels), charts);
    }

    // ─── Utilities ───

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value).replace("</", "<\\/");
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize chart data", e);
        }
    }

    private static String badgeClass(AssessmentLevel level) {
        return switch (level) {
            case GOOD -> "badge-good";
            case NORMAL -> "badge-normal";
            case HIGH -> "badge-high";
        };
    }

    static String escapeHtml(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#39;");
    }
}
