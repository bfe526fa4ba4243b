package io.perfdash.web.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.perfdash.api.error.InvalidRangeException;
import io.perfdash.api.error.NotFoundException;
import io.perfdash.api.error.PerfDashException;
import io.perfdash.api.metrics.QueryMetricsSnapshot;
import io.perfdash.api.report.ReportGenerator;
import io.perfdash.api.sample.Sample;
import io.perfdash.api.series.AlignedSeries;
import io.perfdash.api.stats.SummaryStatistics;
import io.perfdash.core.align.SeriesPalette;
import io.perfdash.core.filter.TimeRangeFilter;
import io.perfdash.core.report.ReportGenerators;
import io.perfdash.core.service.DashboardQueryService;
import io.perfdash.core.support.JsonSupport;
import io.perfdash.core.support.Timestamps;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.catalina.Context;
import org.apache.catalina.startup.Tomcat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Embedded Tomcat server that provides:
 * - Dashboard HTML page
 * - JSON API over the device artifacts (devices, metrics, series, summaries, comparison)
 * - Downloadable performance reports
 * - Query instrumentation snapshot
 */
public class DashboardWebServer {

    private static final Logger log = LoggerFactory.getLogger(DashboardWebServer.class);

    private final DashboardQueryService service;
    private final int port;
    private final ObjectMapper objectMapper;
    private Tomcat tomcat;

    public DashboardWebServer(DashboardQueryService service, int port) {
        this.service = service;
        this.port = port;
        this.objectMapper = JsonSupport.newMapper();
    }

    public void start() {
        try {
            tomcat = new Tomcat();
            tomcat.setPort(port);
            tomcat.setBaseDir(System.getProperty("java.io.tmpdir"));
            tomcat.getConnector(); // trigger connector creation

            Context ctx = tomcat.addContext("", null);

            Tomcat.addServlet(ctx, "devices", new DevicesServlet());
            ctx.addServletMappingDecoded("/api/devices", "devices");

            Tomcat.addServlet(ctx, "metrics", new MetricsServlet());
            ctx.addServletMappingDecoded("/api/metrics", "metrics");

            // /api/device/{folder}/{info|app|performance|summary|report}
            Tomcat.addServlet(ctx, "device", new DeviceServlet());
            ctx.addServletMappingDecoded("/api/device/*", "device");

            Tomcat.addServlet(ctx, "compare", new CompareServlet());
            ctx.addServletMappingDecoded("/api/compare", "compare");

            Tomcat.addServlet(ctx, "serverMetrics", new ServerMetricsServlet());
            ctx.addServletMappingDecoded("/api/server/metrics", "serverMetrics");

            // Dashboard at root
            Tomcat.addServlet(ctx, "dashboard", new DashboardServlet());
            ctx.addServletMappingDecoded("/", "dashboard");

            tomcat.start();
            log.info("PerfDash web server started on port {}", getPort());

        } catch (Exception e) {
            throw new IllegalStateException("Failed to start web server", e);
        }
    }

    public void stop() {
        try {
            if (tomcat != null) {
                tomcat.stop();
                tomcat.destroy();
            }
            log.info("Web server stopped");
        } catch (Exception e) {
            log.error("Error stopping web server", e);
        }
    }

    /**
     * @return the bound port, which differs from the configured one when that was 0
     */
    public int getPort() {
        return tomcat != null ? tomcat.getConnector().getLocalPort() : port;
    }

    // --- Request handling ---

    /**
     * JSON endpoint: maps the query error taxonomy onto HTTP status codes.
     */
    private abstract class JsonServlet extends HttpServlet {

        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            resp.setHeader("Access-Control-Allow-Origin", "*");
            try {
                Object body = handle(req, resp);
                if (body != null) {
                    writeJson(resp, HttpServletResponse.SC_OK, body);
                }
            } catch (NotFoundException e) {
                writeError(resp, HttpServletResponse.SC_NOT_FOUND, e.getMessage(), e.identifier());
            } catch (InvalidRangeException | IllegalArgumentException e) {
                writeError(resp, HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
            } catch (PerfDashException e) {
                log.error("Query failed: {} {}", req.getRequestURI(), e.getMessage(), e);
                writeError(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected failure serving {}", req.getRequestURI(), e);
                if (resp.isCommitted()) {
                    throw e;
                }
                resp.reset();
                writeError(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Internal server error");
            }
        }

        /**
         * @return the JSON body, or null when the response was already written
         */
        abstract Object handle(HttpServletRequest req, HttpServletResponse resp) throws IOException;
    }

    private class DevicesServlet extends JsonServlet {
        @Override
        Object handle(HttpServletRequest req, HttpServletResponse resp) {
            return service.listDevices();
        }
    }

    private class MetricsServlet extends JsonServlet {
        @Override
        Object handle(HttpServletRequest req, HttpServletResponse resp) {
            if (Boolean.parseBoolean(req.getParameter("grouped"))) {
                return service.listMetrics();
            }
            return service.catalog().all();
        }
    }

    private class DeviceServlet extends JsonServlet {
        @Override
        Object handle(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            String path = req.getPathInfo() == null ? "" : req.getPathInfo();
            String[] parts = path.startsWith("/") ? path.substring(1).split("/") : path.split("/");
            if (parts.length != 2 || parts[0].isEmpty()) {
                throw new NotFoundException(path, "Unknown device resource: " + path);
            }
            String folder = parts[0];
            LocalDateTime start = TimeRangeFilter.parseBound("start_time", req.getParameter("start_time"));
            LocalDateTime end = TimeRangeFilter.parseBound("end_time", req.getParameter("end_time"));

            return switch (parts[1]) {
                case "info" -> service.deviceDetail(folder).raw();
                case "app" -> service.appInfo(folder);
                case "performance" -> performance(folder, service.devicePerformance(folder, start, end));
                case "summary" -> summary(folder, requireParam(req, "metric"), start, end);
                case "report" -> {
                    writeReport(resp, folder, req.getParameter("format"), start, end);
                    yield null;
                }
                default -> throw new NotFoundException(path, "Unknown device resource: " + parts[1]);
            };
        }
    }

    private class CompareServlet extends JsonServlet {
        @Override
        Object handle(HttpServletRequest req, HttpServletResponse resp) {
            List<String> folders = Arrays.stream(requireParam(req, "devices").split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
            String metric = requireParam(req, "metric");
            LocalDateTime start = TimeRangeFilter.parseBound("start_time", req.getParameter("start_time"));
            LocalDateTime end = TimeRangeFilter.parseBound("end_time", req.getParameter("end_time"));

            AlignedSeries series = service.align(folders, metric, start, end);
            Map<String, Optional<SummaryStatistics>> summaries = service.lineSummaries(series);

            List<LineResponse> lines = new ArrayList<>();
            for (AlignedSeries.Line line : series.lines()) {
                lines.add(new LineResponse(line.deviceId(), line.label(), line.color(),
                        SeriesPalette.fillFor(line.color()), line.values(),
                        summaries.get(line.deviceId()).orElse(null)));
            }
            return new CompareResponse(series.metricId(), series.axis(), lines, series.hasData());
        }
    }

    private class ServerMetricsServlet extends JsonServlet {
        @Override
        Object handle(HttpServletRequest req, HttpServletResponse resp) {
            return new ServerMetricsResponse(service.metrics().snapshot(), service.metrics().malformedRowsTotal());
        }
    }

    private class DashboardServlet extends HttpServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            if (!"/".equals(req.getServletPath()) && !req.getServletPath().isEmpty()) {
                writeError(resp, HttpServletResponse.SC_NOT_FOUND, "No such page: " + req.getRequestURI());
                return;
            }
            resp.setContentType("text/html");
            resp.setCharacterEncoding("UTF-8");
            resp.getWriter().write(DashboardPage.HTML);
        }
    }

    // --- Response shaping ---

    private PerformanceResponse performance(String folder, List<Sample> samples) {
        List<Map<String, Object>> rows = new ArrayList<>(samples.size());
        for (Sample sample : samples) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", Timestamps.format(sample.timestamp()));
            row.putAll(sample.values());
            rows.add(row);
        }
        return new PerformanceResponse(folder, rows.size(), rows);
    }

    private SummaryResponse summary(String folder, String metric, LocalDateTime start, LocalDateTime end) {
        return service.summary(folder, metric, start, end)
                .map(s -> new SummaryResponse(folder, metric, false, s.count(), s.mean(), s.max(), s.min()))
                .orElseGet(() -> new SummaryResponse(folder, metric, true, 0, null, null, null));
    }

    private void writeReport(HttpServletResponse resp, String folder, String format,
                             LocalDateTime start, LocalDateTime end) throws IOException {
        ReportGenerator generator = ReportGenerators.forFormat(format);
        String body = generator.render(service.report(folder, start, end));
        String contentType = switch (generator.format()) {
            case "HTML" -> "text/html";
            case "CSV" -> "text/csv";
            default -> "application/json";
        };
        resp.setStatus(HttpServletResponse.SC_OK);
        resp.setContentType(contentType);
        resp.setCharacterEncoding("UTF-8");
        resp.getWriter().write(body);
    }

    private static String requireParam(HttpServletRequest req, String name) {
        String value = req.getParameter(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required parameter: " + name);
        }
        return value.trim();
    }

    private void writeJson(HttpServletResponse resp, int status, Object body) throws IOException {
        resp.setStatus(status);
        resp.setContentType("application/json");
        resp.setCharacterEncoding("UTF-8");
        resp.getWriter().write(objectMapper.writeValueAsString(body));
    }

    private void writeError(HttpServletResponse resp, int status, String message) throws IOException {
        writeError(resp, status, message, null);
    }

    private void writeError(HttpServletResponse resp, int status, String message, String id) throws IOException {
        writeJson(resp, status, new ErrorResponse(status, message, id));
    }

    // DTOs
    record ErrorResponse(int status, String error, String id) {}
    record PerformanceResponse(String folder, int count, List<Map<String, Object>> samples) {}
    record SummaryResponse(String folder, String metric, boolean noData, int count, Double mean, Double max, Double min) {}
    record LineResponse(String deviceId, String label, String color, String fill, List<Double> values,
                        SummaryStatistics summary) {}
    record CompareResponse(String metric, List<LocalDateTime> axis, List<LineResponse> lines, boolean hasData) {}
    record ServerMetricsResponse(List<QueryMetricsSnapshot> queries, long malformedRows) {}
}
