package io.perfdash.web.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.perfdash.api.config.DashboardConfig;
import io.perfdash.api.device.DeviceDetail;
import io.perfdash.api.device.DeviceRecord;
import io.perfdash.api.sample.SampleLoad;
import io.perfdash.api.store.ArtifactStore;
import io.perfdash.core.catalog.MetricCatalog;
import io.perfdash.core.metrics.MicrometerQueryMetrics;
import io.perfdash.core.service.DashboardQueryService;
import io.perfdash.web.environment.DashboardEnvironment;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class DashboardWebServerTest {

    private static final String PIXEL = "Pixel7_20240101_120000";
    private static final String GALAXY = "GalaxyS23_20240101_120000";

    @TempDir
    static Path root;

    private static DashboardEnvironment environment;
    private static final HttpClient client = HttpClient.newHttpClient();
    private static final ObjectMapper mapper = new ObjectMapper();

    @BeforeAll
    static void startServer() throws IOException {
        writeDevice(PIXEL, "Google Pixel 7", """
                timestamp,memory_total,cpu_percentage
                2024-01-01 12:00:00,409600,10
                2024-01-01 12:00:10,409600,
                2024-01-01 12:00:20,614400,20
                """);
        writeDevice(GALAXY, "Samsung Galaxy S23", """
                timestamp,memory_total,cpu_percentage
                2024-01-01 12:00:05,204800,40
                """);
        Files.writeString(root.resolve(PIXEL).resolve("apk_info.json"), "{\"package\": \"com.example.app\"}");

        environment = new DashboardEnvironment(DashboardConfig.create().artifactRoot(root).port(0));
        environment.startServer();

        await().atMost(Duration.ofSeconds(10)).until(() -> get("/api/devices").statusCode() == 200);
    }

    @AfterAll
    static void stopServer() {
        environment.shutdown();
    }

    private static void writeDevice(String folder, String name, String csv) throws IOException {
        Path dir = Files.createDirectories(root.resolve(folder));
        Files.writeString(dir.resolve("device_info_" + folder + ".json"),
                "{\"device_id\": \"" + folder + "\", \"model\": {\"full_name\": \"" + name + "\"}, \"android\": {\"version\": \"14\"}}");
        Files.writeString(dir.resolve("app_performance.csv"), csv);
    }

    private static HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + environment.port() + path))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(String path, int expectedStatus) throws IOException, InterruptedException {
        HttpResponse<String> response = get(path);
        assertThat(response.statusCode()).as(path).isEqualTo(expectedStatus);
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(v -> assertThat(v).startsWith("application/json"));
        return mapper.readTree(response.body());
    }

    // ─── Listing ───

    @Test
    void shouldListDevices() throws Exception {
        JsonNode devices = json("/api/devices", 200);

        assertThat(devices).hasSize(2);
        assertThat(devices.get(0).path("folderName").asText()).isEqualTo(GALAXY);
        assertThat(devices.get(1).path("displayName").asText()).isEqualTo("Google Pixel 7");
    }

    @Test
    void shouldListMetricsFlatAndGrouped() throws Exception {
        assertThat(json("/api/metrics", 200)).hasSize(10);

        JsonNode groups = json("/api/metrics?grouped=true", 200);
        assertThat(groups.get(0).path("category").asText()).isEqualTo("Memory");
        assertThat(groups.get(0).path("metrics").get(0).path("id").asText()).isEqualTo("memory_total");
    }

    // ─── Device resources ───

    @Test
    void shouldServeRawDeviceInfo() throws Exception {
        JsonNode info = json("/api/device/" + PIXEL + "/info", 200);

        assertThat(info.path("model").path("full_name").asText()).isEqualTo("Google Pixel 7");
    }

    @Test
    void shouldServeAppInfo() throws Exception {
        JsonNode app = json("/api/device/" + PIXEL + "/app", 200);

        assertThat(app).hasSize(1);
        assertThat(app.get(0).path("package").asText()).isEqualTo("com.example.app");
    }

    @Test
    void shouldServeFlattenedPerformanceRows() throws Exception {
        JsonNode perf = json("/api/device/" + PIXEL + "/performance?start_time=2024-01-01T12:00:05", 200);

        assertThat(perf.path("count").asInt()).isEqualTo(2);
        JsonNode first = perf.path("samples").get(0);
        assertThat(first.path("timestamp").asText()).isEqualTo("2024-01-01 12:00:10");
        assertThat(first.has("cpu_percentage")).isFalse();
        assertThat(perf.path("samples").get(1).path("cpu_percentage").asDouble()).isEqualTo(20.0);
    }

    @Test
    void emptyWindowIsNotAnError() throws Exception {
        JsonNode perf = json("/api/device/" + PIXEL + "/performance?start_time=2030-01-01%2000:00:00", 200);

        assertThat(perf.path("count").asInt()).isZero();
        assertThat(perf.path("samples")).isEmpty();
    }

    @Test
    void shouldSummarizeMetric() throws Exception {
        JsonNode summary = json("/api/device/" + PIXEL + "/summary?metric=cpu_percentage", 200);

        assertThat(summary.path("noData").asBoolean()).isFalse();
        assertThat(summary.path("count").asInt()).isEqualTo(2);
        assertThat(summary.path("mean").asDouble()).isEqualTo(15.0);
        assertThat(summary.path("max").asDouble()).isEqualTo(20.0);
        assertThat(summary.path("min").asDouble()).isEqualTo(10.0);
    }

    @Test
    void summaryWithoutDataIsFlaggedNotFailed() throws Exception {
        JsonNode summary = json("/api/device/" + PIXEL + "/summary?metric=battery_level", 200);

        assertThat(summary.path("noData").asBoolean()).isTrue();
        assertThat(summary.path("mean").isNull()).isTrue();
    }

    @Test
    void shouldServeHtmlAndJsonReports() throws Exception {
        HttpResponse<String> html = get("/api/device/" + PIXEL + "/report");
        assertThat(html.statusCode()).isEqualTo(200);
        assertThat(html.headers().firstValue("Content-Type")).hasValueSatisfying(v -> assertThat(v).startsWith("text/html"));
        assertThat(html.body()).contains("Google Pixel 7 - Performance Report");

        JsonNode report = json("/api/device/" + PIXEL + "/report?format=json", 200);
        assertThat(report.path("folderName").asText()).isEqualTo(PIXEL);
        assertThat(report.path("summaries")).hasSize(2);
    }

    // ─── Comparison ───

    @Test
    void shouldCompareDevicesOnSharedAxis() throws Exception {
        JsonNode cmp = json("/api/compare?devices=" + PIXEL + "," + GALAXY + "&metric=cpu_percentage", 200);

        assertThat(cmp.path("axis")).hasSize(4);
        assertThat(cmp.path("axis").get(0).asText()).isEqualTo("2024-01-01 12:00:00");
        JsonNode lines = cmp.path("lines");
        assertThat(lines).hasSize(2);
        for (JsonNode line : lines) {
            assertThat(line.path("values")).hasSize(4);
            assertThat(line.path("color").asText()).startsWith("rgb(");
        }
        assertThat(lines.get(0).path("values").get(1).isNull()).isTrue();
        assertThat(lines.get(1).path("label").asText()).isEqualTo("Samsung Galaxy S23");
        assertThat(lines.get(1).path("summary").path("mean").asDouble()).isEqualTo(40.0);
        assertThat(cmp.path("hasData").asBoolean()).isTrue();
    }

    // ─── Errors ───

    @Test
    void unknownDeviceIs404() throws Exception {
        JsonNode error = json("/api/device/Ghost_20240101_000000/performance", 404);

        assertThat(error.path("id").asText()).isEqualTo("Ghost_20240101_000000");
        assertThat(error.path("error").asText()).contains("Ghost_20240101_000000");
    }

    @Test
    void unknownMetricIs404() throws Exception {
        json("/api/compare?devices=" + PIXEL + "&metric=gpu_load", 404);
    }

    @Test
    void invertedRangeIs400() throws Exception {
        JsonNode error = json("/api/device/" + PIXEL + "/performance?start_time=2024-01-01%2012:00:20&end_time=2024-01-01%2012:00:00", 400);

        assertThat(error.path("error").asText()).contains("start_time");
    }

    @Test
    void badTimestampIs400() throws Exception {
        json("/api/device/" + PIXEL + "/performance?end_time=yesterday", 400);
    }

    @Test
    void missingParameterIs400() throws Exception {
        json("/api/compare?metric=cpu_percentage", 400);
        json("/api/device/" + PIXEL + "/summary", 400);
    }

    @Test
    void unknownResourceIs404() throws Exception {
        json("/api/device/" + PIXEL + "/nothing", 404);
    }

    // ─── Dashboard and instrumentation ───

    @Test
    void unexpectedFailureIsJson500() throws Exception {
        DashboardWebServer failing = new DashboardWebServer(
                new DashboardQueryService(new BrokenStore(), MetricCatalog.defaults(), new MicrometerQueryMetrics()), 0);
        failing.start();
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create("http://localhost:" + failing.getPort() + "/api/devices"))
                    .GET()
                    .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(response.headers().firstValue("Content-Type"))
                    .hasValueSatisfying(v -> assertThat(v).startsWith("application/json"));
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.path("status").asInt()).isEqualTo(500);
            assertThat(body.path("error").asText()).isEqualTo("Internal server error");
        } finally {
            failing.stop();
        }
    }

    @Test
    void shouldServeDashboardWithPalette() throws Exception {
        HttpResponse<String> page = get("/");

        assertThat(page.statusCode()).isEqualTo(200);
        assertThat(page.body()).contains("<title>PerfDash</title>");
        assertThat(page.body()).contains("enterCompare");
        assertThat(page.body()).contains("'rgb(75, 192, 192)'");
        assertThat(page.body()).doesNotContain("__PALETTE__");
    }

    @Test
    void shouldExposeQueryMetrics() throws Exception {
        get("/api/devices");

        JsonNode metrics = json("/api/server/metrics", 200);

        assertThat(metrics.path("queries").findValuesAsText("operation")).contains("listDevices");
    }

    private static final class BrokenStore implements ArtifactStore {

        @Override
        public List<DeviceRecord> listDevices() {
            throw new IllegalStateException("disk vanished");
        }

        @Override
        public DeviceDetail deviceDetail(String folderName) {
            throw new IllegalStateException("disk vanished");
        }

        @Override
        public SampleLoad loadSamples(String folderName) {
            throw new IllegalStateException("disk vanished");
        }

        @Override
        public List<JsonNode> appInfo(String folderName) {
            throw new IllegalStateException("disk vanished");
        }
    }
}
