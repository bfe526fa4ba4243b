package io.perfdash.core.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.perfdash.api.config.DashboardConfig;
import io.perfdash.api.device.DeviceRecord;
import io.perfdash.api.error.InvalidRangeException;
import io.perfdash.api.error.NotFoundException;
import io.perfdash.api.metric.MetricGroup;
import io.perfdash.api.metrics.QueryMetricsSnapshot;
import io.perfdash.api.report.AssessmentLevel;
import io.perfdash.api.report.PerformanceReport;
import io.perfdash.api.sample.Sample;
import io.perfdash.api.series.AlignedSeries;
import io.perfdash.api.stats.SummaryStatistics;
import io.perfdash.core.ArtifactTree;
import io.perfdash.core.catalog.MetricCatalog;
import io.perfdash.core.metrics.MicrometerQueryMetrics;
import io.perfdash.core.report.CsvReportGenerator;
import io.perfdash.core.store.FileSystemArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DashboardQueryServiceTest {

    private static final String PIXEL = "Pixel7_20240101_120000";
    private static final String GALAXY = "GalaxyS23_20240101_120000";

    @TempDir
    Path tempDir;

    private MicrometerQueryMetrics metrics;
    private DashboardQueryService service;

    @BeforeEach
    void setUp() {
        ArtifactTree tree = new ArtifactTree(tempDir);
        tree.device(PIXEL).info("Google Pixel 7", "14").performance("app_performance.csv",
                ArtifactTree.HEADER,
                "2024-01-01 12:00:00,409600,10,5,36",
                "2024-01-01 12:00:10,,,,",
                "2024-01-01 12:00:20,614400,20,15,38",
                "garbage row");
        tree.device(GALAXY).info("Samsung Galaxy S23", "13").performance("app_performance.csv",
                ArtifactTree.HEADER,
                "2024-01-01 12:00:05,204800,40,25,41",
                "2024-01-01 12:00:20,204800,50,25,42");

        DashboardConfig config = DashboardConfig.create().artifactRoot(tempDir);
        metrics = new MicrometerQueryMetrics(new SimpleMeterRegistry());
        service = new DashboardQueryService(new FileSystemArtifactStore(config), MetricCatalog.defaults(), metrics);
    }

    private static LocalDateTime at(int second) {
        return LocalDateTime.of(2024, 1, 1, 12, 0, second);
    }

    // ─── Listing ───

    @Test
    void shouldListDevicesAndGroupedMetrics() {
        assertThat(service.listDevices()).hasSize(2);
        assertThat(service.listMetrics()).extracting(MetricGroup::category)
                .containsExactly("Memory", "CPU", "Frame rate", "Battery");
    }

    @Test
    void detailShouldPassRawMetadataThrough() {
        assertThat(service.deviceDetail(PIXEL).raw().path("model").path("full_name").asText())
                .isEqualTo("Google Pixel 7");
    }

    // ─── Performance ───

    @Test
    void performanceShouldBeFilteredInclusively() {
        List<Sample> samples = service.devicePerformance(PIXEL, at(10), at(20));

        assertThat(samples).extracting(Sample::timestamp).containsExactly(at(10), at(20));
    }

    @Test
    void performanceOutsideDataIsEmpty() {
        assertThat(service.devicePerformance(PIXEL, at(50), at(59))).isEmpty();
    }

    @Test
    void invertedRangeFailsBeforeFolderLookup() {
        assertThatThrownBy(() -> service.devicePerformance("Ghost_20240101_000000", at(20), at(10)))
                .isInstanceOf(InvalidRangeException.class);
    }

    @Test
    void malformedRowsAreCounted() {
        service.devicePerformance(PIXEL, null, null);

        assertThat(metrics.malformedRowsTotal()).isEqualTo(1);
    }

    // ─── Comparison ───

    @Test
    void alignShouldMergeDevicesOnSharedAxis() {
        AlignedSeries series = service.align(List.of(PIXEL, GALAXY), "cpu_percentage", null, null);

        assertThat(series.axis()).containsExactly(at(0), at(5), at(10), at(20));
        assertThat(series.lines()).extracting(AlignedSeries.Line::label)
                .containsExactly("Google Pixel 7", "Samsung Galaxy S23");
        assertThat(series.lines().get(0).values()).containsExactly(10.0, null, null, 20.0);
        assertThat(series.lines().get(1).values()).containsExactly(null, 40.0, null, 50.0);
    }

    @Test
    void alignShouldIgnoreRepeatedDevices() {
        AlignedSeries series = service.align(List.of(GALAXY, PIXEL, GALAXY), "cpu_percentage", null, null);

        assertThat(series.lines()).extracting(AlignedSeries.Line::deviceId).containsExactly(GALAXY, PIXEL);
    }

    @Test
    void alignUnknownMetricIsNotFound() {
        assertThatThrownBy(() -> service.align(List.of(PIXEL), "gpu_load", null, null))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void alignUnknownDeviceIsNotFound() {
        assertThatThrownBy(() -> service.align(List.of(PIXEL, "Ghost_20240101_000000"), "cpu_percentage", null, null))
                .isInstanceOfSatisfying(NotFoundException.class,
                        e -> assertThat(e.identifier()).isEqualTo("Ghost_20240101_000000"));
        assertThat(service.align(List.of(PIXEL), "cpu_percentage", null, null).hasData()).isTrue();
    }

    @Test
    void corruptMetadataShouldNotBreakComparison() {
        String broken = "Broken_20240101_120000";
        new ArtifactTree(tempDir).device(broken)
                .file("device_info_" + broken + ".json", "{ not json")
                .performance("app_performance.csv", ArtifactTree.HEADER, "2024-01-01 12:00:05,1,70,2,30");

        AlignedSeries series = service.align(List.of(PIXEL, broken), "cpu_percentage", null, null);

        assertThat(series.lines()).extracting(AlignedSeries.Line::label).containsExactly("Google Pixel 7", broken);
        assertThat(series.lines().get(1).values()).containsExactly(null, 70.0, null, null);
        assertThat(service.listDevices()).extracting(DeviceRecord::folderName).containsExactly(GALAXY, PIXEL);
    }

    @Test
    void lineSummariesShouldSkipMissingValues() {
        AlignedSeries series = service.align(List.of(PIXEL, GALAXY), "cpu_percentage", at(5), at(10));

        Map<String, Optional<SummaryStatistics>> summaries = service.lineSummaries(series);

        assertThat(summaries.get(PIXEL)).isEmpty();
        assertThat(summaries.get(GALAXY)).hasValueSatisfying(s -> assertThat(s.mean()).isEqualTo(40.0));
    }

    // ─── Summary ───

    @Test
    void summaryShouldExcludeMissingValues() {
        Optional<SummaryStatistics> stats = service.summary(PIXEL, "cpu_percentage", null, null);

        assertThat(stats).hasValueSatisfying(s -> {
            assertThat(s.count()).isEqualTo(2);
            assertThat(s.mean()).isEqualTo(15.0);
            assertThat(s.max()).isEqualTo(20.0);
            assertThat(s.min()).isEqualTo(10.0);
        });
    }

    @Test
    void summaryOfEmptyWindowIsNoData() {
        assertThat(service.summary(PIXEL, "cpu_percentage", at(10), at(10))).isEmpty();
    }

    @Test
    void summaryUnknownMetricIsNotFound() {
        assertThatThrownBy(() -> service.summary(PIXEL, "gpu_load", null, null)).isInstanceOf(NotFoundException.class);
    }

    // ─── Report ───

    @Test
    void reportShouldSummarizeAndAssess() {
        PerformanceReport report = service.report(GALAXY, null, null);

        assertThat(report.deviceName()).isEqualTo("Samsung Galaxy S23");
        assertThat(report.androidVersion()).isEqualTo("13");
        assertThat(report.sampleCount()).isEqualTo(2);
        assertThat(report.firstSample()).isEqualTo(at(5));
        assertThat(report.lastSample()).isEqualTo(at(20));
        assertThat(report.summaries()).extracting(s -> s.metric().id())
                .containsExactly("memory_total", "cpu_percentage", "janky_percent", "battery_temperature");
        assertThat(report.assessments()).extracting(a -> a.level())
                .containsExactly(AssessmentLevel.GOOD, AssessmentLevel.HIGH, AssessmentLevel.HIGH, AssessmentLevel.HIGH);
    }

    @Test
    void reportShouldFallBackToFolderNameWhenMetadataIsNotAnObject() {
        String broken = "Broken_20240101_120000";
        new ArtifactTree(tempDir).device(broken)
                .file("device_info_" + broken + ".json", "[1, 2, 3]")
                .performance("app_performance.csv", ArtifactTree.HEADER, "2024-01-01 12:00:05,1,70,2,30");

        PerformanceReport report = service.report(broken, null, null);

        assertThat(report.deviceName()).isEqualTo(broken);
        assertThat(report.androidVersion()).isEmpty();
        assertThat(report.sampleCount()).isEqualTo(1);
    }

    @Test
    void reportOfEmptyWindowHasNoSummaries() {
        PerformanceReport report = service.report(PIXEL, at(50), at(59));

        assertThat(report.sampleCount()).isZero();
        assertThat(report.firstSample()).isNull();
        assertThat(report.summaries()).isEmpty();
        assertThat(report.assessments()).isEmpty();
        assertThat(report.malformedRows()).isEqualTo(1);
    }

    @Test
    void reportShouldBeWritten() {
        Path written = service.writeReport(PIXEL, null, null, new CsvReportGenerator(), tempDir.resolve("out/pixel.csv"));

        assertThat(written).exists().hasFileName("pixel-summary.csv");
    }

    // ─── Instrumentation and concurrency ───

    @Test
    void queriesShouldBeTimedPerOperation() {
        service.listDevices();
        service.summary(PIXEL, "cpu_percentage", null, null);
        assertThatThrownBy(() -> service.summary(PIXEL, "nope", null, null)).isInstanceOf(NotFoundException.class);

        List<QueryMetricsSnapshot> snapshot = service.metrics().snapshot();

        assertThat(snapshot).extracting(QueryMetricsSnapshot::operation).containsExactly("listDevices", "summary");
        assertThat(snapshot.get(1).successCount()).isEqualTo(1);
        assertThat(snapshot.get(1).failureCount()).isEqualTo(1);
    }

    @Test
    void concurrentQueriesShouldNotInterfere() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            Callable<AlignedSeries> query = () -> service.align(List.of(PIXEL, GALAXY), "memory_total", null, null);
            List<Future<AlignedSeries>> futures = pool.invokeAll(Collections.nCopies(32, query));

            AlignedSeries expected = service.align(List.of(PIXEL, GALAXY), "memory_total", null, null);
            for (Future<AlignedSeries> future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS)).isEqualTo(expected);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
