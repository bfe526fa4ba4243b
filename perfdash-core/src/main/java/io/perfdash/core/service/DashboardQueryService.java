package io.perfdash.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.perfdash.api.config.DashboardConfig;
import io.perfdash.api.device.DeviceDetail;
import io.perfdash.api.device.DeviceRecord;
import io.perfdash.api.error.EmptySeriesException;
import io.perfdash.api.error.PerfDashException;
import io.perfdash.api.metric.MetricDefinition;
import io.perfdash.api.metric.MetricGroup;
import io.perfdash.api.metrics.QueryMetrics;
import io.perfdash.api.report.PerformanceReport;
import io.perfdash.api.report.ReportGenerator;
import io.perfdash.api.sample.DeviceSeries;
import io.perfdash.api.sample.Sample;
import io.perfdash.api.sample.SampleLoad;
import io.perfdash.api.series.AlignedSeries;
import io.perfdash.api.stats.SummaryStatistics;
import io.perfdash.api.store.ArtifactStore;
import io.perfdash.core.align.SeriesAligner;
import io.perfdash.core.catalog.MetricCatalog;
import io.perfdash.core.filter.TimeRangeFilter;
import io.perfdash.core.metrics.MicrometerQueryMetrics;
import io.perfdash.core.report.PerformanceAssessor;
import io.perfdash.core.stats.SummaryCalculator;
import io.perfdash.core.store.FileSystemArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Request/response query surface over the device artifacts.
 * <p>
 * Stateless: every answer is derived from the artifacts on disk and the request
 * parameters. The only shared state is the immutable metric catalog, so
 * concurrent requests never interfere.
 * <p>
 * Usage:
 * <pre>{@code
 * var config = DashboardConfig.create().artifactRoot(Path.of("results"));
 * var service = new DashboardQueryService(config);
 *
 * List<DeviceRecord> devices = service.listDevices();
 * AlignedSeries cpu = service.align(
 *         List.of(devices.get(0).folderName(), devices.get(1).folderName()),
 *         "cpu_percentage", null, null);
 * }</pre>
 */
public class DashboardQueryService {

    private static final Logger log = LoggerFactory.getLogger(DashboardQueryService.class);

    private final ArtifactStore store;
    private final MetricCatalog catalog;
    private final QueryMetrics metrics;
    private final TimeRangeFilter filter = new TimeRangeFilter();
    private final SeriesAligner aligner = new SeriesAligner();
    private final SummaryCalculator calculator = new SummaryCalculator();
    private final PerformanceAssessor assessor = new PerformanceAssessor();

    public DashboardQueryService(DashboardConfig config) {
        this(new FileSystemArtifactStore(config), MetricCatalog.load(config), new MicrometerQueryMetrics());
    }

    public DashboardQueryService(ArtifactStore store, MetricCatalog catalog, QueryMetrics metrics) {
        this.store = store;
        this.catalog = catalog;
        this.metrics = metrics;
    }

    public List<DeviceRecord> listDevices() {
        return timed("listDevices", store::listDevices);
    }

    public List<MetricGroup> listMetrics() {
        return timed("listMetrics", catalog::grouped);
    }

    public DeviceDetail deviceDetail(String folderName) {
        return timed("deviceDetail", () -> store.deviceDetail(folderName));
    }

    public List<JsonNode> appInfo(String folderName) {
        return timed("appInfo", () -> store.appInfo(folderName));
    }

    /**
     * A device's samples inside the window, ascending by timestamp.
     *
     * @return an empty list when nothing falls inside the window
     */
    public List<Sample> devicePerformance(String folderName, LocalDateTime start, LocalDateTime end) {
        return timed("devicePerformance", () -> {
            filter.validate(start, end);
            return filter.filter(load(folderName).samples(), start, end);
        });
    }

    /**
     * Merge several devices onto one axis for one metric.
     * Repeated folder names are compared once, at their first position.
     */
    public AlignedSeries align(List<String> folderNames, String metricId,
                               LocalDateTime start, LocalDateTime end) {
        return timed("align", () -> {
            filter.validate(start, end);
            catalog.require(metricId);

            List<DeviceSeries> inputs = new ArrayList<>();
            for (String folderName : new LinkedHashSet<>(folderNames)) {
                List<Sample> samples = filter.filter(load(folderName).samples(), start, end);
                inputs.add(new DeviceSeries(folderName, labelOf(folderName), samples));
            }
            return aligner.align(inputs, metricId);
        });
    }

    /**
     * Mean, max and min of one metric of one device inside the window.
     *
     * @return empty when the device has no value for the metric in the window
     */
    public Optional<SummaryStatistics> summary(String folderName, String metricId,
                                               LocalDateTime start, LocalDateTime end) {
        return timed("summary", () -> {
            filter.validate(start, end);
            catalog.require(metricId);
            List<Sample> samples = filter.filter(load(folderName).samples(), start, end);
            try {
                return Optional.of(calculator.summarize(samples, metricId));
            } catch (EmptySeriesException e) {
                log.debug("No data for {} on {}", metricId, folderName);
                return Optional.empty();
            }
        });
    }

    /**
     * Statistics of every line of an aligned series, keyed by device.
     * Devices without any value map to an empty optional.
     */
    public Map<String, Optional<SummaryStatistics>> lineSummaries(AlignedSeries series) {
        Map<String, Optional<SummaryStatistics>> summaries = new LinkedHashMap<>();
        for (AlignedSeries.Line line : series.lines()) {
            try {
                summaries.put(line.deviceId(), Optional.of(calculator.summarize(series.metricId(), line.values())));
            } catch (EmptySeriesException e) {
                summaries.put(line.deviceId(), Optional.empty());
            }
        }
        return summaries;
    }

    /**
     * Assemble a performance report of one device run inside the window.
     */
    public PerformanceReport report(String folderName, LocalDateTime start, LocalDateTime end) {
        return timed("report", () -> {
            filter.validate(start, end);
            SampleLoad load = load(folderName);
            List<Sample> samples = filter.filter(load.samples(), start, end);

            List<PerformanceReport.MetricSummary> summaries = new ArrayList<>();
            Map<String, SummaryStatistics> byMetric = new LinkedHashMap<>();
            for (MetricDefinition metric : catalog.all()) {
                try {
                    SummaryStatistics stats = calculator.summarize(samples, metric.id());
                    summaries.add(new PerformanceReport.MetricSummary(metric, stats));
                    byMetric.put(metric.id(), stats);
                } catch (EmptySeriesException e) {
                    log.debug("Report for {} has no data for {}", folderName, metric.id());
                }
            }

            String deviceName = folderName;
            String androidVersion = "";
            try {
                DeviceDetail detail = store.deviceDetail(folderName);
                deviceName = detail.fullName().isEmpty() ? folderName : detail.fullName();
                androidVersion = detail.androidVersion();
            } catch (PerfDashException e) {
                log.warn("Report for {} has no usable device metadata: {}", folderName, e.getMessage());
            }

            return new PerformanceReport(
                    folderName,
                    deviceName,
                    androidVersion,
                    samples.isEmpty() ? null : samples.get(0).timestamp(),
                    samples.isEmpty() ? null : samples.get(samples.size() - 1).timestamp(),
                    load.malformedRows(),
                    summaries,
                    assessor.assess(byMetric),
                    samples
            );
        });
    }

    /**
     * Assemble a report and write it with the given generator.
     *
     * @return the path of the written file
     */
    public Path writeReport(String folderName, LocalDateTime start, LocalDateTime end,
                            ReportGenerator generator, Path outputPath) {
        PerformanceReport report = report(folderName, start, end);
        Path written = generator.generate(report, outputPath);
        log.info("{} report for {} written to {}", generator.format(), folderName, written);
        return written;
    }

    public MetricCatalog catalog() {
        return catalog;
    }

    public QueryMetrics metrics() {
        return metrics;
    }

    private SampleLoad load(String folderName) {
        SampleLoad load = store.loadSamples(folderName);
        metrics.recordMalformedRows(folderName, load.malformedRows());
        return load;
    }

    private String labelOf(String folderName) {
        try {
            String name = store.deviceDetail(folderName).fullName();
            return name.isEmpty() ? folderName : name;
        } catch (PerfDashException e) {
            log.debug("Labelling {} by folder name: {}", folderName, e.getMessage());
            return folderName;
        }
    }

    private <T> T timed(String operation, Supplier<T> query) {
        long start = System.nanoTime();
        try {
            T result = query.get();
            metrics.recordSuccess(operation, Duration.ofNanos(System.nanoTime() - start));
            return result;
        } catch (RuntimeException e) {
            metrics.recordFailure(operation, Duration.ofNanos(System.nanoTime() - start), e);
            throw e;
        }
    }
}
