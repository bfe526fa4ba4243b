package io.perfdash.api.report;

import io.perfdash.api.metric.MetricDefinition;
import io.perfdash.api.sample.Sample;
import io.perfdash.api.stats.SummaryStatistics;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Everything a report generator needs about one device run.
 *
 * @param folderName     device folder
 * @param deviceName     display name of the device
 * @param androidVersion Android release, empty when unknown
 * @param firstSample    timestamp of the first analysed sample, null when there are none
 * @param lastSample     timestamp of the last analysed sample, null when there are none
 * @param malformedRows  rows dropped while loading
 * @param summaries      statistics of every catalog metric that has data
 * @param assessments    threshold verdicts, only for areas that have data
 * @param samples        the analysed samples, for charting
 */
public record PerformanceReport(
        String folderName,
        String deviceName,
        String androidVersion,
        LocalDateTime firstSample,
        LocalDateTime lastSample,
        int malformedRows,
        List<MetricSummary> summaries,
        List<Assessment> assessments,
        List<Sample> samples
) {

    public PerformanceReport {
        summaries = List.copyOf(summaries);
        assessments = List.copyOf(assessments);
        samples = List.copyOf(samples);
    }

    public int sampleCount() {
        return samples.size();
    }

    /**
     * Statistics of one catalog metric.
     */
    public record MetricSummary(MetricDefinition metric, SummaryStatistics statistics) {}
}
