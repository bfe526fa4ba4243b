package io.perfdash.core.stats;

import io.perfdash.api.error.EmptySeriesException;
import io.perfdash.api.sample.Sample;
import io.perfdash.api.stats.SummaryStatistics;

import java.util.DoubleSummaryStatistics;
import java.util.List;

/**
 * Mean, max and min of one metric.
 * Missing values are left out of the calculation entirely, never counted as zero.
 */
public class SummaryCalculator {

    /**
     * @throws EmptySeriesException if no sample carries a value for the metric
     */
    public SummaryStatistics summarize(List<Sample> samples, String metricId) {
        DoubleSummaryStatistics stats = new DoubleSummaryStatistics();
        for (Sample sample : samples) {
            accept(stats, sample.values().get(metricId));
        }
        return toSummary(metricId, stats);
    }

    /**
     * Summarize an aligned line, where {@code null} marks a missing value.
     *
     * @throws EmptySeriesException if every value is missing
     */
    public SummaryStatistics summarize(String metricId, List<Double> values) {
        DoubleSummaryStatistics stats = new DoubleSummaryStatistics();
        for (Double value : values) {
            accept(stats, value);
        }
        return toSummary(metricId, stats);
    }

    private static void accept(DoubleSummaryStatistics stats, Double value) {
        if (value != null && !value.isNaN()) {
            stats.accept(value);
        }
    }

    private static SummaryStatistics toSummary(String metricId, DoubleSummaryStatistics stats) {
        if (stats.getCount() == 0) {
            throw new EmptySeriesException(metricId);
        }
        return new SummaryStatistics(metricId, (int) stats.getCount(),
                stats.getAverage(), stats.getMax(), stats.getMin());
    }
}
