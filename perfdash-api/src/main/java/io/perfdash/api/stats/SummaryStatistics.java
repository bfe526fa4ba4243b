package io.perfdash.api.stats;

/**
 * Mean, max and min of one metric over the samples that carry it.
 * Values are unrounded; rounding is a presentation concern.
 */
public record SummaryStatistics(
        String metricId,
        int count,
        double mean,
        double max,
        double min
) {}
