package io.perfdash.api.report;

/**
 * Verdict on one area of a device run, derived from the mean of its headline metric.
 *
 * @param area     "memory", "cpu", "smoothness" or "temperature"
 * @param metricId metric the verdict is based on
 * @param value    mean value compared against the thresholds, in {@code unit}
 * @param unit     unit of {@code value}
 * @param level    verdict
 * @param message  human readable advice
 */
public record Assessment(
        String area,
        String metricId,
        double value,
        String unit,
        AssessmentLevel level,
        String message
) {}
