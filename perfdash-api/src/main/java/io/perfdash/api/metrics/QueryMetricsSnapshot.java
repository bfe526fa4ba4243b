package io.perfdash.api.metrics;

import java.time.Instant;

/**
 * Counters and timings of one query operation at a point in time.
 */
public record QueryMetricsSnapshot(
        String operation,
        long successCount,
        long failureCount,
        double averageResponseTimeMs,
        double maxResponseTimeMs,
        Instant timestamp
) {}
