package io.perfdash.api.metrics;

import java.time.Duration;
import java.util.List;

/**
 * Abstraction for instrumenting the query surface.
 * Default implementation uses Micrometer.
 */
public interface QueryMetrics {

    /**
     * Record a query that completed, including ones that found no data.
     *
     * @param operation query name, e.g. "devicePerformance"
     * @param duration  time taken to answer
     */
    void recordSuccess(String operation, Duration duration);

    /**
     * Record a query that failed.
     *
     * @param operation query name
     * @param duration  time taken before failure
     * @param error     the exception that ended the query
     */
    void recordFailure(String operation, Duration duration, Throwable error);

    /**
     * Record rows dropped while loading one device folder.
     */
    void recordMalformedRows(String folderName, int count);

    /**
     * Take a snapshot of all query metrics.
     *
     * @return one snapshot per operation seen so far
     */
    List<QueryMetricsSnapshot> snapshot();

    /**
     * @return total number of malformed rows dropped since startup
     */
    long malformedRowsTotal();
}
