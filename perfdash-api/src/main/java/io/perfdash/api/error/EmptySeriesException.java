package io.perfdash.api.error;

/**
 * Statistics were requested over a series with no values for the metric.
 * <p>
 * Callers surface this as "no data", never as a server error.
 */
public class EmptySeriesException extends PerfDashException {

    private final String metricId;

    public EmptySeriesException(String metricId) {
        super("No values for metric: " + metricId, null, true, false);
        this.metricId = metricId;
    }

    public String metricId() {
        return metricId;
    }
}
