package io.perfdash.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.perfdash.api.metrics.QueryMetrics;
import io.perfdash.api.metrics.QueryMetricsSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Default query instrumentation using Micrometer.
 * Times every query per operation, counts failures per operation and error
 * type, and counts malformed rows per device folder.
 */
public class MicrometerQueryMetrics implements QueryMetrics {

    static final String QUERY_TIME = "perfdash.query.time";
    static final String QUERY_SUCCESS = "perfdash.query.success";
    static final String QUERY_FAILURE = "perfdash.query.failure";
    static final String MALFORMED_ROWS = "perfdash.rows.malformed";

    private final MeterRegistry registry;
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, Counter> successCounters = new ConcurrentHashMap<>();
    private final Map<FailureKey, Counter> failureCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> malformedCounters = new ConcurrentHashMap<>();

    public MicrometerQueryMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MicrometerQueryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordSuccess(String operation, Duration duration) {
        getTimer(operation).record(duration);
        getSuccessCounter(operation).increment();
    }

    @Override
    public void recordFailure(String operation, Duration duration, Throwable error) {
        getTimer(operation).record(duration);
        getFailureCounter(operation, error.getClass().getSimpleName()).increment();
    }

    @Override
    public void recordMalformedRows(String folderName, int count) {
        if (count <= 0) {
            return;
        }
        malformedCounters.computeIfAbsent(folderName, name ->
                Counter.builder(MALFORMED_ROWS)
                        .tag("device", name)
                        .register(registry)).increment(count);
    }

    @Override
    public List<QueryMetricsSnapshot> snapshot() {
        List<QueryMetricsSnapshot> snapshots = new ArrayList<>();
        Instant now = Instant.now();

        for (String operation : timers.keySet().stream().sorted().toList()) {
            Timer timer = timers.get(operation);
            long success = (long) getSuccessCounter(operation).count();
            long failure = (long) failureCounters.entrySet().stream()
                    .filter(e -> e.getKey().operation().equals(operation))
                    .mapToDouble(e -> e.getValue().count())
                    .sum();

            snapshots.add(new QueryMetricsSnapshot(
                    operation,
                    success,
                    failure,
                    timer.mean(TimeUnit.MILLISECONDS),
                    timer.max(TimeUnit.MILLISECONDS),
                    now
            ));
        }
        return snapshots;
    }

    @Override
    public long malformedRowsTotal() {
        return (long) malformedCounters.values().stream().mapToDouble(Counter::count).sum();
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Timer getTimer(String operation) {
        return timers.computeIfAbsent(operation, name ->
                Timer.builder(QUERY_TIME)
                        .tag("operation", name)
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(registry));
    }

    private Counter getSuccessCounter(String operation) {
        return successCounters.computeIfAbsent(operation, name ->
                Counter.builder(QUERY_SUCCESS)
                        .tag("operation", name)
                        .register(registry));
    }

    private Counter getFailureCounter(String operation, String errorType) {
        return failureCounters.computeIfAbsent(new FailureKey(operation, errorType), key ->
                Counter.builder(QUERY_FAILURE)
                        .tag("operation", key.operation())
                        .tag("error", key.errorType())
                        .register(registry));
    }

    private record FailureKey(String operation, String errorType) {}
}
