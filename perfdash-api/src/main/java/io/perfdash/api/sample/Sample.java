package io.perfdash.api.sample;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One measurement row of one device.
 * <p>
 * A sample need not carry every known metric; absent metrics are simply
 * missing from {@link #values()}.
 */
public record Sample(LocalDateTime timestamp, Map<String, Double> values) {

    public Sample {
        if (timestamp == null) {
            throw new IllegalArgumentException("Sample timestamp must not be null");
        }
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Optional<Double> value(String metricId) {
        return Optional.ofNullable(values.get(metricId));
    }

    public boolean has(String metricId) {
        return values.containsKey(metricId);
    }
}
