package io.perfdash.api.metric;

import java.util.List;

/**
 * Metrics of one category, in catalog order.
 */
public record MetricGroup(String category, List<MetricDefinition> metrics) {

    public MetricGroup {
        metrics = List.copyOf(metrics);
    }
}
