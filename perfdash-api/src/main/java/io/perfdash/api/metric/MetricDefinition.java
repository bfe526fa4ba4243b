package io.perfdash.api.metric;

/**
 * One measurable quantity found as a column of the performance files.
 *
 * @param id       stable key used by every series query
 * @param name     display label
 * @param category grouping key (memory, cpu, frame rate, battery)
 * @param unit     display unit, empty for plain counts
 */
public record MetricDefinition(String id, String name, String category, String unit) {

    public MetricDefinition {
        unit = unit == null ? "" : unit;
    }
}
