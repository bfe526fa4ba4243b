package io.perfdash.core.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.perfdash.api.config.DashboardConfig;
import io.perfdash.api.error.NotFoundException;
import io.perfdash.api.metric.MetricDefinition;
import io.perfdash.api.metric.MetricGroup;
import io.perfdash.core.support.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The known metrics, grouped by category.
 * <p>
 * Order is deterministic: categories in order of first appearance, then metrics
 * in insertion order within their category. The catalog is immutable and
 * validated once at startup; a bad definition fails construction.
 */
public final class MetricCatalog {

    private static final Logger log = LoggerFactory.getLogger(MetricCatalog.class);

    private final List<MetricDefinition> metrics;
    private final List<MetricGroup> groups;
    private final Map<String, MetricDefinition> byId;

    private MetricCatalog(List<MetricDefinition> definitions) {
        Map<String, List<MetricDefinition>> byCategory = new LinkedHashMap<>();
        Map<String, MetricDefinition> index = new LinkedHashMap<>();

        for (MetricDefinition definition : definitions) {
            validate(definition);
            if (index.putIfAbsent(definition.id(), definition) != null) {
                throw new IllegalStateException("Duplicate metric id in catalog: " + definition.id());
            }
            byCategory.computeIfAbsent(definition.category(), k -> new ArrayList<>()).add(definition);
        }

        List<MetricGroup> grouped = new ArrayList<>();
        List<MetricDefinition> flat = new ArrayList<>();
        byCategory.forEach((category, members) -> {
            grouped.add(new MetricGroup(category, members));
            flat.addAll(members);
        });

        this.groups = List.copyOf(grouped);
        this.metrics = List.copyOf(flat);
        this.byId = Collections.unmodifiableMap(index);
    }

    public static MetricCatalog of(List<MetricDefinition> definitions) {
        return new MetricCatalog(definitions);
    }

    /**
     * The columns written by the performance collector.
     */
    public static MetricCatalog defaults() {
        return of(List.of(
                new MetricDefinition("memory_total", "Total memory (KB)", "Memory", "KB"),
                new MetricDefinition("memory_java_heap", "Java heap (KB)", "Memory", "KB"),
                new MetricDefinition("memory_native_heap", "Native heap (KB)", "Memory", "KB"),
                new MetricDefinition("memory_pss_total", "PSS total (KB)", "Memory", "KB"),
                new MetricDefinition("cpu_percentage", "CPU usage (%)", "CPU", "%"),
                new MetricDefinition("total_frames", "Total frames", "Frame rate", ""),
                new MetricDefinition("janky_frames", "Janky frames", "Frame rate", ""),
                new MetricDefinition("janky_percent", "Janky frame ratio (%)", "Frame rate", "%"),
                new MetricDefinition("battery_level", "Battery level (%)", "Battery", "%"),
                new MetricDefinition("battery_temperature", "Battery temperature (°C)", "Battery", "°C")
        ));
    }

    /**
     * Load a catalog from a JSON array of {@code {id, name, category, unit}} objects.
     *
     * @throws IllegalStateException if the file cannot be read or holds an invalid catalog
     */
    public static MetricCatalog fromJson(Path file) {
        ObjectMapper mapper = JsonSupport.newMapper();
        try {
            List<MetricDefinition> definitions = mapper.readValue(file.toFile(), new TypeReference<>() {});
            MetricCatalog catalog = of(definitions);
            log.info("Loaded {} metric(s) in {} categories from {}", catalog.size(), catalog.groups.size(), file);
            return catalog;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read metric catalog: " + file, e);
        }
    }

    /**
     * The configured catalog file, or the built-in defaults when none is set.
     */
    public static MetricCatalog load(DashboardConfig config) {
        return config.metricsFile() != null ? fromJson(config.metricsFile()) : defaults();
    }

    /**
     * @return every metric, category by category
     */
    public List<MetricDefinition> all() {
        return metrics;
    }

    public List<MetricGroup> grouped() {
        return groups;
    }

    public Optional<MetricDefinition> find(String metricId) {
        return Optional.ofNullable(byId.get(metricId));
    }

    /**
     * @throws NotFoundException if the id is not in the catalog
     */
    public MetricDefinition require(String metricId) {
        return find(metricId).orElseThrow(() -> NotFoundException.metric(metricId));
    }

    public int size() {
        return metrics.size();
    }

    private static void validate(MetricDefinition definition) {
        if (definition == null) {
            throw new IllegalStateException("Null metric definition in catalog");
        }
        if (isBlank(definition.id()) || isBlank(definition.name()) || isBlank(definition.category())) {
            throw new IllegalStateException("Metric definition needs an id, a name and a category: " + definition);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
