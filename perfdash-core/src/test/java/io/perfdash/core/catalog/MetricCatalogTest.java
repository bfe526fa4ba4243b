package io.perfdash.core.catalog;

import io.perfdash.api.config.DashboardConfig;
import io.perfdash.api.error.NotFoundException;
import io.perfdash.api.metric.MetricDefinition;
import io.perfdash.api.metric.MetricGroup;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricCatalogTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsShouldGroupCollectorColumns() {
        MetricCatalog catalog = MetricCatalog.defaults();

        assertThat(catalog.grouped()).extracting(MetricGroup::category)
                .containsExactly("Memory", "CPU", "Frame rate", "Battery");
        assertThat(catalog.size()).isEqualTo(10);
        assertThat(catalog.require("battery_temperature").unit()).isEqualTo("°C");
    }

    @Test
    void everyMetricBelongsToExactlyOneGroup() {
        MetricCatalog catalog = MetricCatalog.defaults();

        List<String> grouped = catalog.grouped().stream()
                .flatMap(g -> g.metrics().stream())
                .map(MetricDefinition::id)
                .toList();

        assertThat(grouped).doesNotHaveDuplicates()
                .containsExactlyElementsOf(catalog.all().stream().map(MetricDefinition::id).toList());
    }

    @Test
    void shouldKeepFirstAppearanceOrderOfCategories() {
        MetricCatalog catalog = MetricCatalog.of(List.of(
                new MetricDefinition("b1", "B one", "B", ""),
                new MetricDefinition("a1", "A one", "A", ""),
                new MetricDefinition("b2", "B two", "B", "")));

        assertThat(catalog.grouped()).extracting(MetricGroup::category).containsExactly("B", "A");
        assertThat(catalog.all()).extracting(MetricDefinition::id).containsExactly("b1", "b2", "a1");
    }

    @Test
    void duplicateIdShouldFailConstruction() {
        assertThatThrownBy(() -> MetricCatalog.of(List.of(
                new MetricDefinition("cpu", "CPU", "CPU", "%"),
                new MetricDefinition("cpu", "CPU again", "Other", "%"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cpu");
    }

    @Test
    void blankCategoryShouldFailConstruction() {
        assertThatThrownBy(() -> MetricCatalog.of(List.of(new MetricDefinition("cpu", "CPU", " ", "%"))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void unknownMetricIsNotFound() {
        MetricCatalog catalog = MetricCatalog.defaults();

        assertThat(catalog.find("gpu_load")).isEmpty();
        assertThatThrownBy(() -> catalog.require("gpu_load"))
                .isInstanceOfSatisfying(NotFoundException.class, e -> assertThat(e.identifier()).isEqualTo("gpu_load"));
    }

    @Test
    void shouldLoadCatalogFromJson() throws IOException {
        Path file = tempDir.resolve("metrics.json");
        Files.writeString(file, """
                [
                  {"id": "fps", "name": "Frames per second", "category": "Rendering", "unit": "fps"},
                  {"id": "gpu", "name": "GPU load", "category": "Rendering"}
                ]
                """);

        MetricCatalog catalog = MetricCatalog.load(DashboardConfig.create().metricsFile(file));

        assertThat(catalog.all()).extracting(MetricDefinition::id).containsExactly("fps", "gpu");
        assertThat(catalog.require("gpu").unit()).isEmpty();
    }

    @Test
    void unreadableCatalogFileShouldFail() {
        assertThatThrownBy(() -> MetricCatalog.fromJson(tempDir.resolve("missing.json")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void noCatalogFileMeansDefaults() {
        assertThat(MetricCatalog.load(DashboardConfig.create()).size()).isEqualTo(MetricCatalog.defaults().size());
    }
}
