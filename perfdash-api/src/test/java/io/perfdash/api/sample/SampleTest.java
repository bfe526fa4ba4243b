package io.perfdash.api.sample;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SampleTest {

    @Test
    void timestampIsRequired() {
        assertThatThrownBy(() -> new Sample(null, Map.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void valuesAreCopiedAndReadOnly() {
        Map<String, Double> values = new HashMap<>(Map.of("cpu", 1.0));
        Sample sample = new Sample(LocalDateTime.of(2024, 1, 1, 0, 0), values);
        values.put("memory", 2.0);

        assertThat(sample.has("memory")).isFalse();
        assertThat(sample.value("cpu")).contains(1.0);
        assertThat(sample.value("memory")).isEmpty();
        assertThatThrownBy(() -> sample.values().put("x", 1.0)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void labelDefaultsToDeviceId() {
        assertThat(new DeviceSeries("Pixel7_20240101_120000", List.of()).label())
                .isEqualTo("Pixel7_20240101_120000");
    }
}
