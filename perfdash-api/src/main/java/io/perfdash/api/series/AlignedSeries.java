package io.perfdash.api.series;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Several devices' series merged onto one shared timestamp axis.
 * <p>
 * Every line holds exactly {@code axis.size()} values, positionally aligned
 * to the axis. A {@code null} value means the device has no sample carrying
 * the metric at that instant; zero is a real reading.
 */
public record AlignedSeries(String metricId, List<LocalDateTime> axis, List<Line> lines) {

    public AlignedSeries {
        axis = List.copyOf(axis);
        lines = List.copyOf(lines);
        for (Line line : lines) {
            if (line.values().size() != axis.size()) {
                throw new IllegalArgumentException("Line '" + line.deviceId() + "' has "
                        + line.values().size() + " values for an axis of " + axis.size());
            }
        }
    }

    public static AlignedSeries empty(String metricId) {
        return new AlignedSeries(metricId, List.of(), List.of());
    }

    public boolean hasData() {
        return lines.stream().anyMatch(line -> line.presentCount() > 0);
    }

    /**
     * One device's values along the shared axis.
     */
    public record Line(String deviceId, String label, String color, List<Double> values) {

        public Line {
            // List.copyOf rejects nulls, which are the missing-value marker here
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        public long presentCount() {
            return values.stream().filter(Objects::nonNull).count();
        }
    }
}
