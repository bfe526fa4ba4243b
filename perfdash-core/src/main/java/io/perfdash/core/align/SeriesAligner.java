package io.perfdash.core.align;

import io.perfdash.api.sample.DeviceSeries;
import io.perfdash.api.sample.Sample;
import io.perfdash.api.series.AlignedSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Merges independently timestamped device series onto one shared axis.
 * <p>
 * The axis is the chronologically sorted union of every sample timestamp of
 * every input, whether or not the sample carries the metric. Each device then
 * gets one value per axis point: its reading when it has a sample with the
 * metric at that instant, otherwise {@code null}. Devices keep the caller's
 * order, and a device with no readings still gets a full line of nulls so
 * legends stay stable while filters change.
 */
public class SeriesAligner {

    private static final Logger log = LoggerFactory.getLogger(SeriesAligner.class);

    public AlignedSeries align(List<DeviceSeries> devices, String metricId) {
        if (devices.isEmpty()) {
            return AlignedSeries.empty(metricId);
        }

        TreeSet<LocalDateTime> union = new TreeSet<>();
        List<Map<LocalDateTime, Double>> lookups = new ArrayList<>(devices.size());
        for (DeviceSeries device : devices) {
            Map<LocalDateTime, Double> lookup = new HashMap<>();
            for (Sample sample : device.samples()) {
                union.add(sample.timestamp());
                Double value = sample.values().get(metricId);
                if (value != null) {
                    lookup.put(sample.timestamp(), value);
                }
            }
            lookups.add(lookup);
        }

        List<LocalDateTime> axis = new ArrayList<>(union);
        List<AlignedSeries.Line> lines = new ArrayList<>(devices.size());
        for (int i = 0; i < devices.size(); i++) {
            DeviceSeries device = devices.get(i);
            Map<LocalDateTime, Double> lookup = lookups.get(i);

            List<Double> values = new ArrayList<>(axis.size());
            for (LocalDateTime point : axis) {
                values.add(lookup.get(point));
            }
            lines.add(new AlignedSeries.Line(device.deviceId(), device.label(),
                    SeriesPalette.colorFor(device.deviceId(), i), values));
        }

        log.debug("Aligned {} device(s) on {} axis point(s) for {}", devices.size(), axis.size(), metricId);
        return new AlignedSeries(metricId, axis, lines);
    }
}
