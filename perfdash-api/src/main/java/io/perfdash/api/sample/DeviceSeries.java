package io.perfdash.api.sample;

import java.util.List;

/**
 * A device's filtered samples, handed to the aligner.
 *
 * @param deviceId folder name of the device
 * @param label    legend label, usually the device display name
 * @param samples  samples sorted ascending by timestamp
 */
public record DeviceSeries(String deviceId, String label, List<Sample> samples) {

    public DeviceSeries {
        samples = List.copyOf(samples);
    }

    public DeviceSeries(String deviceId, List<Sample> samples) {
        this(deviceId, deviceId, samples);
    }
}
