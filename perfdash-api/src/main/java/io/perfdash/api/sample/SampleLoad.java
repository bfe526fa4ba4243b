package io.perfdash.api.sample;

import java.util.List;

/**
 * Result of loading every performance file of one device folder.
 *
 * @param folderName    the device folder
 * @param samples       samples sorted ascending by timestamp, unique timestamps
 * @param malformedRows number of rows dropped because they could not be parsed
 */
public record SampleLoad(String folderName, List<Sample> samples, int malformedRows) {

    public SampleLoad {
        samples = List.copyOf(samples);
    }
}
