package io.perfdash.api.store;

import com.fasterxml.jackson.databind.JsonNode;
import io.perfdash.api.device.DeviceDetail;
import io.perfdash.api.device.DeviceRecord;
import io.perfdash.api.sample.SampleLoad;

import java.util.List;

/**
 * Read-only access to the result folders written by the collection scripts.
 * Implementations re-read the artifacts on every call and keep no state
 * between calls.
 */
public interface ArtifactStore {

    /**
     * Discover every device folder under the artifact root.
     * Folders with missing or unreadable metadata are skipped, never fatal.
     *
     * @return device records ordered by folder name
     */
    List<DeviceRecord> listDevices();

    /**
     * Load the static metadata of one device.
     *
     * @throws io.perfdash.api.error.NotFoundException if the folder or its metadata file is absent
     */
    DeviceDetail deviceDetail(String folderName);

    /**
     * Load the full sample sequence of one device, sorted by timestamp.
     * Malformed rows are dropped and counted.
     *
     * @throws io.perfdash.api.error.NotFoundException if the folder or its performance files are absent
     */
    SampleLoad loadSamples(String folderName);

    /**
     * Load the app install records of one device.
     *
     * @return one entry per record, in file order
     * @throws io.perfdash.api.error.NotFoundException if the folder or its app metadata file is absent
     */
    List<JsonNode> appInfo(String folderName);
}
