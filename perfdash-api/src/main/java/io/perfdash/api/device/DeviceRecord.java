package io.perfdash.api.device;

/**
 * Identity of one test run's output folder.
 *
 * @param folderName     unique key, also the opaque handle used by every other query
 * @param displayName    device model name, or the folder name when the metadata has none
 * @param androidVersion Android release string, empty when absent
 * @param deviceId       adb serial of the device, empty when absent
 */
public record DeviceRecord(
        String folderName,
        String displayName,
        String androidVersion,
        String deviceId
) {}
