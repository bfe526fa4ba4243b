package io.perfdash.api.error;

/**
 * An unknown device folder, a missing artifact file, or an unknown metric id.
 */
public class NotFoundException extends PerfDashException {

    private final String identifier;

    public NotFoundException(String identifier, String message) {
        super(message);
        this.identifier = identifier;
    }

    public static NotFoundException device(String folderName) {
        return new NotFoundException(folderName, "Device folder not found: " + folderName);
    }

    public static NotFoundException file(String folderName, String expected) {
        return new NotFoundException(folderName, "No " + expected + " in device folder: " + folderName);
    }

    public static NotFoundException metric(String metricId) {
        return new NotFoundException(metricId, "Unknown metric: " + metricId);
    }

    /**
     * @return the folder name or metric id that could not be resolved
     */
    public String identifier() {
        return identifier;
    }
}
