package io.perfdash.api.error;

import java.nio.file.Path;

/**
 * An artifact file exists but could not be read or decoded.
 */
public class ArtifactReadException extends PerfDashException {

    private final Path path;

    public ArtifactReadException(Path path, Throwable cause) {
        super("Failed to read artifact: " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
