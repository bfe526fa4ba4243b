package io.perfdash.api.config;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Configuration of a dashboard instance.
 * Controls where artifacts are read from, how they are recognised, and where
 * the server listens.
 */
public final class DashboardConfig {

    public static final int DEFAULT_PORT = 5002;

    private Path artifactRoot = Path.of(".");
    private int port = DEFAULT_PORT;
    private Pattern folderPattern = Pattern.compile(".*_\\d{8}_\\d{6}$");
    private String deviceInfoGlob = "device_info_*.json";
    private String performanceGlob = "*_performance.csv";
    private String appInfoFileName = "apk_info.json";
    private Path metricsFile = null; // null = built-in catalog
    private Path reportDirectory = Path.of("reports");

    private DashboardConfig() {}

    public static DashboardConfig create() {
        return new DashboardConfig();
    }

    /**
     * Directory holding one subfolder per device run.
     */
    public DashboardConfig artifactRoot(Path artifactRoot) {
        if (artifactRoot == null) {
            throw new IllegalArgumentException("Artifact root must not be null");
        }
        this.artifactRoot = artifactRoot;
        return this;
    }

    /**
     * Port of the embedded server. Zero picks a free port.
     */
    public DashboardConfig port(int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 0 and 65535");
        }
        this.port = port;
        return this;
    }

    /**
     * Naming convention of device run folders, matched against the whole folder name.
     */
    public DashboardConfig folderPattern(String regex) {
        this.folderPattern = Pattern.compile(regex);
        return this;
    }

    public DashboardConfig deviceInfoGlob(String deviceInfoGlob) {
        this.deviceInfoGlob = requireText(deviceInfoGlob, "Device info glob");
        return this;
    }

    public DashboardConfig performanceGlob(String performanceGlob) {
        this.performanceGlob = requireText(performanceGlob, "Performance glob");
        return this;
    }

    public DashboardConfig appInfoFileName(String appInfoFileName) {
        this.appInfoFileName = requireText(appInfoFileName, "App info file name");
        return this;
    }

    /**
     * Replace the built-in metric catalog with a JSON file.
     */
    public DashboardConfig metricsFile(Path metricsFile) {
        this.metricsFile = metricsFile;
        return this;
    }

    public DashboardConfig reportDirectory(Path reportDirectory) {
        this.reportDirectory = reportDirectory;
        return this;
    }

    public Path artifactRoot() { return artifactRoot; }
    public int port() { return port; }
    public Pattern folderPattern() { return folderPattern; }
    public String deviceInfoGlob() { return deviceInfoGlob; }
    public String performanceGlob() { return performanceGlob; }
    public String appInfoFileName() { return appInfoFileName; }
    public Path metricsFile() { return metricsFile; }
    public Path reportDirectory() { return reportDirectory; }

    private static String requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
        return value;
    }
}
