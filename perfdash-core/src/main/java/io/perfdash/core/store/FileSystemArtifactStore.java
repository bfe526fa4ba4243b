package io.perfdash.core.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.perfdash.api.config.DashboardConfig;
import io.perfdash.api.device.DeviceDetail;
import io.perfdash.api.device.DeviceRecord;
import io.perfdash.api.error.ArtifactReadException;
import io.perfdash.api.error.NotFoundException;
import io.perfdash.api.error.PerfDashException;
import io.perfdash.api.sample.Sample;
import io.perfdash.api.sample.SampleLoad;
import io.perfdash.api.store.ArtifactStore;
import io.perfdash.core.support.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Artifact store over the directory tree written by the collection scripts.
 * <p>
 * Layout of one device run folder ({@code <model>_<yyyyMMdd>_<HHmmss>}):
 * <ul>
 *   <li>{@code device_info_*.json}: static device metadata</li>
 *   <li>{@code apk_info.json}: app install records</li>
 *   <li>{@code *_performance.csv}: timestamped samples, one column per metric</li>
 *   <li>auxiliary subfolders (meminfo dumps, screenshots, ...) which are ignored</li>
 * </ul>
 * Nothing is cached: every call reads the disk again, so results always reflect
 * the current artifacts and concurrent callers share no mutable state.
 */
public class FileSystemArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStore.class);

    private final Path root;
    private final Pattern folderPattern;
    private final String deviceInfoGlob;
    private final String performanceGlob;
    private final String appInfoFileName;
    private final ObjectMapper objectMapper;
    private final PerformanceCsvReader csvReader;

    public FileSystemArtifactStore(DashboardConfig config) {
        this.root = config.artifactRoot();
        this.folderPattern = config.folderPattern();
        this.deviceInfoGlob = config.deviceInfoGlob();
        this.performanceGlob = config.performanceGlob();
        this.appInfoFileName = config.appInfoFileName();
        this.objectMapper = JsonSupport.newMapper();
        this.csvReader = new PerformanceCsvReader();
    }

    @Override
    public List<DeviceRecord> listDevices() {
        List<String> folders;
        try (Stream<Path> children = Files.list(root)) {
            folders = children
                    .filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> folderPattern.matcher(name).matches())
                    .sorted()
                    .toList();
        } catch (NoSuchFileException e) {
            log.warn("Artifact root does not exist: {}", root.toAbsolutePath());
            return List.of();
        } catch (IOException e) {
            throw new ArtifactReadException(root, e);
        }

        List<DeviceRecord> devices = new ArrayList<>();
        for (String folder : folders) {
            try {
                DeviceDetail detail = deviceDetail(folder);
                String name = detail.fullName().isEmpty() ? folder : detail.fullName();
                devices.add(new DeviceRecord(folder, name, detail.androidVersion(), detail.deviceId()));
            } catch (PerfDashException e) {
                log.warn("Skipping device folder {}: {}", folder, e.getMessage());
            }
        }
        log.debug("Discovered {} device folder(s) under {}", devices.size(), root);
        return devices;
    }

    @Override
    public DeviceDetail deviceDetail(String folderName) {
        Path folder = resolveFolder(folderName);
        Path file = matching(folder, deviceInfoGlob).stream()
                .findFirst()
                .orElseThrow(() -> NotFoundException.file(folderName, "device metadata file"));

        JsonNode raw = readJson(file);
        if (!raw.isObject()) {
            throw new ArtifactReadException(file, new IllegalStateException("device metadata is not a JSON object"));
        }
        return new DeviceDetail(folderName, raw);
    }

    @Override
    public SampleLoad loadSamples(String folderName) {
        Path folder = resolveFolder(folderName);
        List<Path> files = matching(folder, performanceGlob);
        if (files.isEmpty()) {
            throw NotFoundException.file(folderName, "performance file");
        }

        // later files and later rows win on duplicate timestamps
        TreeMap<LocalDateTime, Sample> byTimestamp = new TreeMap<>();
        int malformed = 0;
        for (Path file : files) {
            PerformanceCsvReader.ParsedFile parsed = csvReader.read(file);
            for (Sample sample : parsed.samples()) {
                byTimestamp.put(sample.timestamp(), sample);
            }
            malformed += parsed.malformedRows();
        }

        log.debug("Loaded {} sample(s) from {} file(s) in {}", byTimestamp.size(), files.size(), folderName);
        return new SampleLoad(folderName, new ArrayList<>(byTimestamp.values()), malformed);
    }

    @Override
    public List<JsonNode> appInfo(String folderName) {
        Path folder = resolveFolder(folderName);
        Path file = folder.resolve(appInfoFileName);
        if (!Files.isRegularFile(file)) {
            throw NotFoundException.file(folderName, appInfoFileName);
        }

        JsonNode raw = readJson(file);
        List<JsonNode> entries = new ArrayList<>();
        if (raw.isArray()) {
            raw.forEach(entries::add);
        } else {
            entries.add(raw);
        }
        return entries;
    }

    public Path root() {
        return root;
    }

    /**
     * Resolve a folder handle to a directory directly under the root.
     * Anything that is not a device folder name is reported as not found.
     */
    private Path resolveFolder(String folderName) {
        if (folderName == null || folderName.isBlank()
                || folderName.contains("/") || folderName.contains("\\") || folderName.contains("..")
                || !folderPattern.matcher(folderName).matches()) {
            throw NotFoundException.device(String.valueOf(folderName));
        }
        Path folder = root.resolve(folderName);
        if (!Files.isDirectory(folder)) {
            throw NotFoundException.device(folderName);
        }
        return folder;
    }

    private List<Path> matching(Path folder, String glob) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder, glob)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (IOException e) {
            throw new ArtifactReadException(folder, e);
        }
        files.sort(null);
        return files;
    }

    private JsonNode readJson(Path file) {
        JsonNode node;
        try {
            node = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new ArtifactReadException(file, e);
        }
        if (node == null || node.isMissingNode()) {
            throw new ArtifactReadException(file, new IOException("empty document"));
        }
        return node;
    }
}
