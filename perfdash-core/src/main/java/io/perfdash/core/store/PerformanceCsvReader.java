package io.perfdash.core.store;

import io.perfdash.api.error.ArtifactReadException;
import io.perfdash.api.error.MalformedDataException;
import io.perfdash.api.sample.Sample;
import io.perfdash.core.support.Timestamps;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads one performance CSV file written by the collector.
 * <p>
 * The first record is the header. The {@code timestamp} column holds the
 * sample time, every other column is a metric id. A record that cannot be
 * parsed is dropped and counted, the rest of the file still loads. A header
 * without a timestamp column makes the whole file count as one malformed row.
 */
public class PerformanceCsvReader {

    private static final Logger log = LoggerFactory.getLogger(PerformanceCsvReader.class);

    static final String TIMESTAMP_COLUMN = "timestamp";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
            .build();

    /**
     * Parsed content of one file, in file order.
     */
    public record ParsedFile(Path path, List<Sample> samples, int malformedRows) {}

    public ParsedFile read(Path path) {
        String source = path.getFileName().toString();
        List<Sample> samples = new ArrayList<>();
        int malformed = 0;

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            List<String> header = headerOf(parser.getHeaderNames());
            if (header.stream().allMatch(String::isEmpty)) {
                return new ParsedFile(path, samples, 0);
            }

            int timestampIndex = header.indexOf(TIMESTAMP_COLUMN);
            if (timestampIndex < 0) {
                log.warn("Skipping {}: header has no {} column", path, TIMESTAMP_COLUMN);
                return new ParsedFile(path, samples, 1);
            }

            Iterator<CSVRecord> records = parser.iterator();
            while (true) {
                CSVRecord record;
                try {
                    if (!records.hasNext()) break;
                    record = records.next();
                } catch (UncheckedIOException e) {
                    // the parser cannot resynchronise after a broken quoted cell
                    malformed++;
                    log.warn("Stopped reading {} at line {}: {}", path, parser.getCurrentLineNumber(),
                            e.getMessage());
                    break;
                }
                if (record.size() == 1 && record.get(0).isBlank()) continue;

                try {
                    samples.add(parseRow(source, (int) parser.getCurrentLineNumber(), header, timestampIndex,
                            record.toList()));
                } catch (MalformedDataException e) {
                    malformed++;
                    log.debug("Dropping row: {}", e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new ArtifactReadException(path, e);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping {}: unreadable header: {}", path, e.getMessage());
            return new ParsedFile(path, samples, 1);
        }

        if (malformed > 0) {
            log.warn("Dropped {} malformed row(s) from {}", malformed, path);
        }
        return new ParsedFile(path, samples, malformed);
    }

    /**
     * Parse one data row against the header.
     *
     * @throws MalformedDataException if the timestamp or any non-empty metric cell is invalid
     */
    Sample parseRow(String source, int lineNumber, List<String> header, int timestampIndex, List<String> cells) {
        if (cells.size() > header.size()) {
            throw new MalformedDataException(source, lineNumber,
                    "expected at most " + header.size() + " cells but found " + cells.size());
        }
        if (timestampIndex >= cells.size()) {
            throw new MalformedDataException(source, lineNumber, "missing timestamp");
        }

        LocalDateTime timestamp;
        try {
            timestamp = Timestamps.parse(cells.get(timestampIndex));
        } catch (DateTimeException e) {
            throw new MalformedDataException(source, lineNumber,
                    "invalid timestamp '" + cells.get(timestampIndex) + "'");
        }

        Map<String, Double> values = new LinkedHashMap<>();
        for (int i = 0; i < cells.size(); i++) {
            if (i == timestampIndex) continue;
            String cell = cells.get(i).trim();
            if (cell.isEmpty()) continue;
            values.put(header.get(i), parseValue(source, lineNumber, header.get(i), cell));
        }
        return new Sample(timestamp, values);
    }

    private static double parseValue(String source, int lineNumber, String column, String cell) {
        double value;
        try {
            value = Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            throw new MalformedDataException(source, lineNumber,
                    "column '" + column + "' is not numeric: '" + cell + "'");
        }
        if (!Double.isFinite(value)) {
            throw new MalformedDataException(source, lineNumber,
                    "column '" + column + "' is not a finite number: '" + cell + "'");
        }
        return value;
    }

    private static List<String> headerOf(List<String> names) {
        List<String> header = new ArrayList<>(names.size());
        for (String name : names) {
            String trimmed = name == null ? "" : name.trim();
            if (header.isEmpty() && !trimmed.isEmpty() && trimmed.charAt(0) == '\uFEFF') {
                trimmed = trimmed.substring(1).trim();
            }
            header.add(trimmed);
        }
        return header;
    }
}
