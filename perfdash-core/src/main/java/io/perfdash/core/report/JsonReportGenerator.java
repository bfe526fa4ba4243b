package io.perfdash.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.perfdash.api.report.PerformanceReport;
import io.perfdash.api.report.ReportGenerator;
import io.perfdash.core.support.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the full report, samples included, as an indented JSON document.
 */
public class JsonReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonReportGenerator.class);

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this.objectMapper = JsonSupport.newMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Path generate(PerformanceReport report, Path outputPath) {
        try {
            Files.createDirectories(outputPath.toAbsolutePath().getParent());
            objectMapper.writeValue(outputPath.toFile(), report);
            log.info("Report written to: {}", outputPath.toAbsolutePath());
            return outputPath;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write report to " + outputPath, e);
        }
    }

    @Override
    public String render(PerformanceReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize report for " + report.folderName(), e);
        }
    }

    @Override
    public String format() {
        return "JSON";
    }
}
