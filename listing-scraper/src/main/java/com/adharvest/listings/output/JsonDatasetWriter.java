package com.adharvest.listings.output;

import com.adharvest.listings.config.ScraperProperties;
import com.adharvest.listings.model.NormalizedRecord;
import com.adharvest.listings.model.ScrapeRun;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Writes the record dataset and the run summary as JSON.
 *
 * Output paths: {outputDir}/listings_{runId}.json (array of flat objects) and
 * {outputDir}/run_{runId}.json.
 */
@Component
@Slf4j
public class JsonDatasetWriter {

    private final ScraperProperties properties;
    private final ObjectMapper mapper;

    public JsonDatasetWriter(ScraperProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.mapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path write(List<NormalizedRecord> records, String runId) {
        List<Map<String, Object>> rows = records.stream().map(NormalizedRecord::fields).toList();
        Path path = writeJson(rows, String.format("listings_%s.json", runId));
        log.info("Written {} records to JSON: {}", records.size(), path);
        return path;
    }

    public Path writeScrapeRun(ScrapeRun run) {
        Path path = writeJson(run, String.format("run_%s.json", run.getRunId()));
        log.debug("Run summary written: {}", path);
        return path;
    }

    private Path writeJson(Object value, String filename) {
        Path outputDir = Paths.get(properties.getOutput().getOutputDir());
        Path outputPath = outputDir.resolve(filename);
        try {
            Files.createDirectories(outputDir);
            mapper.writeValue(outputPath.toFile(), value);
            return outputPath;
        } catch (IOException e) {
            log.error("Failed to write JSON file {}: {}", outputPath, e.getMessage(), e);
            throw new OutputException("JSON write failed: " + outputPath, e);
        }
    }
}
