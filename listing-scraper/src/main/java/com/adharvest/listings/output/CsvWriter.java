package com.adharvest.listings.output;

import com.adharvest.listings.config.ScraperProperties;
import com.adharvest.listings.model.NormalizedRecord;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes normalized records to CSV files.
 *
 * Output path pattern: {outputDir}/listings_{runId}.csv
 *
 * Columns are the union of record keys in first-seen order, so detailed records with
 * different attribute sets still line up. List values are joined with {@code |}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    static final String LIST_SEPARATOR = "|";

    private final ScraperProperties properties;

    public Path write(List<NormalizedRecord> records, String runId) {
        if (records.isEmpty()) return null;

        Path outputDir = Paths.get(properties.getOutput().getOutputDir());
        ensureDirectory(outputDir);
        Path outputPath = outputDir.resolve(String.format("listings_%s.csv", runId));

        String[] headers = headers(records);

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(
                     out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().isIncludeHeader()) {
                writer.writeNext(headers);
            }

            for (NormalizedRecord r : records) {
                writer.writeNext(toRow(r, headers));
            }

            log.info("Written {} records to CSV: {}", records.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new OutputException("CSV write failed: " + outputPath, e);
        }
    }

    static String[] headers(List<NormalizedRecord> records) {
        Set<String> names = new LinkedHashSet<>();
        records.forEach(r -> names.addAll(r.fieldNames()));
        return names.toArray(String[]::new);
    }

    private String[] toRow(NormalizedRecord r, String[] headers) {
        String[] row = new String[headers.length];
        for (int i = 0; i < headers.length; i++) {
            row[i] = str(r.get(headers[i]));
        }
        return row;
    }

    static String str(Object val) {
        if (val == null) return "";
        if (val instanceof Collection<?> values) {
            return values.stream().map(CsvWriter::str).collect(Collectors.joining(LIST_SEPARATOR));
        }
        return val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new OutputException("Cannot create output directory: " + dir, e);
        }
    }
}
