package com.adharvest.listings.output;

import com.adharvest.listings.config.ScraperProperties;
import com.adharvest.listings.model.FilterSet;
import com.adharvest.listings.model.NormalizedRecord;
import com.opencsv.CSVReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CsvWriterTest {

    @TempDir
    Path outputDir;

    private ScraperProperties properties;
    private CsvWriter writer;

    @BeforeEach
    void setUp() {
        properties = new ScraperProperties();
        properties.getOutput().setOutputDir(outputDir.toString());
        writer = new CsvWriter(properties);
    }

    private static NormalizedRecord record(String id, Object... keyValues) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", id);
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new NormalizedRecord(id, fields, "Paris", FilterSet.unfiltered());
    }

    private List<String[]> read(Path file) throws Exception {
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {
            return reader.readAll();
        }
    }

    @Test
    void shouldWriteUnionOfColumnsInFirstSeenOrder() throws Exception {
        Path file = writer.write(List.of(
                record("1", "subject", "Maison", "attr_square", "120"),
                record("2", "subject", "Studio, centre", "attr_rooms", "1")), "run-1");

        assertThat(file.getFileName().toString()).isEqualTo("listings_run-1.csv");
        List<String[]> rows = read(file);
        assertThat(rows.get(0)).containsExactly("id", "subject", "attr_square", "attr_rooms");
        assertThat(rows.get(1)).containsExactly("1", "Maison", "120", "");
        assertThat(rows.get(2)).containsExactly("2", "Studio, centre", "", "1");
    }

    @Test
    void shouldJoinListValues() throws Exception {
        Path file = writer.write(List.of(record("1", "images", List.of("a.jpg", "b.jpg"))), "run-2");

        assertThat(read(file).get(1)).containsExactly("1", "a.jpg|b.jpg");
    }

    @Test
    void shouldOmitHeaderWhenDisabled() throws Exception {
        properties.getOutput().setIncludeHeader(false);

        Path file = writer.write(List.of(record("1")), "run-3");

        assertThat(read(file)).hasSize(1);
    }

    @Test
    void shouldSkipEmptyDataset() {
        assertThat(writer.write(List.of(), "run-4")).isNull();
        assertThat(outputDir.resolve("listings_run-4.csv")).doesNotExist();
    }
}
