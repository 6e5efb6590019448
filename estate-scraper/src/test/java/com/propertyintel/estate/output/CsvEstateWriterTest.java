package com.propertyintel.estate.output;

import static org.assertj.core.api.Assertions.*;

import com.opencsv.CSVReader;
import com.propertyintel.estate.config.EstateScraperProperties;
import com.propertyintel.estate.model.EstateItem;
import com.propertyintel.estate.model.UpsertResult;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvEstateWriterTest {

    @TempDir
    Path tempDir;

    private CsvEstateWriter writer;

    @BeforeEach
    void setUp() {
        EstateScraperProperties properties = new EstateScraperProperties();
        properties.getOutput().getCsv().setOutputDir(tempDir.resolve("out").toString());
        properties.getOutput().getCsv().setFilename("estates.csv");
        writer = new CsvEstateWriter(properties);
    }

    @Test
    void testFirstItemFixesHeader() throws Exception {
        // Given
        writer.open();

        // When
        writer.upsert(item(1L, Map.of("name", "Flat", "links_images", List.of("a.jpg", "b.jpg"))));
        writer.close();

        // Then
        List<String[]> rows = readAll(writer.getOutputPath());
        assertThat(rows.get(0)).containsExactly(
                "hash_id", "links_images", "name", "scraped_at", "source_page", "source_category");
        assertThat(rows.get(1)).containsExactly(
                "1", "a.jpg|b.jpg", "Flat", "2024-05-01T03:00", "3", "flats-sale");
    }

    @Test
    void testDriftIsCountedPerField() throws Exception {
        // Given
        writer.open();
        writer.upsert(item(1L, Map.of("name", "Flat")));

        // When
        writer.upsert(item(2L, Map.of("name", "House", "gps_lat", 50.1)));
        writer.upsert(item(3L, Map.of("gps_lat", 49.2)));
        writer.close();

        // Then
        assertThat(writer.getExtraFields()).containsExactly(Map.entry("gps_lat", 2L));
        assertThat(writer.getMissingFields()).containsExactly(Map.entry("name", 1L));
        List<String[]> rows = readAll(writer.getOutputPath());
        assertThat(rows).hasSize(4);
        assertThat(rows.get(3)[1]).isEmpty();
    }

    @Test
    void testSameListingIsWrittenOnce() throws Exception {
        // Given
        writer.open();

        // When
        UpsertResult first = writer.upsert(item(9L, Map.of("name", "Flat")));
        UpsertResult second = writer.upsert(item(9L, Map.of("name", "Flat")));
        writer.close();

        // Then
        assertThat(first).isEqualTo(UpsertResult.INSERTED);
        assertThat(second).isEqualTo(UpsertResult.SKIPPED_DUPLICATE);
        assertThat(readAll(writer.getOutputPath())).hasSize(2);
    }

    @Test
    void testUpsertBeforeOpenFails() {
        assertThatThrownBy(() -> writer.upsert(item(1L, Map.of())))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testDefaultFilenameIsTimestamped() {
        // Given
        EstateScraperProperties properties = new EstateScraperProperties();
        properties.getOutput().getCsv().setOutputDir(tempDir.toString());
        CsvEstateWriter defaultWriter = new CsvEstateWriter(properties);

        // When
        defaultWriter.open();
        defaultWriter.close();

        // Then
        assertThat(defaultWriter.getOutputPath().getFileName().toString())
                .matches("sreality_\\d{8}_\\d{6}\\.csv");
    }

    private static EstateItem item(long id, Map<String, Object> fields) {
        Map<String, Object> all = new LinkedHashMap<>();
        all.put("hash_id", id);
        all.putAll(new TreeMap<>(fields));
        return EstateItem.builder()
                .fields(all)
                .scrapedAt(LocalDateTime.of(2024, 5, 1, 3, 0))
                .sourcePage(3)
                .sourceCategory("flats-sale")
                .build();
    }

    private static List<String[]> readAll(Path path) throws Exception {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(reader)) {
            return csv.readAll();
        }
    }
}
