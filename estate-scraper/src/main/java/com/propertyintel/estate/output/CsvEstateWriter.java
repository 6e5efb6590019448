package com.propertyintel.estate.output;

import com.opencsv.CSVWriter;
import com.propertyintel.estate.config.EstateScraperProperties;
import com.propertyintel.estate.config.EstateScraperProperties.Output.OutputMode;
import com.propertyintel.estate.model.EstateItem;
import com.propertyintel.estate.model.UpsertResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Appends estate items to a single CSV file per run.
 *
 * Output path: {outputDir}/{filename}, default
 * {outputDir}/sreality_{yyyyMMdd_HHmmss}.csv
 *
 * The header is fixed by the first item written. Later items with fields
 * outside the header have those fields dropped from the row; items lacking
 * header fields get empty cells. Both are counted per field and logged
 * when the file is closed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvEstateWriter implements PersistenceAdapter {

    static final List<String> METADATA_COLUMNS = List.of("scraped_at", "source_page", "source_category");

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final EstateScraperProperties properties;

    private CSVWriter writer;
    private Path outputPath;
    private List<String> header;
    private final Set<String> writtenIds = new HashSet<>();
    private final Map<String, Long> extraFields = new LinkedHashMap<>();
    private final Map<String, Long> missingFields = new LinkedHashMap<>();
    private long rows;

    @Override
    public OutputMode mode() {
        return OutputMode.CSV;
    }

    @Override
    public synchronized void open() {
        EstateScraperProperties.Output.Csv csv = properties.getOutput().getCsv();
        Path outputDir = Paths.get(csv.getOutputDir());
        String filename = csv.getFilename() == null || csv.getFilename().isBlank()
                ? "sreality_" + LocalDateTime.now().format(FILE_STAMP) + ".csv"
                : csv.getFilename();

        header = null;
        rows = 0;
        writtenIds.clear();
        extraFields.clear();
        missingFields.clear();

        try {
            Files.createDirectories(outputDir);
            outputPath = outputDir.resolve(filename);
            writer = new CSVWriter(
                    Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8),
                    CSVWriter.DEFAULT_SEPARATOR,
                    CSVWriter.DEFAULT_QUOTE_CHARACTER,
                    CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                    CSVWriter.DEFAULT_LINE_END);
        } catch (IOException e) {
            throw new PersistenceException("Cannot open CSV output " + outputDir.resolve(filename), e);
        }
        log.info("Writing listings to CSV: {}", outputPath);
    }

    @Override
    public synchronized UpsertResult upsert(EstateItem item) {
        if (writer == null) {
            throw new IllegalStateException("CSV writer is not open");
        }

        Object id = item.getId();
        if (id != null && !writtenIds.add(id.toString())) {
            log.debug("Listing {} already written to {}", id, outputPath);
            return UpsertResult.SKIPPED_DUPLICATE;
        }

        if (header == null) {
            header = new ArrayList<>(item.getFields().keySet());
            header.addAll(METADATA_COLUMNS);
            writer.writeNext(header.toArray(new String[0]));
        } else {
            trackDrift(item);
        }

        writer.writeNext(toRow(item));
        rows++;
        try {
            writer.flush();
        } catch (IOException e) {
            log.error("Failed to flush CSV file {}: {}", outputPath, e.getMessage(), e);
            return UpsertResult.FAILED;
        }
        return UpsertResult.INSERTED;
    }

    @Override
    public synchronized void close() {
        if (writer == null) return;
        try {
            writer.close();
        } catch (IOException e) {
            log.error("Failed to close CSV file {}: {}", outputPath, e.getMessage(), e);
        } finally {
            writer = null;
        }

        extraFields.forEach((field, count) ->
                log.warn("Schema drift: field '{}' appeared in {} listings but is not in the CSV header; not exported",
                        field, count));
        missingFields.forEach((field, count) ->
                log.warn("Schema drift: header field '{}' was absent from {} listings; written as empty",
                        field, count));
        log.info("Written {} listings to CSV: {}", rows, outputPath);
    }

    public synchronized Path getOutputPath() {
        return outputPath;
    }

    public synchronized Map<String, Long> getExtraFields() {
        return new LinkedHashMap<>(extraFields);
    }

    public synchronized Map<String, Long> getMissingFields() {
        return new LinkedHashMap<>(missingFields);
    }

    private void trackDrift(EstateItem item) {
        for (String field : item.getFields().keySet()) {
            if (!header.contains(field)) {
                extraFields.merge(field, 1L, Long::sum);
            }
        }
        for (String column : header) {
            if (!METADATA_COLUMNS.contains(column) && !item.getFields().containsKey(column)) {
                missingFields.merge(column, 1L, Long::sum);
            }
        }
    }

    private String[] toRow(EstateItem item) {
        String[] row = new String[header.size()];
        for (int i = 0; i < row.length; i++) {
            String column = header.get(i);
            row[i] = switch (column) {
                case "scraped_at" -> str(item.getScrapedAt());
                case "source_page" -> str(item.getSourcePage());
                case "source_category" -> str(item.getSourceCategory());
                default -> str(item.get(column));
            };
        }
        return row;
    }

    private String str(Object val) {
        if (val == null) return "";
        if (val instanceof Collection<?> list) {
            return list.stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(properties.getOutput().getCsv().getListDelimiter()));
        }
        return val.toString();
    }
}
