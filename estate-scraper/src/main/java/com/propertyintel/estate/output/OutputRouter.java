package com.propertyintel.estate.output;

import com.propertyintel.estate.config.EstateScraperProperties;
import com.propertyintel.estate.config.EstateScraperProperties.Output.OutputMode;
import com.propertyintel.estate.model.ScrapeRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Picks the sink for a run based on configuration.
 * Supports RELATIONAL, DOCUMENT or CSV modes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final PostgresEstateWriter postgresWriter;
    private final MongoEstateWriter mongoWriter;
    private final CsvEstateWriter csvWriter;
    private final EstateScraperProperties properties;

    public PersistenceAdapter activeAdapter() {
        OutputMode mode = properties.getOutput().getMode();
        return switch (mode) {
            case RELATIONAL -> postgresWriter;
            case DOCUMENT -> mongoWriter;
            case CSV -> csvWriter;
        };
    }

    public void writeScrapeRun(ScrapeRun run) {
        try {
            if (properties.getOutput().getMode() == OutputMode.RELATIONAL) {
                postgresWriter.writeScrapeRun(run);
            }
        } catch (Exception e) {
            log.warn("Failed to write scrape run metadata: {}", e.getMessage());
        }
    }
}
