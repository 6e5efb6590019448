package com.propertyintel.estate.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each crawl run for observability.
 * Stored in the scrape_runs table when the relational sink is active.
 */
@Data
@Builder
public class ScrapeRun {

    private String runId;           // UUID
    private String outputMode;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | INCOMPLETE | FAILED
    private long recordsExpected;
    private long recordsFetched;
    private long recordsWritten;
    private String errorMessage;    // null unless FAILED
}
