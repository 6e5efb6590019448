package com.propertyintel.estate.report;

import com.propertyintel.estate.model.FetchFailure;
import com.propertyintel.estate.model.RunReport;
import com.propertyintel.estate.model.RunReport.CategoryLine;
import com.propertyintel.estate.model.RunReport.CategoryStatus;
import com.propertyintel.estate.model.RunStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconciles what the API said it had against what the run fetched and
 * stored, and logs the result. Reporting problems are logged, never thrown.
 */
@Component
@Slf4j
public class RunReporter {

    public RunReport report(RunStatistics stats) {
        RunReport report = new RunReport(List.of(), 0, 0, 0, 0, 0, 0, 0, List.of());
        try {
            report = build(stats);
            logReport(report, stats);
        } catch (Exception e) {
            log.error("Could not complete run report: {}", e.getMessage(), e);
        }
        return report;
    }

    RunReport build(RunStatistics stats) {
        Map<String, Long> expected = stats.getExpectedByCategory();
        Map<String, Long> fetched = stats.getFetchedByCategory();
        Set<String> skipped = stats.getSkippedCategories();

        Set<String> names = new LinkedHashSet<>(expected.keySet());
        names.addAll(stats.getFailedCategories());

        List<CategoryLine> lines = new ArrayList<>();
        for (String name : names) {
            long exp = expected.getOrDefault(name, 0L);
            long got = fetched.getOrDefault(name, 0L);
            CategoryStatus status;
            if (!expected.containsKey(name)) {
                status = CategoryStatus.PLANNING_FAILED;
            } else if (skipped.contains(name)) {
                status = CategoryStatus.SKIPPED;
            } else {
                status = got >= exp ? CategoryStatus.OK : CategoryStatus.INCOMPLETE;
            }
            lines.add(new CategoryLine(name, exp, got, status));
        }

        return new RunReport(
                lines,
                stats.getTotalExpected(),
                stats.getTotalFetched(),
                stats.getValid(),
                stats.getInvalid(),
                stats.getDuplicates(),
                stats.getPersisted(),
                stats.getFailedTaskCount(),
                stats.getFailures());
    }

    private void logReport(RunReport report, RunStatistics stats) {
        log.info("========== Crawl report ==========");
        for (CategoryLine line : report.categories()) {
            switch (line.status()) {
                case OK -> log.info("  {}: {}/{} OK", line.category(), line.fetched(), line.expected());
                case INCOMPLETE -> log.warn("  {}: {}/{} INCOMPLETE ({} missing)",
                        line.category(), line.fetched(), line.expected(), line.expected() - line.fetched());
                case SKIPPED -> log.info("  {}: no listings, skipped", line.category());
                case PLANNING_FAILED -> log.warn("  {}: count probe failed, not crawled", line.category());
            }
        }

        log.info("Expected: {}  Fetched: {}  Valid: {}  Invalid: {}  Duplicates: {}  Persisted: {}",
                report.totalExpected(), report.totalFetched(), report.valid(), report.invalid(),
                report.duplicates(), report.persisted());
        if (stats.getPersistSkipped() > 0 || stats.getPersistFailed() > 0) {
            log.info("Sink skipped {} existing listings, {} writes failed",
                    stats.getPersistSkipped(), stats.getPersistFailed());
        }
        stats.getMissingByField().forEach((field, count) ->
                log.warn("  {} listings missing required field '{}'", count, field));

        if (report.failedTasks() > 0) {
            log.warn("{} page fetches failed:", report.failedTasks());
        }
        for (FetchFailure failure : report.failures()) {
            if (!failure.isProbe()) {
                log.warn("  {} page {}: {}", failure.category(), failure.page(), failure.reason());
            }
        }

        if (report.isSuccess()) {
            log.info("SUCCESS: all {} expected listings fetched", report.totalExpected());
        } else {
            log.error("MISSING {} RECORDS: fetched {} of {} expected listings",
                    report.missing(), report.totalFetched(), report.totalExpected());
        }
    }
}
