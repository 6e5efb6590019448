package com.propertyintel.estate.service;

import com.propertyintel.estate.config.EstateScraperProperties;
import com.propertyintel.estate.model.CategoryPlan;
import com.propertyintel.estate.model.EstateItem;
import com.propertyintel.estate.model.FetchTask;
import com.propertyintel.estate.model.RunReport;
import com.propertyintel.estate.model.RunStatistics;
import com.propertyintel.estate.model.ScrapeRun;
import com.propertyintel.estate.output.OutputRouter;
import com.propertyintel.estate.output.PersistenceAdapter;
import com.propertyintel.estate.pipeline.RecordPipeline;
import com.propertyintel.estate.report.RunReporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrates one crawl run.
 *
 * open sink → probe categories → fetch every page on the worker pool, each
 * worker pushing its page through the pipeline → close sink → report.
 *
 * Only a sink that cannot be opened stops a run. Failed probes, pages and
 * writes are counted and the run carries on.
 */
@Service
@Slf4j
public class EstateCrawlService {

    private final CategoryPlanner planner;
    private final PageFetcher pageFetcher;
    private final OutputRouter outputRouter;
    private final RunReporter reporter;
    private final EstateScraperProperties properties;
    private final Executor executor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScrapeRun lastRun;
    private volatile RunReport lastReport;

    public EstateCrawlService(CategoryPlanner planner,
                              PageFetcher pageFetcher,
                              OutputRouter outputRouter,
                              RunReporter reporter,
                              EstateScraperProperties properties,
                              @Qualifier("crawlTaskExecutor") Executor executor) {
        this.planner = planner;
        this.pageFetcher = pageFetcher;
        this.outputRouter = outputRouter;
        this.reporter = reporter;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Run a full crawl of every configured category.
     *
     * @return the finished run, or empty if another run was already in progress
     */
    public Optional<ScrapeRun> crawl() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Crawl already in progress, ignoring request");
            return Optional.empty();
        }

        ScrapeRun run = ScrapeRun.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .build();
        lastReport = null;

        try {
            PersistenceAdapter adapter = outputRouter.activeAdapter();
            run.setOutputMode(adapter.mode().name());
            log.info("Starting crawl {} into {} sink", run.getRunId(), adapter.mode());

            try {
                adapter.open();
            } catch (Exception e) {
                log.error("Cannot open {} sink, aborting crawl: {}", adapter.mode(), e.getMessage(), e);
                run.setStatus("FAILED");
                run.setErrorMessage(e.getMessage());
                return Optional.of(run);
            }

            RunStatistics stats = new RunStatistics();
            try {
                crawlInto(adapter, stats);
            } finally {
                adapter.close();
            }

            RunReport report = reporter.report(stats);
            lastReport = report;
            run.setStatus(report.isSuccess() ? "SUCCESS" : "INCOMPLETE");
            run.setRecordsExpected(report.totalExpected());
            run.setRecordsFetched(report.totalFetched());
            run.setRecordsWritten(report.persisted());

        } catch (Exception e) {
            log.error("Crawl {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
        } finally {
            try {
                run.setCompletedAt(LocalDateTime.now());
                outputRouter.writeScrapeRun(run);
            } finally {
                lastRun = run;
                running.set(false);
            }
        }

        log.info("Crawl {} finished: {}", run.getRunId(), run.getStatus());
        return Optional.of(run);
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<ScrapeRun> getLastRun() {
        return Optional.ofNullable(lastRun);
    }

    public Optional<RunReport> getLastReport() {
        return Optional.ofNullable(lastReport);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void crawlInto(PersistenceAdapter adapter, RunStatistics stats) {
        List<CategoryPlan> plans = planner.plan(properties.getCrawl().getCategories(), stats);
        RecordPipeline pipeline = new RecordPipeline(properties.getCrawl().getRequiredFields(), stats, adapter);

        List<FetchTask> tasks = plans.stream()
                .flatMap(plan -> plan.tasks().stream())
                .toList();
        log.info("Fetching {} pages across {} categories", tasks.size(), plans.size());

        CompletableFuture<?>[] futures = tasks.stream()
                .map(task -> CompletableFuture.runAsync(() -> runTask(task, stats, pipeline), executor))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(futures).join();
    }

    private void runTask(FetchTask task, RunStatistics stats, RecordPipeline pipeline) {
        try {
            List<EstateItem> items = pageFetcher.fetch(task, stats);
            pipeline.processAll(items);
        } catch (Exception e) {
            log.error("Task {} page {} failed: {}", task.categoryName(), task.page(), e.getMessage(), e);
            stats.recordTaskFailure(task.categoryName(), task.page(), null, e.getMessage());
        }
    }
}
