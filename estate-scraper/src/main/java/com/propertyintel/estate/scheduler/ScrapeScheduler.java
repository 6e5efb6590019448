package com.propertyintel.estate.scheduler;

import com.propertyintel.estate.config.EstateScraperProperties;
import com.propertyintel.estate.service.EstateCrawlService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup crawls.
 *
 * Default schedule: every day at 03:00 UTC.
 * Override with CRON env var or estate-scraper.scheduling.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScrapeScheduler {

    private final EstateCrawlService crawlService;
    private final EstateScraperProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, starting crawl");
            try {
                crawlService.crawl();
            } catch (Exception e) {
                log.error("Startup crawl failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("Scraper ready. Next scheduled run: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${estate-scraper.scheduling.cron:0 0 3 * * ?}", zone = "UTC")
    public void scheduledCrawl() {
        log.info("Scheduled crawl triggered");
        try {
            crawlService.crawl();
        } catch (Exception e) {
            log.error("Scheduled crawl failed: {}", e.getMessage(), e);
        }
    }
}
