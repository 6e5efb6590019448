package com.propertyintel.estate.config;

import com.propertyintel.estate.service.EstateCrawlService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ScrapeController {

    private final EstateCrawlService crawlService;
    private final EstateScraperProperties properties;

    @PostMapping("/scrape/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        if (crawlService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("status", "already-running"));
        }
        new Thread(crawlService::crawl, "manual-crawl").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    @GetMapping("/scrape/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "property-intel-estate-scraper");
        body.put("version", "1.0.0");
        body.put("dataSource", properties.getApi().getBaseUrl());
        body.put("outputMode", properties.getOutput().getMode());
        body.put("running", crawlService.isRunning());
        crawlService.getLastRun().ifPresent(run -> body.put("lastRun", run));
        crawlService.getLastReport().ifPresent(report -> body.put("lastReport", report));
        return ResponseEntity.ok(body);
    }
}
