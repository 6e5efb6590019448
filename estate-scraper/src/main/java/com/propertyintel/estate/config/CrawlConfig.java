package com.propertyintel.estate.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class CrawlConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, EstateScraperProperties properties) {
        Duration timeout = Duration.ofSeconds(properties.getApi().getTimeoutSeconds());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    /**
     * Worker pool for page-fetch tasks. Pool size is the number of requests
     * allowed in flight at once.
     */
    @Bean
    public ThreadPoolTaskExecutor crawlTaskExecutor(EstateScraperProperties properties) {
        int concurrency = Math.max(1, properties.getCrawl().getConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("Crawl-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
