package com.propertyintel.estate.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "estate-scraper")
@Data
public class EstateScraperProperties {

    private Api api = new Api();
    private Crawl crawl = new Crawl();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Api {
        private String baseUrl = "https://www.sreality.cz/api/cs/v2";
        private int pageSize = 999;

        /** Highest page number the API will serve for a single query */
        private int maxPages = 60;

        /** Filters appended to every query, e.g. locality_region_id=10 */
        private Map<String, String> extraParams = new LinkedHashMap<>();

        private Map<String, String> headers = new LinkedHashMap<>(Map.of(
                "Accept", "application/json, text/plain, */*",
                "Accept-Language", "en,cs;q=0.9",
                "User-Agent", "Mozilla/5.0 (compatible; property-intel-estate-scraper/1.0)"
        ));

        private List<Integer> retryHttpCodes = new ArrayList<>(List.of(
                500, 502, 503, 504, 408, 429, 520, 521, 522, 523, 524));

        private int timeoutSeconds = 30;
        private Throttle throttle = new Throttle();

        @Data
        public static class Throttle {
            private boolean enabled = true;
            private long startDelayMs = 500;
            private long minDelayMs = 250;
            private long maxDelayMs = 5000;
            private double targetConcurrency = 4.0;
        }
    }

    @Data
    public static class Crawl {
        private int concurrency = 8;
        private List<String> requiredFields = new ArrayList<>(List.of("hash_id", "name"));
        private List<Category> categories = new ArrayList<>();
    }

    /**
     * One disjoint query partition. Sreality codes: main 1=flats, 2=houses,
     * 3=land, 4=commercial, 5=other; type 1=sale, 2=rent, 3=auction.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Category {
        private String name;
        private int mainCb;
        private int typeCb;
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.CSV;
        private Csv csv = new Csv();
        private Relational relational = new Relational();
        private Document document = new Document();

        @Data
        public static class Csv {
            private String outputDir = "data";
            /** Blank means sreality_{yyyyMMdd_HHmmss}.csv */
            private String filename = "";
            private String listDelimiter = "|";
        }

        @Data
        public static class Relational {
            private String table = "estates";
            private String runsTable = "scrape_runs";
        }

        @Data
        public static class Document {
            private String collection = "estates";
        }

        public enum OutputMode {
            RELATIONAL, DOCUMENT, CSV
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 3 * * ?";
        private boolean runOnStartup = false;
    }
}
