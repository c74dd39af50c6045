package com.xgpt.search.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;

@Component
@ConfigurationProperties(prefix = "search-ingester")
@Data
public class SearchIngesterProperties {

    private Source source = new Source();
    private Search search = new Search();
    private Retry retry = new Retry();
    private Jobs jobs = new Jobs();
    private Execution execution = new Execution();

    @Data
    public static class Source {
        private String baseUrl = "http://localhost:8090/api";
        private String bearerToken;
        private int pageSize = 20;
        private Duration requestDelay = Duration.ofMillis(500);   // pause before every page request
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Search {
        private int maxQueryLength = 450;
        private int queryOverhead = 100;
        private int checkpointInterval = 50;
        private int defaultMaxTweets = 500;
        private ZoneId zone = ZoneId.systemDefault();
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration maxDelay = Duration.ofMinutes(5);
        private double jitter = 0.25;
        private Duration rateLimitDefaultWait = Duration.ofSeconds(60);
        private Duration rateLimitMaxWait = Duration.ofMinutes(15);
        private int rateLimitMaxWaits = 5;
    }

    @Data
    public static class Jobs {
        private Duration gracePeriod = Duration.ofSeconds(30);
        private Duration staleThreshold = Duration.ofHours(1);
        private Duration retention = Duration.ofHours(24);
        private Duration pingInterval = Duration.ofSeconds(15);
    }

    @Data
    public static class Execution {
        private int poolSize = 4;
    }
}
