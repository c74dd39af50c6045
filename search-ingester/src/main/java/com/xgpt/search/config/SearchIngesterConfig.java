package com.xgpt.search.config;

import com.xgpt.search.service.Sleeper;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class SearchIngesterConfig {

    @Bean
    public RestTemplate searchApiRestTemplate(RestTemplateBuilder builder, SearchIngesterProperties properties) {
        return builder
                .setConnectTimeout(properties.getSource().getConnectTimeout())
                .setReadTimeout(properties.getSource().getReadTimeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    /**
     * Workers for sessions started over HTTP. Shut down after the engine has paused them.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService searchExecutor(SearchIngesterProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getExecution().getPoolSize()),
                r -> new Thread(r, "search-session-" + counter.incrementAndGet()));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService jobEvictionScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "job-eviction");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Delivers job snapshots to open streams in change order, away from the threads that
     * update jobs.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService jobStreamExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "job-stream");
            thread.setDaemon(true);
            return thread;
        });
    }
}
