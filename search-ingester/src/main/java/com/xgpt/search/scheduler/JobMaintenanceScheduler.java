package com.xgpt.search.scheduler;

import com.xgpt.search.jobs.JobEventStream;
import com.xgpt.search.jobs.JobTrackingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic job housekeeping: the hourly purge of expired job rows and the keep-alive ping on
 * open job streams.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JobMaintenanceScheduler {

    private final JobTrackingService jobTracking;
    private final JobEventStream jobEventStream;

    @Scheduled(cron = "${search-ingester.jobs.purge-cron:0 0 * * * *}", zone = "UTC")
    public void purgeExpiredJobs() {
        int purged = jobTracking.purgeExpired();
        if (purged > 0) {
            log.info("Purged {} expired job row(s)", purged);
        }
    }

    @Scheduled(fixedRateString = "${search-ingester.jobs.ping-interval:PT15S}")
    public void pingStreams() {
        jobEventStream.ping();
    }
}
