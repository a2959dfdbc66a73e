package org.operaton.rungrade.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.operaton.rungrade.service.BatchJobRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Scheduler for evicting batch jobs that were submitted but never streamed.
 */
@Component
@Slf4j
public class BatchJobEvictionScheduler {

    private final BatchJobRegistry batchJobRegistry;
    private final Duration jobTtl;

    public BatchJobEvictionScheduler(
            BatchJobRegistry batchJobRegistry,
            @Value("${rungrade.batch.job-ttl-minutes:30}") long jobTtlMinutes) {
        this.batchJobRegistry = batchJobRegistry;
        this.jobTtl = Duration.ofMinutes(jobTtlMinutes);
    }

    /**
     * Evicts jobs older than the configured time to live.
     */
    @Scheduled(fixedDelayString = "${rungrade.batch.eviction-interval-ms:60000}")
    public void evictExpiredJobs() {
        try {
            int evicted = batchJobRegistry.evictCreatedBefore(Instant.now().minus(jobTtl));

            if (evicted > 0) {
                log.info("Evicted {} batch jobs older than {} minutes", evicted, jobTtl.toMinutes());
            } else {
                log.debug("No expired batch jobs to evict");
            }
        } catch (Exception e) {
            log.error("Batch job eviction failed", e);
        }
    }
}
