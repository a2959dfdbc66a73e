package org.operaton.rungrade.service;

import lombok.extern.slf4j.Slf4j;
import org.operaton.rungrade.model.BatchJob;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide store of submitted batch jobs, keyed by job id.
 */
@Component
@Slf4j
public class BatchJobRegistry {

    private final Map<UUID, BatchJob> jobs = new ConcurrentHashMap<>();

    public void register(BatchJob job) {
        jobs.put(job.getId(), job);
        log.debug("Registered batch job {} ({} files)", job.getId(), job.getTotalFiles());
    }

    public Optional<BatchJob> find(UUID jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public void remove(UUID jobId) {
        if (jobs.remove(jobId) != null) {
            log.debug("Removed batch job {}", jobId);
        }
    }

    public int size() {
        return jobs.size();
    }

    /**
     * Removes jobs created before the cutoff that are not currently being processed.
     * Processing jobs remove themselves after their terminal event.
     *
     * @param cutoff creation time limit
     * @return number of evicted jobs
     */
    public int evictCreatedBefore(Instant cutoff) {
        int evicted = 0;
        for (BatchJob job : jobs.values()) {
            if (job.getCreatedAt().isBefore(cutoff) && job.tryEvict()) {
                jobs.remove(job.getId(), job);
                evicted++;
            }
        }
        return evicted;
    }
}
