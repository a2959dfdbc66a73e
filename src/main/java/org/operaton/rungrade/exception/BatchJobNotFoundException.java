package org.operaton.rungrade.exception;

import java.util.UUID;

/**
 * Exception thrown when a batch job id is unknown, already streamed or evicted.
 */
public class BatchJobNotFoundException extends RuntimeException {

    public BatchJobNotFoundException(UUID jobId) {
        super("Batch job not found: " + jobId);
    }
}
