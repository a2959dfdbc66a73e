package org.operaton.rungrade.model;

import lombok.AccessLevel;
import lombok.Getter;
import org.operaton.rungrade.model.dto.FileError;
import org.operaton.rungrade.model.dto.RunResult;
import org.operaton.rungrade.model.dto.UploadedFile;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Transient, process-local batch analysis job. It lives in the job registry from submission
 * until its terminal event and is never persisted.
 * <p>
 * Results and errors are only mutated by the worker that processes the job.
 */
@Getter
public class BatchJob {

    /**
     * Batch job status lifecycle.
     */
    public enum Status {
        CREATED,
        PROCESSING,
        COMPLETED,
        FAILED,
        CANCELLED
    }

    private final UUID id;
    private final double binLength;
    private final int totalFiles;
    private final Instant createdAt;
    private final List<RunResult> results = new ArrayList<>();
    private final List<FileError> errors = new ArrayList<>();

    private List<UploadedFile> files;
    private Status status = Status.CREATED;
    private Instant startedAt;
    private Instant completedAt;
    private boolean evicted;

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    public BatchJob(List<UploadedFile> files, double binLength) {
        this.id = UUID.randomUUID();
        this.files = List.copyOf(files);
        this.totalFiles = files.size();
        this.binLength = binLength;
        this.createdAt = Instant.now();
    }

    /**
     * Moves the job from CREATED to PROCESSING. A job can only be started once, and never
     * after it was evicted.
     *
     * @return true if this call started the job
     */
    public synchronized boolean tryStart() {
        if (status != Status.CREATED || evicted) {
            return false;
        }
        status = Status.PROCESSING;
        startedAt = Instant.now();
        return true;
    }

    /**
     * Moves a processing job into a terminal state. The first terminal state sticks.
     */
    public synchronized void finish(Status terminalStatus) {
        if (terminalStatus == Status.CREATED || terminalStatus == Status.PROCESSING) {
            throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
        }
        if (status != Status.PROCESSING) {
            return;
        }
        status = terminalStatus;
        completedAt = Instant.now();
    }

    public synchronized Status getStatus() {
        return status;
    }

    /**
     * Signals that the event consumer is gone; the worker stops before the next file.
     */
    public void requestCancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * Marks the job as evicted and releases its files, unless it is being processed.
     * Runs under the same monitor as {@link #tryStart()}, so at most one of the two succeeds
     * for a job that has not started yet.
     *
     * @return true if the job was evicted by this call
     */
    public synchronized boolean tryEvict() {
        if (status == Status.PROCESSING || evicted) {
            return false;
        }
        evicted = true;
        releaseFiles();
        return true;
    }

    /**
     * Drops the references to the uploaded file buffers.
     */
    public synchronized void releaseFiles() {
        files = List.of();
    }

    public synchronized List<UploadedFile> getFiles() {
        return files;
    }
}
