package org.operaton.rungrade.service;

import lombok.extern.slf4j.Slf4j;
import org.operaton.rungrade.exception.BatchJobNotFoundException;
import org.operaton.rungrade.exception.EmptyTrackException;
import org.operaton.rungrade.exception.FitFileProcessingException;
import org.operaton.rungrade.exception.GpxFileProcessingException;
import org.operaton.rungrade.exception.InvalidFitFileException;
import org.operaton.rungrade.exception.InvalidGpxFileException;
import org.operaton.rungrade.exception.UnsupportedFileFormatException;
import org.operaton.rungrade.model.Bin;
import org.operaton.rungrade.model.BatchJob;
import org.operaton.rungrade.model.TrackPoint;
import org.operaton.rungrade.model.dto.BatchEvent;
import org.operaton.rungrade.model.dto.BatchReport;
import org.operaton.rungrade.model.dto.BatchSummary;
import org.operaton.rungrade.model.dto.FileError;
import org.operaton.rungrade.model.dto.RunResult;
import org.operaton.rungrade.model.dto.UploadedFile;
import org.operaton.rungrade.util.GradeAdjustmentModel;
import org.operaton.rungrade.util.ParsedActivityData;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs uploaded activity files through parsing and binning, one file at a time and in
 * submission order. A failing file is recorded as a {@link FileError} and never aborts the batch.
 * <p>
 * Two modes are offered: {@link #analyzeFiles} processes a whole batch in the calling thread,
 * while {@link #submit} registers a job that a client later streams with {@link #stream}.
 */
@Service
@Slf4j
public class BatchAnalysisService {

    private final ActivityFileService activityFileService;
    private final BinningService binningService;
    private final BatchJobRegistry batchJobRegistry;
    private final long progressDelayMs;

    public BatchAnalysisService(
            ActivityFileService activityFileService,
            BinningService binningService,
            BatchJobRegistry batchJobRegistry,
            @Value("${rungrade.batch.progress-delay-ms:50}") long progressDelayMs) {
        this.activityFileService = activityFileService;
        this.binningService = binningService;
        this.batchJobRegistry = batchJobRegistry;
        this.progressDelayMs = progressDelayMs;
    }

    /**
     * Analyzes a batch synchronously without grade adjustment.
     *
     * @see #analyzeFiles(List, double, GradeAdjustmentModel, Double)
     */
    public BatchReport analyzeFiles(List<UploadedFile> files, double binLength) {
        return analyzeFiles(files, binLength, null, null);
    }

    /**
     * Analyzes a batch synchronously and returns one aggregate report.
     *
     * @param files             the uploaded files
     * @param binLength         bin length in meters
     * @param gradeModel        grade adjustment model, may be null
     * @param referenceVelocity flat-ground velocity in m/s, may be null
     * @return results, errors and batch totals
     * @throws IllegalArgumentException if no files are given or the bin length is not positive
     */
    public BatchReport analyzeFiles(List<UploadedFile> files, double binLength,
                                    GradeAdjustmentModel gradeModel, Double referenceVelocity) {
        requireFiles(files);
        requireBinLength(binLength);
        log.info("Analyzing {} files with {} m bins", files.size(), binLength);

        List<RunResult> results = new ArrayList<>();
        List<FileError> errors = new ArrayList<>();

        for (int i = 0; i < files.size(); i++) {
            UploadedFile file = files.get(i);
            try {
                results.add(analyzeFile(i, file, binLength, gradeModel, referenceVelocity));
            } catch (RuntimeException e) {
                log.warn("Failed to analyze file {}: {}", file.filename(), e.getMessage());
                errors.add(toFileError(file, e));
            }
        }

        int totalBins = results.stream().mapToInt(result -> result.binsOrEmpty().size()).sum();
        double avgBinsPerFile = results.isEmpty() ? 0 : Math.round(totalBins * 10.0 / results.size()) / 10.0;
        int filesWithHeartRate = (int) results.stream().filter(RunResult::hasHeartRateData).count();

        BatchSummary summary = new BatchSummary(files.size(), results.size(), errors.size(), binLength,
            totalBins, avgBinsPerFile, filesWithHeartRate);

        log.info("Batch analysis finished. Success: {}, Failed: {}, Bins: {}",
            results.size(), errors.size(), totalBins);
        return new BatchReport(true, summary, results, errors);
    }

    /**
     * Registers a batch job for later streaming.
     *
     * @param files     the uploaded files, held in memory until the job ends or is evicted
     * @param binLength bin length in meters
     * @return the registered job
     * @throws IllegalArgumentException if no files are given or the bin length is not positive
     */
    public BatchJob submit(List<UploadedFile> files, double binLength) {
        requireFiles(files);
        requireBinLength(binLength);

        BatchJob job = new BatchJob(files, binLength);
        batchJobRegistry.register(job);
        log.info("Created batch job {} with {} files", job.getId(), job.getTotalFiles());
        return job;
    }

    /**
     * Claims a registered job for streaming. A job can be claimed only once.
     *
     * @param jobId the job id
     * @return the job, now PROCESSING
     * @throws BatchJobNotFoundException if the id is unknown, evicted or already streamed
     */
    public BatchJob claim(UUID jobId) {
        BatchJob job = batchJobRegistry.find(jobId)
            .orElseThrow(() -> new BatchJobNotFoundException(jobId));
        if (!job.tryStart()) {
            throw new BatchJobNotFoundException(jobId);
        }
        return job;
    }

    /**
     * Processes a claimed job on the batch analysis pool and streams its events to the sink.
     *
     * @param job  a job returned by {@link #claim(UUID)}
     * @param sink the event consumer
     */
    @Async("batchAnalysisExecutor")
    public void stream(BatchJob job, BatchEventSink sink) {
        process(job, sink);
    }

    /**
     * Processes a claimed job in the calling thread. Emits one progress event per file and one
     * terminal event, then removes the job from the registry and releases its file buffers.
     * Stops early if the sink fails or the consumer cancels.
     */
    public void process(BatchJob job, BatchEventSink sink) {
        log.info("Starting batch job {}", job.getId());
        List<UploadedFile> files = job.getFiles();
        int totalFiles = files.size();

        try {
            for (int i = 0; i < totalFiles; i++) {
                if (job.isCancelRequested()) {
                    cancel(job, i);
                    return;
                }

                UploadedFile file = files.get(i);
                log.info("Processing file {}/{} of job {}: {} ({} bytes)",
                    i + 1, totalFiles, job.getId(), file.filename(), file.size());

                try {
                    job.getResults().add(analyzeFile(i, file, job.getBinLength(), null, null));
                } catch (RuntimeException e) {
                    log.warn("Failed to process file {}: {}", file.filename(), e.getMessage());
                    job.getErrors().add(toFileError(file, e));
                }

                sink.emit(new BatchEvent.Progress(
                    i + 1,
                    totalFiles,
                    (int) Math.round((i + 1) * 100.0 / totalFiles),
                    job.getResults().size() + job.getErrors().size(),
                    file.filename(),
                    List.copyOf(job.getResults()),
                    List.copyOf(job.getErrors())));

                if (!pause()) {
                    cancel(job, i + 1);
                    return;
                }
            }

            job.finish(BatchJob.Status.COMPLETED);
            sink.emit(new BatchEvent.Complete(
                totalFiles,
                job.getResults().size(),
                job.getErrors().size(),
                List.copyOf(job.getResults()),
                List.copyOf(job.getErrors())));

            log.info("Batch job {} completed. Success: {}, Failed: {}",
                job.getId(), job.getResults().size(), job.getErrors().size());
        } catch (IOException e) {
            log.info("Event consumer of batch job {} is gone: {}", job.getId(), e.getMessage());
            job.finish(BatchJob.Status.CANCELLED);
        } catch (RuntimeException e) {
            log.error("Batch job {} failed with error", job.getId(), e);
            job.finish(BatchJob.Status.FAILED);
            emitError(job, sink, e);
        } finally {
            sink.complete();
            batchJobRegistry.remove(job.getId());
            job.releaseFiles();
        }
    }

    /**
     * Parses and bins one file.
     *
     * @throws RuntimeException any file-level failure
     */
    RunResult analyzeFile(int index, UploadedFile file, double binLength,
                          GradeAdjustmentModel gradeModel, Double referenceVelocity) {
        ParsedActivityData parsed = activityFileService.parse(file);
        List<TrackPoint> points = parsed.getTrackPoints();

        List<Bin> bins = binningService.bin(points, binLength, gradeModel, referenceVelocity);
        log.debug("Created {} bins for {}", bins.size(), file.filename());

        return RunResult.builder()
            .fileIndex(index)
            .filename(file.filename())
            .fileType(parsed.getSourceFormat())
            .sport(parsed.getSport())
            .startTime(parsed.getStartTime())
            .endTime(parsed.getEndTime())
            .totalTimeSeconds(parsed.getTotalTimeSeconds())
            .distanceKm(parsed.getTotalDistanceMeters() != null ? parsed.getTotalDistanceMeters() / 1000 : null)
            .elevationGainMeters(parsed.getElevationGainMeters())
            .pointCount(points.size())
            .avgHeartRate(parsed.getAverageHeartRate())
            .maxHeartRate(parsed.getMaxHeartRate())
            .calories(parsed.getCalories())
            .binLength(binLength)
            .bins(bins)
            .binSummary(binningService.summarize(bins).orElse(null))
            .hasHeartRateData(bins.stream().anyMatch(Bin::hasHeartRate))
            .build();
    }

    private void cancel(BatchJob job, int processedFiles) {
        job.finish(BatchJob.Status.CANCELLED);
        log.info("Batch job {} cancelled after {}/{} files", job.getId(), processedFiles, job.getTotalFiles());
    }

    private void emitError(BatchJob job, BatchEventSink sink, RuntimeException cause) {
        try {
            sink.emit(new BatchEvent.Failure(cause.getMessage()));
        } catch (IOException e) {
            log.debug("Could not deliver error event of batch job {}: {}", job.getId(), e.getMessage());
        }
    }

    /**
     * Gives the consumer time to drain the stream.
     *
     * @return false if the worker was interrupted
     */
    private boolean pause() {
        if (progressDelayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(progressDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private FileError toFileError(UploadedFile file, RuntimeException e) {
        return new FileError(file.filename(), e.getMessage(), determineErrorType(e));
    }

    /**
     * Determines error type from exception.
     */
    String determineErrorType(RuntimeException e) {
        if (e instanceof UnsupportedFileFormatException) {
            return FileError.ErrorType.UNSUPPORTED_FORMAT;
        } else if (e instanceof EmptyTrackException) {
            return FileError.ErrorType.EMPTY_TRACK;
        } else if (e instanceof InvalidGpxFileException || e instanceof InvalidFitFileException) {
            return FileError.ErrorType.VALIDATION_ERROR;
        } else if (e instanceof GpxFileProcessingException || e instanceof FitFileProcessingException) {
            return FileError.ErrorType.PARSING_ERROR;
        } else {
            return FileError.ErrorType.UNKNOWN_ERROR;
        }
    }

    private static void requireFiles(List<UploadedFile> files) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("No files provided");
        }
    }

    private static void requireBinLength(double binLength) {
        if (!Double.isFinite(binLength) || binLength <= 0) {
            throw new IllegalArgumentException("Bin length must be a positive number of meters, got: " + binLength);
        }
    }
}
