package org.operaton.rungrade.controller;

import lombok.extern.slf4j.Slf4j;
import org.operaton.rungrade.exception.BatchJobNotFoundException;
import org.operaton.rungrade.model.BatchJob;
import org.operaton.rungrade.model.dto.BatchEvent;
import org.operaton.rungrade.model.dto.ErrorResponse;
import org.operaton.rungrade.service.BatchAnalysisService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for streamed batch analysis.
 * Files are either submitted first and streamed later by batch id, or uploaded and streamed
 * as server-sent events within one request.
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class BatchAnalysisController {

    private final BatchAnalysisService batchAnalysisService;
    private final double defaultBinLength;
    private final long streamTimeoutMs;

    public BatchAnalysisController(
            BatchAnalysisService batchAnalysisService,
            @Value("${rungrade.binning.default-bin-length:50}") double defaultBinLength,
            @Value("${rungrade.batch.stream-timeout-ms:1800000}") long streamTimeoutMs) {
        this.batchAnalysisService = batchAnalysisService;
        this.defaultBinLength = defaultBinLength;
        this.streamTimeoutMs = streamTimeoutMs;
    }

    /**
     * Stores the uploaded files as a batch job.
     *
     * POST /api/upload-batch
     *
     * @param files     the GPX/FIT files
     * @param binLength bin length in meters
     * @return the batch id and file count
     */
    @PostMapping(path = "/upload-batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> uploadBatch(
            @RequestParam(value = "files", required = false) List<MultipartFile> files,
            @RequestParam(value = "binLength", required = false) Double binLength
    ) {
        try {
            BatchJob job = batchAnalysisService.submit(
                UploadedFiles.of(files), binLength != null ? binLength : defaultBinLength);

            return ResponseEntity.ok(new BatchSubmissionResponse(true, job.getId(), job.getTotalFiles()));

        } catch (IllegalArgumentException e) {
            log.warn("Invalid batch upload: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to store batch upload", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("Failed to store batch upload: " + e.getMessage()));
        }
    }

    /**
     * Streams the progress of a submitted batch job. Each file produces one {@code progress}
     * event, the job ends with one {@code complete} or {@code error} event. Closing the stream
     * cancels the remaining files.
     *
     * GET /api/process-batch/{batchId}
     *
     * @param batchId the id returned by the upload
     * @return the event stream; 404 with a single error event if the job is unknown
     */
    @GetMapping(path = "/process-batch/{batchId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> processBatch(@PathVariable UUID batchId) {
        SseEmitter emitter = new SseEmitter(streamTimeoutMs);

        BatchJob job;
        try {
            job = batchAnalysisService.claim(batchId);
        } catch (BatchJobNotFoundException e) {
            log.warn("Batch stream requested for unknown job {}", batchId);
            sendAndClose(emitter, new BatchEvent.Failure(e.getMessage()));
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(emitter);
        }

        startStream(job, emitter);
        return ResponseEntity.ok(emitter);
    }

    /**
     * Uploads files and streams their analysis in the same request. A request without files
     * gets a single {@code error} event.
     *
     * POST /api/analyze-batch
     *
     * @param files     the GPX/FIT files
     * @param binLength bin length in meters
     * @return the event stream
     */
    @PostMapping(path = "/analyze-batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> analyzeBatch(
            @RequestParam(value = "files", required = false) List<MultipartFile> files,
            @RequestParam(value = "binLength", required = false) Double binLength
    ) {
        SseEmitter emitter = new SseEmitter(streamTimeoutMs);

        BatchJob job;
        try {
            BatchJob submitted = batchAnalysisService.submit(
                UploadedFiles.of(files), binLength != null ? binLength : defaultBinLength);
            job = batchAnalysisService.claim(submitted.getId());
        } catch (IllegalArgumentException | BatchJobNotFoundException e) {
            log.warn("Rejected streamed batch analysis: {}", e.getMessage());
            sendAndClose(emitter, new BatchEvent.Failure(e.getMessage()));
            return ResponseEntity.ok(emitter);
        } catch (Exception e) {
            log.error("Failed to start streamed batch analysis", e);
            sendAndClose(emitter, new BatchEvent.Failure(e.getMessage()));
            return ResponseEntity.ok(emitter);
        }

        startStream(job, emitter);
        return ResponseEntity.ok(emitter);
    }

    /**
     * Hands a claimed job to the worker pool. Closing the stream cancels the remaining files.
     */
    private void startStream(BatchJob job, SseEmitter emitter) {
        emitter.onCompletion(job::requestCancel);
        emitter.onTimeout(job::requestCancel);
        emitter.onError(error -> job.requestCancel());

        batchAnalysisService.stream(job, new SseBatchEventSink(emitter));
    }

    private void sendAndClose(SseEmitter emitter, BatchEvent event) {
        try {
            emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
            emitter.complete();
        } catch (IOException e) {
            emitter.completeWithError(e);
        }
    }

    public record BatchSubmissionResponse(boolean success, UUID batchId, int fileCount) {
    }
}
