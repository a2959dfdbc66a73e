package org.operaton.rungrade.controller;

import lombok.extern.slf4j.Slf4j;
import org.operaton.rungrade.model.dto.BatchReport;
import org.operaton.rungrade.model.dto.ErrorResponse;
import org.operaton.rungrade.service.BatchAnalysisService;
import org.operaton.rungrade.util.GradeAdjustmentModel;
import org.operaton.rungrade.util.QuadraticGradeModel;
import org.operaton.rungrade.util.QuarticGradeModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * REST controller for the synchronous batch analysis.
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class BinningController {

    private final BatchAnalysisService batchAnalysisService;
    private final double defaultBinLength;

    public BinningController(
            BatchAnalysisService batchAnalysisService,
            @Value("${rungrade.binning.default-bin-length:50}") double defaultBinLength) {
        this.batchAnalysisService = batchAnalysisService;
        this.defaultBinLength = defaultBinLength;
    }

    /**
     * Parses and bins all uploaded files and returns one report.
     *
     * POST /api/analyze-with-bins
     *
     * @param files             the GPX/FIT files
     * @param binLength         bin length in meters
     * @param referenceVelocity flat-ground velocity in m/s, enables grade-adjusted metrics
     * @param coefficients      five quartic model coefficients, highest degree first; the quadratic
     *                          default model is used when omitted
     * @return the batch report
     */
    @PostMapping(path = "/analyze-with-bins", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> analyzeWithBins(
            @RequestParam(value = "files", required = false) List<MultipartFile> files,
            @RequestParam(value = "binLength", required = false) Double binLength,
            @RequestParam(value = "referenceVelocity", required = false) Double referenceVelocity,
            @RequestParam(value = "coefficients", required = false) List<Double> coefficients
    ) {
        try {
            double effectiveBinLength = binLength != null ? binLength : defaultBinLength;
            GradeAdjustmentModel gradeModel = gradeModel(referenceVelocity, coefficients);

            log.info("Processing {} files with {} m bins", files == null ? 0 : files.size(), effectiveBinLength);
            BatchReport report = batchAnalysisService.analyzeFiles(
                UploadedFiles.of(files), effectiveBinLength, gradeModel, referenceVelocity);

            return ResponseEntity.ok(report);

        } catch (IllegalArgumentException e) {
            log.warn("Invalid analysis request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to analyze files", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("Failed to analyze files: " + e.getMessage()));
        }
    }

    private GradeAdjustmentModel gradeModel(Double referenceVelocity, List<Double> coefficients) {
        if (coefficients != null && !coefficients.isEmpty()) {
            return QuarticGradeModel.of(coefficients);
        }
        return referenceVelocity != null ? QuadraticGradeModel.INSTANCE : null;
    }
}
