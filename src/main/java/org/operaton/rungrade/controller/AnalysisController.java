package org.operaton.rungrade.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.rungrade.exception.InvalidAnalysisRequestException;
import org.operaton.rungrade.model.dto.AdjustmentStatistic;
import org.operaton.rungrade.model.dto.AdvancedAnalysis;
import org.operaton.rungrade.model.dto.AnalysisRequest;
import org.operaton.rungrade.model.dto.ErrorResponse;
import org.operaton.rungrade.model.dto.ExclusionCounts;
import org.operaton.rungrade.model.dto.RunFilterResult;
import org.operaton.rungrade.model.dto.RunResult;
import org.operaton.rungrade.service.BinFilterService;
import org.operaton.rungrade.service.GradientAnalysisService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for cross-run gradient/pace analysis of previously binned runs.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AnalysisController {

    private final GradientAnalysisService gradientAnalysisService;
    private final BinFilterService binFilterService;

    /**
     * Runs all analyses on the given runs.
     *
     * POST /api/advanced-analysis
     *
     * @param request   the runs
     * @param statistic statistic of the adjustment-vs-expectation view
     * @return the analyses
     */
    @PostMapping("/advanced-analysis")
    public ResponseEntity<?> advancedAnalysis(
            @Valid @RequestBody AnalysisRequest request,
            @RequestParam(value = "statistic", defaultValue = "MEAN") AdjustmentStatistic statistic
    ) {
        try {
            AdvancedAnalysis analyses = gradientAnalysisService.analyzeGradientPace(request.results(), statistic);
            return ResponseEntity.ok(new AdvancedAnalysisResponse(true, analyses));

        } catch (InvalidAnalysisRequestException e) {
            log.warn("Invalid advanced analysis request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
        } catch (Exception e) {
            log.error("Advanced analysis failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse(e.getMessage()));
        }
    }

    /**
     * Filters the bins of the given runs and analyzes what is left.
     *
     * POST /api/analyze-with-filters-json
     *
     * @param request   the runs and filter options
     * @param statistic statistic of the adjustment-vs-expectation view
     * @return the exclusion summary, the analyses and the filtered runs
     */
    @PostMapping("/analyze-with-filters-json")
    public ResponseEntity<?> analyzeWithFilters(
            @Valid @RequestBody AnalysisRequest request,
            @RequestParam(value = "statistic", defaultValue = "MEAN") AdjustmentStatistic statistic
    ) {
        try {
            if (request.results() == null) {
                throw new InvalidAnalysisRequestException("No results provided");
            }

            RunFilterResult filtered = binFilterService.filterRuns(request.results(), request.toFilterOptions());
            AdvancedAnalysis analyses = gradientAnalysisService.analyzeGradientPace(filtered.filteredResults(), statistic);

            log.info("Filtered analysis: kept {} of {} bins", filtered.totalFilteredBins(), filtered.totalOriginalBins());

            return ResponseEntity.ok(new FilteredAnalysisResponse(
                true,
                new FilterSummary(filtered.totalOriginalBins(), filtered.totalFilteredBins(), filtered.exclusionCounts()),
                analyses,
                filtered.filteredResults()));

        } catch (InvalidAnalysisRequestException e) {
            log.warn("Invalid filtered analysis request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
        } catch (Exception e) {
            log.error("Filtered analysis failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse(e.getMessage()));
        }
    }

    public record AdvancedAnalysisResponse(boolean success, AdvancedAnalysis analyses) {
    }

    public record FilterSummary(int totalOriginalBins, int totalFilteredBins, ExclusionCounts exclusionCounts) {
    }

    public record FilteredAnalysisResponse(
            boolean success,
            FilterSummary summary,
            AdvancedAnalysis analyses,
            List<RunResult> filteredResults
    ) {
    }
}
