package org.operaton.rungrade.model.dto;

import jakarta.validation.Valid;

import java.util.List;

/**
 * Body of the analysis endpoints: previously computed run results plus optional filters.
 */
public record AnalysisRequest(
        List<RunResult> results,
        boolean removeUnreliableBins,
        @Valid HeartRateRange heartRateFilter
) {

    public FilterOptions toFilterOptions() {
        return new FilterOptions(removeUnreliableBins, heartRateFilter);
    }
}
