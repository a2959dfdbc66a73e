package org.operaton.rungrade.model.dto;

import java.util.List;

/**
 * Outcome of filtering every run of a request.
 */
public record RunFilterResult(
        List<RunResult> filteredResults,
        int totalOriginalBins,
        int totalFilteredBins,
        ExclusionCounts exclusionCounts
) {
}
