package org.operaton.rungrade.model.dto;

/**
 * Totals of a synchronous batch analysis.
 */
public record BatchSummary(
        int totalFiles,
        int successfulFiles,
        int failedFiles,
        double binLength,
        int totalBins,
        double avgBinsPerFile,
        int filesWithHeartRate
) {
}
