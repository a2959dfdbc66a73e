package org.operaton.rungrade.model.dto;

import lombok.Builder;
import org.operaton.rungrade.model.Bin;
import org.operaton.rungrade.model.RunSummary;

import java.time.Instant;
import java.util.List;

/**
 * Analysis result for one uploaded activity file: file-level stats plus its bins.
 * Clients send these back to the analysis endpoints, so every field is optional on input
 * except {@code bins}.
 */
@Builder(toBuilder = true)
public record RunResult(
        Integer fileIndex,
        String filename,
        String fileType,
        String sport,
        Instant startTime,
        Instant endTime,
        Double totalTimeSeconds,
        Double distanceKm,
        Double elevationGainMeters,
        Integer pointCount,
        Integer avgHeartRate,
        Integer maxHeartRate,
        Integer calories,
        Double binLength,
        List<Bin> bins,
        RunSummary binSummary,
        boolean hasHeartRateData
) {

    /**
     * @return the bins of this run, never null
     */
    public List<Bin> binsOrEmpty() {
        return bins != null ? bins : List.of();
    }

    public RunResult withBins(List<Bin> filteredBins) {
        return toBuilder().bins(filteredBins).build();
    }
}
