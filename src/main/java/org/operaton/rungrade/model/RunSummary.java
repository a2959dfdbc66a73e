package org.operaton.rungrade.model;

import lombok.Builder;

/**
 * Aggregated totals over the bins of one activity.
 *
 * @param totalBins                number of bins, valid or not
 * @param validBins                bins with a positive distance
 * @param totalDistanceKm          summed distance of valid bins in km (2 decimals)
 * @param totalTimeSeconds         summed duration of valid bins
 * @param totalElevationGainMeters summed positive elevation change, rounded
 * @param avgPaceMinPerKm          time-weighted pace, null when distance or time is zero
 * @param avgHeartRate             mean of the per-bin average heart rates
 * @param maxHeartRate             highest per-bin maximum heart rate
 * @param heartRateCoverage        fraction of valid bins carrying heart rate data
 */
@Builder
public record RunSummary(
        int totalBins,
        int validBins,
        double totalDistanceKm,
        double totalTimeSeconds,
        long totalElevationGainMeters,
        Double avgPaceMinPerKm,
        Integer avgHeartRate,
        Integer maxHeartRate,
        double heartRateCoverage
) {
}
