package org.operaton.rungrade.model;

import lombok.Builder;

import java.time.Instant;

/**
 * A contiguous, fixed-distance segment of a route with its derived performance metrics.
 * Optional metrics are null when they could not be derived from the underlying points.
 */
@Builder(toBuilder = true)
public record Bin(
        double distanceMeters,
        double elevationChangeMeters,
        double gradientPercent,
        Double durationSeconds,
        String timeTaken,
        Double velocityMps,
        Double paceMinPerKm,
        double adjustedDurationSeconds,
        Double gradeAdjustedDistanceMeters,
        /* km/h value supplied by clients; the binning engine never sets it */
        Double averageSpeedKmh,
        int startIndex,
        int endIndex,
        Instant startTime,
        Instant endTime,
        Integer avgHeartRate,
        Integer maxHeartRate,
        Integer minHeartRate,
        int heartRateSampleCount
) {

    public boolean hasHeartRate() {
        return avgHeartRate != null;
    }

    public boolean hasValidPace() {
        return paceMinPerKm != null && Double.isFinite(paceMinPerKm) && paceMinPerKm > 0;
    }
}
