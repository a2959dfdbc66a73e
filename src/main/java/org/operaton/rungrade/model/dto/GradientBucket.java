package org.operaton.rungrade.model.dto;

import lombok.Builder;

/**
 * Pace and heart rate statistics of all bins whose gradient falls into one fixed range.
 * Open-ended ranges carry a null bound.
 */
@Builder
public record GradientBucket(
        String label,
        Double min,
        Double max,
        int binCount,
        Double avgPace,
        Double medianPace,
        Double avgHeartRate,
        Double medianHeartRate,
        String paceLabel,
        String medianPaceLabel
) {
}
