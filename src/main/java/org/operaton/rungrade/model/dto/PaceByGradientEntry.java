package org.operaton.rungrade.model.dto;

import org.operaton.rungrade.model.GradientKey;

/**
 * One point of the per-degree pace chart. The pace is distance/time weighted:
 * {@code (totalTime / 60) / (totalDistance / 1000)}.
 */
public record PaceByGradientEntry(
        GradientKey gradient,
        int binCount,
        double totalDistanceMeters,
        double totalTimeSeconds,
        double avgPace,
        String paceLabel
) {
}
