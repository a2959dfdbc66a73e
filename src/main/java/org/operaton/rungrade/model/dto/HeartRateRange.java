package org.operaton.rungrade.model.dto;

import jakarta.validation.constraints.Positive;

/**
 * Inclusive heart rate window for bin filtering. Either bound may be omitted.
 */
public record HeartRateRange(
        @Positive Integer minHeartRate,
        @Positive Integer maxHeartRate
) {

    public boolean isActive() {
        return minHeartRate != null || maxHeartRate != null;
    }

    public boolean contains(int heartRate) {
        if (minHeartRate != null && heartRate < minHeartRate) {
            return false;
        }
        return maxHeartRate == null || heartRate <= maxHeartRate;
    }
}
