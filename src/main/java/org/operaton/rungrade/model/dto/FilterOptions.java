package org.operaton.rungrade.model.dto;

import jakarta.validation.Valid;

/**
 * Which exclusion rules the reliability filter applies. Both modes can be combined.
 *
 * @param removeUnreliableBins apply the speed, gradient, duration and distance checks
 * @param heartRateFilter      optional heart rate window
 */
public record FilterOptions(boolean removeUnreliableBins, @Valid HeartRateRange heartRateFilter) {

    public static FilterOptions none() {
        return new FilterOptions(false, null);
    }

    public boolean isHeartRateFilterActive() {
        return heartRateFilter != null && heartRateFilter.isActive();
    }
}
