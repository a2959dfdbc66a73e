package org.operaton.rungrade.model.dto;

import org.operaton.rungrade.model.GradientKey;

/**
 * Actual versus model-expected pace ratio for the bins of one gradient group.
 *
 * @param actualAdjustment   statistic of the per-bin ratios {@code binPace / basePace}
 * @param expectedAdjustment literature model evaluated at the group's gradient
 * @param deviation          {@code actual - expected}
 */
public record AdjustmentExpectationBucket(
        GradientKey gradient,
        int binCount,
        double actualAdjustment,
        double expectedAdjustment,
        double deviation
) {
}
