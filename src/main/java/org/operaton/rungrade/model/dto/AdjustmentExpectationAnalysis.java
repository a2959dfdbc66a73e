package org.operaton.rungrade.model.dto;

import java.util.List;

/**
 * Per-bin adjustment-vs-expectation view, grouped per integer degree.
 */
public record AdjustmentExpectationAnalysis(
        AdjustmentStatistic statistic,
        Double basePace,
        List<AdjustmentExpectationBucket> buckets
) {
}
