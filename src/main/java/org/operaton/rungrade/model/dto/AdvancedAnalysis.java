package org.operaton.rungrade.model.dto;

import java.util.List;

/**
 * All cross-run gradient/pace analyses for one set of runs.
 */
public record AdvancedAnalysis(
        GradientPaceAnalysis gradientPace,
        List<PaceByGradientEntry> paceByGradientChart,
        GradeAdjustmentAnalysis gradeAdjustment,
        AdjustmentExpectationAnalysis adjustmentExpectation
) {
}
