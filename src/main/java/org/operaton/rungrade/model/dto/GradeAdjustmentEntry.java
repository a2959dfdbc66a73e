package org.operaton.rungrade.model.dto;

import org.operaton.rungrade.model.GradientKey;

/**
 * Personal versus literature pace multiplier for one gradient group.
 */
public record GradeAdjustmentEntry(
        GradientKey gradient,
        double gradientValue,
        double personalAdjustmentFactor,
        double literatureAdjustmentFactor,
        double avgPace,
        String paceLabel,
        int binCount
) {
}
