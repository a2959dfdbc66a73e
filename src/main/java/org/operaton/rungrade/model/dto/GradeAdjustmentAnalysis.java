package org.operaton.rungrade.model.dto;

import java.util.List;

/**
 * Grade adjustment factors relative to the runner's flat pace.
 *
 * @param adjustmentData one entry per gradient group, ascending
 * @param basePace       flat reference pace in min/km, null without data
 * @param basePaceLabel  {@code m:ss} rendering of the base pace or {@code N/A}
 */
public record GradeAdjustmentAnalysis(List<GradeAdjustmentEntry> adjustmentData, Double basePace, String basePaceLabel) {
}
