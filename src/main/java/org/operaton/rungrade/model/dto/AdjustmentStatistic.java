package org.operaton.rungrade.model.dto;

/**
 * Central tendency used by the per-bin adjustment-vs-expectation view.
 */
public enum AdjustmentStatistic {
    MEAN,
    MEDIAN
}
