package org.operaton.rungrade.model.dto;

/**
 * Reasons a bin can be dropped by the reliability filter, in check order.
 */
public enum ExclusionReason {
    SPEED,
    GRADIENT,
    DURATION,
    DISTANCE,
    HEART_RATE
}
