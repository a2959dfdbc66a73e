package org.operaton.rungrade.util;

/**
 * Maps a gradient percentage to a unitless pace multiplier.
 * A factor above 1 means the gradient is slower than the flat-equivalent pace.
 */
public interface GradeAdjustmentModel {

    /**
     * Gradients are clamped to this magnitude before a model is evaluated.
     */
    double MAX_GRADIENT = 35.0;

    /**
     * @param gradientPercent gradient in percent, clamped to [-35, 35] before evaluation
     * @return the pace multiplier
     */
    double factor(double gradientPercent);

    static double clamp(double gradientPercent) {
        return Math.max(-MAX_GRADIENT, Math.min(MAX_GRADIENT, gradientPercent));
    }
}
