package org.operaton.rungrade.util;

/**
 * Simplified default model: {@code max(0.3, 1 + 0.033 g + 0.000233 g^2)}.
 * There is no upper cap.
 */
public class QuadraticGradeModel implements GradeAdjustmentModel {

    public static final QuadraticGradeModel INSTANCE = new QuadraticGradeModel();

    private static final double LINEAR = 0.033;
    private static final double QUADRATIC = 0.000233;
    private static final double MIN_FACTOR = 0.3;

    @Override
    public double factor(double gradientPercent) {
        double g = GradeAdjustmentModel.clamp(gradientPercent);
        return Math.max(MIN_FACTOR, 1 + g * LINEAR + g * g * QUADRATIC);
    }
}
