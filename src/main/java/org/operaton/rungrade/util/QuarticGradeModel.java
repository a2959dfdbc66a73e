package org.operaton.rungrade.util;

import java.util.List;

/**
 * Fourth degree polynomial model {@code a g^4 + b g^3 + c g^2 + d g + e} with empirically
 * fitted coefficients.
 */
public class QuarticGradeModel implements GradeAdjustmentModel {

    /**
     * Published reference curve used to compare a runner's personal adjustment factors against.
     */
    public static final QuarticGradeModel LITERATURE = new QuarticGradeModel(
            -5.294439830640173e-7,
            -0.000003989571857841264,
            0.0020535661142752205,
            0.03265674125152065,
            1);

    private final double a;
    private final double b;
    private final double c;
    private final double d;
    private final double e;

    public QuarticGradeModel(double a, double b, double c, double d, double e) {
        this.a = a;
        this.b = b;
        this.c = c;
        this.d = d;
        this.e = e;
    }

    /**
     * Builds a model from coefficients ordered from the fourth degree term down to the constant.
     *
     * @param coefficients exactly five finite values
     * @return the model
     * @throws IllegalArgumentException if the list does not hold five finite numbers
     */
    public static QuarticGradeModel of(List<Double> coefficients) {
        if (coefficients == null || coefficients.size() != 5) {
            throw new IllegalArgumentException("Exactly five polynomial coefficients are required");
        }
        for (Double coefficient : coefficients) {
            if (coefficient == null || !Double.isFinite(coefficient)) {
                throw new IllegalArgumentException("Polynomial coefficients must be finite numbers");
            }
        }
        return new QuarticGradeModel(coefficients.get(0), coefficients.get(1), coefficients.get(2),
                coefficients.get(3), coefficients.get(4));
    }

    @Override
    public double factor(double gradientPercent) {
        double g = GradeAdjustmentModel.clamp(gradientPercent);
        // Horner form
        return (((a * g + b) * g + c) * g + d) * g + e;
    }
}
