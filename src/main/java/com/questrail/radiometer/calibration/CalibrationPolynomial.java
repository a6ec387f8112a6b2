package com.questrail.radiometer.calibration;

import java.util.Arrays;

/**
 * CalibrationPolynomial
 * -----------------------------------------------------------------------------
 * Degree-4 polynomial mapping a zero-based pixel index to a wavelength in
 * nanometers.
 *
 * <p>Coefficients are held in descending power order:</p>
 * <pre>
 *   λ(x) = c0·x⁴ + c1·x³ + c2·x² + c3·x + c4
 * </pre>
 *
 * <p>Evaluation is always in double precision and the result is never
 * rounded.</p>
 */
public final class CalibrationPolynomial
{
    /** Number of coefficients (degree + 1). */
    public static final int COEFFICIENT_COUNT = 5;

    private final double[] coefficients;

    private CalibrationPolynomial(double[] coefficients) {
        this.coefficients = coefficients;
    }

    /**
     * Creates a polynomial from coefficients in descending power order.
     *
     * @throws IllegalArgumentException unless exactly five finite coefficients are given
     */
    public static CalibrationPolynomial of(double... coefficients) {
        if (coefficients == null || coefficients.length != COEFFICIENT_COUNT) {
            throw new IllegalArgumentException(
                    "Calibration polynomial requires " + COEFFICIENT_COUNT + " coefficients (was "
                            + (coefficients == null ? 0 : coefficients.length) + ")");
        }
        for (int i = 0; i < coefficients.length; i++) {
            if (!Double.isFinite(coefficients[i])) {
                throw new IllegalArgumentException("Coefficient c" + i + " is not finite: " + coefficients[i]);
            }
        }
        return new CalibrationPolynomial(coefficients.clone());
    }

    /**
     * Evaluates the polynomial at {@code x} (Horner's scheme).
     */
    public double evaluate(double x) {
        double result = 0.0;
        for (double c : coefficients) {
            result = result * x + c;
        }
        return result;
    }

    /**
     * Returns a copy of the coefficients, highest power first.
     */
    public double[] coefficients() {
        return coefficients.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CalibrationPolynomial that)) return false;
        return Arrays.equals(coefficients, that.coefficients);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(coefficients);
    }

    @Override
    public String toString() {
        return "CalibrationPolynomial" + Arrays.toString(coefficients);
    }
}
