package org.carma.coalition.game;

/**
 * Floating-point comparisons with a tolerance relative to the magnitude of
 * the operands. Any comparison involving NaN is false.
 */
public final class Tolerance {

    /** Default relative tolerance. */
    public static final double EPSILON = 1e-9;

    /** Floor applied when both operands are close to zero. */
    public static final double ABSOLUTE_FLOOR = 1e-12;

    private Tolerance() {}

    public static boolean definitelyGreater(double a, double b) {
        return definitelyGreater(a, b, EPSILON);
    }

    public static boolean definitelyGreater(double a, double b, double eps) {
        if (Double.isNaN(a) || Double.isNaN(b)) return false;
        return (a - b) > threshold(Math.max(Math.abs(a), Math.abs(b)), eps);
    }

    public static boolean definitelyLess(double a, double b) {
        return definitelyLess(a, b, EPSILON);
    }

    public static boolean definitelyLess(double a, double b, double eps) {
        if (Double.isNaN(a) || Double.isNaN(b)) return false;
        return (b - a) > threshold(Math.max(Math.abs(a), Math.abs(b)), eps);
    }

    /**
     * Strict closeness: the difference is small relative to the smaller operand.
     */
    public static boolean essentiallyEqual(double a, double b) {
        return essentiallyEqual(a, b, EPSILON);
    }

    public static boolean essentiallyEqual(double a, double b, double eps) {
        if (Double.isNaN(a) || Double.isNaN(b)) return false;
        return Math.abs(a - b) <= threshold(Math.min(Math.abs(a), Math.abs(b)), eps);
    }

    /**
     * Loose closeness: the difference is small relative to the larger operand.
     */
    public static boolean approximatelyEqual(double a, double b) {
        return approximatelyEqual(a, b, EPSILON);
    }

    public static boolean approximatelyEqual(double a, double b, double eps) {
        if (Double.isNaN(a) || Double.isNaN(b)) return false;
        return Math.abs(a - b) <= threshold(Math.max(Math.abs(a), Math.abs(b)), eps);
    }

    private static double threshold(double magnitude, double eps) {
        return Math.max(ABSOLUTE_FLOOR, magnitude * eps);
    }
}
