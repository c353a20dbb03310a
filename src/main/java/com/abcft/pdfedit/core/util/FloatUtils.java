package com.abcft.pdfedit.core.util;

import org.apache.commons.math3.util.FastMath;

/**
 * Tolerance based comparison for layout arithmetic.
 */
public final class FloatUtils {

    /**
     * Default epsilon for matrix components and derived values.
     */
    public static final double EPSILON = 1e-6;

    private FloatUtils() {}

    public static boolean feq(double a, double b) {
        return feq(a, b, EPSILON);
    }

    public static boolean feq(double a, double b, double epsilon) {
        return FastMath.abs(a - b) <= epsilon;
    }

    public static boolean isZero(double value) {
        return FastMath.abs(value) <= EPSILON;
    }

    public static double clamp(double value, double min, double max) {
        return FastMath.max(min, FastMath.min(max, value));
    }

    public static boolean within(double value, double min, double max) {
        return value >= min && value <= max;
    }

}
