package com.nutrition.mealplan.domain;

import lombok.Value;

/**
 * Closed daily range {@code [min, max]}. {@code max} may be {@link Double#POSITIVE_INFINITY}.
 */
@Value
public class NutrientBound {
    double min;
    double max;

    public static NutrientBound between(double min, double max) {
        return new NutrientBound(min, max);
    }

    public static NutrientBound atLeast(double min) {
        return new NutrientBound(min, Double.POSITIVE_INFINITY);
    }

    public static NutrientBound unbounded() {
        return new NutrientBound(0, Double.POSITIVE_INFINITY);
    }

    /** Min is a finite number and max is a number, possibly +infinity. */
    public boolean isWellDefined() {
        return Double.isFinite(min) && !Double.isNaN(max);
    }

    public boolean isInverted() {
        return max < min;
    }

    /** A bound that every non-negative total satisfies. */
    public boolean isTrivial() {
        return min <= 0 && Double.isInfinite(max);
    }

    public boolean hasUpperLimit() {
        return !Double.isInfinite(max);
    }

    /**
     * Size of the violation relative to the broken limit; zero when inside.
     */
    public double relativeViolation(double value) {
        if (value < min) {
            return (min - value) / min;
        }
        if (value > max) {
            return max > 0 ? (value - max) / max : value;
        }
        return 0.0;
    }

    public double midpoint() {
        return hasUpperLimit() ? (min + max) / 2.0 : min;
    }
}
