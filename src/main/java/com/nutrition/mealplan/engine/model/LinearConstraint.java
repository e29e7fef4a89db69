package com.nutrition.mealplan.engine.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * {@code lower <= sum(coefficient * variable) <= upper}. Infinite bounds mean "no limit".
 */
@Value
public class LinearConstraint {
    private static final double EPS = 1e-9;

    String name;
    double lowerBound;
    double upperBound;
    Map<BinaryVariable, Double> coefficients;

    private LinearConstraint(String name, double lowerBound, double upperBound, Map<BinaryVariable, Double> coefficients) {
        this.name = name;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.coefficients = Collections.unmodifiableMap(new LinkedHashMap<>(coefficients));
    }

    public static LinearConstraint of(String name, double lowerBound, double upperBound,
                                      Map<BinaryVariable, Double> coefficients) {
        return new LinearConstraint(name, lowerBound, upperBound, coefficients);
    }

    public static LinearConstraint atLeast(String name, double lowerBound, Map<BinaryVariable, Double> coefficients) {
        return new LinearConstraint(name, lowerBound, Double.POSITIVE_INFINITY, coefficients);
    }

    public static LinearConstraint atMost(String name, double upperBound, Map<BinaryVariable, Double> coefficients) {
        return new LinearConstraint(name, Double.NEGATIVE_INFINITY, upperBound, coefficients);
    }

    public double activity(ToDoubleFunction<BinaryVariable> values) {
        double sum = 0.0;
        for (Map.Entry<BinaryVariable, Double> e : coefficients.entrySet()) {
            sum += e.getValue() * values.applyAsDouble(e.getKey());
        }
        return sum;
    }

    public boolean isSatisfiedBy(ToDoubleFunction<BinaryVariable> values) {
        double activity = activity(values);
        return activity >= lowerBound - EPS && activity <= upperBound + EPS;
    }
}
