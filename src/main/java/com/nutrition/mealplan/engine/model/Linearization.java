package com.nutrition.mealplan.engine.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Linear encodings of logical relations between binary variables.
 */
public final class Linearization {

    private Linearization() {
    }

    /**
     * Constraints forcing {@code c = a AND b} for binaries:
     * {@code c >= a + b - 1}, {@code c <= a}, {@code c <= b}.
     */
    public static List<LinearConstraint> booleanAnd(BinaryVariable a, BinaryVariable b, BinaryVariable c) {
        String base = "and_" + c.label();

        // c - a - b >= -1
        Map<BinaryVariable, Double> lower = new LinkedHashMap<>();
        lower.put(c, 1.0);
        lower.put(a, -1.0);
        lower.put(b, -1.0);

        // c - a <= 0
        Map<BinaryVariable, Double> upperA = new LinkedHashMap<>();
        upperA.put(c, 1.0);
        upperA.put(a, -1.0);

        // c - b <= 0
        Map<BinaryVariable, Double> upperB = new LinkedHashMap<>();
        upperB.put(c, 1.0);
        upperB.put(b, -1.0);

        return List.of(
                LinearConstraint.atLeast(base + "_lo", -1.0, lower),
                LinearConstraint.atMost(base + "_le_a", 0.0, upperA),
                LinearConstraint.atMost(base + "_le_b", 0.0, upperB));
    }
}
