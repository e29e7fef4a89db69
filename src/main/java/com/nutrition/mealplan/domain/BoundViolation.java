package com.nutrition.mealplan.domain;

import lombok.Value;

/**
 * A realized daily total that falls outside its configured range.
 */
@Value
public class BoundViolation {
    int day;
    Nutrient nutrient;
    double actual;
    NutrientBound bound;

    public double relativeMagnitude() {
        return bound.relativeViolation(actual);
    }

    public String describe() {
        String limit = actual < bound.getMin()
                ? String.format("min %.1f", bound.getMin())
                : String.format("max %.1f", bound.getMax());
        return String.format("Day %d %s %.1f outside %s (%.0f%%)",
                day, nutrient.getLabel(), actual, limit, relativeMagnitude() * 100);
    }
}
