package com.nutrition.mealplan.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assembled plan: day index to slot type to recipe id, with totals recomputed
 * from the chosen recipes. Never mutated after assembly.
 */
@Value
@Builder
public class MealPlan {
    int horizonDays;
    List<MealType> slots;
    Map<Integer, Map<MealType, String>> assignments;
    Map<Integer, MacroNutrients> dailyTotals;
    Map<String, Integer> recipeCounts;
    List<BoundViolation> violations;
    Map<String, Integer> overusedRecipes; // recipe id -> occurrences above the repeat cap
    int consecutiveRepeats;
    boolean complete;

    public Optional<String> recipeAt(int day, MealType slot) {
        Map<MealType, String> dayPlan = assignments.get(day);
        return dayPlan == null ? Optional.empty() : Optional.ofNullable(dayPlan.get(slot));
    }

    public boolean isConstraintsSatisfied() {
        return complete && violations.isEmpty() && overusedRecipes.isEmpty();
    }

    public double maxRelativeViolation() {
        return violations.stream()
                .mapToDouble(BoundViolation::relativeMagnitude)
                .max()
                .orElse(0.0);
    }
}
