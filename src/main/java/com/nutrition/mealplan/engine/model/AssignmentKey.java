package com.nutrition.mealplan.engine.model;

import com.nutrition.mealplan.domain.MealType;
import lombok.Value;

/**
 * Structured (recipe, day, slot) key used directly as a map key.
 */
@Value
public class AssignmentKey {
    String recipeId;
    int day;
    MealType slot;

    public AssignmentKey previousDay() {
        return new AssignmentKey(recipeId, day - 1, slot);
    }

    @Override
    public String toString() {
        return recipeId + "@d" + day + "/" + slot.getTag();
    }
}
