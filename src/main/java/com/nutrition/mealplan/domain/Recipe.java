package com.nutrition.mealplan.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.Set;

/**
 * Candidate recipe as supplied by the catalog. Immutable for the duration of a run.
 */
@Value
@Builder(toBuilder = true)
public class Recipe {
    String id;
    String title;
    MacroNutrients macros;

    @Singular("eligibleMealTime")
    Set<MealType> eligibleMealTimes;

    int prepTimeMinutes;
    int cookTimeMinutes;

    @Singular
    Set<String> dietaryTags;
    @Singular
    Set<String> allergenTags;
    @Singular
    Set<String> ingredientIds;
    @Singular
    Set<String> goalTags;

    public boolean isEligibleFor(MealType mealType) {
        return eligibleMealTimes.contains(mealType);
    }

    public int getTotalTimeMinutes() {
        return prepTimeMinutes + cookTimeMinutes;
    }

    public boolean hasAnyTag(Set<String> tags) {
        return !Collections.disjoint(dietaryTags, tags) || !Collections.disjoint(allergenTags, tags);
    }
}
