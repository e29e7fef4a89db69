package com.nutrition.mealplan.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Everything one optimization call needs. The recipe list is read once and
 * treated as immutable for the rest of the call.
 */
@Value
@Builder(toBuilder = true)
public class PlanningRequest {
    public static final int MAX_HORIZON_DAYS = 14;

    @Builder.Default
    int horizonDays = 7;
    List<Recipe> recipes;
    ConstraintSet constraints;
    @Builder.Default
    ObjectiveWeights weights = ObjectiveWeights.defaults();

    @Singular("inventoryItem")
    Set<String> inventoryItemIds;
    String goal; // e.g. "muscle_gain"; null when no goal is set
}
