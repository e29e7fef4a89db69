package com.nutrition.mealplan.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConstraintSet {
    // Daily nutrient envelope
    private NutrientBound calories;
    private NutrientBound protein;
    @Builder.Default
    private NutrientBound carbs = NutrientBound.unbounded();
    @Builder.Default
    private NutrientBound fat = NutrientBound.unbounded();
    private double fiberMin;

    // Structure
    @Builder.Default
    private int mealsPerDay = 3;
    @Builder.Default
    private int maxRepeatsPerHorizon = 2; // occurrences of one recipe across the whole horizon
    @Builder.Default
    private double consecutiveDayPenaltyWeight = 1.0;

    // Candidate filters
    @Builder.Default
    private int maxPrepTimeMinutes = 60;
    @Builder.Default
    private Set<String> excludedTags = new HashSet<>(); // dietary or allergen tags

    /**
     * Bound for a nutrient, or {@link NutrientBound#unbounded()} when it is only tracked.
     */
    public NutrientBound boundFor(Nutrient nutrient) {
        return switch (nutrient) {
            case CALORIES -> calories;
            case PROTEIN -> protein;
            case CARBS -> carbs;
            case FAT -> fat;
            case FIBER -> NutrientBound.atLeast(fiberMin);
            case SODIUM -> NutrientBound.unbounded();
        };
    }
}
