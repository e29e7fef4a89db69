package com.nutrition.mealplan.domain;

import lombok.Getter;

/**
 * A slot has no eligible recipe, so no plan can fill it.
 */
@Getter
public class StructuralInfeasibilityException extends RuntimeException {

    private final int day;
    private final MealType mealType;

    public StructuralInfeasibilityException(int day, MealType mealType) {
        super("No eligible recipe for day " + day + " slot " + mealType.getTag());
        this.day = day;
        this.mealType = mealType;
    }
}
