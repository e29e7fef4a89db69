package com.nutrition.mealplan.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class NutrientBoundTest {

    @Test
    void shouldMeasureViolationRelativeToBrokenLimit() {
        NutrientBound bound = NutrientBound.between(1800, 2200);

        assertThat(bound.relativeViolation(2000)).isZero();
        assertThat(bound.relativeViolation(1620)).isCloseTo(0.1, within(1e-9));
        assertThat(bound.relativeViolation(2420)).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void shouldTreatZeroMinimumWithoutCeilingAsTrivial() {
        assertThat(NutrientBound.unbounded().isTrivial()).isTrue();
        assertThat(NutrientBound.atLeast(25).isTrivial()).isFalse();
        assertThat(NutrientBound.atLeast(25).midpoint()).isEqualTo(25);
        assertThat(NutrientBound.between(10, 5).isInverted()).isTrue();
    }

    @Test
    void shouldMapMealsPerDayToOrderedSlots() {
        assertThat(MealType.slotsFor(4)).containsExactly(
                MealType.BREAKFAST, MealType.LUNCH, MealType.DINNER, MealType.SNACK);
        assertThat(MealType.fromTag("meal_5")).isEqualTo(MealType.MEAL_5);
    }
}
