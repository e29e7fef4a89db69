package com.nutrition.mealplan.domain;

import java.util.Arrays;
import java.util.List;

/**
 * Meal-time tags in slot order. A day with {@code n} meals uses the first
 * {@code n} entries.
 */
public enum MealType {
    BREAKFAST("breakfast"),
    LUNCH("lunch"),
    DINNER("dinner"),
    SNACK("snack"),
    MEAL_4("meal_4"),
    MEAL_5("meal_5");

    public static final int MAX_MEALS_PER_DAY = 6;

    private final String tag;

    MealType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Slot types for a day with the given number of meals.
     */
    public static List<MealType> slotsFor(int mealsPerDay) {
        if (mealsPerDay < 1 || mealsPerDay > MAX_MEALS_PER_DAY) {
            throw new IllegalArgumentException("mealsPerDay must be in [1, " + MAX_MEALS_PER_DAY + "]: " + mealsPerDay);
        }
        return List.of(Arrays.copyOf(values(), mealsPerDay));
    }

    public static MealType fromTag(String tag) {
        for (MealType type : values()) {
            if (type.tag.equalsIgnoreCase(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown meal type: " + tag);
    }

    @Override
    public String toString() {
        return tag;
    }
}
