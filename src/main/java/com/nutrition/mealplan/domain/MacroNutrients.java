package com.nutrition.mealplan.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Per-serving macro profile. All values are non-negative.
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class MacroNutrients {
    double calories;
    double proteinG;
    double carbsG;
    double fatG;
    double fiberG;
    double sodiumMg;

    public static final MacroNutrients ZERO = new MacroNutrients(0, 0, 0, 0, 0, 0);

    public MacroNutrients plus(MacroNutrients other) {
        return new MacroNutrients(
                calories + other.calories,
                proteinG + other.proteinG,
                carbsG + other.carbsG,
                fatG + other.fatG,
                fiberG + other.fiberG,
                sodiumMg + other.sodiumMg);
    }

    /** Display-level rounding to one decimal; sums themselves are never rounded. */
    public MacroNutrients roundedForDisplay() {
        return new MacroNutrients(
                round1(calories), round1(proteinG), round1(carbsG), round1(fatG), round1(fiberG), round1(sodiumMg));
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }

    /** True when any value is negative, NaN or infinite. */
    public boolean hasInvalidValue() {
        return !isValid(calories) || !isValid(proteinG) || !isValid(carbsG)
                || !isValid(fatG) || !isValid(fiberG) || !isValid(sodiumMg);
    }

    private static boolean isValid(double v) {
        return Double.isFinite(v) && v >= 0;
    }
}
