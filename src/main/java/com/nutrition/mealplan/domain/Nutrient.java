package com.nutrition.mealplan.domain;

import java.util.function.ToDoubleFunction;

public enum Nutrient {
    CALORIES("calories", MacroNutrients::getCalories),
    PROTEIN("protein_g", MacroNutrients::getProteinG),
    CARBS("carbs_g", MacroNutrients::getCarbsG),
    FAT("fat_g", MacroNutrients::getFatG),
    FIBER("fiber_g", MacroNutrients::getFiberG),
    SODIUM("sodium_mg", MacroNutrients::getSodiumMg);

    private final String label;
    private final ToDoubleFunction<MacroNutrients> extractor;

    Nutrient(String label, ToDoubleFunction<MacroNutrients> extractor) {
        this.label = label;
        this.extractor = extractor;
    }

    public double of(MacroNutrients macros) {
        return extractor.applyAsDouble(macros);
    }

    public String getLabel() {
        return label;
    }
}
