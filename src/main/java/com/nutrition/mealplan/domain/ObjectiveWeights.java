package com.nutrition.mealplan.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Relative importance of the soft objective terms. Weights bias the search only;
 * they never relax a hard constraint.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ObjectiveWeights {
    public static final double SUM_TOLERANCE = 0.01;

    @Builder.Default
    private double macroDeviation = 0.4;
    @Builder.Default
    private double inventoryUsage = 0.3;
    @Builder.Default
    private double variety = 0.2;
    @Builder.Default
    private double goalAlignment = 0.1;

    public static ObjectiveWeights defaults() {
        return ObjectiveWeights.builder().build();
    }

    public double sum() {
        return macroDeviation + inventoryUsage + variety + goalAlignment;
    }

    public boolean hasNonFiniteWeight() {
        return !Double.isFinite(macroDeviation) || !Double.isFinite(inventoryUsage)
                || !Double.isFinite(variety) || !Double.isFinite(goalAlignment);
    }

    public boolean hasNegativeWeight() {
        return macroDeviation < 0 || inventoryUsage < 0 || variety < 0 || goalAlignment < 0;
    }
}
