package com.nutrition.mealplan.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one optimization call: either an assembled plan or a failure
 * reason, never both.
 */
@Value
@Builder
public class MealPlanResult {
    OptimizationStage stage;
    Strategy strategy;
    MealPlan plan;

    @Singular
    List<String> warnings;

    FailureReason failureReason;
    String failureDetail;

    @Singular("traceStage")
    List<OptimizationStage> stageTrace;

    // Diagnostics
    String exactStatus;
    double objectiveValue;
    int solverConsecutiveRepeats;
    long computationTimeMs;

    public boolean isSuccess() {
        return stage == OptimizationStage.ASSEMBLED && plan != null;
    }
}
