package com.nutrition.mealplan.engine;

import com.nutrition.mealplan.domain.OptimizerParams;

public interface MealPlanOptimizer {
    SolveOutcome optimize(ConstraintModel model, OptimizerParams params);
}
