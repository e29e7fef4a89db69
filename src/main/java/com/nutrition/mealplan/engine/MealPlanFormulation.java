package com.nutrition.mealplan.engine;

import com.nutrition.mealplan.domain.MealType;
import com.nutrition.mealplan.domain.Nutrient;
import com.nutrition.mealplan.domain.NutrientBound;
import com.nutrition.mealplan.domain.OptimizerParams;
import com.nutrition.mealplan.domain.Recipe;
import com.nutrition.mealplan.engine.model.AssignmentKey;
import com.nutrition.mealplan.engine.model.BinaryVariable;
import com.nutrition.mealplan.engine.model.LinearConstraint;
import com.nutrition.mealplan.engine.model.Linearization;
import com.nutrition.mealplan.engine.model.MilpModel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binary recipe x day x slot formulation of the meal-plan problem.
 *
 * <ul>
 *   <li>exactly one recipe per (day, slot)</li>
 *   <li>daily nutrient totals inside their bounds</li>
 *   <li>per-recipe occurrences capped over the horizon</li>
 *   <li>rep = x(d-1) AND x(d) for every recipe/slot/day, penalized in the objective</li>
 * </ul>
 *
 * Variables exist only for eligible (recipe, slot) pairs, so an ineligible recipe
 * can never be chosen.
 */
@Slf4j
@Getter
public final class MealPlanFormulation {

    private final MilpModel model;
    private final Map<AssignmentKey, BinaryVariable> assignmentVariables;
    private final Map<AssignmentKey, BinaryVariable> repeatVariables;
    private final Map<String, Recipe> recipesById;

    private MealPlanFormulation(MilpModel model,
                                Map<AssignmentKey, BinaryVariable> assignmentVariables,
                                Map<AssignmentKey, BinaryVariable> repeatVariables,
                                Map<String, Recipe> recipesById) {
        this.model = model;
        this.assignmentVariables = Collections.unmodifiableMap(assignmentVariables);
        this.repeatVariables = Collections.unmodifiableMap(repeatVariables);
        this.recipesById = Collections.unmodifiableMap(recipesById);
    }

    /**
     * Number of assignment variables the model would create.
     */
    public static long estimateDecisionVariables(ConstraintModel constraints) {
        long perDay = 0;
        for (MealType slot : constraints.slotTypes()) {
            perDay += constraints.eligibleRecipes(slot).size();
        }
        return perDay * constraints.getHorizonDays();
    }

    /**
     * @throws com.nutrition.mealplan.domain.StructuralInfeasibilityException if a slot has no eligible recipe
     */
    public static MealPlanFormulation formulate(ConstraintModel constraints, OptimizerParams params) {
        Map<MealType, List<Recipe>> eligible = constraints.eligibleBySlot();
        ObjectiveModel objective = new ObjectiveModel(constraints);
        int days = constraints.getHorizonDays();

        MilpModel.Builder builder = MilpModel.builder();
        Map<AssignmentKey, BinaryVariable> assign = new LinkedHashMap<>();
        Map<AssignmentKey, BinaryVariable> repeat = new LinkedHashMap<>();
        Map<String, Recipe> recipesById = new LinkedHashMap<>();

        // 1. Decision variables, created lazily for eligible triples only
        for (int d = 0; d < days; d++) {
            for (Map.Entry<MealType, List<Recipe>> slot : eligible.entrySet()) {
                for (Recipe recipe : slot.getValue()) {
                    AssignmentKey key = new AssignmentKey(recipe.getId(), d, slot.getKey());
                    BinaryVariable x = BinaryVariable.assign(key);
                    builder.addVariable(x);
                    assign.put(key, x);
                    recipesById.putIfAbsent(recipe.getId(), recipe);
                }
            }
        }

        // 2. Exactly one recipe per slot
        for (int d = 0; d < days; d++) {
            for (Map.Entry<MealType, List<Recipe>> slot : eligible.entrySet()) {
                Map<BinaryVariable, Double> coeffs = new LinkedHashMap<>();
                for (Recipe recipe : slot.getValue()) {
                    coeffs.put(assign.get(new AssignmentKey(recipe.getId(), d, slot.getKey())), 1.0);
                }
                builder.addConstraint(LinearConstraint.of("one_d" + d + "_" + slot.getKey().getTag(), 1.0, 1.0, coeffs));
            }
        }

        // 3. Daily nutrient bounds
        for (int d = 0; d < days; d++) {
            for (Nutrient nutrient : constraints.boundedNutrients()) {
                NutrientBound bound = constraints.getConstraints().boundFor(nutrient);
                Map<BinaryVariable, Double> coeffs = new LinkedHashMap<>();
                for (Map.Entry<AssignmentKey, BinaryVariable> e : assign.entrySet()) {
                    if (e.getKey().getDay() != d) {
                        continue;
                    }
                    double value = nutrient.of(recipesById.get(e.getKey().getRecipeId()).getMacros());
                    if (value != 0.0) {
                        coeffs.put(e.getValue(), value);
                    }
                }
                builder.addConstraint(LinearConstraint.of(
                        nutrient.getLabel() + "_d" + d, bound.getMin(), bound.getMax(), coeffs));
            }
        }

        // 4. Repeat cap over the horizon
        int maxRepeats = constraints.getConstraints().getMaxRepeatsPerHorizon();
        for (String recipeId : recipesById.keySet()) {
            Map<BinaryVariable, Double> coeffs = new LinkedHashMap<>();
            assign.forEach((key, x) -> {
                if (key.getRecipeId().equals(recipeId)) {
                    coeffs.put(x, 1.0);
                }
            });
            builder.addConstraint(LinearConstraint.atMost("cap_" + recipeId, maxRepeats, coeffs));
        }

        // 5. Consecutive-day repeats: rep = prev AND curr
        double penaltyWeight = constraints.getConstraints().getConsecutiveDayPenaltyWeight();
        for (Map.Entry<AssignmentKey, BinaryVariable> e : assign.entrySet()) {
            AssignmentKey key = e.getKey();
            if (key.getDay() == 0) {
                continue;
            }
            BinaryVariable prev = assign.get(key.previousDay());
            if (prev == null) {
                continue;
            }
            BinaryVariable rep = BinaryVariable.repeat(key);
            builder.addVariable(rep);
            builder.addConstraints(Linearization.booleanAnd(prev, e.getValue(), rep));
            builder.addObjectiveTerm(rep, penaltyWeight);
            repeat.put(key, rep);
        }

        // 6. Secondary objective terms, scaled below a single repeat
        double scale = params.getSecondaryObjectiveScale();
        for (Map.Entry<AssignmentKey, BinaryVariable> e : assign.entrySet()) {
            Recipe recipe = recipesById.get(e.getKey().getRecipeId());
            builder.addObjectiveTerm(e.getValue(), scale * objective.assignmentCost(recipe));
        }

        MilpModel model = builder.build();
        log.debug("Formulated meal plan model: {} assignment vars, {} repeat vars, {} constraints",
                assign.size(), repeat.size(), model.getConstraints().size());
        return new MealPlanFormulation(model, assign, repeat, recipesById);
    }
}
