package com.nutrition.mealplan.engine;

import com.nutrition.mealplan.domain.ConfigurationException;
import com.nutrition.mealplan.domain.ConstraintSet;
import com.nutrition.mealplan.domain.MealType;
import com.nutrition.mealplan.domain.Nutrient;
import com.nutrition.mealplan.domain.NutrientBound;
import com.nutrition.mealplan.domain.ObjectiveWeights;
import com.nutrition.mealplan.domain.PlanningRequest;
import com.nutrition.mealplan.domain.Recipe;
import com.nutrition.mealplan.domain.StructuralInfeasibilityException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Feasibility envelope of one optimization call: horizon, candidate pool,
 * constraint set and objective weights. Built once per call and never shared.
 */
@Getter
public final class ConstraintModel {

    private final int horizonDays;
    private final List<Recipe> candidatePool;
    private final ConstraintSet constraints;
    private final ObjectiveWeights weights;
    private final Set<String> inventoryItemIds;
    private final String goal;

    private ConstraintModel(PlanningRequest request) {
        this.horizonDays = request.getHorizonDays();
        this.candidatePool = request.getRecipes() == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(request.getRecipes()));
        this.constraints = request.getConstraints();
        this.weights = request.getWeights();
        this.inventoryItemIds = request.getInventoryItemIds() == null
                ? Set.of()
                : Set.copyOf(request.getInventoryItemIds());
        this.goal = request.getGoal();
    }

    public static ConstraintModel of(PlanningRequest request) {
        if (request == null) {
            throw new ConfigurationException("Planning request cannot be null");
        }
        return new ConstraintModel(request);
    }

    /**
     * Checks the envelope for configuration mistakes. Pure; throws on the first problem found.
     */
    public void validate() {
        if (horizonDays < 1 || horizonDays > PlanningRequest.MAX_HORIZON_DAYS) {
            throw new ConfigurationException("horizonDays must be in [1, " + PlanningRequest.MAX_HORIZON_DAYS
                    + "], got " + horizonDays);
        }
        validatePool();

        if (constraints == null) {
            throw new ConfigurationException("Constraint set cannot be null");
        }
        if (constraints.getCalories() == null || constraints.getProtein() == null) {
            throw new ConfigurationException("Calorie and protein bounds are required");
        }
        for (Nutrient nutrient : Nutrient.values()) {
            NutrientBound bound = constraints.boundFor(nutrient);
            if (bound == null) {
                throw new ConfigurationException(nutrient.getLabel() + " bound cannot be null");
            }
            if (!bound.isWellDefined()) {
                throw new ConfigurationException(nutrient.getLabel() + " bound must have a finite min and a numeric max");
            }
            if (bound.isInverted()) {
                throw new ConfigurationException(String.format("%s max (%.1f) is below min (%.1f)",
                        nutrient.getLabel(), bound.getMax(), bound.getMin()));
            }
            if (bound.getMin() < 0) {
                throw new ConfigurationException(nutrient.getLabel() + " min cannot be negative");
            }
        }
        if (constraints.getMealsPerDay() < 1 || constraints.getMealsPerDay() > MealType.MAX_MEALS_PER_DAY) {
            throw new ConfigurationException("mealsPerDay must be in [1, " + MealType.MAX_MEALS_PER_DAY
                    + "], got " + constraints.getMealsPerDay());
        }
        if (constraints.getMaxRepeatsPerHorizon() < 1) {
            throw new ConfigurationException("maxRepeatsPerHorizon must be >= 1");
        }
        if (!Double.isFinite(constraints.getConsecutiveDayPenaltyWeight())
                || constraints.getConsecutiveDayPenaltyWeight() < 0) {
            throw new ConfigurationException("consecutiveDayPenaltyWeight must be finite and non-negative");
        }
        if (constraints.getMaxPrepTimeMinutes() <= 0) {
            throw new ConfigurationException("maxPrepTimeMinutes must be positive");
        }

        if (weights == null) {
            throw new ConfigurationException("Objective weights cannot be null");
        }
        if (weights.hasNonFiniteWeight()) {
            throw new ConfigurationException("Objective weights must be finite numbers");
        }
        if (weights.hasNegativeWeight()) {
            throw new ConfigurationException("Objective weights cannot be negative");
        }
        if (Math.abs(weights.sum() - 1.0) > ObjectiveWeights.SUM_TOLERANCE) {
            throw new ConfigurationException(String.format("Objective weights must sum to 1.0 (got %.3f)", weights.sum()));
        }
    }

    private void validatePool() {
        if (candidatePool.isEmpty()) {
            throw new ConfigurationException("Candidate recipe list cannot be empty");
        }
        Set<String> seen = new HashSet<>();
        for (Recipe recipe : candidatePool) {
            if (recipe == null || recipe.getId() == null) {
                throw new ConfigurationException("Every recipe needs an id");
            }
            if (!seen.add(recipe.getId())) {
                throw new ConfigurationException("Duplicate recipe id: " + recipe.getId());
            }
            if (recipe.getMacros() == null || recipe.getMacros().hasInvalidValue()) {
                throw new ConfigurationException("Recipe " + recipe.getId() + " has missing, negative or non-finite macros");
            }
        }
    }

    public List<MealType> slotTypes() {
        return MealType.slotsFor(constraints.getMealsPerDay());
    }

    /**
     * Recipes that pass the prep-time ceiling and the tag exclusions, in input order.
     */
    public List<Recipe> admissibleRecipes() {
        Set<String> excluded = constraints.getExcludedTags() == null ? Set.of() : constraints.getExcludedTags();
        return candidatePool.stream()
                .filter(r -> r.getTotalTimeMinutes() <= constraints.getMaxPrepTimeMinutes())
                .filter(r -> !r.hasAnyTag(excluded))
                .collect(Collectors.toList());
    }

    /**
     * Admissible recipes tagged for the meal type. Order follows the input pool so
     * variable creation is deterministic.
     */
    public List<Recipe> eligibleRecipes(MealType mealType) {
        return admissibleRecipes().stream()
                .filter(r -> r.isEligibleFor(mealType))
                .collect(Collectors.toList());
    }

    /**
     * Eligible recipes for every configured slot type.
     *
     * @throws StructuralInfeasibilityException naming the first slot that nothing can fill
     */
    public Map<MealType, List<Recipe>> eligibleBySlot() {
        Map<MealType, List<Recipe>> bySlot = new LinkedHashMap<>();
        for (MealType slot : slotTypes()) {
            List<Recipe> eligible = eligibleRecipes(slot);
            if (eligible.isEmpty()) {
                // eligibility does not depend on the day, so the first affected day is day 0
                throw new StructuralInfeasibilityException(0, slot);
            }
            bySlot.put(slot, Collections.unmodifiableList(eligible));
        }
        return bySlot;
    }

    /**
     * Nutrients whose daily bound restricts anything.
     */
    public List<Nutrient> boundedNutrients() {
        List<Nutrient> bounded = new ArrayList<>();
        for (Nutrient nutrient : Nutrient.values()) {
            if (!constraints.boundFor(nutrient).isTrivial()) {
                bounded.add(nutrient);
            }
        }
        return bounded;
    }

    public int totalSlots() {
        return horizonDays * constraints.getMealsPerDay();
    }
}
