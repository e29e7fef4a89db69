package com.nutrition.mealplan.engine;

import com.nutrition.mealplan.domain.MacroNutrients;
import com.nutrition.mealplan.domain.ObjectiveWeights;
import com.nutrition.mealplan.domain.Recipe;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Weighted soft objective: macro deviation, inventory usage, variety and goal
 * alignment. Every term is normalized to [0, 1] where 0 is best.
 */
public class ObjectiveModel {

    private final ObjectiveWeights weights;
    private final Set<String> inventory;
    private final String goal;
    private final double dailyCalorieTarget;
    private final double dailyProteinTarget;
    private final int mealsPerDay;

    public ObjectiveModel(ConstraintModel model) {
        this.weights = model.getWeights();
        this.inventory = model.getInventoryItemIds();
        this.goal = model.getGoal();
        this.dailyCalorieTarget = model.getConstraints().getCalories().midpoint();
        this.dailyProteinTarget = model.getConstraints().getProtein().midpoint();
        this.mealsPerDay = model.getConstraints().getMealsPerDay();
    }

    /**
     * Linear per-slot cost of choosing a recipe. Variety is not a per-slot property;
     * the exact model expresses it through the repeat cap and repeat variables.
     */
    public double assignmentCost(Recipe recipe) {
        return weights.getMacroDeviation() * mealMacroDeviation(recipe.getMacros())
                + weights.getInventoryUsage() * (1.0 - inventoryCoverage(recipe))
                + weights.getGoalAlignment() * (1.0 - goalAlignment(recipe));
    }

    /**
     * Distance of one serving from an even share of the daily targets.
     */
    public double mealMacroDeviation(MacroNutrients macros) {
        double calorieShare = dailyCalorieTarget / mealsPerDay;
        double proteinShare = dailyProteinTarget / mealsPerDay;
        return (relativeDistance(macros.getCalories(), calorieShare)
                + relativeDistance(macros.getProteinG(), proteinShare)) / 2.0;
    }

    /**
     * Share of the recipe's ingredients already in the pantry. Neutral (1.0) without inventory.
     */
    public double inventoryCoverage(Recipe recipe) {
        if (inventory.isEmpty()) {
            return 1.0;
        }
        if (recipe.getIngredientIds().isEmpty()) {
            return 0.0;
        }
        long inStock = recipe.getIngredientIds().stream().filter(inventory::contains).count();
        return (double) inStock / recipe.getIngredientIds().size();
    }

    public double goalAlignment(Recipe recipe) {
        if (goal == null || goal.isBlank()) {
            return 1.0;
        }
        return recipe.getGoalTags().contains(goal) ? 1.0 : 0.0;
    }

    /**
     * Weighted score of a whole plan, given the recipes of each day in slot order.
     */
    public double planScore(List<List<Recipe>> days) {
        int totalSlots = 0;
        double macroTerm = 0.0;
        double goalMisses = 0.0;
        Set<String> distinct = new HashSet<>();
        Set<String> pantryUsed = new HashSet<>();

        for (List<Recipe> day : days) {
            MacroNutrients totals = MacroNutrients.ZERO;
            for (Recipe recipe : day) {
                totals = totals.plus(recipe.getMacros());
                distinct.add(recipe.getId());
                goalMisses += 1.0 - goalAlignment(recipe);
                for (String item : recipe.getIngredientIds()) {
                    if (inventory.contains(item)) {
                        pantryUsed.add(item);
                    }
                }
                totalSlots++;
            }
            macroTerm += (relativeDistance(totals.getCalories(), dailyCalorieTarget)
                    + relativeDistance(totals.getProteinG(), dailyProteinTarget)) / 2.0;
        }
        if (totalSlots == 0) {
            return 0.0;
        }

        double macroDeviation = macroTerm / days.size();
        double inventoryUnused = inventory.isEmpty() ? 0.0 : 1.0 - (double) pantryUsed.size() / inventory.size();
        double repetition = totalSlots == 1 ? 0.0 : 1.0 - (double) (distinct.size() - 1) / (totalSlots - 1);
        double goalMisalignment = goalMisses / totalSlots;

        return weights.getMacroDeviation() * macroDeviation
                + weights.getInventoryUsage() * inventoryUnused
                + weights.getVariety() * repetition
                + weights.getGoalAlignment() * goalMisalignment;
    }

    private static double relativeDistance(double value, double target) {
        if (target <= 0) {
            return 0.0;
        }
        return Math.min(1.0, Math.abs(value - target) / target);
    }
}
