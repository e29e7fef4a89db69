package com.nutrition.mealplan.engine;

import com.nutrition.mealplan.domain.BoundViolation;
import com.nutrition.mealplan.domain.MacroNutrients;
import com.nutrition.mealplan.domain.MealPlan;
import com.nutrition.mealplan.domain.MealType;
import com.nutrition.mealplan.domain.Nutrient;
import com.nutrition.mealplan.domain.NutrientBound;
import com.nutrition.mealplan.domain.Recipe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Normalizes an optimizer's raw assignment into a {@link MealPlan}. Totals and
 * violations are recomputed from the chosen recipes; optimizer bookkeeping is
 * not trusted.
 */
@Slf4j
@Component
public class PlanAssembler {

    private static final double VIOLATION_EPS = 1e-9;

    public MealPlan assemble(Map<Integer, Map<MealType, String>> raw, ConstraintModel constraints) {
        Map<String, Recipe> recipesById = constraints.getCandidatePool().stream()
                .collect(Collectors.toMap(Recipe::getId, Function.identity()));
        List<MealType> slots = constraints.slotTypes();
        int days = constraints.getHorizonDays();
        Map<MealType, Set<String>> eligibleIds = new EnumMap<>(MealType.class);
        for (MealType slot : slots) {
            eligibleIds.put(slot, constraints.eligibleRecipes(slot).stream()
                    .map(Recipe::getId)
                    .collect(Collectors.toSet()));
        }

        Map<Integer, Map<MealType, String>> assignments = new TreeMap<>();
        Map<Integer, MacroNutrients> dailyTotals = new TreeMap<>();
        Map<String, Integer> recipeCounts = new LinkedHashMap<>();
        List<BoundViolation> violations = new ArrayList<>();
        boolean complete = true;

        for (int d = 0; d < days; d++) {
            Map<MealType, String> source = raw.getOrDefault(d, Map.of());
            Map<MealType, String> dayPlan = new EnumMap<>(MealType.class);
            MacroNutrients totals = MacroNutrients.ZERO;

            for (MealType slot : slots) {
                String recipeId = source.get(slot);
                Recipe recipe = recipeId == null ? null : recipesById.get(recipeId);
                if (recipe == null) {
                    if (recipeId != null) {
                        log.warn("Day {} slot {} refers to unknown recipe {}", d, slot, recipeId);
                    }
                    complete = false;
                    continue;
                }
                if (!eligibleIds.get(slot).contains(recipeId)) {
                    log.warn("Day {} slot {} holds recipe {} that is not eligible there", d, slot, recipeId);
                    complete = false;
                    continue;
                }
                dayPlan.put(slot, recipeId);
                totals = totals.plus(recipe.getMacros());
                recipeCounts.merge(recipeId, 1, Integer::sum);
            }

            for (Nutrient nutrient : constraints.boundedNutrients()) {
                NutrientBound bound = constraints.getConstraints().boundFor(nutrient);
                double actual = nutrient.of(totals);
                if (bound.relativeViolation(actual) > VIOLATION_EPS) {
                    violations.add(new BoundViolation(d, nutrient, actual, bound));
                }
            }
            assignments.put(d, Collections.unmodifiableMap(dayPlan));
            dailyTotals.put(d, totals);
        }

        int maxRepeats = constraints.getConstraints().getMaxRepeatsPerHorizon();
        Map<String, Integer> overused = new LinkedHashMap<>();
        recipeCounts.forEach((id, count) -> {
            if (count > maxRepeats) {
                overused.put(id, count - maxRepeats);
            }
        });

        return MealPlan.builder()
                .horizonDays(days)
                .slots(slots)
                .assignments(Collections.unmodifiableMap(assignments))
                .dailyTotals(Collections.unmodifiableMap(dailyTotals))
                .recipeCounts(Collections.unmodifiableMap(recipeCounts))
                .violations(List.copyOf(violations))
                .overusedRecipes(Collections.unmodifiableMap(overused))
                .consecutiveRepeats(countConsecutiveRepeats(assignments, slots, days))
                .complete(complete)
                .build();
    }

    /**
     * Number of (day, slot) pairs with day > 0 holding the same recipe as the previous day.
     */
    public static int countConsecutiveRepeats(Map<Integer, Map<MealType, String>> assignments,
                                              List<MealType> slots, int days) {
        int repeats = 0;
        for (int d = 1; d < days; d++) {
            Map<MealType, String> prev = assignments.getOrDefault(d - 1, Map.of());
            Map<MealType, String> curr = assignments.getOrDefault(d, Map.of());
            for (MealType slot : slots) {
                String id = curr.get(slot);
                if (id != null && id.equals(prev.get(slot))) {
                    repeats++;
                }
            }
        }
        return repeats;
    }
}
