package com.nutrition.mealplan;

import com.nutrition.mealplan.domain.ConstraintSet;
import com.nutrition.mealplan.domain.MacroNutrients;
import com.nutrition.mealplan.domain.MealPlan;
import com.nutrition.mealplan.domain.MealPlanResult;
import com.nutrition.mealplan.domain.MealType;
import com.nutrition.mealplan.domain.NutrientBound;
import com.nutrition.mealplan.domain.ObjectiveWeights;
import com.nutrition.mealplan.domain.Recipe;
import com.nutrition.mealplan.pool.InMemoryCandidatePool;
import com.nutrition.mealplan.service.MealPlanService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConditionalOnProperty(prefix = "mealplan.demo", name = "enabled", havingValue = "true")
public class DemoRunner implements CommandLineRunner {

    private final MealPlanService service;

    public DemoRunner(MealPlanService service) {
        this.service = service;
    }

    @Override
    public void run(String... args) {
        System.out.println("=== STARTING WEEKLY MEAL PLAN DEMO ===");

        // 1. Candidate pool: four options per main meal
        List<Recipe> recipes = new ArrayList<>();
        String[] breakfasts = {"Oat Protein Bowl", "Egg White Scramble", "Greek Yogurt Parfait", "Cottage Cheese Toast"};
        String[] lunches = {"Chicken Quinoa Bowl", "Turkey Wrap", "Tuna Pasta Salad", "Lentil Chicken Soup"};
        String[] dinners = {"Salmon & Rice", "Beef Stir Fry", "Chicken Tikka", "Pork Loin & Potatoes"};
        for (int i = 0; i < 4; i++) {
            recipes.add(recipe("B0" + i, breakfasts[i], MealType.BREAKFAST, 480 + i * 12, 33 + i, 55, 15, 6));
            recipes.add(recipe("L0" + i, lunches[i], MealType.LUNCH, 690 + i * 10, 44 + i, 70, 22, 9));
            recipes.add(recipe("D0" + i, dinners[i], MealType.DINNER, 790 + i * 10, 54 + i, 75, 28, 10));
        }

        // 2. Constraints (standard weekly cut)
        ConstraintSet constraints = ConstraintSet.builder()
                .calories(NutrientBound.between(1800, 2200))
                .protein(NutrientBound.between(120, 160))
                .fiberMin(20)
                .mealsPerDay(3)
                .maxRepeatsPerHorizon(2)
                .consecutiveDayPenaltyWeight(1.0)
                .build();

        // 3. Run Optimization
        MealPlanResult result = service.optimize(
                new InMemoryCandidatePool(recipes), 7, constraints, ObjectiveWeights.defaults(), null);

        System.out.println("\nResult: " + result.getStage() + " via " + result.getStrategy());
        System.out.println("Trace: " + result.getStageTrace());
        System.out.println("Computation Time: " + result.getComputationTimeMs() + " ms");
        if (!result.isSuccess()) {
            System.out.println("Failure: " + result.getFailureReason() + " - " + result.getFailureDetail());
            return;
        }

        MealPlan plan = result.getPlan();
        System.out.println("\n--- PLAN ---");
        for (int d = 0; d < plan.getHorizonDays(); d++) {
            MacroNutrients totals = plan.getDailyTotals().get(d).roundedForDisplay();
            System.out.printf("Day %d: %s | %.0f kcal, %.1f g protein%n",
                    d, plan.getAssignments().get(d), totals.getCalories(), totals.getProteinG());
        }
        System.out.println("Consecutive repeats: " + plan.getConsecutiveRepeats());
        result.getWarnings().forEach(w -> System.out.println("WARNING: " + w));
    }

    private static Recipe recipe(String id, String title, MealType mealType,
                                 double calories, double protein, double carbs, double fat, double fiber) {
        return Recipe.builder()
                .id(id)
                .title(title)
                .eligibleMealTime(mealType)
                .macros(MacroNutrients.builder()
                        .calories(calories).proteinG(protein).carbsG(carbs).fatG(fat).fiberG(fiber).sodiumMg(600)
                        .build())
                .prepTimeMinutes(10)
                .cookTimeMinutes(20)
                .build();
    }
}
