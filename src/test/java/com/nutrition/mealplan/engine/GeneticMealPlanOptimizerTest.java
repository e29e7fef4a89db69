package com.nutrition.mealplan.engine;

import com.nutrition.mealplan.TestRecipes;
import com.nutrition.mealplan.domain.MealType;
import com.nutrition.mealplan.domain.NutrientBound;
import com.nutrition.mealplan.domain.OptimizerParams;
import com.nutrition.mealplan.domain.PlanningRequest;
import com.nutrition.mealplan.domain.Recipe;
import com.nutrition.mealplan.domain.Strategy;
import com.nutrition.mealplan.domain.StructuralInfeasibilityException;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class GeneticMealPlanOptimizerTest {

    private final GeneticMealPlanOptimizer optimizer = new GeneticMealPlanOptimizer();
    private final OptimizerParams params = TestRecipes.testParams();

    @Test
    void shouldProduceCompletePlanOfEligibleRecipes() {
        // Given
        ConstraintModel model = ConstraintModel.of(TestRecipes.weeklyRequest());
        Map<String, Recipe> byId = model.getCandidatePool().stream()
                .collect(Collectors.toMap(Recipe::getId, r -> r));

        // When
        SolveOutcome outcome = optimizer.optimize(model, params);

        // Then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getStrategy()).isEqualTo(Strategy.METAHEURISTIC);
        assertThat(outcome.getStatus()).isIn("CONVERGED", "GENERATION_LIMIT");
        assertThat(outcome.getGenerations()).isBetween(1, params.getGenerations());
        assertThat(outcome.getAssignments()).hasSize(7);
        outcome.getAssignments().values().forEach(day -> {
            assertThat(day).hasSize(3);
            day.forEach((slot, id) -> assertThat(byId.get(id).isEligibleFor(slot)).isTrue());
        });
        assertThat(outcome.getRecipeCounts().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(21);
    }

    @Test
    void shouldBeDeterministicForFixedSeed() {
        ConstraintModel model = ConstraintModel.of(TestRecipes.weeklyRequest());

        SolveOutcome first = optimizer.optimize(model, params);
        SolveOutcome second = optimizer.optimize(model, params);

        assertThat(second.getAssignments()).isEqualTo(first.getAssignments());
        assertThat(second.getObjectiveValue()).isEqualTo(first.getObjectiveValue());
    }

    @Test
    void shouldCountConsecutiveRepeatsLikeTheAssembler() {
        ConstraintModel model = ConstraintModel.of(TestRecipes.weeklyRequest());

        SolveOutcome outcome = optimizer.optimize(model, params);

        assertThat(outcome.getConsecutiveRepeats()).isEqualTo(
                PlanAssembler.countConsecutiveRepeats(outcome.getAssignments(), model.slotTypes(), 7));
    }

    @Test
    void shouldStillReturnCompletePlanWhenBoundsAreUnreachable() {
        PlanningRequest request = TestRecipes.weeklyRequest().toBuilder()
                .constraints(TestRecipes.weeklyConstraints().toBuilder()
                        .protein(NutrientBound.between(160, 200))
                        .build())
                .build();

        SolveOutcome outcome = optimizer.optimize(ConstraintModel.of(request), params);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getAssignments().values()).allSatisfy(day ->
                assertThat(day).containsOnlyKeys(MealType.BREAKFAST, MealType.LUNCH, MealType.DINNER));
    }

    @Test
    void shouldRejectPlanShapeWithEmptySlot() {
        PlanningRequest request = TestRecipes.weeklyRequest().toBuilder()
                .constraints(TestRecipes.weeklyConstraints().toBuilder().mealsPerDay(4).build())
                .build();

        assertThatThrownBy(() -> optimizer.optimize(ConstraintModel.of(request), params))
                .isInstanceOf(StructuralInfeasibilityException.class);
    }
}
