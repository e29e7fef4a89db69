package com.nutrition.mealplan.service;

import com.nutrition.mealplan.TestRecipes;
import com.nutrition.mealplan.domain.ConfigurationException;
import com.nutrition.mealplan.domain.FailureReason;
import com.nutrition.mealplan.domain.MealPlan;
import com.nutrition.mealplan.domain.MealPlanResult;
import com.nutrition.mealplan.domain.MealType;
import com.nutrition.mealplan.domain.NutrientBound;
import com.nutrition.mealplan.domain.ObjectiveWeights;
import com.nutrition.mealplan.domain.OptimizationStage;
import com.nutrition.mealplan.domain.OptimizerParams;
import com.nutrition.mealplan.domain.PlanningRequest;
import com.nutrition.mealplan.domain.Strategy;
import com.nutrition.mealplan.engine.ConstraintModel;
import com.nutrition.mealplan.engine.GeneticMealPlanOptimizer;
import com.nutrition.mealplan.engine.OrToolsMealPlanOptimizer;
import com.nutrition.mealplan.engine.PlanAssembler;
import com.nutrition.mealplan.engine.SolveOutcome;
import com.nutrition.mealplan.pool.InMemoryCandidatePool;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class MealPlanServiceTest {

    private final OptimizerParams params = TestRecipes.testParams();
    private final MealPlanService service = new MealPlanService(
            new OrToolsMealPlanOptimizer(), new GeneticMealPlanOptimizer(), new PlanAssembler(), params);

    @Test
    void shouldAssembleExactWeeklyPlan() {
        // When
        MealPlanResult result = service.optimize(TestRecipes.weeklyRequest());

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStage().isTerminal()).isTrue();
        assertThat(result.getStrategy()).isEqualTo(Strategy.EXACT);
        assertThat(result.getStageTrace()).containsExactly(
                OptimizationStage.INITIALIZED, OptimizationStage.EXACT_ATTEMPTED, OptimizationStage.ASSEMBLED);
        assertThat(result.getWarnings()).isEmpty();
        assertThat(result.getFailureReason()).isNull();

        MealPlan plan = result.getPlan();
        assertThat(plan.isConstraintsSatisfied()).isTrue();
        assertThat(plan.getConsecutiveRepeats()).isZero();
        assertThat(result.getSolverConsecutiveRepeats()).isEqualTo(plan.getConsecutiveRepeats());
        assertThat(plan.getRecipeCounts().values()).allMatch(count -> count <= 2);
        plan.getDailyTotals().values().forEach(totals -> {
            assertThat(totals.getCalories()).isBetween(1800.0, 2200.0);
            assertThat(totals.getProteinG()).isBetween(120.0, 160.0);
        });
    }

    @Test
    void shouldAcceptCandidatePoolAndUseDefaultParams() {
        MealPlanResult result = service.optimize(new InMemoryCandidatePool(TestRecipes.weeklyPool()), 5,
                TestRecipes.weeklyConstraints(), ObjectiveWeights.defaults(), null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPlan().getHorizonDays()).isEqualTo(5);
        assertThat(result.getPlan().getAssignments()).hasSize(5);
    }

    @Test
    void shouldFailStructurallyWithoutFallback() {
        // Given: four meals a day, but nothing is tagged as a snack
        PlanningRequest request = TestRecipes.weeklyRequest().toBuilder()
                .constraints(TestRecipes.weeklyConstraints().toBuilder().mealsPerDay(4).build())
                .build();

        // When
        MealPlanResult result = service.optimize(request);

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureReason()).isEqualTo(FailureReason.STRUCTURAL_INFEASIBILITY);
        assertThat(result.getFailureDetail()).contains("day 0", MealType.SNACK.getTag());
        assertThat(result.getStageTrace()).doesNotContain(OptimizationStage.FALLBACK_ATTEMPTED);
        assertThat(result.getPlan()).isNull();
    }

    @Test
    void shouldFallBackWithWarningsWhenBoundsAreInfeasible() {
        // Given: best achievable protein is 140 g, about 12% below the minimum
        PlanningRequest request = TestRecipes.weeklyRequest().toBuilder()
                .constraints(TestRecipes.weeklyConstraints().toBuilder()
                        .protein(NutrientBound.between(160, 200))
                        .build())
                .build();

        // When
        MealPlanResult result = service.optimize(request);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStrategy()).isEqualTo(Strategy.METAHEURISTIC);
        assertThat(result.getExactStatus()).isEqualTo("INFEASIBLE");
        assertThat(result.getStageTrace()).containsExactly(
                OptimizationStage.INITIALIZED, OptimizationStage.EXACT_ATTEMPTED,
                OptimizationStage.FALLBACK_ATTEMPTED, OptimizationStage.ASSEMBLED);
        assertThat(result.getPlan().isComplete()).isTrue();
        assertThat(result.getPlan().getViolations()).isNotEmpty();
        assertThat(result.getWarnings())
                .anyMatch(w -> w.contains("SOLVER_INFEASIBLE"))
                .anyMatch(w -> w.contains("protein_g"));
    }

    @Test
    void shouldReportFallbackExhaustedWhenViolationIsTooLarge() {
        PlanningRequest request = TestRecipes.weeklyRequest().toBuilder()
                .constraints(TestRecipes.weeklyConstraints().toBuilder()
                        .protein(NutrientBound.between(400, 500))
                        .build())
                .build();

        MealPlanResult result = service.optimize(request);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureReason()).isEqualTo(FailureReason.FALLBACK_EXHAUSTED);
        assertThat(result.getStageTrace()).endsWith(OptimizationStage.FALLBACK_ATTEMPTED, OptimizationStage.FAILED);
        assertThat(result.getStage()).isEqualTo(OptimizationStage.FAILED);
    }

    @Test
    void shouldFallBackWhenModelIsTooLarge() {
        OptimizerParams tiny = params.toBuilder().maxDecisionVariables(10).build();

        MealPlanResult result = service.optimize(TestRecipes.weeklyRequest(), tiny);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStrategy()).isEqualTo(Strategy.METAHEURISTIC);
        assertThat(result.getExactStatus()).isEqualTo("SKIPPED");
        assertThat(result.getWarnings()).anyMatch(w -> w.contains("MODEL_TOO_LARGE"));
        assertThat(result.getPlan().isComplete()).isTrue();
    }

    @Test
    void shouldFallBackOnSolverTimeout() {
        // Given
        OrToolsMealPlanOptimizer exact = mock(OrToolsMealPlanOptimizer.class);
        when(exact.optimize(any(), any())).thenReturn(SolveOutcome.failure(
                Strategy.EXACT, FailureReason.SOLVER_TIMEOUT, "NOT_SOLVED", "Solver returned NOT_SOLVED", 1000));
        GeneticMealPlanOptimizer genetic = spy(new GeneticMealPlanOptimizer());
        MealPlanService timedOut = new MealPlanService(exact, genetic, new PlanAssembler(), params);

        // When
        MealPlanResult result = timedOut.optimize(TestRecipes.weeklyRequest());

        // Then
        verify(genetic).optimize(any(ConstraintModel.class), any(OptimizerParams.class));
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStrategy()).isEqualTo(Strategy.METAHEURISTIC);
        assertThat(result.getWarnings()).anyMatch(w -> w.contains("SOLVER_TIMEOUT"));
    }

    @Test
    void shouldNotFallBackForNonRecoverableFailure() {
        OrToolsMealPlanOptimizer exact = mock(OrToolsMealPlanOptimizer.class);
        when(exact.optimize(any(), any())).thenReturn(SolveOutcome.failure(
                Strategy.EXACT, FailureReason.STRUCTURAL_INFEASIBILITY, "SKIPPED", "No eligible recipe", 0));
        GeneticMealPlanOptimizer genetic = mock(GeneticMealPlanOptimizer.class);
        MealPlanService failing = new MealPlanService(exact, genetic, new PlanAssembler(), params);

        MealPlanResult result = failing.optimize(TestRecipes.weeklyRequest());

        verify(genetic, never()).optimize(any(), any());
        assertThat(result.getFailureReason()).isEqualTo(FailureReason.STRUCTURAL_INFEASIBILITY);
    }

    @Test
    void shouldRejectMalformedInputBeforeSolving() {
        OrToolsMealPlanOptimizer exact = mock(OrToolsMealPlanOptimizer.class);
        MealPlanService guarded = new MealPlanService(exact, new GeneticMealPlanOptimizer(), new PlanAssembler(), params);
        PlanningRequest request = TestRecipes.weeklyRequest().toBuilder().recipes(List.of()).build();

        assertThatThrownBy(() -> guarded.optimize(request))
                .isInstanceOf(ConfigurationException.class);
        verify(exact, never()).optimize(any(), any());
    }

    @Test
    void shouldRejectNaNWeightsBeforeSolving() {
        OrToolsMealPlanOptimizer exact = mock(OrToolsMealPlanOptimizer.class);
        MealPlanService guarded = new MealPlanService(exact, new GeneticMealPlanOptimizer(), new PlanAssembler(), params);
        PlanningRequest request = TestRecipes.weeklyRequest().toBuilder()
                .weights(ObjectiveWeights.defaults().toBuilder().variety(Double.NaN).build())
                .build();

        assertThatThrownBy(() -> guarded.optimize(request))
                .isInstanceOf(ConfigurationException.class);
        verify(exact, never()).optimize(any(), any());
    }

    @Test
    void shouldRejectInvalidParams() {
        for (double timeout : new double[]{0, 0.0004, Double.POSITIVE_INFINITY, Double.NaN, 1e9}) {
            OptimizerParams broken = params.toBuilder().solverTimeoutSec(timeout).build();

            assertThatThrownBy(() -> service.optimize(TestRecipes.weeklyRequest(), broken))
                    .as("solverTimeoutSec=%s", timeout)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("solverTimeoutSec");
        }
    }
}
