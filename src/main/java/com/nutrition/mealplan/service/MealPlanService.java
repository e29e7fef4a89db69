package com.nutrition.mealplan.service;

import com.nutrition.mealplan.domain.ConstraintSet;
import com.nutrition.mealplan.domain.FailureReason;
import com.nutrition.mealplan.domain.MealPlan;
import com.nutrition.mealplan.domain.MealPlanResult;
import com.nutrition.mealplan.domain.ObjectiveWeights;
import com.nutrition.mealplan.domain.OptimizationStage;
import com.nutrition.mealplan.domain.OptimizerParams;
import com.nutrition.mealplan.domain.PlanningRequest;
import com.nutrition.mealplan.domain.Strategy;
import com.nutrition.mealplan.domain.StructuralInfeasibilityException;
import com.nutrition.mealplan.engine.ConstraintModel;
import com.nutrition.mealplan.engine.GeneticMealPlanOptimizer;
import com.nutrition.mealplan.engine.OrToolsMealPlanOptimizer;
import com.nutrition.mealplan.engine.PlanAssembler;
import com.nutrition.mealplan.engine.SolveOutcome;
import com.nutrition.mealplan.pool.CandidatePool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one optimization call: exact solve first, genetic fallback when the exact
 * path fails for a recoverable reason, then assembly.
 * Synchronous and stateless; every call builds its own model.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MealPlanService {

    private final OrToolsMealPlanOptimizer exactOptimizer;
    private final GeneticMealPlanOptimizer geneticOptimizer;
    private final PlanAssembler assembler;
    private final OptimizerParams defaultParams;

    public MealPlanResult optimize(CandidatePool pool, int horizonDays, ConstraintSet constraints,
                                   ObjectiveWeights weights, OptimizerParams params) {
        if (pool == null) {
            throw new IllegalArgumentException("Candidate pool cannot be null");
        }
        PlanningRequest request = PlanningRequest.builder()
                .horizonDays(horizonDays)
                .recipes(pool.fetchCandidates())
                .constraints(constraints)
                .weights(weights)
                .build();
        return optimize(request, params);
    }

    public MealPlanResult optimize(PlanningRequest request) {
        return optimize(request, null);
    }

    /**
     * @throws com.nutrition.mealplan.domain.ConfigurationException for malformed input, before any solve
     */
    public MealPlanResult optimize(PlanningRequest request, OptimizerParams params) {
        long startTime = System.currentTimeMillis();

        // Fallback to defaults if params are missing
        if (params == null) {
            params = defaultParams;
        }
        params.validate();

        ConstraintModel model = ConstraintModel.of(request);
        model.validate();

        MealPlanResult.MealPlanResultBuilder result = MealPlanResult.builder()
                .traceStage(OptimizationStage.INITIALIZED);

        try {
            // 1. Exact attempt
            SolveOutcome exact = exactOptimizer.optimize(model, params);
            result.traceStage(OptimizationStage.EXACT_ATTEMPTED).exactStatus(exact.getStatus());

            if (exact.isSuccess()) {
                MealPlan plan = assembler.assemble(exact.getAssignments(), model);
                if (plan.isComplete()) {
                    plan.getViolations().forEach(v -> result.warning(v.describe()));
                    return assembled(result, Strategy.EXACT, plan, exact, startTime);
                }
                log.warn("Exact solution left slots unfilled, falling back");
                result.warning("Exact solution was incomplete; plan produced by metaheuristic search");
            } else if (!exact.getFailureReason().isRecoverableByFallback()) {
                return failed(result, exact.getFailureReason(), exact.getDetail(), startTime);
            } else {
                log.warn("Exact path failed ({}): {}. Falling back to genetic search",
                        exact.getFailureReason(), exact.getDetail());
                result.warning("Exact solver " + exact.getFailureReason() + " (" + exact.getStatus()
                        + "); plan produced by metaheuristic search");
            }

            // 2. Fallback attempt
            result.traceStage(OptimizationStage.FALLBACK_ATTEMPTED);
            SolveOutcome fallback = geneticOptimizer.optimize(model, params);
            if (!fallback.isSuccess()) {
                return failed(result, FailureReason.FALLBACK_EXHAUSTED, fallback.getDetail(), startTime);
            }

            MealPlan plan = assembler.assemble(fallback.getAssignments(), model);
            if (!plan.isComplete()) {
                return failed(result, FailureReason.FALLBACK_EXHAUSTED, "Fallback plan left slots unfilled", startTime);
            }
            if (plan.maxRelativeViolation() > params.getFallbackMaxRelativeViolation()) {
                return failed(result, FailureReason.FALLBACK_EXHAUSTED, String.format(
                        "Best fallback plan misses a bound by %.0f%% (limit %.0f%%)",
                        plan.maxRelativeViolation() * 100, params.getFallbackMaxRelativeViolation() * 100), startTime);
            }

            plan.getViolations().forEach(v -> {
                log.warn("Soft violation in fallback plan: {}", v.describe());
                result.warning(v.describe());
            });
            plan.getOverusedRecipes().forEach((id, excess) ->
                    result.warning("Recipe " + id + " exceeds the repeat cap by " + excess));
            return assembled(result, Strategy.METAHEURISTIC, plan, fallback, startTime);

        } catch (StructuralInfeasibilityException e) {
            return failed(result, FailureReason.STRUCTURAL_INFEASIBILITY, e.getMessage(), startTime);
        }
    }

    private MealPlanResult assembled(MealPlanResult.MealPlanResultBuilder result, Strategy strategy,
                                     MealPlan plan, SolveOutcome outcome, long startTime) {
        MealPlanResult done = result
                .traceStage(OptimizationStage.ASSEMBLED)
                .stage(OptimizationStage.ASSEMBLED)
                .strategy(strategy)
                .plan(plan)
                .objectiveValue(outcome.getObjectiveValue())
                .solverConsecutiveRepeats(outcome.getConsecutiveRepeats())
                .computationTimeMs(System.currentTimeMillis() - startTime)
                .build();
        log.info("Meal plan assembled by {} in {} ms, trace {}", strategy, done.getComputationTimeMs(), done.getStageTrace());
        return done;
    }

    private MealPlanResult failed(MealPlanResult.MealPlanResultBuilder result, FailureReason reason,
                                  String detail, long startTime) {
        MealPlanResult done = result
                .traceStage(OptimizationStage.FAILED)
                .stage(OptimizationStage.FAILED)
                .failureReason(reason)
                .failureDetail(detail)
                .computationTimeMs(System.currentTimeMillis() - startTime)
                .build();
        log.warn("Meal plan optimization failed: {} - {}, trace {}", reason, detail, done.getStageTrace());
        return done;
    }
}
