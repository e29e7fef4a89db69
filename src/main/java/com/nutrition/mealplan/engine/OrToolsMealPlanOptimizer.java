package com.nutrition.mealplan.engine;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import com.nutrition.mealplan.domain.FailureReason;
import com.nutrition.mealplan.domain.MealType;
import com.nutrition.mealplan.domain.OptimizerParams;
import com.nutrition.mealplan.domain.Strategy;
import com.nutrition.mealplan.engine.model.AssignmentKey;
import com.nutrition.mealplan.engine.model.BinaryVariable;
import com.nutrition.mealplan.engine.model.LinearConstraint;
import com.nutrition.mealplan.engine.model.MilpModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Exact path: hands the completed {@link MilpModel} to an OR-Tools MIP solver
 * under a wall-clock limit.
 */
@Slf4j
@Component
public class OrToolsMealPlanOptimizer implements MealPlanOptimizer {

    static {
        Loader.loadNativeLibraries();
    }

    @Override
    public SolveOutcome optimize(ConstraintModel constraints, OptimizerParams params) {
        long startTime = System.currentTimeMillis();

        long estimated = MealPlanFormulation.estimateDecisionVariables(constraints);
        if (estimated > params.getMaxDecisionVariables()) {
            log.warn("Skipping exact solve: {} decision variables exceed limit {}",
                    estimated, params.getMaxDecisionVariables());
            return SolveOutcome.failure(Strategy.EXACT, FailureReason.MODEL_TOO_LARGE, "SKIPPED",
                    estimated + " decision variables exceed limit " + params.getMaxDecisionVariables(),
                    System.currentTimeMillis() - startTime);
        }

        // 1. Build the complete model before touching the solver
        MealPlanFormulation formulation = MealPlanFormulation.formulate(constraints, params);
        MilpModel model = formulation.getModel();

        // 2. Initialize Solver
        MPSolver solver = MPSolver.createSolver(params.getSolverId());
        if (solver == null) {
            log.error("Could not create solver {}", params.getSolverId());
            return SolveOutcome.failure(Strategy.EXACT, FailureReason.SOLVER_UNAVAILABLE, "SOLVER_NOT_FOUND",
                    "Solver " + params.getSolverId() + " is not available", System.currentTimeMillis() - startTime);
        }

        try {
            // Never solve without a limit
            solver.setTimeLimit(Math.max(1L, Math.round(params.getSolverTimeoutSec() * 1000)));
            if (!solver.setNumThreads(params.getSolverThreads())) {
                log.debug("Solver {} ignored thread count {}", params.getSolverId(), params.getSolverThreads());
            }

            Map<BinaryVariable, MPVariable> vars = translate(solver, model);

            // 3. Solve
            final MPSolver.ResultStatus status = solver.solve();
            long duration = System.currentTimeMillis() - startTime;
            log.info("Exact solve finished: status={}, vars={}, constraints={}, {} ms",
                    status, vars.size(), model.getConstraints().size(), duration);

            if (status == MPSolver.ResultStatus.OPTIMAL || status == MPSolver.ResultStatus.FEASIBLE) {
                return buildOutcome(status, formulation, vars, solver.objective().value(), duration);
            }
            FailureReason reason = status == MPSolver.ResultStatus.NOT_SOLVED
                    ? FailureReason.SOLVER_TIMEOUT
                    : FailureReason.SOLVER_INFEASIBLE;
            return SolveOutcome.failure(Strategy.EXACT, reason, status.name(),
                    "Solver returned " + status.name(), duration);
        } finally {
            solver.delete();
        }
    }

    private Map<BinaryVariable, MPVariable> translate(MPSolver solver, MilpModel model) {
        double infinity = MPSolver.infinity();
        Map<BinaryVariable, MPVariable> vars = new LinkedHashMap<>();
        for (BinaryVariable v : model.getVariables()) {
            vars.put(v, solver.makeBoolVar(v.label()));
        }

        for (LinearConstraint c : model.getConstraints()) {
            double lb = Double.isInfinite(c.getLowerBound()) ? -infinity : c.getLowerBound();
            double ub = Double.isInfinite(c.getUpperBound()) ? infinity : c.getUpperBound();
            MPConstraint ct = solver.makeConstraint(lb, ub, c.getName());
            c.getCoefficients().forEach((v, coeff) -> ct.setCoefficient(vars.get(v), coeff));
        }

        MPObjective objective = solver.objective();
        model.getObjective().forEach((v, coeff) -> objective.setCoefficient(vars.get(v), coeff));
        objective.setMinimization();
        return vars;
    }

    private SolveOutcome buildOutcome(MPSolver.ResultStatus status, MealPlanFormulation formulation,
                                      Map<BinaryVariable, MPVariable> vars, double objectiveValue, long duration) {
        Map<Integer, Map<MealType, String>> assignments = new TreeMap<>();
        Map<String, Integer> recipeCounts = new LinkedHashMap<>();

        for (Map.Entry<AssignmentKey, BinaryVariable> e : formulation.getAssignmentVariables().entrySet()) {
            if (vars.get(e.getValue()).solutionValue() > 0.5) {
                AssignmentKey key = e.getKey();
                assignments.computeIfAbsent(key.getDay(), d -> new EnumMap<>(MealType.class))
                        .put(key.getSlot(), key.getRecipeId());
                recipeCounts.merge(key.getRecipeId(), 1, Integer::sum);
            }
        }

        int repeats = 0;
        for (BinaryVariable rep : formulation.getRepeatVariables().values()) {
            if (vars.get(rep).solutionValue() > 0.5) {
                repeats++;
            }
        }
        log.debug("Recipe counts over horizon: {}", recipeCounts);

        return SolveOutcome.builder()
                .strategy(Strategy.EXACT)
                .success(true)
                .status(status.name())
                .assignments(assignments)
                .recipeCounts(recipeCounts)
                .objectiveValue(objectiveValue)
                .consecutiveRepeats(repeats)
                .computationTimeMs(duration)
                .build();
    }
}
