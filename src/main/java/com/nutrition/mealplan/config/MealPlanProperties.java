package com.nutrition.mealplan.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Optimizer defaults, bound from {@code mealplan.optimizer.*}.
 */
@Data
@ConfigurationProperties(prefix = "mealplan.optimizer")
public class MealPlanProperties {

    /** OR-Tools solver id passed to MPSolver.createSolver. */
    private String solverId = "SCIP";

    /** Wall-clock limit for the exact solve, in seconds. */
    private double solverTimeoutSec = 30.0;

    private int solverThreads = 1;

    /** Above this many assignment variables the exact path is skipped. */
    private int maxDecisionVariables = 50_000;

    private double secondaryObjectiveScale = 0.01;

    private Genetic genetic = new Genetic();

    /** Worst relative bound violation accepted in a fallback plan. */
    private double fallbackMaxRelativeViolation = 0.5;

    @Data
    public static class Genetic {
        private int populationSize = 50;
        private int generations = 100;
        private double mutationRate = 0.1;
        private double crossoverRate = 0.7;
        private double elitismRate = 0.1;
        private int tournamentSize = 3;
        private int plateauGenerations = 25;
        private long randomSeed = 42L;
        private double violationPenalty = 100.0;
    }
}
