package com.nutrition.mealplan.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OptimizerParams {
    public static final double MIN_SOLVER_TIMEOUT_SEC = 0.001;
    public static final double MAX_SOLVER_TIMEOUT_SEC = 3600.0;

    // Exact solver
    private String solverId;
    private double solverTimeoutSec;
    private int solverThreads;
    private int maxDecisionVariables;   // above this the exact path is skipped
    private double secondaryObjectiveScale; // keeps per-slot costs below one consecutive repeat

    // Genetic fallback
    private int populationSize;
    private int generations;
    private double mutationRate;
    private double crossoverRate;
    private double elitismRate;
    private int tournamentSize;
    private int plateauGenerations;
    private long randomSeed;
    private double violationPenalty;

    // Fallback acceptance: worst relative bound violation tolerated in a fallback plan
    private double fallbackMaxRelativeViolation;

    /**
     * STANDARD PROFILE
     * - Generous solver budget for weekly planning.
     * - Single solver thread so identical inputs give identical plans.
     */
    public static OptimizerParams defaults() {
        return OptimizerParams.builder()
                .solverId("SCIP")
                .solverTimeoutSec(30.0)
                .solverThreads(1)
                .maxDecisionVariables(50_000)
                .secondaryObjectiveScale(0.01)
                .populationSize(50)
                .generations(100)
                .mutationRate(0.1)
                .crossoverRate(0.7)
                .elitismRate(0.1)
                .tournamentSize(3)
                .plateauGenerations(25)
                .randomSeed(42L)
                .violationPenalty(100.0)
                .fallbackMaxRelativeViolation(0.5)
                .build();
    }

    /**
     * QUICK PREVIEW PROFILE
     * - Short solver budget and a smaller population for interactive previews.
     */
    public static OptimizerParams forQuickPreview() {
        return defaults().toBuilder()
                .solverTimeoutSec(5.0)
                .populationSize(30)
                .generations(60)
                .plateauGenerations(15)
                .build();
    }

    public void validate() {
        if (solverId == null || solverId.isBlank()) {
            throw new ConfigurationException("solverId must be set");
        }
        // OR-Tools reads a zero millisecond limit as "no limit"
        if (!(solverTimeoutSec >= MIN_SOLVER_TIMEOUT_SEC && solverTimeoutSec <= MAX_SOLVER_TIMEOUT_SEC)) {
            throw new ConfigurationException("solverTimeoutSec must be in [" + MIN_SOLVER_TIMEOUT_SEC + ", "
                    + MAX_SOLVER_TIMEOUT_SEC + "], got " + solverTimeoutSec);
        }
        if (solverThreads < 1) {
            throw new ConfigurationException("solverThreads must be >= 1");
        }
        if (maxDecisionVariables < 1) {
            throw new ConfigurationException("maxDecisionVariables must be >= 1");
        }
        if (populationSize < 2 || generations < 1) {
            throw new ConfigurationException("populationSize must be >= 2 and generations >= 1");
        }
        if (tournamentSize < 1 || tournamentSize > populationSize) {
            throw new ConfigurationException("tournamentSize must be in [1, populationSize]");
        }
        if (!isRate(mutationRate) || !isRate(crossoverRate) || !isRate(elitismRate)) {
            throw new ConfigurationException("mutationRate, crossoverRate and elitismRate must be in [0, 1]");
        }
        if (plateauGenerations < 1) {
            throw new ConfigurationException("plateauGenerations must be >= 1");
        }
        if (!isNonNegative(secondaryObjectiveScale) || !isNonNegative(violationPenalty)
                || !isNonNegative(fallbackMaxRelativeViolation)) {
            throw new ConfigurationException("penalty scales and fallback threshold must be non-negative");
        }
    }

    private static boolean isNonNegative(double value) {
        return Double.isFinite(value) && value >= 0;
    }

    private static boolean isRate(double rate) {
        return rate >= 0.0 && rate <= 1.0;
    }
}
