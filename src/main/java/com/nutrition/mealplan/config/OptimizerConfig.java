package com.nutrition.mealplan.config;

import com.nutrition.mealplan.domain.OptimizerParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(MealPlanProperties.class)
public class OptimizerConfig {

    @Bean
    public OptimizerParams defaultOptimizerParams(MealPlanProperties properties) {
        MealPlanProperties.Genetic genetic = properties.getGenetic();
        OptimizerParams params = OptimizerParams.builder()
                .solverId(properties.getSolverId())
                .solverTimeoutSec(properties.getSolverTimeoutSec())
                .solverThreads(properties.getSolverThreads())
                .maxDecisionVariables(properties.getMaxDecisionVariables())
                .secondaryObjectiveScale(properties.getSecondaryObjectiveScale())
                .populationSize(genetic.getPopulationSize())
                .generations(genetic.getGenerations())
                .mutationRate(genetic.getMutationRate())
                .crossoverRate(genetic.getCrossoverRate())
                .elitismRate(genetic.getElitismRate())
                .tournamentSize(genetic.getTournamentSize())
                .plateauGenerations(genetic.getPlateauGenerations())
                .randomSeed(genetic.getRandomSeed())
                .violationPenalty(genetic.getViolationPenalty())
                .fallbackMaxRelativeViolation(properties.getFallbackMaxRelativeViolation())
                .build();
        // Fail at startup rather than on the first request
        params.validate();
        log.info("Meal plan optimizer: solver={}, time limit={}s, population={}, generations={}",
                params.getSolverId(), params.getSolverTimeoutSec(), params.getPopulationSize(), params.getGenerations());
        return params;
    }
}
