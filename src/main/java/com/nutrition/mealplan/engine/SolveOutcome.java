package com.nutrition.mealplan.engine;

import com.nutrition.mealplan.domain.FailureReason;
import com.nutrition.mealplan.domain.MealType;
import com.nutrition.mealplan.domain.Strategy;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Raw result of one optimizer: a day -> slot -> recipe id assignment, or a failure reason.
 */
@Value
@Builder
public class SolveOutcome {
    Strategy strategy;
    boolean success;
    FailureReason failureReason;
    String status;  // solver status name, or "CONVERGED"/"GENERATION_LIMIT" for the genetic search
    String detail;

    Map<Integer, Map<MealType, String>> assignments;
    Map<String, Integer> recipeCounts;

    double objectiveValue;
    int consecutiveRepeats; // as counted by the optimizer's own bookkeeping
    int generations;
    long computationTimeMs;

    public static SolveOutcome failure(Strategy strategy, FailureReason reason, String status,
                                       String detail, long computationTimeMs) {
        return SolveOutcome.builder()
                .strategy(strategy)
                .success(false)
                .failureReason(reason)
                .status(status)
                .detail(detail)
                .assignments(Map.of())
                .recipeCounts(Map.of())
                .computationTimeMs(computationTimeMs)
                .build();
    }
}
