package com.nutrition.mealplan.domain;

public enum FailureReason {
    STRUCTURAL_INFEASIBILITY(false),
    SOLVER_INFEASIBLE(true),
    SOLVER_TIMEOUT(true),
    SOLVER_UNAVAILABLE(true),
    MODEL_TOO_LARGE(true),
    FALLBACK_EXHAUSTED(false);

    private final boolean recoverableByFallback;

    FailureReason(boolean recoverableByFallback) {
        this.recoverableByFallback = recoverableByFallback;
    }

    public boolean isRecoverableByFallback() {
        return recoverableByFallback;
    }
}
