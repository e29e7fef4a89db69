package com.nutrition.mealplan.domain;

/**
 * Lifecycle of one optimization call. {@link #ASSEMBLED} and {@link #FAILED} are terminal.
 */
public enum OptimizationStage {
    INITIALIZED,
    EXACT_ATTEMPTED,
    FALLBACK_ATTEMPTED,
    ASSEMBLED,
    FAILED;

    public boolean isTerminal() {
        return this == ASSEMBLED || this == FAILED;
    }
}
