package com.nutrition.mealplan.engine.model;

import lombok.Value;

/**
 * A 0/1 variable of the meal-plan model. Identity is the (kind, key) pair.
 */
@Value
public class BinaryVariable {

    public enum Kind {
        /** Recipe fills the slot. */
        ASSIGN,
        /** Recipe fills the slot on both this day and the previous one. */
        REPEAT
    }

    Kind kind;
    AssignmentKey key;

    public static BinaryVariable assign(AssignmentKey key) {
        return new BinaryVariable(Kind.ASSIGN, key);
    }

    public static BinaryVariable repeat(AssignmentKey key) {
        return new BinaryVariable(Kind.REPEAT, key);
    }

    /** Solver-side label, for solver logs only. */
    public String label() {
        return (kind == Kind.ASSIGN ? "x[" : "rep[") + key + "]";
    }
}
