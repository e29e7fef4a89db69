package com.nutrition.mealplan.domain;

public enum Strategy {
    EXACT,
    METAHEURISTIC
}
