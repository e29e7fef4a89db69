package com.nutrition.mealplan.pool;

import com.nutrition.mealplan.domain.Recipe;

import java.util.List;

public class InMemoryCandidatePool implements CandidatePool {

    private final List<Recipe> recipes;

    public InMemoryCandidatePool(List<Recipe> recipes) {
        this.recipes = List.copyOf(recipes);
    }

    @Override
    public List<Recipe> fetchCandidates() {
        return recipes;
    }
}
