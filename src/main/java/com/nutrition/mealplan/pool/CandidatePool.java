package com.nutrition.mealplan.pool;

import com.nutrition.mealplan.domain.Recipe;

import java.util.List;

/**
 * Source of candidate recipes. Implementations return a pre-fetched list that
 * stays fixed for the whole optimization call.
 */
public interface CandidatePool {
    List<Recipe> fetchCandidates();
}
