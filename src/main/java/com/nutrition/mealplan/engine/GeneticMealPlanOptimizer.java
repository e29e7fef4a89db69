package com.nutrition.mealplan.engine;

import com.nutrition.mealplan.domain.MacroNutrients;
import com.nutrition.mealplan.domain.MealType;
import com.nutrition.mealplan.domain.Nutrient;
import com.nutrition.mealplan.domain.OptimizerParams;
import com.nutrition.mealplan.domain.Recipe;
import com.nutrition.mealplan.domain.Strategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Fallback path: population-based search over full-horizon plans.
 *
 * Nutrient bounds and the repeat cap are soft here. Their violations are
 * penalized in the cost, and whatever survives is reported by the assembler.
 * Every gene is drawn from its slot's eligible list, so plans are always complete.
 */
@Slf4j
@Component
public class GeneticMealPlanOptimizer implements MealPlanOptimizer {

    @Override
    public SolveOutcome optimize(ConstraintModel constraints, OptimizerParams params) {
        long startTime = System.currentTimeMillis();

        Search search = new Search(constraints, params);
        Individual best = search.run();

        long duration = System.currentTimeMillis() - startTime;
        String status = search.converged ? "CONVERGED" : "GENERATION_LIMIT";
        log.info("Genetic search finished: status={}, generations={}, cost={}, {} ms",
                status, search.generationsRun, String.format("%.4f", best.cost), duration);

        Map<Integer, Map<MealType, String>> assignments = new TreeMap<>();
        Map<String, Integer> recipeCounts = new LinkedHashMap<>();
        for (int d = 0; d < constraints.getHorizonDays(); d++) {
            Map<MealType, String> dayPlan = new EnumMap<>(MealType.class);
            for (int s = 0; s < search.slots.size(); s++) {
                Recipe recipe = search.recipeAt(best, d, s);
                dayPlan.put(search.slots.get(s), recipe.getId());
                recipeCounts.merge(recipe.getId(), 1, Integer::sum);
            }
            assignments.put(d, dayPlan);
        }

        return SolveOutcome.builder()
                .strategy(Strategy.METAHEURISTIC)
                .success(true)
                .status(status)
                .assignments(assignments)
                .recipeCounts(recipeCounts)
                .objectiveValue(best.cost)
                .consecutiveRepeats(search.consecutiveRepeats(best))
                .generations(search.generationsRun)
                .computationTimeMs(duration)
                .build();
    }

    private static final class Individual {
        final int[] genes; // index into the slot's eligible list, gene = day * slots + slot
        double cost = Double.NaN;

        Individual(int[] genes) {
            this.genes = genes;
        }

        Individual copy() {
            Individual c = new Individual(genes.clone());
            c.cost = cost;
            return c;
        }
    }

    /**
     * State of one run. Created per call, so concurrent calls share nothing.
     */
    private static final class Search {
        private static final double IMPROVEMENT_EPS = 1e-9;

        final ConstraintModel constraints;
        final OptimizerParams params;
        final List<MealType> slots;
        final List<List<Recipe>> eligible;
        final List<Nutrient> bounded;
        final ObjectiveModel objective;
        final Random rng;
        final int days;

        List<Individual> population = new ArrayList<>();
        int generationsRun;
        boolean converged;

        Search(ConstraintModel constraints, OptimizerParams params) {
            Map<MealType, List<Recipe>> bySlot = constraints.eligibleBySlot();
            this.constraints = constraints;
            this.params = params;
            this.slots = new ArrayList<>(bySlot.keySet());
            this.eligible = new ArrayList<>(bySlot.values());
            this.bounded = constraints.boundedNutrients();
            this.objective = new ObjectiveModel(constraints);
            this.rng = new Random(params.getRandomSeed());
            this.days = constraints.getHorizonDays();
        }

        Individual run() {
            for (int i = 0; i < params.getPopulationSize(); i++) {
                population.add(evaluate(randomIndividual()));
            }
            population.sort(Comparator.comparingDouble(ind -> ind.cost));
            Individual best = population.get(0).copy();
            int stale = 0;

            for (int gen = 0; gen < params.getGenerations(); gen++) {
                population = nextGeneration();
                population.sort(Comparator.comparingDouble(ind -> ind.cost));
                generationsRun = gen + 1;

                Individual leader = population.get(0);
                if (leader.cost < best.cost - IMPROVEMENT_EPS) {
                    best = leader.copy();
                    stale = 0;
                } else if (++stale >= params.getPlateauGenerations()) {
                    converged = true;
                    log.debug("Fitness plateau after {} generations (best cost {})", generationsRun, best.cost);
                    break;
                }
            }
            return best;
        }

        private List<Individual> nextGeneration() {
            List<Individual> next = new ArrayList<>(params.getPopulationSize());

            // Elitism - keep best individuals
            int eliteCount = (int) (params.getPopulationSize() * params.getElitismRate());
            for (int i = 0; i < eliteCount && i < population.size(); i++) {
                next.add(population.get(i).copy());
            }

            while (next.size() < params.getPopulationSize()) {
                Individual parent1 = tournament();
                Individual parent2 = tournament();

                Individual[] children;
                if (rng.nextDouble() < params.getCrossoverRate()) {
                    children = crossover(parent1, parent2);
                } else {
                    children = new Individual[]{parent1.copy(), parent2.copy()};
                }

                for (Individual child : children) {
                    if (next.size() >= params.getPopulationSize()) {
                        break;
                    }
                    if (rng.nextDouble() < params.getMutationRate()) {
                        mutate(child);
                    }
                    next.add(Double.isNaN(child.cost) ? evaluate(child) : child);
                }
            }
            return next;
        }

        private Individual randomIndividual() {
            int[] genes = new int[days * slots.size()];
            for (int g = 0; g < genes.length; g++) {
                genes[g] = rng.nextInt(eligible.get(g % slots.size()).size());
            }
            return new Individual(genes);
        }

        private Individual tournament() {
            Individual winner = null;
            for (int i = 0; i < params.getTournamentSize(); i++) {
                Individual candidate = population.get(rng.nextInt(population.size()));
                if (winner == null || candidate.cost < winner.cost) {
                    winner = candidate;
                }
            }
            return winner;
        }

        /**
         * Each day of a child comes whole from one parent; the sibling takes the other.
         */
        private Individual[] crossover(Individual p1, Individual p2) {
            int width = slots.size();
            int[] a = new int[p1.genes.length];
            int[] b = new int[p1.genes.length];
            for (int d = 0; d < days; d++) {
                boolean swap = rng.nextBoolean();
                System.arraycopy(swap ? p2.genes : p1.genes, d * width, a, d * width, width);
                System.arraycopy(swap ? p1.genes : p2.genes, d * width, b, d * width, width);
            }
            return new Individual[]{new Individual(a), new Individual(b)};
        }

        /** Resamples one random day/slot from its eligible list. */
        private void mutate(Individual individual) {
            int gene = rng.nextInt(individual.genes.length);
            individual.genes[gene] = rng.nextInt(eligible.get(gene % slots.size()).size());
            individual.cost = Double.NaN;
        }

        Recipe recipeAt(Individual individual, int day, int slot) {
            return eligible.get(slot).get(individual.genes[day * slots.size() + slot]);
        }

        private Individual evaluate(Individual individual) {
            int width = slots.size();
            double violation = 0.0;
            List<List<Recipe>> plan = new ArrayList<>(days);
            Map<String, Integer> counts = new HashMap<>();

            for (int d = 0; d < days; d++) {
                List<Recipe> day = new ArrayList<>(width);
                MacroNutrients totals = MacroNutrients.ZERO;
                for (int s = 0; s < width; s++) {
                    Recipe recipe = recipeAt(individual, d, s);
                    day.add(recipe);
                    totals = totals.plus(recipe.getMacros());
                    counts.merge(recipe.getId(), 1, Integer::sum);
                }
                for (Nutrient nutrient : bounded) {
                    violation += constraints.getConstraints().boundFor(nutrient).relativeViolation(nutrient.of(totals));
                }
                plan.add(day);
            }

            int maxRepeats = constraints.getConstraints().getMaxRepeatsPerHorizon();
            int capExcess = counts.values().stream().mapToInt(c -> Math.max(0, c - maxRepeats)).sum();

            individual.cost = params.getViolationPenalty() * (violation + capExcess)
                    + constraints.getConstraints().getConsecutiveDayPenaltyWeight() * consecutiveRepeats(individual)
                    + objective.planScore(plan);
            return individual;
        }

        int consecutiveRepeats(Individual individual) {
            int width = slots.size();
            int repeats = 0;
            for (int d = 1; d < days; d++) {
                for (int s = 0; s < width; s++) {
                    if (recipeAt(individual, d, s).getId().equals(recipeAt(individual, d - 1, s).getId())) {
                        repeats++;
                    }
                }
            }
            return repeats;
        }
    }
}
