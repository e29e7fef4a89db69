package com.nutrition.mealplan.engine.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Completed minimization model over binary variables. Produced only by
 * {@link Builder#build()}, so a solver never sees a half-built model.
 */
public final class MilpModel {

    private final Set<BinaryVariable> variables;
    private final List<LinearConstraint> constraints;
    private final Map<BinaryVariable, Double> objective;

    private MilpModel(Builder builder) {
        this.variables = Collections.unmodifiableSet(new LinkedHashSet<>(builder.variables));
        this.constraints = List.copyOf(builder.constraints);
        this.objective = Collections.unmodifiableMap(new LinkedHashMap<>(builder.objective));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<BinaryVariable> getVariables() {
        return variables;
    }

    public List<LinearConstraint> getConstraints() {
        return constraints;
    }

    public Map<BinaryVariable, Double> getObjective() {
        return objective;
    }

    public long countVariables(BinaryVariable.Kind kind) {
        return variables.stream().filter(v -> v.getKind() == kind).count();
    }

    public double objectiveValue(Map<BinaryVariable, Double> values) {
        double total = 0.0;
        for (Map.Entry<BinaryVariable, Double> term : objective.entrySet()) {
            total += term.getValue() * values.getOrDefault(term.getKey(), 0.0);
        }
        return total;
    }

    public static final class Builder {
        private final Set<BinaryVariable> variables = new LinkedHashSet<>();
        private final List<LinearConstraint> constraints = new ArrayList<>();
        private final Map<BinaryVariable, Double> objective = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder addVariable(BinaryVariable variable) {
            if (!variables.add(variable)) {
                throw new IllegalStateException("Variable declared twice: " + variable.label());
            }
            return this;
        }

        public Builder addConstraint(LinearConstraint constraint) {
            for (BinaryVariable v : constraint.getCoefficients().keySet()) {
                if (!variables.contains(v)) {
                    throw new IllegalStateException("Constraint " + constraint.getName() + " uses undeclared " + v.label());
                }
            }
            constraints.add(constraint);
            return this;
        }

        public Builder addConstraints(Collection<LinearConstraint> toAdd) {
            toAdd.forEach(this::addConstraint);
            return this;
        }

        /** Adds to the variable's objective coefficient. */
        public Builder addObjectiveTerm(BinaryVariable variable, double coefficient) {
            if (!variables.contains(variable)) {
                throw new IllegalStateException("Objective uses undeclared " + variable.label());
            }
            if (coefficient != 0.0) {
                objective.merge(variable, coefficient, Double::sum);
            }
            return this;
        }

        public MilpModel build() {
            return new MilpModel(this);
        }
    }
}
