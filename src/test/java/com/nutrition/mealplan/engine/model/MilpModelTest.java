package com.nutrition.mealplan.engine.model;

import com.nutrition.mealplan.domain.MealType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MilpModelTest {

    private final BinaryVariable x = BinaryVariable.assign(new AssignmentKey("a", 0, MealType.BREAKFAST));
    private final BinaryVariable y = BinaryVariable.assign(new AssignmentKey("b", 0, MealType.BREAKFAST));

    @Test
    void shouldRejectConstraintOnUndeclaredVariable() {
        MilpModel.Builder builder = MilpModel.builder().addVariable(x);

        assertThatThrownBy(() -> builder.addConstraint(LinearConstraint.atMost("c", 1.0, Map.of(x, 1.0, y, 1.0))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("undeclared");
    }

    @Test
    void shouldRejectDuplicateVariable() {
        MilpModel.Builder builder = MilpModel.builder().addVariable(x);

        assertThatThrownBy(() -> builder.addVariable(BinaryVariable.assign(new AssignmentKey("a", 0, MealType.BREAKFAST))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldMergeObjectiveTermsAndFreezeOnBuild() {
        MilpModel.Builder builder = MilpModel.builder()
                .addVariable(x)
                .addVariable(y)
                .addObjectiveTerm(x, 1.0)
                .addObjectiveTerm(x, 0.5)
                .addObjectiveTerm(y, 0.0);

        MilpModel model = builder.build();
        builder.addObjectiveTerm(y, 3.0);

        assertThat(model.getObjective()).containsOnly(Map.entry(x, 1.5));
        assertThat(model.objectiveValue(Map.of(x, 1.0, y, 1.0))).isEqualTo(1.5);
        assertThat(model.countVariables(BinaryVariable.Kind.ASSIGN)).isEqualTo(2);
    }
}
