package com.nutrition.mealplan.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OptimizerParamsTest {

    @Test
    void shouldProvideValidProfiles() {
        assertThatCode(() -> OptimizerParams.defaults().validate()).doesNotThrowAnyException();
        assertThatCode(() -> OptimizerParams.forQuickPreview().validate()).doesNotThrowAnyException();
        assertThat(OptimizerParams.forQuickPreview().getSolverTimeoutSec())
                .isLessThan(OptimizerParams.defaults().getSolverTimeoutSec());
    }

    @Test
    void shouldRejectTournamentLargerThanPopulation() {
        OptimizerParams params = OptimizerParams.defaults().toBuilder().populationSize(4).tournamentSize(5).build();

        assertThatThrownBy(params::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("tournamentSize");
    }

    @Test
    void shouldRejectSolverTimeoutThatCannotBeEnforced() {
        OptimizerParams tooShort = OptimizerParams.defaults().toBuilder().solverTimeoutSec(4.0E-4).build();
        OptimizerParams infinite = OptimizerParams.defaults().toBuilder()
                .solverTimeoutSec(Double.POSITIVE_INFINITY).build();
        OptimizerParams shortest = OptimizerParams.defaults().toBuilder()
                .solverTimeoutSec(OptimizerParams.MIN_SOLVER_TIMEOUT_SEC).build();

        assertThatThrownBy(tooShort::validate).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(infinite::validate).isInstanceOf(ConfigurationException.class);
        assertThatCode(shortest::validate).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectNaNPenaltyScales() {
        OptimizerParams params = OptimizerParams.defaults().toBuilder().violationPenalty(Double.NaN).build();

        assertThatThrownBy(params::validate).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldRejectRateOutsideUnitInterval() {
        OptimizerParams params = OptimizerParams.defaults().toBuilder().mutationRate(1.5).build();

        assertThatThrownBy(params::validate).isInstanceOf(ConfigurationException.class);
    }
}
