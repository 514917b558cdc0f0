package io.mnemo.core.evolution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class EvolutionPoliciesTest {

    @Test
    void shouldLeaveRecordsUpToOneYearUntouched() {
        assertThat(DecayPolicy.DEFAULT.applies(365)).isFalse();
        assertThat(DecayPolicy.DEFAULT.applies(366)).isTrue();
    }

    @Test
    void shouldClampFactorToFloors() {
        assertThat(DecayPolicy.DEFAULT.factor(465, 0)).isCloseTo(0.9, within(1e-9));
        assertThat(DecayPolicy.DEFAULT.factor(3000, 0)).isCloseTo(0.3, within(1e-9));
        assertThat(DecayPolicy.DEFAULT.factor(3000, 5)).isCloseTo(0.7, within(1e-9));
        assertThat(DecayPolicy.DEFAULT.factor(465, 9)).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void shouldNeverDecayBelowMinimumWeight() {
        assertThat(DecayPolicy.DEFAULT.decayedWeight(1.0, 730, 0)).isCloseTo(0.635, within(1e-9));
        assertThat(DecayPolicy.DEFAULT.decayedWeight(1.5, 730, 7)).isCloseTo(1.05, within(1e-9));
        assertThat(DecayPolicy.DEFAULT.decayedWeight(Double.MIN_VALUE, 3000, 0))
            .isEqualTo(DecayPolicy.DEFAULT_MINIMUM_WEIGHT);
    }

    @Test
    void shouldRejectNonPositiveMinimumWeight() {
        assertThatThrownBy(() -> new DecayPolicy(365, 1000.0, 0.3, 5, 0.7, Duration.ofDays(1), 0.0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldLevelUpOnPositiveMultiplesOnly() {
        assertThat(ReinforcementPolicy.DEFAULT.levelsUp(0)).isFalse();
        assertThat(ReinforcementPolicy.DEFAULT.levelsUp(3)).isTrue();
        assertThat(ReinforcementPolicy.DEFAULT.levelsUp(4)).isFalse();
        assertThat(ReinforcementPolicy.DEFAULT.levelsUp(6)).isTrue();
    }
}
