package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mnemo.core.evolution.DecayPolicy;
import io.mnemo.core.evolution.ReinforcementPolicy;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EvolutionConfig(
    @JsonAlias({"access_increment"}) double accessIncrement,
    @JsonAlias({"level_up_every"}) int levelUpEvery,
    @JsonAlias({"level_up_bonus"}) double levelUpBonus,
    @JsonAlias({"decay_threshold_days"}) int decayThresholdDays,
    @JsonAlias({"decay_scale_days"}) double decayScaleDays,
    @JsonAlias({"min_decay"}) double minimumDecay,
    @JsonAlias({"protection_access_threshold"}) int protectionAccessThreshold,
    @JsonAlias({"protected_floor"}) double protectedFloor,
    @JsonAlias({"minimum_maintenance_interval_hours"}) long minimumMaintenanceIntervalHours,
    @JsonAlias({"minimum_weight"}) double minimumWeight
) {

    public static EvolutionConfig defaults() {
        return new EvolutionConfig(0.05, 3, 0.15, 365, 1000.0, 0.3, 5, 0.7, 24, DecayPolicy.DEFAULT_MINIMUM_WEIGHT);
    }

    public ReinforcementPolicy reinforcementPolicy() {
        return new ReinforcementPolicy(accessIncrement, levelUpEvery, levelUpBonus);
    }

    public DecayPolicy decayPolicy() {
        return new DecayPolicy(
            decayThresholdDays,
            decayScaleDays,
            minimumDecay,
            protectionAccessThreshold,
            protectedFloor,
            Duration.ofHours(Math.max(0, minimumMaintenanceIntervalHours)),
            minimumWeight
        );
    }
}
