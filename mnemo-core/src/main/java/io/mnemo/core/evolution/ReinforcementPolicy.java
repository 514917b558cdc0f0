package io.mnemo.core.evolution;

public record ReinforcementPolicy(double accessIncrement, int levelUpEvery, double levelUpBonus) {
    public static final ReinforcementPolicy DEFAULT = new ReinforcementPolicy(0.05, 3, 0.15);

    public ReinforcementPolicy {
        if (accessIncrement < 0.0 || levelUpBonus < 0.0) {
            throw new IllegalArgumentException("reinforcement increments must be >= 0");
        }
        if (levelUpEvery <= 0) {
            throw new IllegalArgumentException("levelUpEvery must be > 0");
        }
    }

    public boolean levelsUp(int newAccessCount) {
        return newAccessCount > 0 && newAccessCount % levelUpEvery == 0;
    }
}
