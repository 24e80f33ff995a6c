package com.questhub.engineservice.combat.targeting;

/**
 * 可配置的目标选择方式（questhub.engine.ai-targeting）。
 */
public enum TargetingMode {
    LOWEST_HEALTH {
        @Override
        public TargetingStrategy strategy() {
            return new LowestHealthTargeting();
        }
    },
    HIGHEST_THREAT {
        @Override
        public TargetingStrategy strategy() {
            return new HighestThreatTargeting();
        }
    };

    public abstract TargetingStrategy strategy();
}
