package com.questhub.engineservice.domain.model;

import com.questhub.engineservice.domain.enums.StatusEffectType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 持续若干回合的状态效果。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusEffect {

    public static final String STUNNED = "stunned";
    public static final String ROOTED = "rooted";

    /** 效果名（如 poison / regeneration / stunned） */
    private String name;
    private StatusEffectType type;
    /** 剩余回合数，归零后移除 */
    private int remainingRounds;
    /** 每回合的生命变化量（DOT/HOT），其他类型忽略 */
    private int magnitude;

    public StatusEffect copy() {
        return new StatusEffect(name, type, remainingRounds, magnitude);
    }
}
