package com.questhub.engineservice.domain.enums;

/**
 * 状态效果类型：DOT 每回合扣血，HOT 每回合回血，CONTROL 限制行动。
 */
public enum StatusEffectType {
    BUFF,
    DEBUFF,
    DOT,
    HOT,
    CONTROL
}
