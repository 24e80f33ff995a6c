package com.questhub.engineservice.domain.enums;

/**
 * 游戏状态的分区。撤销/重做增量只记录发生变化的分区。
 */
public enum StateSection {
    /** 游戏阶段 */
    PHASE,
    /** 角色属性、资源、背包 */
    CHARACTER,
    /** 位置与场景 */
    LOCATION,
    /** 战斗会话 */
    COMBAT,
    /** 回合计数与随机数游标 */
    PROGRESS
}
