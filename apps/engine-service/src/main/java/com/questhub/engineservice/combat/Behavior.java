package com.questhub.engineservice.combat;

/**
 * 敌人行为倾向。
 */
public enum Behavior {
    /** 一直进攻 */
    AGGRESSIVE,
    /** 血量偏低或按概率防御 */
    DEFENSIVE,
    /** 血量偏低时按概率防御，否则进攻 */
    TACTICAL,
    /** 血量偏低时按概率逃跑 */
    COWARD,
    /** 无视血量，一直进攻 */
    BERSERKER
}
