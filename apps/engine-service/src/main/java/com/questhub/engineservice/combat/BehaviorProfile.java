package com.questhub.engineservice.combat;

/**
 * 敌人行为参数。
 *
 * @param behavior          行为倾向
 * @param lowHealthThreshold 低血量阈值（生命比例）
 * @param defendChance      满足条件时防御的概率
 * @param fleeChance        满足条件时逃跑的概率
 */
public record BehaviorProfile(Behavior behavior, double lowHealthThreshold, double defendChance, double fleeChance) {

    public static final BehaviorProfile DEFAULT = new BehaviorProfile(Behavior.AGGRESSIVE, 0.2, 0.1, 0.0);
}
