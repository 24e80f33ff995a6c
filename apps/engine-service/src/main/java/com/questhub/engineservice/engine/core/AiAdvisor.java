package com.questhub.engineservice.engine.core;

/**
 * AI 建议器抽象：给定状态与行动者，返回一条建议的行动。
 * - 只读：不修改传入的状态，返回的行动由调用方走统一的结算路径执行；
 * - 泛型 S、A 保持与具体玩法解耦（战斗中的敌人决策即其一）。
 */
public interface AiAdvisor<S extends Snapshot<S>, A> {

    A chooseAction(S state, String actorId, RandomSource random);
}
