package com.questhub.engineservice.combat;

/**
 * 战斗状态机的回调。由 {@link CombatManager} 在阶段切换与结算时同步调用。
 */
public interface CombatTransitionListener {

    void onPhaseChanged(CombatSession session, CombatPhase from, CombatPhase to);

    default void onResolved(CombatSession session, CombatOutcome outcome) {
    }
}
