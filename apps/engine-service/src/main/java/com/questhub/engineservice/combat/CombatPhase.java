package com.questhub.engineservice.combat;

/**
 * 战斗状态机阶段：INITIATIVE → PLAYER_TURN / ENEMY_TURN 交替 → RESOLUTION。
 */
public enum CombatPhase {
    INITIATIVE,
    PLAYER_TURN,
    ENEMY_TURN,
    RESOLUTION
}
