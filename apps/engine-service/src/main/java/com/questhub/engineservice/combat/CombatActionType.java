package com.questhub.engineservice.combat;

public enum CombatActionType {
    ATTACK,
    DEFEND,
    /** 治疗法术 */
    HEAL,
    FLEE,
    WAIT
}
