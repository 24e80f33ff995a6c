package com.questhub.engineservice.combat;

/**
 * 敌人下一步意图，展示给玩家用作提示。
 */
public enum EnemyIntention {
    ATTACK,
    DEFEND,
    FLEE
}
