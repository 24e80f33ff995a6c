package com.questhub.engineservice.combat;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一次战斗行动。玩家命令与敌人 AI 产出同一种结构，走同一条结算路径。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CombatAction {
    private String actorId;
    private CombatActionType type;
    /** 目标ID；防御/逃跑/等待为空，治疗为空表示自己 */
    private String targetId;

    public static CombatAction attack(String actorId, String targetId) {
        return new CombatAction(actorId, CombatActionType.ATTACK, targetId);
    }

    public static CombatAction defend(String actorId) {
        return new CombatAction(actorId, CombatActionType.DEFEND, null);
    }

    public static CombatAction flee(String actorId) {
        return new CombatAction(actorId, CombatActionType.FLEE, null);
    }

    public static CombatAction heal(String actorId) {
        return new CombatAction(actorId, CombatActionType.HEAL, null);
    }

    public static CombatAction waitTurn(String actorId) {
        return new CombatAction(actorId, CombatActionType.WAIT, null);
    }
}
