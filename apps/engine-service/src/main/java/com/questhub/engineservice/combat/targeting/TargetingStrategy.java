package com.questhub.engineservice.combat.targeting;

import com.questhub.engineservice.combat.Combatant;
import com.questhub.engineservice.combat.CombatSession;

import java.util.List;
import java.util.Optional;

/**
 * 目标选择策略：从对立阵营仍在场的参与者中选出一个目标。
 */
public interface TargetingStrategy {

    Optional<Combatant> selectTarget(CombatSession session, Combatant actor);

    /**
     * 对立阵营中仍在场的参与者，保持行动顺序。
     */
    static List<Combatant> opponents(CombatSession session, Combatant actor) {
        return session.getCombatants().stream()
                .filter(c -> c.isPlayer() != actor.isPlayer())
                .filter(Combatant::isActive)
                .toList();
    }
}
