package com.questhub.engineservice.combat.targeting;

import com.questhub.engineservice.combat.Combatant;
import com.questhub.engineservice.combat.CombatSession;

import java.util.Comparator;
import java.util.Optional;

/**
 * 优先攻击生命比例最低的目标，同比例取行动顺序靠前者。
 */
public class LowestHealthTargeting implements TargetingStrategy {

    @Override
    public Optional<Combatant> selectTarget(CombatSession session, Combatant actor) {
        return TargetingStrategy.opponents(session, actor).stream()
                .min(Comparator.comparingDouble(Combatant::getHealthRatio));
    }
}
