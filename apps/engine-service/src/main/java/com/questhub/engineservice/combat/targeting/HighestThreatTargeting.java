package com.questhub.engineservice.combat.targeting;

import com.questhub.engineservice.combat.Combatant;
import com.questhub.engineservice.combat.CombatSession;

import java.util.Optional;

/**
 * 优先攻击威胁最高的目标：力量*1.5 + 等级*2 + (敏捷-10)*0.5。同分取行动顺序靠前者。
 */
public class HighestThreatTargeting implements TargetingStrategy {

    @Override
    public Optional<Combatant> selectTarget(CombatSession session, Combatant actor) {
        return TargetingStrategy.opponents(session, actor).stream()
                .reduce((a, b) -> threat(b) > threat(a) ? b : a);
    }

    static double threat(Combatant c) {
        return c.getAttributes().getStrength() * 1.5 + c.getLevel() * 2
                + (c.getAttributes().getDexterity() - 10) * 0.5;
    }
}
