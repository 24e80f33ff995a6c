package com.questhub.engineservice.combat;

import com.questhub.engineservice.engine.core.RandomSource;
import org.springframework.stereotype.Component;

/**
 * 战斗数值公式。只计算，不修改参与者。
 */
@Component
public class CombatCalculator {

    public static final double PLAYER_FLEE_CHANCE = 0.4;
    public static final double ENEMY_FLEE_CHANCE = 0.3;

    /**
     * 一次攻击的结算结果。
     */
    public record AttackResult(boolean hit, boolean critical, int damage) {
        static AttackResult miss() {
            return new AttackResult(false, false, 0);
        }
    }

    /**
     * 命中率（百分比）：80 + (敏捷-10)*2 - 目标敏捷*1.5，目标防御时 -15，限制在 5..95。
     */
    public double hitChance(Combatant attacker, Combatant target) {
        double chance = 80 + (attacker.getAttributes().getDexterity() - 10) * 2
                - target.getAttributes().getDexterity() * 1.5;
        if (target.isDefending()) {
            chance -= 15;
        }
        return clamp(chance, 5, 95);
    }

    /**
     * 暴击率（百分比）：5 + (敏捷-10)*0.5 + (幸运-10)*0.3，限制在 1..50。
     */
    public double critChance(Combatant attacker) {
        double chance = 5 + (attacker.getAttributes().getDexterity() - 10) * 0.5
                + (attacker.getAttributes().getLuck() - 10) * 0.3;
        return clamp(chance, 1, 50);
    }

    public double baseDamage(Combatant attacker) {
        return 10 + attacker.getAttributes().getStrength() * 1.5 + attacker.getLevel() * 2;
    }

    public AttackResult resolveAttack(Combatant attacker, Combatant target, RandomSource random) {
        if (random.nextDouble() * 100 >= hitChance(attacker, target)) {
            return AttackResult.miss();
        }
        // ±15% 浮动
        double damage = baseDamage(attacker) * (0.85 + random.nextDouble() * 0.3);
        damage -= target.getAttributes().getConstitution() * 0.8;
        boolean critical = random.nextDouble() * 100 < critChance(attacker);
        if (critical) {
            damage *= 2;
        }
        if (target.isDefending()) {
            damage /= 2;
        }
        return new AttackResult(true, critical, Math.max(1, (int) Math.round(damage)));
    }

    public int healAmount(Combatant caster) {
        return 25 + Math.max(0, caster.getAttributes().getWisdom() - 10) * 2;
    }

    public double fleeChance(Combatant actor) {
        return actor.isPlayer() ? PLAYER_FLEE_CHANCE : ENEMY_FLEE_CHANCE;
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
