package com.questhub.engineservice.combat;

import com.questhub.engineservice.domain.model.Attributes;

/**
 * 敌人模板：实例化战斗单位时的基础数值。
 */
public record EnemyTemplate(String templateId, String name, int level, int maxHealth, int strength, int dexterity,
                            int constitution, int luck, BehaviorProfile profile) {

    public Combatant instantiate(String combatantId) {
        Combatant c = new Combatant();
        c.setId(combatantId);
        c.setName(name);
        c.setPlayer(false);
        c.setTemplateId(templateId);
        c.setLevel(level);
        c.setHealth(maxHealth);
        c.setMaxHealth(maxHealth);
        c.setStamina(50);
        c.setMaxStamina(50);
        Attributes a = new Attributes();
        a.setStrength(strength);
        a.setDexterity(dexterity);
        a.setConstitution(constitution);
        a.setLuck(luck);
        c.setAttributes(a);
        return c;
    }
}
