package com.questhub.engineservice.combat;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.questhub.engineservice.domain.model.Attributes;
import com.questhub.engineservice.domain.model.StatusEffect;
import com.questhub.engineservice.engine.core.Snapshot;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 战斗参与者（玩家角色或敌人实例）。
 */
@Data
public class Combatant implements Snapshot<Combatant> {
    private String id;
    private String name;
    private boolean player;
    /** 敌人模板ID，玩家为空 */
    private String templateId;
    private int level = 1;

    private int health;
    private int maxHealth;
    private int stamina;
    private int maxStamina;
    private int mana;
    private int maxMana;
    private Attributes attributes = new Attributes();

    /** 开战时掷出的先攻值 */
    private int initiative;
    private boolean defending;
    /** 已逃离战斗 */
    private boolean fled;
    private List<StatusEffect> statusEffects = new ArrayList<>();
    /** 在行动顺序中的位置（0 开始） */
    private int position;
    private EnemyIntention intention;

    /**
     * 仍在场且生命大于 0。
     */
    @JsonIgnore
    public boolean isActive() {
        return health > 0 && !fled;
    }

    @JsonIgnore
    public double getHealthRatio() {
        return maxHealth <= 0 ? 0 : (double) health / maxHealth;
    }

    @Override
    public Combatant copy() {
        Combatant c = new Combatant();
        c.id = id;
        c.name = name;
        c.player = player;
        c.templateId = templateId;
        c.level = level;
        c.health = health;
        c.maxHealth = maxHealth;
        c.stamina = stamina;
        c.maxStamina = maxStamina;
        c.mana = mana;
        c.maxMana = maxMana;
        c.attributes = attributes == null ? new Attributes() : attributes.copy();
        c.initiative = initiative;
        c.defending = defending;
        c.fled = fled;
        c.statusEffects = new ArrayList<>();
        statusEffects.forEach(e -> c.statusEffects.add(e.copy()));
        c.position = position;
        c.intention = intention;
        return c;
    }
}
