package com.questhub.engineservice.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.questhub.engineservice.engine.core.Snapshot;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CharacterState
 * -------------------------------------------------------
 * 会话中的角色状态（等级、资源、属性、状态效果、背包）。
 * 同时也是角色仓储的存取对象。
 */
@Data
public class CharacterState implements Snapshot<CharacterState> {
    private String id;
    private String name;
    private int level = 1;
    private int experience;
    private int gold;

    private int health = 100;
    private int maxHealth = 100;
    private int mana = 50;
    private int maxMana = 50;
    private int stamina = 80;
    private int maxStamina = 80;

    private Attributes attributes = new Attributes();
    private List<StatusEffect> statusEffects = new ArrayList<>();
    /** 物品ID -> 数量 */
    private Map<String, Integer> inventory = new LinkedHashMap<>();

    /**
     * 新角色的默认状态：1 级，生命 100 / 法力 50 / 体力 80，全属性 10。
     */
    public static CharacterState newCharacter(String id, String name) {
        CharacterState c = new CharacterState();
        c.setId(id);
        c.setName(name == null || name.isBlank() ? id : name);
        c.getInventory().put("health_potion", 2);
        c.getInventory().put("mana_potion", 1);
        return c;
    }

    @JsonIgnore
    public boolean isAlive() {
        return health > 0;
    }

    public boolean hasStatus(String effectName) {
        return statusEffects.stream().anyMatch(e -> e.getName().equals(effectName));
    }

    public int itemCount(String itemId) {
        return inventory.getOrDefault(itemId, 0);
    }

    @Override
    public CharacterState copy() {
        CharacterState c = new CharacterState();
        c.id = id;
        c.name = name;
        c.level = level;
        c.experience = experience;
        c.gold = gold;
        c.health = health;
        c.maxHealth = maxHealth;
        c.mana = mana;
        c.maxMana = maxMana;
        c.stamina = stamina;
        c.maxStamina = maxStamina;
        c.attributes = attributes == null ? new Attributes() : attributes.copy();
        c.statusEffects = new ArrayList<>();
        statusEffects.forEach(e -> c.statusEffects.add(e.copy()));
        c.inventory = new LinkedHashMap<>(inventory);
        return c;
    }
}
