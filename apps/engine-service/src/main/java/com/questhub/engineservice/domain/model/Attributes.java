package com.questhub.engineservice.domain.model;

import com.questhub.engineservice.engine.core.Snapshot;
import lombok.Data;

/**
 * 角色 / 战斗单位的基础属性，默认值均为 10。
 */
@Data
public class Attributes implements Snapshot<Attributes> {
    private int strength = 10;
    private int dexterity = 10;
    private int constitution = 10;
    private int intelligence = 10;
    private int wisdom = 10;
    private int charisma = 10;
    private int luck = 10;

    @Override
    public Attributes copy() {
        Attributes a = new Attributes();
        a.strength = strength;
        a.dexterity = dexterity;
        a.constitution = constitution;
        a.intelligence = intelligence;
        a.wisdom = wisdom;
        a.charisma = charisma;
        a.luck = luck;
        return a;
    }
}
