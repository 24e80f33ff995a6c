package com.questhub.engineservice.command;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * 命令消耗。计算出来时只是告知，效果执行阶段才真正扣除。
 */
@Value
@Builder
public class CommandCost {

    public static final CommandCost NONE = CommandCost.builder().build();

    int mana;
    int stamina;
    int health;
    int gold;
    /** 物品ID -> 数量 */
    @Singular
    Map<String, Integer> items;

    public static CommandCost ofMana(int mana) {
        return CommandCost.builder().mana(mana).build();
    }

    public static CommandCost ofStamina(int stamina) {
        return CommandCost.builder().stamina(stamina).build();
    }
}
