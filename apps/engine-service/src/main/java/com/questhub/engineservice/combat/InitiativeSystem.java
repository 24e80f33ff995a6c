package com.questhub.engineservice.combat;

import com.questhub.engineservice.engine.core.RandomSource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * InitiativeSystem
 * -------------------------------------------------------
 * 开战时计算行动顺序。
 * - 先攻 = 1d20 + floor((敏捷-10)/2) + floor((幸运-10)/5)，伏击方敌人 +5，最低为 1；
 * - 按先攻降序排列，同分保持入场顺序（稳定排序），固定种子下结果可复现；
 * - 伏击时所有敌人排在所有玩家之前，与掷骰结果无关。
 */
@Component
public class InitiativeSystem {

    static final int AMBUSH_BONUS = 5;

    /**
     * 为每个参与者掷先攻并返回排好序的新列表（同时写入 initiative 与 position）。
     *
     * @param roster 入场顺序的参与者
     * @param ambush 是否伏击
     * @param random 随机来源
     */
    public List<Combatant> order(List<Combatant> roster, boolean ambush, RandomSource random) {
        for (Combatant c : roster) {
            c.setInitiative(roll(c, ambush, random));
        }
        List<Combatant> ordered = new ArrayList<>(roster);
        // List.sort 为稳定排序，同分保持入场顺序
        ordered.sort(Comparator.comparingInt(Combatant::getInitiative).reversed());
        if (ambush) {
            List<Combatant> partitioned = new ArrayList<>(ordered.size());
            ordered.stream().filter(c -> !c.isPlayer()).forEach(partitioned::add);
            ordered.stream().filter(Combatant::isPlayer).forEach(partitioned::add);
            ordered = partitioned;
        }
        for (int i = 0; i < ordered.size(); i++) {
            ordered.get(i).setPosition(i);
        }
        return ordered;
    }

    int roll(Combatant c, boolean ambush, RandomSource random) {
        int dex = c.getAttributes().getDexterity();
        int luck = c.getAttributes().getLuck();
        int score = random.roll(20) + Math.floorDiv(dex - 10, 2) + Math.floorDiv(luck - 10, 5);
        if (ambush && !c.isPlayer()) {
            score += AMBUSH_BONUS;
        }
        return Math.max(1, score);
    }
}
