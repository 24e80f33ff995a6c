package com.questhub.engineservice.combat;

import com.questhub.engineservice.support.ScriptedRandom;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InitiativeSystemTest {

    private final InitiativeSystem initiative = new InitiativeSystem();
    private final EnemyTemplates templates = new EnemyTemplates();

    private List<Combatant> roster() {
        List<Combatant> r = new ArrayList<>();
        r.add(CombatFixtures.player("hero", 100));
        r.add(CombatFixtures.enemy(templates, "enemy_wolf", "wolf#1"));
        r.add(CombatFixtures.enemy(templates, "enemy_goblin", "goblin#2"));
        r.add(CombatFixtures.enemy(templates, "enemy_skeleton", "skeleton#3"));
        return r;
    }

    private static List<String> ids(List<Combatant> ordered) {
        return ordered.stream().map(Combatant::getId).toList();
    }

    @Test
    @DisplayName("固定种子与阵容下行动顺序可复现")
    void sameSeedSameOrder() {
        List<String> first = ids(initiative.order(roster(), false, new CombatDice(42L, 0)));
        List<String> second = ids(initiative.order(roster(), false, new CombatDice(42L, 0)));
        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("按先攻降序排列，同分保持入场顺序")
    void tiesKeepInsertionOrder() {
        List<Combatant> r = new ArrayList<>();
        r.add(CombatFixtures.player("a", 100));
        r.add(CombatFixtures.player("b", 100));
        r.add(CombatFixtures.player("c", 100));

        List<Combatant> ordered = initiative.order(r, false, new ScriptedRandom(0.5));

        assertThat(ids(ordered)).containsExactly("a", "b", "c");
        assertThat(ordered).extracting(Combatant::getPosition).containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("伏击时所有敌人排在玩家之前，与掷骰无关")
    void ambushPutsEnemiesFirst() {
        // 玩家掷 20，敌人掷 1
        ScriptedRandom random = new ScriptedRandom(0.99, 0.0, 0.0, 0.0);

        List<Combatant> ordered = initiative.order(roster(), true, random);

        assertThat(ordered.subList(0, 3)).noneMatch(Combatant::isPlayer);
        assertThat(ordered.get(3).getId()).isEqualTo("hero");
    }

    @Test
    @DisplayName("先攻公式：d20 + 敏捷修正 + 幸运修正，最低为 1")
    void rollFormula() {
        Combatant quick = CombatFixtures.player("quick", 100);
        quick.getAttributes().setDexterity(16);
        quick.getAttributes().setLuck(15);
        // d20 = 10 → 10 + 3 + 1
        assertThat(initiative.roll(quick, false, new ScriptedRandom(0.45))).isEqualTo(14);

        Combatant clumsy = CombatFixtures.player("clumsy", 100);
        clumsy.getAttributes().setDexterity(1);
        clumsy.getAttributes().setLuck(1);
        assertThat(initiative.roll(clumsy, false, new ScriptedRandom(0.0))).isEqualTo(1);
    }

    @Test
    @DisplayName("伏击方敌人先攻 +5")
    void ambushBonusForEnemies() {
        Combatant wolf = CombatFixtures.enemy(templates, "enemy_wolf", "wolf#1");
        int normal = initiative.roll(wolf, false, new ScriptedRandom(0.5));
        int ambush = initiative.roll(wolf, true, new ScriptedRandom(0.5));
        assertThat(ambush - normal).isEqualTo(InitiativeSystem.AMBUSH_BONUS);
    }
}
