package com.questhub.engineservice.combat;

import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 内置敌人模板目录。未登记的模板ID按默认模板处理，名称取模板ID。
 */
@Component
public class EnemyTemplates {

    private static final Map<String, EnemyTemplate> TEMPLATES = Map.of(
            "enemy_giant_rat", new EnemyTemplate("enemy_giant_rat", "巨鼠", 1, 30, 8, 14, 8, 10,
                    new BehaviorProfile(Behavior.COWARD, 0.3, 0.0, 0.6)),
            "enemy_wolf", new EnemyTemplate("enemy_wolf", "野狼", 2, 45, 12, 14, 10, 10,
                    new BehaviorProfile(Behavior.AGGRESSIVE, 0.2, 0.1, 0.2)),
            "enemy_bandit", new EnemyTemplate("enemy_bandit", "强盗", 3, 60, 12, 12, 12, 12,
                    new BehaviorProfile(Behavior.TACTICAL, 0.3, 0.4, 0.3)),
            "enemy_goblin", new EnemyTemplate("enemy_goblin", "哥布林", 2, 40, 10, 13, 9, 11,
                    new BehaviorProfile(Behavior.COWARD, 0.35, 0.1, 0.5)),
            "enemy_skeleton", new EnemyTemplate("enemy_skeleton", "骷髅兵", 3, 55, 13, 9, 14, 8,
                    new BehaviorProfile(Behavior.DEFENSIVE, 0.4, 0.3, 0.0)),
            "enemy_orc_berserker", new EnemyTemplate("enemy_orc_berserker", "兽人狂战士", 4, 80, 16, 10, 13, 9,
                    new BehaviorProfile(Behavior.BERSERKER, 0.0, 0.0, 0.0))
    );

    public EnemyTemplate get(String templateId) {
        EnemyTemplate t = TEMPLATES.get(templateId);
        if (t != null) {
            return t;
        }
        return new EnemyTemplate(templateId, templateId, 1, 40, 10, 10, 10, 10, BehaviorProfile.DEFAULT);
    }

    public BehaviorProfile profileOf(Combatant enemy) {
        return get(enemy.getTemplateId()).profile();
    }
}
