package com.questhub.engineservice.combat;

import com.questhub.engineservice.combat.targeting.TargetingStrategy;
import com.questhub.engineservice.config.EngineProperties;
import com.questhub.engineservice.engine.core.AiAdvisor;
import com.questhub.engineservice.engine.core.RandomSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * EnemyAI
 * -------------------------------------------------------
 * 敌人决策：按模板的行为倾向决定攻击 / 防御 / 逃跑，目标由可插拔的 {@link TargetingStrategy} 选出。
 * - 只读：不修改战斗状态，返回的行动交给 CombatManager 与玩家行动走同一结算路径；
 * - 所有随机判定来自传入的 RandomSource，固定种子可复现。
 */
@Component
public class EnemyAI implements AiAdvisor<CombatSession, CombatAction> {

    private final EnemyTemplates templates;
    private final TargetingStrategy targeting;

    @Autowired
    public EnemyAI(EnemyTemplates templates, EngineProperties props) {
        this(templates, props.getAiTargeting().strategy());
    }

    public EnemyAI(EnemyTemplates templates, TargetingStrategy targeting) {
        this.templates = templates;
        this.targeting = targeting;
    }

    @Override
    public CombatAction chooseAction(CombatSession session, String actorId, RandomSource random) {
        Combatant enemy = session.find(actorId)
                .orElseThrow(() -> new IllegalArgumentException("COMBATANT_NOT_FOUND: " + actorId));
        Optional<Combatant> target = targeting.selectTarget(session, enemy);
        if (target.isEmpty()) {
            return CombatAction.waitTurn(actorId);
        }
        BehaviorProfile profile = templates.profileOf(enemy);
        boolean lowHealth = enemy.getHealthRatio() < profile.lowHealthThreshold();

        switch (profile.behavior()) {
            case COWARD -> {
                if (lowHealth && random.nextDouble() < profile.fleeChance()) {
                    return CombatAction.flee(actorId);
                }
            }
            case DEFENSIVE -> {
                if (lowHealth || random.nextDouble() < profile.defendChance()) {
                    return CombatAction.defend(actorId);
                }
            }
            case TACTICAL -> {
                if (lowHealth && random.nextDouble() < profile.defendChance()) {
                    return CombatAction.defend(actorId);
                }
            }
            case AGGRESSIVE, BERSERKER -> {
                // 始终进攻
            }
        }
        return CombatAction.attack(actorId, target.get().getId());
    }

    /**
     * 行动对应的意图，用于前端展示。
     */
    public static EnemyIntention intentionOf(CombatAction action) {
        return switch (action.getType()) {
            case DEFEND -> EnemyIntention.DEFEND;
            case FLEE -> EnemyIntention.FLEE;
            default -> EnemyIntention.ATTACK;
        };
    }
}
