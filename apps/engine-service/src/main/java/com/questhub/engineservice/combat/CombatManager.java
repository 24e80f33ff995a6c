package com.questhub.engineservice.combat;

import com.questhub.engineservice.domain.constants.EngineMessages;
import com.questhub.engineservice.domain.enums.LogType;
import com.questhub.engineservice.domain.model.CharacterState;
import com.questhub.engineservice.domain.model.LogEntry;
import com.questhub.engineservice.domain.model.StatusEffect;
import com.questhub.engineservice.engine.core.RandomSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * CombatManager
 * -------------------------------------------------------
 * 战斗状态机。自身无状态，所有数据都在传入的 {@link CombatSession} 上（即命令的工作副本）。
 * 职责：
 * - 开战：组建参与者、掷先攻、从 INITIATIVE 切到首位行动者的回合阶段；
 * - 推进回合：跳过已倒下/已逃离的参与者，越过末位时回合数 +1 并做回合结算；
 * - 结算行动：玩家与敌人的行动走同一条路径，产生相同格式的日志；
 * - 判定结束：一方全部倒下或玩家逃跑成功时进入 RESOLUTION。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CombatManager {

    /** 每回合结束恢复的体力 */
    static final int ROUND_STAMINA_REGEN = 5;

    private final InitiativeSystem initiativeSystem;
    private final EnemyAI enemyAI;
    private final CombatCalculator calculator;
    private final EnemyTemplates templates;

    private final List<CombatTransitionListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(CombatTransitionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(CombatTransitionListener listener) {
        listeners.remove(listener);
    }

    /**
     * 开始一场战斗。
     *
     * @param actor   发起战斗的角色
     * @param options 敌人列表、是否伏击、能否逃跑等
     * @param random  随机来源（决定先攻）
     * @param now     当前时间（毫秒）
     * @return 已进入首位行动者回合阶段的战斗会话
     */
    public CombatSession startCombat(CharacterState actor, StartCombatOptions options, RandomSource random, long now) {
        if (options.getEnemyIds() == null || options.getEnemyIds().isEmpty()) {
            throw new IllegalArgumentException(EngineMessages.NO_ENEMIES);
        }
        // 1) 入场顺序：角色在前，敌人按给定顺序
        List<Combatant> roster = new ArrayList<>();
        roster.add(fromCharacter(actor));
        List<String> enemyIds = options.getEnemyIds();
        for (int i = 0; i < enemyIds.size(); i++) {
            roster.add(templates.get(enemyIds.get(i)).instantiate(enemyIds.get(i) + "#" + (i + 1)));
        }

        // 2) 掷先攻并排序
        CombatSession session = new CombatSession();
        session.setCombatId(UUID.randomUUID().toString());
        session.setCombatants(initiativeSystem.order(roster, options.isAmbush(), random));
        session.setAmbush(options.isAmbush());
        session.setCanFlee(options.isCanFlee());
        session.setTerrain(options.getTerrain());
        session.setLocationId(options.getLocationId());
        session.setStartedAt(now);
        session.setRound(1);
        session.setCurrentTurnIndex(0);
        session.setPhase(CombatPhase.INITIATIVE);

        List<String> order = session.getCombatants().stream().map(Combatant::getName).toList();
        append(session, LogEntry.of(LogType.COMBAT, null, EngineMessages.formatCombatStarted(order)));
        if (options.isAmbush()) {
            append(session, LogEntry.of(LogType.COMBAT, null, EngineMessages.AMBUSH_NARRATION));
        }

        // 3) INITIATIVE 立即切换到首位行动者的回合
        Combatant first = session.getCurrentCombatant();
        transition(session, first.isPlayer() ? CombatPhase.PLAYER_TURN : CombatPhase.ENEMY_TURN);
        log.info("战斗开始: combatId={}, combatants={}, ambush={}, first={}",
                session.getCombatId(), session.getCombatants().size(), options.isAmbush(), first.getId());
        return session;
    }

    /**
     * 推进到下一位在场的参与者。
     * 越过末位时先做回合结算（状态效果、体力恢复），回合数 +1；若结算后战斗结束则进入 RESOLUTION。
     *
     * @return 新的当前行动者；战斗已结束时返回 null
     */
    public Combatant advanceTurn(CombatSession session) {
        if (session.isResolved()) {
            throw new IllegalStateException("COMBAT_RESOLVED: " + session.getCombatId());
        }
        if (resolveIfFinished(session)) {
            return null;
        }
        List<Combatant> combatants = session.getCombatants();
        int idx = session.getCurrentTurnIndex();
        while (true) {
            idx++;
            if (idx >= combatants.size()) {
                idx = 0;
                endOfRound(session);
                session.setRound(session.getRound() + 1);
                append(session, LogEntry.of(LogType.COMBAT, null, EngineMessages.formatRoundStarted(session.getRound())));
                if (resolveIfFinished(session)) {
                    return null;
                }
            }
            if (combatants.get(idx).isActive()) {
                break;
            }
        }
        session.setCurrentTurnIndex(idx);
        Combatant next = combatants.get(idx);
        // 防御姿态持续到自己的下一个回合开始
        next.setDefending(false);
        transition(session, next.isPlayer() ? CombatPhase.PLAYER_TURN : CombatPhase.ENEMY_TURN);
        return next;
    }

    /**
     * 结算一次行动（玩家或敌人）。结算后检查战斗是否结束。
     */
    public void applyAction(CombatSession session, CombatAction action, RandomSource random) {
        Combatant actor = session.find(action.getActorId())
                .orElseThrow(() -> new IllegalArgumentException("COMBATANT_NOT_FOUND: " + action.getActorId()));
        if (!actor.isActive()) {
            throw new IllegalStateException("COMBATANT_INACTIVE: " + actor.getId());
        }
        switch (action.getType()) {
            case ATTACK -> attack(session, actor, action.getTargetId(), random);
            case DEFEND -> {
                actor.setDefending(true);
                append(session, LogEntry.of(LogType.COMBAT, actor.getId(), EngineMessages.formatDefending(actor.getName())));
            }
            case HEAL -> {
                int before = actor.getHealth();
                actor.setHealth(Math.min(actor.getMaxHealth(), before + calculator.healAmount(actor)));
                append(session, LogEntry.of(LogType.COMBAT, actor.getId(),
                        EngineMessages.formatHealed(actor.getName(), actor.getHealth() - before)));
            }
            case FLEE -> flee(session, actor, random);
            case WAIT -> append(session, LogEntry.of(LogType.COMBAT, actor.getId(), EngineMessages.formatWaited(actor.getName())));
        }
        if (!session.isResolved()) {
            resolveIfFinished(session);
        }
    }

    /**
     * 连续结算敌人回合，直到轮到玩家或战斗结束。两次玩家回合之间每个敌人至多行动一次。
     *
     * @return 本次结算的敌人回合数
     */
    public int runEnemyTurns(CombatSession session, RandomSource random) {
        int acted = 0;
        int limit = session.getCombatants().size();
        while (!session.isResolved() && acted < limit) {
            Combatant current = session.getCurrentCombatant();
            if (current.isPlayer()) {
                break;
            }
            CombatAction action = enemyAI.chooseAction(session, current.getId(), random);
            current.setIntention(EnemyAI.intentionOf(action));
            applyAction(session, action, random);
            acted++;
            if (!session.isResolved()) {
                advanceTurn(session);
            }
        }
        return acted;
    }

    /**
     * 检查胜负：玩家全部倒下为 DEFEAT，敌人全部倒下或逃离为 VICTORY。
     *
     * @return 是否已结束
     */
    public boolean resolveIfFinished(CombatSession session) {
        if (session.isResolved()) {
            return true;
        }
        boolean playersLeft = session.getPlayers().stream().anyMatch(Combatant::isActive);
        boolean enemiesLeft = session.getEnemies().stream().anyMatch(Combatant::isActive);
        if (!playersLeft) {
            resolve(session, CombatOutcome.DEFEAT);
            return true;
        }
        if (!enemiesLeft) {
            resolve(session, CombatOutcome.VICTORY);
            return true;
        }
        return false;
    }

    /**
     * 胜利奖励的经验：被击倒敌人的等级 × 20（逃走的不计）。
     */
    public int experienceReward(CombatSession session) {
        return session.getEnemies().stream()
                .filter(e -> e.getHealth() <= 0)
                .mapToInt(e -> e.getLevel() * 20)
                .sum();
    }

    public int goldReward(CombatSession session) {
        return session.getEnemies().stream()
                .filter(e -> e.getHealth() <= 0)
                .mapToInt(e -> e.getLevel() * 10)
                .sum();
    }

    /**
     * 由角色构造玩家方参与者，ID 与角色ID相同。
     */
    public static Combatant fromCharacter(CharacterState c) {
        Combatant p = new Combatant();
        p.setId(c.getId());
        p.setName(c.getName());
        p.setPlayer(true);
        p.setLevel(c.getLevel());
        p.setHealth(c.getHealth());
        p.setMaxHealth(c.getMaxHealth());
        p.setStamina(c.getStamina());
        p.setMaxStamina(c.getMaxStamina());
        p.setMana(c.getMana());
        p.setMaxMana(c.getMaxMana());
        p.setAttributes(c.getAttributes().copy());
        c.getStatusEffects().forEach(e -> p.getStatusEffects().add(e.copy()));
        return p;
    }

    /**
     * 把玩家方参与者的资源写回角色。
     */
    public static void syncToCharacter(Combatant p, CharacterState c) {
        c.setHealth(Math.max(0, p.getHealth()));
        c.setStamina(p.getStamina());
        c.setMana(p.getMana());
        List<StatusEffect> effects = new ArrayList<>();
        p.getStatusEffects().forEach(e -> effects.add(e.copy()));
        c.setStatusEffects(effects);
    }

    /**
     * 把角色的当前资源写入玩家方参与者（命令扣除消耗后调用）。
     */
    public static void syncFromCharacter(CharacterState c, Combatant p) {
        p.setHealth(c.getHealth());
        p.setStamina(c.getStamina());
        p.setMana(c.getMana());
    }

    // ---------------- 内部 ----------------

    private void attack(CombatSession session, Combatant actor, String targetId, RandomSource random) {
        Combatant target = session.find(targetId)
                .filter(Combatant::isActive)
                .orElseThrow(() -> new IllegalArgumentException(EngineMessages.formatUnknownTarget(targetId)));
        CombatCalculator.AttackResult r = calculator.resolveAttack(actor, target, random);
        if (!r.hit()) {
            append(session, LogEntry.of(LogType.COMBAT, actor.getId(),
                    EngineMessages.formatAttackMiss(actor.getName(), target.getName())));
            return;
        }
        target.setHealth(Math.max(0, target.getHealth() - r.damage()));
        String msg = r.critical()
                ? EngineMessages.formatAttackCrit(actor.getName(), target.getName(), r.damage())
                : EngineMessages.formatAttackHit(actor.getName(), target.getName(), r.damage());
        append(session, LogEntry.of(LogType.COMBAT, actor.getId(), msg));
        if (target.getHealth() <= 0) {
            append(session, LogEntry.of(LogType.COMBAT, target.getId(), EngineMessages.formatDefeated(target.getName())));
        }
    }

    private void flee(CombatSession session, Combatant actor, RandomSource random) {
        if (random.nextDouble() >= calculator.fleeChance(actor)) {
            append(session, LogEntry.of(LogType.COMBAT, actor.getId(), EngineMessages.formatFleeFailed(actor.getName())));
            return;
        }
        append(session, LogEntry.of(LogType.COMBAT, actor.getId(), EngineMessages.formatFleeSuccess(actor.getName())));
        if (actor.isPlayer()) {
            resolve(session, CombatOutcome.FLED);
        } else {
            actor.setFled(true);
        }
    }

    /**
     * 回合结算：状态效果生效并递减，在场者恢复体力。
     */
    private void endOfRound(CombatSession session) {
        for (Combatant c : session.getCombatants()) {
            if (!c.isActive()) {
                continue;
            }
            Iterator<StatusEffect> it = c.getStatusEffects().iterator();
            while (it.hasNext()) {
                StatusEffect e = it.next();
                int delta = switch (e.getType()) {
                    case DOT -> -e.getMagnitude();
                    case HOT -> e.getMagnitude();
                    default -> 0;
                };
                if (delta != 0) {
                    c.setHealth(Math.max(0, Math.min(c.getMaxHealth(), c.getHealth() + delta)));
                    append(session, LogEntry.of(LogType.COMBAT, c.getId(),
                            EngineMessages.formatStatusTick(c.getName(), e.getName(), delta)));
                }
                e.setRemainingRounds(e.getRemainingRounds() - 1);
                if (e.getRemainingRounds() <= 0) {
                    it.remove();
                }
            }
            if (c.getHealth() <= 0) {
                append(session, LogEntry.of(LogType.COMBAT, c.getId(), EngineMessages.formatDefeated(c.getName())));
                continue;
            }
            c.setStamina(Math.min(c.getMaxStamina(), c.getStamina() + ROUND_STAMINA_REGEN));
        }
    }

    private void resolve(CombatSession session, CombatOutcome outcome) {
        session.setOutcome(outcome);
        transition(session, CombatPhase.RESOLUTION);
        log.info("战斗结束: combatId={}, outcome={}, round={}", session.getCombatId(), outcome, session.getRound());
        for (CombatTransitionListener l : listeners) {
            l.onResolved(session, outcome);
        }
    }

    private void transition(CombatSession session, CombatPhase to) {
        CombatPhase from = session.getPhase();
        session.setPhase(to);
        if (from != to) {
            for (CombatTransitionListener l : listeners) {
                l.onPhaseChanged(session, from, to);
            }
        }
    }

    private static void append(CombatSession session, LogEntry entry) {
        session.getLog().add(entry);
    }
}
