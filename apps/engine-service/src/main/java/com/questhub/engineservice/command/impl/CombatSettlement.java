package com.questhub.engineservice.command.impl;

import com.questhub.engineservice.combat.CombatManager;
import com.questhub.engineservice.combat.CombatSession;
import com.questhub.engineservice.combat.Combatant;
import com.questhub.engineservice.command.CommandContext;
import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.domain.constants.EngineMessages;
import com.questhub.engineservice.domain.enums.GamePhase;
import com.questhub.engineservice.domain.enums.LogType;
import com.questhub.engineservice.domain.enums.NotificationType;
import com.questhub.engineservice.domain.model.CharacterState;
import com.questhub.engineservice.domain.model.GameState;
import com.questhub.engineservice.domain.model.LogEntry;
import com.questhub.engineservice.domain.model.Notification;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * 战斗命令的收尾：把玩家方参与者的资源写回角色，收集本次新增的战斗日志；
 * 战斗已结算时发放奖励 / 标记阵亡，清除战斗会话并回到探索阶段。
 */
@Component
@RequiredArgsConstructor
public class CombatSettlement {

    private final CombatManager combatManager;

    /**
     * @param logFrom 本次命令开始前战斗日志的长度
     */
    public void settle(CommandContext ctx, int logFrom, CommandResult.CommandResultBuilder result) {
        GameState state = ctx.getState();
        CombatSession combat = state.getCombat();
        CharacterState character = ctx.character();

        combat.find(character.getId()).ifPresent(p -> CombatManager.syncToCharacter(p, character));
        result.logEntries(new ArrayList<>(combat.getLog().subList(logFrom, combat.getLog().size())));

        if (!combat.isResolved()) {
            return;
        }
        switch (combat.getOutcome()) {
            case VICTORY -> {
                int xp = combatManager.experienceReward(combat);
                int gold = combatManager.goldReward(combat);
                character.setExperience(character.getExperience() + xp);
                character.setGold(character.getGold() + gold);
                String msg = EngineMessages.formatVictory(xp, gold);
                result.experienceGained(xp)
                        .logEntry(LogEntry.of(LogType.COMBAT, character.getId(), msg))
                        .notification(new Notification(NotificationType.SUCCESS, EngineMessages.COMBAT_TITLE, msg));
            }
            case DEFEAT -> {
                character.setHealth(0);
                result.logEntry(LogEntry.of(LogType.COMBAT, character.getId(), EngineMessages.DEFEAT))
                        .notification(new Notification(NotificationType.DANGER, EngineMessages.COMBAT_TITLE, EngineMessages.DEFEAT));
            }
            case FLED -> result.logEntry(LogEntry.of(LogType.COMBAT, character.getId(), EngineMessages.FLED))
                    .notification(new Notification(NotificationType.INFO, EngineMessages.COMBAT_TITLE, EngineMessages.FLED));
        }
        // 战斗会话在结算后清除
        state.setCombat(null);
        state.setPhase(GamePhase.EXPLORATION);
        result.extra("combatOutcome", combat.getOutcome().name());
    }

    /**
     * 当前行动者是否是该角色（玩家回合且轮到自己）。
     */
    public static boolean isCharactersTurn(CombatSession combat, CharacterState character) {
        if (combat == null || combat.isResolved()) {
            return false;
        }
        Combatant current = combat.getCurrentCombatant();
        return current != null && current.isPlayer() && current.getId().equals(character.getId());
    }
}
