package com.questhub.engineservice.command.impl;

import com.questhub.engineservice.combat.CombatManager;
import com.questhub.engineservice.combat.CombatSession;
import com.questhub.engineservice.combat.StartCombatOptions;
import com.questhub.engineservice.command.CommandContext;
import com.questhub.engineservice.command.CommandDefinition;
import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.command.CommandType;
import com.questhub.engineservice.command.GameCommand;
import com.questhub.engineservice.command.ValidationResult;
import com.questhub.engineservice.domain.constants.EngineMessages;
import com.questhub.engineservice.domain.enums.GamePhase;
import com.questhub.engineservice.domain.enums.NotificationType;
import com.questhub.engineservice.domain.model.Notification;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 开始战斗。参数：enemyIds（必需），isAmbush（兼容 ambush）、canFlee、terrain、locationId（可选）。
 * 敌人先攻时立即结算敌人回合，直到轮到玩家。开战不可撤销。
 */
@Component
@RequiredArgsConstructor
public class StartCombatCommand implements GameCommand {

    private static final CommandDefinition DEFINITION = CommandDefinition.builder()
            .displayName("开始战斗")
            .description("与指定的敌人进入战斗")
            .requiredParam("enemyIds")
            .allowedPhase(GamePhase.EXPLORATION)
            .allowedPhase(GamePhase.REST)
            .allowedPhase(GamePhase.DIALOGUE)
            .undoable(false)
            .build();

    private final CombatManager combatManager;
    private final CombatSettlement settlement;

    @Override
    public CommandType type() {
        return CommandType.START_COMBAT;
    }

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    public ValidationResult validate(CommandContext ctx) {
        if (ctx.getState().getCombat() != null || ctx.getState().getPhase() == GamePhase.COMBAT) {
            return ValidationResult.fail(EngineMessages.ALREADY_IN_COMBAT);
        }
        if (ctx.stringListParam("enemyIds").isEmpty()) {
            return ValidationResult.fail(EngineMessages.NO_ENEMIES);
        }
        return ValidationResult.ok();
    }

    @Override
    public CommandResult execute(CommandContext ctx) {
        StartCombatOptions options = StartCombatOptions.builder()
                .enemyIds(ctx.stringListParam("enemyIds"))
                .ambush(ctx.boolParam("isAmbush", ctx.boolParam("ambush", false)))
                .canFlee(ctx.boolParam("canFlee", true))
                .terrain(ctx.stringParam("terrain"))
                .locationId(ctx.stringParam("locationId", ctx.getState().getLocation().getLocationId()))
                .build();

        CombatSession combat = combatManager.startCombat(ctx.character(), options, ctx.getDice(), ctx.getNow());
        ctx.getState().setCombat(combat);
        ctx.getState().setPhase(GamePhase.COMBAT);
        // 敌人先攻
        combatManager.runEnemyTurns(combat, ctx.getDice());

        CommandResult.CommandResultBuilder result = CommandResult.builder()
                .success(true)
                .message(EngineMessages.COMBAT_TITLE)
                .extra("combatId", combat.getCombatId());
        if (options.isAmbush()) {
            result.notification(new Notification(NotificationType.WARNING,
                    EngineMessages.AMBUSH_TITLE, EngineMessages.AMBUSH_NARRATION));
        }
        settlement.settle(ctx, 0, result);
        return result.build();
    }
}
