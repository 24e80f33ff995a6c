package com.questhub.engineservice.command.impl;

import com.questhub.engineservice.combat.CombatAction;
import com.questhub.engineservice.combat.CombatManager;
import com.questhub.engineservice.combat.CombatSession;
import com.questhub.engineservice.combat.Combatant;
import com.questhub.engineservice.command.CommandContext;
import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.command.GameCommand;
import com.questhub.engineservice.command.ValidationResult;
import com.questhub.engineservice.domain.constants.EngineMessages;

/**
 * 战斗行动命令的公共流程：
 * 1) 校验处于玩家回合且轮到该角色；
 * 2) 同步角色资源（已扣除消耗）到玩家方参与者；
 * 3) 结算玩家行动 → 推进回合 → 连续结算敌人回合直到再次轮到玩家；
 * 4) 收尾（奖励 / 阵亡 / 清除战斗）。
 * 战斗中的行动都不可撤销。
 */
public abstract class AbstractCombatActionCommand implements GameCommand {

    protected final CombatManager combatManager;
    protected final CombatSettlement settlement;

    protected AbstractCombatActionCommand(CombatManager combatManager, CombatSettlement settlement) {
        this.combatManager = combatManager;
        this.settlement = settlement;
    }

    /**
     * 由子类给出本次行动。
     */
    protected abstract CombatAction buildAction(CommandContext ctx, Combatant player);

    /**
     * 子类的额外校验，此时已确认轮到玩家。
     */
    protected ValidationResult validateAction(CommandContext ctx, CombatSession combat) {
        return ValidationResult.ok();
    }

    @Override
    public ValidationResult validate(CommandContext ctx) {
        CombatSession combat = ctx.getState().getCombat();
        if (combat == null) {
            return ValidationResult.fail(EngineMessages.NOT_IN_COMBAT);
        }
        if (!CombatSettlement.isCharactersTurn(combat, ctx.character())) {
            return ValidationResult.fail(EngineMessages.NOT_PLAYER_TURN);
        }
        return validateAction(ctx, combat);
    }

    @Override
    public CommandResult execute(CommandContext ctx) {
        CombatSession combat = ctx.getState().getCombat();
        int logFrom = combat.getLog().size();
        Combatant player = combat.getCurrentCombatant();
        CombatManager.syncFromCharacter(ctx.character(), player);

        combatManager.applyAction(combat, buildAction(ctx, player), ctx.getDice());
        if (!combat.isResolved()) {
            combatManager.advanceTurn(combat);
            combatManager.runEnemyTurns(combat, ctx.getDice());
        }

        CommandResult.CommandResultBuilder result = CommandResult.builder()
                .success(true)
                .message(definition().getDisplayName());
        settlement.settle(ctx, logFrom, result);
        return result.build();
    }

    @Override
    public boolean isUndoable(CommandContext ctx) {
        return false;
    }
}
