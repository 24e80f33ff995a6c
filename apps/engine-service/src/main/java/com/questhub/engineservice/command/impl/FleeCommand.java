package com.questhub.engineservice.command.impl;

import com.questhub.engineservice.combat.CombatAction;
import com.questhub.engineservice.combat.CombatManager;
import com.questhub.engineservice.combat.CombatSession;
import com.questhub.engineservice.combat.Combatant;
import com.questhub.engineservice.command.CommandContext;
import com.questhub.engineservice.command.CommandCost;
import com.questhub.engineservice.command.CommandDefinition;
import com.questhub.engineservice.command.CommandType;
import com.questhub.engineservice.command.ValidationResult;
import com.questhub.engineservice.domain.constants.EngineMessages;
import com.questhub.engineservice.domain.enums.GamePhase;
import org.springframework.stereotype.Component;

/**
 * 逃跑：仅在允许逃跑的战斗中可用，成功率 40%。消耗 10 体力。
 */
@Component
public class FleeCommand extends AbstractCombatActionCommand {

    private static final CommandDefinition DEFINITION = CommandDefinition.builder()
            .displayName("逃跑")
            .description("尝试脱离战斗")
            .allowedPhase(GamePhase.COMBAT)
            .undoable(false)
            .build();

    public FleeCommand(CombatManager combatManager, CombatSettlement settlement) {
        super(combatManager, settlement);
    }

    @Override
    public CommandType type() {
        return CommandType.FLEE;
    }

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    protected ValidationResult validateAction(CommandContext ctx, CombatSession combat) {
        return combat.isCanFlee() ? ValidationResult.ok() : ValidationResult.fail(EngineMessages.CANNOT_FLEE);
    }

    @Override
    public CommandCost cost(CommandContext ctx) {
        return CommandCost.ofStamina(10);
    }

    @Override
    protected CombatAction buildAction(CommandContext ctx, Combatant player) {
        return CombatAction.flee(player.getId());
    }
}
