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

import java.util.Optional;

/**
 * 攻击：targetId 可选，缺省时攻击行动顺序中第一个在场的敌人。消耗 5 体力。
 */
@Component
public class AttackCommand extends AbstractCombatActionCommand {

    static final int STAMINA_COST = 5;

    private static final CommandDefinition DEFINITION = CommandDefinition.builder()
            .displayName("攻击")
            .description("对一名敌人发起普通攻击")
            .allowedPhase(GamePhase.COMBAT)
            .undoable(false)
            .build();

    public AttackCommand(CombatManager combatManager, CombatSettlement settlement) {
        super(combatManager, settlement);
    }

    @Override
    public CommandType type() {
        return CommandType.ATTACK;
    }

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    protected ValidationResult validateAction(CommandContext ctx, CombatSession combat) {
        if (resolveTarget(ctx, combat).isEmpty()) {
            return ValidationResult.fail(EngineMessages.formatUnknownTarget(ctx.stringParam("targetId")));
        }
        return ValidationResult.ok();
    }

    @Override
    public CommandCost cost(CommandContext ctx) {
        return CommandCost.ofStamina(STAMINA_COST);
    }

    @Override
    protected CombatAction buildAction(CommandContext ctx, Combatant player) {
        Combatant target = resolveTarget(ctx, ctx.getState().getCombat()).orElseThrow();
        return CombatAction.attack(player.getId(), target.getId());
    }

    private Optional<Combatant> resolveTarget(CommandContext ctx, CombatSession combat) {
        String targetId = ctx.stringParam("targetId");
        if (targetId == null || targetId.isBlank()) {
            return combat.getEnemies().stream().filter(Combatant::isActive).findFirst();
        }
        return combat.find(targetId).filter(c -> !c.isPlayer() && c.isActive());
    }
}
