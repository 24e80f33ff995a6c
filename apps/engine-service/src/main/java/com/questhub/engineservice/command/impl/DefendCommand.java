package com.questhub.engineservice.command.impl;

import com.questhub.engineservice.combat.CombatAction;
import com.questhub.engineservice.combat.CombatManager;
import com.questhub.engineservice.combat.Combatant;
import com.questhub.engineservice.command.CommandContext;
import com.questhub.engineservice.command.CommandCost;
import com.questhub.engineservice.command.CommandDefinition;
import com.questhub.engineservice.command.CommandType;
import com.questhub.engineservice.domain.enums.GamePhase;
import org.springframework.stereotype.Component;

/**
 * 防御：直到自己下个回合开始前，受到的命中率 -15、伤害减半。消耗 3 体力。
 */
@Component
public class DefendCommand extends AbstractCombatActionCommand {

    private static final CommandDefinition DEFINITION = CommandDefinition.builder()
            .displayName("防御")
            .description("摆出防御姿态")
            .allowedPhase(GamePhase.COMBAT)
            .undoable(false)
            .build();

    public DefendCommand(CombatManager combatManager, CombatSettlement settlement) {
        super(combatManager, settlement);
    }

    @Override
    public CommandType type() {
        return CommandType.DEFEND;
    }

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    public CommandCost cost(CommandContext ctx) {
        return CommandCost.ofStamina(3);
    }

    @Override
    protected CombatAction buildAction(CommandContext ctx, Combatant player) {
        return CombatAction.defend(player.getId());
    }
}
