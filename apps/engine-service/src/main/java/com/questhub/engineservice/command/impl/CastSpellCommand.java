package com.questhub.engineservice.command.impl;

import com.questhub.engineservice.combat.CombatAction;
import com.questhub.engineservice.combat.CombatCalculator;
import com.questhub.engineservice.combat.CombatManager;
import com.questhub.engineservice.combat.Combatant;
import com.questhub.engineservice.command.CommandContext;
import com.questhub.engineservice.command.CommandCost;
import com.questhub.engineservice.command.CommandDefinition;
import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.command.CommandType;
import com.questhub.engineservice.command.ValidationResult;
import com.questhub.engineservice.domain.constants.EngineMessages;
import com.questhub.engineservice.domain.enums.GamePhase;
import com.questhub.engineservice.domain.enums.LogType;
import com.questhub.engineservice.domain.model.CharacterState;
import com.questhub.engineservice.domain.model.LogEntry;
import org.springframework.stereotype.Component;

/**
 * 施法。目前只有 heal：消耗 10 法力，恢复 25 + 智慧加成 的生命。
 * 探索中是普通可撤销命令；战斗中作为玩家行动结算，敌人随后行动，不可撤销。
 */
@Component
public class CastSpellCommand extends AbstractCombatActionCommand {

    static final String HEAL = "heal";
    static final int MANA_COST = 10;

    private static final CommandDefinition DEFINITION = CommandDefinition.builder()
            .displayName("施法")
            .description("施放法术（heal）")
            .allowedPhase(GamePhase.EXPLORATION)
            .allowedPhase(GamePhase.COMBAT)
            .build();

    private final CombatCalculator calculator;

    public CastSpellCommand(CombatManager combatManager, CombatSettlement settlement, CombatCalculator calculator) {
        super(combatManager, settlement);
        this.calculator = calculator;
    }

    @Override
    public CommandType type() {
        return CommandType.CAST_SPELL;
    }

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    public ValidationResult validate(CommandContext ctx) {
        String spellId = ctx.stringParam("spellId", HEAL);
        if (!HEAL.equals(spellId)) {
            return ValidationResult.fail(EngineMessages.formatUnknownSpell(spellId));
        }
        return inCombat(ctx) ? super.validate(ctx) : ValidationResult.ok();
    }

    @Override
    public CommandCost cost(CommandContext ctx) {
        return CommandCost.ofMana(MANA_COST);
    }

    @Override
    public CommandResult execute(CommandContext ctx) {
        if (inCombat(ctx)) {
            return super.execute(ctx);
        }
        CharacterState c = ctx.character();
        int before = c.getHealth();
        c.setHealth(Math.min(c.getMaxHealth(), before + calculator.healAmount(CombatManager.fromCharacter(c))));
        String msg = EngineMessages.formatHealed(c.getName(), c.getHealth() - before);
        return CommandResult.builder()
                .success(true)
                .message(msg)
                .logEntry(LogEntry.of(LogType.EXPLORATION, c.getId(), msg))
                .build();
    }

    @Override
    protected CombatAction buildAction(CommandContext ctx, Combatant player) {
        return CombatAction.heal(player.getId());
    }

    @Override
    public boolean isUndoable(CommandContext ctx) {
        return !inCombat(ctx);
    }

    private static boolean inCombat(CommandContext ctx) {
        return ctx.getState().getCombat() != null;
    }
}
