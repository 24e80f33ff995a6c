package com.questhub.engineservice.command.impl;

import com.questhub.engineservice.command.CommandContext;
import com.questhub.engineservice.command.CommandDefinition;
import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.command.CommandType;
import com.questhub.engineservice.command.GameCommand;
import com.questhub.engineservice.command.ValidationResult;
import com.questhub.engineservice.domain.constants.EngineMessages;
import com.questhub.engineservice.domain.enums.GamePhase;
import com.questhub.engineservice.domain.enums.LogType;
import com.questhub.engineservice.domain.enums.NotificationType;
import com.questhub.engineservice.domain.model.CharacterState;
import com.questhub.engineservice.domain.model.LogEntry;
import com.questhub.engineservice.domain.model.Notification;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * 复活：仅在阵亡时可用，恢复一半生命并损失 10% 金币。不可撤销。
 */
@Component
public class RespawnCommand implements GameCommand {

    private static final CommandDefinition DEFINITION = CommandDefinition.builder()
            .displayName("复活")
            .description("阵亡后在原地重新站起")
            .requiresAlive(false)
            .undoable(false)
            .build();

    @Override
    public CommandType type() {
        return CommandType.RESPAWN;
    }

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    public ValidationResult validate(CommandContext ctx) {
        return ctx.character().isAlive() ? ValidationResult.fail(EngineMessages.NOT_DEAD) : ValidationResult.ok();
    }

    @Override
    public CommandResult execute(CommandContext ctx) {
        CharacterState c = ctx.character();
        int goldLost = c.getGold() / 10;
        c.setGold(c.getGold() - goldLost);
        c.setHealth(Math.max(1, c.getMaxHealth() / 2));
        c.setStamina(c.getMaxStamina());
        c.setStatusEffects(new ArrayList<>());
        ctx.getState().setCombat(null);
        ctx.getState().setPhase(GamePhase.EXPLORATION);

        String msg = EngineMessages.formatRespawned(c.getHealth(), goldLost);
        return CommandResult.builder()
                .success(true)
                .message(msg)
                .logEntry(LogEntry.of(LogType.SYSTEM, c.getId(), msg))
                .notification(new Notification(NotificationType.INFO, "复活", msg))
                .build();
    }
}
