package com.questhub.engineservice.command.impl;

import com.questhub.engineservice.command.CommandContext;
import com.questhub.engineservice.command.CommandDefinition;
import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.command.CommandType;
import com.questhub.engineservice.command.GameCommand;
import com.questhub.engineservice.domain.constants.EngineMessages;
import com.questhub.engineservice.domain.enums.GamePhase;
import com.questhub.engineservice.domain.enums.LogType;
import com.questhub.engineservice.domain.model.CharacterState;
import com.questhub.engineservice.domain.model.LogEntry;
import org.springframework.stereotype.Component;

/**
 * 休息：恢复各项资源最大值的 25%，冷却 60 秒。
 */
@Component
public class RestCommand implements GameCommand {

    private static final CommandDefinition DEFINITION = CommandDefinition.builder()
            .displayName("休息")
            .description("原地休整，恢复生命、法力与体力")
            .cooldownMs(60_000)
            .allowedPhase(GamePhase.EXPLORATION)
            .allowedPhase(GamePhase.REST)
            .build();

    @Override
    public CommandType type() {
        return CommandType.REST;
    }

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    public CommandResult execute(CommandContext ctx) {
        CharacterState c = ctx.character();
        int hp = restore(c.getHealth(), c.getMaxHealth());
        int mana = restore(c.getMana(), c.getMaxMana());
        int stamina = restore(c.getStamina(), c.getMaxStamina());
        c.setHealth(c.getHealth() + hp);
        c.setMana(c.getMana() + mana);
        c.setStamina(c.getStamina() + stamina);

        String msg = EngineMessages.formatRested(hp, mana, stamina);
        return CommandResult.builder()
                .success(true)
                .message(msg)
                .logEntry(LogEntry.of(LogType.EXPLORATION, c.getId(), msg))
                .build();
    }

    private static int restore(int current, int max) {
        return Math.min(max - current, max / 4);
    }
}
