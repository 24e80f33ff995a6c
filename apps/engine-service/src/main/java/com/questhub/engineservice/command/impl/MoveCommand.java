package com.questhub.engineservice.command.impl;

import com.questhub.engineservice.command.CommandContext;
import com.questhub.engineservice.command.CommandCost;
import com.questhub.engineservice.command.CommandDefinition;
import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.command.CommandType;
import com.questhub.engineservice.command.GameCommand;
import com.questhub.engineservice.command.ValidationResult;
import com.questhub.engineservice.domain.constants.EngineMessages;
import com.questhub.engineservice.domain.enums.Direction;
import com.questhub.engineservice.domain.enums.GamePhase;
import com.questhub.engineservice.domain.enums.LogType;
import com.questhub.engineservice.domain.model.CharacterState;
import com.questhub.engineservice.domain.model.LocationState;
import com.questhub.engineservice.domain.model.LogEntry;
import com.questhub.engineservice.domain.model.StatusEffect;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 移动：direction（north/south/east/west）+ distance（1-10，默认 1）。
 * 体力消耗 = max(1, distance*2 - floor((敏捷-10)/5))。
 */
@Component
public class MoveCommand implements GameCommand {

    static final int MAX_DISTANCE = 10;

    private static final CommandDefinition DEFINITION = CommandDefinition.builder()
            .displayName("移动")
            .description("向指定方向移动若干格")
            .requiredParam("direction")
            .allowedPhase(GamePhase.EXPLORATION)
            .build();

    @Override
    public CommandType type() {
        return CommandType.MOVE;
    }

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    public ValidationResult validate(CommandContext ctx) {
        List<String> reasons = new ArrayList<>();
        if (Direction.parse(ctx.stringParam("direction")).isEmpty()) {
            reasons.add(EngineMessages.formatInvalidDirection(ctx.stringParam("direction")));
        }
        Integer distance = ctx.intParam("distance", 1);
        if (distance == null || distance < 1 || distance > MAX_DISTANCE) {
            reasons.add(EngineMessages.formatInvalidDistance(ctx.getParameters().get("distance")));
        }
        CharacterState c = ctx.character();
        if (c.hasStatus(StatusEffect.STUNNED) || c.hasStatus(StatusEffect.ROOTED)) {
            reasons.add(EngineMessages.MOVEMENT_IMPAIRED);
        }
        return ValidationResult.of(reasons);
    }

    @Override
    public CommandCost cost(CommandContext ctx) {
        int distance = ctx.intParam("distance", 1);
        int dex = ctx.character().getAttributes().getDexterity();
        return CommandCost.ofStamina(Math.max(1, distance * 2 - Math.floorDiv(dex - 10, 5)));
    }

    @Override
    public CommandResult execute(CommandContext ctx) {
        Direction dir = Direction.parse(ctx.stringParam("direction")).orElseThrow();
        int distance = ctx.intParam("distance", 1);
        LocationState loc = ctx.getState().getLocation();
        loc.setX(loc.getX() + dir.dx() * distance);
        loc.setY(loc.getY() + dir.dy() * distance);

        String msg = EngineMessages.formatMoved(dir.name().toLowerCase(Locale.ROOT), distance, loc.getX(), loc.getY());
        return CommandResult.builder()
                .success(true)
                .message(msg)
                .logEntry(LogEntry.of(LogType.EXPLORATION, ctx.character().getId(), msg))
                .build();
    }
}
