package com.questhub.engineservice.command.impl;

import com.questhub.engineservice.application.ai.NarrativeService;
import com.questhub.engineservice.command.CommandContext;
import com.questhub.engineservice.command.CommandCost;
import com.questhub.engineservice.command.CommandDefinition;
import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.command.CommandType;
import com.questhub.engineservice.config.EngineProperties;
import com.questhub.engineservice.domain.constants.EngineMessages;
import com.questhub.engineservice.domain.enums.GamePhase;
import com.questhub.engineservice.domain.enums.LogType;
import com.questhub.engineservice.domain.model.LogEntry;
import com.questhub.engineservice.infrastructure.client.ai.ImageRequest;
import org.springframework.stereotype.Component;

/**
 * 生成当前场景的插画。冷却 10 秒，消耗 5 法力。
 */
@Component
public class GenerateImageCommand extends AbstractAiCommand {

    private static final CommandDefinition DEFINITION = CommandDefinition.builder()
            .displayName("生成插画")
            .description("为当前场景生成一张插画")
            .cooldownMs(10_000)
            .allowedPhase(GamePhase.EXPLORATION)
            .allowedPhase(GamePhase.COMBAT)
            .allowedPhase(GamePhase.DIALOGUE)
            .allowedPhase(GamePhase.REST)
            .allowedPhase(GamePhase.CUTSCENE)
            .build();

    public GenerateImageCommand(NarrativeService narrativeService, EngineProperties properties) {
        super(narrativeService, properties);
    }

    @Override
    public CommandType type() {
        return CommandType.GENERATE_IMAGE;
    }

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    public CommandCost cost(CommandContext ctx) {
        return CommandCost.ofMana(5);
    }

    @Override
    public CommandResult execute(CommandContext ctx) {
        String prompt = ctx.stringParam("prompt", ctx.getState().getLocation().getLocationId());
        String url = narrativeService.generateImage(new ImageRequest(ctx.getSessionId(), prompt, ctx.getNarrativeStyle()));
        ctx.getState().getLocation().setLastImageUrl(url);
        return CommandResult.builder()
                .success(true)
                .message(EngineMessages.IMAGE_GENERATED)
                .logEntry(LogEntry.of(LogType.NARRATIVE, ctx.character().getId(), EngineMessages.IMAGE_GENERATED))
                .extra("imageUrl", url)
                .build();
    }
}
