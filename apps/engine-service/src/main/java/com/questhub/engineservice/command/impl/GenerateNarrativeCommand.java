package com.questhub.engineservice.command.impl;

import com.questhub.engineservice.application.ai.NarrativeService;
import com.questhub.engineservice.command.CommandContext;
import com.questhub.engineservice.command.CommandDefinition;
import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.command.CommandType;
import com.questhub.engineservice.config.EngineProperties;
import com.questhub.engineservice.domain.enums.GamePhase;
import com.questhub.engineservice.domain.enums.LogType;
import com.questhub.engineservice.domain.model.LogEntry;
import com.questhub.engineservice.infrastructure.client.ai.NarrativeRequest;
import org.springframework.stereotype.Component;

/**
 * 推进剧情：把角色、地点和最近事件交给 AI 服务，生成的文本写入地点状态和日志。
 */
@Component
public class GenerateNarrativeCommand extends AbstractAiCommand {

    private static final CommandDefinition DEFINITION = CommandDefinition.builder()
            .displayName("推进剧情")
            .description("根据最近发生的事件生成一段叙事")
            .cooldownMs(3_000)
            .allowedPhase(GamePhase.EXPLORATION)
            .allowedPhase(GamePhase.DIALOGUE)
            .allowedPhase(GamePhase.REST)
            .allowedPhase(GamePhase.CUTSCENE)
            .build();

    public GenerateNarrativeCommand(NarrativeService narrativeService, EngineProperties properties) {
        super(narrativeService, properties);
    }

    @Override
    public CommandType type() {
        return CommandType.GENERATE_NARRATIVE;
    }

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    public CommandResult execute(CommandContext ctx) {
        NarrativeRequest request = new NarrativeRequest(
                ctx.getSessionId(),
                ctx.character().getName(),
                ctx.getState().getLocation().getLocationId(),
                ctx.stringParam("prompt"),
                ctx.getNarrativeStyle(),
                ctx.getRecentEvents());
        String text = narrativeService.generateNarrative(request);
        ctx.getState().getLocation().setLastNarrative(text);
        return CommandResult.builder()
                .success(true)
                .message(text)
                .logEntry(LogEntry.of(LogType.NARRATIVE, ctx.character().getId(), text))
                .build();
    }
}
