package com.questhub.engineservice.command.impl;

import com.questhub.engineservice.application.ai.NarrativeService;
import com.questhub.engineservice.command.CommandContext;
import com.questhub.engineservice.command.GameCommand;
import com.questhub.engineservice.command.ValidationResult;
import com.questhub.engineservice.config.EngineProperties;
import com.questhub.engineservice.domain.constants.EngineMessages;

/**
 * 调用 AI 服务的命令基类。AI 关闭时校验失败；远程调用的异常直接抛出，由命令管线包装。
 */
public abstract class AbstractAiCommand implements GameCommand {

    protected final NarrativeService narrativeService;
    private final EngineProperties properties;

    protected AbstractAiCommand(NarrativeService narrativeService, EngineProperties properties) {
        this.narrativeService = narrativeService;
        this.properties = properties;
    }

    @Override
    public ValidationResult validate(CommandContext ctx) {
        return properties.isAiEnabled() ? ValidationResult.ok() : ValidationResult.fail(EngineMessages.AI_DISABLED);
    }
}
