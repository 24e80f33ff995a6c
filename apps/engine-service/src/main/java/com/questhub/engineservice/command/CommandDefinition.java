package com.questhub.engineservice.command;

import com.questhub.engineservice.domain.enums.GamePhase;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * 命令的静态定义：展示信息、冷却、等级与参数要求、允许的阶段、是否可撤销。
 */
@Value
@Builder
public class CommandDefinition {
    String displayName;
    String description;
    /** 同一行动者两次执行的最小间隔（毫秒） */
    long cooldownMs;
    @Builder.Default
    int minLevel = 1;
    @Singular
    List<String> requiredParams;
    /** 允许执行的阶段，为空表示不限 */
    @Singular
    Set<GamePhase> allowedPhases;
    @Builder.Default
    boolean requiresAlive = true;
    @Builder.Default
    boolean undoable = true;
}
