package com.questhub.engineservice.command;

/**
 * 命令能力接口：{类型, 定义, 校验, 消耗, 执行, 是否可撤销}。
 * 实现应当无状态，每次调用通过 {@link CommandContext} 获得数据。
 */
public interface GameCommand {

    CommandType type();

    CommandDefinition definition();

    /**
     * 命令特有的校验（通用校验由 CommandValidator 完成）。不得修改上下文状态。
     */
    default ValidationResult validate(CommandContext ctx) {
        return ValidationResult.ok();
    }

    /**
     * 基础消耗。
     */
    default CommandCost cost(CommandContext ctx) {
        return CommandCost.NONE;
    }

    /**
     * 在工作副本上执行效果。消耗已由调用方扣除。
     */
    CommandResult execute(CommandContext ctx);

    /**
     * 本次调用能否撤销。默认取定义，个别命令随上下文变化（如战斗中施法）。
     */
    default boolean isUndoable(CommandContext ctx) {
        return definition().isUndoable();
    }
}
