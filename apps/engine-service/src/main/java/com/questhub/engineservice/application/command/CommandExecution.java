package com.questhub.engineservice.application.command;

import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.domain.model.GameState;

/**
 * 管线执行成功后的产物：尚未提交的工作副本、命令结果、本次是否可撤销。
 */
public record CommandExecution(GameState workingState, CommandResult result, boolean undoable) {
}
