package com.questhub.engineservice.common.error;

import com.questhub.engineservice.domain.constants.EngineMessages;

/**
 * 命令执行阶段的失败（例如 AI 服务调用失败），保留原始异常作为 cause。
 * 工作副本随之丢弃，不会提交任何部分修改。
 */
public class CommandExecutionException extends EngineException {

    public CommandExecutionException(String commandType, Throwable cause) {
        super(EngineErrorCode.COMMAND_EXECUTION_ERROR, EngineMessages.formatCommandFailed(commandType), null, cause);
    }
}
