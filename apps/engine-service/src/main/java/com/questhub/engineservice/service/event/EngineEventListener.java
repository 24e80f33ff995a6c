package com.questhub.engineservice.service.event;

import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.command.CommandType;
import com.questhub.engineservice.common.error.EngineException;
import com.questhub.engineservice.domain.model.GameSession;

/**
 * 引擎事件回调。回调在命令线程上、会话锁释放之后同步调用，实现不应阻塞。
 */
public interface EngineEventListener {

    default void onSessionCreated(GameSession session) {
    }

    default void onCommandExecuted(String sessionId, CommandType type, CommandResult result) {
    }

    default void onCommandFailed(String sessionId, CommandType type, EngineException error) {
    }
}
