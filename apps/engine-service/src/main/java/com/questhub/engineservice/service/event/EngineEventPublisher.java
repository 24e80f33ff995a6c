package com.questhub.engineservice.service.event;

import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.command.CommandType;
import com.questhub.engineservice.common.error.EngineException;
import com.questhub.engineservice.domain.model.GameSession;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 引擎自己持有的监听器列表。单个监听器抛错只记录日志，不影响其他监听器和调用方。
 */
@Slf4j
public class EngineEventPublisher {

    private final List<EngineEventListener> listeners = new CopyOnWriteArrayList<>();

    public void add(EngineEventListener listener) {
        listeners.add(listener);
    }

    public void remove(EngineEventListener listener) {
        listeners.remove(listener);
    }

    public void sessionCreated(GameSession session) {
        fire("onSessionCreated", l -> l.onSessionCreated(session));
    }

    public void commandExecuted(String sessionId, CommandType type, CommandResult result) {
        fire("onCommandExecuted", l -> l.onCommandExecuted(sessionId, type, result));
    }

    public void commandFailed(String sessionId, CommandType type, EngineException error) {
        fire("onCommandFailed", l -> l.onCommandFailed(sessionId, type, error));
    }

    private void fire(String event, Consumer<EngineEventListener> call) {
        for (EngineEventListener l : listeners) {
            try {
                call.accept(l);
            } catch (RuntimeException e) {
                log.error("引擎事件监听器异常: event={}, listener={}", event, l.getClass().getSimpleName(), e);
            }
        }
    }
}
