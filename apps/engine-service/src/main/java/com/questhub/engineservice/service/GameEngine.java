package com.questhub.engineservice.service;

import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.command.CommandType;
import com.questhub.engineservice.domain.model.GameSession;
import com.questhub.engineservice.domain.model.SessionSettings;
import com.questhub.engineservice.lock.SessionLockInfo;
import com.questhub.engineservice.service.event.EngineEventListener;
import com.questhub.engineservice.service.metrics.MetricsSnapshot;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 会话命令引擎：会话生命周期、持锁执行命令、撤销 / 重做、指标。
 */
public interface GameEngine {

    /**
     * 新建会话。角色不存在时按 characterId 创建默认角色。
     *
     * @param characterName 新建角色时使用的名称，可为空
     */
    GameSession createSession(String userId, String characterId, String characterName, SessionSettings settings);

    default GameSession createSession(String userId, String characterId, SessionSettings settings) {
        return createSession(userId, characterId, null, settings);
    }

    /** 只读获取会话；不存在时抛 SessionNotFoundException */
    GameSession getSession(String sessionId);

    List<GameSession> getUserSessions(String userId);

    /**
     * 执行一条命令：获取会话锁 → 加载 → 校验 / 计费 / 冷却 → 执行 → 提交 → 保存 → 释放锁。
     */
    CommandResult executeCommand(String sessionId, CommandType type, Map<String, Object> parameters, String userId);

    CommandResult undoCommand(String sessionId, String userId);

    CommandResult redoCommand(String sessionId, String userId);

    /** 结束会话：保存角色，删除会话 */
    void endSession(String sessionId, String userId);

    boolean isSessionLocked(String sessionId);

    Optional<SessionLockInfo> getSessionLockInfo(String sessionId);

    /** 运维用：强制释放会话锁 */
    boolean forceReleaseSessionLock(String sessionId);

    MetricsSnapshot getMetrics();

    void addListener(EngineEventListener listener);

    void removeListener(EngineEventListener listener);

    /** 停止后台任务，保存所有内存会话并清空缓存 */
    void shutdown();
}
