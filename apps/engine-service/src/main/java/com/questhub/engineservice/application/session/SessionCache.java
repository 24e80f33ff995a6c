package com.questhub.engineservice.application.session;

import com.questhub.engineservice.common.error.SessionNotFoundException;
import com.questhub.engineservice.config.EngineProperties;
import com.questhub.engineservice.domain.model.GameSession;
import com.questhub.engineservice.domain.repository.SessionRepository;
import com.questhub.engineservice.service.metrics.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SessionCache
 * -------------------------------------------------------
 * 本实例内存中的会话 + 仓储读穿。
 * - 读路径（不持锁）：优先内存，未命中时从仓储加载；
 * - 写路径（持锁）：{@link #loadForUpdate} 以仓储为准比较 version，
 *   其他实例提交过的会话会替换掉本地旧副本。本地副本只有在已落盘且版本一致，
 *   或者确实更新且尚未落盘时才保留。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionCache {

    private final SessionRepository repository;
    private final EngineProperties properties;
    private final EngineMetrics metrics;

    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();

    public Optional<GameSession> find(String sessionId) {
        GameSession cached = sessions.get(sessionId);
        if (cached != null) {
            metrics.cacheHit();
            return Optional.of(cached);
        }
        metrics.cacheMiss();
        Optional<GameSession> stored = repository.findById(sessionId);
        stored.ifPresent(s -> sessions.putIfAbsent(sessionId, s));
        return stored.map(s -> sessions.getOrDefault(sessionId, s));
    }

    /**
     * 持锁后加载用于修改的会话。
     *
     * @throws SessionNotFoundException 内存与仓储中都没有
     */
    public GameSession loadForUpdate(String sessionId) {
        GameSession cached = sessions.get(sessionId);
        Optional<GameSession> stored = repository.findById(sessionId);
        if (cached != null && (stored.isEmpty() || keepLocal(cached, stored.get()))) {
            metrics.cacheHit();
            return cached;
        }
        metrics.cacheMiss();
        GameSession fresh = stored.orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (cached != null) {
            log.debug("本地会话已过期，按存储刷新: sessionId={}, local={}, stored={}",
                    sessionId, cached.getVersion(), fresh.getVersion());
        }
        sessions.put(sessionId, fresh);
        return fresh;
    }

    /**
     * 版本相同但本地有未落盘修改时，说明本地提交保存失败，而同一版本号可能已被其他实例写入，按仓储为准。
     */
    private static boolean keepLocal(GameSession cached, GameSession stored) {
        if (cached.getVersion() > stored.getVersion()) {
            return cached.hasUnsavedChanges();
        }
        return cached.getVersion() == stored.getVersion() && !cached.hasUnsavedChanges();
    }

    public void put(GameSession session) {
        sessions.put(session.getSessionId(), session);
    }

    public void evict(String sessionId) {
        sessions.remove(sessionId);
    }

    /**
     * 写入仓储。失败只记录日志，会话保持“未保存”状态，交给自动保存重试。
     *
     * @return 是否保存成功
     */
    public boolean persist(GameSession session, long now) {
        long previous = session.getLastSavedAt();
        session.setLastSavedAt(now);
        try {
            repository.save(session, Duration.ofSeconds(properties.getSessionTtlSeconds()));
            return true;
        } catch (RuntimeException e) {
            session.setLastSavedAt(previous);
            log.error("会话保存失败，等待自动保存重试: sessionId={}", session.getSessionId(), e);
            return false;
        }
    }

    public void delete(GameSession session) {
        sessions.remove(session.getSessionId());
        repository.delete(session.getSessionId(), session.getUserId());
    }

    public Collection<GameSession> all() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    public void clear() {
        sessions.clear();
    }
}
