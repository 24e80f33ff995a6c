package com.questhub.engineservice.application.session;

import com.questhub.engineservice.common.error.LockBusyException;
import com.questhub.engineservice.config.EngineProperties;
import com.questhub.engineservice.domain.model.GameSession;
import com.questhub.engineservice.lock.SessionLock;
import com.questhub.engineservice.lock.impl.LocalSessionLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * 后台维护任务：自动保存、清理不活跃会话、清理本地过期锁。
 * 每个会话都在短时持锁下读取，正在执行命令的会话本轮跳过。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionMaintenance {

    private final SessionCache cache;
    private final SessionLock sessionLock;
    private final EngineProperties properties;
    private final Clock clock;

    /**
     * 保存有未落盘修改且开启了自动保存的会话。
     *
     * @return 保存成功的数量
     */
    public int autoSave() {
        int saved = 0;
        int busy = 0;
        for (GameSession s : cache.all()) {
            if (!s.hasUnsavedChanges() || !s.getSettings().isAutoSave()) {
                continue;
            }
            try {
                if (underShortLock(s, () -> cache.persist(s, clock.millis()))) {
                    saved++;
                }
            } catch (LockBusyException e) {
                busy++;
            }
        }
        if (saved > 0 || busy > 0) {
            log.info("自动保存完成: saved={}, busySkipped={}", saved, busy);
        }
        return saved;
    }

    /**
     * 清理超过 inactiveTimeoutMinutes 没有活动的会话：先保存，再移出内存。
     *
     * @return 移出的数量
     */
    public int cleanupInactive() {
        long deadline = clock.millis() - Duration.ofMinutes(properties.getInactiveTimeoutMinutes()).toMillis();
        int evicted = 0;
        for (GameSession s : cache.all()) {
            if (s.getLastActivity() >= deadline) {
                continue;
            }
            try {
                boolean done = underShortLock(s, () -> {
                    if (s.hasUnsavedChanges() && !cache.persist(s, clock.millis())) {
                        return false;
                    }
                    cache.evict(s.getSessionId());
                    return true;
                });
                if (done) {
                    evicted++;
                }
            } catch (LockBusyException e) {
                log.debug("会话正忙，本轮不清理: sessionId={}", s.getSessionId());
            }
        }
        if (evicted > 0) {
            log.info("清理不活跃会话: evicted={}, remaining={}", evicted, cache.size());
        }
        return evicted;
    }

    /**
     * 本地锁存储需要主动清理过期记录；Redis 依赖键 TTL。
     */
    public int cleanupExpiredLocks() {
        if (sessionLock instanceof LocalSessionLock local) {
            return local.cleanupExpired();
        }
        return 0;
    }

    /**
     * 停机时保存所有未落盘的会话。忙碌的会话记录告警后跳过。
     */
    public int saveAll() {
        int saved = 0;
        for (GameSession s : cache.all()) {
            if (!s.hasUnsavedChanges()) {
                continue;
            }
            try {
                if (underShortLock(s, () -> cache.persist(s, clock.millis()))) {
                    saved++;
                }
            } catch (LockBusyException e) {
                log.warn("停机保存时会话仍被占用，跳过: sessionId={}", s.getSessionId());
            }
        }
        return saved;
    }

    private boolean underShortLock(GameSession s, Supplier<Boolean> action) {
        return sessionLock.withLock(s.getSessionId(), Duration.ofMillis(properties.getSnapshotLockTtlMillis()), action);
    }
}
