package com.questhub.engineservice.lock.impl;

import com.questhub.engineservice.common.error.LockBusyException;
import com.questhub.engineservice.common.error.LockNotHeldException;
import com.questhub.engineservice.config.EngineProperties;
import com.questhub.engineservice.lock.AbstractSessionLock;
import com.questhub.engineservice.lock.SessionLockInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内会话锁，仅用于单进程部署（questhub.engine.lock-store=local）。
 * 过期判断与 Redis 实现一致：过期记录视为不存在，可被新持有者覆盖。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "questhub.engine", name = "lock-store", havingValue = "local")
public class LocalSessionLock extends AbstractSessionLock {

    private static final String OWNER = "local";

    private final Map<String, SessionLockInfo> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    public LocalSessionLock(EngineProperties props, Clock clock) {
        super(props);
        this.clock = clock;
    }

    @Override
    public String acquire(String sessionId, Duration ttl) {
        long now = clock.millis();
        SessionLockInfo candidate = new SessionLockInfo(UUID.randomUUID().toString(), OWNER, now, now + ttl.toMillis());
        // compute 在同一个 key 上是原子的：仅当无锁或已过期时写入
        SessionLockInfo holder = locks.compute(sessionId,
                (k, cur) -> (cur == null || cur.isExpiredAt(now)) ? candidate : cur);
        if (holder != candidate) {
            log.debug("会话锁被占用: sessionId={}, holder={}", sessionId, holder.getLockId());
            throw new LockBusyException(sessionId);
        }
        return candidate.getLockId();
    }

    @Override
    public void release(String sessionId, String token) {
        long now = clock.millis();
        boolean[] released = {false};
        locks.computeIfPresent(sessionId, (k, cur) -> {
            if (cur.getLockId().equals(token) && !cur.isExpiredAt(now)) {
                released[0] = true;
                return null;
            }
            return cur;
        });
        if (!released[0]) {
            throw new LockNotHeldException(sessionId);
        }
    }

    @Override
    public boolean isLocked(String sessionId) {
        return getLockInfo(sessionId).isPresent();
    }

    @Override
    public Optional<SessionLockInfo> getLockInfo(String sessionId) {
        SessionLockInfo cur = locks.get(sessionId);
        if (cur == null || cur.isExpiredAt(clock.millis())) {
            return Optional.empty();
        }
        return Optional.of(cur);
    }

    @Override
    public boolean forceRelease(String sessionId) {
        SessionLockInfo removed = locks.remove(sessionId);
        log.warn("强制释放会话锁: sessionId={}, holder={}", sessionId, removed == null ? null : removed.getLockId());
        return removed != null;
    }

    /**
     * 清理已过期的锁记录。
     *
     * @return 清理数量
     */
    public int cleanupExpired() {
        long now = clock.millis();
        int before = locks.size();
        locks.entrySet().removeIf(e -> e.getValue().isExpiredAt(now));
        return before - locks.size();
    }
}
