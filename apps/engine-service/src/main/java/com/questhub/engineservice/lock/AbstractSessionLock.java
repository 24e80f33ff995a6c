package com.questhub.engineservice.lock;

import com.questhub.engineservice.common.error.LockNotHeldException;
import com.questhub.engineservice.config.EngineProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 会话锁公共部分：默认 TTL 与持锁执行模板。
 */
@Slf4j
public abstract class AbstractSessionLock implements SessionLock {

    protected final Duration defaultTtl;

    protected AbstractSessionLock(EngineProperties props) {
        this.defaultTtl = Duration.ofSeconds(props.getLockTtlSeconds());
    }

    @Override
    public String acquire(String sessionId) {
        return acquire(sessionId, defaultTtl);
    }

    @Override
    public <T> T withLock(String sessionId, Duration ttl, Supplier<T> action) {
        String token = acquire(sessionId, ttl);
        try {
            return action.get();
        } finally {
            releaseAfterUse(sessionId, token);
        }
    }

    /**
     * 用后释放：锁已过期（执行时间超过 TTL）时只告警，主流程结果不受影响。
     */
    public void releaseAfterUse(String sessionId, String token) {
        try {
            release(sessionId, token);
        } catch (LockNotHeldException e) {
            log.warn("会话锁已失效，释放跳过: sessionId={}, token={}（执行时间可能超过了锁 TTL）", sessionId, token);
        } catch (RuntimeException e) {
            log.error("释放会话锁失败: sessionId={}, token={}", sessionId, token, e);
        }
    }
}
