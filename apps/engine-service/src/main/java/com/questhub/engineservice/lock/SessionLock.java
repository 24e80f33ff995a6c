package com.questhub.engineservice.lock;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * SessionLock
 * -------------------------------------------------------
 * 按会话ID的互斥锁。任一时刻每个会话至多一个未过期的持有者。
 * - 获取失败立即抛出 LockBusyException，不排队；
 * - 每把锁都带 TTL，持有者崩溃后自动失效；
 * - forceRelease 供运维使用，跳过令牌校验。
 */
public interface SessionLock {

    /**
     * 以默认 TTL 获取锁。
     *
     * @return 持有令牌
     * @throws com.questhub.engineservice.common.error.LockBusyException 已被其他持有者占用
     */
    String acquire(String sessionId);

    String acquire(String sessionId, Duration ttl);

    /**
     * 释放锁，令牌必须与当前持有者一致。
     *
     * @throws com.questhub.engineservice.common.error.LockNotHeldException 令牌不匹配或锁已过期
     */
    void release(String sessionId, String token);

    boolean isLocked(String sessionId);

    Optional<SessionLockInfo> getLockInfo(String sessionId);

    /**
     * 强制释放（不校验令牌）。
     *
     * @return 释放前是否存在锁
     */
    boolean forceRelease(String sessionId);

    /**
     * 持锁执行：获取 → 执行 → finally 释放。释放失败只记录日志，不覆盖执行结果。
     */
    <T> T withLock(String sessionId, Duration ttl, Supplier<T> action);
}
