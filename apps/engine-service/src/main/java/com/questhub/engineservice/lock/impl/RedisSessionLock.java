package com.questhub.engineservice.lock.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questhub.engineservice.common.error.LockBusyException;
import com.questhub.engineservice.common.error.LockNotHeldException;
import com.questhub.engineservice.config.EngineProperties;
import com.questhub.engineservice.infrastructure.redis.RedisKeys;
import com.questhub.engineservice.infrastructure.redis.RedisOps;
import com.questhub.engineservice.lock.AbstractSessionLock;
import com.questhub.engineservice.lock.SessionLockInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * RedisSessionLock
 * -------------------------------------------------------
 * 基于 Redis 的分布式会话锁（默认实现）。
 * - 获取：SET key {lockInfo JSON} NX PX ttl，键过期即自动释放；
 * - 释放：Lua 脚本比较 lockId 后 DEL，避免误删他人锁；
 * - 强制释放：直接 DEL。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "questhub.engine", name = "lock-store", havingValue = "redis", matchIfMissing = true)
public class RedisSessionLock extends AbstractSessionLock {

    /**
     * 令牌匹配才删除。
     * 返回：1 删除成功；0 令牌不匹配；-1 锁不存在。
     */
    static final String RELEASE_SCRIPT =
            "local v = redis.call('GET', KEYS[1]) " +
            "if not v then return -1 end " +
            "local ok, rec = pcall(cjson.decode, v) " +
            "if ok and type(rec) == 'table' and rec['lockId'] == ARGV[1] then " +
            "  return redis.call('DEL', KEYS[1]) " +
            "end " +
            "return 0";

    private final RedisOps ops;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    /** 当前节点标识，写入锁记录便于排查 */
    private final String nodeId;

    public RedisSessionLock(RedisOps ops,
                            ObjectMapper objectMapper,
                            EngineProperties props,
                            Clock clock,
                            @Value("${instance.id:${spring.application.name:engine-service}-${random.value}}") String nodeId) {
        super(props);
        this.ops = ops;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.nodeId = nodeId;
    }

    @Override
    public String acquire(String sessionId, Duration ttl) {
        String key = RedisKeys.sessionLock(sessionId);
        long now = clock.millis();
        SessionLockInfo info = new SessionLockInfo(UUID.randomUUID().toString(), nodeId, now, now + ttl.toMillis());
        String payload = toJson(info);

        // 1) SET NX PX
        if (ops.setStringNx(key, payload, ttl)) {
            return info.getLockId();
        }

        // 2) 键仍在但记录已过期（如时钟漂移、TTL 未生效）：按旧令牌比较删除后重试一次
        Optional<SessionLockInfo> existing = getRawLockInfo(key);
        if (existing.isPresent() && existing.get().isExpiredAt(now)) {
            Long r = ops.evalString(RELEASE_SCRIPT, List.of(key), existing.get().getLockId());
            if (r != null && r == 1L && ops.setStringNx(key, payload, ttl)) {
                log.info("会话锁已过期，接管成功: sessionId={}, previousOwner={}", sessionId, existing.get().getOwner());
                return info.getLockId();
            }
        }
        log.debug("会话锁被占用: sessionId={}, holder={}", sessionId, existing.map(SessionLockInfo::getOwner).orElse(null));
        throw new LockBusyException(sessionId);
    }

    @Override
    public void release(String sessionId, String token) {
        Long r = ops.evalString(RELEASE_SCRIPT, List.of(RedisKeys.sessionLock(sessionId)), token);
        if (r == null || r != 1L) {
            throw new LockNotHeldException(sessionId);
        }
    }

    @Override
    public boolean isLocked(String sessionId) {
        return getLockInfo(sessionId).isPresent();
    }

    @Override
    public Optional<SessionLockInfo> getLockInfo(String sessionId) {
        long now = clock.millis();
        return getRawLockInfo(RedisKeys.sessionLock(sessionId)).filter(i -> !i.isExpiredAt(now));
    }

    @Override
    public boolean forceRelease(String sessionId) {
        long n = ops.del(RedisKeys.sessionLock(sessionId));
        log.warn("强制释放会话锁: sessionId={}, existed={}", sessionId, n > 0);
        return n > 0;
    }

    private Optional<SessionLockInfo> getRawLockInfo(String key) {
        String json = ops.getString(key);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, SessionLockInfo.class));
        } catch (JsonProcessingException e) {
            // 非本服务写入的值，按被占用处理，不解析
            log.warn("会话锁记录无法解析: key={}", key);
            return Optional.of(new SessionLockInfo(null, null, 0, Long.MAX_VALUE));
        }
    }

    private String toJson(SessionLockInfo info) {
        try {
            return objectMapper.writeValueAsString(info);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("LOCK_SERIALIZE_FAILED", e);
        }
    }
}
