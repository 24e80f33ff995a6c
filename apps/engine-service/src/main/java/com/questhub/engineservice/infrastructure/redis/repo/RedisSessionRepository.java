package com.questhub.engineservice.infrastructure.redis.repo;

import com.questhub.engineservice.domain.model.GameSession;
import com.questhub.engineservice.domain.repository.SessionRepository;
import com.questhub.engineservice.infrastructure.redis.RedisKeys;
import com.questhub.engineservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * RedisSessionRepository
 * -------------------------------------------------------
 * 会话的 Redis 仓储实现。
 * - questhub:session:{id}            -> GameSession JSON（带 TTL，每次保存续期）
 * - questhub:user:{userId}:sessions  -> Set<sessionId>（与会话同 TTL）
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "questhub.engine", name = "persistence-enabled", havingValue = "true", matchIfMissing = true)
public class RedisSessionRepository implements SessionRepository {

    private final RedisOps ops;

    @Override
    public void save(GameSession session, Duration ttl) {
        ops.setEx(RedisKeys.session(session.getSessionId()), session, ttl);
        String indexKey = RedisKeys.userSessions(session.getUserId());
        ops.sAdd(indexKey, session.getSessionId());
        ops.expire(indexKey, ttl);
    }

    @Override
    public Optional<GameSession> findById(String sessionId) {
        return Optional.ofNullable(ops.get(RedisKeys.session(sessionId), GameSession.class));
    }

    @Override
    public void delete(String sessionId, String userId) {
        ops.del(RedisKeys.session(sessionId));
        if (userId != null) {
            ops.sRem(RedisKeys.userSessions(userId), sessionId);
        }
    }

    @Override
    public Set<String> findIdsByUser(String userId) {
        return ops.sMembers(RedisKeys.userSessions(userId));
    }
}
