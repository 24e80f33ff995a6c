package com.questhub.engineservice.domain.repository;

import com.questhub.engineservice.domain.model.GameSession;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * 会话仓储：按会话ID点查与覆盖写入，并维护用户 → 会话ID 索引。
 */
public interface SessionRepository {

    /**
     * 保存会话（覆盖写入），同时登记到所属用户的索引。
     */
    void save(GameSession session, Duration ttl);

    Optional<GameSession> findById(String sessionId);

    /**
     * 删除会话并从用户索引中移除。
     */
    void delete(String sessionId, String userId);

    Set<String> findIdsByUser(String userId);
}
