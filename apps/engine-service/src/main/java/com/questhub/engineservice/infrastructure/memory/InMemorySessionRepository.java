package com.questhub.engineservice.infrastructure.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questhub.engineservice.domain.model.GameSession;
import com.questhub.engineservice.domain.repository.SessionRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内会话仓储（questhub.engine.persistence-enabled=false）。
 * 与 Redis 实现一样按 JSON 存取，读出的对象与内存中的会话互不共享引用。
 * 不处理 TTL。
 */
@Repository
@ConditionalOnProperty(prefix = "questhub.engine", name = "persistence-enabled", havingValue = "false")
public class InMemorySessionRepository implements SessionRepository {

    private final Map<String, String> sessions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> userIndex = new ConcurrentHashMap<>();
    private final ObjectMapper mapper;

    public InMemorySessionRepository() {
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public void save(GameSession session, Duration ttl) {
        sessions.put(session.getSessionId(), write(session));
        userIndex.computeIfAbsent(session.getUserId(), k -> ConcurrentHashMap.newKeySet()).add(session.getSessionId());
    }

    @Override
    public Optional<GameSession> findById(String sessionId) {
        String json = sessions.get(sessionId);
        return json == null ? Optional.empty() : Optional.of(read(json));
    }

    @Override
    public void delete(String sessionId, String userId) {
        sessions.remove(sessionId);
        if (userId != null) {
            userIndex.getOrDefault(userId, Collections.emptySet()).remove(sessionId);
        }
    }

    @Override
    public Set<String> findIdsByUser(String userId) {
        return Set.copyOf(userIndex.getOrDefault(userId, Collections.emptySet()));
    }

    private String write(GameSession session) {
        try {
            return mapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("SESSION_SERIALIZE_FAILED: " + session.getSessionId(), e);
        }
    }

    private GameSession read(String json) {
        try {
            return mapper.readValue(json, GameSession.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("SESSION_DESERIALIZE_FAILED", e);
        }
    }
}
