package com.questhub.engineservice.infrastructure.redis.repo;

import com.questhub.engineservice.domain.model.CharacterState;
import com.questhub.engineservice.domain.repository.CharacterRepository;
import com.questhub.engineservice.infrastructure.redis.RedisKeys;
import com.questhub.engineservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * 角色的 Redis 仓储实现（不设 TTL，角色长期保留）。
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "questhub.engine", name = "persistence-enabled", havingValue = "true", matchIfMissing = true)
public class RedisCharacterRepository implements CharacterRepository {

    private final RedisOps ops;

    @Override
    public Optional<CharacterState> findById(String characterId) {
        return Optional.ofNullable(ops.get(RedisKeys.character(characterId), CharacterState.class));
    }

    @Override
    public void save(CharacterState character) {
        ops.set(RedisKeys.character(character.getId()), character);
    }
}
