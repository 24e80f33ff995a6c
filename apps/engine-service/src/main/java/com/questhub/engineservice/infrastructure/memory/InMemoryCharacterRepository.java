package com.questhub.engineservice.infrastructure.memory;

import com.questhub.engineservice.domain.model.CharacterState;
import com.questhub.engineservice.domain.repository.CharacterRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内角色仓储，存取时复制，避免与会话状态共享引用。
 */
@Repository
@ConditionalOnProperty(prefix = "questhub.engine", name = "persistence-enabled", havingValue = "false")
public class InMemoryCharacterRepository implements CharacterRepository {

    private final Map<String, CharacterState> characters = new ConcurrentHashMap<>();

    @Override
    public Optional<CharacterState> findById(String characterId) {
        return Optional.ofNullable(characters.get(characterId)).map(CharacterState::copy);
    }

    @Override
    public void save(CharacterState character) {
        characters.put(character.getId(), character.copy());
    }
}
