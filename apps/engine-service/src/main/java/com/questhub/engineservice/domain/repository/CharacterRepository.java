package com.questhub.engineservice.domain.repository;

import com.questhub.engineservice.domain.model.CharacterState;

import java.util.Optional;

public interface CharacterRepository {

    Optional<CharacterState> findById(String characterId);

    void save(CharacterState character);
}
