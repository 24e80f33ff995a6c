package com.questhub.engineservice.combat;

public enum CombatOutcome {
    VICTORY,
    DEFEAT,
    FLED
}
