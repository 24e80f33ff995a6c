package com.questhub.engineservice.common.error;

import com.questhub.engineservice.domain.constants.EngineMessages;

import java.util.Map;

public class CooldownActiveException extends EngineException {

    private final long remainingMs;

    public CooldownActiveException(String commandType, long remainingMs) {
        super(EngineErrorCode.COOLDOWN_ACTIVE,
                EngineMessages.formatCooldownActive(commandType, remainingMs),
                Map.of("command", commandType, "remainingMs", remainingMs));
        this.remainingMs = remainingMs;
    }

    public long getRemainingMs() {
        return remainingMs;
    }
}
