package com.questhub.engineservice.common.error;

import com.questhub.engineservice.domain.constants.EngineMessages;

public class LockNotHeldException extends EngineException {

    public LockNotHeldException(String sessionId) {
        super(EngineErrorCode.LOCK_NOT_HELD, EngineMessages.formatLockNotHeld(sessionId));
    }
}
