package com.questhub.engineservice.common.error;

import com.questhub.engineservice.domain.constants.EngineMessages;

public class SessionNotFoundException extends EngineException {

    public SessionNotFoundException(String sessionId) {
        super(EngineErrorCode.SESSION_NOT_FOUND, EngineMessages.formatSessionNotFound(sessionId));
    }
}
