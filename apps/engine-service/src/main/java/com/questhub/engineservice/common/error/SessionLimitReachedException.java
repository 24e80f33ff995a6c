package com.questhub.engineservice.common.error;

import com.questhub.engineservice.domain.constants.EngineMessages;

public class SessionLimitReachedException extends EngineException {

    public SessionLimitReachedException(int max) {
        super(EngineErrorCode.SESSION_LIMIT_REACHED, EngineMessages.formatSessionLimit(max));
    }
}
