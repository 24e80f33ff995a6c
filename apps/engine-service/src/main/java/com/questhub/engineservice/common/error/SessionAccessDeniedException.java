package com.questhub.engineservice.common.error;

import com.questhub.engineservice.domain.constants.EngineMessages;

public class SessionAccessDeniedException extends EngineException {

    public SessionAccessDeniedException() {
        super(EngineErrorCode.ACCESS_DENIED, EngineMessages.ACCESS_DENIED);
    }
}
