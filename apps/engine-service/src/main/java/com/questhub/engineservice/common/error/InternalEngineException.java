package com.questhub.engineservice.common.error;

import com.questhub.engineservice.domain.constants.EngineMessages;

public class InternalEngineException extends EngineException {

    public InternalEngineException(Throwable cause) {
        super(EngineErrorCode.INTERNAL_ENGINE_ERROR, EngineMessages.INTERNAL_ERROR, null, cause);
    }
}
