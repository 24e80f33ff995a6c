package com.questhub.engineservice.common.error;

import com.questhub.engineservice.domain.constants.EngineMessages;

public class NothingToRedoException extends EngineException {

    public NothingToRedoException() {
        super(EngineErrorCode.NOTHING_TO_REDO, EngineMessages.NOTHING_TO_REDO);
    }
}
