package com.questhub.engineservice.common.error;

import com.questhub.engineservice.domain.constants.EngineMessages;

public class NothingToUndoException extends EngineException {

    public NothingToUndoException() {
        super(EngineErrorCode.NOTHING_TO_UNDO, EngineMessages.NOTHING_TO_UNDO);
    }
}
