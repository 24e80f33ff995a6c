package com.questhub.engineservice.common.error;

import com.questhub.engineservice.domain.constants.EngineMessages;

public class UnknownCommandException extends EngineException {

    public UnknownCommandException(String type) {
        super(EngineErrorCode.UNKNOWN_COMMAND, EngineMessages.formatUnknownCommand(type));
    }
}
