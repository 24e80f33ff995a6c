package com.questhub.engineservice.common.error;

import com.questhub.engineservice.domain.constants.EngineMessages;

/**
 * 会话锁已被其他持有者占用。快速失败，不排队；调用方应退避后重试。
 */
public class LockBusyException extends EngineException {

    public LockBusyException(String sessionId) {
        super(EngineErrorCode.LOCK_BUSY, EngineMessages.formatSessionBusy(sessionId));
    }
}
