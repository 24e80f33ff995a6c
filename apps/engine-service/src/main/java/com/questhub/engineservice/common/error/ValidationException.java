package com.questhub.engineservice.common.error;

import com.questhub.engineservice.domain.constants.EngineMessages;

import java.util.List;

/**
 * 校验失败：携带全部可读原因。抛出时尚未发生任何状态修改。
 */
public class ValidationException extends EngineException {

    private final List<String> reasons;

    public ValidationException(List<String> reasons) {
        super(EngineErrorCode.VALIDATION_ERROR, EngineMessages.formatValidationFailed(reasons), List.copyOf(reasons));
        this.reasons = List.copyOf(reasons);
    }

    public ValidationException(String reason) {
        this(List.of(reason));
    }

    public List<String> getReasons() {
        return reasons;
    }
}
