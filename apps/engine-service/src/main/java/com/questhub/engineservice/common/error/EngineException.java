package com.questhub.engineservice.common.error;

/**
 * 引擎异常基类。
 * -------------------------------------------------------
 * - 所有可预期的失败都以带 {@link EngineErrorCode} 的异常抛出；
 * - message 为用户可见文案；
 * - details 为可选的诊断信息（如校验失败原因），不包含内部堆栈。
 */
public class EngineException extends RuntimeException {

    private final EngineErrorCode code;
    private final transient Object details;

    public EngineException(EngineErrorCode code, String message) {
        this(code, message, null, null);
    }

    public EngineException(EngineErrorCode code, String message, Object details) {
        this(code, message, details, null);
    }

    public EngineException(EngineErrorCode code, String message, Object details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details;
    }

    public EngineErrorCode getCode() {
        return code;
    }

    public Object getDetails() {
        return details;
    }

    public boolean isRetryable() {
        return code.retryable();
    }
}
