package com.questhub.engineservice.common.error;

/**
 * 引擎错误码。
 * 每个错误码声明对应的 HTTP 状态与调用方是否可重试，供请求层统一映射。
 */
public enum EngineErrorCode {
    /** 参数缺失 / 阶段不符 / 资源不足，未发生任何修改 */
    VALIDATION_ERROR(400, false),
    /** 冷却中，稍后重试 */
    COOLDOWN_ACTIVE(429, true),
    /** 会话正被其他请求占用，退避后重试 */
    LOCK_BUSY(409, true),
    /** 释放锁时令牌不匹配或锁已过期 */
    LOCK_NOT_HELD(409, false),
    NOTHING_TO_UNDO(409, false),
    NOTHING_TO_REDO(409, false),
    /** 命令执行期间的下游失败（例如 AI 服务超时） */
    COMMAND_EXECUTION_ERROR(502, true),
    INTERNAL_ENGINE_ERROR(500, false),
    SESSION_NOT_FOUND(404, false),
    ACCESS_DENIED(403, false),
    SESSION_LIMIT_REACHED(503, true),
    UNKNOWN_COMMAND(400, false);

    private final int httpStatus;
    private final boolean retryable;

    EngineErrorCode(int httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public boolean retryable() {
        return retryable;
    }
}
