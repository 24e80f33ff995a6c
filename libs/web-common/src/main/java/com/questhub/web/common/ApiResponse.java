package com.questhub.web.common;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param <T> 响应数据类型
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    /**
     * 响应状态码
     * 200: 成功
     * 400: 客户端错误（参数错误、校验失败）
     * 403: 无权限（非会话所有者）
     * 404: 资源不存在
     * 409: 冲突（会话被锁、无可撤销操作）
     * 429: 冷却中
     * 500: 服务器错误
     * 502: 下游（AI 服务）调用失败
     * 503: 容量已满
     */
    int code,

    /**
     * 业务错误码（如 LOCK_BUSY），成功时为空
     */
    String errorCode,

    /**
     * 响应消息
     */
    String message,

    /**
     * 响应数据；失败时可携带诊断信息（如校验失败原因列表）
     */
    T data,

    /**
     * 调用方是否可以稍后重试
     */
    boolean retryable
) implements Serializable {

    public static final String OK = "success";

    /**
     * 成功响应（无数据）
     */
    public static <T> ApiResponse<T> success() {
        return new ApiResponse<>(200, null, OK, null, false);
    }

    /**
     * 成功响应（带数据）
     */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, null, OK, data, false);
    }

    /**
     * 成功响应（带消息和数据）
     */
    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(200, null, message, data, false);
    }

    /**
     * 带业务错误码的失败响应
     */
    public static <T> ApiResponse<T> error(int code, String errorCode, String message, T data, boolean retryable) {
        return new ApiResponse<>(code, errorCode, message, data, retryable);
    }

    /**
     * 失败响应
     */
    public static <T> ApiResponse<T> error(int code, String message) {
        return new ApiResponse<>(code, null, message, null, false);
    }

    /**
     * 失败响应（400 Bad Request）
     */
    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, null, message, null, false);
    }

    /**
     * 失败响应（404 Not Found）
     */
    public static <T> ApiResponse<T> notFound(String message) {
        return new ApiResponse<>(404, null, message, null, false);
    }

    /**
     * 失败响应（409 Conflict）
     */
    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(409, null, message, null, false);
    }

    /**
     * 失败响应（500 Internal Server Error）
     */
    public static <T> ApiResponse<T> serverError(String message) {
        return new ApiResponse<>(500, null, message, null, false);
    }

    /**
     * 是否为成功响应
     */
    @JsonIgnore
    public boolean isSuccess() {
        return code == 200;
    }
}
