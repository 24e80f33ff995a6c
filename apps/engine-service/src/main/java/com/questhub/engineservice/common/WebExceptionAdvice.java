package com.questhub.engineservice.common;

import com.questhub.engineservice.common.error.EngineErrorCode;
import com.questhub.engineservice.common.error.EngineException;
import com.questhub.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 * 引擎异常按错误码映射 HTTP 状态；只返回错误码、提示文案和诊断数据，不暴露原始异常。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 引擎异常：状态码、是否可重试都由 {@link EngineErrorCode} 决定。
     */
    @ExceptionHandler(EngineException.class)
    public ResponseEntity<ApiResponse<Object>> engine(EngineException e) {
        EngineErrorCode code = e.getCode();
        return ResponseEntity.status(code.httpStatus())
                .body(ApiResponse.error(code.httpStatus(), code.name(), e.getMessage(), e.getDetails(), code.retryable()));
    }

    /**
     * 参数不合法（如未知方向字符串在控制器层解析失败）。
     * @return HTTP 400
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 业务状态冲突。
     * @return HTTP 409
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        log.warn("请求状态冲突: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }
}
