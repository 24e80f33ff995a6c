package com.questhub.web.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApiResponseTest {

    @Test
    @DisplayName("成功响应不携带错误码")
    void successHasNoErrorCode() {
        ApiResponse<String> r = ApiResponse.success("payload");
        assertTrue(r.isSuccess());
        assertNull(r.errorCode());
        assertEquals("payload", r.data());
        assertFalse(r.retryable());
    }

    @Test
    @DisplayName("业务失败响应保留错误码、诊断数据与重试标记")
    void errorKeepsCodeAndDiagnostics() {
        ApiResponse<List<String>> r = ApiResponse.error(409, "LOCK_BUSY", "busy", List.of("retry later"), true);
        assertFalse(r.isSuccess());
        assertEquals("LOCK_BUSY", r.errorCode());
        assertEquals(List.of("retry later"), r.data());
        assertTrue(r.retryable());
    }
}
