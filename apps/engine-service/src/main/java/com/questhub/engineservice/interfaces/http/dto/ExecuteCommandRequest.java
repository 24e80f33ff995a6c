package com.questhub.engineservice.interfaces.http.dto;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * 执行命令请求：type 为命令代码（如 move、attack），parameters 为命令参数。
 */
@Data
public class ExecuteCommandRequest {
    private String type;
    private Map<String, Object> parameters = new HashMap<>();
}
