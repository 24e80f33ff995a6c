package com.questhub.engineservice.interfaces.http.dto;

import com.questhub.engineservice.domain.model.SessionSettings;
import lombok.Data;

/**
 * 创建会话请求。characterId 为空时新建角色。
 */
@Data
public class CreateSessionRequest {
    private String characterId;
    private String characterName;
    private SessionSettings settings;
}
