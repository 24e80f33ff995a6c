package com.questhub.engineservice.infrastructure.client.ai;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NarrativeRequest {
    private String sessionId;
    private String characterName;
    private String locationId;
    /** 玩家输入的提示，可为空 */
    private String prompt;
    private String style;
    /** 最近的事件日志，作为上下文 */
    private List<String> recentEvents;
}
