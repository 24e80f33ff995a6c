package com.questhub.engineservice.domain.model;

import com.questhub.engineservice.domain.enums.LogType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 游戏日志条目：随命令结果返回，并写入会话事件历史。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LogEntry {
    private long timestamp;
    private LogType type;
    /** 行动者ID，系统消息为空 */
    private String actorId;
    private String message;

    public static LogEntry of(LogType type, String actorId, String message) {
        return new LogEntry(System.currentTimeMillis(), type, actorId, message);
    }

    public static LogEntry system(String message) {
        return of(LogType.SYSTEM, null, message);
    }
}
