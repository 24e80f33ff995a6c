package com.questhub.engineservice.command;

import com.questhub.engineservice.domain.model.LogEntry;
import com.questhub.engineservice.domain.model.Notification;
import com.questhub.engineservice.domain.model.StateDelta;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;
import java.util.Map;

/**
 * 命令执行结果。delta 由引擎在提交时填入。
 */
@Data
@Builder
public class CommandResult {
    private CommandType commandType;
    private boolean success;
    private String message;
    private StateDelta delta;
    @Singular
    private List<LogEntry> logEntries;
    @Singular
    private List<Notification> notifications;
    private int experienceGained;
    /** 附加数据（如插画地址） */
    @Singular
    private Map<String, Object> extras;
}
