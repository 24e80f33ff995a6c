package com.questhub.engineservice.domain.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * GameSession
 * -------------------------------------------------------
 * 单个玩家的游戏会话（权威状态，用于 Redis 持久化）。
 * - 只由 GameEngine 在持有会话锁时修改；
 * - undoStack / redoStack 栈顶在列表末尾；
 * - version 每次提交自增，用于判断内存缓存是否落后于存储。
 */
@Data
public class GameSession {
    private String sessionId;
    /** 所属用户ID */
    private String userId;
    private String characterId;
    private GameState state;

    private long createdAt;
    private long lastActivity;
    /** 最近一次写入存储的时间（毫秒），0 表示尚未保存 */
    private long lastSavedAt;
    private long version;
    private boolean active = true;

    private List<UndoEntry> undoStack = new ArrayList<>();
    private List<UndoEntry> redoStack = new ArrayList<>();
    /** 有界事件历史（最旧的在前） */
    private List<LogEntry> eventHistory = new ArrayList<>();
    /** 冷却记录："actorId:commandType" -> 上次执行时间（毫秒） */
    private Map<String, Long> cooldowns = new HashMap<>();

    private SessionSettings settings = new SessionSettings();

    public boolean isOwnedBy(String uid) {
        return userId != null && userId.equals(uid);
    }

    /** 最近一次修改尚未写入存储 */
    public boolean hasUnsavedChanges() {
        return lastActivity > lastSavedAt;
    }
}
