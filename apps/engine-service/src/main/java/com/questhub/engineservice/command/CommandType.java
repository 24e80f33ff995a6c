package com.questhub.engineservice.command;

import com.questhub.engineservice.common.error.UnknownCommandException;

import java.util.Locale;

/**
 * 命令类型标签。新增命令 = 新增一个标签 + 一个 {@link GameCommand} 实现。
 */
public enum CommandType {
    MOVE,
    REST,
    START_COMBAT,
    ATTACK,
    DEFEND,
    FLEE,
    CAST_SPELL,
    USE_ITEM,
    GENERATE_IMAGE,
    GENERATE_NARRATIVE,
    RESPAWN;

    /**
     * 对外的小写编码，如 start_combat。
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 解析请求中的命令类型，大小写不敏感，'-' 与 '_' 等价。
     *
     * @throws UnknownCommandException 无法识别
     */
    public static CommandType fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new UnknownCommandException(String.valueOf(raw));
        }
        try {
            return CommandType.valueOf(raw.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnknownCommandException(raw);
        }
    }
}
