package com.questhub.engineservice.command;

import com.questhub.engineservice.combat.CombatDice;
import com.questhub.engineservice.domain.model.CharacterState;
import com.questhub.engineservice.domain.model.GameState;
import lombok.Getter;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 单次命令调用的上下文。
 * state 是工作副本：校验阶段只读，执行阶段可修改，提交前对外不可见。
 */
@Getter
public class CommandContext {

    private final String sessionId;
    private final String userId;
    private final GameState state;
    private final Map<String, Object> parameters;
    private final long now;
    /** 随机来源，游标从 state.rngCursor 开始，提交时写回 */
    private final CombatDice dice;
    /** 会话设置中的叙事风格，供 AI 命令使用 */
    private final String narrativeStyle;
    /** 最近的事件消息（旧到新），供 AI 命令作为上下文 */
    private final List<String> recentEvents;

    public CommandContext(String sessionId, String userId, GameState state, Map<String, Object> parameters, long now) {
        this(sessionId, userId, state, parameters, now, null, List.of());
    }

    public CommandContext(String sessionId, String userId, GameState state, Map<String, Object> parameters, long now,
                          String narrativeStyle, List<String> recentEvents) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.state = state;
        this.parameters = parameters == null ? Map.of() : parameters;
        this.now = now;
        this.dice = new CombatDice(state.getRngSeed(), state.getRngCursor());
        this.narrativeStyle = narrativeStyle;
        this.recentEvents = recentEvents == null ? List.of() : recentEvents;
    }

    public CharacterState character() {
        return state.getCharacter();
    }

    public boolean hasParam(String name) {
        Object v = parameters.get(name);
        return v != null && !(v instanceof String s && s.isBlank());
    }

    public String stringParam(String name) {
        Object v = parameters.get(name);
        return v == null ? null : String.valueOf(v);
    }

    public String stringParam(String name, String defaultValue) {
        String v = stringParam(name);
        return v == null || v.isBlank() ? defaultValue : v;
    }

    /**
     * 整数参数；缺失时返回默认值，无法解析时返回 null。
     */
    public Integer intParam(String name, Integer defaultValue) {
        Object v = parameters.get(name);
        if (v == null) {
            return defaultValue;
        }
        if (v instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public boolean boolParam(String name, boolean defaultValue) {
        Object v = parameters.get(name);
        if (v == null) {
            return defaultValue;
        }
        if (v instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(String.valueOf(v));
    }

    /**
     * 字符串列表参数，兼容 JSON 数组与逗号分隔字符串。
     */
    public List<String> stringListParam(String name) {
        Object v = parameters.get(name);
        if (v == null) {
            return List.of();
        }
        if (v instanceof Collection<?> c) {
            return c.stream().filter(e -> e != null).map(String::valueOf).filter(s -> !s.isBlank()).toList();
        }
        String s = String.valueOf(v);
        return s.isBlank() ? List.of() : List.of(s.split("\\s*,\\s*"));
    }
}
