package com.questhub.engineservice.command;

import com.questhub.engineservice.domain.model.GameSession;
import org.springframework.stereotype.Component;

/**
 * 冷却记录，保存在会话内（随会话持久化，多实例共享）。
 * key = actorId:commandType，value = 上次成功执行的时间。
 */
@Component
public class CooldownTracker {

    /**
     * @return 剩余冷却毫秒数，0 表示可执行
     */
    public long remaining(GameSession session, String actorId, CommandType type, long cooldownMs, long now) {
        if (cooldownMs <= 0) {
            return 0;
        }
        Long last = session.getCooldowns().get(key(actorId, type));
        if (last == null) {
            return 0;
        }
        return Math.max(0, last + cooldownMs - now);
    }

    /**
     * 仅在提交成功后记录。
     */
    public void record(GameSession session, String actorId, CommandType type, long now) {
        session.getCooldowns().put(key(actorId, type), now);
    }

    private static String key(String actorId, CommandType type) {
        return actorId + ":" + type.code();
    }
}
