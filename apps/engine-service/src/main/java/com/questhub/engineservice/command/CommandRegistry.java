package com.questhub.engineservice.command;

import com.questhub.engineservice.common.error.UnknownCommandException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 命令注册表：收集容器中所有 {@link GameCommand} 实现，按类型索引。
 */
@Slf4j
@Component
public class CommandRegistry {

    private final Map<CommandType, GameCommand> commands = new EnumMap<>(CommandType.class);

    public CommandRegistry(List<GameCommand> all) {
        for (GameCommand c : all) {
            GameCommand prev = commands.put(c.type(), c);
            if (prev != null) {
                throw new IllegalStateException("DUPLICATE_COMMAND: " + c.type() + " -> "
                        + prev.getClass().getSimpleName() + ", " + c.getClass().getSimpleName());
            }
        }
        log.info("命令注册完成: {}", commands.keySet());
    }

    public GameCommand get(CommandType type) {
        GameCommand c = commands.get(type);
        if (c == null) {
            throw new UnknownCommandException(type.code());
        }
        return c;
    }

    public Map<CommandType, GameCommand> all() {
        return Collections.unmodifiableMap(commands);
    }
}
