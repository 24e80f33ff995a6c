package com.questhub.engineservice.application.command;

import com.questhub.engineservice.command.CommandContext;
import com.questhub.engineservice.command.CommandCost;
import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.command.CommandValidator;
import com.questhub.engineservice.command.CooldownTracker;
import com.questhub.engineservice.command.CostApplier;
import com.questhub.engineservice.command.GameCommand;
import com.questhub.engineservice.command.ValidationResult;
import com.questhub.engineservice.common.error.CommandExecutionException;
import com.questhub.engineservice.common.error.CooldownActiveException;
import com.questhub.engineservice.common.error.EngineException;
import com.questhub.engineservice.common.error.ValidationException;
import com.questhub.engineservice.domain.model.GameSession;
import com.questhub.engineservice.domain.model.GameState;
import com.questhub.engineservice.domain.model.LogEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * CommandPipeline
 * -------------------------------------------------------
 * 单条命令的 校验 → 计费 → 冷却 → 执行 流程，全部作用在工作副本上。
 * 任何一步失败都直接抛出，会话的权威状态不受影响；提交由引擎完成。
 * 调用方必须已持有会话锁。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandPipeline {

    private final CommandValidator validator;
    private final CooldownTracker cooldowns;

    public CommandExecution run(GameSession session, GameCommand command, Map<String, Object> parameters, long now) {
        GameState working = session.getState().copy();
        CommandContext ctx = new CommandContext(session.getSessionId(), session.getUserId(), working, parameters, now,
                session.getSettings().getNarrativeStyle(), recentMessages(session));

        // 1) 结构校验 + 命令特有校验
        ValidationResult structure = validator.validateStructure(command, ctx);
        if (!structure.isValid()) {
            throw new ValidationException(structure.reasons());
        }

        // 2) 计费：只判断是否负担得起
        CommandCost cost = command.cost(ctx);
        ValidationResult affordable = validator.validateAffordable(cost, ctx.character());
        if (!affordable.isValid()) {
            throw new ValidationException(affordable.reasons());
        }

        // 3) 冷却
        long remaining = cooldowns.remaining(session, ctx.character().getId(), command.type(),
                command.definition().getCooldownMs(), now);
        if (remaining > 0) {
            throw new CooldownActiveException(command.type().code(), remaining);
        }

        // 4) 扣费 + 执行
        boolean undoable = command.isUndoable(ctx);
        CostApplier.deduct(cost, ctx.character());
        CommandResult result;
        try {
            result = command.execute(ctx);
        } catch (EngineException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("命令执行失败，工作副本已丢弃: sessionId={}, type={}, cause={}",
                    session.getSessionId(), command.type().code(), e.toString());
            throw new CommandExecutionException(command.type().code(), e);
        }

        working.setRngCursor(ctx.getDice().cursor());
        working.setTurn(working.getTurn() + 1);
        result.setCommandType(command.type());
        return new CommandExecution(working, result, undoable);
    }

    private static List<String> recentMessages(GameSession session) {
        List<LogEntry> history = session.getEventHistory();
        int from = Math.max(0, history.size() - 10);
        return history.subList(from, history.size()).stream().map(LogEntry::getMessage).toList();
    }
}
