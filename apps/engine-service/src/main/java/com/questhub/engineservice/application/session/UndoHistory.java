package com.questhub.engineservice.application.session;

import com.questhub.engineservice.config.EngineProperties;
import com.questhub.engineservice.domain.model.GameSession;
import com.questhub.engineservice.domain.model.UndoEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 会话撤销 / 重做栈的维护规则。栈顶在列表末尾。
 * - 撤销栈有上限，超出时丢弃最旧的条目；
 * - 新命令提交会清空重做栈；
 * - 不可撤销的命令是历史屏障：两个栈都清空。
 */
@Component
@RequiredArgsConstructor
public class UndoHistory {

    private final EngineProperties properties;

    /**
     * 记录一次已提交的命令。
     */
    public void record(GameSession session, UndoEntry entry) {
        session.getRedoStack().clear();
        if (!entry.isUndoable()) {
            session.getUndoStack().clear();
            return;
        }
        pushBounded(session.getUndoStack(), entry);
    }

    public UndoEntry peekUndo(GameSession session) {
        return peek(session.getUndoStack());
    }

    public UndoEntry peekRedo(GameSession session) {
        return peek(session.getRedoStack());
    }

    /**
     * 撤销完成：条目从撤销栈移到重做栈。
     */
    public void moveToRedo(GameSession session) {
        UndoEntry entry = pop(session.getUndoStack());
        pushBounded(session.getRedoStack(), entry);
    }

    /**
     * 重做完成：条目从重做栈移回撤销栈。
     */
    public void moveToUndo(GameSession session) {
        UndoEntry entry = pop(session.getRedoStack());
        pushBounded(session.getUndoStack(), entry);
    }

    private void pushBounded(List<UndoEntry> stack, UndoEntry entry) {
        stack.add(entry);
        while (stack.size() > properties.getMaxUndoStackSize()) {
            stack.remove(0);
        }
    }

    private static UndoEntry peek(List<UndoEntry> stack) {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1);
    }

    private static UndoEntry pop(List<UndoEntry> stack) {
        return stack.remove(stack.size() - 1);
    }
}
