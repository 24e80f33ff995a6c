package com.questhub.engineservice.domain.model;

import lombok.Data;

/**
 * 撤销栈条目：产生它的命令 + 该命令的状态增量。
 */
@Data
public class UndoEntry {
    private String entryId;
    private String commandType;
    /** 产生该条目的命令是否可撤销；不可撤销的条目不会入栈，出栈时再做一次防御校验 */
    private boolean undoable;
    private StateDelta delta;
    private long createdAt;
}
