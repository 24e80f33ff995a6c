package com.questhub.engineservice.domain.model;

import com.questhub.engineservice.combat.CombatSession;
import com.questhub.engineservice.domain.enums.GamePhase;
import com.questhub.engineservice.engine.core.Snapshot;
import lombok.Data;

/**
 * GameState
 * -------------------------------------------------------
 * 会话的可变游戏状态快照：阶段、角色、位置、战斗、回合计数与随机数游标。
 * - 命令总是在 {@link #copy()} 得到的工作副本上执行；
 * - 随机数由 rngSeed + rngCursor 推导，游标随状态一起提交或丢弃。
 */
@Data
public class GameState implements Snapshot<GameState> {
    private GamePhase phase = GamePhase.EXPLORATION;
    private CharacterState character;
    private LocationState location = new LocationState();
    /** 战斗会话；不在战斗中时为 null */
    private CombatSession combat;
    /** 已提交命令数 */
    private int turn;
    private long rngSeed;
    private long rngCursor;

    @Override
    public GameState copy() {
        GameState s = new GameState();
        s.phase = phase;
        s.character = character == null ? null : character.copy();
        s.location = location == null ? null : location.copy();
        s.combat = combat == null ? null : combat.copy();
        s.turn = turn;
        s.rngSeed = rngSeed;
        s.rngCursor = rngCursor;
        return s;
    }
}
