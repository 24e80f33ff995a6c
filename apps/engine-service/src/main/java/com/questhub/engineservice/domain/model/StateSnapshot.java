package com.questhub.engineservice.domain.model;

import com.questhub.engineservice.combat.CombatSession;
import com.questhub.engineservice.domain.enums.GamePhase;
import com.questhub.engineservice.domain.enums.StateSection;
import lombok.Data;

import java.util.Collection;

/**
 * 按分区截取的状态片段。未被截取的分区字段保持为空。
 */
@Data
public class StateSnapshot {
    private GamePhase phase;
    private CharacterState character;
    private LocationState location;
    private CombatSession combat;
    private int turn;
    private long rngCursor;

    public static StateSnapshot capture(GameState state, Collection<StateSection> sections) {
        StateSnapshot s = new StateSnapshot();
        for (StateSection section : sections) {
            switch (section) {
                case PHASE -> s.phase = state.getPhase();
                case CHARACTER -> s.character = state.getCharacter() == null ? null : state.getCharacter().copy();
                case LOCATION -> s.location = state.getLocation() == null ? null : state.getLocation().copy();
                case COMBAT -> s.combat = state.getCombat() == null ? null : state.getCombat().copy();
                case PROGRESS -> {
                    s.turn = state.getTurn();
                    s.rngCursor = state.getRngCursor();
                }
            }
        }
        return s;
    }

    /**
     * 把片段中指定分区写回目标状态（写入副本，片段本身可重复使用）。
     */
    public void applyTo(GameState target, Collection<StateSection> sections) {
        for (StateSection section : sections) {
            switch (section) {
                case PHASE -> target.setPhase(phase);
                case CHARACTER -> target.setCharacter(character == null ? null : character.copy());
                case LOCATION -> target.setLocation(location == null ? null : location.copy());
                case COMBAT -> target.setCombat(combat == null ? null : combat.copy());
                case PROGRESS -> {
                    target.setTurn(turn);
                    target.setRngCursor(rngCursor);
                }
            }
        }
    }
}
