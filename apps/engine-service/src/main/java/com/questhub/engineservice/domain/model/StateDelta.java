package com.questhub.engineservice.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.questhub.engineservice.domain.enums.StateSection;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * StateDelta
 * -------------------------------------------------------
 * 一次命令造成的最小状态变化：变化的分区 + 这些分区的前后快照。
 * - 撤销：把 before 写回；
 * - 重做：把 after 写回。
 */
@Data
public class StateDelta {
    private List<StateSection> sections = new ArrayList<>();
    private StateSnapshot before;
    private StateSnapshot after;

    public static StateDelta between(GameState before, GameState after) {
        List<StateSection> changed = new ArrayList<>();
        if (before.getPhase() != after.getPhase()) {
            changed.add(StateSection.PHASE);
        }
        if (!Objects.equals(before.getCharacter(), after.getCharacter())) {
            changed.add(StateSection.CHARACTER);
        }
        if (!Objects.equals(before.getLocation(), after.getLocation())) {
            changed.add(StateSection.LOCATION);
        }
        if (!Objects.equals(before.getCombat(), after.getCombat())) {
            changed.add(StateSection.COMBAT);
        }
        if (before.getTurn() != after.getTurn() || before.getRngCursor() != after.getRngCursor()) {
            changed.add(StateSection.PROGRESS);
        }
        StateDelta d = new StateDelta();
        d.sections = changed;
        d.before = StateSnapshot.capture(before, changed);
        d.after = StateSnapshot.capture(after, changed);
        return d;
    }

    public void revert(GameState state) {
        before.applyTo(state, sections);
    }

    public void reapply(GameState state) {
        after.applyTo(state, sections);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return sections.isEmpty();
    }
}
