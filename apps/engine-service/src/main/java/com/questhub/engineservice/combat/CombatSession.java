package com.questhub.engineservice.combat;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.questhub.engineservice.domain.model.LogEntry;
import com.questhub.engineservice.engine.core.Snapshot;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CombatSession
 * -------------------------------------------------------
 * 回合制战斗的完整状态，保存在 GameState 中随会话一起持久化。
 * - combatants 即行动顺序，开战后固定不变；
 * - currentTurnIndex 指向当前行动者，round 从 1 开始；
 * - phase 为 RESOLUTION 时 outcome 非空。
 */
@Data
public class CombatSession implements Snapshot<CombatSession> {
    private String combatId;
    private List<Combatant> combatants = new ArrayList<>();
    private int currentTurnIndex;
    private int round = 1;
    private CombatPhase phase = CombatPhase.INITIATIVE;
    private CombatOutcome outcome;
    private boolean ambush;
    private boolean canFlee = true;
    private String terrain;
    private String locationId;
    private long startedAt;
    /** 本场战斗的日志 */
    private List<LogEntry> log = new ArrayList<>();

    @JsonIgnore
    public Combatant getCurrentCombatant() {
        if (combatants.isEmpty()) {
            return null;
        }
        return combatants.get(currentTurnIndex);
    }

    public Optional<Combatant> find(String combatantId) {
        return combatants.stream().filter(c -> c.getId().equals(combatantId)).findFirst();
    }

    @JsonIgnore
    public List<Combatant> getPlayers() {
        return combatants.stream().filter(Combatant::isPlayer).toList();
    }

    @JsonIgnore
    public List<Combatant> getEnemies() {
        return combatants.stream().filter(c -> !c.isPlayer()).toList();
    }

    @JsonIgnore
    public boolean isResolved() {
        return phase == CombatPhase.RESOLUTION;
    }

    @Override
    public CombatSession copy() {
        CombatSession s = new CombatSession();
        s.combatId = combatId;
        s.combatants = new ArrayList<>();
        combatants.forEach(c -> s.combatants.add(c.copy()));
        s.currentTurnIndex = currentTurnIndex;
        s.round = round;
        s.phase = phase;
        s.outcome = outcome;
        s.ambush = ambush;
        s.canFlee = canFlee;
        s.terrain = terrain;
        s.locationId = locationId;
        s.startedAt = startedAt;
        s.log = new ArrayList<>(log);
        return s;
    }
}
