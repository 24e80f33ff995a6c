package com.questhub.engineservice.combat;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 开战参数。
 */
@Value
@Builder
public class StartCombatOptions {
    /** 敌人模板ID列表，按出场顺序 */
    List<String> enemyIds;
    boolean ambush;
    @Builder.Default
    boolean canFlee = true;
    String terrain;
    String locationId;
}
