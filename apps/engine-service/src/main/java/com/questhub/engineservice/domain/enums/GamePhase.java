package com.questhub.engineservice.domain.enums;

/**
 * 会话所处的游戏阶段，决定哪些命令可以执行。
 */
public enum GamePhase {
    EXPLORATION,
    COMBAT,
    DIALOGUE,
    TRADE,
    REST,
    CUTSCENE
}
