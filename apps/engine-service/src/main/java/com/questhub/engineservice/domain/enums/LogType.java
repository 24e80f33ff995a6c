package com.questhub.engineservice.domain.enums;

public enum LogType {
    EXPLORATION,
    COMBAT,
    NARRATIVE,
    SYSTEM
}
