package com.questhub.engineservice.domain.enums;

public enum NotificationType {
    INFO,
    SUCCESS,
    WARNING,
    DANGER
}
