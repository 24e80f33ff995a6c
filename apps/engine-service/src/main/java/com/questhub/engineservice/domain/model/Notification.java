package com.questhub.engineservice.domain.model;

import com.questhub.engineservice.domain.enums.NotificationType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 面向玩家的提示。引擎只负责生成，投递由上层完成。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Notification {
    private NotificationType type;
    private String title;
    private String message;
}
