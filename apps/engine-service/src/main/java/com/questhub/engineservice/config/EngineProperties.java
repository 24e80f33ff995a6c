package com.questhub.engineservice.config;

import com.questhub.engineservice.combat.targeting.TargetingMode;
import com.questhub.engineservice.lock.LockStoreType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 会话命令引擎配置。
 *
 * <pre>
 * questhub:
 *   engine:
 *     max-undo-stack-size: 50
 *     lock-store: redis
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "questhub.engine")
public class EngineProperties {

    /** 撤销栈上限，超出时丢弃最旧条目 */
    private int maxUndoStackSize = 50;

    /** 会话事件历史上限 */
    private int maxEventHistorySize = 100;

    /** 单实例内存中允许的活跃会话数 */
    private int maxConcurrentSessions = 1000;

    /** 自动保存间隔（秒），<=0 关闭 */
    private long autoSaveIntervalSeconds = 30;

    /** 会话在存储中的 TTL（秒） */
    private long sessionTtlSeconds = 3600;

    /** 超过该时长无操作的会话会被保存后移出内存（分钟） */
    private long inactiveTimeoutMinutes = 30;

    /** 清理任务间隔（秒），<=0 关闭 */
    private long cleanupIntervalSeconds = 300;

    /** 命令执行时会话锁的 TTL（秒） */
    private long lockTtlSeconds = 60;

    /** 自动保存取快照时短锁的 TTL（毫秒） */
    private long snapshotLockTtlMillis = 2000;

    /**
     * 会话锁存储：REDIS（多实例共享）或 LOCAL（仅单进程部署）。
     * 必须显式选择，不做自动降级。
     */
    private LockStoreType lockStore = LockStoreType.REDIS;

    /** 敌人 AI 的目标选择方式 */
    private TargetingMode aiTargeting = TargetingMode.LOWEST_HEALTH;

    /** 是否允许调用 AI 叙事/插画服务 */
    private boolean aiEnabled = true;

    /** 是否写入 Redis；关闭时使用进程内存储 */
    private boolean persistenceEnabled = true;
}
