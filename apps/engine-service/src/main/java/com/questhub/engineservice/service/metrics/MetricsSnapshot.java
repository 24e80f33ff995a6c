package com.questhub.engineservice.service.metrics;

/**
 * 引擎指标的只读快照。
 */
public record MetricsSnapshot(
        long totalCommandsExecuted,
        long failedCommands,
        long totalSessions,
        int activeSessions,
        double averageCommandExecutionMillis,
        double errorRate,
        long cacheHits,
        long cacheMisses,
        double cacheHitRate,
        long lockBusyRejections
) {
}
