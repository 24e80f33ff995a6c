package com.questhub.engineservice.service.metrics;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 引擎运行计数。只做累计，长期聚合交给外部监控。
 */
@Component
public class EngineMetrics {

    private final AtomicLong commandsExecuted = new AtomicLong();
    private final AtomicLong commandsFailed = new AtomicLong();
    private final AtomicLong executionNanos = new AtomicLong();
    private final AtomicLong sessionsCreated = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong lockBusy = new AtomicLong();

    public void commandSucceeded(long elapsedNanos) {
        commandsExecuted.incrementAndGet();
        executionNanos.addAndGet(elapsedNanos);
    }

    public void commandFailed() {
        commandsFailed.incrementAndGet();
    }

    public void sessionCreated() {
        sessionsCreated.incrementAndGet();
    }

    public void cacheHit() {
        cacheHits.incrementAndGet();
    }

    public void cacheMiss() {
        cacheMisses.incrementAndGet();
    }

    public void lockBusy() {
        lockBusy.incrementAndGet();
    }

    /**
     * @param activeSessions 当前内存中的会话数
     */
    public MetricsSnapshot snapshot(int activeSessions) {
        long ok = commandsExecuted.get();
        long failed = commandsFailed.get();
        long hits = cacheHits.get();
        long misses = cacheMisses.get();
        double avgMillis = ok == 0 ? 0 : executionNanos.get() / 1_000_000.0 / ok;
        double errorRate = ok + failed == 0 ? 0 : (double) failed / (ok + failed);
        double hitRate = hits + misses == 0 ? 0 : (double) hits / (hits + misses);
        return new MetricsSnapshot(ok, failed, sessionsCreated.get(), activeSessions,
                avgMillis, errorRate, hits, misses, hitRate, lockBusy.get());
    }
}
