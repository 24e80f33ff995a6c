package com.questhub.engineservice.lock;

/**
 * 会话锁的存储方式。
 * REDIS：多实例共享同一 Redis，唯一可靠的分布式部署方式。
 * LOCAL：进程内互斥，仅适用于单进程部署。
 */
public enum LockStoreType {
    REDIS,
    LOCAL
}
