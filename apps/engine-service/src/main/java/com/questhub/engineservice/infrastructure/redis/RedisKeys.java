package com.questhub.engineservice.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "questhub:";

    private RedisKeys() {}

    // ---- 会话 ----
    public static String session(String sessionId) {
        return PFX + "session:" + sessionId;
    }

    /** 某用户的会话ID集合 */
    public static String userSessions(String userId) {
        return PFX + "user:" + userId + ":sessions";
    }

    // ---- 角色 ----
    public static String character(String characterId) {
        return PFX + "character:" + characterId;
    }

    // ---- 会话锁：多实例共享，SET NX PX 获取 ----
    public static String sessionLock(String sessionId) {
        return PFX + "lock:session:" + sessionId;
    }
}
