package com.questhub.engineservice.lock;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 会话锁记录：持有令牌、持有节点、获取时间与过期时间（毫秒）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionLockInfo {
    /** 持有令牌，释放时必须出示 */
    private String lockId;
    /** 持有者节点ID */
    private String owner;
    private long acquiredAt;
    private long expiresAt;

    public boolean isExpiredAt(long nowMillis) {
        return nowMillis >= expiresAt;
    }
}
