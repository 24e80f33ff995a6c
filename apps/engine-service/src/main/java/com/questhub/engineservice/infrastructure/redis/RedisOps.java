package com.questhub.engineservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 公用 Redis 工具类：
 * - 封装 String/Set/Key/脚本 常用操作
 * - 仅提供“原语级”方法；业务键名放在 RedisKeys，组织逻辑放在 Repo/Lock 层
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** 通用对象模板：用于 JSON 存储与反序列化 */
    private final RedisTemplate<String, Object> redis;
    /** 字符串模板：用于锁与脚本 */
    private final StringRedisTemplate strRedis;

    // -------------- Object --------------
    /**
     * 写入键值（无 TTL）
     */
    public void set(String key, Object val) {
        redis.opsForValue().set(key, val);
    }

    /**
     * 写入键值（带 TTL）
     */
    public void setEx(String key, Object val, Duration ttl) {
        redis.opsForValue().set(key, val, ttl);
    }

    /**
     * 获取键值并自动反序列化为指定类型；类型不符时返回 null
     */
    public <T> T get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return type.isInstance(v) ? type.cast(v) : null;
    }

    // -------------- Set --------------
    /**
     * 向集合添加成员（字符串）
     */
    public Long sAdd(String key, String... members) {
        return strRedis.opsForSet().add(key, members);
    }

    /**
     * 从集合移除成员
     */
    public Long sRem(String key, String... members) {
        return strRedis.opsForSet().remove(key, (Object[]) members);
    }

    /**
     * 获取集合全部成员；键不存在时返回空集合
     */
    public Set<String> sMembers(String key) {
        Set<String> members = strRedis.opsForSet().members(key);
        return members == null ? Collections.emptySet() : members;
    }

    // -------------- Key & TTL --------------
    /**
     * 设置过期时间（TTL）
     */
    public Boolean expire(String key, Duration ttl) {
        return redis.expire(key, ttl);
    }

    /**
     * 删除一个或多个 Key
     * @return 实际删除数量
     */
    public long del(String... keys) {
        Long n = redis.delete(Arrays.asList(keys));
        return n == null ? 0 : n;
    }

    // -------------- String --------------
    /**
     * 仅当不存在时写入字符串键值（SET NX PX），带 TTL。
     * @return true 表示写入成功，false 表示已存在
     */
    public boolean setStringNx(String key, String val, Duration ttl) {
        Boolean ok = strRedis.opsForValue().setIfAbsent(key, val, ttl);
        return Boolean.TRUE.equals(ok);
    }

    /**
     * 获取简单字符串值
     */
    public String getString(String key) {
        return strRedis.opsForValue().get(key);
    }

    // -------------- Script --------------

    /**
     * 以字符串序列化执行 Lua 脚本（原子操作），返回整数结果。
     * -------------------------------------------------------
     * 常用于：
     *  - 锁的“令牌匹配才删除”；
     *  - 其他需要读-判断-写原子化的场景。
     *
     * @param script Lua 文本内容
     * @param keys   KEYS[...] 参数列表
     * @param args   ARGV[...] 参数列表（按字符串传入）
     * @return 脚本返回的整数
     */
    public Long evalString(String script, List<String> keys, String... args) {
        DefaultRedisScript<Long> rs = new DefaultRedisScript<>(script, Long.class);
        return strRedis.execute(rs, keys, (Object[]) args);
    }
}
