package com.questhub.engineservice.infrastructure.redis;

import com.fasterxml.jackson.databind.DeserializationFeature;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * RedisConfig
 * -------------------------------------------------------
 * 全局 Redis 连接与序列化配置类（通用基础设施层）
 * -------------------------------------------------------
 * Responsibilities:
 *  - 提供统一的 RedisTemplate 和 StringRedisTemplate Bean；
 *  - 配置序列化策略（Key: String，Value: JSON，携带类型信息）；
 *  - 反序列化时忽略未知字段，会话结构新增字段后旧数据仍可读取。
 * -------------------------------------------------------
 * 使用说明：
 *  - RedisTemplate<String, Object>：会话、角色等对象存取；
 *  - StringRedisTemplate：会话锁等字符串键值与 Lua 脚本。
 */
@Configuration
public class RedisConfig {

    /**
     * 通用 RedisTemplate（Key 为 String，Value 为任意对象，自动 JSON 序列化）
     *
     * @param factory Spring Data Redis 提供的连接工厂（Lettuce）
     * @return RedisTemplate<String, Object> Bean
     */
    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory factory) {
        RedisTemplate<String, Object> tpl = new RedisTemplate<>();
        tpl.setConnectionFactory(factory);

        StringRedisSerializer keySer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer valSer = new GenericJackson2JsonRedisSerializer();
        valSer.configure(om -> om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));

        tpl.setKeySerializer(keySer);
        tpl.setValueSerializer(valSer);
        tpl.setHashKeySerializer(keySer);
        tpl.setHashValueSerializer(valSer);

        tpl.afterPropertiesSet();
        return tpl;
    }

    /**
     * 纯字符串操作模板（StringRedisTemplate）
     * 适合锁、标志位等轻量操作。
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
        return new StringRedisTemplate(factory);
    }
}
