package com.questhub.engineservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 引擎公共 Bean。时钟单独声明，测试中可替换为可控时钟。
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
