package com.questhub.engineservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * engine-service 启动入口。
 * 通过 @EnableFeignClients 启用基础设施层的 AI 服务 Feign Client。
 */
@SpringBootApplication
@EnableFeignClients
public class EngineServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(EngineServiceApplication.class, args);
    }
}
