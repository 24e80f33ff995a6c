package com.questhub.engineservice.infrastructure.scheduler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 引擎后台任务线程池（自动保存、清理不活跃会话、清理过期锁），与请求线程分开。
 * 核心线程数来自 scheduler.engine.corePoolSize，线程名 engine-maint-N，守护线程。
 */
@Configuration
public class EngineSchedulerConfig {

    @Value("${scheduler.engine.corePoolSize:2}")
    private int corePoolSize;

    @Bean(name = "engineMaintenanceScheduler")
    public ScheduledThreadPoolExecutor engineMaintenanceScheduler() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "engine-maint-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(corePoolSize, tf, new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
