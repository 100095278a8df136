package com.example.dealerhooks.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    /**
     * Webhook 扇出投递线程池，每个匹配的订阅占用一个任务。
     */
    @Bean(name = "webhookTaskExecutor")
    public Executor webhookTaskExecutor(WebhookProperties properties) {
        WebhookProperties.Executor pool = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        // Core pool size: threads to keep alive
        executor.setCorePoolSize(pool.getCorePoolSize());
        // Max pool size: max threads to allow
        executor.setMaxPoolSize(pool.getMaxPoolSize());
        // Queue capacity: tasks to buffer
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix("Webhook-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
