package com.example.dealerhooks.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Webhook 投递配置（前缀 app.webhook）。
 * 自动重试（maxAttempts，单次触发内）与手动重投（manualRetryLimit，单条台账）是两套独立额度。
 */
@Data
@ConfigurationProperties(prefix = "app.webhook")
public class WebhookProperties {

    /**
     * 出站请求的 User-Agent。
     */
    private String userAgent = "DealerHooks-Webhook/1.0";

    private Duration connectTimeout = Duration.ofSeconds(5);

    /**
     * 单次 HTTP 尝试的总超时，超时按可重试错误处理。
     */
    private Duration requestTimeout = Duration.ofSeconds(5);

    /**
     * 单次触发内的总尝试次数（含首次）。
     */
    private int maxAttempts = 3;

    private Duration initialBackoff = Duration.ofSeconds(1);

    private double backoffMultiplier = 2.0;

    private Duration maxBackoff = Duration.ofSeconds(10);

    /**
     * 每条台账记录允许的手动重投次数。
     */
    private int manualRetryLimit = 5;

    /**
     * 连续失败多少次后自动停用订阅。
     */
    private int failureThreshold = 10;

    /**
     * 台账中保存的响应体最大长度。
     */
    private int responseBodyLimit = 1000;

    private int historyLimit = 50;

    private Executor executor = new Executor();

    @Data
    public static class Executor {
        private int corePoolSize = 10;
        private int maxPoolSize = 50;
        private int queueCapacity = 200;
    }
}
