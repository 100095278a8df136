package com.example.dealerhooks.config;

import com.example.dealerhooks.exception.TransientDeliveryException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import java.net.http.HttpClient;

/**
 * 出站投递基础设施：HTTP 客户端与自动重试策略。
 */
@Configuration
public class DeliveryConfig {

    @Bean
    public HttpClient webhookHttpClient(WebhookProperties properties) {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(properties.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    /**
     * 指数退避重试，只重试 {@link TransientDeliveryException}；其余异常立即结束。
     */
    @Bean
    public RetryTemplate deliveryRetryTemplate(WebhookProperties properties) {
        return RetryTemplate.builder()
                .maxAttempts(properties.getMaxAttempts())
                .exponentialBackoff(properties.getInitialBackoff().toMillis(),
                        properties.getBackoffMultiplier(),
                        properties.getMaxBackoff().toMillis())
                .retryOn(TransientDeliveryException.class)
                .build();
    }
}
