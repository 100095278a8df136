package com.example.dealerhooks.service;

import com.example.dealerhooks.config.WebhookProperties;
import com.example.dealerhooks.repository.SubscriptionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 订阅健康管理：记录连续失败次数，达到阈值后自动停用。
 * 停用后不会自动恢复，需要管理员显式启用。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionHealthGovernor {

    private final SubscriptionRepository subscriptionRepository;
    private final WebhookProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * 记录一次投递结果。
     *
     * @param subscriptionId 订阅 ID
     * @param success        是否成功
     * @param error          失败原因（成功时忽略）
     */
    @Transactional
    public void recordOutcome(Long subscriptionId, boolean success, String error) {
        LocalDateTime now = LocalDateTime.now();

        if (success) {
            if (subscriptionRepository.markSucceeded(subscriptionId, now) == 0) {
                log.debug("Subscription {} no longer exists, success not recorded", subscriptionId);
            }
            return;
        }

        if (subscriptionRepository.incrementFailureCount(subscriptionId, error, now) == 0) {
            log.debug("Subscription {} no longer exists, failure not recorded", subscriptionId);
            return;
        }

        int threshold = properties.getFailureThreshold();
        if (subscriptionRepository.deactivateIfThresholdReached(subscriptionId, threshold) == 1) {
            meterRegistry.counter("webhook.subscriptions.disabled").increment();
            log.warn("Subscription {} disabled after {} consecutive failures, last error: {}",
                    subscriptionId, threshold, error);
        }
    }
}
