package com.example.dealerhooks.service;

import com.example.dealerhooks.config.WebhookProperties;
import com.example.dealerhooks.exception.DeliveryAlreadySucceededException;
import com.example.dealerhooks.exception.DeliveryException;
import com.example.dealerhooks.exception.RetryLimitExceededException;
import com.example.dealerhooks.exception.SubscriptionNotFoundException;
import com.example.dealerhooks.model.DeliveryStatus;
import com.example.dealerhooks.model.Subscription;
import com.example.dealerhooks.model.WebhookDelivery;
import com.example.dealerhooks.model.WebhookEnvelope;
import com.example.dealerhooks.model.WebhookEventType;
import com.example.dealerhooks.repository.SubscriptionRepository;
import com.example.dealerhooks.security.WebhookSigner;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Webhook 投递执行器：签名、发送、自动重试，并写入台账与健康状态。
 * 每次触发只产生一条台账记录，自动重试只更新这条记录。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookDeliveryService {

    private final DeliveryLedger ledger;
    private final SubscriptionHealthGovernor healthGovernor;
    private final SubscriptionRepository subscriptionRepository;
    private final WebhookSigner signer;
    private final WebhookPayloadSerializer serializer;
    private final WebhookHttpSender sender;
    private final RetryTemplate deliveryRetryTemplate;
    private final WebhookProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * 向单个订阅投递事件。
     *
     * @param subscription 订阅
     * @param envelope     信封
     * @return 终态的台账记录
     */
    public WebhookDelivery deliver(Subscription subscription, WebhookEnvelope envelope) {
        String payload = serializer.serialize(envelope);
        String signature = signer.sign(payload, subscription.getSecret());
        WebhookDelivery delivery = ledger.open(subscription.getId(), envelope.event(), payload);

        attempt(delivery.getId(), subscription, envelope.event(), envelope.timestamp(), payload, signature);
        return ledger.get(delivery.getId());
    }

    /**
     * 手动重投一条失败记录，使用台账中保存的原始信封。
     * 每次调用无论成败都会消耗一次手动重投额度。
     *
     * @param deliveryId 台账记录 ID
     * @return 重投后的台账记录
     * @throws DeliveryAlreadySucceededException 记录已成功
     * @throws RetryLimitExceededException       手动重投额度已用尽
     * @throws SubscriptionNotFoundException     订阅已被删除
     */
    public WebhookDelivery retryDelivery(Long deliveryId) {
        WebhookDelivery delivery = ledger.get(deliveryId);
        rejectIfNotRetryable(delivery);

        Subscription subscription = subscriptionRepository.findById(delivery.getSubscriptionId())
                .orElseThrow(() -> new SubscriptionNotFoundException(delivery.getSubscriptionId()));

        if (!ledger.claimManualRetry(deliveryId)) {
            // 并发重投抢先占用了额度或已经成功
            rejectIfNotRetryable(ledger.get(deliveryId));
            throw new RetryLimitExceededException(deliveryId, properties.getManualRetryLimit());
        }

        String payload = delivery.getPayload();
        String signature = signer.sign(payload, subscription.getSecret());
        log.info("Manual retry #{} of delivery {} to {}", delivery.getRetryCount() + 1, deliveryId,
                subscription.getTargetUrl());

        attempt(deliveryId, subscription, delivery.getEvent(), serializer.readTimestamp(payload), payload, signature);
        return ledger.get(deliveryId);
    }

    /**
     * 向订阅发送一条测试事件。
     *
     * @param subscriptionId 订阅 ID
     * @return 台账记录
     */
    public WebhookDelivery sendTest(Long subscriptionId) {
        Subscription subscription = subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new SubscriptionNotFoundException(subscriptionId));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", "This is a test webhook");
        data.put("webhookId", subscription.getId());
        return deliver(subscription, WebhookEnvelope.of(WebhookEventType.TEST, data));
    }

    private void rejectIfNotRetryable(WebhookDelivery delivery) {
        if (delivery.getStatus() == DeliveryStatus.SUCCESS) {
            throw new DeliveryAlreadySucceededException(delivery.getId());
        }
        if (delivery.getRetryCount() >= properties.getManualRetryLimit()) {
            throw new RetryLimitExceededException(delivery.getId(), properties.getManualRetryLimit());
        }
    }

    private void attempt(Long deliveryId, Subscription subscription, String event, String timestamp,
                         String payload, String signature) {
        String targetUrl = subscription.getTargetUrl();
        WebhookHttpSender.Response response;
        try {
            response = deliveryRetryTemplate.execute(context -> {
                int attemptNo = context.getRetryCount() + 1;
                try {
                    return sender.send(targetUrl, payload, signature, event, timestamp);
                } catch (DeliveryException e) {
                    log.warn("Delivery {} -> {} attempt {}/{} failed: {}", deliveryId, targetUrl, attemptNo,
                            properties.getMaxAttempts(), e.getMessage());
                    throw e;
                }
            });
        } catch (DeliveryException e) {
            fail(deliveryId, subscription.getId(), e.getStatusCode(), e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("Unexpected error delivering {} to {}", deliveryId, targetUrl, e);
            fail(deliveryId, subscription.getId(), null, e.getMessage() != null ? e.getMessage() : e.toString());
            return;
        }

        ledger.markSucceeded(deliveryId, response.statusCode(), response.body());
        meterRegistry.counter("webhook.deliveries", "outcome", "success").increment();
        log.info("Webhook delivered: subscription={} event={} delivery={} status={}",
                subscription.getId(), event, deliveryId, response.statusCode());
        try {
            healthGovernor.recordOutcome(subscription.getId(), true, null);
        } catch (RuntimeException e) {
            // 投递已成功，健康状态更新失败不能记为投递失败
            log.error("Failed to record success of delivery {} for subscription {}", deliveryId,
                    subscription.getId(), e);
        }
    }

    private void fail(Long deliveryId, Long subscriptionId, Integer statusCode, String error) {
        ledger.markFailed(deliveryId, statusCode, error);
        healthGovernor.recordOutcome(subscriptionId, false, error);
        meterRegistry.counter("webhook.deliveries", "outcome", "failure").increment();
        log.warn("Webhook delivery failed: subscription={} delivery={} error={}", subscriptionId, deliveryId, error);
    }
}
