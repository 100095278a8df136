package com.example.dealerhooks.service;

import com.example.dealerhooks.model.Subscription;
import com.example.dealerhooks.model.WebhookEnvelope;
import com.example.dealerhooks.model.WebhookEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 事件分发入口：业务模块在状态变化时调用 {@link #triggerEvent}。
 * 对每个匹配的订阅独立提交投递任务，单个订阅的失败不会影响其他订阅，也不会抛给调用方。
 */
@Service
@Slf4j
public class WebhookDispatcher {

    private final WebhookRegistryService registryService;
    private final WebhookDeliveryService deliveryService;
    private final Executor taskExecutor;

    public WebhookDispatcher(WebhookRegistryService registryService,
                             WebhookDeliveryService deliveryService,
                             @Qualifier("webhookTaskExecutor") Executor taskExecutor) {
        this.registryService = registryService;
        this.deliveryService = deliveryService;
        this.taskExecutor = taskExecutor;
    }

    /**
     * 按事件名触发。
     *
     * @param eventName 事件名，例如 "vehicle.sold"
     * @param data      业务数据
     * @return 匹配到的订阅数
     * @throws IllegalArgumentException 未知事件名
     */
    public int triggerEvent(String eventName, Object data) {
        return triggerEvent(WebhookEventType.fromValue(eventName), data);
    }

    /**
     * 触发事件并扇出到所有匹配的启用订阅。
     *
     * @param type 事件类型
     * @param data 业务数据
     * @return 匹配到的订阅数
     */
    public int triggerEvent(WebhookEventType type, Object data) {
        if (type.isWildcard()) {
            throw new IllegalArgumentException("Wildcard is a subscription filter, not an event");
        }

        List<Subscription> subscriptions = registryService.findActiveSubscribers(type).stream()
                .filter(subscription -> subscription.matches(type))
                .toList();
        if (subscriptions.isEmpty()) {
            log.info("No webhooks registered for event: {}", type);
            return 0;
        }

        WebhookEnvelope envelope = WebhookEnvelope.of(type, data);
        for (Subscription subscription : subscriptions) {
            try {
                taskExecutor.execute(() -> deliverSafely(subscription, envelope));
            } catch (RejectedExecutionException e) {
                log.error("Delivery of {} to webhook {} rejected by executor", type, subscription.getId(), e);
            }
        }

        log.info("Event {} dispatched to {} webhook(s)", type, subscriptions.size());
        return subscriptions.size();
    }

    private void deliverSafely(Subscription subscription, WebhookEnvelope envelope) {
        try {
            deliveryService.deliver(subscription, envelope);
        } catch (Exception e) {
            log.error("Webhook delivery to subscription {} aborted", subscription.getId(), e);
        }
    }
}
