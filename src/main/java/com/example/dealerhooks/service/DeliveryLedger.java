package com.example.dealerhooks.service;

import com.example.dealerhooks.config.WebhookProperties;
import com.example.dealerhooks.dto.WebhookStats;
import com.example.dealerhooks.exception.DeliveryNotFoundException;
import com.example.dealerhooks.model.DeliveryStatus;
import com.example.dealerhooks.model.WebhookDelivery;
import com.example.dealerhooks.repository.WebhookDeliveryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 投递台账：只追加、不删除，成功记录不回退。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryLedger {

    private final WebhookDeliveryRepository repository;
    private final WebhookProperties properties;

    /**
     * 新建 PENDING 记录。
     */
    @Transactional
    public WebhookDelivery open(Long subscriptionId, String event, String payload) {
        WebhookDelivery delivery = WebhookDelivery.builder()
                .subscriptionId(subscriptionId)
                .event(event)
                .payload(payload)
                .status(DeliveryStatus.PENDING)
                .build();
        return repository.save(delivery);
    }

    @Transactional
    public void markSucceeded(Long deliveryId, int statusCode, String responseBody) {
        int updated = repository.markSucceeded(deliveryId, statusCode, truncate(responseBody), LocalDateTime.now());
        if (updated == 0) {
            log.warn("Delivery {} was already successful, success not recorded twice", deliveryId);
        }
    }

    @Transactional
    public void markFailed(Long deliveryId, Integer statusCode, String errorMessage) {
        int updated = repository.markFailed(deliveryId, statusCode, errorMessage);
        if (updated == 0) {
            log.warn("Delivery {} is already successful, ignoring failure: {}", deliveryId, errorMessage);
        }
    }

    /**
     * 占用一次手动重投额度。
     *
     * @return true 表示成功占用；false 表示记录已成功或额度已用尽
     */
    @Transactional
    public boolean claimManualRetry(Long deliveryId) {
        return repository.claimManualRetry(deliveryId, properties.getManualRetryLimit()) == 1;
    }

    @Transactional(readOnly = true)
    public WebhookDelivery get(Long deliveryId) {
        return repository.findById(deliveryId).orElseThrow(() -> new DeliveryNotFoundException(deliveryId));
    }

    /**
     * 查询订阅的投递历史（最新在前）。
     *
     * @param subscriptionId 订阅 ID
     * @param limit          条数，非正数时使用默认值
     */
    @Transactional(readOnly = true)
    public List<WebhookDelivery> history(Long subscriptionId, int limit) {
        int size = limit > 0 ? limit : properties.getHistoryLimit();
        return repository.findBySubscriptionIdOrderByCreatedAtDescIdDesc(subscriptionId, PageRequest.of(0, size));
    }

    @Transactional(readOnly = true)
    public WebhookStats stats(Long subscriptionId) {
        long total = repository.countBySubscriptionId(subscriptionId);
        long successful = repository.countBySubscriptionIdAndStatus(subscriptionId, DeliveryStatus.SUCCESS);
        long failed = repository.countBySubscriptionIdAndStatus(subscriptionId, DeliveryStatus.FAILED);
        LocalDateTime lastDelivery = repository.findFirstBySubscriptionIdOrderByCreatedAtDescIdDesc(subscriptionId)
                .map(WebhookDelivery::getCreatedAt)
                .orElse(null);

        return WebhookStats.builder()
                .totalDeliveries(total)
                .successfulDeliveries(successful)
                .failedDeliveries(failed)
                .successRate(total > 0 ? (successful * 100.0 / total) : 0)
                .lastDelivery(lastDelivery)
                .build();
    }

    private String truncate(String body) {
        if (body == null) {
            return null;
        }
        int limit = properties.getResponseBodyLimit();
        return body.length() > limit ? body.substring(0, limit) : body;
    }
}
