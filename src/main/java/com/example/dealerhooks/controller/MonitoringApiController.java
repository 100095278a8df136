package com.example.dealerhooks.controller;

import com.example.dealerhooks.model.DeliveryStatus;
import com.example.dealerhooks.repository.SubscriptionRepository;
import com.example.dealerhooks.repository.WebhookDeliveryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 监控数据 API
 */
@RestController
@RequestMapping("/api/monitoring")
@RequiredArgsConstructor
public class MonitoringApiController {

    private final HealthEndpoint healthEndpoint;
    private final SubscriptionRepository subscriptionRepository;
    private final WebhookDeliveryRepository deliveryRepository;

    /**
     * 获取投递概览数据
     */
    @GetMapping("/overview")
    public Map<String, Object> getOverview() {
        Map<String, Object> overview = new LinkedHashMap<>();

        // 健康状态
        overview.put("status", healthEndpoint.health().getStatus().getCode());

        // 订阅
        long totalSubscriptions = subscriptionRepository.count();
        long activeSubscriptions = subscriptionRepository.countByActiveTrue();
        overview.put("totalSubscriptions", totalSubscriptions);
        overview.put("activeSubscriptions", activeSubscriptions);
        overview.put("disabledSubscriptions", totalSubscriptions - activeSubscriptions);

        // 投递
        long totalDeliveries = deliveryRepository.count();
        long successfulDeliveries = deliveryRepository.countByStatus(DeliveryStatus.SUCCESS);
        overview.put("totalDeliveries", totalDeliveries);
        overview.put("successfulDeliveries", successfulDeliveries);
        overview.put("failedDeliveries", deliveryRepository.countByStatus(DeliveryStatus.FAILED));
        overview.put("pendingDeliveries", deliveryRepository.countByStatus(DeliveryStatus.PENDING));

        // 计算成功率
        double successRate = totalDeliveries > 0 ? (successfulDeliveries * 100.0 / totalDeliveries) : 0;
        overview.put("successRate", String.format("%.1f", successRate));

        return overview;
    }
}
