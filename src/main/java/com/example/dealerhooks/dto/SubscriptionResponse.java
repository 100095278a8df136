package com.example.dealerhooks.dto;

import com.example.dealerhooks.model.Subscription;
import com.example.dealerhooks.model.WebhookEventType;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 订阅视图（不含密钥）。
 */
@Data
@Builder
public class SubscriptionResponse {
    private Long id;
    private String url;
    private List<String> events;
    private String description;
    private boolean active;
    private int failureCount;
    private LocalDateTime lastTriggeredAt;
    private String lastError;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static SubscriptionResponse from(Subscription sub) {
        return SubscriptionResponse.builder()
                .id(sub.getId())
                .url(sub.getTargetUrl())
                .events(sub.getEvents().stream().map(WebhookEventType::getValue).sorted().toList())
                .description(sub.getDescription())
                .active(sub.isActive())
                .failureCount(sub.getFailureCount())
                .lastTriggeredAt(sub.getLastTriggeredAt())
                .lastError(sub.getLastError())
                .createdAt(sub.getCreatedAt())
                .updatedAt(sub.getUpdatedAt())
                .build();
    }
}
