package com.example.dealerhooks.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class WebhookStats {
    private long totalDeliveries;
    private long successfulDeliveries;
    private long failedDeliveries;
    private double successRate; // 百分比
    private LocalDateTime lastDelivery;
}
