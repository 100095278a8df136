package com.example.dealerhooks.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 投递台账：每次事件触发对每个订阅只产生一条记录，自动重试不会新增记录。
 * 订阅被删除后记录保留（subscriptionId 不设外键级联）。
 */
@Entity
@Table(name = "webhook_delivery", indexes = {
        @Index(name = "idx_delivery_subscription", columnList = "subscriptionId"),
        @Index(name = "idx_delivery_created_at", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookDelivery {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long subscriptionId;

    @Column(nullable = false, length = 64)
    private String event;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload; // 序列化后的信封，签名即基于此内容

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private DeliveryStatus status = DeliveryStatus.PENDING;

    private Integer responseStatus;

    @Column(columnDefinition = "TEXT")
    private String responseBody;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    // 手动重投次数，与单次触发内的自动重试无关
    @Builder.Default
    private int retryCount = 0;

    @CreationTimestamp
    private LocalDateTime createdAt;

    private LocalDateTime deliveredAt;
}
