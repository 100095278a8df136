package com.example.dealerhooks.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

/**
 * Webhook 订阅。
 * failureCount / active 由健康管理的单条 UPDATE 维护，实体更新只写入发生变化的列，
 * 避免管理端编辑覆盖并发写入的失败计数。
 */
@Entity
@Table(name = "subscription")
@DynamicUpdate
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 2048)
    private String targetUrl; // 例如 "https://crm.example.com/hooks"

    // 订阅的事件集合，ALL 表示通配
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "subscription_event", joinColumns = @JoinColumn(name = "subscription_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 64)
    @Builder.Default
    private Set<WebhookEventType> events = new HashSet<>();

    @ToString.Exclude
    @Column(nullable = false)
    private String secret; // HMAC 签名密钥

    private String description;

    @Builder.Default
    private boolean active = true;

    // 连续失败次数，成功后清零
    @Builder.Default
    private int failureCount = 0;

    private LocalDateTime lastTriggeredAt;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    /**
     * 判断订阅是否关心该事件（直接订阅或通配）。
     *
     * @param type 事件类型
     * @return true 表示匹配
     */
    public boolean matches(WebhookEventType type) {
        return events != null && (events.contains(type) || events.contains(WebhookEventType.ALL));
    }

    public void setEvents(Set<WebhookEventType> events) {
        this.events = events == null ? new HashSet<>() : new HashSet<>(events);
    }
}
