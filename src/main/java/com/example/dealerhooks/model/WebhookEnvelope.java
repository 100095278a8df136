package com.example.dealerhooks.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * 发送给订阅方的标准信封：{event, timestamp, data}。
 *
 * @param event     事件名
 * @param timestamp ISO-8601 时间（UTC，毫秒精度）
 * @param data      业务数据
 */
@JsonPropertyOrder({ "event", "timestamp", "data" })
public record WebhookEnvelope(String event, String timestamp, Object data) {

    public static WebhookEnvelope of(WebhookEventType type, Object data) {
        return new WebhookEnvelope(type.getValue(),
                Instant.now().truncatedTo(ChronoUnit.MILLIS).toString(), data);
    }
}
