package com.example.dealerhooks.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 可订阅的事件类型（封闭集合）。
 * 新事件只需在此处追加一个常量。
 */
public enum WebhookEventType {

    // 车辆
    VEHICLE_CREATED("vehicle.created"),
    VEHICLE_UPDATED("vehicle.updated"),
    VEHICLE_DELETED("vehicle.deleted"),
    VEHICLE_SOLD("vehicle.sold"),

    // 询价
    INQUIRY_RECEIVED("inquiry.received"),
    INQUIRY_UPDATED("inquiry.updated"),

    CONTACT_RECEIVED("contact.received"),

    // 预约
    APPOINTMENT_SCHEDULED("appointment.scheduled"),
    APPOINTMENT_CONFIRMED("appointment.confirmed"),
    APPOINTMENT_CANCELLED("appointment.cancelled"),
    APPOINTMENT_COMPLETED("appointment.completed"),

    // 支付
    PAYMENT_INITIATED("payment.initiated"),
    PAYMENT_COMPLETED("payment.completed"),
    PAYMENT_FAILED("payment.failed"),
    PAYMENT_REFUNDED("payment.refunded"),

    // 交车
    DELIVERY_SCHEDULED("delivery.scheduled"),
    DELIVERY_IN_TRANSIT("delivery.in_transit"),
    DELIVERY_COMPLETED("delivery.completed"),

    // 邮件订阅
    NEWSLETTER_SUBSCRIBED("newsletter.subscribed"),
    NEWSLETTER_UNSUBSCRIBED("newsletter.unsubscribed"),

    // 管理端测试投递
    TEST("test"),

    // 通配符：匹配全部事件
    ALL("*");

    private static final Map<String, WebhookEventType> BY_VALUE = Arrays.stream(values())
            .collect(Collectors.toMap(WebhookEventType::getValue, Function.identity()));

    private final String value;

    WebhookEventType(String value) {
        this.value = value;
    }

    /**
     * 线上传输使用的事件名，例如 "vehicle.sold"。
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isWildcard() {
        return this == ALL;
    }

    /**
     * 按事件名解析。
     *
     * @param value 事件名
     * @return 事件类型
     * @throws IllegalArgumentException 未知事件名
     */
    @JsonCreator
    public static WebhookEventType fromValue(String value) {
        WebhookEventType type = value == null ? null : BY_VALUE.get(value.trim());
        if (type == null) {
            throw new IllegalArgumentException("Unknown webhook event: " + value);
        }
        return type;
    }

    @Override
    public String toString() {
        return value;
    }
}
