package com.example.dealerhooks.exception;

import lombok.Getter;

/**
 * 单次 HTTP 投递尝试失败。
 */
@Getter
public abstract class DeliveryException extends WebhookException {

    /**
     * 订阅方返回的状态码，传输层失败时为 null。
     */
    private final Integer statusCode;

    protected DeliveryException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
