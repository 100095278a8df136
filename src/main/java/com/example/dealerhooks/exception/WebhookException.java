package com.example.dealerhooks.exception;

/**
 * Webhook 子系统异常基类。
 */
public class WebhookException extends RuntimeException {

    public WebhookException(String message) {
        super(message);
    }

    public WebhookException(String message, Throwable cause) {
        super(message, cause);
    }
}
