package com.example.dealerhooks.exception;

/**
 * 注册或更新订阅时参数非法（URL 协议、事件名等）。
 */
public class InvalidSubscriptionException extends WebhookException {

    public InvalidSubscriptionException(String message) {
        super(message);
    }
}
