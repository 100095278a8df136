package com.example.dealerhooks.exception;

/**
 * 手动重投次数已用尽。
 */
public class RetryLimitExceededException extends WebhookException {

    public RetryLimitExceededException(Long deliveryId, int limit) {
        super("Maximum retry attempts reached for delivery " + deliveryId + " (limit " + limit + ")");
    }
}
