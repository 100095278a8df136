package com.example.dealerhooks.exception;

/**
 * 对已成功的投递记录发起手动重投。
 */
public class DeliveryAlreadySucceededException extends WebhookException {

    public DeliveryAlreadySucceededException(Long deliveryId) {
        super("Delivery already successful: " + deliveryId);
    }
}
