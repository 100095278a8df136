package com.example.dealerhooks.exception;

public class DeliveryNotFoundException extends WebhookException {

    public DeliveryNotFoundException(Long id) {
        super("Webhook delivery not found: " + id);
    }
}
