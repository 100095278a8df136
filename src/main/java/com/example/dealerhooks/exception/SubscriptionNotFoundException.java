package com.example.dealerhooks.exception;

public class SubscriptionNotFoundException extends WebhookException {

    public SubscriptionNotFoundException(Long id) {
        super("Webhook subscription not found: " + id);
    }
}
