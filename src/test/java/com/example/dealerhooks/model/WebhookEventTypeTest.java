package com.example.dealerhooks.model;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WebhookEventTypeTest {

    @Test
    void testFromValue() {
        assertEquals(WebhookEventType.VEHICLE_SOLD, WebhookEventType.fromValue("vehicle.sold"));
        assertEquals(WebhookEventType.DELIVERY_IN_TRANSIT, WebhookEventType.fromValue(" delivery.in_transit "));
        assertEquals(WebhookEventType.ALL, WebhookEventType.fromValue("*"));
        assertTrue(WebhookEventType.ALL.isWildcard());
    }

    @Test
    void testUnknownValueRejected() {
        assertThrows(IllegalArgumentException.class, () -> WebhookEventType.fromValue("vehicle.stolen"));
        assertThrows(IllegalArgumentException.class, () -> WebhookEventType.fromValue("VEHICLE_SOLD"));
        assertThrows(IllegalArgumentException.class, () -> WebhookEventType.fromValue(null));
    }

    @Test
    void testWireNamesAreUnique() {
        long distinct = java.util.Arrays.stream(WebhookEventType.values())
                .map(WebhookEventType::getValue)
                .distinct()
                .count();
        assertEquals(WebhookEventType.values().length, distinct);
    }

    @Test
    void testSubscriptionMatching() {
        Subscription direct = Subscription.builder().events(Set.of(WebhookEventType.VEHICLE_SOLD)).build();
        assertTrue(direct.matches(WebhookEventType.VEHICLE_SOLD));
        assertFalse(direct.matches(WebhookEventType.PAYMENT_COMPLETED));

        Subscription wildcard = Subscription.builder().events(Set.of(WebhookEventType.ALL)).build();
        assertTrue(wildcard.matches(WebhookEventType.NEWSLETTER_UNSUBSCRIBED));

        // 通配与具体事件同时存在是合法的冗余配置
        Subscription both = Subscription.builder()
                .events(Set.of(WebhookEventType.ALL, WebhookEventType.VEHICLE_SOLD))
                .build();
        assertTrue(both.matches(WebhookEventType.VEHICLE_SOLD));
        assertTrue(both.matches(WebhookEventType.INQUIRY_RECEIVED));
    }
}
