package com.example.dealerhooks.config;

import com.example.dealerhooks.exception.PermanentDeliveryException;
import com.example.dealerhooks.exception.TransientDeliveryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryConfigTest {

    private RetryTemplate retryTemplate;

    @BeforeEach
    void setUp() {
        WebhookProperties properties = new WebhookProperties();
        properties.setInitialBackoff(Duration.ofMillis(20));
        properties.setBackoffMultiplier(2.0);
        properties.setMaxBackoff(Duration.ofMillis(30));
        retryTemplate = new DeliveryConfig().deliveryRetryTemplate(properties);
    }

    @Test
    void testTransientFailureRetriedUpToMaxAttemptsWithBackoff() {
        AtomicInteger calls = new AtomicInteger();

        long started = System.nanoTime();
        assertThrows(TransientDeliveryException.class, () -> retryTemplate.execute(context -> {
            calls.incrementAndGet();
            throw new TransientDeliveryException("HTTP 503", 503);
        }));
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertEquals(3, calls.get());
        // 20ms + min(40ms, 30ms)
        assertTrue(elapsedMillis >= 50, "backoff waited only " + elapsedMillis + "ms");
    }

    @Test
    void testPermanentFailureNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(PermanentDeliveryException.class, () -> retryTemplate.execute(context -> {
            calls.incrementAndGet();
            throw new PermanentDeliveryException("HTTP 404", 404);
        }));

        assertEquals(1, calls.get());
    }

    @Test
    void testRecoversWhenLaterAttemptSucceeds() {
        AtomicInteger calls = new AtomicInteger();

        String result = retryTemplate.execute(context -> {
            if (calls.incrementAndGet() < 2) {
                throw new TransientDeliveryException("Connection error: reset", (Integer) null);
            }
            return "delivered";
        });

        assertEquals("delivered", result);
        assertEquals(2, calls.get());
    }
}
