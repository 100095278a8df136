package com.example.dealerhooks.service;

import com.example.dealerhooks.dto.RegisteredWebhook;
import com.example.dealerhooks.dto.UpdateWebhookRequest;
import com.example.dealerhooks.model.Subscription;
import com.example.dealerhooks.model.WebhookEventType;
import com.example.dealerhooks.repository.SubscriptionRepository;
import com.example.dealerhooks.repository.WebhookDeliveryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SubscriptionHealthGovernorTest {

    @Autowired
    private SubscriptionHealthGovernor governor;

    @Autowired
    private WebhookRegistryService registryService;

    @Autowired
    private WebhookDispatcher dispatcher;

    @Autowired
    private SubscriptionRepository subscriptionRepository;

    @Autowired
    private WebhookDeliveryRepository deliveryRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @BeforeEach
    void setUp() {
        deliveryRepository.deleteAll();
        subscriptionRepository.deleteAll();
    }

    private Long register() {
        RegisteredWebhook webhook = registryService.register("https://sub.example/hook",
                List.of("vehicle.sold"), null, null);
        return webhook.id();
    }

    @Test
    void testSuccessResetsStreak() {
        Long id = register();
        governor.recordOutcome(id, false, "HTTP 500");
        governor.recordOutcome(id, false, "HTTP 502");

        Subscription failing = registryService.get(id);
        assertEquals(2, failing.getFailureCount());
        assertEquals("HTTP 502", failing.getLastError());

        governor.recordOutcome(id, true, null);

        Subscription recovered = registryService.get(id);
        assertEquals(0, recovered.getFailureCount());
        assertNotNull(recovered.getLastTriggeredAt());
        assertTrue(recovered.isActive());
    }

    @Test
    void testTenConsecutiveFailuresDisableSubscription() {
        Long id = register();
        for (int i = 0; i < 9; i++) {
            governor.recordOutcome(id, false, "Connection error");
        }
        assertTrue(registryService.get(id).isActive());

        governor.recordOutcome(id, false, "Connection error");

        Subscription disabled = registryService.get(id);
        assertFalse(disabled.isActive());
        assertEquals(10, disabled.getFailureCount());

        // 停用后不再参与自动分发
        assertEquals(0, dispatcher.triggerEvent(WebhookEventType.VEHICLE_SOLD, Map.of("vehicleId", "v1")));
    }

    @Test
    void testReactivationIsExplicitAndKeepsStreak() {
        Long id = register();
        for (int i = 0; i < 10; i++) {
            governor.recordOutcome(id, false, "HTTP 503");
        }
        governor.recordOutcome(id, true, null);
        assertFalse(registryService.get(id).isActive());

        registryService.update(id, UpdateWebhookRequest.builder().active(true).build());

        assertTrue(registryService.get(id).isActive());
    }

    @Test
    void testUpdateDoesNotOverwriteFailureRecordedMeanwhile() {
        Long id = register();
        for (int i = 0; i < 9; i++) {
            governor.recordOutcome(id, false, "HTTP 500");
        }

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            // 编辑事务提交前，另一线程记录第 10 次失败
            transactionTemplate.executeWithoutResult(status -> {
                registryService.update(id, UpdateWebhookRequest.builder().description("renamed").build());
                Future<?> failure = pool.submit(() -> governor.recordOutcome(id, false, "HTTP 500"));
                try {
                    failure.get(10, TimeUnit.SECONDS);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            });
        } finally {
            pool.shutdown();
        }

        Subscription sub = registryService.get(id);
        assertEquals("renamed", sub.getDescription());
        assertEquals(10, sub.getFailureCount());
        assertFalse(sub.isActive());
    }

    @Test
    void testConcurrentFailuresAreCountedExactly() throws Exception {
        Long id = register();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(pool.submit(() -> governor.recordOutcome(id, false, "HTTP 500")));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdown();
        }

        Subscription sub = registryService.get(id);
        assertEquals(16, sub.getFailureCount());
        assertFalse(sub.isActive());
    }

    @Test
    void testMissingSubscriptionIsIgnored() {
        assertDoesNotThrow(() -> governor.recordOutcome(987654L, false, "HTTP 500"));
        assertDoesNotThrow(() -> governor.recordOutcome(987654L, true, null));
    }
}
