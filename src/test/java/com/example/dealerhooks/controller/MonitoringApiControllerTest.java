package com.example.dealerhooks.controller;

import com.example.dealerhooks.model.DeliveryStatus;
import com.example.dealerhooks.model.Subscription;
import com.example.dealerhooks.model.WebhookDelivery;
import com.example.dealerhooks.model.WebhookEventType;
import com.example.dealerhooks.repository.SubscriptionRepository;
import com.example.dealerhooks.repository.WebhookDeliveryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Set;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class MonitoringApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SubscriptionRepository subscriptionRepository;

    @Autowired
    private WebhookDeliveryRepository deliveryRepository;

    @BeforeEach
    void setUp() {
        deliveryRepository.deleteAll();
        subscriptionRepository.deleteAll();

        Subscription active = subscriptionRepository.save(Subscription.builder()
                .targetUrl("https://a.example/hook")
                .events(Set.of(WebhookEventType.ALL))
                .secret("a")
                .build());
        subscriptionRepository.save(Subscription.builder()
                .targetUrl("https://b.example/hook")
                .events(Set.of(WebhookEventType.VEHICLE_SOLD))
                .secret("b")
                .active(false)
                .failureCount(10)
                .build());

        for (DeliveryStatus status : new DeliveryStatus[] { DeliveryStatus.SUCCESS, DeliveryStatus.SUCCESS,
                DeliveryStatus.SUCCESS, DeliveryStatus.FAILED }) {
            deliveryRepository.save(WebhookDelivery.builder()
                    .subscriptionId(active.getId())
                    .event("vehicle.sold")
                    .payload("{}")
                    .status(status)
                    .build());
        }
    }

    @Test
    void overviewSummarizesSubscriptionsAndDeliveries() throws Exception {
        mockMvc.perform(get("/api/monitoring/overview"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.totalSubscriptions").value(2))
                .andExpect(jsonPath("$.activeSubscriptions").value(1))
                .andExpect(jsonPath("$.disabledSubscriptions").value(1))
                .andExpect(jsonPath("$.totalDeliveries").value(4))
                .andExpect(jsonPath("$.successfulDeliveries").value(3))
                .andExpect(jsonPath("$.failedDeliveries").value(1))
                .andExpect(jsonPath("$.pendingDeliveries").value(0));
    }
}
