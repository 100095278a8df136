package com.example.dealerhooks.controller;

import com.example.dealerhooks.dto.RegisterWebhookRequest;
import com.example.dealerhooks.dto.RegisteredWebhook;
import com.example.dealerhooks.dto.SubscriptionResponse;
import com.example.dealerhooks.dto.UpdateWebhookRequest;
import com.example.dealerhooks.dto.WebhookStats;
import com.example.dealerhooks.model.WebhookDelivery;
import com.example.dealerhooks.service.DeliveryLedger;
import com.example.dealerhooks.service.WebhookDeliveryService;
import com.example.dealerhooks.service.WebhookRegistryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Webhook 订阅管理接口。
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookAdminController {

    private final WebhookRegistryService registryService;
    private final WebhookDeliveryService deliveryService;
    private final DeliveryLedger ledger;

    /**
     * 订阅列表（最新在前）。
     */
    @GetMapping
    public List<SubscriptionResponse> list() {
        return registryService.list().stream().map(SubscriptionResponse::from).toList();
    }

    /**
     * 注册订阅。
     *
     * @param request 注册参数
     * @return 订阅 ID 与密钥
     */
    @PostMapping
    public ResponseEntity<RegisteredWebhook> register(@Valid @RequestBody RegisterWebhookRequest request) {
        RegisteredWebhook registered = registryService.register(request.getUrl(), request.getEvents(),
                request.getSecret(), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(registered);
    }

    @GetMapping("/{id}")
    public SubscriptionResponse get(@PathVariable Long id) {
        return SubscriptionResponse.from(registryService.get(id));
    }

    /**
     * 部分更新订阅（地址、事件、密钥、启用状态、描述）。
     */
    @PatchMapping("/{id}")
    public SubscriptionResponse update(@PathVariable Long id, @RequestBody UpdateWebhookRequest request) {
        return SubscriptionResponse.from(registryService.update(id, request));
    }

    /**
     * 删除订阅，投递历史保留。
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        registryService.delete(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * 投递历史。
     *
     * @param id    订阅 ID
     * @param limit 条数
     */
    @GetMapping("/{id}/deliveries")
    public List<WebhookDelivery> deliveries(@PathVariable Long id,
            @RequestParam(defaultValue = "0") int limit) {
        return ledger.history(id, limit);
    }

    @GetMapping("/{id}/stats")
    public WebhookStats stats(@PathVariable Long id) {
        return ledger.stats(id);
    }

    /**
     * 发送测试事件。
     */
    @PostMapping("/{id}/test")
    public WebhookDelivery test(@PathVariable Long id) {
        return deliveryService.sendTest(id);
    }

    /**
     * 手动重投失败记录。
     *
     * @param deliveryId 台账记录 ID
     */
    @PostMapping("/deliveries/{deliveryId}/retry")
    public WebhookDelivery retry(@PathVariable Long deliveryId) {
        return deliveryService.retryDelivery(deliveryId);
    }
}
