package com.example.dealerhooks.service;

import com.example.dealerhooks.dto.RegisteredWebhook;
import com.example.dealerhooks.dto.UpdateWebhookRequest;
import com.example.dealerhooks.exception.InvalidSubscriptionException;
import com.example.dealerhooks.exception.SubscriptionNotFoundException;
import com.example.dealerhooks.model.Subscription;
import com.example.dealerhooks.model.WebhookEventType;
import com.example.dealerhooks.repository.SubscriptionRepository;
import com.example.dealerhooks.utils.TargetUrlValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;

/**
 * 订阅注册表：增删改查。删除订阅不会删除其投递台账。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookRegistryService {

    private static final int SECRET_BYTES = 32;

    private final SubscriptionRepository repository;
    private final TargetUrlValidator urlValidator;
    private final SecureRandom random = new SecureRandom();

    /**
     * 注册订阅。不校验目标是否可达。
     *
     * @param url         目标地址
     * @param events      事件名列表
     * @param secret      签名密钥，为空时自动生成
     * @param description 描述
     * @return 订阅 ID 与密钥
     */
    @Transactional
    public RegisteredWebhook register(String url, Collection<String> events, String secret, String description) {
        String targetUrl = urlValidator.validate(url);
        Set<WebhookEventType> eventTypes = parseEvents(events);
        String finalSecret = secret == null || secret.isBlank() ? generateSecret() : secret;

        Subscription sub = Subscription.builder()
                .targetUrl(targetUrl)
                .events(eventTypes)
                .secret(finalSecret)
                .description(description)
                .active(true)
                .build();
        sub = repository.save(sub);

        log.info("Registered webhook {} -> {} for {}", sub.getId(), targetUrl, eventTypes);
        return new RegisteredWebhook(sub.getId(), finalSecret);
    }

    /**
     * 部分更新订阅。
     *
     * @param id      订阅 ID
     * @param request 更新内容，null 字段忽略
     */
    @Transactional
    public Subscription update(Long id, UpdateWebhookRequest request) {
        Subscription sub = get(id);

        if (request.getUrl() != null && !request.getUrl().isBlank()) {
            sub.setTargetUrl(urlValidator.validate(request.getUrl()));
        }
        if (request.getEvents() != null) {
            sub.setEvents(parseEvents(request.getEvents()));
        }
        if (request.getSecret() != null && !request.getSecret().isBlank()) {
            sub.setSecret(request.getSecret());
        }
        if (request.getDescription() != null) {
            sub.setDescription(request.getDescription());
        }
        if (request.getActive() != null) {
            if (request.getActive() && !sub.isActive()) {
                log.info("Webhook {} re-activated (failure streak {})", id, sub.getFailureCount());
            }
            sub.setActive(request.getActive());
        }

        return repository.save(sub);
    }

    /**
     * 删除订阅（不可恢复）。
     *
     * @param id 订阅 ID
     */
    @Transactional
    public void delete(Long id) {
        if (!repository.existsById(id)) {
            throw new SubscriptionNotFoundException(id);
        }
        repository.deleteById(id);
        log.info("Deleted webhook {}", id);
    }

    @Transactional(readOnly = true)
    public List<Subscription> list() {
        return repository.findAllByOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public Subscription get(Long id) {
        return repository.findById(id).orElseThrow(() -> new SubscriptionNotFoundException(id));
    }

    /**
     * 查询应接收该事件的启用订阅（直接订阅或通配）。
     */
    @Transactional(readOnly = true)
    public List<Subscription> findActiveSubscribers(WebhookEventType type) {
        return repository.findActiveByEventTypes(EnumSet.of(type, WebhookEventType.ALL));
    }

    private Set<WebhookEventType> parseEvents(Collection<String> events) {
        if (events == null || events.isEmpty()) {
            throw new InvalidSubscriptionException("At least one event is required");
        }
        Set<WebhookEventType> types = EnumSet.noneOf(WebhookEventType.class);
        for (String name : events) {
            try {
                types.add(WebhookEventType.fromValue(name));
            } catch (IllegalArgumentException e) {
                throw new InvalidSubscriptionException(e.getMessage());
            }
        }
        return types;
    }

    private String generateSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
