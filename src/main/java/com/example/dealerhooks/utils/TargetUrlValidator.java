package com.example.dealerhooks.utils;

import com.example.dealerhooks.exception.InvalidSubscriptionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 订阅目标地址校验。
 * 只做语法层面的检查（协议、主机、黑名单主机），不解析 DNS，也不探测可达性；
 * 不可达的地址会在投递时以失败形式体现。
 */
@Component
@Slf4j
public class TargetUrlValidator {

    private final List<String> blockedHosts;

    public TargetUrlValidator(@Value("${app.webhook.blocked-hosts:}") String blockedHostsConfig) {
        this.blockedHosts = Arrays.stream(blockedHostsConfig.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    /**
     * 校验目标地址。
     *
     * @param url 目标 URL
     * @return 规范化后的 URL
     * @throws InvalidSubscriptionException 地址不可用于投递
     */
    public String validate(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidSubscriptionException("Target URL is required");
        }
        URI uri;
        try {
            uri = URI.create(url.trim()).normalize();
        } catch (IllegalArgumentException e) {
            log.warn("Rejected malformed target URL {}: {}", url, e.getMessage());
            throw new InvalidSubscriptionException("Malformed target URL: " + url);
        }

        // 协议白名单
        String scheme = uri.getScheme();
        if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
            throw new InvalidSubscriptionException("Unsupported protocol: " + scheme);
        }

        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new InvalidSubscriptionException("Host cannot be empty");
        }

        // 显式拦截通配/零地址
        if (host.equals("0.0.0.0") || host.equals("::") || host.equals("[::]")) {
            throw new InvalidSubscriptionException("Blocked wildcard address: " + host);
        }

        if (blockedHosts.contains(host.toLowerCase(Locale.ROOT))) {
            throw new InvalidSubscriptionException("Blocked host: " + host);
        }

        return uri.toString();
    }

    /**
     * 快速判断 URL 是否可用。
     *
     * @param url 目标 URL
     * @return true 表示可用
     */
    public boolean isValid(String url) {
        try {
            validate(url);
            return true;
        } catch (InvalidSubscriptionException e) {
            return false;
        }
    }
}
