package com.example.dealerhooks.service;

import com.example.dealerhooks.config.WebhookProperties;
import com.example.dealerhooks.exception.PermanentDeliveryException;
import com.example.dealerhooks.exception.TransientDeliveryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 执行单次 HTTP 投递，并把失败归类为可重试 / 不可重试。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookHttpSender {

    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    public static final String EVENT_HEADER = "X-Webhook-Event";
    public static final String TIMESTAMP_HEADER = "X-Webhook-Timestamp";

    private final HttpClient webhookHttpClient;
    private final WebhookProperties properties;

    public record Response(int statusCode, String body) {
    }

    /**
     * 发送一次签名后的 POST 请求。
     *
     * @param targetUrl 目标地址
     * @param payload   已序列化的信封
     * @param signature 签名
     * @param event     事件名
     * @param timestamp 信封时间戳
     * @return 2xx 响应
     * @throws TransientDeliveryException 连接失败、超时、5xx
     * @throws PermanentDeliveryException 其他非 2xx 响应或地址非法
     */
    public Response send(String targetUrl, String payload, String signature, String event, String timestamp) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(targetUrl))
                    .timeout(properties.getRequestTimeout())
                    .header("Content-Type", "application/json")
                    .header(SIGNATURE_HEADER, signature)
                    .header(EVENT_HEADER, event)
                    .header(TIMESTAMP_HEADER, timestamp)
                    .header("User-Agent", properties.getUserAgent())
                    .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new PermanentDeliveryException("Invalid target URL: " + e.getMessage(), e);
        }

        // request.timeout 只约束响应头，整次交换（含响应体）由同一截止时间约束
        long timeoutMillis = properties.getRequestTimeout().toMillis();
        CompletableFuture<HttpResponse<String>> exchange =
                webhookHttpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> response;
        try {
            response = exchange.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            exchange.cancel(true);
            throw new TransientDeliveryException("Timed out after " + timeoutMillis + "ms", e);
        } catch (ExecutionException e) {
            throw classify(unwrap(e.getCause()), timeoutMillis);
        } catch (InterruptedException e) {
            exchange.cancel(true);
            Thread.currentThread().interrupt();
            throw new PermanentDeliveryException("Delivery interrupted", e);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return new Response(status, response.body());
        }
        if (status >= 500) {
            throw new TransientDeliveryException("HTTP " + status, status);
        }
        throw new PermanentDeliveryException("HTTP " + status, status);
    }

    private Throwable unwrap(Throwable cause) {
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private RuntimeException classify(Throwable cause, long timeoutMillis) {
        if (cause instanceof HttpTimeoutException) {
            return new TransientDeliveryException("Timed out after " + timeoutMillis + "ms: " + cause.getMessage(),
                    cause);
        }
        if (cause instanceof IOException) {
            return new TransientDeliveryException("Connection error: " + describe((IOException) cause), cause);
        }
        return new PermanentDeliveryException("Delivery failed: " + cause, cause);
    }

    private String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
