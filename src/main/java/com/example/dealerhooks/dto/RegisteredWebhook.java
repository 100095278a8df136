package com.example.dealerhooks.dto;

/**
 * 注册结果。密钥只在注册时返回一次。
 *
 * @param id     订阅 ID
 * @param secret 签名密钥
 */
public record RegisteredWebhook(Long id, String secret) {
}
