package com.example.dealerhooks.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;

/**
 * HMAC-SHA256 签名与验签。
 * 出站投递用 {@link #sign} 生成 X-Webhook-Signature，订阅方可用 {@link #verify} 校验。
 */
@Component
@Slf4j
public class WebhookSigner {

    private static final String HMAC_SHA256 = "HmacSHA256";

    /**
     * 计算签名。
     *
     * @param payload 原文字节
     * @param secret  密钥
     * @return 十六进制小写签名
     */
    public String sign(byte[] payload, String secret) {
        if (payload == null || secret == null) {
            throw new IllegalArgumentException("payload and secret are required");
        }
        try {
            SecretKeySpec secretKey = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256);
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(secretKey);
            return bytesToHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            // JDK 必定提供 HmacSHA256
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    public String sign(String payload, String secret) {
        return sign(payload == null ? null : payload.getBytes(StandardCharsets.UTF_8), secret);
    }

    /**
     * 校验签名。
     * 长度不一致或任意参数为空时返回 false，不抛异常。
     *
     * @param payload   原文字节
     * @param signature 待校验的十六进制签名，可带 "sha256=" 前缀
     * @param secret    密钥
     * @return 校验通过返回 true
     */
    public boolean verify(byte[] payload, String signature, String secret) {
        if (payload == null || signature == null || secret == null || secret.isEmpty()) {
            return false;
        }

        String cleanSignature = signature.startsWith("sha256=") ? signature.substring(7) : signature;
        String expected = sign(payload, secret);

        // 常量时间比较，防止计时攻击
        boolean valid = MessageDigest.isEqual(
                cleanSignature.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
        if (!valid) {
            log.debug("Webhook signature mismatch");
        }
        return valid;
    }

    public boolean verify(String payload, String signature, String secret) {
        return payload != null && verify(payload.getBytes(StandardCharsets.UTF_8), signature, secret);
    }

    /**
     * 将字节数组转为十六进制字符串。
     *
     * @param bytes 字节数组
     * @return 十六进制字符串
     */
    private String bytesToHex(byte[] bytes) {
        StringBuilder hexString = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1)
                hexString.append('0');
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
