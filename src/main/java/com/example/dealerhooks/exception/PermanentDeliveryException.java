package com.example.dealerhooks.exception;

/**
 * 不可重试的投递失败：4xx、非 2xx 的其他响应、目标地址非法。
 */
public class PermanentDeliveryException extends DeliveryException {

    public PermanentDeliveryException(String message, Integer statusCode) {
        super(message, statusCode, null);
    }

    public PermanentDeliveryException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
