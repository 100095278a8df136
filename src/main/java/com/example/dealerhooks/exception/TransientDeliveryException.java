package com.example.dealerhooks.exception;

/**
 * 可重试的投递失败：连接异常、超时、5xx。
 */
public class TransientDeliveryException extends DeliveryException {

    public TransientDeliveryException(String message, Integer statusCode) {
        super(message, statusCode, null);
    }

    public TransientDeliveryException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
