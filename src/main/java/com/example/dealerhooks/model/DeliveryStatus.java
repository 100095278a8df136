package com.example.dealerhooks.model;

/**
 * 投递记录状态。SUCCESS 与 FAILED 为终态，SUCCESS 不可回退。
 */
public enum DeliveryStatus {
    PENDING,
    SUCCESS,
    FAILED
}
