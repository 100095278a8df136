package com.example.dealerhooks.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 部分更新订阅，null 字段保持不变。更新不会清零连续失败次数。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateWebhookRequest {
    private String url;
    private List<String> events;
    private String secret;
    private String description;
    private Boolean active;
}
