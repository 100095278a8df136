package com.example.dealerhooks.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 注册订阅请求。secret 为空时由服务端生成。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterWebhookRequest {

    @NotBlank(message = "url is required")
    private String url;

    @NotEmpty(message = "events must not be empty")
    private List<String> events; // 事件名，"*" 表示全部

    private String secret;

    private String description;
}
