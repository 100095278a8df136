package com.example.dealerhooks.service;

import com.example.dealerhooks.model.WebhookEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

/**
 * 信封的规范化 JSON 序列化：信封字段固定为 event、timestamp、data 顺序，
 * data 内的对象属性与 Map 键按字典序输出，保证相同内容得到相同字节。
 */
@Component
public class WebhookPayloadSerializer {

    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public String serialize(WebhookEnvelope envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event data is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 从已保存的信封中读取时间戳，用于重投时的 X-Webhook-Timestamp。
     */
    public String readTimestamp(String payload) {
        try {
            JsonNode node = mapper.readTree(payload);
            return node.path("timestamp").asText("");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload is not valid JSON", e);
        }
    }
}
