/*
 * Copyright 2024-2025 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.familyleaf.prompting.extension.ai.client;

import com.familyleaf.prompting.common.exception.AiProviderException;
import com.familyleaf.prompting.extension.config.PromptingProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic messages 客户端
 * <p>
 * system 消息单独放入 {@code system} 字段，其余消息按原顺序放入 {@code messages}。
 * 只有 system 消息时补一条 user 开场消息，因为该接口要求至少一条用户消息。
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class AnthropicProviderClient implements ProviderClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicProviderClient.class);

    public static final String PROVIDER = "anthropic";
    public static final String DEFAULT_MODEL = "claude-3-sonnet-20240229";
    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    static final String MESSAGES_PATH = "/v1/messages";
    static final String API_VERSION = "2023-06-01";
    static final String KICKOFF_MESSAGE = "Please start the conversation.";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final PromptingProperties.Ai properties;
    private final String model;
    private final String url;

    public AnthropicProviderClient(RestTemplate restTemplate, ObjectMapper objectMapper,
                                   PromptingProperties.Ai properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.model = properties.getModel() != null && !properties.getModel().isBlank()
                ? properties.getModel() : DEFAULT_MODEL;
        String baseUrl = properties.getBaseUrl() != null && !properties.getBaseUrl().isBlank()
                ? properties.getBaseUrl() : DEFAULT_BASE_URL;
        this.url = baseUrl + MESSAGES_PATH;
    }

    @Override
    public String complete(List<Message> messages) {
        String system = "";
        List<Map<String, String>> conversation = new ArrayList<>();
        for (Message message : messages) {
            String text = message.getText() != null ? message.getText() : "";
            if (message.getMessageType() == MessageType.SYSTEM) {
                if (system.isEmpty()) {
                    system = text;
                }
                continue;
            }
            conversation.add(Map.of("role", message.getMessageType().getValue(), "content", text));
        }
        if (conversation.isEmpty()) {
            conversation.add(Map.of("role", MessageType.USER.getValue(), "content", KICKOFF_MESSAGE));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("max_tokens", properties.getMaxTokens());
        body.put("temperature", properties.getTemperature());
        body.put("system", system);
        body.put("messages", conversation);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-api-key", properties.getApiKey());
        headers.set("anthropic-version", API_VERSION);

        String response;
        try {
            response = restTemplate.postForObject(url, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientException e) {
            log.error("Anthropic 调用失败: model={}, messages={}", model, conversation.size(), e);
            throw new AiProviderException(PROVIDER, "Anthropic API error: " + e.getMessage(), e);
        }

        try {
            JsonNode root = objectMapper.readTree(response == null ? "{}" : response);
            String text = root.path("content").path(0).path("text").asText("");
            log.debug("Anthropic 调用完成: model={}, length={}", model, text.length());
            return text;
        } catch (JsonProcessingException e) {
            throw new AiProviderException(PROVIDER, "Anthropic 响应无法解析", e);
        }
    }

    @Override
    public String getProvider() {
        return PROVIDER;
    }

    @Override
    public String getModel() {
        return model;
    }
}
