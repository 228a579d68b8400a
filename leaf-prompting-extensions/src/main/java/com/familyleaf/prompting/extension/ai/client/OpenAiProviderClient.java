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
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * OpenAI chat-completions 客户端
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class OpenAiProviderClient implements ProviderClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiProviderClient.class);

    public static final String PROVIDER = "openai";
    public static final String DEFAULT_MODEL = "gpt-4";
    public static final String DEFAULT_BASE_URL = "https://api.openai.com";
    static final String COMPLETIONS_PATH = "/v1/chat/completions";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final PromptingProperties.Ai properties;
    private final String model;
    private final String url;

    public OpenAiProviderClient(RestTemplate restTemplate, ObjectMapper objectMapper, PromptingProperties.Ai properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.model = properties.getModel() != null && !properties.getModel().isBlank()
                ? properties.getModel() : DEFAULT_MODEL;
        String baseUrl = properties.getBaseUrl() != null && !properties.getBaseUrl().isBlank()
                ? properties.getBaseUrl() : DEFAULT_BASE_URL;
        this.url = baseUrl + COMPLETIONS_PATH;
    }

    @Override
    public String complete(List<Message> messages) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages.stream()
                .map(message -> Map.of(
                        "role", message.getMessageType().getValue(),
                        "content", message.getText() != null ? message.getText() : ""))
                .collect(Collectors.toList()));
        body.put("max_tokens", properties.getMaxTokens());
        body.put("temperature", properties.getTemperature());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(properties.getApiKey());

        String response;
        try {
            response = restTemplate.postForObject(url, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientException e) {
            log.error("OpenAI 调用失败: model={}, messages={}", model, messages.size(), e);
            throw new AiProviderException(PROVIDER, "OpenAI API error: " + e.getMessage(), e);
        }

        try {
            JsonNode root = objectMapper.readTree(response == null ? "{}" : response);
            String text = root.path("choices").path(0).path("message").path("content").asText("");
            log.debug("OpenAI 调用完成: model={}, length={}", model, text.length());
            return text;
        } catch (JsonProcessingException e) {
            throw new AiProviderException(PROVIDER, "OpenAI 响应无法解析", e);
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
