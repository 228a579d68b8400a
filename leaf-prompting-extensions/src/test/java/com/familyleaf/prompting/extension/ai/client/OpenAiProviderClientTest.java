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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("OpenAiProviderClient 报文测试")
class OpenAiProviderClientTest {

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private PromptingProperties.Ai properties;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new PromptingProperties.Ai();
        properties.setProvider("openai");
        properties.setApiKey("sk-test");
    }

    @Test
    @DisplayName("请求体为 chat-completions 结构，读取第一条 choice")
    void shouldSendChatCompletionRequest() {
        // Given
        server.expect(requestTo("https://api.openai.com/v1/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andExpect(jsonPath("$.model").value("gpt-4"))
                .andExpect(jsonPath("$.max_tokens").value(500))
                .andExpect(jsonPath("$.temperature").value(0.7))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[0].content").value("You are Sage"))
                .andExpect(jsonPath("$.messages[1].role").value("assistant"))
                .andExpect(jsonPath("$.messages[2].role").value("user"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"role\":\"assistant\","
                        + "\"content\":\"How was the park?\"}}]}", MediaType.APPLICATION_JSON));
        OpenAiProviderClient client = new OpenAiProviderClient(restTemplate, new ObjectMapper(), properties);

        // When
        String text = client.complete(List.of(
                new SystemMessage("You are Sage"),
                new AssistantMessage("Hi there!"),
                new UserMessage("We went out")));

        // Then
        assertThat(text).isEqualTo("How was the park?");
        assertThat(client.getProvider()).isEqualTo("openai");
        assertThat(client.getModel()).isEqualTo("gpt-4");
        server.verify();
    }

    @Test
    @DisplayName("自定义模型与地址")
    void shouldUseConfiguredModelAndBaseUrl() {
        properties.setModel("gpt-4o-mini");
        properties.setBaseUrl("http://localhost:9999");
        server.expect(requestTo("http://localhost:9999/v1/chat/completions"))
                .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));
        OpenAiProviderClient client = new OpenAiProviderClient(restTemplate, new ObjectMapper(), properties);

        assertThat(client.complete(List.of(new UserMessage("hi")))).isEmpty();
        server.verify();
    }

    @Test
    @DisplayName("服务端错误转换为 AiProviderException")
    void shouldWrapServerError() {
        server.expect(requestTo("https://api.openai.com/v1/chat/completions"))
                .andRespond(withServerError());
        OpenAiProviderClient client = new OpenAiProviderClient(restTemplate, new ObjectMapper(), properties);

        assertThatThrownBy(() -> client.complete(List.of(new UserMessage("hi"))))
                .isInstanceOf(AiProviderException.class)
                .hasMessageContaining("OpenAI API error")
                .satisfies(e -> assertThat(((AiProviderException) e).getProvider()).isEqualTo("openai"));
    }
}
