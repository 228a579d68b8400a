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
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("AnthropicProviderClient 报文测试")
class AnthropicProviderClientTest {

    private static final String URL = "https://api.anthropic.com/v1/messages";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private PromptingProperties.Ai properties;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new PromptingProperties.Ai();
        properties.setProvider("anthropic");
        properties.setApiKey("ak-test");
    }

    @Test
    @DisplayName("系统消息单独传递，其余消息按角色排列")
    void shouldSendMessagesRequest() {
        // Given
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("x-api-key", "ak-test"))
                .andExpect(header("anthropic-version", "2023-06-01"))
                .andExpect(jsonPath("$.model").value("claude-3-sonnet-20240229"))
                .andExpect(jsonPath("$.system").value("You are Sage"))
                .andExpect(jsonPath("$.messages", hasSize(2)))
                .andExpect(jsonPath("$.messages[0].role").value("assistant"))
                .andExpect(jsonPath("$.messages[1].role").value("user"))
                .andExpect(jsonPath("$.messages[1].content").value("She laughed"))
                .andRespond(withSuccess("{\"content\":[{\"type\":\"text\",\"text\":\"What made her laugh?\"}]}",
                        MediaType.APPLICATION_JSON));
        AnthropicProviderClient client = new AnthropicProviderClient(restTemplate, new ObjectMapper(), properties);

        // When
        String text = client.complete(List.of(
                new SystemMessage("You are Sage"),
                new AssistantMessage("Any news?"),
                new UserMessage("She laughed")));

        // Then
        assertThat(text).isEqualTo("What made her laugh?");
        server.verify();
    }

    @Test
    @DisplayName("只有系统消息时补一条开场用户消息")
    void shouldAddKickoffMessageForEmptyConversation() {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.messages", hasSize(1)))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[0].content").value(AnthropicProviderClient.KICKOFF_MESSAGE))
                .andRespond(withSuccess("{\"content\":[{\"type\":\"text\",\"text\":\"Hello!\"}]}",
                        MediaType.APPLICATION_JSON));
        AnthropicProviderClient client = new AnthropicProviderClient(restTemplate, new ObjectMapper(), properties);

        assertThat(client.complete(List.of(new SystemMessage("You are Sage")))).isEqualTo("Hello!");
        server.verify();
    }

    @Test
    @DisplayName("鉴权失败转换为 AiProviderException")
    void shouldWrapClientError() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));
        AnthropicProviderClient client = new AnthropicProviderClient(restTemplate, new ObjectMapper(), properties);

        assertThatThrownBy(() -> client.complete(List.of(new UserMessage("hi"))))
                .isInstanceOf(AiProviderException.class)
                .hasMessageContaining("Anthropic API error");
    }
}
