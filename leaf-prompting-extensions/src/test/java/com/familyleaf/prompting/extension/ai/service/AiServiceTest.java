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
package com.familyleaf.prompting.extension.ai.service;

import com.familyleaf.prompting.common.enums.PromptType;
import com.familyleaf.prompting.common.exception.AiProviderException;
import com.familyleaf.prompting.extension.ai.client.ProviderClient;
import com.familyleaf.prompting.extension.ai.model.AiLeafSuggestion;
import com.familyleaf.prompting.extension.ai.model.AiPromptContext;
import com.familyleaf.prompting.extension.ai.model.AiResponse;
import com.familyleaf.prompting.extension.ai.model.ExtractedData;
import com.familyleaf.prompting.extension.analysis.service.ResponseAnalyzer;
import com.familyleaf.prompting.extension.cache.LocalStateCache;
import com.familyleaf.prompting.extension.context.model.TimeContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AiService 单元测试")
class AiServiceTest {

    private static final String USER = "user-1";
    private static final String BRANCH = "branch-1";
    private static final Instant NOW = Instant.parse("2024-06-10T10:00:00Z");

    @Mock
    private ProviderClient providerClient;

    @Captor
    private ArgumentCaptor<List<Message>> messagesCaptor;

    private AiService aiService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        lenient().when(providerClient.getProvider()).thenReturn("openai");
        lenient().when(providerClient.getModel()).thenReturn("gpt-4");
        aiService = new AiService(providerClient, new ResponseAnalyzer(),
                new LocalStateCache<>("conversation-history", null, clock), new ObjectMapper(), clock, 4);
    }

    @Test
    @DisplayName("最近内容带里程碑时生成庆祝提示并记录历史")
    void shouldGenerateCelebrationPrompt() {
        // Given
        String reply = "What a wonderful milestone! How did you feel when you saw it happen?";
        when(providerClient.complete(anyList())).thenReturn(reply);
        AiPromptContext context = context(List.of(recent("She walked!", "first_steps", NOW.minusSeconds(3600))));

        // When
        AiResponse response = aiService.generatePrompt(context);

        // Then
        assertThat(response.getMessage()).isEqualTo(reply);
        assertThat(response.getPromptType()).isEqualTo(PromptType.CELEBRATION);
        assertThat(response.getSuggestedResponses()).hasSize(4);
        assertThat(response.getConfidenceScore()).isCloseTo(0.9, within(1e-9));

        verify(providerClient).complete(messagesCaptor.capture());
        List<Message> sent = messagesCaptor.getValue();
        assertThat(sent).hasSize(1);
        assertThat(sent.get(0).getMessageType()).isEqualTo(MessageType.SYSTEM);
        assertThat(sent.get(0).getText()).contains("Sage").contains("The Lees").contains("celebration is in order");

        List<Message> history = aiService.getConversationHistory(BRANCH, USER);
        assertThat(history).hasSize(1);
        assertThat(history.get(0).getMessageType()).isEqualTo(MessageType.ASSISTANT);
    }

    @Test
    @DisplayName("历史按上限截断")
    void shouldBoundConversationHistory() {
        when(providerClient.complete(anyList())).thenReturn("Tell me about your day?");
        AiPromptContext context = context(new ArrayList<>());

        for (int i = 0; i < 6; i++) {
            aiService.generatePrompt(context);
        }

        assertThat(aiService.getConversationHistory(BRANCH, USER)).hasSize(4);
    }

    @Test
    @DisplayName("追问失败时用户消息已进入历史，助手消息不写入")
    void shouldKeepUserMessageWhenFollowUpFails() {
        when(providerClient.complete(anyList())).thenThrow(new AiProviderException("openai", "timeout"));

        assertThatThrownBy(() -> aiService.processUserResponse("We went to the beach", context(new ArrayList<>()),
                PromptType.MEMORY))
                .isInstanceOf(AiProviderException.class);

        List<Message> history = aiService.getConversationHistory(BRANCH, USER);
        assertThat(history).hasSize(1);
        assertThat(history.get(0).getMessageType()).isEqualTo(MessageType.USER);
        assertThat(history.get(0).getText()).isEqualTo("We went to the beach");
    }

    @Test
    @DisplayName("追问成功时从用户回复和追问中抽取结构化信息")
    void shouldExtractDataFromFollowUp() {
        when(providerClient.complete(anyList())).thenReturn("That sounds lovely! Who was with you?");

        AiResponse response = aiService.processUserResponse("Emma started walking at the park",
                context(new ArrayList<>()), PromptType.CHECKIN);

        assertThat(response.getPromptType()).isEqualTo(PromptType.FOLLOWUP);
        ExtractedData data = response.getExtractedData();
        assertThat(data.getMilestone().getType()).isEqualTo("first_steps");
        assertThat(data.getMilestone().getDate()).isEqualTo("2024-06-10");
        assertThat(data.getActivities()).contains("park", "walking");
        assertThat(data.getLocations()).contains("park");
        assertThat(data.getMood()).isEqualTo("positive");
        assertThat(aiService.getConversationHistory(BRANCH, USER)).hasSize(2);
    }

    @Test
    @DisplayName("叶子增强：从回复中截取 JSON 解析")
    void shouldParseLeafEnhancementJson() {
        when(providerClient.complete(anyList())).thenReturn(
                "Sure! {\"caption\":\"Fun at the park\",\"tags\":[\"play\",\"outside\"],"
                        + "\"milestone\":{\"type\":\"first_steps\",\"confidence\":0.9},\"season\":\"summer\","
                        + "\"confidence\":0.85,\"extra\":true} Hope it helps");

        AiLeafSuggestion suggestion = aiService.generateLeafEnhancement("Enhance this leaf");

        assertThat(suggestion.getCaption()).isEqualTo("Fun at the park");
        assertThat(suggestion.getTags()).containsExactly("play", "outside");
        assertThat(suggestion.getMilestone().getType()).isEqualTo("first_steps");
        assertThat(suggestion.getConfidence()).isEqualTo(0.85);
    }

    @Test
    @DisplayName("叶子增强回复没有 JSON 时抛出服务商异常")
    void shouldRejectLeafEnhancementWithoutJson() {
        when(providerClient.complete(anyList())).thenReturn("I cannot help with that");

        assertThatThrownBy(() -> aiService.generateLeafEnhancement("Enhance this leaf"))
                .isInstanceOf(AiProviderException.class);
    }

    @Test
    @DisplayName("提示类型：超过 24 小时无新内容为问候，傍晚无历史为问候，否则回忆")
    void shouldDeterminePromptType() {
        AiPromptContext stale = context(List.of(recent("Lunch", null, NOW.minus(Duration.ofHours(30)))));
        assertThat(aiService.determinePromptType(stale, new ArrayList<>())).isEqualTo(PromptType.CHECKIN);

        AiPromptContext evening = context(new ArrayList<>());
        evening.setTimeContext(new TimeContext(TimeContext.EVENING, "Monday", "summer"));
        assertThat(aiService.determinePromptType(evening, new ArrayList<>())).isEqualTo(PromptType.CHECKIN);

        AiPromptContext fresh = context(List.of(recent("Lunch", null, NOW.minus(Duration.ofHours(2)))));
        assertThat(aiService.determinePromptType(fresh, new ArrayList<>())).isEqualTo(PromptType.MEMORY);
    }

    @Test
    @DisplayName("清空对话历史")
    void shouldClearConversationHistory() {
        when(providerClient.complete(anyList())).thenReturn("Hello?");
        aiService.generatePrompt(context(new ArrayList<>()));

        aiService.clearConversationHistory(BRANCH, USER);

        assertThat(aiService.getConversationHistory(BRANCH, USER)).isEmpty();
    }

    private AiPromptContext context(List<AiPromptContext.RecentMessage> recent) {
        return AiPromptContext.builder()
                .userId(USER)
                .branchId(BRANCH)
                .branchName("The Lees")
                .branchType("family")
                .userName("Sarah Lee")
                .recentMessages(new ArrayList<>(recent))
                .timeContext(new TimeContext(TimeContext.MORNING, "Monday", "summer"))
                .build();
    }

    private AiPromptContext.RecentMessage recent(String content, String milestoneType, Instant timestamp) {
        return AiPromptContext.RecentMessage.builder()
                .content(content)
                .author("Ann")
                .timestamp(timestamp)
                .milestoneType(milestoneType)
                .build();
    }
}
