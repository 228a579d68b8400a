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
package com.familyleaf.prompting.start.controller;

import com.familyleaf.prompting.common.enums.PromptStatus;
import com.familyleaf.prompting.common.enums.PromptType;
import com.familyleaf.prompting.extension.ai.model.AiResponse;
import com.familyleaf.prompting.extension.prompt.model.SmartPrompt;
import com.familyleaf.prompting.extension.prompt.service.SmartPromptingEngine;
import com.familyleaf.prompting.start.filter.LoginContextFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("SmartPromptApiController 接口测试")
class SmartPromptApiControllerTest {

    private static final String USER_HEADER = "X-User-Id";

    @Mock
    private ObjectProvider<SmartPromptingEngine> engineProvider;

    @Mock
    private SmartPromptingEngine engine;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SmartPromptApiController(engineProvider))
                .addFilters(new LoginContextFilter())
                .build();
    }

    private static SmartPrompt prompt(String id, PromptStatus status) {
        Instant createdAt = Instant.parse("2024-06-10T10:00:00Z");
        return SmartPrompt.builder()
                .id(id)
                .branchId("branch-1")
                .userId("user-1")
                .content("How has your day been with the family?")
                .promptType(PromptType.CHECKIN)
                .suggestedResponses(List.of("Had a great day!"))
                .createdAt(createdAt)
                .expiresAt(createdAt.plusSeconds(48 * 3600))
                .status(status)
                .build();
    }

    @Test
    @DisplayName("查询待处理提示")
    void shouldListPendingPrompts() throws Exception {
        // Given
        when(engineProvider.getIfAvailable()).thenReturn(engine);
        when(engine.getPendingPrompts("user-1", "branch-1")).thenReturn(List.of(prompt("p-1", PromptStatus.PENDING)));

        // When & Then
        mockMvc.perform(get("/api/prompts/pending").param("branchId", "branch-1").header(USER_HEADER, "user-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].id").value("p-1"))
                .andExpect(jsonPath("$.items[0].promptType").value("checkin"))
                .andExpect(jsonPath("$.items[0].status").value("pending"))
                .andExpect(jsonPath("$.items[0].expiresAt").value("2024-06-12T10:00:00Z"));
    }

    @Test
    @DisplayName("缺少用户标识时返回 400")
    void shouldRejectMissingUser() throws Exception {
        mockMvc.perform(get("/api/prompts/pending").param("branchId", "branch-1"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(engineProvider);
    }

    @Test
    @DisplayName("引擎不可用时返回 503")
    void shouldReportUnavailableEngine() throws Exception {
        when(engineProvider.getIfAvailable()).thenReturn(null);

        mockMvc.perform(post("/api/prompts/generate").param("branchId", "branch-1").header(USER_HEADER, "user-1"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    @DisplayName("不适合提示时生成接口返回 204")
    void shouldReturnNoContentWhenNotDue() throws Exception {
        when(engineProvider.getIfAvailable()).thenReturn(engine);
        when(engine.generateProactivePrompt("user-1", "branch-1")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/prompts/generate").param("branchId", "branch-1").header(USER_HEADER, "user-1"))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("回复提示并返回追问")
    void shouldRespondWithFollowUp() throws Exception {
        // Given
        when(engineProvider.getIfAvailable()).thenReturn(engine);
        when(engine.processUserResponse("p-1", "We spent the whole afternoon at the park!", "user-1", "branch-1"))
                .thenReturn(Optional.of(AiResponse.builder()
                        .message("What was the best part?")
                        .promptType(PromptType.FOLLOWUP)
                        .confidenceScore(0.7)
                        .build()));

        // When & Then
        mockMvc.perform(post("/api/prompts/p-1/respond")
                        .header(USER_HEADER, "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"branchId\":\"branch-1\",\"response\":\"We spent the whole afternoon at the park!\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.followUp.message").value("What was the best part?"));
    }

    @Test
    @DisplayName("回复缺少分支时返回 400")
    void shouldRejectRespondWithoutBranch() throws Exception {
        mockMvc.perform(post("/api/prompts/p-1/respond")
                        .header(USER_HEADER, "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\":\"Hi\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("忽略提示，不可忽略时返回 404")
    void shouldDismissPrompt() throws Exception {
        when(engineProvider.getIfAvailable()).thenReturn(engine);
        when(engine.dismissPrompt("p-1")).thenReturn(Optional.of(prompt("p-1", PromptStatus.DISMISSED)));
        when(engine.dismissPrompt("p-2")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/prompts/p-1/dismiss").header(USER_HEADER, "user-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("dismissed"));
        mockMvc.perform(post("/api/prompts/p-2/dismiss").header(USER_HEADER, "user-1"))
                .andExpect(status().isNotFound());
        verify(engine).dismissPrompt("p-2");
    }

    @Test
    @DisplayName("刷新用户模式缓存")
    void shouldRefreshInsights() throws Exception {
        when(engineProvider.getIfAvailable()).thenReturn(engine);

        mockMvc.perform(post("/api/prompts/insights/refresh").header(USER_HEADER, "user-1"))
                .andExpect(status().isNoContent());
        verify(engine).refreshUserPatterns();
    }
}
