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

import com.familyleaf.prompting.common.enums.EngagementLevel;
import com.familyleaf.prompting.extension.leaf.model.LeafContentAnalysis;
import com.familyleaf.prompting.extension.leaf.model.LeafEnhancementRequest;
import com.familyleaf.prompting.extension.leaf.model.LeafEnhancementResult;
import com.familyleaf.prompting.extension.prompt.service.SmartPromptingEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("LeafAssistApiController 接口测试")
class LeafAssistApiControllerTest {

    @Mock
    private ObjectProvider<SmartPromptingEngine> engineProvider;

    @Mock
    private SmartPromptingEngine engine;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new LeafAssistApiController(engineProvider)).build();
    }

    @Test
    @DisplayName("增强单个叶子")
    void shouldEnhanceLeaf() throws Exception {
        // Given
        when(engineProvider.getIfAvailable()).thenReturn(engine);
        when(engine.enhanceLeaf(any(LeafEnhancementRequest.class))).thenReturn(LeafEnhancementResult.builder()
                .leafId("leaf-1")
                .suggestedTags(List.of("play", "outside"))
                .confidence(0.7)
                .build());

        // When & Then
        mockMvc.perform(post("/api/leaves/enhance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"leafId\":\"leaf-1\",\"content\":\"Playing at the park\","
                                + "\"context\":{\"authorName\":\"Alice\",\"childAge\":14}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.leafId").value("leaf-1"))
                .andExpect(jsonPath("$.suggestedTags[1]").value("outside"));

        ArgumentCaptor<LeafEnhancementRequest> captor = ArgumentCaptor.forClass(LeafEnhancementRequest.class);
        verify(engine).enhanceLeaf(captor.capture());
        assertThat(captor.getValue().getContext().getChildAge()).isEqualTo(14);
    }

    @Test
    @DisplayName("批量增强")
    void shouldEnhanceBatch() throws Exception {
        when(engineProvider.getIfAvailable()).thenReturn(engine);
        when(engine.enhanceLeavesBatch(anyList())).thenReturn(List.of(
                LeafEnhancementResult.builder().leafId("a").build(),
                LeafEnhancementResult.builder().leafId("b").build()));

        mockMvc.perform(post("/api/leaves/enhance/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"leafId\":\"a\"},{\"leafId\":\"b\"}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].leafId").value("a"))
                .andExpect(jsonPath("$[1].leafId").value("b"));
    }

    @Test
    @DisplayName("分析内容时缺省媒体列表为空")
    void shouldAnalyzeWithoutMedia() throws Exception {
        when(engineProvider.getIfAvailable()).thenReturn(engine);
        when(engine.analyzeLeafContent(eq("leaf-1"), eq("So cute"), eq(List.of())))
                .thenReturn(LeafContentAnalysis.builder()
                        .leafId("leaf-1")
                        .contentQuality(EngagementLevel.LOW)
                        .missingElements(List.of("emotions"))
                        .build());

        mockMvc.perform(post("/api/leaves/leaf-1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"So cute\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.missingElements[0]").value("emotions"));
    }

    @Test
    @DisplayName("引擎不可用时返回 503")
    void shouldReportUnavailableEngine() throws Exception {
        when(engineProvider.getIfAvailable()).thenReturn(null);

        mockMvc.perform(post("/api/leaves/enhance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"leafId\":\"leaf-1\"}"))
                .andExpect(status().isServiceUnavailable());
    }
}
