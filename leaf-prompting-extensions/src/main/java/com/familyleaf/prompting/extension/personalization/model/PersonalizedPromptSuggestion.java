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
package com.familyleaf.prompting.extension.personalization.model;

import com.familyleaf.prompting.common.enums.PromptType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 个性化提示建议
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonalizedPromptSuggestion {

    private String content;

    private PromptType promptType;

    private double confidence;

    /**
     * 命中的个性化信号说明
     */
    @Builder.Default
    private List<String> reasoning = new ArrayList<>();

    private SuggestedTiming suggestedTiming;

    @Builder.Default
    private List<String> suggestedResponses = new ArrayList<>();

    private PersonalizationFactors personalizationFactors;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SuggestedTiming {

        private int hour;

        private String day;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PersonalizationFactors {

        @Builder.Default
        private List<String> basedOnTopics = new ArrayList<>();

        @Builder.Default
        private List<String> basedOnPeople = new ArrayList<>();

        private boolean basedOnTiming;

        private boolean basedOnSentiment;
    }
}
