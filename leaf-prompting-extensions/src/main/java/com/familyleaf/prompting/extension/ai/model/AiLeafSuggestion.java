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
package com.familyleaf.prompting.extension.ai.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 模型返回的叶子增强建议（JSON 结构）
 *
 * <pre>
 * {
 *   "caption": "...",
 *   "tags": ["tag1", "tag2"],
 *   "milestone": {"type": "first_steps", "confidence": 0.8, "description": "..."},
 *   "season": "toddler",
 *   "confidence": 0.9
 * }
 * </pre>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AiLeafSuggestion {

    private String caption;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private Milestone milestone;

    private String season;

    private Double confidence;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Milestone {

        private String type;

        private Double confidence;

        private String description;
    }
}
