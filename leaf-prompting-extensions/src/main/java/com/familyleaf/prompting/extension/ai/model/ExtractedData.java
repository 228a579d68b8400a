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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 从对话文本中抽取的结构化信息
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedData {

    private ExtractedMilestone milestone;

    /**
     * 非中性时为 positive/negative，否则为 null
     */
    private String mood;

    @Builder.Default
    private List<String> activities = new ArrayList<>();

    @Builder.Default
    private List<String> people = new ArrayList<>();

    @Builder.Default
    private List<String> locations = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExtractedMilestone {

        private String type;

        /**
         * ISO 日期，例如 2025-08-27
         */
        private String date;

        private String description;
    }
}
