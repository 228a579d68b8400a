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
package com.familyleaf.prompting.extension.analysis.model;

import com.familyleaf.prompting.common.enums.Sentiment;
import com.familyleaf.prompting.common.enums.Urgency;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 单条消息的结构化分析结果
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageAnalysis {

    /**
     * 按置信度降序排列的分类
     */
    @Builder.Default
    private List<MessageCategory> categories = new ArrayList<>();

    /**
     * 标签，去重，最多 8 个
     */
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private Sentiment sentiment = Sentiment.NEUTRAL;

    @Builder.Default
    private List<String> topics = new ArrayList<>();

    @Builder.Default
    private Urgency urgency = Urgency.LOW;

    /**
     * 里程碑类型，例如 first_steps，未命中时为 null
     */
    private String milestone;

    @Builder.Default
    private List<String> people = new ArrayList<>();

    @Builder.Default
    private List<String> locations = new ArrayList<>();

    @Builder.Default
    private List<String> timeReferences = new ArrayList<>();

    /**
     * 首要分类（置信度最高）
     */
    public Optional<MessageCategory> primaryCategory() {
        return categories == null || categories.isEmpty()
                ? Optional.empty()
                : Optional.of(categories.get(0));
    }
}
