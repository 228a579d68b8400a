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
package com.familyleaf.prompting.extension.leaf.model;

import com.familyleaf.prompting.common.enums.EngagementLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 叶子内容质量分析
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeafContentAnalysis {

    private String leafId;

    private EngagementLevel contentQuality;

    /**
     * 按优先级排列，最多 4 条
     */
    @Builder.Default
    private List<String> suggestions = new ArrayList<>();

    /**
     * emotions / context / people / actions
     */
    @Builder.Default
    private List<String> missingElements = new ArrayList<>();
}
