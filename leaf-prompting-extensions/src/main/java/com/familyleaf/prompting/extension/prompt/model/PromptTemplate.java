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
package com.familyleaf.prompting.extension.prompt.model;

import com.familyleaf.prompting.common.enums.PromptType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 静态提示模板
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptTemplate {

    private String id;

    private PromptType type;

    /**
     * 适用时段，null 表示任意时段
     */
    private String timeOfDay;

    /**
     * 适用的星期（英文全称），为空表示任意一天
     */
    @Builder.Default
    private List<String> daysOfWeek = new ArrayList<>();

    /**
     * 与近期内容关键词匹配时优先选用
     */
    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    /**
     * 提示正文，可包含 {userName} 与 {branchName}
     */
    private String content;

    @Builder.Default
    private List<String> suggestedResponses = new ArrayList<>();
}
