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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 叶子增强请求
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeafEnhancementRequest {

    private String leafId;

    @Builder.Default
    private List<String> mediaUrls = new ArrayList<>();

    private String content;

    private LeafContext context;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LeafContext {

        private String authorName;

        private String branchName;

        private String treeName;

        /**
         * 孩子月龄
         */
        private Integer childAge;

        @Builder.Default
        private List<String> existingTags = new ArrayList<>();
    }
}
