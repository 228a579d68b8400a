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
package com.familyleaf.prompting.extension.family.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 分支信息
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BranchInfo {

    public static final String DEFAULT_NAME = "Family";
    public static final String DEFAULT_TYPE = "family";

    private String id;

    private String name;

    /**
     * family/community/topic/local
     */
    private String type;

    /**
     * 分支不存在时使用的占位信息
     */
    public static BranchInfo fallback(String branchId) {
        return new BranchInfo(branchId, DEFAULT_NAME, DEFAULT_TYPE);
    }
}
