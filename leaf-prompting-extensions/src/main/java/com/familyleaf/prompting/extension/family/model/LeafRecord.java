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

import java.time.Instant;

/**
 * 叶子内容记录（只读视图）
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeafRecord {

    private String id;

    private String branchId;

    private String authorId;

    /**
     * 作者名，资料缺失时为 null
     */
    private String authorFirstName;

    private String authorLastName;

    private String content;

    private String milestoneType;

    private Instant createdAt;

    /**
     * 作者全名，两段都缺失时返回空串
     */
    public String authorDisplayName() {
        String first = authorFirstName != null ? authorFirstName : "";
        String last = authorLastName != null ? authorLastName : "";
        return (first + " " + last).trim();
    }
}
