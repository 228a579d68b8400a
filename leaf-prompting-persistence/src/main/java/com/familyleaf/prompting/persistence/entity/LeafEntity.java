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
package com.familyleaf.prompting.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * 叶子（用户发布的内容），提示引擎只读
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Entity
@Builder
@Immutable
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "leaves")
public class LeafEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "branch_id", length = 64, nullable = false)
    private String branchId;

    @Column(name = "author_id", length = 64, nullable = false)
    private String authorId;

    @Column(name = "content", columnDefinition = "text")
    private String content;

    /**
     * 里程碑类型，例如 first_steps，可为空
     */
    @Column(name = "milestone_type", length = 50)
    private String milestoneType;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
