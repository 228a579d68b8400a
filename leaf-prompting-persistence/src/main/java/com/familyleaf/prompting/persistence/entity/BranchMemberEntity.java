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
 * 分支成员关系，只读
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
@Table(name = "branch_members")
public class BranchMemberEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "branch_id", length = 64, nullable = false)
    private String branchId;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    /**
     * 成员状态：active/pending/removed
     */
    @Column(name = "status", length = 20)
    private String status;

    @Column(name = "joined_at")
    private LocalDateTime joinedAt;
}
