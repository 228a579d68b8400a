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
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 用户会话状态实体，每个 (user_id, branch_id) 一行
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "user_conversation_states",
        uniqueConstraints = @UniqueConstraint(name = "uk_conversation_state_user_branch",
                columnNames = {"user_id", "branch_id"}))
public class ConversationStateEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    @Column(name = "branch_id", length = 64, nullable = false)
    private String branchId;

    @Column(name = "last_interaction", nullable = false)
    private LocalDateTime lastInteraction;

    /**
     * 会话阶段：initial/active/followup/concluded
     */
    @Column(name = "conversation_phase", length = 20)
    private String conversationPhase;

    @Column(name = "current_topic", length = 100)
    private String currentTopic;

    /**
     * 偏好设置，JSONB类型
     * 例如：{"promptStyle":"casual","reminderFrequency":"medium","preferredTopics":[],"bestTimeForPrompts":"anytime"}
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "preferences", columnDefinition = "jsonb")
    private Map<String, Object> preferences;

    /**
     * 互动历史，最多保留 50 条
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "response_history", columnDefinition = "jsonb")
    private List<Map<String, Object>> responseHistory;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
