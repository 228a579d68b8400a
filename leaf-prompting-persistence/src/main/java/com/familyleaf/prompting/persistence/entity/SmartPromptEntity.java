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
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 系统生成的智能提示实体
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "ai_system_messages", indexes = {
        @Index(name = "idx_system_messages_user_branch", columnList = "user_id, branch_id, status"),
        @Index(name = "idx_system_messages_expires_at", columnList = "expires_at")
})
public class SmartPromptEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "branch_id", length = 64, nullable = false)
    private String branchId;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    /**
     * 消息类型：prompt/response/system
     */
    @Column(name = "message_type", length = 20, nullable = false)
    private String messageType;

    @Column(name = "content", columnDefinition = "text", nullable = false)
    private String content;

    /**
     * 提示类型：checkin/milestone/memory/followup/celebration/leaf_caption/leaf_tags
     */
    @Column(name = "prompt_type", length = 30)
    private String promptType;

    /**
     * 存储状态：pending/responded/dismissed，过期状态不落库
     */
    @Column(name = "status", length = 20, nullable = false)
    private String status;

    /**
     * 上下文数据，例如：{"suggestedResponses":["..."]}
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "context_data", columnDefinition = "jsonb")
    private Map<String, Object> contextData;

    /**
     * 生成元数据，例如：{"provider":"demo","model":"demo","confidence":0.8,"template":"evening-memory"}
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "ai_metadata", columnDefinition = "jsonb")
    private Map<String, Object> aiMetadata;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;
}
