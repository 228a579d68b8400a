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
import java.util.List;
import java.util.Map;

/**
 * 用户回复分析记录实体，只追加不修改
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "ai_response_analysis", indexes = {
        @Index(name = "idx_response_analysis_user_branch", columnList = "user_id, branch_id, created_at")
})
public class AnalysisRecordEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    @Column(name = "branch_id", length = 64, nullable = false)
    private String branchId;

    @Column(name = "response_text", columnDefinition = "text")
    private String responseText;

    /**
     * 分类列表，元素结构：{"type":"milestone","confidence":0.95,"reason":"..."}
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "categories", columnDefinition = "jsonb")
    private List<Map<String, Object>> categories;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags", columnDefinition = "jsonb")
    private List<String> tags;

    /**
     * 情感：positive/neutral/negative
     */
    @Column(name = "sentiment", length = 20)
    private String sentiment;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "topics", columnDefinition = "jsonb")
    private List<String> topics;

    /**
     * 紧急程度：low/medium/high
     */
    @Column(name = "urgency", length = 20)
    private String urgency;

    @Column(name = "milestone", length = 50)
    private String milestone;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "people", columnDefinition = "jsonb")
    private List<String> people;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "locations", columnDefinition = "jsonb")
    private List<String> locations;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "time_references", columnDefinition = "jsonb")
    private List<String> timeReferences;

    /**
     * 首要分类的置信度
     */
    @Column(name = "confidence_score")
    private Double confidenceScore;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
