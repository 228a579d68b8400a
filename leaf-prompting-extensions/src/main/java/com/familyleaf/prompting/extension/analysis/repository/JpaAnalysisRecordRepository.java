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
package com.familyleaf.prompting.extension.analysis.repository;

import com.familyleaf.prompting.common.enums.CategoryType;
import com.familyleaf.prompting.common.enums.Sentiment;
import com.familyleaf.prompting.common.enums.Urgency;
import com.familyleaf.prompting.common.enums.ValueEnum;
import com.familyleaf.prompting.extension.analysis.model.AnalysisRecord;
import com.familyleaf.prompting.extension.analysis.model.MessageAnalysis;
import com.familyleaf.prompting.extension.analysis.model.MessageCategory;
import com.familyleaf.prompting.persistence.entity.AnalysisRecordEntity;
import com.familyleaf.prompting.persistence.repository.AnalysisRecordJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 基于 JPA 的回复分析记录存储
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class JpaAnalysisRecordRepository implements AnalysisRecordRepository {

    private static final Logger logger = LoggerFactory.getLogger(JpaAnalysisRecordRepository.class);

    private static final String KEY_TYPE = "type";
    private static final String KEY_CONFIDENCE = "confidence";
    private static final String KEY_REASON = "reason";

    private final AnalysisRecordJpaRepository jpaRepository;
    private final Clock clock;

    public JpaAnalysisRecordRepository(AnalysisRecordJpaRepository jpaRepository, Clock clock) {
        this.jpaRepository = jpaRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public void save(AnalysisRecord record) {
        AnalysisRecordEntity entity = toEntity(record);
        jpaRepository.save(entity);
        logger.debug("保存回复分析记录: id={}, userId={}, branchId={}",
                entity.getId(), entity.getUserId(), entity.getBranchId());
    }

    @Override
    public List<AnalysisRecord> findRecent(String userId, String branchId, int limit) {
        return jpaRepository.findByUserIdAndBranchIdOrderByCreatedAtDesc(userId, branchId, PageRequest.of(0, limit))
                .stream()
                .map(this::toRecord)
                .collect(Collectors.toList());
    }

    // ==================== 转换方法 ====================

    private AnalysisRecordEntity toEntity(AnalysisRecord record) {
        MessageAnalysis analysis = record.getAnalysis() != null ? record.getAnalysis() : new MessageAnalysis();
        return AnalysisRecordEntity.builder()
                .id(record.getId() != null ? record.getId() : UUID.randomUUID().toString())
                .userId(record.getUserId())
                .branchId(record.getBranchId())
                .responseText(record.getResponseText())
                .categories(analysis.getCategories().stream()
                        .map(this::toMap)
                        .collect(Collectors.toList()))
                .tags(new ArrayList<>(analysis.getTags()))
                .sentiment(analysis.getSentiment() != null ? analysis.getSentiment().getValue() : null)
                .topics(new ArrayList<>(analysis.getTopics()))
                .urgency(analysis.getUrgency() != null ? analysis.getUrgency().getValue() : null)
                .milestone(analysis.getMilestone())
                .people(new ArrayList<>(analysis.getPeople()))
                .locations(new ArrayList<>(analysis.getLocations()))
                .timeReferences(new ArrayList<>(analysis.getTimeReferences()))
                .confidenceScore(record.getConfidenceScore())
                .createdAt(toLocalDateTime(record.getCreatedAt()))
                .build();
    }

    private AnalysisRecord toRecord(AnalysisRecordEntity entity) {
        MessageAnalysis analysis = MessageAnalysis.builder()
                .categories(toCategories(entity.getCategories()))
                .tags(orEmpty(entity.getTags()))
                .sentiment(ValueEnum.find(Sentiment.class, entity.getSentiment()).orElse(Sentiment.NEUTRAL))
                .topics(orEmpty(entity.getTopics()))
                .urgency(ValueEnum.find(Urgency.class, entity.getUrgency()).orElse(Urgency.LOW))
                .milestone(entity.getMilestone())
                .people(orEmpty(entity.getPeople()))
                .locations(orEmpty(entity.getLocations()))
                .timeReferences(orEmpty(entity.getTimeReferences()))
                .build();

        return AnalysisRecord.builder()
                .id(entity.getId())
                .userId(entity.getUserId())
                .branchId(entity.getBranchId())
                .responseText(entity.getResponseText())
                .analysis(analysis)
                .confidenceScore(entity.getConfidenceScore() != null ? entity.getConfidenceScore() : 0.5)
                .createdAt(toInstant(entity.getCreatedAt()))
                .build();
    }

    private Map<String, Object> toMap(MessageCategory category) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(KEY_TYPE, category.getType().getValue());
        map.put(KEY_CONFIDENCE, category.getConfidence());
        map.put(KEY_REASON, category.getReason());
        return map;
    }

    /**
     * 无法识别的分类类型直接丢弃
     */
    private List<MessageCategory> toCategories(List<Map<String, Object>> raw) {
        List<MessageCategory> categories = new ArrayList<>();
        if (raw == null) {
            return categories;
        }
        for (Map<String, Object> item : raw) {
            Optional<CategoryType> type = ValueEnum.find(CategoryType.class, (String) item.get(KEY_TYPE));
            if (type.isEmpty()) {
                logger.warn("忽略无法识别的分类类型: type={}", item.get(KEY_TYPE));
                continue;
            }
            Object confidence = item.get(KEY_CONFIDENCE);
            categories.add(MessageCategory.builder()
                    .type(type.get())
                    .confidence(confidence instanceof Number ? ((Number) confidence).doubleValue() : 0.0)
                    .reason((String) item.get(KEY_REASON))
                    .build());
        }
        return categories;
    }

    private List<String> orEmpty(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    private LocalDateTime toLocalDateTime(Instant instant) {
        if (instant == null) {
            return LocalDateTime.now(clock);
        }
        return LocalDateTime.ofInstant(instant, ZoneId.systemDefault());
    }

    private Instant toInstant(LocalDateTime localDateTime) {
        if (localDateTime == null) {
            return null;
        }
        return localDateTime.atZone(ZoneId.systemDefault()).toInstant();
    }
}
