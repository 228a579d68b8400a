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
package com.familyleaf.prompting.extension.context.repository;

import com.familyleaf.prompting.common.enums.ConversationPhase;
import com.familyleaf.prompting.common.enums.ValueEnum;
import com.familyleaf.prompting.extension.context.model.ConversationPreferences;
import com.familyleaf.prompting.extension.context.model.ConversationState;
import com.familyleaf.prompting.extension.context.model.InteractionRecord;
import com.familyleaf.prompting.persistence.entity.ConversationStateEntity;
import com.familyleaf.prompting.persistence.repository.ConversationStateJpaRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 基于 JPA 的会话状态存储
 * <p>
 * preferences 与 response_history 以 JSONB 保存，通过 ObjectMapper 与领域模型互转
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class JpaConversationStateRepository implements ConversationStateRepository {

    private static final Logger logger = LoggerFactory.getLogger(JpaConversationStateRepository.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<Map<String, Object>>> LIST_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<InteractionRecord>> HISTORY_TYPE = new TypeReference<>() {
    };

    private final ConversationStateJpaRepository jpaRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JpaConversationStateRepository(ConversationStateJpaRepository jpaRepository, ObjectMapper objectMapper,
                                          Clock clock) {
        this.jpaRepository = jpaRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<ConversationState> find(String userId, String branchId) {
        return jpaRepository.findByUserIdAndBranchId(userId, branchId).map(this::toState);
    }

    @Override
    @Transactional
    public void upsert(ConversationState state) {
        LocalDateTime now = LocalDateTime.now(clock);
        ConversationStateEntity entity = jpaRepository.findByUserIdAndBranchId(state.getUserId(), state.getBranchId())
                .orElseGet(() -> ConversationStateEntity.builder()
                        .id(UUID.randomUUID().toString())
                        .userId(state.getUserId())
                        .branchId(state.getBranchId())
                        .createdAt(now)
                        .build());

        entity.setLastInteraction(toLocalDateTime(state.getLastInteraction()));
        entity.setConversationPhase(state.getConversationPhase() != null
                ? state.getConversationPhase().getValue() : ConversationPhase.INITIAL.getValue());
        entity.setCurrentTopic(state.getCurrentTopic());
        entity.setPreferences(objectMapper.convertValue(state.getPreferences(), MAP_TYPE));
        entity.setResponseHistory(objectMapper.convertValue(state.getResponseHistory(), LIST_TYPE));
        entity.setUpdatedAt(now);

        jpaRepository.save(entity);
        logger.debug("保存会话状态: userId={}, branchId={}, phase={}, historySize={}",
                state.getUserId(), state.getBranchId(), entity.getConversationPhase(),
                state.getResponseHistory() != null ? state.getResponseHistory().size() : 0);
    }

    // ==================== 转换方法 ====================

    private ConversationState toState(ConversationStateEntity entity) {
        return ConversationState.builder()
                .userId(entity.getUserId())
                .branchId(entity.getBranchId())
                .lastInteraction(toInstant(entity.getLastInteraction()))
                .conversationPhase(ValueEnum.find(ConversationPhase.class, entity.getConversationPhase())
                        .orElse(ConversationPhase.INITIAL))
                .currentTopic(entity.getCurrentTopic())
                .preferences(toPreferences(entity.getPreferences()))
                .responseHistory(toHistory(entity.getResponseHistory()))
                .build();
    }

    private ConversationPreferences toPreferences(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return ConversationPreferences.defaults();
        }
        try {
            ConversationPreferences preferences = objectMapper.convertValue(raw, ConversationPreferences.class);
            return preferences != null ? preferences : ConversationPreferences.defaults();
        } catch (IllegalArgumentException e) {
            logger.warn("会话偏好解析失败，使用默认值: raw={}", raw, e);
            return ConversationPreferences.defaults();
        }
    }

    private List<InteractionRecord> toHistory(List<Map<String, Object>> raw) {
        if (raw == null || raw.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.convertValue(raw, HISTORY_TYPE));
        } catch (IllegalArgumentException e) {
            logger.warn("互动历史解析失败，按空历史处理: size={}", raw.size(), e);
            return new ArrayList<>();
        }
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
