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
package com.familyleaf.prompting.extension.prompt.repository;

import com.familyleaf.prompting.common.enums.PromptStatus;
import com.familyleaf.prompting.common.enums.PromptType;
import com.familyleaf.prompting.common.enums.ValueEnum;
import com.familyleaf.prompting.extension.prompt.model.AiMetadata;
import com.familyleaf.prompting.extension.prompt.model.SmartPrompt;
import com.familyleaf.prompting.persistence.entity.SmartPromptEntity;
import com.familyleaf.prompting.persistence.repository.SmartPromptJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
 * 基于 JPA 的智能提示存储，对应 ai_system_messages 表中 message_type=prompt 的记录
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class JpaSmartPromptRepository implements SmartPromptRepository {

    private static final Logger logger = LoggerFactory.getLogger(JpaSmartPromptRepository.class);

    static final String MESSAGE_TYPE_PROMPT = "prompt";

    private static final String KEY_SUGGESTED_RESPONSES = "suggestedResponses";
    private static final String KEY_PROVIDER = "provider";
    private static final String KEY_MODEL = "model";
    private static final String KEY_CONFIDENCE = "confidence";
    private static final String KEY_TEMPLATE = "template";

    private final SmartPromptJpaRepository jpaRepository;
    private final Clock clock;

    public JpaSmartPromptRepository(SmartPromptJpaRepository jpaRepository, Clock clock) {
        this.jpaRepository = jpaRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public SmartPrompt save(SmartPrompt prompt) {
        SmartPromptEntity saved = jpaRepository.save(toEntity(prompt));
        logger.debug("保存智能提示: id={}, branchId={}, userId={}, promptType={}",
                saved.getId(), saved.getBranchId(), saved.getUserId(), saved.getPromptType());
        return toPrompt(saved);
    }

    @Override
    public Optional<SmartPrompt> findById(String id) {
        return jpaRepository.findById(id).map(this::toPrompt);
    }

    @Override
    public List<SmartPrompt> findPending(String userId, String branchId, Instant now) {
        return jpaRepository.findValidByUserIdAndBranchIdAndStatus(
                        userId, branchId, PromptStatus.PENDING.getValue(), toLocalDateTime(now))
                .stream()
                .map(this::toPrompt)
                .collect(Collectors.toList());
    }

    @Override
    public boolean existsByBranchAndTypeSince(String branchId, PromptType promptType, Instant since) {
        return jpaRepository.existsByBranchIdAndPromptTypeAndCreatedAtGreaterThanEqual(
                branchId, promptType.getValue(), toLocalDateTime(since));
    }

    @Override
    @Transactional
    public boolean transitionStatus(String id, PromptStatus expected, PromptStatus target) {
        int updated = jpaRepository.updateStatus(id, expected.getValue(), target.getValue());
        logger.debug("更新提示状态: id={}, expected={}, target={}, updated={}",
                id, expected.getValue(), target.getValue(), updated);
        return updated > 0;
    }

    @Override
    @Transactional
    public int deleteExpired(Instant now) {
        return jpaRepository.deleteExpired(toLocalDateTime(now));
    }

    // ==================== 转换方法 ====================

    private SmartPromptEntity toEntity(SmartPrompt prompt) {
        Map<String, Object> contextData = new LinkedHashMap<>();
        contextData.put(KEY_SUGGESTED_RESPONSES, new ArrayList<>(prompt.getSuggestedResponses()));

        Map<String, Object> aiMetadata = new LinkedHashMap<>();
        AiMetadata metadata = prompt.getAiMetadata();
        if (metadata != null) {
            aiMetadata.put(KEY_PROVIDER, metadata.getProvider());
            aiMetadata.put(KEY_MODEL, metadata.getModel());
            aiMetadata.put(KEY_CONFIDENCE, metadata.getConfidence());
            if (metadata.getTemplate() != null) {
                aiMetadata.put(KEY_TEMPLATE, metadata.getTemplate());
            }
        }

        PromptStatus status = prompt.getStatus() != null ? prompt.getStatus() : PromptStatus.PENDING;
        return SmartPromptEntity.builder()
                .id(prompt.getId() != null ? prompt.getId() : UUID.randomUUID().toString())
                .branchId(prompt.getBranchId())
                .userId(prompt.getUserId())
                .messageType(MESSAGE_TYPE_PROMPT)
                .content(prompt.getContent())
                .promptType(prompt.getPromptType() != null ? prompt.getPromptType().getValue() : null)
                .status(status.getValue())
                .contextData(contextData)
                .aiMetadata(aiMetadata)
                .createdAt(toLocalDateTime(prompt.getCreatedAt()))
                .expiresAt(toLocalDateTime(prompt.getExpiresAt()))
                .build();
    }

    @SuppressWarnings("unchecked")
    private SmartPrompt toPrompt(SmartPromptEntity entity) {
        List<String> suggestedResponses = new ArrayList<>();
        if (entity.getContextData() != null
                && entity.getContextData().get(KEY_SUGGESTED_RESPONSES) instanceof List) {
            ((List<Object>) entity.getContextData().get(KEY_SUGGESTED_RESPONSES))
                    .forEach(item -> suggestedResponses.add(String.valueOf(item)));
        }

        AiMetadata metadata = null;
        Map<String, Object> raw = entity.getAiMetadata();
        if (raw != null) {
            Object confidence = raw.get(KEY_CONFIDENCE);
            metadata = AiMetadata.builder()
                    .provider((String) raw.get(KEY_PROVIDER))
                    .model((String) raw.get(KEY_MODEL))
                    .confidence(confidence instanceof Number ? ((Number) confidence).doubleValue() : 0.0)
                    .template((String) raw.get(KEY_TEMPLATE))
                    .build();
        }

        return SmartPrompt.builder()
                .id(entity.getId())
                .branchId(entity.getBranchId())
                .userId(entity.getUserId())
                .content(entity.getContent())
                .promptType(ValueEnum.find(PromptType.class, entity.getPromptType()).orElse(null))
                .suggestedResponses(suggestedResponses)
                .aiMetadata(metadata)
                .createdAt(toInstant(entity.getCreatedAt()))
                .expiresAt(toInstant(entity.getExpiresAt()))
                .status(ValueEnum.find(PromptStatus.class, entity.getStatus()).orElse(PromptStatus.PENDING))
                .build();
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
