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
package com.familyleaf.prompting.extension.prompt.model;

import com.familyleaf.prompting.common.enums.PromptStatus;
import com.familyleaf.prompting.common.enums.PromptType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 智能提示
 * <p>
 * 存储的状态只有 pending / responded / dismissed 三种；expired 由 {@link #effectiveStatus(Instant)} 在读取时推导。
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SmartPrompt {

    private String id;

    private String branchId;

    private String userId;

    private String content;

    private PromptType promptType;

    @Builder.Default
    private List<String> suggestedResponses = new ArrayList<>();

    private AiMetadata aiMetadata;

    private Instant createdAt;

    private Instant expiresAt;

    /**
     * 存储的状态
     */
    @Builder.Default
    private PromptStatus status = PromptStatus.PENDING;

    /**
     * 读取时的有效状态：待处理且已过有效期的提示视为 expired
     */
    public PromptStatus effectiveStatus(Instant now) {
        if (status == PromptStatus.PENDING && expiresAt != null && !expiresAt.isAfter(now)) {
            return PromptStatus.EXPIRED;
        }
        return status;
    }

    public boolean isPendingAt(Instant now) {
        return effectiveStatus(now) == PromptStatus.PENDING;
    }
}
