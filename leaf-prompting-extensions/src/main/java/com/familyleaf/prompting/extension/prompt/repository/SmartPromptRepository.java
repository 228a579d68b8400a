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
import com.familyleaf.prompting.extension.prompt.model.SmartPrompt;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 智能提示存储
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public interface SmartPromptRepository {

    SmartPrompt save(SmartPrompt prompt);

    Optional<SmartPrompt> findById(String id);

    /**
     * 用户在分支内仍有效的待处理提示，按创建时间倒序
     */
    List<SmartPrompt> findPending(String userId, String branchId, Instant now);

    /**
     * 分支内是否存在 since 之后（含）创建的某类提示
     */
    boolean existsByBranchAndTypeSince(String branchId, PromptType promptType, Instant since);

    /**
     * 仅当当前状态为 expected 时更新为 target
     *
     * @return 是否更新成功
     */
    boolean transitionStatus(String id, PromptStatus expected, PromptStatus target);

    /**
     * 删除 expiresAt 早于 now 的提示
     *
     * @return 删除的条数
     */
    int deleteExpired(Instant now);
}
