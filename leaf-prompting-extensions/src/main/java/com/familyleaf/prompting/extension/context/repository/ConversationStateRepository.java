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

import com.familyleaf.prompting.extension.context.model.ConversationState;

import java.util.Optional;

/**
 * 会话状态存储，每个 (userId, branchId) 一条
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public interface ConversationStateRepository {

    Optional<ConversationState> find(String userId, String branchId);

    /**
     * 按 (userId, branchId) 插入或整体覆盖
     */
    void upsert(ConversationState state);
}
