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
package com.familyleaf.prompting.extension.support;

import com.familyleaf.prompting.extension.context.model.ConversationState;
import com.familyleaf.prompting.extension.context.repository.ConversationStateRepository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryConversationStateRepository implements ConversationStateRepository {

    private final Map<String, ConversationState> states = new ConcurrentHashMap<>();

    private int upsertCount;

    @Override
    public Optional<ConversationState> find(String userId, String branchId) {
        return Optional.ofNullable(states.get(userId + ":" + branchId)).map(ConversationState::copy);
    }

    @Override
    public void upsert(ConversationState state) {
        upsertCount++;
        states.put(state.getUserId() + ":" + state.getBranchId(), state.copy());
    }

    public int getUpsertCount() {
        return upsertCount;
    }
}
