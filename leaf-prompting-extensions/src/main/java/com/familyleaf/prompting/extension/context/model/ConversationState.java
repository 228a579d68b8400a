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
package com.familyleaf.prompting.extension.context.model;

import com.familyleaf.prompting.common.enums.ConversationPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 用户在某个分支内的会话状态
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationState {

    public static final int MAX_HISTORY = 50;

    private String userId;

    private String branchId;

    private Instant lastInteraction;

    @Builder.Default
    private ConversationPhase conversationPhase = ConversationPhase.INITIAL;

    private String currentTopic;

    @Builder.Default
    private ConversationPreferences preferences = ConversationPreferences.defaults();

    /**
     * 互动历史，容量 50，超出时淘汰最早的记录
     */
    @Builder.Default
    private List<InteractionRecord> responseHistory = new ArrayList<>();

    public static ConversationState initial(String userId, String branchId, Instant now) {
        return ConversationState.builder()
                .userId(userId)
                .branchId(branchId)
                .lastInteraction(now)
                .build();
    }

    public void appendInteraction(InteractionRecord record) {
        List<InteractionRecord> history = new ArrayList<>(responseHistory != null ? responseHistory : List.of());
        history.add(record);
        if (history.size() > MAX_HISTORY) {
            history = new ArrayList<>(history.subList(history.size() - MAX_HISTORY, history.size()));
        }
        this.responseHistory = history;
    }

    /**
     * 深拷贝，缓存中的实例不直接修改
     */
    public ConversationState copy() {
        return ConversationState.builder()
                .userId(userId)
                .branchId(branchId)
                .lastInteraction(lastInteraction)
                .conversationPhase(conversationPhase)
                .currentTopic(currentTopic)
                .preferences(preferences != null ? preferences.copy() : ConversationPreferences.defaults())
                .responseHistory(new ArrayList<>(responseHistory != null ? responseHistory : List.of()))
                .build();
    }
}
