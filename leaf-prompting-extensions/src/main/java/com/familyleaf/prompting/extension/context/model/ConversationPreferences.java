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

import com.familyleaf.prompting.common.enums.PromptStyle;
import com.familyleaf.prompting.common.enums.PromptWindow;
import com.familyleaf.prompting.common.enums.ReminderFrequency;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 用户会话偏好
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationPreferences {

    public static final int MAX_PREFERRED_TOPICS = 10;

    @Builder.Default
    private PromptStyle promptStyle = PromptStyle.CASUAL;

    @Builder.Default
    private ReminderFrequency reminderFrequency = ReminderFrequency.MEDIUM;

    /**
     * 偏好话题，最多 10 个，超出时淘汰最早加入的
     */
    @Builder.Default
    private List<String> preferredTopics = new ArrayList<>();

    @Builder.Default
    private PromptWindow bestTimeForPrompts = PromptWindow.ANYTIME;

    public static ConversationPreferences defaults() {
        return ConversationPreferences.builder().build();
    }

    /**
     * 追加新话题（已存在的忽略），保持容量上限
     */
    public void addTopics(List<String> topics) {
        List<String> merged = new ArrayList<>(preferredTopics != null ? preferredTopics : List.of());
        for (String topic : topics) {
            if (!merged.contains(topic)) {
                merged.add(topic);
            }
        }
        if (merged.size() > MAX_PREFERRED_TOPICS) {
            merged = new ArrayList<>(merged.subList(merged.size() - MAX_PREFERRED_TOPICS, merged.size()));
        }
        this.preferredTopics = merged;
    }

    public ConversationPreferences copy() {
        return new ConversationPreferences(promptStyle, reminderFrequency,
                new ArrayList<>(preferredTopics != null ? preferredTopics : List.of()), bestTimeForPrompts);
    }
}
