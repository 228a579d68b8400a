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
package com.familyleaf.prompting.extension.ai.model;

import com.familyleaf.prompting.extension.context.model.ConversationPreferences;
import com.familyleaf.prompting.extension.context.model.TimeContext;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 生成提示所需的上下文
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiPromptContext {

    private String userId;

    private String branchId;

    private String branchName;

    /**
     * family/community/topic/local
     */
    private String branchType;

    /**
     * 用户全名，资料缺失时为 there
     */
    private String userName;

    private String familyRole;

    /**
     * 分支最近的内容，最新的在前
     */
    @Builder.Default
    private List<RecentMessage> recentMessages = new ArrayList<>();

    /**
     * 用户尚无会话状态时为 null
     */
    private ConversationPreferences userPreferences;

    private TimeContext timeContext;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecentMessage {

        private String content;

        private String author;

        private Instant timestamp;

        private String milestoneType;
    }
}
