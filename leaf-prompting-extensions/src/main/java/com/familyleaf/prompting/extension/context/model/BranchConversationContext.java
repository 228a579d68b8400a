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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 分支级会话上下文，由分支最近的叶子推导
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BranchConversationContext {

    private String branchId;

    private int messageCount24h;

    private String lastActiveUserId;

    private Instant lastActiveTime;

    @Builder.Default
    private List<String> topTopics = new ArrayList<>();

    @Builder.Default
    private List<String> activeMemberIds = new ArrayList<>();

    @Builder.Default
    private List<String> commonActivities = new ArrayList<>();

    /**
     * 最近的里程碑，最新的在前
     */
    @Builder.Default
    private List<RecentMilestone> recentMilestones = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecentMilestone {

        /**
         * 可读的里程碑名称，例如 first steps
         */
        private String type;

        private Instant date;

        /**
         * 孩子的名字，未知时为 null
         */
        private String child;
    }
}
