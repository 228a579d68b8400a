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
package com.familyleaf.prompting.extension.personalization.model;

import com.familyleaf.prompting.common.enums.EngagementLevel;
import com.familyleaf.prompting.common.enums.SentimentTrend;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 用户行为模式
 * <p>
 * 由最近的回复分析记录与叶子统计得出，按 (用户, 分支) 缓存。
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserPattern {

    private String userId;

    private String branchId;

    private Preferences preferences;

    private Behavioral behavioral;

    private Content content;

    private Timing timing;

    private Instant lastUpdated;

    /**
     * 偏好
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Preferences {

        /**
         * 最常出现的分类类型，最多 3 个
         */
        @Builder.Default
        private List<String> preferredPromptTypes = new ArrayList<>();

        /**
         * HH:00 格式
         */
        @Builder.Default
        private List<String> bestResponseTimes = new ArrayList<>();

        @Builder.Default
        private List<String> engagementTriggers = new ArrayList<>();

        @Builder.Default
        private List<String> avoidanceTopics = new ArrayList<>();
    }

    /**
     * 行为统计
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Behavioral {

        private long averageResponseLength;

        /**
         * 平均回复间隔（天）
         */
        private double responseFrequency;

        private SentimentTrend sentimentTrend;

        private EngagementLevel engagementLevel;
    }

    /**
     * 内容统计
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Content {

        @Builder.Default
        private List<String> commonTopics = new ArrayList<>();

        @Builder.Default
        private List<String> frequentTags = new ArrayList<>();

        @Builder.Default
        private List<String> milestoneTypes = new ArrayList<>();

        @Builder.Default
        private List<String> peopleOfInterest = new ArrayList<>();

        @Builder.Default
        private List<String> locationPatterns = new ArrayList<>();
    }

    /**
     * 时间规律
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Timing {

        @Builder.Default
        private List<Integer> mostActiveHours = new ArrayList<>();

        /**
         * 小写英文星期名
         */
        @Builder.Default
        private List<String> preferredDays = new ArrayList<>();

        /**
         * 平均响应时延（小时）
         */
        private double responseLatency;
    }
}
