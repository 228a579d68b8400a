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
package com.familyleaf.prompting.extension.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 智能提示引擎配置属性
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@ConfigurationProperties(prefix = "family.prompting")
public class PromptingProperties {

    /**
     * 是否启用智能提示引擎
     */
    private boolean enabled = true;

    /**
     * 提示的有效期
     */
    private Duration responseTimeout = Duration.ofHours(48);

    /**
     * 个性化提示的最低置信度，超过才直接采用
     */
    private double personalizedConfidenceThreshold = 0.6;

    /**
     * 近期发过内容的成员在调度时跳过
     */
    private Duration recentActivityWindow = Duration.ofDays(7);

    /**
     * 用户行为模式缓存时长
     */
    private Duration patternCacheTtl = Duration.ofHours(24);

    /**
     * 会话状态缓存时长，为空表示不过期
     */
    private Duration stateCacheTtl;

    /**
     * 固定随机种子，设置后模板选择可复现
     */
    private Long randomSeed;

    private Schedule schedule = new Schedule();

    private MilestoneDetection milestoneDetection = new MilestoneDetection();

    private Cleanup cleanup = new Cleanup();

    private Ai ai = new Ai();

    @Data
    public static class Schedule {
        /**
         * 是否启用主动提示调度
         */
        private boolean enabled = true;

        /**
         * 每日触发时间，HH:mm
         */
        private List<String> times = new ArrayList<>(List.of("09:00", "19:00"));

        /**
         * 调度 cron 表达式，设置后取代 times
         */
        private String cron;
    }

    @Data
    public static class MilestoneDetection {
        private boolean enabled = true;

        /**
         * 检测到里程碑后是否自动生成庆祝提示
         */
        private boolean autoTrigger = true;

        /**
         * 回看时间窗口
         */
        private Duration lookback = Duration.ofHours(24);

        private String cron = "0 */30 * * * *";
    }

    @Data
    public static class Cleanup {
        private boolean enabled = true;

        private String cron = "0 15 * * * *";
    }

    @Data
    public static class Ai {
        /**
         * none / openai / anthropic
         */
        private String provider = "none";

        private String apiKey;

        /**
         * 为空时按服务商取默认模型
         */
        private String model;

        private int maxTokens = 500;

        private double temperature = 0.7;

        /**
         * 为空时按服务商取默认地址
         */
        private String baseUrl;

        /**
         * 每个会话保留的历史消息数
         */
        private int historyLimit = 20;

        public boolean isConfigured() {
            return provider != null && !"none".equalsIgnoreCase(provider)
                    && apiKey != null && !apiKey.isBlank();
        }
    }
}
