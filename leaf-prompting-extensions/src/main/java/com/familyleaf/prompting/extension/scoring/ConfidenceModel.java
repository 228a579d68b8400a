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
package com.familyleaf.prompting.extension.scoring;

import com.familyleaf.prompting.common.enums.CategoryType;
import com.familyleaf.prompting.common.enums.EngagementLevel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 置信度模型
 * <p>
 * 置信度 = clamp(base + 各命名分项之和, floor, ceiling)。实例不可变，{@link #with} 返回新实例，
 * 各分项可单独计算和测试。分类、个性化提示、生成文本以及固定场景的置信度统一从这里取值。
 * </p>
 *
 * <pre>
 * double score = ConfidenceModel.of(0.5, 0.3, 0.95)
 *         .with("preferredType", ConfidenceModel.preferredTypeBonus(true))
 *         .with("activeHour", ConfidenceModel.activeHourBonus(false))
 *         .score();
 * </pre>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public final class ConfidenceModel {

    public static final double PERSONALIZED_BASE = 0.5;
    public static final double PERSONALIZED_FLOOR = 0.3;
    public static final double PERSONALIZED_CEILING = 0.95;

    public static final double GENERATED_TEXT_BASE = 0.5;
    public static final double GENERATED_TEXT_CEILING = 1.0;

    /**
     * 里程碑自动触发的庆祝提示
     */
    public static final double MILESTONE_CELEBRATION = 0.9;

    /**
     * 演示模式下的主动提示
     */
    public static final double DEMO_PROMPT = 0.8;

    /**
     * 演示模式下的追问
     */
    public static final double DEMO_FOLLOW_UP = 0.7;

    /**
     * 规则生成的叶子增强结果
     */
    public static final double RULE_BASED_LEAF = 0.7;

    /**
     * 规则检测到的叶子里程碑
     */
    public static final double RULE_BASED_LEAF_MILESTONE = 0.8;

    /**
     * 分析记录无分类时的默认置信度
     */
    public static final double DEFAULT_ANALYSIS = 0.5;

    private final double base;
    private final double floor;
    private final double ceiling;
    private final Map<String, Double> components;

    private ConfidenceModel(double base, double floor, double ceiling, Map<String, Double> components) {
        this.base = base;
        this.floor = floor;
        this.ceiling = ceiling;
        this.components = components;
    }

    public static ConfidenceModel of(double base, double floor, double ceiling) {
        if (floor > ceiling) {
            throw new IllegalArgumentException("floor 不能大于 ceiling: floor=" + floor + ", ceiling=" + ceiling);
        }
        return new ConfidenceModel(base, floor, ceiling, Collections.emptyMap());
    }

    /**
     * 追加一个命名分项，同名分项会被覆盖
     */
    public ConfidenceModel with(String name, double delta) {
        Map<String, Double> next = new LinkedHashMap<>(components);
        next.put(name, delta);
        return new ConfidenceModel(base, floor, ceiling, Collections.unmodifiableMap(next));
    }

    public double score() {
        double raw = base;
        for (double delta : components.values()) {
            raw += delta;
        }
        return Math.min(ceiling, Math.max(floor, raw));
    }

    public double getBase() {
        return base;
    }

    public double getFloor() {
        return floor;
    }

    public double getCeiling() {
        return ceiling;
    }

    public Map<String, Double> getComponents() {
        return components;
    }

    // ==================== 组合模型 ====================

    /**
     * 个性化提示置信度，结果落在 [0.3, 0.95]
     */
    public static ConfidenceModel forPersonalizedPrompt(boolean preferredType, boolean activeHour,
                                                        EngagementLevel engagement, int commonTopicCount) {
        return of(PERSONALIZED_BASE, PERSONALIZED_FLOOR, PERSONALIZED_CEILING)
                .with("preferredType", preferredTypeBonus(preferredType))
                .with("activeHour", activeHourBonus(activeHour))
                .with("engagement", engagementAdjustment(engagement))
                .with("topicRichness", topicRichnessBonus(commonTopicCount));
    }

    /**
     * 模型生成文本的置信度，上限 1.0
     */
    public static ConfidenceModel forGeneratedText(String text) {
        String safe = text != null ? text : "";
        return of(GENERATED_TEXT_BASE, 0.0, GENERATED_TEXT_CEILING)
                .with("length", lengthBonus(safe.length()))
                .with("questions", questionBonus(safe.chars().filter(c -> c == '?').count()))
                .with("pronoun", pronounBonus(safe));
    }

    // ==================== 分项 ====================

    public static double preferredTypeBonus(boolean preferred) {
        return preferred ? 0.2 : 0.0;
    }

    public static double activeHourBonus(boolean activeHour) {
        return activeHour ? 0.15 : 0.0;
    }

    public static double engagementAdjustment(EngagementLevel engagement) {
        if (engagement == EngagementLevel.HIGH) {
            return 0.1;
        }
        if (engagement == EngagementLevel.LOW) {
            return -0.1;
        }
        return 0.0;
    }

    public static double topicRichnessBonus(int commonTopicCount) {
        return commonTopicCount > 3 ? 0.05 : 0.0;
    }

    /**
     * 长度超过 50 加 0.2，超过 100 再加 0.1
     */
    public static double lengthBonus(int length) {
        double bonus = 0.0;
        if (length > 50) {
            bonus += 0.2;
        }
        if (length > 100) {
            bonus += 0.1;
        }
        return bonus;
    }

    /**
     * 每个问号 0.1，最多 0.3
     */
    public static double questionBonus(long questionCount) {
        return Math.min(questionCount * 0.1, 0.3);
    }

    public static double pronounBonus(String text) {
        return text != null && text.contains("you") ? 0.1 : 0.0;
    }

    /**
     * 规则分类的固定置信度
     */
    public static double categoryConfidence(CategoryType type) {
        return switch (type) {
            case MILESTONE -> 0.95;
            case PHOTO_SHARE -> 0.9;
            case CONCERN, QUESTION -> 0.85;
            case CELEBRATION -> 0.8;
            case MEMORY -> 0.75;
            case ROUTINE -> 0.7;
            case DAILY_UPDATE -> 0.6;
        };
    }
}
