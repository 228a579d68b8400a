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
package com.familyleaf.prompting.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 智能提示类型枚举
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public enum PromptType implements ValueEnum {

    /**
     * 日常问候
     */
    CHECKIN("checkin", "日常问候"),

    /**
     * 成长里程碑
     */
    MILESTONE("milestone", "成长里程碑"),

    /**
     * 回忆分享
     */
    MEMORY("memory", "回忆分享"),

    /**
     * 追问
     */
    FOLLOWUP("followup", "追问"),

    /**
     * 庆祝
     */
    CELEBRATION("celebration", "庆祝"),

    /**
     * 叶子配文建议
     */
    LEAF_CAPTION("leaf_caption", "叶子配文建议"),

    /**
     * 叶子标签建议
     */
    LEAF_TAGS("leaf_tags", "叶子标签建议");

    private final String value;
    private final String description;

    PromptType(String value, String description) {
        this.value = value;
        this.description = description;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 是否为会话类提示（可由个性化模板生成）
     */
    public boolean isConversational() {
        return this != LEAF_CAPTION && this != LEAF_TAGS;
    }

    @JsonCreator
    public static PromptType fromValue(String value) {
        return ValueEnum.parse(PromptType.class, value);
    }
}
