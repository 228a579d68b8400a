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
 * 会话阶段
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public enum ConversationPhase implements ValueEnum {

    /**
     * 尚无互动记录
     */
    INITIAL("initial"),

    /**
     * 互动少于 3 次
     */
    ACTIVE("active"),

    /**
     * 至少 3 次互动且最近一次在 24 小时内
     */
    FOLLOWUP("followup"),

    /**
     * 最近一次互动已超过 24 小时
     */
    CONCLUDED("concluded");

    private final String value;

    ConversationPhase(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ConversationPhase fromValue(String value) {
        return ValueEnum.parse(ConversationPhase.class, value);
    }
}
