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
 * 智能提示状态枚举
 * <p>
 * {@link #EXPIRED} 只在读取时根据过期时间推导，不会写入存储
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public enum PromptStatus implements ValueEnum {

    PENDING("pending"),
    RESPONDED("responded"),
    DISMISSED("dismissed"),
    EXPIRED("expired");

    private final String value;

    PromptStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PromptStatus fromValue(String value) {
        return ValueEnum.parse(PromptStatus.class, value);
    }
}
