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
 * 提示语气风格
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public enum PromptStyle implements ValueEnum {

    CASUAL("casual"),
    FORMAL("formal"),
    PLAYFUL("playful");

    private final String value;

    PromptStyle(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 低参与度时尝试的下一种风格：casual 与 playful 互换，formal 退回 casual
     */
    public PromptStyle alternative() {
        return switch (this) {
            case CASUAL -> PLAYFUL;
            case PLAYFUL, FORMAL -> CASUAL;
        };
    }

    @JsonCreator
    public static PromptStyle fromValue(String value) {
        return ValueEnum.parse(PromptStyle.class, value);
    }
}
