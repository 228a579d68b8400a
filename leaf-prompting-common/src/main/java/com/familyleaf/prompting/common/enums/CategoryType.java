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
 * 消息分类类型
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public enum CategoryType implements ValueEnum {

    PHOTO_SHARE("photo_share"),
    MILESTONE("milestone"),
    CELEBRATION("celebration"),
    CONCERN("concern"),
    QUESTION("question"),
    MEMORY("memory"),
    ROUTINE("routine"),
    DAILY_UPDATE("daily_update");

    private final String value;

    CategoryType(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static CategoryType fromValue(String value) {
        return ValueEnum.parse(CategoryType.class, value);
    }
}
