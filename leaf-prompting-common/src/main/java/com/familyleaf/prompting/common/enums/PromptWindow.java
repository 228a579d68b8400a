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
 * 用户偏好的提示时间窗口（闭区间，按小时）
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public enum PromptWindow implements ValueEnum {

    MORNING("morning", 6, 12),
    AFTERNOON("afternoon", 12, 18),
    EVENING("evening", 18, 22),
    ANYTIME("anytime", 0, 23);

    private final String value;
    private final int fromHour;
    private final int toHour;

    PromptWindow(String value, int fromHour, int toHour) {
        this.value = value;
        this.fromHour = fromHour;
        this.toHour = toHour;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean contains(int hour) {
        return hour >= fromHour && hour <= toHour;
    }

    @JsonCreator
    public static PromptWindow fromValue(String value) {
        return ValueEnum.parse(PromptWindow.class, value);
    }
}
