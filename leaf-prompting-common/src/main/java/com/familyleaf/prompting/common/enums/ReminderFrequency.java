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
 * 主动提醒频率
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public enum ReminderFrequency implements ValueEnum {

    /**
     * 每天约 3 次
     */
    HIGH("high", 8),

    /**
     * 每天 1 次
     */
    MEDIUM("medium", 24),

    /**
     * 每 3 天 1 次
     */
    LOW("low", 72);

    private final String value;
    private final int thresholdHours;

    ReminderFrequency(String value, int thresholdHours) {
        this.value = value;
        this.thresholdHours = thresholdHours;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 距上次互动至少间隔的小时数
     */
    public int getThresholdHours() {
        return thresholdHours;
    }

    @JsonCreator
    public static ReminderFrequency fromValue(String value) {
        return ValueEnum.parse(ReminderFrequency.class, value);
    }
}
