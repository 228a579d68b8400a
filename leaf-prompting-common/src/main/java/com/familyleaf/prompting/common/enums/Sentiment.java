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
 * 情感倾向
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public enum Sentiment implements ValueEnum {

    POSITIVE("positive", 1),
    NEUTRAL("neutral", 0),
    NEGATIVE("negative", -1);

    private final String value;
    private final int score;

    Sentiment(String value, int score) {
        this.value = value;
        this.score = score;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 净情感分值：正向 +1，负向 -1，中性 0
     */
    public int getScore() {
        return score;
    }

    @JsonCreator
    public static Sentiment fromValue(String value) {
        return ValueEnum.parse(Sentiment.class, value);
    }
}
