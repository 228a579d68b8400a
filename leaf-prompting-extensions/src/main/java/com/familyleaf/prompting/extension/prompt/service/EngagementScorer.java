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
package com.familyleaf.prompting.extension.prompt.service;

import com.familyleaf.prompting.common.enums.EngagementLevel;
import com.familyleaf.prompting.common.enums.Sentiment;
import com.familyleaf.prompting.extension.analysis.model.MessageAnalysis;

import java.util.regex.Pattern;

/**
 * 回复参与度评分
 * <p>
 * 基础信号（长度、表情、感叹号、问号）加上分析结果信号，累计 ≥4 为 high，≥2 为 medium，否则 low。
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class EngagementScorer {

    private static final Pattern EMOJI = Pattern.compile(
            "[\\x{1F600}-\\x{1F64F}\\x{1F300}-\\x{1F5FF}\\x{1F680}-\\x{1F6FF}\\x{1F1E0}-\\x{1F1FF}]");

    public EngagementLevel score(String response, MessageAnalysis analysis) {
        String text = response != null ? response : "";
        int score = 0;

        if (text.length() > 100) {
            score += 2;
        } else if (text.length() > 50) {
            score += 1;
        }
        if (EMOJI.matcher(text).find()) {
            score += 1;
        }
        if (text.contains("!")) {
            score += 1;
        }
        if (text.contains("?")) {
            score += 1;
        }

        if (analysis != null) {
            if (analysis.getSentiment() == Sentiment.POSITIVE) {
                score += 1;
            }
            if (analysis.getCategories() != null && analysis.getCategories().size() > 1) {
                score += 1;
            }
            if (analysis.getMilestone() != null) {
                score += 2;
            }
            if (analysis.getTopics() != null && analysis.getTopics().size() > 2) {
                score += 1;
            }
            int people = analysis.getPeople() != null ? analysis.getPeople().size() : 0;
            int locations = analysis.getLocations() != null ? analysis.getLocations().size() : 0;
            if (people + locations > 1) {
                score += 1;
            }
        }

        if (score >= 4) {
            return EngagementLevel.HIGH;
        }
        if (score >= 2) {
            return EngagementLevel.MEDIUM;
        }
        return EngagementLevel.LOW;
    }
}
