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
package com.familyleaf.prompting.extension.analysis.service;

import com.familyleaf.prompting.common.enums.CategoryType;
import com.familyleaf.prompting.common.enums.Sentiment;
import com.familyleaf.prompting.common.enums.Urgency;
import com.familyleaf.prompting.extension.analysis.model.MessageAnalysis;
import com.familyleaf.prompting.extension.analysis.model.MessageCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResponseAnalyzer 单元测试")
class ResponseAnalyzerTest {

    private final ResponseAnalyzer analyzer = new ResponseAnalyzer();

    @Test
    @DisplayName("里程碑消息：分类、情感、地点与人名")
    void shouldAnalyzeMilestoneMessage() {
        MessageAnalysis analysis = analyzer.analyzeMessage("Today Emma took her first steps at the park! So proud.");

        assertThat(analysis.getMilestone()).isEqualTo("first_steps");
        assertThat(analysis.getCategories())
                .extracting(MessageCategory::getType)
                .containsExactly(CategoryType.MILESTONE, CategoryType.CELEBRATION);
        assertThat(analysis.primaryCategory()).get()
                .extracting(MessageCategory::getConfidence)
                .isEqualTo(0.95);
        assertThat(analysis.getSentiment()).isEqualTo(Sentiment.POSITIVE);
        assertThat(analysis.getUrgency()).isEqualTo(Urgency.MEDIUM);
        assertThat(analysis.getLocations()).containsExactly("park");
        assertThat(analysis.getTopics()).containsExactly("activities");
        assertThat(analysis.getPeople()).containsExactly("emma");
        assertThat(analysis.getTimeReferences()).contains("today");
        assertThat(analysis.getTags()).contains("park", "first");
    }

    @Test
    @DisplayName("带问号的担忧归类为 question，情感为负面")
    void shouldClassifyQuestion() {
        MessageAnalysis analysis = analyzer.analyzeMessage("Is it normal that she wakes up at night? I'm worried.");

        assertThat(analysis.getCategories())
                .extracting(MessageCategory::getType)
                .containsExactly(CategoryType.QUESTION);
        assertThat(analysis.getSentiment()).isEqualTo(Sentiment.NEGATIVE);
        assertThat(analysis.getUrgency()).isEqualTo(Urgency.MEDIUM);
    }

    @Test
    @DisplayName("发烧属于高紧急度")
    void shouldDetectHighUrgency() {
        MessageAnalysis analysis = analyzer.analyzeMessage("She has a fever since this morning");

        assertThat(analysis.getUrgency()).isEqualTo(Urgency.HIGH);
        assertThat(analysis.getTimeReferences()).contains("this morning");
        assertThat(analysis.getCategories())
                .extracting(MessageCategory::getType)
                .containsExactly(CategoryType.MEMORY, CategoryType.ROUTINE);
    }

    @Test
    @DisplayName("空文本与 null 得到日常更新")
    void shouldFallBackToDailyUpdate() {
        for (String content : new String[]{null, "", "   "}) {
            MessageAnalysis analysis = analyzer.analyzeMessage(content);

            assertThat(analysis.getCategories())
                    .extracting(MessageCategory::getType)
                    .containsExactly(CategoryType.DAILY_UPDATE);
            assertThat(analysis.getSentiment()).isEqualTo(Sentiment.NEUTRAL);
            assertThat(analysis.getUrgency()).isEqualTo(Urgency.LOW);
            assertThat(analysis.getMilestone()).isNull();
            assertThat(analysis.getTags()).isEmpty();
        }
    }

    @Test
    @DisplayName("只有媒体时同时给出 photo_share 与 daily_update")
    void shouldAddDailyUpdateForMediaOnly() {
        MessageAnalysis analysis = analyzer.analyzeMessage("look", List.of("https://cdn.example.com/a.jpg"));

        assertThat(analysis.getCategories())
                .extracting(MessageCategory::getType)
                .containsExactly(CategoryType.PHOTO_SHARE, CategoryType.DAILY_UPDATE);
    }

    @Test
    @DisplayName("话题标签与月龄转为标签")
    void shouldExtractHashtagsAndAge() {
        MessageAnalysis analysis = analyzer.analyzeMessage("Splash time #bathtime, she is 8 months old");

        assertThat(analysis.getTags()).contains("bathtime", "8month");
        assertThat(analysis.getTags()).hasSizeLessThanOrEqualTo(ResponseAnalyzer.MAX_TAGS);
    }

    @Test
    @DisplayName("里程碑按词典顺序先命中者生效")
    void shouldPreferEarlierMilestone() {
        assertThat(analyzer.detectMilestone("she said mama and walked across the room")).isEqualTo("first_word");
    }

    @Test
    @DisplayName("建议标签合并分类、情感、话题、里程碑与紧急度")
    void shouldGenerateSuggestedTags() {
        MessageAnalysis analysis = analyzer.analyzeMessage("Today Emma took her first steps at the park! So proud.");

        assertThat(analyzer.generateSuggestedTags(analysis))
                .containsExactly("milestone", "celebration", "positive", "activities", "first_steps", "urgency_medium");
    }

    @Test
    @DisplayName("建议标签最多 8 个")
    void shouldCapSuggestedTags() {
        MessageAnalysis analysis = MessageAnalysis.builder()
                .topics(List.of("a", "b", "c", "d", "e", "f", "g", "h", "i", "j"))
                .build();

        assertThat(analyzer.generateSuggestedTags(analysis)).hasSize(8);
    }
}
