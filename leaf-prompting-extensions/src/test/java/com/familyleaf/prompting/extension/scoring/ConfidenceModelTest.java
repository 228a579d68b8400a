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
package com.familyleaf.prompting.extension.scoring;

import com.familyleaf.prompting.common.enums.CategoryType;
import com.familyleaf.prompting.common.enums.EngagementLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ConfidenceModel 单元测试")
class ConfidenceModelTest {

    @Test
    @DisplayName("分项求和后限制在上下限之间")
    void shouldClampSum() {
        ConfidenceModel model = ConfidenceModel.of(0.5, 0.3, 0.95)
                .with("a", 0.3)
                .with("b", 0.3);

        assertThat(model.score()).isEqualTo(0.95);
        assertThat(model.with("a", -0.9).score()).isEqualTo(0.3);
        assertThat(model.getComponents()).containsOnlyKeys("a", "b");
    }

    @Test
    @DisplayName("同名分项覆盖，原实例不变")
    void shouldReplaceComponentImmutably() {
        ConfidenceModel base = ConfidenceModel.of(0.5, 0.0, 1.0).with("bonus", 0.2);
        ConfidenceModel replaced = base.with("bonus", 0.1);

        assertThat(base.score()).isCloseTo(0.7, within(1e-9));
        assertThat(replaced.score()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    @DisplayName("下限大于上限时拒绝创建")
    void shouldRejectInvertedBounds() {
        assertThatThrownBy(() -> ConfidenceModel.of(0.5, 0.9, 0.1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("个性化提示置信度范围")
    void shouldScorePersonalizedPrompt() {
        assertThat(ConfidenceModel.forPersonalizedPrompt(true, true, EngagementLevel.HIGH, 5).score())
                .isEqualTo(ConfidenceModel.PERSONALIZED_CEILING);
        assertThat(ConfidenceModel.forPersonalizedPrompt(true, true, EngagementLevel.MEDIUM, 0).score())
                .isCloseTo(0.85, within(1e-9));
        assertThat(ConfidenceModel.forPersonalizedPrompt(false, false, EngagementLevel.LOW, 0).score())
                .isCloseTo(0.4, within(1e-9));
    }

    @Test
    @DisplayName("生成文本按长度、问号与第二人称加分")
    void shouldScoreGeneratedText() {
        assertThat(ConfidenceModel.forGeneratedText("Hi").score()).isEqualTo(0.5);
        assertThat(ConfidenceModel.forGeneratedText(null).score()).isEqualTo(0.5);
        assertThat(ConfidenceModel.forGeneratedText("How was your day? Did you go outside?").score())
                .isCloseTo(0.8, within(1e-9));
        String longText = "Tell me, how did you spend the afternoon? Who came along? What did you eat? "
                + "Was there a favorite moment you want to remember?";
        assertThat(ConfidenceModel.forGeneratedText(longText).score()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("分类置信度为固定值")
    void shouldMapCategoryConfidence() {
        assertThat(ConfidenceModel.categoryConfidence(CategoryType.MILESTONE)).isEqualTo(0.95);
        assertThat(ConfidenceModel.categoryConfidence(CategoryType.DAILY_UPDATE)).isEqualTo(0.6);
        assertThat(ConfidenceModel.questionBonus(7)).isCloseTo(0.3, within(1e-9));
    }
}
