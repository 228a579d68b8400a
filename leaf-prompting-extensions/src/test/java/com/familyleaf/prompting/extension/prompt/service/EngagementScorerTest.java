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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EngagementScorer 单元测试")
class EngagementScorerTest {

    private final EngagementScorer scorer = new EngagementScorer();

    @Test
    @DisplayName("简短平淡的回复为低投入")
    void shouldScoreFlatReplyLow() {
        assertThat(scorer.score("ok", MessageAnalysis.builder().build())).isEqualTo(EngagementLevel.LOW);
        assertThat(scorer.score(null, null)).isEqualTo(EngagementLevel.LOW);
    }

    @Test
    @DisplayName("感叹和提问各加一分")
    void shouldScorePunctuationMedium() {
        assertThat(scorer.score("Really? Wow!", MessageAnalysis.builder().build())).isEqualTo(EngagementLevel.MEDIUM);
    }

    @Test
    @DisplayName("里程碑与丰富细节为高投入")
    void shouldScoreRichReplyHigh() {
        MessageAnalysis analysis = MessageAnalysis.builder()
                .sentiment(Sentiment.POSITIVE)
                .milestone("first_steps")
                .people(List.of("Grandma"))
                .locations(List.of("park"))
                .build();

        assertThat(scorer.score("She walked", analysis)).isEqualTo(EngagementLevel.HIGH);
    }

    @Test
    @DisplayName("长文本本身计入分数")
    void shouldCountLength() {
        String longReply = "a".repeat(101);

        assertThat(scorer.score(longReply, MessageAnalysis.builder().build())).isEqualTo(EngagementLevel.MEDIUM);
        assertThat(scorer.score(longReply + "!!", MessageAnalysis.builder().build())).isEqualTo(EngagementLevel.MEDIUM);
        assertThat(scorer.score(longReply + "! 😊", MessageAnalysis.builder().build()))
                .isEqualTo(EngagementLevel.HIGH);
    }
}
