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

import com.familyleaf.prompting.extension.context.model.TimeContext;
import com.familyleaf.prompting.extension.prompt.model.PromptTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PromptTemplateLibrary 单元测试")
class PromptTemplateLibraryTest {

    private final PromptTemplateLibrary library = new PromptTemplateLibrary(new Random(11));

    @Test
    @DisplayName("命中近期关键词的模板优先")
    void shouldPreferKeywordTemplate() {
        PromptTemplate template = library.select(TimeContext.MORNING, "Monday", Set.of("school"));

        assertThat(template.getId()).isEqualTo("school-memory");
    }

    @Test
    @DisplayName("没有关键词时在通用模板中按时段选择")
    void shouldSelectGeneralTemplateForTimeOfDay() {
        for (int i = 0; i < 20; i++) {
            PromptTemplate evening = library.select(TimeContext.EVENING, "Monday", Set.of());
            assertThat(evening.getId()).isIn("evening-memory", PromptTemplateLibrary.FALLBACK_TEMPLATE_ID);
            assertThat(evening.getKeywords()).isEmpty();
        }
    }

    @Test
    @DisplayName("周末模板只在周末参与选择")
    void shouldOfferWeekendTemplateOnlyOnWeekends() {
        Set<String> saturday = selectMany(TimeContext.NIGHT, "Saturday");
        Set<String> tuesday = selectMany(TimeContext.NIGHT, "Tuesday");

        assertThat(saturday).contains("weekend-memory");
        assertThat(tuesday).doesNotContain("weekend-memory");
    }

    @Test
    @DisplayName("模板编号唯一，未知编号抛出异常")
    void shouldHaveUniqueTemplateIds() {
        List<String> ids = library.getTemplates().stream().map(PromptTemplate::getId).collect(Collectors.toList());

        assertThat(ids).doesNotHaveDuplicates().contains(PromptTemplateLibrary.FALLBACK_TEMPLATE_ID);
        assertThat(library.getTemplates()).allSatisfy(template ->
                assertThat(template.getSuggestedResponses()).isNotEmpty());
        assertThatThrownBy(() -> library.findById("missing")).isInstanceOf(IllegalArgumentException.class);
    }

    private Set<String> selectMany(String timeOfDay, String dayOfWeek) {
        return IntStream.range(0, 60)
                .mapToObj(i -> library.select(timeOfDay, dayOfWeek, Set.of()).getId())
                .collect(Collectors.toSet());
    }
}
