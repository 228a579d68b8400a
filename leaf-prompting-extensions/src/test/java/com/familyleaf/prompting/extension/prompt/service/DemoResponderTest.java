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

import com.familyleaf.prompting.common.enums.PromptType;
import com.familyleaf.prompting.extension.prompt.model.PromptTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DemoResponder 单元测试")
class DemoResponderTest {

    private final DemoResponder responder = new DemoResponder(new Random(5));
    private final PromptTemplateLibrary library = new PromptTemplateLibrary(new Random(5));

    @Test
    @DisplayName("称呼加模板正文，并替换占位符")
    void shouldFillNamesIntoTemplate() {
        String text = responder.respond(library.findById("morning-checkin"), "Alice", "Smith Family");

        assertThat(text).matches("(Hi|Hello) Alice! How is everyone starting the day in Smith Family\\?");
    }

    @Test
    @DisplayName("缺少名字时使用通用称呼")
    void shouldUseGenericNames() {
        String text = responder.respond(library.findById("morning-checkin"), null, null);

        assertThat(text).contains("there!").endsWith("in the family?");
    }

    @Test
    @DisplayName("未配置称呼的提示类型使用日常问候")
    void shouldFallBackToCheckinOpeners() {
        PromptTemplate template = PromptTemplate.builder()
                .id("caption")
                .type(PromptType.LEAF_CAPTION)
                .content("Caption this moment.")
                .build();

        assertThat(responder.respond(template, "Bob", "Family")).matches("(Hi|Hello) Bob! Caption this moment\\.");
    }

    @Test
    @DisplayName("追问取自固定话术")
    void shouldPickFollowUpFromFixedLines() {
        assertThat(DemoResponder.FOLLOW_UPS).contains(responder.followUp());
    }
}
