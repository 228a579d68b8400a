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

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 未配置文本生成服务时的固定话术
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class DemoResponder {

    private static final Map<PromptType, List<String>> OPENERS = new EnumMap<>(PromptType.class);

    static final List<String> FOLLOW_UPS = List.of(
            "That sounds wonderful! Can you tell me more about that?",
            "I love hearing these details! What was the best part?",
            "That's so sweet! How did everyone feel about it?",
            "What a special moment! Any other highlights from that day?");

    static {
        OPENERS.put(PromptType.CHECKIN, List.of("Hi {userName}!", "Hello {userName}!"));
        OPENERS.put(PromptType.MEMORY, List.of("Hey {userName}!", "Hi {userName}, memory time!"));
        OPENERS.put(PromptType.MILESTONE, List.of("Hi {userName}! 🌟", "{userName}, exciting times!"));
        OPENERS.put(PromptType.CELEBRATION, List.of("🎉 {userName}!", "Congratulations, {userName}!"));
        OPENERS.put(PromptType.FOLLOWUP, List.of("Hi again, {userName}!"));
    }

    private final Random random;

    public DemoResponder(Random random) {
        this.random = random;
    }

    /**
     * 以模板正文为主体，加上按提示类型选取的称呼
     */
    public String respond(PromptTemplate template, String userName, String branchName) {
        List<String> openers = OPENERS.getOrDefault(template.getType(), OPENERS.get(PromptType.CHECKIN));
        String opener = openers.get(random.nextInt(openers.size()));
        String text = opener + " " + template.getContent();
        return text
                .replace("{userName}", userName != null ? userName : "there")
                .replace("{branchName}", branchName != null ? branchName : "the family");
    }

    public String followUp() {
        return FOLLOW_UPS.get(random.nextInt(FOLLOW_UPS.size()));
    }
}
