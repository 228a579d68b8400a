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
import com.familyleaf.prompting.extension.context.model.TimeContext;
import com.familyleaf.prompting.extension.prompt.model.PromptTemplate;

import java.util.Collection;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * 静态提示模板库
 * <p>
 * 按时段、星期与近期关键词筛选模板：命中关键词的模板优先，其次是不带关键词的通用模板。
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class PromptTemplateLibrary {

    static final String FALLBACK_TEMPLATE_ID = "general-checkin";

    private static final List<String> WEEKEND = List.of("Saturday", "Sunday");

    private static final List<PromptTemplate> TEMPLATES = List.of(
            PromptTemplate.builder()
                    .id("morning-checkin")
                    .type(PromptType.CHECKIN)
                    .timeOfDay(TimeContext.MORNING)
                    .content("How is everyone starting the day in {branchName}?")
                    .suggestedResponses(List.of("Slow morning today", "Busy already!", "Breakfast was fun",
                            "Let me share a photo"))
                    .build(),
            PromptTemplate.builder()
                    .id("afternoon-checkin")
                    .type(PromptType.CHECKIN)
                    .timeOfDay(TimeContext.AFTERNOON)
                    .content("How has the afternoon been going so far?")
                    .suggestedResponses(List.of("Pretty good!", "We went outside", "Nap time went well",
                            "Lots happened today..."))
                    .build(),
            PromptTemplate.builder()
                    .id("evening-memory")
                    .type(PromptType.MEMORY)
                    .timeOfDay(TimeContext.EVENING)
                    .content("What was the best moment of today?")
                    .suggestedResponses(List.of("I have a story to share", "Here's what happened...",
                            "It was a quiet day", "Let me share a photo"))
                    .build(),
            PromptTemplate.builder()
                    .id("night-memory")
                    .type(PromptType.MEMORY)
                    .timeOfDay(TimeContext.NIGHT)
                    .content("Before the day ends, is there a little moment worth saving?")
                    .suggestedResponses(List.of("Yes, one thing...", "Not tonight", "Tomorrow I'll share more"))
                    .build(),
            PromptTemplate.builder()
                    .id("weekend-memory")
                    .type(PromptType.MEMORY)
                    .daysOfWeek(WEEKEND)
                    .content("Any weekend adventures with the family worth remembering?")
                    .suggestedResponses(List.of("We went on a trip", "Just relaxing at home", "Family visit!",
                            "Let me share a photo"))
                    .build(),
            PromptTemplate.builder()
                    .id("milestone-progress")
                    .type(PromptType.MILESTONE)
                    .keywords(List.of("first", "new", "milestone"))
                    .content("Has anyone learned something new lately? Every little first counts!")
                    .suggestedResponses(List.of("Yes, something new!", "Not yet, but soon", "I want to record this",
                            "Share with family"))
                    .build(),
            PromptTemplate.builder()
                    .id("birthday-celebration")
                    .type(PromptType.CELEBRATION)
                    .keywords(List.of("birthday"))
                    .content("I noticed a birthday coming up or just passed! How did you celebrate?")
                    .suggestedResponses(List.of("We had a party", "Small family celebration", "Want to see photos?",
                            "Still planning!"))
                    .build(),
            PromptTemplate.builder()
                    .id("school-memory")
                    .type(PromptType.MEMORY)
                    .keywords(List.of("school"))
                    .content("How are things going at school? Any stories from this week?")
                    .suggestedResponses(List.of("School is going well", "There was a funny moment",
                            "New friends!", "A bit tricky lately"))
                    .build(),
            PromptTemplate.builder()
                    .id("play-memory")
                    .type(PromptType.MEMORY)
                    .keywords(List.of("playground", "play", "fun"))
                    .content("What has been the favorite game or playtime activity recently?")
                    .suggestedResponses(List.of("The playground!", "Building blocks", "Hide and seek",
                            "Let me share a photo"))
                    .build(),
            PromptTemplate.builder()
                    .id("mealtime-checkin")
                    .type(PromptType.CHECKIN)
                    .keywords(List.of("food"))
                    .content("How are mealtimes going? Any new favorite foods?")
                    .suggestedResponses(List.of("Tried something new!", "Picky week", "We cooked together"))
                    .build(),
            PromptTemplate.builder()
                    .id("sleep-checkin")
                    .type(PromptType.CHECKIN)
                    .keywords(List.of("sleep"))
                    .content("How has everyone been sleeping lately?")
                    .suggestedResponses(List.of("Better this week", "Still working on it", "Naps are going great"))
                    .build(),
            PromptTemplate.builder()
                    .id("happy-memory")
                    .type(PromptType.MEMORY)
                    .keywords(List.of("love", "happy", "excited"))
                    .content("It sounds like there has been a lot of joy lately. What made everyone smile?")
                    .suggestedResponses(List.of("So many things!", "Here's what happened...", "A sweet surprise",
                            "Let me share a photo"))
                    .build(),
            PromptTemplate.builder()
                    .id(FALLBACK_TEMPLATE_ID)
                    .type(PromptType.CHECKIN)
                    .content("How has your day been with the family?")
                    .suggestedResponses(List.of("Had a great day!", "Nothing special today", "Lots happened today...",
                            "Let me share a photo"))
                    .build());

    private final Random random;

    public PromptTemplateLibrary(Random random) {
        this.random = random;
    }

    /**
     * 选择一个模板，总能返回结果
     *
     * @param timeOfDay      当前时段
     * @param dayOfWeek      当前星期（英文全称）
     * @param recentKeywords 近期内容中出现的关键词（小写）
     */
    public PromptTemplate select(String timeOfDay, String dayOfWeek, Collection<String> recentKeywords) {
        List<PromptTemplate> eligible = TEMPLATES.stream()
                .filter(template -> template.getTimeOfDay() == null || template.getTimeOfDay().equals(timeOfDay))
                .filter(template -> template.getDaysOfWeek().isEmpty() || template.getDaysOfWeek().contains(dayOfWeek))
                .collect(Collectors.toList());

        List<PromptTemplate> keywordMatches = eligible.stream()
                .filter(template -> template.getKeywords().stream().anyMatch(recentKeywords::contains))
                .collect(Collectors.toList());
        if (!keywordMatches.isEmpty()) {
            return pick(keywordMatches);
        }

        List<PromptTemplate> general = eligible.stream()
                .filter(template -> template.getKeywords().isEmpty())
                .collect(Collectors.toList());
        return general.isEmpty() ? findById(FALLBACK_TEMPLATE_ID) : pick(general);
    }

    public List<PromptTemplate> getTemplates() {
        return TEMPLATES;
    }

    public PromptTemplate findById(String id) {
        return TEMPLATES.stream()
                .filter(template -> template.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("模板不存在: " + id));
    }

    private PromptTemplate pick(List<PromptTemplate> candidates) {
        return candidates.get(random.nextInt(candidates.size()));
    }
}
