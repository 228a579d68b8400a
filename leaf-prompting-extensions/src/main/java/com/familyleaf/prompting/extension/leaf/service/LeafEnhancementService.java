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
package com.familyleaf.prompting.extension.leaf.service;

import com.familyleaf.prompting.common.enums.EngagementLevel;
import com.familyleaf.prompting.extension.ai.model.AiLeafSuggestion;
import com.familyleaf.prompting.extension.ai.service.AiService;
import com.familyleaf.prompting.extension.analysis.service.TextSignals;
import com.familyleaf.prompting.extension.leaf.model.DetectedMilestone;
import com.familyleaf.prompting.extension.leaf.model.LeafContentAnalysis;
import com.familyleaf.prompting.extension.leaf.model.LeafEnhancementRequest;
import com.familyleaf.prompting.extension.leaf.model.LeafEnhancementResult;
import com.familyleaf.prompting.extension.scoring.ConfidenceModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 叶子内容辅助：配文、标签、里程碑与成长阶段建议，以及内容质量分析
 * <p>
 * 配置了文本生成服务时请求结构化 JSON，未配置或调用失败时使用规则兜底。
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class LeafEnhancementService {

    private static final Logger logger = LoggerFactory.getLogger(LeafEnhancementService.class);

    static final int MAX_SUGGESTIONS = 4;
    static final List<String> DEFAULT_TAGS = List.of("memory", "precious");

    private static final Map<String, List<String>> TAG_KEYWORDS = new LinkedHashMap<>();

    private static final Map<String, DetectedMilestone> MILESTONE_PHRASES = new LinkedHashMap<>();

    private static final Pattern EMOTIONAL_WORDS = Pattern.compile(
            "\\b(happy|sad|excited|proud|worried|love|joy|surprised|amazed|grateful)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTEXT_WORDS = Pattern.compile(
            "\\b(today|yesterday|morning|evening|while|when|after|during|first time|finally)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PEOPLE_WORDS = Pattern.compile(
            "\\b(dad|mom|mama|papa|grandma|grandpa|brother|sister|family|together|with)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ACTION_WORDS = Pattern.compile(
            "\\b(walking|talking|playing|laughing|smiling|crawling|running|eating|sleeping)\\b",
            Pattern.CASE_INSENSITIVE);

    static {
        TAG_KEYWORDS.put("play", List.of("play", "playing", "toys", "games"));
        TAG_KEYWORDS.put("family", List.of("mom", "dad", "grandma", "grandpa", "family"));
        TAG_KEYWORDS.put("food", List.of("eat", "eating", "food", "meal", "dinner", "lunch"));
        TAG_KEYWORDS.put("sleep", List.of("sleep", "nap", "bedtime", "tired"));
        TAG_KEYWORDS.put("outside", List.of("park", "outside", "playground", "walk"));
        TAG_KEYWORDS.put("learning", List.of("book", "read", "learn", "school"));
        TAG_KEYWORDS.put("cute", List.of("cute", "adorable", "sweet", "precious"));
        TAG_KEYWORDS.put("happy", List.of("happy", "smile", "laugh", "joy", "fun"));

        MILESTONE_PHRASES.put("first step", milestone("first_steps", "Child took their first independent steps!"));
        MILESTONE_PHRASES.put("first word", milestone("first_word", "Child said their first recognizable word!"));
        MILESTONE_PHRASES.put("first tooth", milestone("first_tooth", "First tooth has emerged!"));
        MILESTONE_PHRASES.put("birthday", milestone("birthday", "Special birthday celebration!"));
        MILESTONE_PHRASES.put("crawling", milestone("crawling", "Child has started crawling!"));
    }

    /**
     * 未配置文本生成服务时为 null
     */
    private final AiService aiService;
    private final Executor executor;

    public LeafEnhancementService(AiService aiService, Executor executor) {
        this.aiService = aiService;
        this.executor = executor;
    }

    /**
     * 增强单个叶子，不会抛出异常
     */
    public LeafEnhancementResult enhanceLeaf(LeafEnhancementRequest request) {
        if (aiService == null) {
            return ruleBasedEnhancement(request);
        }
        try {
            AiLeafSuggestion suggestion = aiService.generateLeafEnhancement(buildEnhancementPrompt(request));
            logger.debug("叶子增强完成: leafId={}, provider={}", request.getLeafId(), aiService.getProvider());
            return fromSuggestion(request, suggestion);
        } catch (RuntimeException e) {
            logger.error("叶子增强失败，使用规则兜底: leafId={}", request.getLeafId(), e);
            return ruleBasedEnhancement(request);
        }
    }

    /**
     * 并发增强多个叶子，结果顺序与请求一致
     */
    public List<LeafEnhancementResult> enhanceLeavesBatch(List<LeafEnhancementRequest> requests) {
        List<CompletableFuture<LeafEnhancementResult>> futures = requests.stream()
                .map(this::submitEnhancement)
                .collect(Collectors.toList());
        List<LeafEnhancementResult> results = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());
        logger.info("批量叶子增强完成: count={}", results.size());
        return results;
    }

    /**
     * 线程池拒绝时在当前线程执行
     */
    private CompletableFuture<LeafEnhancementResult> submitEnhancement(LeafEnhancementRequest request) {
        try {
            return CompletableFuture.supplyAsync(() -> enhanceLeaf(request), executor);
        } catch (RejectedExecutionException e) {
            logger.warn("叶子增强线程池已满，改为同步执行: leafId={}", request.getLeafId());
            return CompletableFuture.completedFuture(enhanceLeaf(request));
        }
    }

    /**
     * 根据情感、情境、人物、动作词汇与字数评估内容质量
     */
    public LeafContentAnalysis analyzeLeafContent(String leafId, String content, List<String> mediaUrls) {
        String text = content != null ? content : "";
        String lower = text.toLowerCase(Locale.ROOT);
        String trimmed = text.trim();
        int wordCount = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;

        boolean emotional = EMOTIONAL_WORDS.matcher(text).find();
        boolean context = CONTEXT_WORDS.matcher(text).find();
        boolean people = PEOPLE_WORDS.matcher(text).find();
        boolean actions = ACTION_WORDS.matcher(text).find();

        List<String> suggestions = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        EngagementLevel quality = EngagementLevel.MEDIUM;

        if (wordCount < 5) {
            quality = EngagementLevel.LOW;
            suggestions.add("Add more details about what happened");
            suggestions.add("Describe how you felt in this moment");
        } else if (wordCount > 20 && emotional && context) {
            quality = EngagementLevel.HIGH;
        }

        if (!emotional) {
            missing.add("emotions");
            suggestions.add("Add how this moment made you feel");
        }
        if (!context) {
            missing.add("context");
            suggestions.add("Include when or where this happened");
        }
        if (!people && !lower.contains("alone")) {
            missing.add("people");
            suggestions.add("Mention who was involved or who witnessed this");
        }
        if (!actions) {
            missing.add("actions");
            suggestions.add("Describe what was happening in more detail");
        }

        if (mediaUrls != null && !mediaUrls.isEmpty()) {
            if (wordCount < 10) {
                suggestions.add("The photos/videos are great! Add a description to make this memory even more special");
            }
        } else if (TextSignals.containsAny(lower, List.of("photo", "picture", "video"))) {
            suggestions.add("Consider adding the photo or video you mentioned");
        }

        if (wordCount > 50) {
            suggestions.add("This is a wonderfully detailed memory!");
        } else if (wordCount < 15) {
            suggestions.add("Try adding a bit more detail to make this memory even richer");
        }

        return LeafContentAnalysis.builder()
                .leafId(leafId)
                .contentQuality(quality)
                .suggestions(suggestions.stream().limit(MAX_SUGGESTIONS).collect(Collectors.toList()))
                .missingElements(missing)
                .build();
    }

    /**
     * 关键词标签表、里程碑短语表与按月龄推断的成长阶段
     */
    LeafEnhancementResult ruleBasedEnhancement(LeafEnhancementRequest request) {
        String content = request.getContent() != null ? request.getContent().toLowerCase(Locale.ROOT) : "";

        List<String> tags = TextSignals.matchingKeys(content, TAG_KEYWORDS);

        DetectedMilestone detected = null;
        for (Map.Entry<String, DetectedMilestone> entry : MILESTONE_PHRASES.entrySet()) {
            if (content.contains(entry.getKey())) {
                DetectedMilestone template = entry.getValue();
                detected = DetectedMilestone.builder()
                        .type(template.getType())
                        .confidence(template.getConfidence())
                        .description(template.getDescription())
                        .build();
                break;
            }
        }

        Integer childAge = request.getContext() != null ? request.getContext().getChildAge() : null;

        return LeafEnhancementResult.builder()
                .leafId(request.getLeafId())
                .suggestedTags(tags.isEmpty() ? new ArrayList<>(DEFAULT_TAGS) : tags)
                .detectedMilestone(detected)
                .suggestedSeason(childAge != null ? seasonForAge(childAge) : null)
                .confidence(ConfidenceModel.RULE_BASED_LEAF)
                .build();
    }

    static String seasonForAge(int ageInMonths) {
        if (ageInMonths <= 12) {
            return "first_year";
        }
        if (ageInMonths <= 36) {
            return "toddler";
        }
        if (ageInMonths <= 60) {
            return "preschool";
        }
        return "school_age";
    }

    String buildEnhancementPrompt(LeafEnhancementRequest request) {
        LeafEnhancementRequest.LeafContext context = request.getContext() != null
                ? request.getContext() : new LeafEnhancementRequest.LeafContext();
        List<String> media = request.getMediaUrls();
        List<String> existingTags = context.getExistingTags();

        return "You are helping parents capture precious memories of their children. "
                + "Analyze this memory and provide helpful suggestions.\n\n"
                + "Context:\n"
                + "- Parent: " + context.getAuthorName() + "\n"
                + "- Child's Tree: " + context.getTreeName() + "\n"
                + "- Branch: " + context.getBranchName() + "\n"
                + (context.getChildAge() != null ? "- Child's age: " + context.getChildAge() + " months\n" : "")
                + "\nMemory Content:\n"
                + (request.getContent() != null && !request.getContent().isBlank()
                        ? request.getContent() : "No text content provided")
                + "\n\n"
                + (media != null && !media.isEmpty() ? "Media: " + media.size() + " file(s) attached" : "No media attached")
                + "\n\n"
                + (existingTags != null && !existingTags.isEmpty()
                        ? "Existing tags: " + String.join(", ", existingTags) + "\n\n" : "")
                + "Please provide:\n"
                + "1. A warm, engaging caption that captures the emotion and significance (if content needs enhancement)\n"
                + "2. 3-5 relevant tags for organization and search\n"
                + "3. Detect if this represents a milestone (first_word, first_steps, etc.)\n"
                + "4. Suggest a season/period classification if appropriate (first_year, toddler, preschool, etc.)\n\n"
                + "Response format:\n"
                + "{\n"
                + "  \"caption\": \"suggested caption (only if needed)\",\n"
                + "  \"tags\": [\"tag1\", \"tag2\", \"tag3\"],\n"
                + "  \"milestone\": {\n"
                + "    \"type\": \"milestone_type\",\n"
                + "    \"confidence\": 0.8,\n"
                + "    \"description\": \"why this is a milestone\"\n"
                + "  },\n"
                + "  \"season\": \"suggested_season\",\n"
                + "  \"confidence\": 0.9\n"
                + "}";
    }

    private LeafEnhancementResult fromSuggestion(LeafEnhancementRequest request, AiLeafSuggestion suggestion) {
        DetectedMilestone detected = null;
        AiLeafSuggestion.Milestone milestone = suggestion.getMilestone();
        if (milestone != null && milestone.getType() != null && !milestone.getType().isBlank()) {
            detected = DetectedMilestone.builder()
                    .type(milestone.getType())
                    .confidence(milestone.getConfidence() != null
                            ? milestone.getConfidence() : ConfidenceModel.RULE_BASED_LEAF_MILESTONE)
                    .description(milestone.getDescription())
                    .build();
        }
        return LeafEnhancementResult.builder()
                .leafId(request.getLeafId())
                .suggestedCaption(suggestion.getCaption())
                .suggestedTags(suggestion.getTags() != null ? new ArrayList<>(suggestion.getTags()) : new ArrayList<>())
                .detectedMilestone(detected)
                .suggestedSeason(suggestion.getSeason())
                .confidence(suggestion.getConfidence() != null
                        ? suggestion.getConfidence() : ConfidenceModel.DEFAULT_ANALYSIS)
                .build();
    }

    private static DetectedMilestone milestone(String type, String description) {
        return DetectedMilestone.builder()
                .type(type)
                .confidence(ConfidenceModel.RULE_BASED_LEAF_MILESTONE)
                .description(description)
                .build();
    }
}
