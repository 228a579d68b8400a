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
import com.familyleaf.prompting.extension.scoring.ConfidenceModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 回复分析器
 * <p>
 * 无状态、无副作用：把自由文本转换为 {@link MessageAnalysis}。所有判断都基于固定词表和正则。
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class ResponseAnalyzer {

    public static final int MAX_TAGS = 8;

    /**
     * 里程碑词典，按声明顺序先命中者生效
     */
    static final Map<String, List<String>> MILESTONE_KEYWORDS = new LinkedHashMap<>();

    static final Map<String, List<String>> TOPIC_KEYWORDS = new LinkedHashMap<>();

    static {
        MILESTONE_KEYWORDS.put("first_smile", List.of("first smile", "smiled for the first time", "first real smile"));
        MILESTONE_KEYWORDS.put("first_laugh", List.of("first laugh", "laughed for the first time", "giggled"));
        MILESTONE_KEYWORDS.put("first_word", List.of("first word", "said mama", "said dada", "said their first"));
        MILESTONE_KEYWORDS.put("first_steps", List.of("first steps", "walked", "took their first step", "walking"));
        MILESTONE_KEYWORDS.put("first_tooth", List.of("first tooth", "tooth came in", "teething"));
        MILESTONE_KEYWORDS.put("first_solid_food", List.of("first food", "solid food", "started eating"));
        MILESTONE_KEYWORDS.put("birthday", List.of("birthday", "turned", "years old", "birthday party"));
        MILESTONE_KEYWORDS.put("christmas", List.of("christmas", "xmas", "santa", "presents"));
        MILESTONE_KEYWORDS.put("vacation", List.of("vacation", "trip", "travel", "holiday"));

        TOPIC_KEYWORDS.put("health", List.of("doctor", "sick", "fever", "medicine", "checkup", "vaccine", "teeth",
                "growth", "sleep"));
        TOPIC_KEYWORDS.put("food", List.of("eating", "food", "hungry", "meal", "breakfast", "lunch", "dinner",
                "snack", "bottle", "milk"));
        TOPIC_KEYWORDS.put("development", List.of("walking", "talking", "crawling", "sitting", "playing",
                "learning", "book", "toy"));
        TOPIC_KEYWORDS.put("social", List.of("friends", "playdate", "daycare", "school", "family", "grandma",
                "grandpa", "cousin"));
        TOPIC_KEYWORDS.put("activities", List.of("park", "playground", "swimming", "music", "dance", "art",
                "reading", "game"));
        TOPIC_KEYWORDS.put("routine", List.of("bedtime", "nap", "bath", "morning", "evening", "schedule",
                "routine"));
    }

    private static final List<String> POSITIVE_WORDS = List.of("happy", "excited", "love", "amazing", "wonderful",
            "great", "awesome", "perfect", "beautiful", "proud", "joy", "smile", "laugh");

    private static final List<String> NEGATIVE_WORDS = List.of("worried", "concerned", "difficult", "hard",
            "problem", "issue", "crying", "upset", "sick", "tired", "stressed");

    private static final List<String> POSITIVE_SIGNALS = List.of("!", "😊", "❤");

    private static final List<String> NEGATIVE_SIGNALS = List.of("😢", "😰", "💔");

    private static final List<String> HIGH_URGENCY = List.of("urgent", "emergency", "help", "immediately",
            "right now", "asap", "sick", "hurt", "fever");

    private static final List<String> MEDIUM_URGENCY = List.of("soon", "today", "tomorrow", "this week",
            "concerned", "worried", "question");

    private static final List<String> CELEBRATION_WORDS = List.of("birthday", "celebrate", "party",
            "achievement", "proud", "excited");

    private static final List<String> CONCERN_WORDS = List.of("worried", "concerned", "should i",
            "is this normal", "?");

    private static final List<String> MEMORY_WORDS = List.of("remember", "today we", "this morning",
            "yesterday", "last week");

    private static final List<String> ROUTINE_WORDS = List.of("bedtime", "nap", "morning", "routine",
            "schedule", "usually");

    private static final List<String> TAG_KEYWORDS = List.of(
            "happy", "excited", "tired", "hungry", "playful", "cranky",
            "morning", "afternoon", "evening", "bedtime",
            "park", "home", "daycare", "grandmas", "outside",
            "book", "toy", "music", "bath", "food", "snack",
            "new", "first", "favorite", "funny", "cute");

    private static final List<String> FAMILY_TERMS = List.of("mama", "mom", "mommy", "dada", "dad", "daddy",
            "grandma", "grandpa", "sister", "brother", "aunt", "uncle", "cousin");

    private static final List<String> LOCATION_KEYWORDS = List.of("park", "home", "daycare", "school",
            "playground", "beach", "zoo", "library", "store", "restaurant", "hospital", "doctor");

    private static final Pattern HASHTAG = Pattern.compile("#(\\w+)");

    private static final Pattern AGE = Pattern.compile("(\\d+)\\s*(month|year|week)s?\\s*old");

    private static final List<Pattern> TIME_PATTERNS = List.of(
            Pattern.compile("\\b(today|yesterday|tomorrow)\\b"),
            Pattern.compile("\\b(this|last|next)\\s+(morning|afternoon|evening|night|week|month|year)\\b"),
            Pattern.compile("\\b(\\d{1,2}:\\d{2})\\s*(am|pm)?\\b"),
            Pattern.compile("\\b(monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b"));

    public MessageAnalysis analyzeMessage(String content) {
        return analyzeMessage(content, Collections.emptyList());
    }

    /**
     * 分析一条用户消息
     *
     * @param content   原始文本
     * @param mediaUrls 附带的媒体地址，可为 null
     */
    public MessageAnalysis analyzeMessage(String content, List<String> mediaUrls) {
        String original = content != null ? content.trim() : "";
        String clean = original.toLowerCase(Locale.ROOT);

        return MessageAnalysis.builder()
                .categories(categorize(clean, mediaUrls))
                .tags(extractTags(clean))
                .sentiment(analyzeSentiment(clean))
                .topics(extractTopics(clean))
                .urgency(assessUrgency(clean))
                .milestone(detectMilestone(clean))
                .people(extractPeople(original, clean))
                .locations(TextSignals.matchedKeywords(clean, LOCATION_KEYWORDS))
                .timeReferences(TextSignals.allMatches(clean, TIME_PATTERNS))
                .build();
    }

    /**
     * 根据分析结果生成建议标签，去重，最多 8 个
     */
    public List<String> generateSuggestedTags(MessageAnalysis analysis) {
        Set<String> suggested = new LinkedHashSet<>();
        for (MessageCategory category : analysis.getCategories()) {
            if (category.getConfidence() > 0.7) {
                suggested.add(category.getType().getValue());
            }
        }
        if (analysis.getSentiment() != null && analysis.getSentiment() != Sentiment.NEUTRAL) {
            suggested.add(analysis.getSentiment().getValue());
        }
        suggested.addAll(analysis.getTopics());
        if (analysis.getMilestone() != null) {
            suggested.add(analysis.getMilestone());
        }
        if (analysis.getUrgency() != null && analysis.getUrgency() != Urgency.LOW) {
            suggested.add("urgency_" + analysis.getUrgency().getValue());
        }
        return suggested.stream().limit(MAX_TAGS).collect(Collectors.toList());
    }

    /**
     * 情感判断：正负词表命中数加表情/标点信号，严格多者胜出，相等为中性
     *
     * @param lowerCaseText 已转小写的文本
     */
    public Sentiment analyzeSentiment(String lowerCaseText) {
        int positive = TextSignals.matchedKeywords(lowerCaseText, POSITIVE_WORDS).size();
        int negative = TextSignals.matchedKeywords(lowerCaseText, NEGATIVE_WORDS).size();
        if (TextSignals.containsAny(lowerCaseText, POSITIVE_SIGNALS)) {
            positive++;
        }
        if (TextSignals.containsAny(lowerCaseText, NEGATIVE_SIGNALS)) {
            negative++;
        }
        if (positive > negative) {
            return Sentiment.POSITIVE;
        }
        if (negative > positive) {
            return Sentiment.NEGATIVE;
        }
        return Sentiment.NEUTRAL;
    }

    /**
     * 按声明顺序返回第一个命中的里程碑类型
     */
    public String detectMilestone(String lowerCaseText) {
        return TextSignals.firstMatchingKey(lowerCaseText, MILESTONE_KEYWORDS).orElse(null);
    }

    private List<MessageCategory> categorize(String content, List<String> mediaUrls) {
        List<MessageCategory> categories = new ArrayList<>();

        if (mediaUrls != null && !mediaUrls.isEmpty()) {
            categories.add(category(CategoryType.PHOTO_SHARE, "Message includes media attachments"));
        }

        String milestone = detectMilestone(content);
        if (milestone != null) {
            categories.add(category(CategoryType.MILESTONE, "Detected milestone: " + milestone));
        }

        if (TextSignals.containsAny(content, CELEBRATION_WORDS)) {
            categories.add(category(CategoryType.CELEBRATION, "Contains celebratory language"));
        }

        if (TextSignals.containsAny(content, CONCERN_WORDS)) {
            boolean question = content.contains("?");
            categories.add(question
                    ? category(CategoryType.QUESTION, "Contains question marks")
                    : category(CategoryType.CONCERN, "Contains concern indicators"));
        }

        if (TextSignals.containsAny(content, MEMORY_WORDS)) {
            categories.add(category(CategoryType.MEMORY, "Contains memory/experience sharing language"));
        }

        if (TextSignals.containsAny(content, ROUTINE_WORDS)) {
            categories.add(category(CategoryType.ROUTINE, "Contains routine/schedule references"));
        }

        boolean onlyPhoto = categories.size() == 1 && categories.get(0).getType() == CategoryType.PHOTO_SHARE;
        if (categories.isEmpty() || onlyPhoto) {
            categories.add(category(CategoryType.DAILY_UPDATE,
                    "General update without specific category indicators"));
        }

        categories.sort(Comparator.comparingDouble(MessageCategory::getConfidence).reversed());
        return categories;
    }

    private MessageCategory category(CategoryType type, String reason) {
        return new MessageCategory(type, ConfidenceModel.categoryConfidence(type), reason);
    }

    private List<String> extractTags(String content) {
        Set<String> tags = new LinkedHashSet<>();

        Matcher hashtag = HASHTAG.matcher(content);
        while (hashtag.find()) {
            tags.add(hashtag.group(1));
        }

        tags.addAll(TextSignals.matchedKeywords(content, TAG_KEYWORDS));

        Matcher age = AGE.matcher(content);
        while (age.find()) {
            tags.add(age.group(1) + age.group(2));
        }

        return tags.stream().limit(MAX_TAGS).collect(Collectors.toList());
    }

    private List<String> extractTopics(String content) {
        return TextSignals.matchingKeys(content, TOPIC_KEYWORDS);
    }

    private Urgency assessUrgency(String content) {
        if (TextSignals.containsAny(content, HIGH_URGENCY)) {
            return Urgency.HIGH;
        }
        if (TextSignals.containsAny(content, MEDIUM_URGENCY)) {
            return Urgency.MEDIUM;
        }
        return Urgency.LOW;
    }

    private List<String> extractPeople(String original, String lowerCase) {
        Set<String> people = new LinkedHashSet<>(TextSignals.matchedKeywords(lowerCase, FAMILY_TERMS));
        for (String name : TextSignals.capitalizedNames(original)) {
            people.add(name.toLowerCase(Locale.ROOT));
        }
        return new ArrayList<>(people);
    }
}
