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
package com.familyleaf.prompting.extension.personalization.service;

import com.familyleaf.prompting.common.enums.EngagementLevel;
import com.familyleaf.prompting.common.enums.PromptType;
import com.familyleaf.prompting.common.enums.Sentiment;
import com.familyleaf.prompting.common.enums.SentimentTrend;
import com.familyleaf.prompting.common.enums.ValueEnum;
import com.familyleaf.prompting.extension.analysis.model.AnalysisRecord;
import com.familyleaf.prompting.extension.analysis.model.MessageAnalysis;
import com.familyleaf.prompting.extension.analysis.model.MessageCategory;
import com.familyleaf.prompting.extension.analysis.repository.AnalysisRecordRepository;
import com.familyleaf.prompting.extension.cache.StateCache;
import com.familyleaf.prompting.extension.family.model.LeafRecord;
import com.familyleaf.prompting.extension.family.model.UserProfile;
import com.familyleaf.prompting.extension.family.repository.FamilyDirectoryRepository;
import com.familyleaf.prompting.extension.family.repository.LeafRepository;
import com.familyleaf.prompting.extension.personalization.model.PersonalizedPromptSuggestion;
import com.familyleaf.prompting.extension.personalization.model.UserPattern;
import com.familyleaf.prompting.extension.scoring.ConfidenceModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 个性化提示系统
 * <p>
 * 从用户的历史回复分析中学习行为模式，并据此生成模板化的个性化提示与置信度。
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class PersonalizedPromptingSystem {

    private static final Logger logger = LoggerFactory.getLogger(PersonalizedPromptingSystem.class);

    static final int ANALYSIS_LIMIT = 100;
    static final int LEAF_LIMIT = 50;
    static final int DEFAULT_SUGGESTED_HOUR = 19;
    static final int MAX_SUGGESTED_RESPONSES = 4;
    static final String DEFAULT_USER_NAME = "there";
    static final String DEFAULT_PERSON = "everyone";

    private static final int SENTIMENT_WINDOW = 10;
    private static final double SENTIMENT_TREND_DELTA = 0.2;
    private static final double DEFAULT_RESPONSE_FREQUENCY_DAYS = 2;
    private static final double DEFAULT_RESPONSE_LATENCY_HOURS = 4;
    private static final double MILLIS_PER_DAY = 86_400_000d;

    private static final Map<PromptType, List<String>> TEMPLATES = new EnumMap<>(PromptType.class);

    private static final Map<PromptType, List<String>> SUGGESTED_RESPONSES = new EnumMap<>(PromptType.class);

    private static final Map<String, String> TOPIC_PHRASES = Map.of(
            "health", "Hope everyone is feeling well!",
            "food", "How's mealtime going?",
            "development", "Any new skills or progress?",
            "social", "How are the social interactions?",
            "activities", "What fun activities have you been up to?",
            "routine", "How's the daily routine flowing?");

    static {
        TEMPLATES.put(PromptType.CHECKIN, List.of(
                "Good {timeOfDay}, {userName}! How are things going with {person} today? {topic}",
                "Hi {userName}! I'm curious about your day - anything special happening with {topic}?",
                "{timeOfDay} check-in! How's {person} doing, {userName}? Would love to hear an update! {topic}"));
        TEMPLATES.put(PromptType.MEMORY, List.of(
                "Hey {userName}! I was thinking about memories... anything sweet from {topic} lately?",
                "Memory time, {userName}! What's a moment with {person} that made you smile recently? {topic}",
                "Hi {userName}! Share a special moment from your day - especially anything about {topic}!"));
        TEMPLATES.put(PromptType.MILESTONE, List.of(
                "Hi {userName}! 🎉 Any exciting developments or new things {person} is doing? {topic}",
                "{userName}, I'm always excited to hear about milestones! Anything new with {topic}?",
                "Milestone check, {userName}! 🌟 Has {person} done anything amazing lately? {topic}"));
        TEMPLATES.put(PromptType.CELEBRATION, List.of(
                "🎉 {userName}! I heard there might be something to celebrate with {topic}!",
                "Celebration time, {userName}! ✨ Tell me about this wonderful moment with {person}!",
                "So exciting, {userName}! 🌟 I'd love to hear all about {topic} and how {person} experienced it!"));
        TEMPLATES.put(PromptType.FOLLOWUP, List.of(
                "Hi {userName}! 💫 I've been thinking about what you shared about {topic}. How did that go?",
                "{userName}, following up on {topic} - how are things developing with {person}?",
                "Hey {userName}! ✨ You mentioned {topic} before. Any updates on how that's going?"));

        SUGGESTED_RESPONSES.put(PromptType.CHECKIN,
                List.of("Everything is going well!", "It's been a good day", "We're doing great!"));
        SUGGESTED_RESPONSES.put(PromptType.MEMORY,
                List.of("Let me share a sweet moment", "I have something to tell you", "Today was special"));
        SUGGESTED_RESPONSES.put(PromptType.MILESTONE,
                List.of("Yes, something amazing happened!", "We reached a new milestone!", "I have exciting news!"));
        SUGGESTED_RESPONSES.put(PromptType.CELEBRATION,
                List.of("Thank you for celebrating with us!", "It was such a special moment", "We're so proud!"));
        SUGGESTED_RESPONSES.put(PromptType.FOLLOWUP,
                List.of("Here's an update", "Things are going well", "Let me tell you more"));
    }

    private final AnalysisRecordRepository analysisRepository;
    private final LeafRepository leafRepository;
    private final FamilyDirectoryRepository directoryRepository;
    private final StateCache<UserPattern> patternCache;
    private final Clock clock;
    private final Random random;

    public PersonalizedPromptingSystem(AnalysisRecordRepository analysisRepository,
                                       LeafRepository leafRepository,
                                       FamilyDirectoryRepository directoryRepository,
                                       StateCache<UserPattern> patternCache,
                                       Clock clock,
                                       Random random) {
        this.analysisRepository = analysisRepository;
        this.leafRepository = leafRepository;
        this.directoryRepository = directoryRepository;
        this.patternCache = patternCache;
        this.clock = clock;
        this.random = random;
    }

    /**
     * 获取用户行为模式：缓存未过期直接返回，否则由最近的分析记录重新计算
     * <p>
     * 没有任何历史记录时返回默认模式，默认模式不进入缓存
     * </p>
     */
    public UserPattern analyzeUserPatterns(String userId, String branchId) {
        String key = StateCache.key(userId, branchId);
        Optional<UserPattern> cached = patternCache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        List<AnalysisRecord> analyses = analysisRepository.findRecent(userId, branchId, ANALYSIS_LIMIT);
        if (analyses.isEmpty()) {
            logger.debug("用户无回复分析历史，使用默认模式: userId={}, branchId={}", userId, branchId);
            return defaultPattern(userId, branchId);
        }

        List<LeafRecord> leaves = leafRepository.findRecentByAuthor(userId, branchId, LEAF_LIMIT);
        UserPattern pattern = computeUserPattern(userId, branchId, analyses, leaves);
        patternCache.put(key, pattern);
        logger.info("用户行为模式已更新: userId={}, branchId={}, samples={}, engagement={}, trend={}",
                userId, branchId, analyses.size(), pattern.getBehavioral().getEngagementLevel(),
                pattern.getBehavioral().getSentimentTrend());
        return pattern;
    }

    /**
     * 没有历史时使用的固定模式
     */
    public UserPattern defaultPattern(String userId, String branchId) {
        return UserPattern.builder()
                .userId(userId)
                .branchId(branchId)
                .preferences(UserPattern.Preferences.builder()
                        .preferredPromptTypes(new ArrayList<>(List.of(
                                PromptType.CHECKIN.getValue(), PromptType.MEMORY.getValue())))
                        .bestResponseTimes(new ArrayList<>(List.of("09:00", "19:00")))
                        .engagementTriggers(new ArrayList<>(List.of("family", "milestones", "daily activities")))
                        .build())
                .behavioral(UserPattern.Behavioral.builder()
                        .averageResponseLength(50)
                        .responseFrequency(DEFAULT_RESPONSE_FREQUENCY_DAYS)
                        .sentimentTrend(SentimentTrend.STABLE)
                        .engagementLevel(EngagementLevel.MEDIUM)
                        .build())
                .content(UserPattern.Content.builder().build())
                .timing(UserPattern.Timing.builder()
                        .mostActiveHours(new ArrayList<>(List.of(9, DEFAULT_SUGGESTED_HOUR)))
                        .preferredDays(new ArrayList<>(List.of("monday", "wednesday", "friday")))
                        .responseLatency(DEFAULT_RESPONSE_LATENCY_HOURS)
                        .build())
                .lastUpdated(clock.instant())
                .build();
    }

    /**
     * 由分析记录（按创建时间倒序）与用户最近的叶子计算行为模式
     */
    public UserPattern computeUserPattern(String userId, String branchId,
                                          List<AnalysisRecord> analyses, List<LeafRecord> leaves) {
        int total = analyses.size();
        List<MessageAnalysis> details = analyses.stream()
                .map(record -> record.getAnalysis() != null ? record.getAnalysis() : new MessageAnalysis())
                .collect(Collectors.toList());

        double averageLength = analyses.stream()
                .mapToInt(record -> record.getResponseText() != null ? record.getResponseText().length() : 0)
                .average()
                .orElse(0);

        SentimentTrend trend = sentimentTrend(details);

        List<String> frequentTags = topByFrequency(flatten(details, MessageAnalysis::getTags), 10);
        List<String> commonTopics = topByFrequency(flatten(details, MessageAnalysis::getTopics), 8);

        LinkedHashSet<String> milestoneTypes = details.stream()
                .map(MessageAnalysis::getMilestone)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        leaves.stream()
                .map(LeafRecord::getMilestoneType)
                .filter(Objects::nonNull)
                .forEach(milestoneTypes::add);

        List<String> people = distinct(flatten(details, MessageAnalysis::getPeople), 8);
        List<String> locations = distinct(flatten(details, MessageAnalysis::getLocations), 6);

        Map<Integer, Integer> hourCounts = new TreeMap<>();
        Map<String, Integer> dayCounts = new LinkedHashMap<>();
        for (AnalysisRecord record : analyses) {
            if (record.getCreatedAt() == null) {
                continue;
            }
            ZonedDateTime at = record.getCreatedAt().atZone(clock.getZone());
            hourCounts.merge(at.getHour(), 1, Integer::sum);
            dayCounts.merge(at.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH)
                    .toLowerCase(Locale.ROOT), 1, Integer::sum);
        }
        List<Integer> mostActiveHours = topEntries(hourCounts, 3);
        List<String> preferredDays = topEntries(dayCounts, 4);

        double fractionPositive = details.stream()
                .filter(analysis -> analysis.getSentiment() == Sentiment.POSITIVE).count() / (double) total;
        double fractionMultiCategory = details.stream()
                .filter(analysis -> analysis.getCategories() != null && analysis.getCategories().size() > 1)
                .count() / (double) total;
        EngagementLevel engagementLevel = engagementLevel(averageLength / 100 + fractionPositive + fractionMultiCategory);

        List<String> categoryTypes = new ArrayList<>();
        for (MessageAnalysis analysis : details) {
            if (analysis.getCategories() == null) {
                continue;
            }
            for (MessageCategory category : analysis.getCategories()) {
                if (category.getType() != null) {
                    categoryTypes.add(category.getType().getValue());
                }
            }
        }
        List<String> preferredPromptTypes = topByFrequency(categoryTypes, 3);
        if (preferredPromptTypes.isEmpty()) {
            preferredPromptTypes = new ArrayList<>(List.of(PromptType.CHECKIN.getValue(), PromptType.MEMORY.getValue()));
        }

        return UserPattern.builder()
                .userId(userId)
                .branchId(branchId)
                .preferences(UserPattern.Preferences.builder()
                        .preferredPromptTypes(preferredPromptTypes)
                        .bestResponseTimes(mostActiveHours.stream()
                                .map(hour -> String.format("%02d:00", hour))
                                .collect(Collectors.toList()))
                        .engagementTriggers(commonTopics.stream().limit(5).collect(Collectors.toList()))
                        .build())
                .behavioral(UserPattern.Behavioral.builder()
                        .averageResponseLength(Math.round(averageLength))
                        .responseFrequency(Math.round(responseFrequencyDays(analyses) * 10) / 10.0)
                        .sentimentTrend(trend)
                        .engagementLevel(engagementLevel)
                        .build())
                .content(UserPattern.Content.builder()
                        .commonTopics(commonTopics)
                        .frequentTags(frequentTags)
                        .milestoneTypes(new ArrayList<>(milestoneTypes))
                        .peopleOfInterest(people)
                        .locationPatterns(locations)
                        .build())
                .timing(UserPattern.Timing.builder()
                        .mostActiveHours(mostActiveHours)
                        .preferredDays(preferredDays)
                        .responseLatency(DEFAULT_RESPONSE_LATENCY_HOURS)
                        .build())
                .lastUpdated(clock.instant())
                .build();
    }

    public PersonalizedPromptSuggestion generatePersonalizedPrompt(String userId, String branchId) {
        return generatePersonalizedPrompt(userId, branchId, clock.instant());
    }

    /**
     * 依据用户模式生成个性化提示建议，不落库
     */
    public PersonalizedPromptSuggestion generatePersonalizedPrompt(String userId, String branchId, Instant time) {
        UserPattern pattern = analyzeUserPatterns(userId, branchId);
        ZonedDateTime at = time.atZone(clock.getZone());
        int hour = at.getHour();

        String userName = directoryRepository.findProfile(userId)
                .map(UserProfile::getFirstName)
                .filter(name -> !name.isBlank())
                .orElse(DEFAULT_USER_NAME);

        PromptType promptType = selectPromptType(pattern, hour);
        String content = fillTemplate(pattern, promptType, userName, hour);
        double confidence = calculatePromptConfidence(pattern, promptType, hour);

        List<String> topics = pattern.getContent().getCommonTopics();
        List<String> people = pattern.getContent().getPeopleOfInterest();
        return PersonalizedPromptSuggestion.builder()
                .content(content)
                .promptType(promptType)
                .confidence(confidence)
                .reasoning(reasoning(pattern, promptType, hour))
                .suggestedTiming(suggestTiming(pattern))
                .suggestedResponses(suggestedResponses(pattern, promptType))
                .personalizationFactors(PersonalizedPromptSuggestion.PersonalizationFactors.builder()
                        .basedOnTopics(topics.stream().limit(3).collect(Collectors.toList()))
                        .basedOnPeople(people.stream().limit(2).collect(Collectors.toList()))
                        .basedOnTiming(pattern.getTiming().getMostActiveHours().contains(hour))
                        .basedOnSentiment(pattern.getBehavioral().getSentimentTrend() == SentimentTrend.IMPROVING)
                        .build())
                .build();
    }

    /**
     * 个性化提示置信度，落在 [0.3, 0.95]
     */
    public double calculatePromptConfidence(UserPattern pattern, PromptType promptType, int hour) {
        return ConfidenceModel.forPersonalizedPrompt(
                        isPreferred(pattern, promptType),
                        pattern.getTiming().getMostActiveHours().contains(hour),
                        pattern.getBehavioral().getEngagementLevel(),
                        pattern.getContent().getCommonTopics().size())
                .score();
    }

    public UserPattern getUserInsights(String userId, String branchId) {
        return analyzeUserPatterns(userId, branchId);
    }

    public void invalidate(String userId, String branchId) {
        patternCache.invalidate(StateCache.key(userId, branchId));
    }

    public void clearCache() {
        patternCache.clear();
    }

    // ==================== 提示类型与内容 ====================

    PromptType selectPromptType(UserPattern pattern, int hour) {
        if (hour >= 6 && hour <= 10 && isPreferred(pattern, PromptType.CHECKIN)) {
            return PromptType.CHECKIN;
        }
        if (hour >= 18 && hour <= 22 && isPreferred(pattern, PromptType.MEMORY)) {
            return PromptType.MEMORY;
        }
        if (pattern.getContent().getMilestoneTypes().size() > 2 && isPreferred(pattern, PromptType.MILESTONE)) {
            return PromptType.MILESTONE;
        }
        return pattern.getPreferences().getPreferredPromptTypes().stream()
                .map(value -> ValueEnum.find(PromptType.class, value))
                .flatMap(Optional::stream)
                .filter(PromptType::isConversational)
                .findFirst()
                .orElse(PromptType.CHECKIN);
    }

    private String fillTemplate(UserPattern pattern, PromptType promptType, String userName, int hour) {
        List<String> templates = TEMPLATES.getOrDefault(promptType, TEMPLATES.get(PromptType.CHECKIN));
        String template = templates.get(random.nextInt(templates.size()));

        String content = template
                .replace("{userName}", userName)
                .replace("{timeOfDay}", timeOfDayLabel(hour));

        List<String> topics = pattern.getContent().getCommonTopics();
        if (!topics.isEmpty()) {
            String topic = topics.get(random.nextInt(Math.min(3, topics.size())));
            content = content.replace("{topic}", TOPIC_PHRASES.getOrDefault(topic, ""));
        } else {
            content = content.replace("{topic}", "");
        }

        List<String> people = pattern.getContent().getPeopleOfInterest();
        if (!people.isEmpty()) {
            content = content.replace("{person}", people.get(random.nextInt(Math.min(2, people.size()))));
        } else {
            content = content.replace("{person}", DEFAULT_PERSON);
        }

        return content.replaceAll("\\s+", " ").trim();
    }

    private List<String> reasoning(UserPattern pattern, PromptType promptType, int hour) {
        List<String> reasons = new ArrayList<>();
        if (isPreferred(pattern, promptType)) {
            reasons.add("User typically responds well to " + promptType.getValue() + " prompts");
        }
        if (pattern.getTiming().getMostActiveHours().contains(hour)) {
            reasons.add("User is usually active at " + hour + ":00");
        }
        if (pattern.getBehavioral().getEngagementLevel() == EngagementLevel.HIGH) {
            reasons.add("User shows high engagement with detailed responses");
        }
        List<String> topics = pattern.getContent().getCommonTopics();
        if (!topics.isEmpty()) {
            reasons.add("Personalized based on interests: "
                    + topics.stream().limit(2).collect(Collectors.joining(", ")));
        }
        if (pattern.getBehavioral().getSentimentTrend() == SentimentTrend.IMPROVING) {
            reasons.add("User sentiment has been positive lately");
        }
        return reasons;
    }

    private PersonalizedPromptSuggestion.SuggestedTiming suggestTiming(UserPattern pattern) {
        List<Integer> hours = pattern.getTiming().getMostActiveHours();
        List<String> days = pattern.getTiming().getPreferredDays();
        return PersonalizedPromptSuggestion.SuggestedTiming.builder()
                .hour(hours.isEmpty() ? DEFAULT_SUGGESTED_HOUR : hours.get(0))
                .day(days.isEmpty() ? null : days.get(0))
                .build();
    }

    private List<String> suggestedResponses(UserPattern pattern, PromptType promptType) {
        List<String> responses = new ArrayList<>(
                SUGGESTED_RESPONSES.getOrDefault(promptType, SUGGESTED_RESPONSES.get(PromptType.CHECKIN)));
        List<String> topics = pattern.getContent().getCommonTopics();
        if (topics.contains("food")) {
            responses.add("Mealtime went really well today");
        }
        if (topics.contains("development")) {
            responses.add("We're seeing new progress!");
        }
        return responses.stream().limit(MAX_SUGGESTED_RESPONSES).collect(Collectors.toList());
    }

    private static boolean isPreferred(UserPattern pattern, PromptType promptType) {
        return pattern.getPreferences().getPreferredPromptTypes().contains(promptType.getValue());
    }

    static String timeOfDayLabel(int hour) {
        if (hour >= 5 && hour < 12) {
            return "morning";
        }
        if (hour >= 12 && hour < 17) {
            return "afternoon";
        }
        if (hour >= 17 && hour < 21) {
            return "evening";
        }
        return "night";
    }

    // ==================== 统计 ====================

    /**
     * 比较最近 10 条与最早 10 条的平均情感分
     */
    static SentimentTrend sentimentTrend(List<MessageAnalysis> newestFirst) {
        List<MessageAnalysis> recent = newestFirst.subList(0, Math.min(SENTIMENT_WINDOW, newestFirst.size()));
        List<MessageAnalysis> earlier = newestFirst.subList(
                Math.max(0, newestFirst.size() - SENTIMENT_WINDOW), newestFirst.size());
        double recentScore = averageSentiment(recent);
        double earlierScore = averageSentiment(earlier);
        if (recentScore > earlierScore + SENTIMENT_TREND_DELTA) {
            return SentimentTrend.IMPROVING;
        }
        if (recentScore < earlierScore - SENTIMENT_TREND_DELTA) {
            return SentimentTrend.DECLINING;
        }
        return SentimentTrend.STABLE;
    }

    static EngagementLevel engagementLevel(double compositeScore) {
        if (compositeScore > 1.5) {
            return EngagementLevel.HIGH;
        }
        if (compositeScore < 0.8) {
            return EngagementLevel.LOW;
        }
        return EngagementLevel.MEDIUM;
    }

    private static double averageSentiment(List<MessageAnalysis> analyses) {
        return analyses.stream()
                .mapToInt(analysis -> analysis.getSentiment() != null ? analysis.getSentiment().getScore() : 0)
                .average()
                .orElse(0);
    }

    /**
     * 相邻记录的平均间隔天数，不足两条时为 2
     */
    private static double responseFrequencyDays(List<AnalysisRecord> analyses) {
        List<Instant> dates = analyses.stream()
                .map(AnalysisRecord::getCreatedAt)
                .filter(Objects::nonNull)
                .sorted((a, b) -> b.compareTo(a))
                .collect(Collectors.toList());
        if (dates.size() < 2) {
            return DEFAULT_RESPONSE_FREQUENCY_DAYS;
        }
        double totalDays = 0;
        for (int i = 0; i < dates.size() - 1; i++) {
            totalDays += Duration.between(dates.get(i + 1), dates.get(i)).toMillis() / MILLIS_PER_DAY;
        }
        return totalDays / (dates.size() - 1);
    }

    private static List<String> flatten(List<MessageAnalysis> analyses,
                                        Function<MessageAnalysis, Collection<String>> extractor) {
        List<String> values = new ArrayList<>();
        for (MessageAnalysis analysis : analyses) {
            Collection<String> items = extractor.apply(analysis);
            if (items != null) {
                values.addAll(items);
            }
        }
        return values;
    }

    private static List<String> topByFrequency(List<String> items, int limit) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        items.forEach(item -> counts.merge(item, 1, Integer::sum));
        return topEntries(counts, limit);
    }

    /**
     * 按出现次数倒序取前 N 个键，次数相同时保持原有顺序
     */
    private static <K> List<K> topEntries(Map<K, Integer> counts, int limit) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<K, Integer>comparingByValue().reversed())
                .limit(limit)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private static List<String> distinct(List<String> items, int limit) {
        return items.stream().distinct().limit(limit).collect(Collectors.toList());
    }
}
