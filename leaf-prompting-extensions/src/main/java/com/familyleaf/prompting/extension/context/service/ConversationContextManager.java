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
package com.familyleaf.prompting.extension.context.service;

import com.familyleaf.prompting.common.enums.ConversationPhase;
import com.familyleaf.prompting.common.enums.EngagementLevel;
import com.familyleaf.prompting.extension.ai.model.AiPromptContext;
import com.familyleaf.prompting.extension.analysis.service.TextSignals;
import com.familyleaf.prompting.extension.cache.StateCache;
import com.familyleaf.prompting.extension.context.model.BranchConversationContext;
import com.familyleaf.prompting.extension.context.model.ConversationPreferences;
import com.familyleaf.prompting.extension.context.model.ConversationState;
import com.familyleaf.prompting.extension.context.model.Interaction;
import com.familyleaf.prompting.extension.context.model.InteractionRecord;
import com.familyleaf.prompting.extension.context.model.TimeContext;
import com.familyleaf.prompting.extension.context.repository.ConversationStateRepository;
import com.familyleaf.prompting.extension.family.model.BranchInfo;
import com.familyleaf.prompting.extension.family.model.LeafRecord;
import com.familyleaf.prompting.extension.family.model.UserProfile;
import com.familyleaf.prompting.extension.family.repository.FamilyDirectoryRepository;
import com.familyleaf.prompting.extension.family.repository.LeafRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * 会话上下文管理器
 * <p>
 * 维护每个 (用户, 分支) 的会话状态机与偏好学习，并判断是否应主动提示用户。
 * 状态以存储为准，缓存只用于加速读取。
 * </p>
 *
 * <pre>
 * initial（无历史）→ active（少于 3 次互动）→ followup（至少 3 次且最近一次在 24 小时内）→ concluded（超过 24 小时）
 * </pre>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class ConversationContextManager {

    private static final Logger logger = LoggerFactory.getLogger(ConversationContextManager.class);

    static final int RECENT_MESSAGE_LIMIT = 10;
    static final int BRANCH_CONTEXT_LEAF_LIMIT = 50;
    static final String DEFAULT_USER_NAME = "there";

    private static final Duration CONCLUDED_AFTER = Duration.ofHours(24);
    private static final double MILLIS_PER_HOUR = 3_600_000d;

    private static final Map<String, List<String>> CONVERSATION_TOPICS = new LinkedHashMap<>();

    static {
        CONVERSATION_TOPICS.put("school", List.of("school", "class", "teacher", "homework", "learning"));
        CONVERSATION_TOPICS.put("playground", List.of("playground", "park", "swing", "slide", "outside"));
        CONVERSATION_TOPICS.put("food", List.of("eat", "food", "dinner", "lunch", "breakfast", "snack"));
        CONVERSATION_TOPICS.put("sleep", List.of("sleep", "nap", "bedtime", "tired", "dream"));
        CONVERSATION_TOPICS.put("play", List.of("play", "toys", "games", "fun", "blocks"));
        CONVERSATION_TOPICS.put("family", List.of("mom", "dad", "sister", "brother", "grandma", "grandpa"));
        CONVERSATION_TOPICS.put("milestones", List.of("first", "new", "learned", "can", "milestone"));
    }

    static final List<String> DEFAULT_PROMPTS = List.of(
            "How has your day been with the family?",
            "Any special moments you'd like to capture today?",
            "What's been the highlight of your week so far?",
            "Tell me about something that made you smile recently!");

    private final ConversationStateRepository stateRepository;
    private final LeafRepository leafRepository;
    private final FamilyDirectoryRepository directoryRepository;
    private final StateCache<ConversationState> stateCache;
    private final Clock clock;
    private final Random random;

    public ConversationContextManager(ConversationStateRepository stateRepository,
                                      LeafRepository leafRepository,
                                      FamilyDirectoryRepository directoryRepository,
                                      StateCache<ConversationState> stateCache,
                                      Clock clock,
                                      Random random) {
        this.stateRepository = stateRepository;
        this.leafRepository = leafRepository;
        this.directoryRepository = directoryRepository;
        this.stateCache = stateCache;
        this.clock = clock;
        this.random = random;
    }

    /**
     * 组装生成提示所需的上下文，只读
     */
    public AiPromptContext getAIContext(String userId, String branchId) {
        Optional<UserProfile> profile = directoryRepository.findProfile(userId);
        BranchInfo branch = directoryRepository.findBranch(branchId).orElseGet(() -> BranchInfo.fallback(branchId));
        List<LeafRecord> recentLeaves = leafRepository.findRecentByBranch(branchId, RECENT_MESSAGE_LIMIT);
        Optional<ConversationState> state = getUserState(userId, branchId);

        String userName = profile.map(UserProfile::fullName).filter(name -> !name.isEmpty()).orElse(DEFAULT_USER_NAME);

        return AiPromptContext.builder()
                .userId(userId)
                .branchId(branchId)
                .branchName(branch.getName())
                .branchType(branch.getType())
                .userName(userName)
                .familyRole(profile.map(UserProfile::getFamilyRole).orElse(null))
                .recentMessages(recentLeaves.stream()
                        .map(leaf -> AiPromptContext.RecentMessage.builder()
                                .content(leaf.getContent() != null ? leaf.getContent() : "")
                                .author(leaf.authorDisplayName())
                                .timestamp(leaf.getCreatedAt())
                                .milestoneType(leaf.getMilestoneType())
                                .build())
                        .collect(Collectors.toList()))
                .userPreferences(state.map(ConversationState::getPreferences).orElse(null))
                .timeContext(getTimeContext())
                .build();
    }

    /**
     * 记录一次互动并学习偏好，整体写回存储
     *
     * @return 更新后的状态
     */
    public ConversationState updateUserState(String userId, String branchId, Interaction interaction) {
        Instant now = clock.instant();
        ConversationState state = getUserState(userId, branchId)
                .map(ConversationState::copy)
                .orElseGet(() -> ConversationState.initial(userId, branchId, now));

        state.appendInteraction(InteractionRecord.builder()
                .prompt(interaction.prompt())
                .response(interaction.response())
                .timestamp(now)
                .engagement(interaction.engagement())
                .build());
        state.setConversationPhase(determinePhase(state.getResponseHistory(), now));
        state.setLastInteraction(now);
        updatePreferences(state.getPreferences(), interaction);

        stateRepository.upsert(state);
        stateCache.put(cacheKey(userId, branchId), state);
        logger.debug("更新会话状态: userId={}, branchId={}, phase={}, style={}",
                userId, branchId, state.getConversationPhase(), state.getPreferences().getPromptStyle());
        return state;
    }

    /**
     * 是否应主动提示用户
     * <p>
     * 无状态的用户总是返回 true；否则要求距上次互动超过频率阈值，且当前小时在偏好时间窗口内
     * </p>
     */
    public boolean shouldPromptUser(String userId, String branchId) {
        Optional<ConversationState> state = getUserState(userId, branchId);
        if (state.isEmpty()) {
            return true;
        }

        ConversationPreferences preferences = state.get().getPreferences() != null
                ? state.get().getPreferences() : ConversationPreferences.defaults();
        Instant lastInteraction = state.get().getLastInteraction();
        ZonedDateTime now = ZonedDateTime.now(clock);

        double hoursSince = lastInteraction == null
                ? Double.MAX_VALUE
                : Duration.between(lastInteraction, now.toInstant()).toMillis() / MILLIS_PER_HOUR;
        boolean dueByFrequency = hoursSince >= preferences.getReminderFrequency().getThresholdHours();
        boolean goodTime = preferences.getBestTimeForPrompts().contains(now.getHour());

        logger.debug("提示时机判断: userId={}, branchId={}, hoursSince={}, dueByFrequency={}, goodTime={}",
                userId, branchId, hoursSince, dueByFrequency, goodTime);
        return dueByFrequency && goodTime;
    }

    /**
     * 非学习型的兜底提示建议
     * <p>
     * 用户没有会话状态或分支没有近期内容时返回 4 条通用提示
     * </p>
     */
    public List<String> getPersonalizedPrompts(String userId, String branchId) {
        Optional<ConversationState> state = getUserState(userId, branchId);
        Optional<BranchConversationContext> branchContext = getBranchContext(branchId);
        if (state.isEmpty() || branchContext.isEmpty()) {
            return DEFAULT_PROMPTS;
        }

        List<String> prompts = new ArrayList<>();

        List<BranchConversationContext.RecentMilestone> milestones = branchContext.get().getRecentMilestones();
        if (!milestones.isEmpty()) {
            BranchConversationContext.RecentMilestone latest = milestones.get(0);
            String child = latest.getChild() != null ? latest.getChild() : "the little one";
            prompts.add("How has everyone been adjusting since " + child + "'s " + latest.getType() + "?");
        }

        List<String> activities = branchContext.get().getCommonActivities();
        if (!activities.isEmpty()) {
            String activity = activities.get(random.nextInt(activities.size()));
            prompts.add("Have you done any " + activity + " lately? I'd love to hear about it!");
        }

        if ("Sunday".equals(getTimeContext().getDayOfWeek())) {
            prompts.add("How was your family weekend? Any special moments to remember?");
        }

        return prompts.isEmpty() ? DEFAULT_PROMPTS : prompts;
    }

    /**
     * 由分支最近的叶子推导分支上下文，分支没有内容时返回空
     */
    public Optional<BranchConversationContext> getBranchContext(String branchId) {
        List<LeafRecord> leaves = leafRepository.findRecentByBranch(branchId, BRANCH_CONTEXT_LEAF_LIMIT);
        if (leaves.isEmpty()) {
            return Optional.empty();
        }

        Instant dayAgo = clock.instant().minus(Duration.ofHours(24));
        Map<String, Integer> topicCounts = new LinkedHashMap<>();
        Map<String, Integer> activityCounts = new LinkedHashMap<>();
        LinkedHashSet<String> members = new LinkedHashSet<>();
        List<BranchConversationContext.RecentMilestone> milestones = new ArrayList<>();
        int last24h = 0;

        for (LeafRecord leaf : leaves) {
            String text = leaf.getContent() != null ? leaf.getContent().toLowerCase(Locale.ROOT) : "";
            extractTopics(text).forEach(topic -> topicCounts.merge(topic, 1, Integer::sum));
            TextSignals.matchedKeywords(text, TextSignals.ACTIVITY_KEYWORDS)
                    .forEach(activity -> activityCounts.merge(activity, 1, Integer::sum));
            members.add(leaf.getAuthorId());
            if (leaf.getCreatedAt() != null && !leaf.getCreatedAt().isBefore(dayAgo)) {
                last24h++;
            }
            if (leaf.getMilestoneType() != null) {
                milestones.add(BranchConversationContext.RecentMilestone.builder()
                        .type(leaf.getMilestoneType().replace('_', ' '))
                        .date(leaf.getCreatedAt())
                        .build());
            }
        }

        LeafRecord latest = leaves.get(0);
        return Optional.of(BranchConversationContext.builder()
                .branchId(branchId)
                .messageCount24h(last24h)
                .lastActiveUserId(latest.getAuthorId())
                .lastActiveTime(latest.getCreatedAt())
                .topTopics(topByCount(topicCounts, 3))
                .activeMemberIds(new ArrayList<>(members))
                .commonActivities(topByCount(activityCounts, 5))
                .recentMilestones(milestones)
                .build());
    }

    /**
     * 读取会话状态：先查缓存，未命中再查存储并回填缓存；不会创建新状态
     */
    public Optional<ConversationState> getUserState(String userId, String branchId) {
        String key = cacheKey(userId, branchId);
        Optional<ConversationState> cached = stateCache.get(key);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<ConversationState> stored = stateRepository.find(userId, branchId);
        stored.ifPresent(state -> stateCache.put(key, state));
        return stored;
    }

    public TimeContext getTimeContext() {
        return TimeContext.of(ZonedDateTime.now(clock));
    }

    public void invalidateUserState(String userId, String branchId) {
        stateCache.invalidate(cacheKey(userId, branchId));
    }

    public void clearCache() {
        stateCache.clear();
    }

    /**
     * 根据最近 5 次互动推导会话阶段
     */
    static ConversationPhase determinePhase(List<InteractionRecord> history, Instant now) {
        List<InteractionRecord> recent = history.subList(Math.max(0, history.size() - 5), history.size());
        if (recent.isEmpty()) {
            return ConversationPhase.INITIAL;
        }
        if (recent.size() < 3) {
            return ConversationPhase.ACTIVE;
        }
        Instant last = recent.get(recent.size() - 1).getTimestamp();
        if (last != null && Duration.between(last, now).compareTo(CONCLUDED_AFTER) >= 0) {
            return ConversationPhase.CONCLUDED;
        }
        return ConversationPhase.FOLLOWUP;
    }

    static List<String> extractTopics(String text) {
        return TextSignals.matchingKeys(text.toLowerCase(Locale.ROOT), CONVERSATION_TOPICS);
    }

    /**
     * 低参与度且回复很短时切换语气风格；高参与度的长回复保持现状
     */
    private void updatePreferences(ConversationPreferences preferences, Interaction interaction) {
        int length = interaction.response().length();
        if (interaction.engagement() == EngagementLevel.HIGH && length > 100) {
            return;
        }
        if (interaction.engagement() == EngagementLevel.LOW && length < 50) {
            preferences.setPromptStyle(preferences.getPromptStyle().alternative());
        }
        preferences.addTopics(extractTopics(interaction.response()));
    }

    private static List<String> topByCount(Map<String, Integer> counts, int limit) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(limit)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private static String cacheKey(String userId, String branchId) {
        return StateCache.key(userId, branchId);
    }
}
