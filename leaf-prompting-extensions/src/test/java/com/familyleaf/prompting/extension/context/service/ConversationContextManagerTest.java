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
import com.familyleaf.prompting.common.enums.PromptStyle;
import com.familyleaf.prompting.common.enums.PromptWindow;
import com.familyleaf.prompting.common.enums.ReminderFrequency;
import com.familyleaf.prompting.extension.ai.model.AiPromptContext;
import com.familyleaf.prompting.extension.cache.LocalStateCache;
import com.familyleaf.prompting.extension.context.model.ConversationState;
import com.familyleaf.prompting.extension.context.model.Interaction;
import com.familyleaf.prompting.extension.context.model.InteractionRecord;
import com.familyleaf.prompting.extension.family.model.LeafRecord;
import com.familyleaf.prompting.extension.support.InMemoryConversationStateRepository;
import com.familyleaf.prompting.extension.support.InMemoryFamilyDirectoryRepository;
import com.familyleaf.prompting.extension.support.InMemoryLeafRepository;
import com.familyleaf.prompting.extension.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConversationContextManager 单元测试")
class ConversationContextManagerTest {

    private static final String USER = "user-1";
    private static final String BRANCH = "branch-1";

    private MutableClock clock;
    private InMemoryConversationStateRepository stateRepository;
    private InMemoryLeafRepository leafRepository;
    private InMemoryFamilyDirectoryRepository directoryRepository;
    private ConversationContextManager manager;

    @BeforeEach
    void setUp() {
        // 2024-06-10 是周一
        clock = MutableClock.at("2024-06-10T10:00:00");
        stateRepository = new InMemoryConversationStateRepository();
        leafRepository = new InMemoryLeafRepository();
        directoryRepository = new InMemoryFamilyDirectoryRepository();
        manager = new ConversationContextManager(stateRepository, leafRepository, directoryRepository,
                new LocalStateCache<>("conversation-state", null, clock), clock, new Random(42));
    }

    @Test
    @DisplayName("没有会话状态的用户总是可以提示")
    void shouldPromptUserWithoutState() {
        assertThat(manager.shouldPromptUser(USER, BRANCH)).isTrue();
        assertThat(manager.getUserState(USER, BRANCH)).isEmpty();
    }

    @Test
    @DisplayName("首次互动创建状态并写回存储")
    void shouldCreateStateOnFirstInteraction() {
        // When
        ConversationState state = manager.updateUserState(USER, BRANCH,
                new Interaction("How was today?", "Great", EngagementLevel.MEDIUM));

        // Then
        assertThat(state.getResponseHistory()).hasSize(1);
        assertThat(state.getConversationPhase()).isEqualTo(ConversationPhase.ACTIVE);
        assertThat(state.getLastInteraction()).isEqualTo(clock.instant());
        assertThat(stateRepository.getUpsertCount()).isEqualTo(1);
        assertThat(stateRepository.find(USER, BRANCH)).isPresent();
    }

    @Test
    @DisplayName("第 51 次互动淘汰最早的一条，历史保持 50 条")
    void shouldEvictOldestInteraction() {
        for (int i = 0; i < 51; i++) {
            manager.updateUserState(USER, BRANCH, new Interaction("p" + i, "r" + i, EngagementLevel.MEDIUM));
        }

        ConversationState state = manager.getUserState(USER, BRANCH).orElseThrow();
        assertThat(state.getResponseHistory()).hasSize(ConversationState.MAX_HISTORY);
        assertThat(state.getResponseHistory().get(0).getPrompt()).isEqualTo("p1");
        assertThat(state.getResponseHistory().get(49).getPrompt()).isEqualTo("p50");
    }

    @Test
    @DisplayName("三次互动后进入 followup 阶段")
    void shouldMoveToFollowUpPhase() {
        manager.updateUserState(USER, BRANCH, new Interaction("a", "b", EngagementLevel.MEDIUM));
        manager.updateUserState(USER, BRANCH, new Interaction("c", "d", EngagementLevel.MEDIUM));
        ConversationState state = manager.updateUserState(USER, BRANCH,
                new Interaction("e", "f", EngagementLevel.MEDIUM));

        assertThat(state.getConversationPhase()).isEqualTo(ConversationPhase.FOLLOWUP);
    }

    @Test
    @DisplayName("最近一次互动超过 24 小时为 concluded")
    void shouldConcludeStaleConversation() {
        Instant now = clock.instant();
        List<InteractionRecord> history = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            history.add(InteractionRecord.builder().prompt("p").response("r")
                    .timestamp(now.minus(Duration.ofHours(30))).engagement(EngagementLevel.MEDIUM).build());
        }

        assertThat(ConversationContextManager.determinePhase(history, now)).isEqualTo(ConversationPhase.CONCLUDED);
        assertThat(ConversationContextManager.determinePhase(new ArrayList<>(), now))
                .isEqualTo(ConversationPhase.INITIAL);
    }

    @Test
    @DisplayName("恰好 24 小时即为 concluded，不足 24 小时为 followup")
    void shouldConcludeAtExactlyTwentyFourHours() {
        Instant now = clock.instant();
        List<InteractionRecord> history = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            history.add(InteractionRecord.builder().prompt("p").response("r")
                    .timestamp(now.minus(Duration.ofHours(24))).engagement(EngagementLevel.MEDIUM).build());
        }
        List<InteractionRecord> recent = new ArrayList<>(history.subList(0, 2));
        recent.add(InteractionRecord.builder().prompt("p").response("r")
                .timestamp(now.minus(Duration.ofHours(23))).engagement(EngagementLevel.MEDIUM).build());

        assertThat(ConversationContextManager.determinePhase(history, now)).isEqualTo(ConversationPhase.CONCLUDED);
        assertThat(ConversationContextManager.determinePhase(recent, now)).isEqualTo(ConversationPhase.FOLLOWUP);
    }

    @Test
    @DisplayName("默认中频：互动后立即不提示，超过 24 小时再提示")
    void shouldRespectMediumFrequency() {
        manager.updateUserState(USER, BRANCH, new Interaction("p", "r", EngagementLevel.MEDIUM));
        assertThat(manager.shouldPromptUser(USER, BRANCH)).isFalse();

        clock.advance(Duration.ofHours(25));
        assertThat(manager.shouldPromptUser(USER, BRANCH)).isTrue();
    }

    @Test
    @DisplayName("低频用户 2 小时后仍不提示")
    void shouldNotPromptLowFrequencyUserAfterTwoHours() {
        // Given
        ConversationState state = manager.updateUserState(USER, BRANCH,
                new Interaction("p", "r", EngagementLevel.MEDIUM));
        ConversationState lowFrequency = state.copy();
        lowFrequency.getPreferences().setReminderFrequency(ReminderFrequency.LOW);
        stateRepository.upsert(lowFrequency);
        manager.invalidateUserState(USER, BRANCH);

        // When
        clock.advance(Duration.ofHours(2));

        // Then
        assertThat(manager.shouldPromptUser(USER, BRANCH)).isFalse();
    }

    @Test
    @DisplayName("超出偏好时间窗口时不提示")
    void shouldNotPromptOutsidePreferredWindow() {
        ConversationState state = manager.updateUserState(USER, BRANCH,
                new Interaction("p", "r", EngagementLevel.MEDIUM));
        ConversationState morningOnly = state.copy();
        morningOnly.getPreferences().setBestTimeForPrompts(PromptWindow.MORNING);
        stateRepository.upsert(morningOnly);
        manager.clearCache();

        // 次日 20:00
        clock.advance(Duration.ofHours(34));

        assertThat(manager.shouldPromptUser(USER, BRANCH)).isFalse();
    }

    @Test
    @DisplayName("低参与度的短回复切换语气风格")
    void shouldSwitchStyleOnLowEngagement() {
        ConversationState state = manager.updateUserState(USER, BRANCH,
                new Interaction("How was the park?", "ok", EngagementLevel.LOW));

        assertThat(state.getPreferences().getPromptStyle()).isEqualTo(PromptStyle.PLAYFUL);
    }

    @Test
    @DisplayName("回复中的话题合并进偏好")
    void shouldLearnTopicsFromResponse() {
        ConversationState state = manager.updateUserState(USER, BRANCH,
                new Interaction("Anything new?", "We went to the park after school", EngagementLevel.MEDIUM));

        assertThat(state.getPreferences().getPreferredTopics()).containsExactly("school", "playground");
        assertThat(state.getPreferences().getPromptStyle()).isEqualTo(PromptStyle.CASUAL);
    }

    @Test
    @DisplayName("高参与度的长回复不改变偏好")
    void shouldKeepPreferencesOnHighEngagement() {
        String longResponse = "We spent the whole afternoon at the park with grandma and then had a picnic lunch "
                + "under the big oak tree, it was lovely.";

        ConversationState state = manager.updateUserState(USER, BRANCH,
                new Interaction("Tell me more", longResponse, EngagementLevel.HIGH));

        assertThat(state.getPreferences().getPreferredTopics()).isEmpty();
    }

    @Test
    @DisplayName("上下文包含用户名、分支名、最近内容与时间")
    void shouldBuildAiContext() {
        // Given
        directoryRepository.addProfile(USER, "Sarah", "Lee");
        directoryRepository.addBranch(BRANCH, "The Lees");
        leafRepository.add(leaf("l1", "older", null, clock.instant().minus(Duration.ofHours(5))));
        leafRepository.add(leaf("l2", "newer", "first_steps", clock.instant().minus(Duration.ofHours(1))));

        // When
        AiPromptContext context = manager.getAIContext(USER, BRANCH);

        // Then
        assertThat(context.getUserName()).isEqualTo("Sarah Lee");
        assertThat(context.getBranchName()).isEqualTo("The Lees");
        assertThat(context.getRecentMessages())
                .extracting(AiPromptContext.RecentMessage::getContent)
                .containsExactly("newer", "older");
        assertThat(context.getRecentMessages().get(0).getMilestoneType()).isEqualTo("first_steps");
        assertThat(context.getUserPreferences()).isNull();
        assertThat(context.getTimeContext().getTimeOfDay()).isEqualTo("morning");
        assertThat(context.getTimeContext().getDayOfWeek()).isEqualTo("Monday");
        assertThat(context.getTimeContext().getSeason()).isEqualTo("summer");
    }

    @Test
    @DisplayName("资料缺失时使用默认用户名与分支名")
    void shouldUseDefaultsForMissingDirectoryEntries() {
        AiPromptContext context = manager.getAIContext("ghost", "nowhere");

        assertThat(context.getUserName()).isEqualTo("there");
        assertThat(context.getBranchName()).isEqualTo("Family");
        assertThat(context.getRecentMessages()).isEmpty();
    }

    @Test
    @DisplayName("无状态时返回默认提示")
    void shouldReturnDefaultPromptsWithoutState() {
        assertThat(manager.getPersonalizedPrompts(USER, BRANCH))
                .isEqualTo(ConversationContextManager.DEFAULT_PROMPTS);
    }

    @Test
    @DisplayName("根据分支里程碑与常见活动生成提示")
    void shouldBuildPromptsFromBranchContext() {
        // Given
        manager.updateUserState(USER, BRANCH, new Interaction("p", "r", EngagementLevel.MEDIUM));
        leafRepository.add(leaf("l1", "We went to the park", null, clock.instant().minus(Duration.ofHours(3))));
        leafRepository.add(leaf("l2", "She walked alone", "first_steps", clock.instant().minus(Duration.ofHours(1))));

        // When
        List<String> prompts = manager.getPersonalizedPrompts(USER, BRANCH);

        // Then
        assertThat(prompts).containsExactly(
                "How has everyone been adjusting since the little one's first steps?",
                "Have you done any park lately? I'd love to hear about it!");
    }

    @Test
    @DisplayName("缓存失效后从存储恢复状态")
    void shouldReloadStateFromStoreAfterCacheClear() {
        manager.updateUserState(USER, BRANCH, new Interaction("p", "r", EngagementLevel.MEDIUM));

        manager.clearCache();

        assertThat(manager.getUserState(USER, BRANCH)).get()
                .extracting(state -> state.getResponseHistory().size())
                .isEqualTo(1);
    }

    private LeafRecord leaf(String id, String content, String milestoneType, Instant createdAt) {
        return LeafRecord.builder()
                .id(id)
                .branchId(BRANCH)
                .authorId("author-1")
                .authorFirstName("Ann")
                .content(content)
                .milestoneType(milestoneType)
                .createdAt(createdAt)
                .build();
    }
}
