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
import com.familyleaf.prompting.common.enums.PromptStatus;
import com.familyleaf.prompting.common.enums.PromptType;
import com.familyleaf.prompting.common.exception.AiProviderException;
import com.familyleaf.prompting.common.exception.PromptPersistenceException;
import com.familyleaf.prompting.extension.ai.model.AiPromptContext;
import com.familyleaf.prompting.extension.ai.model.AiResponse;
import com.familyleaf.prompting.extension.ai.service.AiService;
import com.familyleaf.prompting.extension.analysis.model.AnalysisRecord;
import com.familyleaf.prompting.extension.analysis.model.MessageAnalysis;
import com.familyleaf.prompting.extension.analysis.model.MessageCategory;
import com.familyleaf.prompting.extension.analysis.service.ResponseAnalyzer;
import com.familyleaf.prompting.extension.config.PromptingProperties;
import com.familyleaf.prompting.extension.context.model.Interaction;
import com.familyleaf.prompting.extension.context.model.TimeContext;
import com.familyleaf.prompting.extension.context.service.ConversationContextManager;
import com.familyleaf.prompting.extension.family.model.BranchMembership;
import com.familyleaf.prompting.extension.family.model.LeafRecord;
import com.familyleaf.prompting.extension.family.repository.FamilyDirectoryRepository;
import com.familyleaf.prompting.extension.family.repository.LeafRepository;
import com.familyleaf.prompting.extension.leaf.model.LeafContentAnalysis;
import com.familyleaf.prompting.extension.leaf.model.LeafEnhancementRequest;
import com.familyleaf.prompting.extension.leaf.model.LeafEnhancementResult;
import com.familyleaf.prompting.extension.leaf.service.LeafEnhancementService;
import com.familyleaf.prompting.extension.personalization.model.PersonalizedPromptSuggestion;
import com.familyleaf.prompting.extension.personalization.model.UserPattern;
import com.familyleaf.prompting.extension.personalization.service.PersonalizedPromptingSystem;
import com.familyleaf.prompting.extension.prompt.model.AiMetadata;
import com.familyleaf.prompting.extension.prompt.model.PromptTemplate;
import com.familyleaf.prompting.extension.prompt.model.SmartPrompt;
import com.familyleaf.prompting.extension.prompt.repository.SmartPromptRepository;
import com.familyleaf.prompting.extension.scoring.ConfidenceModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 智能提示引擎
 * <p>
 * 编排主动提示的生成（个性化 → 模型 → 固定话术 三级兜底）、回复处理、里程碑庆祝、批量调度与过期清理，
 * 并驱动提示的生命周期：pending → responded / dismissed，过期在读取时推导。
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class SmartPromptingEngine {

    private static final Logger logger = LoggerFactory.getLogger(SmartPromptingEngine.class);

    static final String PROVIDER_PERSONALIZED = "personalized";
    static final String PROVIDER_DEMO = "demo";
    static final String PROVIDER_MILESTONE = "milestone-detection";
    static final String MODEL_MILESTONE = "auto-trigger";

    /**
     * 回复超过该长度才考虑生成追问
     */
    static final int FOLLOW_UP_MIN_LENGTH = 20;

    static final List<String> CELEBRATION_RESPONSES = List.of(
            "It was amazing to watch!", "We were so proud!", "I have photos to share", "Such a special moment");

    private static final Pattern RECENT_KEYWORDS = Pattern.compile(
            "\\b(?:school|playground|food|sleep|play|birthday|milestone|first|new|love|fun|happy|excited)\\b",
            Pattern.CASE_INSENSITIVE);

    private final ConversationContextManager contextManager;
    private final PersonalizedPromptingSystem personalizedSystem;
    private final ResponseAnalyzer responseAnalyzer;
    private final EngagementScorer engagementScorer;
    private final PromptTemplateLibrary templateLibrary;
    private final DemoResponder demoResponder;
    private final SmartPromptRepository promptRepository;
    private final LeafRepository leafRepository;
    private final FamilyDirectoryRepository directoryRepository;
    private final AsyncAnalysisPersistenceService analysisPersistence;
    private final LeafEnhancementService leafEnhancementService;

    /**
     * 未配置文本生成服务时为 null
     */
    private final AiService aiService;
    private final PromptingProperties properties;
    private final Clock clock;

    public SmartPromptingEngine(ConversationContextManager contextManager,
                                PersonalizedPromptingSystem personalizedSystem,
                                ResponseAnalyzer responseAnalyzer,
                                EngagementScorer engagementScorer,
                                PromptTemplateLibrary templateLibrary,
                                DemoResponder demoResponder,
                                SmartPromptRepository promptRepository,
                                LeafRepository leafRepository,
                                FamilyDirectoryRepository directoryRepository,
                                AsyncAnalysisPersistenceService analysisPersistence,
                                LeafEnhancementService leafEnhancementService,
                                AiService aiService,
                                PromptingProperties properties,
                                Clock clock) {
        this.contextManager = contextManager;
        this.personalizedSystem = personalizedSystem;
        this.responseAnalyzer = responseAnalyzer;
        this.engagementScorer = engagementScorer;
        this.templateLibrary = templateLibrary;
        this.demoResponder = demoResponder;
        this.promptRepository = promptRepository;
        this.leafRepository = leafRepository;
        this.directoryRepository = directoryRepository;
        this.analysisPersistence = analysisPersistence;
        this.leafEnhancementService = leafEnhancementService;
        this.aiService = aiService;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== 主动提示 ====================

    /**
     * 为用户生成一条主动提示并落库
     *
     * @return 用户当前不适合提示时为空
     * @throws PromptPersistenceException 提示保存失败
     */
    public Optional<SmartPrompt> generateProactivePrompt(String userId, String branchId) {
        if (!contextManager.shouldPromptUser(userId, branchId)) {
            logger.debug("当前不适合提示用户: userId={}, branchId={}", userId, branchId);
            return Optional.empty();
        }

        Instant now = clock.instant();
        AiPromptContext context = contextManager.getAIContext(userId, branchId);

        PromptDraft draft = personalizedDraft(userId, branchId, now);
        if (draft == null) {
            TimeContext time = context.getTimeContext();
            PromptTemplate template = templateLibrary.select(time.getTimeOfDay(), time.getDayOfWeek(),
                    extractRecentKeywords(context.getRecentMessages()));
            draft = providerDraft(context, template);
            if (draft == null) {
                draft = demoDraft(context, template);
            }
        }

        SmartPrompt prompt = newPrompt(userId, branchId, draft.content, draft.promptType, draft.suggestedResponses,
                AiMetadata.builder()
                        .provider(draft.provider)
                        .model(draft.model)
                        .confidence(draft.confidence)
                        .template(draft.templateId)
                        .build(),
                now);
        SmartPrompt saved = persist(prompt);

        contextManager.updateUserState(userId, branchId,
                new Interaction(saved.getContent(), "", EngagementLevel.MEDIUM));
        logger.info("生成主动提示: promptId={}, userId={}, branchId={}, promptType={}, provider={}",
                saved.getId(), userId, branchId, saved.getPromptType().getValue(), draft.provider);
        return Optional.of(saved);
    }

    /**
     * 第一级：个性化提示，置信度超过阈值才采用
     */
    private PromptDraft personalizedDraft(String userId, String branchId, Instant now) {
        try {
            PersonalizedPromptSuggestion suggestion =
                    personalizedSystem.generatePersonalizedPrompt(userId, branchId, now);
            if (suggestion.getConfidence() > properties.getPersonalizedConfidenceThreshold()) {
                return new PromptDraft(suggestion.getContent(), suggestion.getPromptType(),
                        suggestion.getSuggestedResponses(), suggestion.getConfidence(),
                        PROVIDER_PERSONALIZED, PROVIDER_PERSONALIZED, null);
            }
            logger.debug("个性化提示置信度不足，使用模板: userId={}, confidence={}", userId, suggestion.getConfidence());
        } catch (RuntimeException e) {
            logger.warn("个性化提示生成失败，使用模板: userId={}, branchId={}", userId, branchId, e);
        }
        return null;
    }

    /**
     * 第二级：文本生成服务
     */
    private PromptDraft providerDraft(AiPromptContext context, PromptTemplate template) {
        if (aiService == null) {
            return null;
        }
        try {
            AiResponse response = aiService.generatePrompt(context);
            return new PromptDraft(response.getMessage(), response.getPromptType(), response.getSuggestedResponses(),
                    response.getConfidenceScore(), aiService.getProvider(), aiService.getModel(), template.getId());
        } catch (RuntimeException e) {
            String provider = e instanceof AiProviderException
                    ? ((AiProviderException) e).getProvider() : aiService.getProvider();
            logger.warn("文本生成服务调用失败，使用固定话术: userId={}, provider={}",
                    context.getUserId(), provider, e);
            return null;
        }
    }

    /**
     * 第三级：固定话术，总能生成
     */
    private PromptDraft demoDraft(AiPromptContext context, PromptTemplate template) {
        String content = demoResponder.respond(template, context.getUserName(), context.getBranchName());
        return new PromptDraft(content, template.getType(), template.getSuggestedResponses(),
                ConfidenceModel.DEMO_PROMPT, PROVIDER_DEMO, PROVIDER_DEMO, template.getId());
    }

    // ==================== 回复处理 ====================

    /**
     * 处理用户对提示的回复
     *
     * @return 生成的追问；提示不存在、非待处理、已过期或不需要追问时为空
     */
    public Optional<AiResponse> processUserResponse(String promptId, String userResponse,
                                                    String userId, String branchId) {
        Instant now = clock.instant();
        Optional<SmartPrompt> found = promptRepository.findById(promptId);
        if (found.isEmpty() || !found.get().isPendingAt(now)) {
            logger.debug("提示不可回复: promptId={}, status={}", promptId,
                    found.map(prompt -> prompt.effectiveStatus(now).getValue()).orElse("missing"));
            return Optional.empty();
        }
        if (!promptRepository.transitionStatus(promptId, PromptStatus.PENDING, PromptStatus.RESPONDED)) {
            logger.info("提示状态已被并发修改: promptId={}", promptId);
            return Optional.empty();
        }
        SmartPrompt prompt = found.get();
        String response = userResponse != null ? userResponse : "";

        MessageAnalysis analysis = responseAnalyzer.analyzeMessage(response);
        EngagementLevel engagement = engagementScorer.score(response, analysis);
        storeAnalysis(userId, branchId, response, analysis, now);

        contextManager.updateUserState(userId, branchId, new Interaction(prompt.getContent(), response, engagement));
        logger.info("处理提示回复: promptId={}, userId={}, engagement={}, milestone={}",
                promptId, userId, engagement.getValue(), analysis.getMilestone());

        if (response.length() <= FOLLOW_UP_MIN_LENGTH || engagement == EngagementLevel.LOW) {
            return Optional.empty();
        }

        try {
            return Optional.of(createFollowUp(prompt, response, userId, branchId));
        } catch (RuntimeException e) {
            logger.error("生成追问失败: promptId={}, userId={}, branchId={}", promptId, userId, branchId, e);
            return Optional.empty();
        }
    }

    private AiResponse createFollowUp(SmartPrompt prompt, String response, String userId, String branchId) {
        AiResponse followUp;
        String provider;
        String model;
        if (aiService != null) {
            AiPromptContext context = contextManager.getAIContext(userId, branchId);
            followUp = aiService.processUserResponse(response, context, prompt.getPromptType());
            provider = aiService.getProvider();
            model = aiService.getModel();
        } else {
            followUp = AiResponse.builder()
                    .message(demoResponder.followUp())
                    .promptType(PromptType.FOLLOWUP)
                    .confidenceScore(ConfidenceModel.DEMO_FOLLOW_UP)
                    .build();
            provider = PROVIDER_DEMO;
            model = PROVIDER_DEMO;
        }

        SmartPrompt followUpPrompt = newPrompt(userId, branchId, followUp.getMessage(), PromptType.FOLLOWUP,
                followUp.getSuggestedResponses(),
                AiMetadata.builder().provider(provider).model(model).confidence(followUp.getConfidenceScore()).build(),
                clock.instant());
        persist(followUpPrompt);
        return followUp;
    }

    private void storeAnalysis(String userId, String branchId, String response, MessageAnalysis analysis,
                               Instant now) {
        AnalysisRecord record = AnalysisRecord.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .branchId(branchId)
                .responseText(response)
                .analysis(analysis)
                .confidenceScore(analysis.primaryCategory()
                        .map(MessageCategory::getConfidence)
                        .orElse(ConfidenceModel.DEFAULT_ANALYSIS))
                .createdAt(now)
                .build();
        try {
            analysisPersistence.saveAsync(record);
        } catch (RuntimeException e) {
            logger.error("提交回复分析保存任务失败: userId={}, branchId={}", userId, branchId, e);
        }
    }

    /**
     * 用户忽略提示
     *
     * @return 更新后的提示；不存在、非待处理或已过期时为空
     */
    public Optional<SmartPrompt> dismissPrompt(String promptId) {
        Instant now = clock.instant();
        Optional<SmartPrompt> found = promptRepository.findById(promptId);
        if (found.isEmpty() || !found.get().isPendingAt(now)) {
            return Optional.empty();
        }
        if (!promptRepository.transitionStatus(promptId, PromptStatus.PENDING, PromptStatus.DISMISSED)) {
            return Optional.empty();
        }
        SmartPrompt prompt = found.get();
        prompt.setStatus(PromptStatus.DISMISSED);
        logger.info("提示已忽略: promptId={}, userId={}", promptId, prompt.getUserId());
        return Optional.of(prompt);
    }

    public List<SmartPrompt> getPendingPrompts(String userId, String branchId) {
        return promptRepository.findPending(userId, branchId, clock.instant());
    }

    // ==================== 里程碑 ====================

    /**
     * 扫描回看窗口内带里程碑标记的叶子，为尚未庆祝过的里程碑生成庆祝提示
     * <p>
     * 单个叶子处理失败只记录日志，继续处理其余叶子
     * </p>
     */
    public List<SmartPrompt> checkForMilestones(String branchId) {
        PromptingProperties.MilestoneDetection detection = properties.getMilestoneDetection();
        if (!detection.isEnabled()) {
            return new ArrayList<>();
        }

        Instant now = clock.instant();
        List<LeafRecord> leaves = leafRepository.findMilestonesSince(branchId, now.minus(detection.getLookback()));
        List<SmartPrompt> created = new ArrayList<>();
        for (LeafRecord leaf : leaves) {
            try {
                if (promptRepository.existsByBranchAndTypeSince(branchId, PromptType.CELEBRATION, leaf.getCreatedAt())) {
                    continue;
                }
                if (!detection.isAutoTrigger()) {
                    logger.info("检测到里程碑，未开启自动庆祝: leafId={}, milestone={}", leaf.getId(), leaf.getMilestoneType());
                    continue;
                }
                SmartPrompt prompt = newPrompt(leaf.getAuthorId(), branchId, celebrationContent(leaf),
                        PromptType.CELEBRATION, CELEBRATION_RESPONSES,
                        AiMetadata.builder()
                                .provider(PROVIDER_MILESTONE)
                                .model(MODEL_MILESTONE)
                                .confidence(ConfidenceModel.MILESTONE_CELEBRATION)
                                .build(),
                        clock.instant());
                created.add(persist(prompt));
            } catch (RuntimeException e) {
                logger.error("里程碑庆祝提示生成失败: branchId={}, leafId={}", branchId, leaf.getId(), e);
            }
        }
        if (!created.isEmpty()) {
            logger.info("生成里程碑庆祝提示: branchId={}, count={}", branchId, created.size());
        }
        return created;
    }

    static String celebrationContent(LeafRecord leaf) {
        String name = leaf.getAuthorFirstName() != null && !leaf.getAuthorFirstName().isBlank()
                ? leaf.getAuthorFirstName() : "someone";
        String milestone = leaf.getMilestoneType() != null ? leaf.getMilestoneType().replace('_', ' ') : "";
        return "What an amazing milestone! I saw that " + name + " reached a special moment with " + milestone
                + ". Tell me all about how this happened - I'd love to capture every detail of this precious memory!";
    }

    // ==================== 调度 ====================

    /**
     * 顺序遍历所有活跃成员，为符合条件的成员生成主动提示
     *
     * @return 生成的提示数
     */
    public int scheduleProactivePrompts() {
        if (!properties.isEnabled() || !properties.getSchedule().isEnabled()) {
            return 0;
        }

        List<BranchMembership> members = directoryRepository.findActiveMemberships();
        int generated = 0;
        for (BranchMembership member : members) {
            try {
                if (shouldSchedulePrompt(member.getUserId(), member.getBranchId())
                        && generateProactivePrompt(member.getUserId(), member.getBranchId()).isPresent()) {
                    generated++;
                }
            } catch (RuntimeException e) {
                logger.error("调度主动提示失败: userId={}, branchId={}", member.getUserId(), member.getBranchId(), e);
            }
        }
        logger.info("主动提示调度完成: members={}, generated={}", members.size(), generated);
        return generated;
    }

    /**
     * 成员没有待处理提示，且近期没有发布过内容
     */
    boolean shouldSchedulePrompt(String userId, String branchId) {
        Instant now = clock.instant();
        if (!promptRepository.findPending(userId, branchId, now).isEmpty()) {
            return false;
        }
        return !leafRepository.hasAuthoredSince(userId, branchId, now.minus(properties.getRecentActivityWindow()));
    }

    /**
     * 删除已过有效期的提示，可重复执行
     *
     * @return 删除的条数
     */
    public int cleanupExpiredPrompts() {
        int deleted = promptRepository.deleteExpired(clock.instant());
        logger.info("清理过期提示: deleted={}", deleted);
        return deleted;
    }

    // ==================== 个性化洞察 ====================

    public UserPattern getUserPatternInsights(String userId, String branchId) {
        return personalizedSystem.getUserInsights(userId, branchId);
    }

    /**
     * 预览个性化提示，不落库
     */
    public PersonalizedPromptSuggestion previewPersonalizedPrompt(String userId, String branchId) {
        return personalizedSystem.generatePersonalizedPrompt(userId, branchId, clock.instant());
    }

    public void refreshUserPatterns() {
        personalizedSystem.clearCache();
    }

    // ==================== 叶子辅助 ====================

    public LeafEnhancementResult enhanceLeaf(LeafEnhancementRequest request) {
        return leafEnhancementService.enhanceLeaf(request);
    }

    public List<LeafEnhancementResult> enhanceLeavesBatch(List<LeafEnhancementRequest> requests) {
        return leafEnhancementService.enhanceLeavesBatch(requests);
    }

    public LeafContentAnalysis analyzeLeafContent(String leafId, String content, List<String> mediaUrls) {
        return leafEnhancementService.analyzeLeafContent(leafId, content, mediaUrls);
    }

    public boolean isAiConfigured() {
        return aiService != null;
    }

    // ==================== 内部方法 ====================

    private SmartPrompt newPrompt(String userId, String branchId, String content, PromptType promptType,
                                  List<String> suggestedResponses, AiMetadata metadata, Instant now) {
        return SmartPrompt.builder()
                .id(UUID.randomUUID().toString())
                .branchId(branchId)
                .userId(userId)
                .content(content)
                .promptType(promptType)
                .suggestedResponses(suggestedResponses != null ? new ArrayList<>(suggestedResponses) : new ArrayList<>())
                .aiMetadata(metadata)
                .createdAt(now)
                .expiresAt(now.plus(properties.getResponseTimeout()))
                .status(PromptStatus.PENDING)
                .build();
    }

    private SmartPrompt persist(SmartPrompt prompt) {
        try {
            return promptRepository.save(prompt);
        } catch (RuntimeException e) {
            logger.error("保存智能提示失败: promptId={}, branchId={}, promptType={}",
                    prompt.getId(), prompt.getBranchId(), prompt.getPromptType().getValue(), e);
            throw new PromptPersistenceException("保存智能提示失败: " + prompt.getId(), e);
        }
    }

    /**
     * 最近 5 条内容中出现的关键词，小写去重
     */
    static Set<String> extractRecentKeywords(List<AiPromptContext.RecentMessage> messages) {
        Set<String> keywords = new LinkedHashSet<>();
        messages.stream().limit(5).forEach(message -> {
            if (message.getContent() == null) {
                return;
            }
            Matcher matcher = RECENT_KEYWORDS.matcher(message.getContent());
            while (matcher.find()) {
                keywords.add(matcher.group().toLowerCase(Locale.ROOT));
            }
        });
        return keywords;
    }

    /**
     * 待落库的提示内容与来源
     */
    private static final class PromptDraft {

        private final String content;
        private final PromptType promptType;
        private final List<String> suggestedResponses;
        private final double confidence;
        private final String provider;
        private final String model;
        private final String templateId;

        private PromptDraft(String content, PromptType promptType, List<String> suggestedResponses,
                            double confidence, String provider, String model, String templateId) {
            this.content = content;
            this.promptType = promptType;
            this.suggestedResponses = suggestedResponses;
            this.confidence = confidence;
            this.provider = provider;
            this.model = model;
            this.templateId = templateId;
        }
    }
}
