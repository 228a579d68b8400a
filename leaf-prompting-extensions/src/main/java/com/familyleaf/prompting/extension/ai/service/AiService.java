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
package com.familyleaf.prompting.extension.ai.service;

import com.familyleaf.prompting.common.enums.PromptType;
import com.familyleaf.prompting.common.enums.Sentiment;
import com.familyleaf.prompting.common.exception.AiProviderException;
import com.familyleaf.prompting.extension.ai.client.ProviderClient;
import com.familyleaf.prompting.extension.ai.model.AiLeafSuggestion;
import com.familyleaf.prompting.extension.ai.model.AiPromptContext;
import com.familyleaf.prompting.extension.ai.model.AiResponse;
import com.familyleaf.prompting.extension.ai.model.ExtractedData;
import com.familyleaf.prompting.extension.analysis.service.ResponseAnalyzer;
import com.familyleaf.prompting.extension.analysis.service.TextSignals;
import com.familyleaf.prompting.extension.cache.StateCache;
import com.familyleaf.prompting.extension.context.model.TimeContext;
import com.familyleaf.prompting.extension.scoring.ConfidenceModel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 文本生成服务集成层
 * <p>
 * 负责构建带人设的系统消息、维护每个 (分支, 用户) 的滚动对话历史，
 * 并从生成文本中抽取结构化信息。服务商调用失败直接抛给调用方，本层不重试。
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class AiService {

    private static final Logger logger = LoggerFactory.getLogger(AiService.class);

    /**
     * 每次请求携带的历史消息数
     */
    static final int CONTEXT_WINDOW = 10;

    private static final Duration CHECKIN_GAP = Duration.ofHours(24);

    private static final List<String> RECENT_MILESTONE_WORDS = List.of(
            "first", "milestone", "achievement", "birthday", "tooth", "steps", "word");

    private static final Map<String, List<String>> EXTRACTION_MILESTONES = new LinkedHashMap<>();

    private static final List<String> EXTRACTION_LOCATIONS = List.of(
            "home", "school", "park", "beach", "grandma", "grandpa", "restaurant");

    private static final Map<PromptType, String> PROMPT_INSTRUCTIONS = new EnumMap<>(PromptType.class);

    private static final Map<PromptType, List<String>> SUGGESTED_RESPONSES = new EnumMap<>(PromptType.class);

    static final String LEAF_ENHANCEMENT_SYSTEM_MESSAGE =
            "You are a family memory assistant. Reply with a single JSON object and nothing else.";

    static {
        EXTRACTION_MILESTONES.put("first_steps", List.of("first steps", "walking", "walked"));
        EXTRACTION_MILESTONES.put("first_word", List.of("first word", "said", "talking"));
        EXTRACTION_MILESTONES.put("first_tooth", List.of("tooth", "teeth", "teething"));
        EXTRACTION_MILESTONES.put("birthday", List.of("birthday", "turned", "years old"));
        EXTRACTION_MILESTONES.put("school", List.of("school", "kindergarten", "grade"));

        PROMPT_INSTRUCTIONS.put(PromptType.CHECKIN, "Today, initiate a gentle check-in. Ask about recent family "
                + "moments, activities, or how everyone is doing. Keep it natural and conversational.");
        PROMPT_INSTRUCTIONS.put(PromptType.MILESTONE, "A milestone moment has been detected. Ask engaging questions "
                + "about the details, feelings, and context around this special achievement.");
        PROMPT_INSTRUCTIONS.put(PromptType.MEMORY, "Help capture a family memory. Ask about recent experiences, "
                + "special moments, or daily life that might be worth preserving.");
        PROMPT_INSTRUCTIONS.put(PromptType.FOLLOWUP, "Continue the conversation naturally based on what was just "
                + "shared. Ask relevant follow-up questions that encourage more storytelling.");
        PROMPT_INSTRUCTIONS.put(PromptType.CELEBRATION, "A celebration is in order! Acknowledge the milestone or "
                + "achievement and ask for more details about this special moment.");

        SUGGESTED_RESPONSES.put(PromptType.CHECKIN, List.of(
                "Had a great day!", "Nothing special today", "Lots happened today...", "Let me share a photo"));
        SUGGESTED_RESPONSES.put(PromptType.MILESTONE, List.of(
                "Yes, it was amazing!", "Tell me more about milestones", "I want to record this", "Share with family"));
        SUGGESTED_RESPONSES.put(PromptType.MEMORY, List.of(
                "I have a story to share", "Here's what happened...", "Let me think about that",
                "Ask me something else"));
        SUGGESTED_RESPONSES.put(PromptType.FOLLOWUP, List.of(
                "Exactly!", "There's more to it...", "That reminds me of...", "I'll share more later"));
        SUGGESTED_RESPONSES.put(PromptType.CELEBRATION, List.of(
                "Thank you!", "We're so proud", "It was a special moment", "Want to see photos?"));
    }

    private final ProviderClient providerClient;
    private final ResponseAnalyzer responseAnalyzer;
    private final StateCache<List<Message>> historyCache;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int historyLimit;

    public AiService(ProviderClient providerClient,
                     ResponseAnalyzer responseAnalyzer,
                     StateCache<List<Message>> historyCache,
                     ObjectMapper objectMapper,
                     Clock clock,
                     int historyLimit) {
        this.providerClient = providerClient;
        this.responseAnalyzer = responseAnalyzer;
        this.historyCache = historyCache;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.historyLimit = historyLimit;
    }

    /**
     * 生成一条主动提示
     *
     * @throws AiProviderException 服务商调用失败
     */
    public AiResponse generatePrompt(AiPromptContext context) {
        String key = historyKey(context.getBranchId(), context.getUserId());
        List<Message> history = getConversationHistory(context.getBranchId(), context.getUserId());

        PromptType promptType = determinePromptType(context, history);
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(buildSystemMessage(context, promptType)));
        messages.addAll(tail(history));

        String response = providerClient.complete(messages);

        history.add(new AssistantMessage(response));
        storeHistory(key, history);
        logger.info("生成提示完成: branchId={}, userId={}, promptType={}, provider={}",
                context.getBranchId(), context.getUserId(), promptType.getValue(), providerClient.getProvider());

        return AiResponse.builder()
                .message(response)
                .promptType(promptType)
                .suggestedResponses(suggestedResponses(promptType))
                .extractedData(extractStructuredData(response))
                .confidenceScore(ConfidenceModel.forGeneratedText(response).score())
                .build();
    }

    /**
     * 针对用户回复生成追问
     * <p>
     * 用户消息先进入历史；只有调用成功时才追加助手消息
     * </p>
     *
     * @throws AiProviderException 服务商调用失败
     */
    public AiResponse processUserResponse(String userMessage, AiPromptContext context, PromptType previousPromptType) {
        String key = historyKey(context.getBranchId(), context.getUserId());
        List<Message> history = getConversationHistory(context.getBranchId(), context.getUserId());
        history.add(new UserMessage(userMessage));
        storeHistory(key, history);

        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(buildFollowUpSystemMessage(previousPromptType)));
        messages.addAll(tail(history));

        String response = providerClient.complete(messages);

        history.add(new AssistantMessage(response));
        storeHistory(key, history);
        logger.info("生成追问完成: branchId={}, userId={}, previousPromptType={}",
                context.getBranchId(), context.getUserId(),
                previousPromptType != null ? previousPromptType.getValue() : null);

        return AiResponse.builder()
                .message(response)
                .promptType(PromptType.FOLLOWUP)
                .extractedData(extractStructuredData(userMessage + " " + response))
                .confidenceScore(ConfidenceModel.forGeneratedText(response).score())
                .build();
    }

    /**
     * 请求服务商返回叶子增强建议的 JSON 并解析
     *
     * @throws AiProviderException 服务商调用失败或返回内容不是合法 JSON
     */
    public AiLeafSuggestion generateLeafEnhancement(String prompt) {
        List<Message> messages = List.of(
                new SystemMessage(LEAF_ENHANCEMENT_SYSTEM_MESSAGE),
                new UserMessage(prompt));
        String response = providerClient.complete(messages);
        String json = jsonBody(response)
                .orElseThrow(() -> new AiProviderException(providerClient.getProvider(), "叶子增强响应中没有 JSON 对象"));
        try {
            return objectMapper.readValue(json, AiLeafSuggestion.class);
        } catch (JsonProcessingException e) {
            throw new AiProviderException(providerClient.getProvider(), "叶子增强响应无法解析", e);
        }
    }

    /**
     * 基于关键词的结构化信息抽取
     */
    public ExtractedData extractStructuredData(String text) {
        String safe = text != null ? text : "";
        String lower = safe.toLowerCase(Locale.ROOT);

        ExtractedData.ExtractedMilestone milestone = TextSignals.firstMatchingKey(lower, EXTRACTION_MILESTONES)
                .map(type -> ExtractedData.ExtractedMilestone.builder()
                        .type(type)
                        .description(safe)
                        .date(LocalDate.now(clock).toString())
                        .build())
                .orElse(null);

        Sentiment sentiment = responseAnalyzer.analyzeSentiment(lower);

        return ExtractedData.builder()
                .milestone(milestone)
                .mood(sentiment != Sentiment.NEUTRAL ? sentiment.getValue() : null)
                .activities(TextSignals.matchedKeywords(lower, TextSignals.ACTIVITY_KEYWORDS))
                .people(TextSignals.capitalizedNames(safe))
                .locations(TextSignals.matchedKeywords(lower, EXTRACTION_LOCATIONS))
                .build();
    }

    /**
     * 最近内容带里程碑 → 庆祝；最近一条超过 24 小时 → 问候；傍晚且无历史 → 问候；否则回忆
     */
    PromptType determinePromptType(AiPromptContext context, List<Message> history) {
        List<AiPromptContext.RecentMessage> recent = context.getRecentMessages();
        AiPromptContext.RecentMessage last = recent.isEmpty() ? null : recent.get(0);

        if ((last != null && last.getMilestoneType() != null) || containsMilestoneWords(recent)) {
            return PromptType.CELEBRATION;
        }
        if (last != null && last.getTimestamp() != null
                && Duration.between(last.getTimestamp(), clock.instant()).compareTo(CHECKIN_GAP) > 0) {
            return PromptType.CHECKIN;
        }
        TimeContext time = context.getTimeContext();
        if (time != null && TimeContext.EVENING.equals(time.getTimeOfDay()) && history.isEmpty()) {
            return PromptType.CHECKIN;
        }
        return PromptType.MEMORY;
    }

    String buildSystemMessage(AiPromptContext context, PromptType promptType) {
        String style = context.getUserPreferences() != null && context.getUserPreferences().getPromptStyle() != null
                ? context.getUserPreferences().getPromptStyle().getValue() : "casual";
        TimeContext time = context.getTimeContext();

        String personality = "You are Sage, a warm and encouraging family journal assistant for the "
                + context.getBranchName() + " family. Your role is to help families capture and preserve "
                + "precious memories through natural conversation.\n\n"
                + "Personality:\n"
                + "- Warm, empathetic, and genuinely interested in family life\n"
                + "- Ask thoughtful follow-up questions that encourage storytelling\n"
                + "- Celebrate milestones and achievements\n"
                + "- Be respectful of family dynamics and sensitive moments\n"
                + "- Use a " + style + " tone\n\n"
                + "Current context:\n"
                + "- Speaking with " + context.getUserName() + " ("
                + (context.getFamilyRole() != null ? context.getFamilyRole() : "family member") + ")\n"
                + "- Time: " + (time != null ? time.getTimeOfDay() + " on " + time.getDayOfWeek() : "unknown") + "\n"
                + "- Branch: " + context.getBranchName() + " (" + context.getBranchType() + ")\n";

        return personality + "\n\n" + PROMPT_INSTRUCTIONS.getOrDefault(promptType,
                PROMPT_INSTRUCTIONS.get(PromptType.MEMORY));
    }

    String buildFollowUpSystemMessage(PromptType previousPromptType) {
        String previous = previousPromptType != null ? previousPromptType.getValue() : PromptType.CHECKIN.getValue();
        return "You are Sage, continuing a conversation about family memories. The user just shared something "
                + "in response to your " + previous + " prompt.\n\n"
                + "Respond naturally by:\n"
                + "1. Acknowledging what they shared\n"
                + "2. Asking one thoughtful follow-up question\n"
                + "3. Being encouraging and showing genuine interest\n\n"
                + "Keep responses concise (2-3 sentences) and conversational. Focus on drawing out details, "
                + "emotions, or context that make the memory richer.";
    }

    public List<String> suggestedResponses(PromptType promptType) {
        return new ArrayList<>(SUGGESTED_RESPONSES.getOrDefault(promptType, SUGGESTED_RESPONSES.get(PromptType.MEMORY)));
    }

    public void clearConversationHistory(String branchId, String userId) {
        historyCache.invalidate(historyKey(branchId, userId));
    }

    /**
     * 返回历史副本，修改副本不影响缓存
     */
    public List<Message> getConversationHistory(String branchId, String userId) {
        return historyCache.get(historyKey(branchId, userId))
                .map(ArrayList::new)
                .orElseGet(ArrayList::new);
    }

    public String getProvider() {
        return providerClient.getProvider();
    }

    public String getModel() {
        return providerClient.getModel();
    }

    private void storeHistory(String key, List<Message> history) {
        List<Message> bounded = history.size() > historyLimit
                ? new ArrayList<>(history.subList(history.size() - historyLimit, history.size()))
                : new ArrayList<>(history);
        historyCache.put(key, bounded);
    }

    private static List<Message> tail(List<Message> history) {
        return history.subList(Math.max(0, history.size() - CONTEXT_WINDOW), history.size());
    }

    private static boolean containsMilestoneWords(List<AiPromptContext.RecentMessage> recent) {
        String content = recent.stream()
                .limit(3)
                .map(message -> message.getContent() != null ? message.getContent().toLowerCase(Locale.ROOT) : "")
                .collect(Collectors.joining(" "));
        return TextSignals.containsAny(content, RECENT_MILESTONE_WORDS);
    }

    private static Optional<String> jsonBody(String response) {
        if (response == null) {
            return Optional.empty();
        }
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        return start >= 0 && end > start ? Optional.of(response.substring(start, end + 1)) : Optional.empty();
    }

    private static String historyKey(String branchId, String userId) {
        return StateCache.key(branchId, userId);
    }
}
