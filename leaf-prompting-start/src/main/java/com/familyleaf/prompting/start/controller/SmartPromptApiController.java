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
package com.familyleaf.prompting.start.controller;

import com.familyleaf.prompting.common.context.LoginContext;
import com.familyleaf.prompting.extension.ai.model.AiResponse;
import com.familyleaf.prompting.extension.personalization.model.PersonalizedPromptSuggestion;
import com.familyleaf.prompting.extension.personalization.model.UserPattern;
import com.familyleaf.prompting.extension.prompt.model.SmartPrompt;
import com.familyleaf.prompting.extension.prompt.service.SmartPromptingEngine;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 智能提示接口
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/prompts")
public class SmartPromptApiController {

    private final ObjectProvider<SmartPromptingEngine> engineProvider;

    public SmartPromptApiController(ObjectProvider<SmartPromptingEngine> engineProvider) {
        this.engineProvider = engineProvider;
    }

    /**
     * 当前用户在分支内的待处理提示，最新的在前
     */
    @GetMapping("/pending")
    public ResponseEntity<PendingResponse> getPending(@RequestParam String branchId) {
        String userId = LoginContext.getUserId();
        if (!StringUtils.hasText(userId)) {
            return ResponseEntity.badRequest().build();
        }
        SmartPromptingEngine engine = engineProvider.getIfAvailable();
        if (engine == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        List<PromptView> items = engine.getPendingPrompts(userId, branchId).stream()
                .map(PromptView::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(new PendingResponse(items));
    }

    /**
     * 立即为当前用户生成一条主动提示，不适合提示时返回 204
     */
    @PostMapping("/generate")
    public ResponseEntity<PromptView> generate(@RequestParam String branchId) {
        String userId = LoginContext.getUserId();
        if (!StringUtils.hasText(userId)) {
            return ResponseEntity.badRequest().build();
        }
        SmartPromptingEngine engine = engineProvider.getIfAvailable();
        if (engine == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return engine.generateProactivePrompt(userId, branchId)
                .map(prompt -> ResponseEntity.ok(PromptView.from(prompt)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * 回复提示，有追问时一并返回
     */
    @PostMapping("/{promptId}/respond")
    public ResponseEntity<RespondResponse> respond(@PathVariable String promptId,
                                                   @RequestBody RespondRequest request) {
        String userId = LoginContext.getUserId();
        if (!StringUtils.hasText(userId) || request == null || !StringUtils.hasText(request.branchId())) {
            return ResponseEntity.badRequest().build();
        }
        SmartPromptingEngine engine = engineProvider.getIfAvailable();
        if (engine == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        Optional<AiResponse> followUp = engine.processUserResponse(
                promptId, request.response(), userId, request.branchId());
        return ResponseEntity.ok(new RespondResponse(followUp.orElse(null)));
    }

    @PostMapping("/{promptId}/dismiss")
    public ResponseEntity<PromptView> dismiss(@PathVariable String promptId) {
        SmartPromptingEngine engine = engineProvider.getIfAvailable();
        if (engine == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return engine.dismissPrompt(promptId)
                .map(prompt -> ResponseEntity.ok(PromptView.from(prompt)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/insights")
    public ResponseEntity<UserPattern> getInsights(@RequestParam String branchId) {
        String userId = LoginContext.getUserId();
        if (!StringUtils.hasText(userId)) {
            return ResponseEntity.badRequest().build();
        }
        SmartPromptingEngine engine = engineProvider.getIfAvailable();
        if (engine == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return ResponseEntity.ok(engine.getUserPatternInsights(userId, branchId));
    }

    /**
     * 清空用户模式缓存，下次请求重新分析
     */
    @PostMapping("/insights/refresh")
    public ResponseEntity<Void> refreshInsights() {
        SmartPromptingEngine engine = engineProvider.getIfAvailable();
        if (engine == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        engine.refreshUserPatterns();
        return ResponseEntity.noContent().build();
    }

    /**
     * 预览个性化提示，不落库
     */
    @GetMapping("/preview")
    public ResponseEntity<PersonalizedPromptSuggestion> preview(@RequestParam String branchId) {
        String userId = LoginContext.getUserId();
        if (!StringUtils.hasText(userId)) {
            return ResponseEntity.badRequest().build();
        }
        SmartPromptingEngine engine = engineProvider.getIfAvailable();
        if (engine == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return ResponseEntity.ok(engine.previewPersonalizedPrompt(userId, branchId));
    }

    public record PendingResponse(List<PromptView> items) {
    }

    public record RespondRequest(String branchId, String response) {
    }

    /**
     * followUp 为 null 表示没有追问
     */
    public record RespondResponse(AiResponse followUp) {
    }

    public record PromptView(
            String id,
            String branchId,
            String content,
            String promptType,
            List<String> suggestedResponses,
            String status,
            String createdAt,
            String expiresAt
    ) {

        static PromptView from(SmartPrompt prompt) {
            return new PromptView(
                    prompt.getId(),
                    prompt.getBranchId(),
                    prompt.getContent(),
                    prompt.getPromptType() != null ? prompt.getPromptType().getValue() : null,
                    prompt.getSuggestedResponses(),
                    prompt.getStatus() != null ? prompt.getStatus().getValue() : null,
                    prompt.getCreatedAt() != null ? prompt.getCreatedAt().toString() : null,
                    prompt.getExpiresAt() != null ? prompt.getExpiresAt().toString() : null
            );
        }
    }
}
