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
package com.familyleaf.prompting.extension.support;

import com.familyleaf.prompting.common.enums.PromptStatus;
import com.familyleaf.prompting.common.enums.PromptType;
import com.familyleaf.prompting.extension.prompt.model.SmartPrompt;
import com.familyleaf.prompting.extension.prompt.repository.SmartPromptRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class InMemorySmartPromptRepository implements SmartPromptRepository {

    private final Map<String, SmartPrompt> prompts = new LinkedHashMap<>();

    private boolean failOnSave;

    @Override
    public SmartPrompt save(SmartPrompt prompt) {
        if (failOnSave) {
            throw new IllegalStateException("database unavailable");
        }
        prompts.put(prompt.getId(), copy(prompt));
        return prompt;
    }

    @Override
    public Optional<SmartPrompt> findById(String id) {
        return Optional.ofNullable(prompts.get(id)).map(InMemorySmartPromptRepository::copy);
    }

    @Override
    public List<SmartPrompt> findPending(String userId, String branchId, Instant now) {
        return prompts.values().stream()
                .filter(prompt -> userId.equals(prompt.getUserId()) && branchId.equals(prompt.getBranchId()))
                .filter(prompt -> prompt.isPendingAt(now))
                .sorted(Comparator.comparing(SmartPrompt::getCreatedAt).reversed())
                .map(InMemorySmartPromptRepository::copy)
                .collect(Collectors.toList());
    }

    @Override
    public boolean existsByBranchAndTypeSince(String branchId, PromptType promptType, Instant since) {
        return prompts.values().stream()
                .anyMatch(prompt -> branchId.equals(prompt.getBranchId()) && prompt.getPromptType() == promptType
                        && !prompt.getCreatedAt().isBefore(since));
    }

    @Override
    public boolean transitionStatus(String id, PromptStatus expected, PromptStatus target) {
        SmartPrompt prompt = prompts.get(id);
        if (prompt == null || prompt.getStatus() != expected) {
            return false;
        }
        prompt.setStatus(target);
        return true;
    }

    @Override
    public int deleteExpired(Instant now) {
        List<String> expired = prompts.values().stream()
                .filter(prompt -> prompt.getExpiresAt().isBefore(now))
                .map(SmartPrompt::getId)
                .collect(Collectors.toList());
        expired.forEach(prompts::remove);
        return expired.size();
    }

    public List<SmartPrompt> all() {
        return prompts.values().stream().map(InMemorySmartPromptRepository::copy).collect(Collectors.toList());
    }

    public void put(SmartPrompt prompt) {
        prompts.put(prompt.getId(), copy(prompt));
    }

    public void setFailOnSave(boolean failOnSave) {
        this.failOnSave = failOnSave;
    }

    private static SmartPrompt copy(SmartPrompt prompt) {
        return SmartPrompt.builder()
                .id(prompt.getId())
                .branchId(prompt.getBranchId())
                .userId(prompt.getUserId())
                .content(prompt.getContent())
                .promptType(prompt.getPromptType())
                .suggestedResponses(new ArrayList<>(prompt.getSuggestedResponses()))
                .aiMetadata(prompt.getAiMetadata())
                .createdAt(prompt.getCreatedAt())
                .expiresAt(prompt.getExpiresAt())
                .status(prompt.getStatus())
                .build();
    }
}
