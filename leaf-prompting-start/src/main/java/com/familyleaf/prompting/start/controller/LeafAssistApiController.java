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

import com.familyleaf.prompting.extension.leaf.model.LeafContentAnalysis;
import com.familyleaf.prompting.extension.leaf.model.LeafEnhancementRequest;
import com.familyleaf.prompting.extension.leaf.model.LeafEnhancementResult;
import com.familyleaf.prompting.extension.prompt.service.SmartPromptingEngine;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * 叶子辅助接口：标题/标签建议与内容质量分析
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/leaves")
public class LeafAssistApiController {

    private final ObjectProvider<SmartPromptingEngine> engineProvider;

    public LeafAssistApiController(ObjectProvider<SmartPromptingEngine> engineProvider) {
        this.engineProvider = engineProvider;
    }

    @PostMapping("/enhance")
    public ResponseEntity<LeafEnhancementResult> enhance(@RequestBody LeafEnhancementRequest request) {
        SmartPromptingEngine engine = engineProvider.getIfAvailable();
        if (engine == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return ResponseEntity.ok(engine.enhanceLeaf(request));
    }

    /**
     * 批量增强，结果顺序与请求一致
     */
    @PostMapping("/enhance/batch")
    public ResponseEntity<List<LeafEnhancementResult>> enhanceBatch(@RequestBody List<LeafEnhancementRequest> requests) {
        SmartPromptingEngine engine = engineProvider.getIfAvailable();
        if (engine == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return ResponseEntity.ok(engine.enhanceLeavesBatch(requests));
    }

    @PostMapping("/{leafId}/analyze")
    public ResponseEntity<LeafContentAnalysis> analyze(@PathVariable String leafId,
                                                       @RequestBody AnalyzeRequest request) {
        SmartPromptingEngine engine = engineProvider.getIfAvailable();
        if (engine == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        List<String> mediaUrls = request.mediaUrls() != null ? request.mediaUrls() : new ArrayList<>();
        return ResponseEntity.ok(engine.analyzeLeafContent(leafId, request.content(), mediaUrls));
    }

    public record AnalyzeRequest(String content, List<String> mediaUrls) {
    }
}
